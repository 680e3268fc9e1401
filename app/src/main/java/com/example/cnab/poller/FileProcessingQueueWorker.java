package com.example.cnab.poller;

import com.example.cnab.config.WorkerProperties;
import com.example.cnab.exception.TransientInfrastructureException;
import com.example.cnab.messaging.QueueClient;
import com.example.cnab.messaging.QueueMessage;
import com.example.cnab.metrics.IngestionMetrics;
import com.example.cnab.model.FileProcessingMessage;
import com.example.cnab.processor.FileIngestionOrchestrator;
import com.example.cnab.processor.IngestionOutcome;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Consome a fila de processamento de arquivos e decide, por mensagem, entre remover (ACK)
 * e manter para nova entrega (RETAIN):
 * <ul>
 *     <li>corpo vazio ou inválido: ACK, a mensagem nunca será processável;</li>
 *     <li>o orquestrador retornou um resultado (Processed, Rejected ou Skipped): ACK;</li>
 *     <li>o orquestrador lançou exceção: RETAIN, a fila reentrega após o visibility timeout
 *     e a redrive policy leva a mensagem para a DLQ depois de maxReceiveCount entregas.</li>
 * </ul>
 * O loop roda em uma única thread e não morre com exceções inesperadas.
 */
@Component
public class FileProcessingQueueWorker implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(FileProcessingQueueWorker.class);

    static final String CORRELATION_ID_ATTRIBUTE = "CorrelationId";
    static final String MDC_CORRELATION_ID = "correlationId";
    static final String QUEUE_NAME = "file-processing";

    private final QueueClient queueClient;
    private final FileIngestionOrchestrator orchestrator;
    private final ObjectMapper objectMapper;
    private final WorkerProperties properties;
    private final IngestionMetrics metrics;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);
    private volatile CountDownLatch stopSignal = new CountDownLatch(1);
    private volatile WorkerState state = WorkerState.IDLE;
    private ExecutorService executor;

    public FileProcessingQueueWorker(QueueClient queueClient,
                                     FileIngestionOrchestrator orchestrator,
                                     ObjectMapper objectMapper,
                                     WorkerProperties properties,
                                     IngestionMetrics metrics) {
        this.queueClient = queueClient;
        this.orchestrator = orchestrator;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.metrics = metrics;
    }

    @Override
    public void start() {
        if (!properties.isEnabled()) {
            log.info("Worker da fila de processamento desativado por configuração.");
            return;
        }
        if (!running.compareAndSet(false, true)) {
            return;
        }
        // um stop() anterior deixa a sinalização consumida
        stopRequested.set(false);
        stopSignal = new CountDownLatch(1);
        transition(WorkerState.IDLE);
        executor = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "file-processing-worker");
            thread.setDaemon(false);
            return thread;
        });
        executor.submit(this::runLoop);
        log.info("Worker da fila de processamento iniciado. Fila: {}", properties.getQueueUrl());
    }

    @Override
    public void stop() {
        stopRequested.set(true);
        stopSignal.countDown();
        if (executor == null) {
            transition(WorkerState.STOPPED);
            running.set(false);
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(properties.getShutdownTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Mensagem em processamento não terminou em {}; interrompendo o worker. "
                        + "Ela voltará à fila após o visibility timeout.", properties.getShutdownTimeout());
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
        running.set(false);
        log.info("Worker da fila de processamento parado.");
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    public WorkerState getState() {
        return state;
    }

    private void runLoop() {
        while (!stopRequested.get()) {
            try {
                int received = pollOnce();
                if (received == 0) {
                    pauseWhenIdle();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (RuntimeException e) {
                log.error("Erro inesperado no loop do worker: {}", e.getMessage(), e);
                transition(WorkerState.IDLE);
                try {
                    pauseWhenIdle();
                } catch (InterruptedException interrupted) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        }
        transition(WorkerState.STOPPED);
    }

    private void pauseWhenIdle() throws InterruptedException {
        if (!stopRequested.get()) {
            stopSignal.await(properties.getEmptyQueueBackoff().toMillis(), TimeUnit.MILLISECONDS);
        }
    }

    /**
     * Executa um ciclo: recebe um lote e trata cada mensagem em sequência.
     *
     * @return quantidade de mensagens recebidas no lote
     */
    int pollOnce() {
        if (stopRequested.get()) {
            transition(WorkerState.STOPPED);
            return 0;
        }
        transition(WorkerState.POLLING);
        List<QueueMessage> messages = queueClient.receive(properties.getQueueUrl(), properties.getMaxMessages(),
                properties.getVisibilityTimeoutSeconds(), properties.getWaitTimeSeconds());
        if (messages.isEmpty()) {
            log.debug("Nenhuma mensagem na fila de processamento.");
            transition(WorkerState.IDLE);
            return 0;
        }

        log.info("Recebidas {} mensagem(ns) da fila de processamento.", messages.size());
        for (QueueMessage message : messages) {
            if (stopRequested.get()) {
                log.info("Desligamento solicitado; as mensagens restantes do lote voltarão à fila após o visibility timeout.");
                break;
            }
            transition(WorkerState.DISPATCHING);
            handle(message);
        }
        transition(WorkerState.IDLE);
        return messages.size();
    }

    private void handle(QueueMessage message) {
        FileProcessingMessage payload = deserialize(message);
        if (payload == null) {
            acknowledge(message);
            return;
        }

        String correlationId = resolveCorrelationId(message, payload);
        payload.setCorrelationId(correlationId);
        MDC.put(MDC_CORRELATION_ID, correlationId);
        try {
            transition(WorkerState.PROCESSING);
            IngestionOutcome outcome = orchestrator.process(payload);
            log.info("Mensagem {} do arquivo {} tratada com resultado {}.",
                    message.getMessageId(), payload.getFileId(), outcome.getStatus());
            acknowledge(message);
        } catch (RuntimeException e) {
            retain(message, payload, e);
        } finally {
            MDC.remove(MDC_CORRELATION_ID);
        }
    }

    private FileProcessingMessage deserialize(QueueMessage message) {
        if (message.getBody() == null || message.getBody().isBlank()) {
            log.warn("Mensagem {} com corpo vazio; removendo da fila.", message.getMessageId());
            return null;
        }
        try {
            FileProcessingMessage payload = objectMapper.readValue(message.getBody(), FileProcessingMessage.class);
            if (payload == null || payload.getFileId() == null) {
                log.warn("Mensagem {} sem fileId; removendo da fila.", message.getMessageId());
                return null;
            }
            return payload;
        } catch (JsonProcessingException e) {
            log.warn("Mensagem {} com JSON inválido; removendo da fila: {}", message.getMessageId(), e.getOriginalMessage());
            return null;
        }
    }

    private void acknowledge(QueueMessage message) {
        transition(WorkerState.ACK);
        metrics.messageHandled(QUEUE_NAME, true);
        try {
            queueClient.delete(properties.getQueueUrl(), message.getReceiptHandle());
        } catch (TransientInfrastructureException e) {
            // a reentrega cai em SKIPPED porque o arquivo já está em status terminal
            log.error("Falha ao remover a mensagem {} da fila: {}", message.getMessageId(), e.getMessage());
        }
    }

    private void retain(QueueMessage message, FileProcessingMessage payload, RuntimeException failure) {
        transition(WorkerState.RETAIN);
        metrics.messageHandled(QUEUE_NAME, false);
        log.error("Falha ao processar o arquivo {} (mensagem {}); mensagem mantida na fila para nova tentativa: {}",
                payload.getFileId(), message.getMessageId(), failure.getMessage(), failure);
    }

    static String resolveCorrelationId(QueueMessage message, FileProcessingMessage payload) {
        String fromAttribute = message.getAttributes().get(CORRELATION_ID_ATTRIBUTE);
        if (fromAttribute != null && !fromAttribute.isBlank()) {
            return fromAttribute;
        }
        if (payload.getCorrelationId() != null && !payload.getCorrelationId().isBlank()) {
            return payload.getCorrelationId();
        }
        return UUID.randomUUID().toString();
    }

    private void transition(WorkerState next) {
        log.trace("Worker {} -> {}", state, next);
        state = next;
    }
}
