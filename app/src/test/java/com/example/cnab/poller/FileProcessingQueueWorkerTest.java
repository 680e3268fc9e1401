package com.example.cnab.poller;

import com.example.cnab.config.AwsConfig;
import com.example.cnab.config.WorkerProperties;
import com.example.cnab.exception.FileNotRegisteredException;
import com.example.cnab.exception.TransientInfrastructureException;
import com.example.cnab.messaging.QueueClient;
import com.example.cnab.messaging.QueueMessage;
import com.example.cnab.metrics.IngestionMetrics;
import com.example.cnab.model.FileProcessingMessage;
import com.example.cnab.processor.FileIngestionOrchestrator;
import com.example.cnab.processor.IngestionOutcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.clearInvocations;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class FileProcessingQueueWorkerTest {

    private static final String QUEUE_URL = "http://localhost:4566/000000000000/file-processing-queue";

    @Mock
    private QueueClient queueClient;

    @Mock
    private FileIngestionOrchestrator orchestrator;

    private WorkerProperties properties;
    private FileProcessingQueueWorker worker;

    @BeforeEach
    void setUp() {
        properties = new WorkerProperties();
        properties.setQueueUrl(QUEUE_URL);
        properties.setEmptyQueueBackoff(Duration.ofMillis(10));
        properties.setShutdownTimeout(Duration.ofSeconds(5));
        worker = new FileProcessingQueueWorker(queueClient, orchestrator, new AwsConfig().objectMapper(),
                properties, IngestionMetrics.noOp());
    }

    @Test
    void pollOnce_acknowledgesEveryTerminalOutcome() {
        UUID processed = UUID.randomUUID();
        UUID rejected = UUID.randomUUID();
        UUID skipped = UUID.randomUUID();
        receive(message("r-1", body(processed)), message("r-2", body(rejected)), message("r-3", body(skipped)));
        when(orchestrator.process(any())).thenAnswer(invocation -> {
            FileProcessingMessage payload = invocation.getArgument(0);
            IngestionOutcome.Status status = payload.getFileId().equals(processed) ? IngestionOutcome.Status.PROCESSED
                    : payload.getFileId().equals(rejected) ? IngestionOutcome.Status.REJECTED
                    : IngestionOutcome.Status.SKIPPED;
            return IngestionOutcome.builder().fileId(payload.getFileId()).status(status).build();
        });

        int received = worker.pollOnce();

        assertThat(received).isEqualTo(3);
        verify(queueClient).delete(QUEUE_URL, "r-1");
        verify(queueClient).delete(QUEUE_URL, "r-2");
        verify(queueClient).delete(QUEUE_URL, "r-3");
        assertThat(worker.getState()).isEqualTo(WorkerState.IDLE);
    }

    @Test
    void pollOnce_retainsMessageWhenProcessingThrows() {
        receive(message("r-1", body(UUID.randomUUID())));
        when(orchestrator.process(any())).thenThrow(new TransientInfrastructureException("banco indisponível", null));

        worker.pollOnce();

        verify(queueClient, never()).delete(anyString(), anyString());
    }

    @Test
    void pollOnce_failureOfOneMessageDoesNotAffectTheNext() {
        UUID failing = UUID.randomUUID();
        UUID ok = UUID.randomUUID();
        receive(message("r-1", body(failing)), message("r-2", body(ok)));
        when(orchestrator.process(any())).thenAnswer(invocation -> {
            FileProcessingMessage payload = invocation.getArgument(0);
            if (payload.getFileId().equals(failing)) {
                throw new FileNotRegisteredException(failing);
            }
            return IngestionOutcome.builder().fileId(ok).status(IngestionOutcome.Status.PROCESSED).build();
        });

        worker.pollOnce();

        verify(queueClient, never()).delete(QUEUE_URL, "r-1");
        verify(queueClient).delete(QUEUE_URL, "r-2");
    }

    @Test
    void pollOnce_deletesPoisonMessagesWithoutProcessing() {
        receive(message("r-1", "{not json"), message("r-2", ""), message("r-3", "{\"fileName\":\"x.txt\"}"));

        worker.pollOnce();

        verify(queueClient).delete(QUEUE_URL, "r-1");
        verify(queueClient).delete(QUEUE_URL, "r-2");
        verify(queueClient).delete(QUEUE_URL, "r-3");
        verifyNoInteractions(orchestrator);
    }

    @Test
    void pollOnce_acceptsS3KeyAliasAndAttributeCorrelationId() {
        UUID fileId = UUID.randomUUID();
        String json = "{\"fileId\":\"" + fileId + "\",\"s3Key\":\"uploads/a.txt\",\"fileName\":\"a.txt\","
                + "\"uploadedAt\":\"2024-03-10T15:00:00Z\",\"correlationId\":\"from-body\"}";
        receive(QueueMessage.builder().messageId("m-1").receiptHandle("r-1").body(json)
                .attributes(Map.of("CorrelationId", "from-attribute")).build());
        when(orchestrator.process(any()))
                .thenReturn(IngestionOutcome.builder().fileId(fileId).status(IngestionOutcome.Status.PROCESSED).build());

        worker.pollOnce();

        ArgumentCaptor<FileProcessingMessage> captor = ArgumentCaptor.forClass(FileProcessingMessage.class);
        verify(orchestrator).process(captor.capture());
        assertThat(captor.getValue().getObjectKey()).isEqualTo("uploads/a.txt");
        assertThat(captor.getValue().getCorrelationId()).isEqualTo("from-attribute");
    }

    @Test
    void resolveCorrelationId_fallsBackToBodyThenGenerated() {
        QueueMessage withoutAttribute = message("r-1", "{}");
        FileProcessingMessage withBody = FileProcessingMessage.builder().correlationId("from-body").build();
        FileProcessingMessage withoutBody = FileProcessingMessage.builder().build();

        assertThat(FileProcessingQueueWorker.resolveCorrelationId(withoutAttribute, withBody)).isEqualTo("from-body");
        assertThat(FileProcessingQueueWorker.resolveCorrelationId(withoutAttribute, withoutBody)).isNotBlank();
    }

    @Test
    void pollOnce_deleteFailureIsLoggedNotPropagated() {
        UUID fileId = UUID.randomUUID();
        receive(message("r-1", body(fileId)));
        when(orchestrator.process(any()))
                .thenReturn(IngestionOutcome.builder().fileId(fileId).status(IngestionOutcome.Status.PROCESSED).build());
        doThrow(new TransientInfrastructureException("SQS indisponível", null)).when(queueClient).delete(QUEUE_URL, "r-1");

        assertThat(worker.pollOnce()).isEqualTo(1);
    }

    @Test
    void pollOnce_emptyBatchReturnsToIdle() {
        receive();

        assertThat(worker.pollOnce()).isZero();
        assertThat(worker.getState()).isEqualTo(WorkerState.IDLE);
    }

    @Test
    void stop_preventsFurtherPolling() {
        worker.stop();

        assertThat(worker.pollOnce()).isZero();
        assertThat(worker.getState()).isEqualTo(WorkerState.STOPPED);
        verifyNoInteractions(queueClient);
    }

    @Test
    void lifecycle_startAndStop() {
        lenient().when(queueClient.receive(eq(QUEUE_URL), anyInt(), anyInt(), anyInt())).thenReturn(List.of());

        worker.start();
        assertThat(worker.isRunning()).isTrue();
        worker.stop();

        assertThat(worker.isRunning()).isFalse();
        assertThat(worker.getState()).isEqualTo(WorkerState.STOPPED);
    }

    @Test
    void lifecycle_restartAfterStopResumesPolling() {
        lenient().when(queueClient.receive(eq(QUEUE_URL), anyInt(), anyInt(), anyInt())).thenReturn(List.of());
        worker.start();
        worker.stop();
        clearInvocations(queueClient);

        worker.start();

        verify(queueClient, timeout(2000).atLeastOnce()).receive(eq(QUEUE_URL), anyInt(), anyInt(), anyInt());
        assertThat(worker.isRunning()).isTrue();
        worker.stop();
        assertThat(worker.isRunning()).isFalse();
        assertThat(worker.getState()).isEqualTo(WorkerState.STOPPED);
    }

    @Test
    void stop_waitsForInFlightMessageAndAcknowledgesIt() throws InterruptedException {
        UUID fileId = UUID.randomUUID();
        when(queueClient.receive(QUEUE_URL, 10, 300, 20))
                .thenReturn(List.of(message("r-1", body(fileId))))
                .thenReturn(List.of());
        CountDownLatch processingStarted = new CountDownLatch(1);
        when(orchestrator.process(any())).thenAnswer(invocation -> {
            processingStarted.countDown();
            Thread.sleep(500);
            return IngestionOutcome.builder().fileId(fileId).status(IngestionOutcome.Status.PROCESSED).build();
        });

        worker.start();
        assertThat(processingStarted.await(2, TimeUnit.SECONDS)).isTrue();
        worker.stop();

        verify(orchestrator).process(any());
        verify(queueClient).delete(QUEUE_URL, "r-1");
        assertThat(worker.getState()).isEqualTo(WorkerState.STOPPED);
    }

    @Test
    void start_doesNothingWhenDisabled() {
        properties.setEnabled(false);

        worker.start();

        assertThat(worker.isRunning()).isFalse();
        verifyNoInteractions(queueClient);
    }

    private void receive(QueueMessage... messages) {
        when(queueClient.receive(QUEUE_URL, 10, 300, 20)).thenReturn(List.of(messages));
    }

    private static QueueMessage message(String receiptHandle, String body) {
        return QueueMessage.builder()
                .messageId("id-" + receiptHandle)
                .receiptHandle(receiptHandle)
                .body(body)
                .build();
    }

    private static String body(UUID fileId) {
        return "{\"fileId\":\"" + fileId + "\",\"objectKey\":\"uploads/" + fileId + ".txt\",\"fileName\":\"CNAB.txt\"}";
    }
}
