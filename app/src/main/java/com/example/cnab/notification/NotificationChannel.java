package com.example.cnab.notification;

import com.example.cnab.config.NotificationProperties;
import com.example.cnab.config.ResilienceConfig;
import com.example.cnab.exception.TransientInfrastructureException;
import com.example.cnab.messaging.QueueClient;
import com.example.cnab.metrics.IngestionMetrics;
import com.example.cnab.model.NotificationAttempt;
import com.example.cnab.model.NotificationDlqMessage;
import com.example.cnab.model.NotificationType;
import com.example.cnab.repository.NotificationAttemptRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.retry.Retry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Notificações de fim de processamento, em regime de melhor esforço.
 * Cada envio tem até {@code app.notification.max-attempts} tentativas com backoff exponencial;
 * esgotadas as tentativas, a notificação vai para a DLQ de notificações. Nenhum método lança exceção.
 */
@Service
public class NotificationChannel {

    private static final Logger log = LoggerFactory.getLogger(NotificationChannel.class);

    static final String CONTEXT_FILE_NAME = "fileName";
    static final String CONTEXT_STATUS = "status";
    static final String CONTEXT_TRANSACTION_COUNT = "transactionCount";
    static final String CONTEXT_ERROR_MESSAGE = "errorMessage";
    static final String CONTEXT_CORRELATION_ID = "correlationId";

    private final NotificationSender sender;
    private final QueueClient queueClient;
    private final NotificationAttemptRepository attemptRepository;
    private final ObjectMapper objectMapper;
    private final NotificationProperties properties;
    private final Retry retry;
    private final IngestionMetrics metrics;
    private final Clock clock;

    public NotificationChannel(NotificationSender sender,
                               QueueClient queueClient,
                               NotificationAttemptRepository attemptRepository,
                               ObjectMapper objectMapper,
                               NotificationProperties properties,
                               @Qualifier(ResilienceConfig.NOTIFICATION_RETRY) Retry retry,
                               IngestionMetrics metrics,
                               Clock clock) {
        this.sender = sender;
        this.queueClient = queueClient;
        this.attemptRepository = attemptRepository;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.retry = retry;
        this.metrics = metrics;
        this.clock = clock;
    }

    public NotificationResult notifyProcessingCompleted(UUID fileId, String fileName, int transactionCount, String correlationId) {
        Map<String, String> context = new LinkedHashMap<>();
        context.put(CONTEXT_FILE_NAME, String.valueOf(fileName));
        context.put(CONTEXT_STATUS, "Processed");
        context.put(CONTEXT_TRANSACTION_COUNT, String.valueOf(transactionCount));
        putIfPresent(context, CONTEXT_CORRELATION_ID, correlationId);
        return deliver(UUID.randomUUID(), fileId, NotificationType.PROCESSING_COMPLETED,
                properties.getDefaultRecipientEmail(), context, false);
    }

    public NotificationResult notifyProcessingFailed(UUID fileId, String fileName, String errorMessage, String correlationId) {
        Map<String, String> context = new LinkedHashMap<>();
        context.put(CONTEXT_FILE_NAME, String.valueOf(fileName));
        context.put(CONTEXT_STATUS, "Rejected");
        putIfPresent(context, CONTEXT_ERROR_MESSAGE, errorMessage);
        putIfPresent(context, CONTEXT_CORRELATION_ID, correlationId);
        return deliver(UUID.randomUUID(), fileId, NotificationType.PROCESSING_FAILED,
                properties.getDefaultRecipientEmail(), context, false);
    }

    /**
     * Reenvia uma notificação vinda da DLQ com a mesma política de tentativas. Não republica na DLQ:
     * uma nova falha fica registrada para revisão manual.
     */
    public NotificationResult retryFromDlq(NotificationDlqMessage message) {
        UUID notificationId = message.getNotificationId() != null ? message.getNotificationId() : UUID.randomUUID();
        if (message.getNotificationType() == null) {
            log.error("Notificação {} da DLQ sem tipo; requer revisão manual.", notificationId);
            return NotificationResult.failed(notificationId, 0, "Tipo de notificação ausente", false);
        }
        String recipient = message.getRecipientEmail() != null
                ? message.getRecipientEmail() : properties.getDefaultRecipientEmail();
        Map<String, String> context = message.getContext() != null ? message.getContext() : Map.of();
        return deliver(notificationId, message.getFileId(), message.getNotificationType(), recipient, context, true);
    }

    private NotificationResult deliver(UUID notificationId, UUID fileId, NotificationType type,
                                       String recipient, Map<String, String> context, boolean fromDlq) {
        if (!properties.isEnabled()) {
            log.debug("Notificações desativadas; {} do arquivo {} não será enviada.", type, fileId);
            return NotificationResult.disabled(notificationId);
        }

        String subject = subject(type, context);
        String body = body(type, fileId, context);
        AtomicInteger attempts = new AtomicInteger();
        try {
            retry.executeRunnable(() -> {
                attempts.incrementAndGet();
                sender.send(recipient, subject, body);
            });
        } catch (RuntimeException e) {
            return handleFailure(notificationId, fileId, type, recipient, context, attempts.get(), e, fromDlq);
        }

        log.info("Notificação {} ({}) do arquivo {} enviada para {} após {} tentativa(s).",
                notificationId, type.getWireName(), fileId, recipient, attempts.get());
        metrics.notificationDelivered(true, attempts.get());
        record(notificationId, fileId, type, recipient, attempts.get(),
                fromDlq ? NotificationAttempt.STATUS_DLQ_RETRY_SUCCEEDED : NotificationAttempt.STATUS_SENT, null);
        return NotificationResult.delivered(notificationId, attempts.get());
    }

    private NotificationResult handleFailure(UUID notificationId, UUID fileId, NotificationType type, String recipient,
                                             Map<String, String> context, int attempts, RuntimeException failure,
                                             boolean fromDlq) {
        String errorMessage = failure.getMessage();
        metrics.notificationDelivered(false, attempts);

        if (fromDlq) {
            log.error("Notificação {} do arquivo {} falhou novamente a partir da DLQ; requer revisão manual: {}",
                    notificationId, fileId, errorMessage);
            record(notificationId, fileId, type, recipient, attempts, NotificationAttempt.STATUS_MANUAL_REVIEW, errorMessage);
            return NotificationResult.failed(notificationId, attempts, errorMessage, false);
        }

        log.error("Notificação {} do arquivo {} falhou após {} tentativa(s): {}. Enviando para a DLQ.",
                notificationId, fileId, attempts, errorMessage);
        NotificationDlqMessage dlqMessage = NotificationDlqMessage.builder()
                .notificationId(notificationId)
                .fileId(fileId)
                .notificationType(type)
                .recipientEmail(recipient)
                .attemptCount(attempts)
                .lastAttemptAt(clock.instant())
                .errorMessage(errorMessage)
                .context(new HashMap<>(context))
                .build();
        boolean published = publishToDlq(dlqMessage, context.get(CONTEXT_CORRELATION_ID));
        record(notificationId, fileId, type, recipient, attempts,
                published ? NotificationAttempt.STATUS_SENT_TO_DLQ : NotificationAttempt.STATUS_MANUAL_REVIEW, errorMessage);
        return NotificationResult.failed(notificationId, attempts, errorMessage, published);
    }

    private boolean publishToDlq(NotificationDlqMessage dlqMessage, String correlationId) {
        try {
            String body = objectMapper.writeValueAsString(dlqMessage);
            Map<String, String> attributes = new HashMap<>();
            putIfPresent(attributes, "CorrelationId", correlationId);
            queueClient.send(properties.getDlqQueueUrl(), body, attributes);
            log.info("Notificação {} publicada na DLQ de notificações.", dlqMessage.getNotificationId());
            return true;
        } catch (JsonProcessingException e) {
            log.error("Erro ao serializar a notificação {} para a DLQ: {}", dlqMessage.getNotificationId(), e.getMessage(), e);
        } catch (TransientInfrastructureException e) {
            log.error("Não foi possível publicar a notificação {} na DLQ: {}", dlqMessage.getNotificationId(), e.getMessage(), e);
        }
        return false;
    }

    private void record(UUID notificationId, UUID fileId, NotificationType type, String recipient,
                        int attempts, String status, String errorMessage) {
        NotificationAttempt attempt = NotificationAttempt.builder()
                .notificationId(notificationId.toString())
                .fileId(fileId == null ? null : fileId.toString())
                .notificationType(type.getWireName())
                .recipientEmail(recipient)
                .attemptCount(attempts)
                .status(status)
                .lastAttemptAt(clock.instant())
                .errorMessage(errorMessage)
                .build();
        try {
            attemptRepository.save(attempt);
        } catch (RuntimeException e) {
            log.warn("Falha ao registrar a tentativa de notificação {} no DynamoDB: {}", notificationId, e.getMessage());
        }
    }

    static String subject(NotificationType type, Map<String, String> context) {
        String fileName = context.getOrDefault(CONTEXT_FILE_NAME, "");
        if (type == NotificationType.PROCESSING_COMPLETED) {
            return "Arquivo " + fileName + " processado";
        }
        return "Arquivo " + fileName + " rejeitado";
    }

    static String body(NotificationType type, UUID fileId, Map<String, String> context) {
        String fileName = context.getOrDefault(CONTEXT_FILE_NAME, "");
        if (type == NotificationType.PROCESSING_COMPLETED) {
            return String.format("O arquivo %s (id %s) foi processado com sucesso. Transações importadas: %s.",
                    fileName, fileId, context.getOrDefault(CONTEXT_TRANSACTION_COUNT, "0"));
        }
        return String.format("O arquivo %s (id %s) foi rejeitado. Motivo: %s",
                fileName, fileId, context.getOrDefault(CONTEXT_ERROR_MESSAGE, "não informado"));
    }

    private static void putIfPresent(Map<String, String> map, String key, String value) {
        if (value != null) {
            map.put(key, value);
        }
    }
}
