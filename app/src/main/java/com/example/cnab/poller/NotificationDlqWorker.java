package com.example.cnab.poller;

import com.example.cnab.config.NotificationProperties;
import com.example.cnab.exception.TransientInfrastructureException;
import com.example.cnab.messaging.QueueClient;
import com.example.cnab.messaging.QueueMessage;
import com.example.cnab.metrics.IngestionMetrics;
import com.example.cnab.model.NotificationDlqMessage;
import com.example.cnab.notification.NotificationChannel;
import com.example.cnab.notification.NotificationResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Drena a DLQ de notificações periodicamente. Cada mensagem é reenviada uma vez pelo
 * {@link NotificationChannel} e sempre removida da DLQ, com sucesso ou não.
 */
@Component
public class NotificationDlqWorker {

    private static final Logger log = LoggerFactory.getLogger(NotificationDlqWorker.class);

    static final String QUEUE_NAME = "notification-dlq";

    private final QueueClient queueClient;
    private final NotificationChannel notificationChannel;
    private final ObjectMapper objectMapper;
    private final NotificationProperties properties;
    private final IngestionMetrics metrics;

    public NotificationDlqWorker(QueueClient queueClient,
                                 NotificationChannel notificationChannel,
                                 ObjectMapper objectMapper,
                                 NotificationProperties properties,
                                 IngestionMetrics metrics) {
        this.queueClient = queueClient;
        this.notificationChannel = notificationChannel;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.metrics = metrics;
    }

    @Scheduled(fixedDelayString = "${app.notification.dlq-poll-interval-ms:60000}",
            initialDelayString = "${app.notification.dlq-initial-delay-ms:60000}")
    public void pollNotificationDlq() {
        if (!properties.isEnabled()) {
            return;
        }
        try {
            CycleSummary summary = drainOnce();
            if (summary.getReceived() > 0) {
                log.info("Ciclo da DLQ de notificações concluído. Recebidas: {}, reenviadas: {}, para revisão manual: {}",
                        summary.getReceived(), summary.getResolved(), summary.getManualReview());
            }
        } catch (TransientInfrastructureException e) {
            log.error("Erro ao ler a DLQ de notificações: {}", e.getMessage(), e);
        } catch (RuntimeException e) {
            log.error("Erro inesperado no ciclo da DLQ de notificações: {}", e.getMessage(), e);
        }
    }

    CycleSummary drainOnce() {
        List<QueueMessage> messages = queueClient.receive(properties.getDlqQueueUrl(), properties.getDlqMaxMessages(),
                properties.getDlqVisibilityTimeoutSeconds(), properties.getDlqWaitTimeSeconds());
        int resolved = 0;
        int manualReview = 0;
        for (QueueMessage message : messages) {
            try {
                if (retry(message)) {
                    resolved++;
                } else {
                    manualReview++;
                }
            } catch (RuntimeException e) {
                log.error("Erro inesperado ao reenviar a mensagem {} da DLQ de notificações: {}",
                        message.getMessageId(), e.getMessage(), e);
                manualReview++;
            } finally {
                delete(message);
            }
        }
        return new CycleSummary(messages.size(), resolved, manualReview);
    }

    private boolean retry(QueueMessage message) {
        NotificationDlqMessage payload = deserialize(message);
        if (payload == null) {
            return false;
        }
        NotificationResult result = notificationChannel.retryFromDlq(payload);
        if (result.isSuccess()) {
            log.info("Notificação {} do arquivo {} reenviada com sucesso a partir da DLQ.",
                    payload.getNotificationId(), payload.getFileId());
            return true;
        }
        log.error("Notificação {} do arquivo {} falhou novamente; registrada para revisão manual: {}",
                payload.getNotificationId(), payload.getFileId(), result.getErrorMessage());
        return false;
    }

    private NotificationDlqMessage deserialize(QueueMessage message) {
        if (message.getBody() == null || message.getBody().isBlank()) {
            log.error("Mensagem {} da DLQ de notificações com corpo vazio; descartando para revisão manual.",
                    message.getMessageId());
            return null;
        }
        try {
            return objectMapper.readValue(message.getBody(), NotificationDlqMessage.class);
        } catch (JsonProcessingException e) {
            log.error("Mensagem {} da DLQ de notificações com JSON inválido; descartando para revisão manual: {}. Corpo: {}",
                    message.getMessageId(), e.getOriginalMessage(), message.getBody());
            return null;
        }
    }

    private void delete(QueueMessage message) {
        metrics.messageHandled(QUEUE_NAME, true);
        try {
            queueClient.delete(properties.getDlqQueueUrl(), message.getReceiptHandle());
        } catch (TransientInfrastructureException e) {
            log.error("Falha ao remover a mensagem {} da DLQ de notificações: {}", message.getMessageId(), e.getMessage());
        }
    }

    @Value
    static class CycleSummary {
        int received;
        int resolved;
        int manualReview;
    }
}
