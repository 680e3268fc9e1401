package com.example.cnab.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Notificação que esgotou as tentativas e foi enviada para a DLQ de notificações.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class NotificationDlqMessage {
    private UUID notificationId;
    private UUID fileId;
    private NotificationType notificationType;
    private String recipientEmail;
    private int attemptCount;
    private Instant lastAttemptAt;
    private String errorMessage;
    private Map<String, String> context;
}
