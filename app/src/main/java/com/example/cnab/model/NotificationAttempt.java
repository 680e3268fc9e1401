package com.example.cnab.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbPartitionKey;

import java.time.Instant;

/**
 * Registro de auditoria de uma notificação, gravado na tabela DynamoDB de tentativas.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@DynamoDbBean
public class NotificationAttempt {

    public static final String STATUS_SENT = "SENT";
    public static final String STATUS_SENT_TO_DLQ = "SENT_TO_DLQ";
    public static final String STATUS_DLQ_RETRY_SUCCEEDED = "DLQ_RETRY_SUCCEEDED";
    public static final String STATUS_MANUAL_REVIEW = "MANUAL_REVIEW";

    private String notificationId;
    private String fileId;
    private String notificationType;
    private String recipientEmail;
    private Integer attemptCount;
    private String status;
    private Instant lastAttemptAt;
    private String errorMessage;

    @DynamoDbPartitionKey
    public String getNotificationId() {
        return notificationId;
    }
}
