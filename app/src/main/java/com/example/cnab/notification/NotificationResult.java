package com.example.cnab.notification;

import lombok.Value;

import java.util.UUID;

@Value
public class NotificationResult {

    UUID notificationId;
    boolean success;
    int attemptCount;
    String errorMessage;
    boolean publishedToDlq;

    public static NotificationResult delivered(UUID notificationId, int attemptCount) {
        return new NotificationResult(notificationId, true, attemptCount, null, false);
    }

    public static NotificationResult failed(UUID notificationId, int attemptCount, String errorMessage, boolean publishedToDlq) {
        return new NotificationResult(notificationId, false, attemptCount, errorMessage, publishedToDlq);
    }

    public static NotificationResult disabled(UUID notificationId) {
        return new NotificationResult(notificationId, true, 0, null, false);
    }
}
