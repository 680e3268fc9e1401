package com.example.cnab.notification;

/**
 * Canal de entrega de e-mail. Falhas saem como
 * {@link com.example.cnab.exception.NotificationDeliveryException}.
 */
public interface NotificationSender {

    void send(String recipientEmail, String subject, String body);
}
