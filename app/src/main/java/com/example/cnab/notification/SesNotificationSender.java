package com.example.cnab.notification;

import com.example.cnab.config.NotificationProperties;
import com.example.cnab.exception.NotificationDeliveryException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.ses.SesClient;
import software.amazon.awssdk.services.ses.model.Body;
import software.amazon.awssdk.services.ses.model.Content;
import software.amazon.awssdk.services.ses.model.Destination;
import software.amazon.awssdk.services.ses.model.Message;
import software.amazon.awssdk.services.ses.model.SendEmailRequest;
import software.amazon.awssdk.services.ses.model.SesException;

import java.nio.charset.StandardCharsets;

@Component
public class SesNotificationSender implements NotificationSender {

    private static final Logger log = LoggerFactory.getLogger(SesNotificationSender.class);

    private final SesClient sesClient;
    private final String senderEmail;

    public SesNotificationSender(SesClient sesClient, NotificationProperties properties) {
        this.sesClient = sesClient;
        this.senderEmail = properties.getSenderEmail();
    }

    @Override
    public void send(String recipientEmail, String subject, String body) {
        SendEmailRequest request = SendEmailRequest.builder()
                .source(senderEmail)
                .destination(Destination.builder().toAddresses(recipientEmail).build())
                .message(Message.builder()
                        .subject(utf8(subject))
                        .body(Body.builder().text(utf8(body)).build())
                        .build())
                .build();
        try {
            String messageId = sesClient.sendEmail(request).messageId();
            log.info("E-mail '{}' enviado para {} (SES messageId {}).", subject, recipientEmail, messageId);
        } catch (SesException e) {
            throw new NotificationDeliveryException("SES recusou o envio para " + recipientEmail + ": "
                    + e.awsErrorDetails().errorMessage(), e);
        } catch (SdkException e) {
            throw new NotificationDeliveryException("Falha de comunicação com o SES: " + e.getMessage(), e);
        }
    }

    private static Content utf8(String data) {
        return Content.builder().charset(StandardCharsets.UTF_8.name()).data(data).build();
    }
}
