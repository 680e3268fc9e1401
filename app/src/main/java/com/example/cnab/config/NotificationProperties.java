package com.example.cnab.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Data
@Component
@Validated
@ConfigurationProperties(prefix = "app.notification")
public class NotificationProperties {

    private boolean enabled = true;

    @NotBlank(message = "A URL da DLQ de notificações não pode estar em branco.")
    private String dlqQueueUrl;

    @NotBlank(message = "O e-mail remetente das notificações não pode estar em branco.")
    private String senderEmail;

    @NotBlank(message = "O e-mail destinatário padrão não pode estar em branco.")
    private String defaultRecipientEmail = "notifications@transactionprocessor.local";

    @Min(1)
    private int maxAttempts = 4;

    @NotNull
    private Duration initialBackoff = Duration.ofSeconds(2);

    private double backoffMultiplier = 2.0;

    @Min(1)
    @Max(10)
    private int dlqMaxMessages = 10;

    @Min(0)
    @Max(20)
    private int dlqWaitTimeSeconds = 20;

    @Min(0)
    private int dlqVisibilityTimeoutSeconds = 60;
}
