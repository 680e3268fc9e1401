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

/**
 * Parâmetros do worker que consome a fila de processamento de arquivos.
 */
@Data
@Component
@Validated
@ConfigurationProperties(prefix = "app.worker")
public class WorkerProperties {

    private boolean enabled = true;

    @NotBlank(message = "A URL da fila SQS de processamento não pode estar em branco.")
    private String queueUrl;

    @Min(1)
    @Max(10)
    private int maxMessages = 10;

    @Min(0)
    private int visibilityTimeoutSeconds = 300;

    @Min(0)
    @Max(20)
    private int waitTimeSeconds = 20;

    @NotNull
    private Duration emptyQueueBackoff = Duration.ofSeconds(5);

    @NotNull
    private Duration shutdownTimeout = Duration.ofSeconds(60);
}
