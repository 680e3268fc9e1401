package com.example.cnab.config;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.exception.SdkServiceException;

import java.io.UncheckedIOException;

/**
 * Políticas de retry (Resilience4j) usadas pelos clientes de fila, armazenamento e notificação.
 */
@Configuration
public class ResilienceConfig {

    private static final Logger log = LoggerFactory.getLogger(ResilienceConfig.class);

    public static final String AWS_CLIENT_RETRY = "awsClientRetry";
    public static final String NOTIFICATION_RETRY = "notificationRetry";

    @Value("${app.aws.retry.max-attempts:3}")
    private int awsMaxAttempts;

    @Value("${app.aws.retry.initial-backoff-ms:200}")
    private long awsInitialBackoffMs;

    /**
     * Retry para chamadas SQS/S3: só repete falhas de transporte, throttling e erros 5xx.
     */
    @Bean(name = AWS_CLIENT_RETRY)
    public Retry awsClientRetry() {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(awsMaxAttempts)
                .intervalFunction(IntervalFunction.ofExponentialBackoff(awsInitialBackoffMs, 2.0))
                .retryOnException(ResilienceConfig::isRetryableAwsFailure)
                .build();
        Retry retry = Retry.of(AWS_CLIENT_RETRY, config);
        retry.getEventPublisher().onRetry(event -> log.warn("Nova tentativa {} da chamada AWS após falha: {}",
                event.getNumberOfRetryAttempts(), event.getLastThrowable().getMessage()));
        return retry;
    }

    @Bean(name = NOTIFICATION_RETRY)
    public Retry notificationRetry(NotificationProperties properties) {
        Retry retry = Retry.of(NOTIFICATION_RETRY, notificationRetryConfig(properties));
        retry.getEventPublisher().onRetry(event -> log.warn("Tentativa {} de envio de notificação falhou: {}",
                event.getNumberOfRetryAttempts(), event.getLastThrowable().getMessage()));
        return retry;
    }

    public static RetryConfig notificationRetryConfig(NotificationProperties properties) {
        return RetryConfig.custom()
                .maxAttempts(properties.getMaxAttempts())
                .intervalFunction(IntervalFunction.ofExponentialBackoff(
                        properties.getInitialBackoff().toMillis(), properties.getBackoffMultiplier()))
                .build();
    }

    public static boolean isRetryableAwsFailure(Throwable throwable) {
        if (throwable instanceof SdkClientException || throwable instanceof UncheckedIOException) {
            return true;
        }
        if (throwable instanceof SdkServiceException) {
            SdkServiceException serviceException = (SdkServiceException) throwable;
            return serviceException.isThrottlingException() || serviceException.statusCode() >= 500;
        }
        return false;
    }
}
