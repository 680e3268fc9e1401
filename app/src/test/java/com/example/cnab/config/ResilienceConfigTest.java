package com.example.cnab.config;

import io.github.resilience4j.retry.RetryConfig;
import org.junit.jupiter.api.Test;
import software.amazon.awssdk.awscore.exception.AwsErrorDetails;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.services.sqs.model.SqsException;

import static org.assertj.core.api.Assertions.assertThat;

class ResilienceConfigTest {

    @Test
    void notificationRetry_defaultsToInitialAttemptPlusThreeRetriesWithDoublingWaits() {
        RetryConfig config = ResilienceConfig.notificationRetryConfig(new NotificationProperties());

        assertThat(config.getMaxAttempts()).isEqualTo(4);
        assertThat(config.getIntervalBiFunction().apply(1, null)).isEqualTo(2000L);
        assertThat(config.getIntervalBiFunction().apply(2, null)).isEqualTo(4000L);
        assertThat(config.getIntervalBiFunction().apply(3, null)).isEqualTo(8000L);
    }

    @Test
    void isRetryableAwsFailure_onlyForTransportThrottlingAndServerErrors() {
        assertThat(ResilienceConfig.isRetryableAwsFailure(SdkClientException.create("timeout"))).isTrue();
        assertThat(ResilienceConfig.isRetryableAwsFailure(sqsError(503, "ServiceUnavailable"))).isTrue();
        assertThat(ResilienceConfig.isRetryableAwsFailure(sqsError(400, "InvalidParameterValue"))).isFalse();
        assertThat(ResilienceConfig.isRetryableAwsFailure(new IllegalStateException("bug"))).isFalse();
    }

    private static SqsException sqsError(int status, String code) {
        return (SqsException) SqsException.builder()
                .statusCode(status)
                .awsErrorDetails(AwsErrorDetails.builder().errorCode(code).errorMessage(code).build())
                .build();
    }
}
