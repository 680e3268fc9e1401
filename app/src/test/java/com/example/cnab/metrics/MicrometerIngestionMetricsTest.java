package com.example.cnab.metrics;

import com.example.cnab.processor.IngestionOutcome;
import com.example.cnab.validation.ErrorCategory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class MicrometerIngestionMetricsTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final MicrometerIngestionMetrics metrics = new MicrometerIngestionMetrics(registry);

    @Test
    void fileCompleted_recordsTimerAndCounterByOutcome() {
        metrics.fileCompleted(IngestionOutcome.Status.PROCESSED, Duration.ofMillis(250));
        metrics.fileCompleted(IngestionOutcome.Status.REJECTED, Duration.ofMillis(50));

        assertThat(registry.get("cnab.files.completed").tag("outcome", "PROCESSED").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("cnab.files.processing.time").tag("outcome", "PROCESSED").timer()
                .totalTime(TimeUnit.MILLISECONDS)).isEqualTo(250.0);
        assertThat(registry.get("cnab.files.completed").tag("outcome", "REJECTED").counter().count()).isEqualTo(1.0);
    }

    @Test
    void validationFailed_countsFailuresAndIndividualErrors() {
        metrics.validationFailed(ErrorCategory.CONTENT, 4);

        assertThat(registry.get("cnab.validation.failures").tag("category", "CONTENT").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("cnab.validation.errors").tag("category", "CONTENT").counter().count()).isEqualTo(4.0);
    }

    @Test
    void messageHandled_tagsDisposition() {
        metrics.messageHandled("file-processing", true);
        metrics.messageHandled("file-processing", false);
        metrics.messageHandled("file-processing", false);

        assertThat(registry.get("cnab.queue.messages").tag("disposition", "ack").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("cnab.queue.messages").tag("disposition", "retain").counter().count()).isEqualTo(2.0);
    }

    @Test
    void notificationDelivered_recordsAttemptDistribution() {
        metrics.notificationDelivered(false, 3);

        assertThat(registry.get("cnab.notifications").tag("result", "failed").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("cnab.notifications.attempts").summary().totalAmount()).isEqualTo(3.0);
    }
}
