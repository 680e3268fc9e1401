package com.example.cnab.metrics;

import com.example.cnab.processor.IngestionOutcome;
import com.example.cnab.validation.ErrorCategory;
import io.micrometer.core.instrument.MeterRegistry;

import java.time.Duration;

public class MicrometerIngestionMetrics implements IngestionMetrics {

    private final MeterRegistry meterRegistry;

    public MicrometerIngestionMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    @Override
    public void fileCompleted(IngestionOutcome.Status status, Duration elapsed) {
        meterRegistry.timer("cnab.files.processing.time", "outcome", status.name()).record(elapsed);
        meterRegistry.counter("cnab.files.completed", "outcome", status.name()).increment();
    }

    @Override
    public void validationFailed(ErrorCategory category, int errorCount) {
        meterRegistry.counter("cnab.validation.failures", "category", category.name()).increment();
        meterRegistry.counter("cnab.validation.errors", "category", category.name()).increment(errorCount);
    }

    @Override
    public void transactionsPersisted(int count) {
        meterRegistry.counter("cnab.transactions.persisted").increment(count);
    }

    @Override
    public void messageHandled(String queue, boolean acknowledged) {
        meterRegistry.counter("cnab.queue.messages", "queue", queue,
                "disposition", acknowledged ? "ack" : "retain").increment();
    }

    @Override
    public void notificationDelivered(boolean success, int attempts) {
        meterRegistry.counter("cnab.notifications", "result", success ? "sent" : "failed").increment();
        meterRegistry.summary("cnab.notifications.attempts").record(attempts);
    }
}
