package com.example.cnab.metrics;

import com.example.cnab.processor.IngestionOutcome;
import com.example.cnab.validation.ErrorCategory;

import java.time.Duration;

final class NoOpIngestionMetrics implements IngestionMetrics {

    static final NoOpIngestionMetrics INSTANCE = new NoOpIngestionMetrics();

    private NoOpIngestionMetrics() {
    }

    @Override
    public void fileCompleted(IngestionOutcome.Status status, Duration elapsed) {
    }

    @Override
    public void validationFailed(ErrorCategory category, int errorCount) {
    }

    @Override
    public void transactionsPersisted(int count) {
    }

    @Override
    public void messageHandled(String queue, boolean acknowledged) {
    }

    @Override
    public void notificationDelivered(boolean success, int attempts) {
    }
}
