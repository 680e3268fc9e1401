package com.example.cnab.metrics;

import com.example.cnab.processor.IngestionOutcome;
import com.example.cnab.validation.ErrorCategory;

import java.time.Duration;

/**
 * Observador do pipeline de ingestão. Implementações não podem lançar exceções.
 */
public interface IngestionMetrics {

    void fileCompleted(IngestionOutcome.Status status, Duration elapsed);

    void validationFailed(ErrorCategory category, int errorCount);

    void transactionsPersisted(int count);

    void messageHandled(String queue, boolean acknowledged);

    void notificationDelivered(boolean success, int attempts);

    static IngestionMetrics noOp() {
        return NoOpIngestionMetrics.INSTANCE;
    }
}
