package com.example.cnab.processor;

import com.example.cnab.validation.IngestionError;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.UUID;

/**
 * Resultado terminal do processamento de uma mensagem. Qualquer resultado retornado
 * (inclusive SKIPPED) autoriza a remoção da mensagem da fila.
 */
@Value
@Builder
public class IngestionOutcome {

    public enum Status {
        PROCESSED,
        REJECTED,
        SKIPPED
    }

    UUID fileId;
    Status status;
    int transactionsInserted;
    int storesCreated;
    @Builder.Default
    List<IngestionError> errors = List.of();
    String errorMessage;

    public static IngestionOutcome skipped(UUID fileId) {
        return IngestionOutcome.builder()
                .fileId(fileId)
                .status(Status.SKIPPED)
                .build();
    }
}
