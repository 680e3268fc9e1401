package com.example.cnab.validation;

import lombok.Getter;

import java.util.List;
import java.util.stream.Collectors;

@Getter
public class ValidationResult {

    private static final ValidationResult SUCCESS = new ValidationResult(List.of());

    private final List<IngestionError> errors;

    private ValidationResult(List<IngestionError> errors) {
        this.errors = List.copyOf(errors);
    }

    public static ValidationResult success() {
        return SUCCESS;
    }

    public static ValidationResult failure(List<IngestionError> errors) {
        if (errors.isEmpty()) {
            throw new IllegalArgumentException("Uma falha de validação precisa de pelo menos um erro.");
        }
        return new ValidationResult(errors);
    }

    public static ValidationResult failure(IngestionError error) {
        return new ValidationResult(List.of(error));
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    /**
     * Junta as mensagens de erro com "; " no formato gravado em {@code files.error_message}.
     */
    public String describe() {
        return describe(errors);
    }

    public static String describe(List<IngestionError> errors) {
        return errors.stream()
                .map(IngestionError::describe)
                .collect(Collectors.joining("; "));
    }
}
