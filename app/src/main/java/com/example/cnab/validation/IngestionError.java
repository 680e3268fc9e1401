package com.example.cnab.validation;

import lombok.Value;

/**
 * Erro de ingestão classificado por categoria. {@code lineNumber} é nulo para erros do arquivo inteiro.
 */
@Value
public class IngestionError {

    ErrorCategory category;
    Integer lineNumber;
    String message;

    public static IngestionError structural(Integer lineNumber, String message) {
        return new IngestionError(ErrorCategory.STRUCTURAL, lineNumber, message);
    }

    public static IngestionError content(int lineNumber, String message) {
        return new IngestionError(ErrorCategory.CONTENT, lineNumber, message);
    }

    public String describe() {
        return lineNumber == null ? message : "Linha " + lineNumber + ": " + message;
    }
}
