package com.example.cnab.validation;

public enum ErrorCategory {
    /** Tamanho, comprimento de linha, codificação ou arquivo vazio. */
    STRUCTURAL,
    /** Regras de campo de uma linha com estrutura válida. */
    CONTENT
}
