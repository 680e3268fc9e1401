package com.example.cnab.exception;

public class InvalidTransactionSignException extends IllegalStateException {

    public InvalidTransactionSignException(int typeCode, String sign) {
        super(String.format("Sinal inválido '%s' para o tipo de transação %d. Deve ser '+' ou '-'.", sign, typeCode));
    }
}
