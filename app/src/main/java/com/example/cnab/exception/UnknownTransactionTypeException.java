package com.example.cnab.exception;

public class UnknownTransactionTypeException extends RuntimeException {

    public UnknownTransactionTypeException(int typeCode) {
        super("Tipo de transação desconhecido: " + typeCode);
    }
}
