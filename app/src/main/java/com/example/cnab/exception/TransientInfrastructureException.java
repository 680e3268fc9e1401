package com.example.cnab.exception;

/**
 * Falha transitória de infraestrutura (fila, armazenamento de objetos ou banco de dados).
 * Nunca deve levar um arquivo ao estado Rejected: a mensagem permanece na fila para nova entrega.
 */
public class TransientInfrastructureException extends RuntimeException {

    public TransientInfrastructureException(String message, Throwable cause) {
        super(message, cause);
    }
}
