package com.example.cnab.poller;

/**
 * Estados do loop do worker da fila de processamento.
 * IDLE → POLLING → DISPATCHING → PROCESSING → ACK | RETAIN → DISPATCHING ... → IDLE; STOPPED é final.
 */
public enum WorkerState {
    IDLE,
    POLLING,
    DISPATCHING,
    PROCESSING,
    ACK,
    RETAIN,
    STOPPED
}
