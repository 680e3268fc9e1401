package com.example.cnab.exception;

import java.util.UUID;

public class FileNotRegisteredException extends RuntimeException {

    public FileNotRegisteredException(UUID fileId) {
        super("Arquivo não encontrado no banco de dados: " + fileId);
    }
}
