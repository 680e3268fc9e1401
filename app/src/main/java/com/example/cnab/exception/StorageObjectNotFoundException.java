package com.example.cnab.exception;

public class StorageObjectNotFoundException extends RuntimeException {

    private final String objectKey;

    public StorageObjectNotFoundException(String objectKey, Throwable cause) {
        super("Objeto não encontrado no armazenamento: " + objectKey, cause);
        this.objectKey = objectKey;
    }

    public String getObjectKey() {
        return objectKey;
    }
}
