package com.example.cnab.exception;

public class ObjectTooLargeException extends RuntimeException {

    private final long size;
    private final long maxSize;

    public ObjectTooLargeException(String objectKey, long size, long maxSize) {
        super(String.format("Objeto %s com %d bytes excede o máximo de %d bytes", objectKey, size, maxSize));
        this.size = size;
        this.maxSize = maxSize;
    }

    public long getSize() {
        return size;
    }

    public long getMaxSize() {
        return maxSize;
    }
}
