package com.saletracker.tracker.domain.exceptions;

public class StorageException extends RuntimeException {

    private StorageException(String message, Throwable cause) {
        super(message, cause);
    }

    public static StorageException readFailed(String document, Throwable cause) {
        return new StorageException("Failed to read " + document, cause);
    }

    public static StorageException writeFailed(String document, Throwable cause) {
        return new StorageException("Failed to persist " + document, cause);
    }
}
