package com.example.subburn_backend.exception;

/**
 * Local file storage could not be read or written.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
