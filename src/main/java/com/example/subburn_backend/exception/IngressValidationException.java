package com.example.subburn_backend.exception;

/**
 * The upload request cannot be accepted as sent (HTTP 400).
 */
public class IngressValidationException extends RuntimeException {

    private final String code;

    public IngressValidationException(String code, String message) {
        super(message);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
