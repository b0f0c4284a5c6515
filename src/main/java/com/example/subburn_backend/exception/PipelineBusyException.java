package com.example.subburn_backend.exception;

/**
 * The worker pool and its queue are full; the upload was not started (HTTP 503).
 */
public class PipelineBusyException extends RuntimeException {

    public PipelineBusyException(String message, Throwable cause) {
        super(message, cause);
    }
}
