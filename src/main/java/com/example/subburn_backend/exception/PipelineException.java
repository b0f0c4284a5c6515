package com.example.subburn_backend.exception;

/**
 * Base type for failures that end a subtitle job in the failed stage.
 *
 * <p>These never reach the upload caller: the orchestrator turns them into
 * {@code error} and {@code log} events for the job's subscriber.
 */
public abstract class PipelineException extends Exception {

    protected PipelineException(String message) {
        super(message);
    }

    protected PipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
