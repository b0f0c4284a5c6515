package com.example.subburn_backend.exception;

/**
 * An external tool exited non-zero, timed out or could not be started.
 */
public class ToolInvocationException extends PipelineException {

    /** Exit code used when the process never produced one. */
    public static final int NO_EXIT_CODE = -1;

    private final String toolName;
    private final int exitCode;
    private final String diagnostics;

    public ToolInvocationException(String toolName, int exitCode, String message, String diagnostics) {
        super(message);
        this.toolName = toolName;
        this.exitCode = exitCode;
        this.diagnostics = diagnostics;
    }

    public ToolInvocationException(String toolName, String message, Throwable cause) {
        super(message, cause);
        this.toolName = toolName;
        this.exitCode = NO_EXIT_CODE;
        this.diagnostics = cause == null ? null : cause.toString();
    }

    public String getToolName() {
        return toolName;
    }

    public int getExitCode() {
        return exitCode;
    }

    /** Captured stderr (or stdout when stderr was empty) of the failed run, possibly truncated. */
    public String getDiagnostics() {
        return diagnostics;
    }
}
