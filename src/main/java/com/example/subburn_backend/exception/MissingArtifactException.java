package com.example.subburn_backend.exception;

import java.nio.file.Path;

/**
 * A tool reported success but the file it should have written is not there.
 */
public class MissingArtifactException extends PipelineException {

    private final Path expectedPath;

    public MissingArtifactException(String message, Path expectedPath) {
        super(message);
        this.expectedPath = expectedPath;
    }

    public Path getExpectedPath() {
        return expectedPath;
    }
}
