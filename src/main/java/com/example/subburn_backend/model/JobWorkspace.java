package com.example.subburn_backend.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Files owned by one job. Paths are fixed at construction; {@link #cleanup()} removes the intermediates only.
 */
public final class JobWorkspace {
    private static final Logger LOGGER = LoggerFactory.getLogger(JobWorkspace.class);

    private final String jobId;
    private final Path workDir;
    private final Path audioPath;
    private final Path subtitlePath;
    private final Path tempSubtitlePath;
    private final Path outputVideoPath;

    public JobWorkspace(String jobId, Path workDir, Path audioPath, Path subtitlePath, Path tempSubtitlePath, Path outputVideoPath) {
        this.jobId = Objects.requireNonNull(jobId, "jobId");
        this.workDir = Objects.requireNonNull(workDir, "workDir");
        this.audioPath = Objects.requireNonNull(audioPath, "audioPath");
        this.subtitlePath = Objects.requireNonNull(subtitlePath, "subtitlePath");
        this.tempSubtitlePath = Objects.requireNonNull(tempSubtitlePath, "tempSubtitlePath");
        this.outputVideoPath = Objects.requireNonNull(outputVideoPath, "outputVideoPath");
    }

    public String jobId() { return jobId; }

    /** Directory the subtitle burner runs in, so it can reference {@link #tempSubtitleFileName()} relatively. */
    public Path workDir() { return workDir; }

    public Path audioPath() { return audioPath; }

    public Path subtitlePath() { return subtitlePath; }

    public Path tempSubtitlePath() { return tempSubtitlePath; }

    public Path outputVideoPath() { return outputVideoPath; }

    public String tempSubtitleFileName() {
        return tempSubtitlePath.getFileName().toString();
    }

    public String outputFileName() {
        return outputVideoPath.getFileName().toString();
    }

    /**
     * Deletes the extracted audio and the temporary subtitle copy. Safe to call repeatedly; never throws.
     */
    public void cleanup() {
        deleteQuietly(audioPath);
        deleteQuietly(tempSubtitlePath);
    }

    private void deleteQuietly(Path path) {
        try {
            if (Files.deleteIfExists(path)) {
                LOGGER.debug("Workspace cleanup jobId={} deleted={}", jobId, path);
            }
        } catch (IOException e) {
            LOGGER.warn("Workspace cleanup failed jobId={} path={} err={}", jobId, path, e.toString());
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof JobWorkspace that)) return false;
        return jobId.equals(that.jobId)
                && workDir.equals(that.workDir)
                && audioPath.equals(that.audioPath)
                && subtitlePath.equals(that.subtitlePath)
                && tempSubtitlePath.equals(that.tempSubtitlePath)
                && outputVideoPath.equals(that.outputVideoPath);
    }

    @Override
    public int hashCode() {
        return Objects.hash(jobId, workDir, audioPath, subtitlePath, tempSubtitlePath, outputVideoPath);
    }

    @Override
    public String toString() {
        return "JobWorkspace{jobId=" + jobId + ", audio=" + audioPath + ", srt=" + subtitlePath + ", out=" + outputVideoPath + "}";
    }
}
