package com.example.subburn_backend.model;

import com.example.subburn_backend.service.events.SubscriberHandle;
import com.example.subburn_backend.util.JobStage;
import org.springframework.lang.Nullable;

import java.nio.file.Path;
import java.util.Objects;

/**
 * One upload travelling through the subtitle pipeline.
 *
 * <p>Owned by a single orchestrator run; not safe for concurrent mutation.
 */
public class Job {
    private final JobWorkspace workspace;
    private final Path sourceVideoPath;
    private final String originalFilename;
    private final @Nullable SubscriberHandle subscriber;

    private JobStage stage = JobStage.QUEUED;
    private int progress = 0;
    private String failureMessage;

    public Job(JobWorkspace workspace, Path sourceVideoPath, String originalFilename, @Nullable SubscriberHandle subscriber) {
        this.workspace = Objects.requireNonNull(workspace, "workspace");
        this.sourceVideoPath = Objects.requireNonNull(sourceVideoPath, "sourceVideoPath");
        this.originalFilename = originalFilename;
        this.subscriber = subscriber;
    }

    public String getId() {
        return workspace.jobId();
    }

    public JobWorkspace getWorkspace() {
        return workspace;
    }

    public Path getSourceVideoPath() {
        return sourceVideoPath;
    }

    public String getOriginalFilename() {
        return originalFilename;
    }

    @Nullable
    public SubscriberHandle getSubscriber() {
        return subscriber;
    }

    public JobStage getStage() {
        return stage;
    }

    public int getProgress() {
        return progress;
    }

    public String getFailureMessage() {
        return failureMessage;
    }

    /**
     * Moves to the next stage and raises progress to that stage's value.
     *
     * @throws IllegalStateException when {@code next} is not the direct successor of the current stage
     */
    public void advanceTo(JobStage next) {
        if (next == JobStage.FAILED || !stage.canAdvanceTo(next)) {
            throw new IllegalStateException("Illegal stage transition " + stage + " -> " + next + " for job " + getId());
        }
        stage = next;
        progress = Math.max(progress, next.progress());
    }

    /**
     * Ends the job in {@link JobStage#FAILED}. Progress keeps its last value.
     */
    public void fail(String message) {
        if (!stage.canAdvanceTo(JobStage.FAILED)) {
            throw new IllegalStateException("Job " + getId() + " already terminal in " + stage);
        }
        stage = JobStage.FAILED;
        failureMessage = message;
    }
}
