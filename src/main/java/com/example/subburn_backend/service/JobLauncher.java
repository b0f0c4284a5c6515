package com.example.subburn_backend.service;

import com.example.subburn_backend.exception.PipelineBusyException;
import com.example.subburn_backend.model.Job;
import com.example.subburn_backend.model.JobWorkspace;
import com.example.subburn_backend.service.events.SubscriberHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Creates the job for a stored upload and hands it to the pipeline pool without waiting for it.
 */
@Service
public class JobLauncher {
    private static final Logger LOGGER = LoggerFactory.getLogger(JobLauncher.class);

    private final WorkspaceManager workspaceManager;
    private final SubtitlePipelineOrchestrator orchestrator;
    private final Executor pipelineExecutor;

    public JobLauncher(WorkspaceManager workspaceManager,
                       SubtitlePipelineOrchestrator orchestrator,
                       @Qualifier("pipelineTaskExecutor") Executor pipelineExecutor) {
        this.workspaceManager = workspaceManager;
        this.orchestrator = orchestrator;
        this.pipelineExecutor = pipelineExecutor;
    }

    /**
     * @throws PipelineBusyException when the pool cannot take another job
     */
    public Job launch(Path storedUpload, String originalFilename, @Nullable SubscriberHandle subscriber) {
        JobWorkspace workspace = workspaceManager.allocate(storedUpload);
        Job job = new Job(workspace, storedUpload, originalFilename, subscriber);
        try {
            pipelineExecutor.execute(() -> orchestrator.run(job));
        } catch (RejectedExecutionException e) {
            LOGGER.warn("Pipeline pool saturated, rejecting jobId={}", job.getId());
            throw new PipelineBusyException("Too many videos are being processed, try again later", e);
        }
        LOGGER.info("Job queued jobId={} subscriber={}", job.getId(), subscriber != null ? subscriber.id() : null);
        return job;
    }
}
