package com.example.subburn_backend.service;

import com.example.subburn_backend.config.PipelineProperties;
import com.example.subburn_backend.dto.web.DownloadReference;
import com.example.subburn_backend.engine.Interfaces.AudioExtractionEngine;
import com.example.subburn_backend.engine.Interfaces.SubtitleBurnEngine;
import com.example.subburn_backend.engine.Interfaces.TranscriptionEngine;
import com.example.subburn_backend.exception.MissingArtifactException;
import com.example.subburn_backend.exception.PipelineException;
import com.example.subburn_backend.exception.StorageException;
import com.example.subburn_backend.model.Job;
import com.example.subburn_backend.model.JobWorkspace;
import com.example.subburn_backend.service.events.JobEventPublisher;
import com.example.subburn_backend.service.events.JobEventType;
import com.example.subburn_backend.util.JobStage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.StandardCopyOption;

/**
 * Drives one job through extract audio, transcribe, burn subtitles and publish.
 *
 * <p>Stages run strictly in order on the calling thread. Any stage failure ends the job in
 * {@link JobStage#FAILED}, reported to the subscriber as one {@code error} event plus a mirrored log line;
 * nothing is thrown to the caller. Intermediates are removed on both exits unless
 * {@code pipeline.keep-intermediates-on-failure} is set and the job failed.
 */
@Service
public class SubtitlePipelineOrchestrator {
    private static final Logger LOGGER = LoggerFactory.getLogger(SubtitlePipelineOrchestrator.class);

    private final AudioExtractionEngine audioExtraction;
    private final TranscriptionEngine transcription;
    private final SubtitleBurnEngine subtitleBurn;
    private final JobEventPublisher events;
    private final PipelineProperties properties;

    public SubtitlePipelineOrchestrator(AudioExtractionEngine audioExtraction,
                                        TranscriptionEngine transcription,
                                        SubtitleBurnEngine subtitleBurn,
                                        JobEventPublisher events,
                                        PipelineProperties properties) {
        this.audioExtraction = audioExtraction;
        this.transcription = transcription;
        this.subtitleBurn = subtitleBurn;
        this.events = events;
        this.properties = properties;
    }

    public void run(Job job) {
        long t0 = System.nanoTime();
        LOGGER.info("JOB START jobId={} source={} original={}", job.getId(), job.getSourceVideoPath(), job.getOriginalFilename());
        try {
            extractAudio(job);
            transcribe(job);
            burnSubtitles(job);
            publish(job);
        } catch (PipelineException e) {
            fail(job, e.getMessage(), e);
        } catch (RuntimeException e) {
            fail(job, e.getMessage() != null ? e.getMessage() : e.toString(), e);
        } finally {
            cleanup(job);
            LOGGER.info("JOB {} jobId={} in={}ms", job.getStage() == JobStage.COMPLETED ? "DONE" : "FAILED",
                    job.getId(), (System.nanoTime() - t0) / 1_000_000);
        }
    }

    private void extractAudio(Job job) throws PipelineException {
        enter(job, JobStage.EXTRACTING_AUDIO, "Step 1: Extracting audio...");
        audioExtraction.extractAudio(job.getSourceVideoPath(), job.getWorkspace().audioPath(), job.getSubscriber());
        log(job, "Audio extracted.");
    }

    private void transcribe(Job job) throws PipelineException {
        JobWorkspace ws = job.getWorkspace();
        enter(job, JobStage.TRANSCRIBING, "Step 2: Generating subtitles (Whisper)...");
        transcription.transcribeToSrt(ws.audioPath(), ws.subtitlePath().getParent(), job.getSubscriber());
        if (!Files.exists(ws.subtitlePath())) {
            throw new MissingArtifactException("SRT file was not generated.", ws.subtitlePath());
        }
        log(job, "Subtitles generated.");
    }

    private void burnSubtitles(Job job) throws PipelineException {
        JobWorkspace ws = job.getWorkspace();
        enter(job, JobStage.BURNING, "Step 3: Burning subtitles into video...");
        try {
            Files.copy(ws.subtitlePath(), ws.tempSubtitlePath(), StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new StorageException("Copying subtitles to " + ws.tempSubtitlePath() + " failed", e);
        }
        subtitleBurn.burn(job.getSourceVideoPath(), ws.workDir(), ws.tempSubtitleFileName(), ws.outputVideoPath(), job.getSubscriber());
    }

    private void publish(Job job) {
        JobWorkspace ws = job.getWorkspace();
        try {
            Files.deleteIfExists(ws.tempSubtitlePath());
        } catch (IOException e) {
            LOGGER.warn("Temp subtitle not removed jobId={} path={} err={}", job.getId(), ws.tempSubtitlePath(), e.toString());
        }
        job.advanceTo(JobStage.COMPLETED);
        log(job, "Video processing complete!");
        events.emit(job.getSubscriber(), JobEventType.PROGRESS, job.getProgress());
        events.emit(job.getSubscriber(), JobEventType.COMPLETE, new DownloadReference(downloadUrl(ws)));
    }

    private void fail(Job job, String message, Exception cause) {
        if (cause instanceof PipelineException) {
            LOGGER.warn("Job {} failed in stage={}: {}", job.getId(), job.getStage(), message);
        } else {
            LOGGER.error("Job {} failed in stage={}: {}", job.getId(), job.getStage(), cause.toString(), cause);
        }
        if (job.getStage().isTerminal()) {
            return;
        }
        job.fail(message);
        events.emit(job.getSubscriber(), JobEventType.ERROR, message);
        events.log(job.getSubscriber(), "Error: " + message);
    }

    private void cleanup(Job job) {
        if (job.getStage() == JobStage.FAILED && properties.isKeepIntermediatesOnFailure()) {
            LOGGER.info("Keeping intermediates of failed jobId={} {}", job.getId(), job.getWorkspace());
            return;
        }
        job.getWorkspace().cleanup();
    }

    private void enter(Job job, JobStage stage, String message) {
        job.advanceTo(stage);
        LOGGER.debug("Job {} -> {}", job.getId(), stage);
        log(job, message);
        events.emit(job.getSubscriber(), JobEventType.PROGRESS, job.getProgress());
    }

    private void log(Job job, String message) {
        events.log(job.getSubscriber(), message);
    }

    String downloadUrl(JobWorkspace ws) {
        String prefix = properties.getDownloadPrefix().replaceAll("/+$", "");
        return prefix + "/" + ws.outputFileName();
    }
}
