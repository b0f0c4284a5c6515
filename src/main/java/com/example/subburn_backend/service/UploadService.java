package com.example.subburn_backend.service;

import com.example.subburn_backend.dto.web.UploadAcceptedResponse;
import com.example.subburn_backend.exception.IngressValidationException;
import com.example.subburn_backend.exception.PipelineBusyException;
import com.example.subburn_backend.model.Job;
import com.example.subburn_backend.service.Interfaces.StorageService;
import com.example.subburn_backend.service.events.JobEventPublisher;
import com.example.subburn_backend.service.events.SubscriberHandle;
import com.example.subburn_backend.service.events.SubscriberRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.nio.file.Path;
import java.time.Clock;
import java.util.UUID;

@Service
public class UploadService {
    private static final Logger LOGGER = LoggerFactory.getLogger(UploadService.class);
    static final String ACCEPTED_MESSAGE = "Upload successful, processing started";

    private final StorageService storageService;
    private final SubscriberRegistry subscribers;
    private final JobEventPublisher events;
    private final JobLauncher jobLauncher;
    private final Clock clock;

    public UploadService(StorageService storageService, SubscriberRegistry subscribers, JobEventPublisher events, JobLauncher jobLauncher, Clock clock) {
        this.storageService = storageService;
        this.subscribers = subscribers;
        this.events = events;
        this.jobLauncher = jobLauncher;
        this.clock = clock;
    }

    /**
     * Stores the upload, starts its pipeline in the background and returns at once.
     * The acknowledgement only means processing started; the outcome arrives on the subscriber's stream.
     */
    public UploadAcceptedResponse accept(MultipartFile file, String subscriberId) {
        if (file == null || file.isEmpty()) {
            throw new IngressValidationException("FILE_MISSING", "No file uploaded");
        }
        String storedName = clock.millis() + "-" + uniqueTag() + "-" + sanitizeFilename(file.getOriginalFilename());
        if (WorkspaceManager.isReservedUploadName(storedName)) {
            throw new IngressValidationException("UNSUPPORTED_FILE", "A .wav file cannot be used as the source video");
        }
        Path stored = storageService.storeUpload(file, storedName);

        SubscriberHandle subscriber = subscribers.resolve(subscriberId).orElse(null);
        if (subscriber == null) {
            LOGGER.warn("Subscriber not found for id={}, job runs without events", subscriberId);
        } else {
            events.log(subscriber, "Received file. Starting process...");
        }

        Job job;
        try {
            job = jobLauncher.launch(stored, file.getOriginalFilename(), subscriber);
        } catch (PipelineBusyException e) {
            storageService.deleteUpload(storedName);
            throw e;
        }
        LOGGER.info("INGEST upload stored={} jobId={} size={}", stored, job.getId(), file.getSize());
        return new UploadAcceptedResponse(ACCEPTED_MESSAGE, job.getId());
    }

    /** Random part of the stored name; two uploads of the same file in the same millisecond still differ. */
    static String uniqueTag() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    /**
     * Last path segment of the client's file name with anything outside {@code [A-Za-z0-9._-]} replaced.
     * The stored name, and so the job id, never carries client-controlled separators or quotes.
     */
    static String sanitizeFilename(String originalFilename) {
        if (originalFilename == null || originalFilename.isBlank()) {
            return "upload.mp4";
        }
        String name = originalFilename.replace('\\', '/');
        name = name.substring(name.lastIndexOf('/') + 1);
        name = name.replaceAll("[^A-Za-z0-9._-]", "_");
        return name.isBlank() ? "upload.mp4" : name;
    }
}
