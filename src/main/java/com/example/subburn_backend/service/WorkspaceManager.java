package com.example.subburn_backend.service;

import com.example.subburn_backend.model.JobWorkspace;
import com.example.subburn_backend.service.Interfaces.StorageService;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Derives a job id from the stored upload name and lays out the job's files.
 *
 * <p>All paths are pure functions of the id and the storage roots:
 * <ul>
 *     <li>audio: {@code <uploads>/<id>.wav}</li>
 *     <li>subtitles: {@code <outputs>/<id>.srt}, the name Whisper gives its srt output for {@code <id>.wav}</li>
 *     <li>rendered video: {@code <outputs>/subtitled_<id>.mp4}</li>
 *     <li>temporary subtitle copy: {@code <work>/temp_<id>.srt}</li>
 * </ul>
 */
@Service
public class WorkspaceManager {
    private static final Pattern SAFE_ID = Pattern.compile("[A-Za-z0-9._-]+");

    static final String AUDIO_EXTENSION = ".wav";
    static final String OUTPUT_PREFIX = "subtitled_";
    static final String TEMP_SUBTITLE_PREFIX = "temp_";

    private final StorageService storage;

    public WorkspaceManager(StorageService storage) {
        this.storage = storage;
    }

    public JobWorkspace allocate(Path storedUpload) {
        if (storedUpload == null || storedUpload.getFileName() == null) {
            throw new IllegalArgumentException("stored upload path is required");
        }
        JobWorkspace ws = forJobId(jobIdOf(storedUpload.getFileName().toString()));
        for (Path derived : List.of(ws.audioPath(), ws.subtitlePath(), ws.tempSubtitlePath(), ws.outputVideoPath())) {
            if (aliases(storedUpload, derived)) {
                throw new IllegalArgumentException("Stored upload " + storedUpload + " would be overwritten by job file " + derived);
            }
        }
        return ws;
    }

    public JobWorkspace forJobId(String jobId) {
        requireSafe(jobId);
        return new JobWorkspace(
                jobId,
                storage.rootWork(),
                storage.resolveUpload(jobId + AUDIO_EXTENSION),
                storage.resolveOutput(jobId + ".srt"),
                storage.rootWork().resolve(TEMP_SUBTITLE_PREFIX + jobId + ".srt"),
                storage.resolveOutput(OUTPUT_PREFIX + jobId + ".mp4")
        );
    }

    /**
     * File name without its trailing extension. A leading dot does not start an extension.
     */
    public static String jobIdOf(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }

    /**
     * True when an upload stored under {@code storedName} would share its path with the job's extracted audio.
     */
    public static boolean isReservedUploadName(String storedName) {
        return storedName.toLowerCase(Locale.ROOT).endsWith(AUDIO_EXTENSION) && storedName.lastIndexOf('.') > 0;
    }

    // case-insensitive file systems treat song.WAV and song.wav as one file
    private static boolean aliases(Path a, Path b) {
        Path pa = a.toAbsolutePath().normalize();
        Path pb = b.toAbsolutePath().normalize();
        return Objects.equals(pa.getParent(), pb.getParent())
                && pa.getFileName().toString().equalsIgnoreCase(pb.getFileName().toString());
    }

    private static void requireSafe(String jobId) {
        if (jobId == null || !SAFE_ID.matcher(jobId).matches() || jobId.equals(".") || jobId.equals("..")) {
            throw new IllegalArgumentException("Job id is not a safe file name component: " + jobId);
        }
    }
}
