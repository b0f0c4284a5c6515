package com.example.subburn_backend.engine.Interfaces;

import com.example.subburn_backend.exception.ToolInvocationException;
import com.example.subburn_backend.service.events.SubscriberHandle;
import org.springframework.lang.Nullable;

import java.nio.file.Path;

public interface AudioExtractionEngine {

    /** Writes the source's audio track as 16 kHz mono 16-bit PCM wav to {@code audioTarget}. */
    void extractAudio(Path sourceVideo, Path audioTarget, @Nullable SubscriberHandle subscriber) throws ToolInvocationException;
}
