package com.example.subburn_backend.engine.Interfaces;

import com.example.subburn_backend.exception.ToolInvocationException;
import com.example.subburn_backend.service.events.SubscriberHandle;
import org.springframework.lang.Nullable;

import java.nio.file.Path;

public interface TranscriptionEngine {

    /**
     * Transcribes {@code audio} into an srt file inside {@code outputDir}, named after the audio file's base name.
     * Whether the file actually appeared is for the caller to check.
     */
    void transcribeToSrt(Path audio, Path outputDir, @Nullable SubscriberHandle subscriber) throws ToolInvocationException;
}
