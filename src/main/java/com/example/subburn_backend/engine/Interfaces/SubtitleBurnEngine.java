package com.example.subburn_backend.engine.Interfaces;

import com.example.subburn_backend.exception.ToolInvocationException;
import com.example.subburn_backend.service.events.SubscriberHandle;
import org.springframework.lang.Nullable;

import java.nio.file.Path;

public interface SubtitleBurnEngine {

    /**
     * Renders {@code sourceVideo} with the subtitles burned in.
     *
     * @param subtitleFileName srt file name relative to {@code workDir}
     */
    void burn(Path sourceVideo, Path workDir, String subtitleFileName, Path outputVideo,
              @Nullable SubscriberHandle subscriber) throws ToolInvocationException;
}
