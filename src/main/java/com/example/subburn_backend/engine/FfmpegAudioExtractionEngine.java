package com.example.subburn_backend.engine;

import com.example.subburn_backend.engine.Interfaces.AudioExtractionEngine;
import com.example.subburn_backend.engine.Interfaces.ToolRunner;
import com.example.subburn_backend.exception.ToolInvocationException;
import com.example.subburn_backend.service.events.SubscriberHandle;
import org.springframework.lang.Nullable;

import java.nio.file.Path;
import java.util.List;

public class FfmpegAudioExtractionEngine implements AudioExtractionEngine {
    static final int SAMPLE_RATE = 16_000;

    private final ToolRunner toolRunner;
    private final String ffmpegBin;

    public FfmpegAudioExtractionEngine(ToolRunner toolRunner, String ffmpegBin) {
        this.toolRunner = toolRunner;
        this.ffmpegBin = ffmpegBin != null ? ffmpegBin : "ffmpeg";
    }

    @Override
    public void extractAudio(Path sourceVideo, Path audioTarget, @Nullable SubscriberHandle subscriber) throws ToolInvocationException {
        toolRunner.run(ToolCommand.of("ffmpeg", List.of(
                ffmpegBin, "-y",
                "-i", sourceVideo.toAbsolutePath().toString(),
                "-ar", String.valueOf(SAMPLE_RATE),
                "-ac", "1",
                "-c:a", "pcm_s16le",
                audioTarget.toAbsolutePath().toString()
        )), subscriber);
    }
}
