package com.example.subburn_backend.config;

import com.example.subburn_backend.engine.FfmpegAudioExtractionEngine;
import com.example.subburn_backend.engine.FfmpegSubtitleBurnEngine;
import com.example.subburn_backend.engine.ProcessToolRunner;
import com.example.subburn_backend.engine.WhisperCliTranscriptionEngine;
import com.example.subburn_backend.engine.Interfaces.AudioExtractionEngine;
import com.example.subburn_backend.engine.Interfaces.SubtitleBurnEngine;
import com.example.subburn_backend.engine.Interfaces.ToolRunner;
import com.example.subburn_backend.engine.Interfaces.TranscriptionEngine;
import com.example.subburn_backend.service.events.JobEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class EngineConfig {

    @Bean
    public ToolRunner toolRunner(JobEventPublisher publisher, ToolProperties tools) {
        return new ProcessToolRunner(
                publisher,
                Duration.ofSeconds(Math.max(1, tools.getTimeoutSeconds())),
                tools.getExtraPath()
        );
    }

    @Bean
    public AudioExtractionEngine audioExtractionEngine(ToolRunner toolRunner, ToolProperties tools) {
        return new FfmpegAudioExtractionEngine(toolRunner, tools.getFfmpegBinary());
    }

    @Bean
    public TranscriptionEngine transcriptionEngine(ToolRunner toolRunner, ToolProperties tools) {
        return new WhisperCliTranscriptionEngine(toolRunner, tools.getWhisperBinary(), tools.getWhisperModel());
    }

    @Bean
    public SubtitleBurnEngine subtitleBurnEngine(ToolRunner toolRunner, ToolProperties tools, SubtitleStyleProperties style) {
        return new FfmpegSubtitleBurnEngine(toolRunner, tools.getFfmpegBinary(), style.toStyle());
    }
}
