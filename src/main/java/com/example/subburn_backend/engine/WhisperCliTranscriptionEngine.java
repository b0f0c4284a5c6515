package com.example.subburn_backend.engine;

import com.example.subburn_backend.engine.Interfaces.ToolRunner;
import com.example.subburn_backend.engine.Interfaces.TranscriptionEngine;
import com.example.subburn_backend.exception.ToolInvocationException;
import com.example.subburn_backend.service.events.SubscriberHandle;
import org.springframework.lang.Nullable;

import java.nio.file.Path;
import java.util.List;

/**
 * Runs the openai-whisper command line tool. Whisper names its output {@code <audio base name>.srt}.
 */
public class WhisperCliTranscriptionEngine implements TranscriptionEngine {

    private final ToolRunner toolRunner;
    private final String whisperCmd;
    private final String whisperModel;

    public WhisperCliTranscriptionEngine(ToolRunner toolRunner, String whisperCmd, String whisperModel) {
        this.toolRunner = toolRunner;
        this.whisperCmd = whisperCmd != null ? whisperCmd : "whisper";
        this.whisperModel = whisperModel != null ? whisperModel : "base";
    }

    @Override
    public void transcribeToSrt(Path audio, Path outputDir, @Nullable SubscriberHandle subscriber) throws ToolInvocationException {
        toolRunner.run(ToolCommand.of("whisper", List.of(
                whisperCmd,
                audio.toAbsolutePath().toString(),
                "--model", whisperModel,
                "--output_format", "srt",
                "--output_dir", outputDir.toAbsolutePath().toString()
        )), subscriber);
    }
}
