package com.example.subburn_backend.engine;

import com.example.subburn_backend.engine.Interfaces.ToolRunner;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class WhisperCliTranscriptionEngineTest {

    @Mock
    private ToolRunner toolRunner;

    @Test
    void writesSrtIntoOutputDirWithConfiguredModel() throws Exception {
        Path wav = Path.of("/data/uploads/clip.wav");
        Path outputs = Path.of("/data/outputs");

        new WhisperCliTranscriptionEngine(toolRunner, "whisper", "small").transcribeToSrt(wav, outputs, null);

        ArgumentCaptor<ToolCommand> cmd = ArgumentCaptor.forClass(ToolCommand.class);
        verify(toolRunner).run(cmd.capture(), isNull());
        assertThat(cmd.getValue().toolName()).isEqualTo("whisper");
        assertThat(cmd.getValue().argv()).containsExactly(
                "whisper", wav.toString(),
                "--model", "small",
                "--output_format", "srt",
                "--output_dir", outputs.toString());
    }

    @Test
    void defaultsToBaseModel() throws Exception {
        new WhisperCliTranscriptionEngine(toolRunner, null, null)
                .transcribeToSrt(Path.of("/w/a.wav"), Path.of("/w/out"), null);

        ArgumentCaptor<ToolCommand> cmd = ArgumentCaptor.forClass(ToolCommand.class);
        verify(toolRunner).run(cmd.capture(), isNull());
        assertThat(cmd.getValue().argv()).startsWith("whisper").contains("base");
    }
}
