package com.example.subburn_backend.engine;

import com.example.subburn_backend.engine.Interfaces.ToolRunner;
import com.example.subburn_backend.exception.ToolInvocationException;
import com.example.subburn_backend.testutil.RecordingSubscriber;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class FfmpegAudioExtractionEngineTest {

    @Mock
    private ToolRunner toolRunner;

    @Test
    void extractsMono16kPcmWav() throws Exception {
        RecordingSubscriber subscriber = new RecordingSubscriber("s");
        Path src = Path.of("/data/uploads/1700000000000-movie.mp4");
        Path wav = Path.of("/data/uploads/1700000000000-movie.wav");

        new FfmpegAudioExtractionEngine(toolRunner, "/usr/local/bin/ffmpeg").extractAudio(src, wav, subscriber);

        ArgumentCaptor<ToolCommand> cmd = ArgumentCaptor.forClass(ToolCommand.class);
        verify(toolRunner).run(cmd.capture(), eq(subscriber));
        assertThat(cmd.getValue().toolName()).isEqualTo("ffmpeg");
        assertThat(cmd.getValue().argv()).containsExactly(
                "/usr/local/bin/ffmpeg", "-y",
                "-i", src.toString(),
                "-ar", "16000",
                "-ac", "1",
                "-c:a", "pcm_s16le",
                wav.toString());
        assertThat(cmd.getValue().workingDir()).isNull();
    }

    @Test
    void propagatesToolFailure() throws Exception {
        when(toolRunner.run(any(), any())).thenThrow(new ToolInvocationException("ffmpeg", 1, "Command failed: ffmpeg exited with code 1", "bad input"));

        assertThatThrownBy(() -> new FfmpegAudioExtractionEngine(toolRunner, null)
                .extractAudio(Path.of("/a.mp4"), Path.of("/a.wav"), null))
                .isInstanceOf(ToolInvocationException.class)
                .hasMessageContaining("exited with code 1");
    }
}
