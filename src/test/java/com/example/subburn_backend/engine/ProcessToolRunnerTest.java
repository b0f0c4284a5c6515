package com.example.subburn_backend.engine;

import com.example.subburn_backend.exception.ToolInvocationException;
import com.example.subburn_backend.service.events.JobEventPublisher;
import com.example.subburn_backend.service.events.JobEventType;
import com.example.subburn_backend.testutil.RecordingSubscriber;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertThrows;

@EnabledOnOs({OS.LINUX, OS.MAC})
class ProcessToolRunnerTest {

    private final JobEventPublisher publisher = new JobEventPublisher();
    private final RecordingSubscriber subscriber = new RecordingSubscriber("sub-1");

    private ProcessToolRunner runner(Duration timeout, String extraPath) {
        return new ProcessToolRunner(publisher, timeout, extraPath);
    }

    private static ToolCommand shell(String script) {
        return ToolCommand.of("sh", List.of("sh", "-c", script));
    }

    @Test
    void returnsStdoutOnSuccess() throws Exception {
        String out = runner(Duration.ofSeconds(10), null).run(shell("echo hello; echo world"), subscriber);

        assertThat(out).isEqualTo("hello" + System.lineSeparator() + "world");
        assertThat(subscriber.events()).isEmpty();
    }

    @Test
    void nonZeroExitCarriesExitCodeAndLastStderrLine() {
        ToolInvocationException ex = assertThrows(ToolInvocationException.class,
                () -> runner(Duration.ofSeconds(10), null).run(shell("echo first >&2; echo boom >&2; exit 3"), subscriber));

        assertThat(ex.getExitCode()).isEqualTo(3);
        assertThat(ex.getToolName()).isEqualTo("sh");
        assertThat(ex.getMessage()).isEqualTo("Command failed: sh exited with code 3: boom");
        assertThat(ex.getDiagnostics()).contains("first").contains("boom");
        assertThat(subscriber.payloads(JobEventType.LOG)).containsExactly("Error: " + ex.getMessage());
    }

    @Test
    void missingExecutableFailsToStart() {
        ToolCommand cmd = ToolCommand.of("ffmpeg", List.of("/nonexistent/bin/ffmpeg-missing", "-version"));

        ToolInvocationException ex = assertThrows(ToolInvocationException.class,
                () -> runner(Duration.ofSeconds(10), null).run(cmd, subscriber));

        assertThat(ex.getExitCode()).isEqualTo(ToolInvocationException.NO_EXIT_CODE);
        assertThat(ex.getMessage()).startsWith("Failed to start ffmpeg");
        assertThat(subscriber.payloads(JobEventType.LOG)).hasSize(1);
    }

    @Test
    void failureWithoutSubscriberStillThrows() {
        assertThatThrownBy(() -> runner(Duration.ofSeconds(10), null).run(shell("exit 1"), null))
                .isInstanceOf(ToolInvocationException.class)
                .hasMessage("Command failed: sh exited with code 1");
    }

    @Test
    void environmentAdditionsReachTheChild() throws Exception {
        ToolCommand cmd = shell("printf %s \"$SUBBURN_TEST_VAR\"").withEnvironment(Map.of("SUBBURN_TEST_VAR", "injected"));

        assertThat(runner(Duration.ofSeconds(10), null).run(cmd, subscriber)).isEqualTo("injected");
        assertThat(System.getenv("SUBBURN_TEST_VAR")).isNull();
    }

    @Test
    void extraPathIsPrependedForTheChildOnly() throws Exception {
        String extra = "/opt/subburn-test-bin";
        String childPath = runner(Duration.ofSeconds(10), extra).run(shell("printf %s \"$PATH\""), subscriber);

        assertThat(childPath).startsWith(extra + ":");
        assertThat(System.getenv("PATH")).doesNotContain(extra);
    }

    @Test
    void runsInTheRequestedWorkingDirectory(@TempDir Path dir) throws Exception {
        String pwd = runner(Duration.ofSeconds(10), null).run(shell("pwd -P").inDirectory(dir), subscriber);

        assertThat(Path.of(pwd).toRealPath()).isEqualTo(dir.toRealPath());
    }

    @Test
    void slowToolTimesOut() {
        ToolInvocationException ex = assertThrows(ToolInvocationException.class,
                () -> runner(Duration.ofMillis(300), null).run(shell("sleep 5"), subscriber));

        assertThat(ex.getMessage()).contains("timed out");
        assertThat(ex.getExitCode()).isEqualTo(ToolInvocationException.NO_EXIT_CODE);
    }
}
