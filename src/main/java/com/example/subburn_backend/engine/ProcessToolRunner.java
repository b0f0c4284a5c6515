package com.example.subburn_backend.engine;

import com.example.subburn_backend.engine.Interfaces.ToolRunner;
import com.example.subburn_backend.exception.ToolInvocationException;
import com.example.subburn_backend.service.events.JobEventPublisher;
import com.example.subburn_backend.service.events.SubscriberHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.StringJoiner;
import java.util.concurrent.TimeUnit;

public class ProcessToolRunner implements ToolRunner {
    private static final Logger LOGGER = LoggerFactory.getLogger(ProcessToolRunner.class);
    private static final int LOG_SNIPPET_MAX = 4_000;

    private final JobEventPublisher publisher;
    private final Duration timeout;
    private final @Nullable String extraPath;

    public ProcessToolRunner(JobEventPublisher publisher, Duration timeout, @Nullable String extraPath) {
        this.publisher = publisher;
        this.timeout = timeout != null ? timeout : Duration.ofHours(1);
        this.extraPath = (extraPath == null || extraPath.isBlank()) ? null : extraPath;
    }

    @Override
    public String run(ToolCommand command, @Nullable SubscriberHandle subscriber) throws ToolInvocationException {
        try {
            return execute(command);
        } catch (ToolInvocationException e) {
            LOGGER.warn("Tool failed tool={} exit={} msg={}", command.toolName(), e.getExitCode(), e.getMessage());
            publisher.log(subscriber, "Error: " + e.getMessage());
            throw e;
        }
    }

    private String execute(ToolCommand command) throws ToolInvocationException {
        LOGGER.info("Exec tool={} cmd={}", command.toolName(), command.commandLine());
        Process process;
        try {
            process = start(command);
        } catch (IOException e) {
            throw new ToolInvocationException(command.toolName(),
                    "Failed to start " + command.toolName() + ": " + e.getMessage(), e);
        }

        StringJoiner out = new StringJoiner(System.lineSeparator());
        StringJoiner err = new StringJoiner(System.lineSeparator());
        Thread tOut = drain(process.getInputStream(), out, command.toolName() + "-out");
        Thread tErr = drain(process.getErrorStream(), err, command.toolName() + "-err");

        try {
            boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                process.waitFor(5, TimeUnit.SECONDS);
                tOut.join(1_000);
                tErr.join(1_000);
                throw new ToolInvocationException(command.toolName(), ToolInvocationException.NO_EXIT_CODE,
                        command.toolName() + " timed out after " + timeout, truncate(err.toString()));
            }
            tOut.join();
            tErr.join();
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new ToolInvocationException(command.toolName(), "Interrupted while waiting for " + command.toolName(), e);
        }

        int code = process.exitValue();
        if (code != 0) {
            String diagnostics = err.length() > 0 ? err.toString() : out.toString();
            throw new ToolInvocationException(command.toolName(), code,
                    "Command failed: " + command.toolName() + " exited with code " + code + lastLine(diagnostics),
                    truncate(diagnostics));
        }
        LOGGER.debug("Tool done tool={} exit=0", command.toolName());
        return out.toString();
    }

    /**
     * Starts the child process. Environment additions and {@code extraPath} apply to this child only.
     */
    protected Process start(ToolCommand command) throws IOException {
        ProcessBuilder pb = new ProcessBuilder(command.argv()).redirectErrorStream(false);
        if (command.workingDir() != null) {
            pb.directory(command.workingDir().toFile());
        }
        Map<String, String> env = pb.environment();
        env.putAll(command.environment());
        if (extraPath != null) {
            String current = env.get("PATH");
            env.put("PATH", current == null || current.isEmpty() ? extraPath : extraPath + File.pathSeparator + current);
        }
        return pb.start();
    }

    private static Thread drain(InputStream stream, StringJoiner sink, String name) {
        Thread t = new Thread(() -> {
            try (var br = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
                String line;
                while ((line = br.readLine()) != null) {
                    LOGGER.debug("[{}] {}", name, line);
                    sink.add(line);
                }
            } catch (IOException e) {
                // stream closes when the process is destroyed; exit code decides the outcome
                LOGGER.trace("Stream {} closed: {}", name, e.toString());
            }
        }, name);
        t.setDaemon(true);
        t.start();
        return t;
    }

    private static String lastLine(String output) {
        if (output == null || output.isBlank()) {
            return "";
        }
        String[] lines = output.strip().split("\\R");
        return ": " + lines[lines.length - 1];
    }

    private static String truncate(String output) {
        if (output == null || output.isBlank()) {
            return "<no output>";
        }
        if (output.length() <= LOG_SNIPPET_MAX) {
            return output;
        }
        return "..." + output.substring(output.length() - LOG_SNIPPET_MAX);
    }
}
