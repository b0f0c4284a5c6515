package com.example.subburn_backend.engine;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One external tool invocation. {@code argv} holds the executable followed by its arguments, one element per
 * argument, so paths never pass through a shell.
 *
 * @param workingDir  directory the process runs in, or {@code null} for the JVM's
 * @param environment variables added to the child's environment only
 */
public record ToolCommand(String toolName, List<String> argv, Path workingDir, Map<String, String> environment) {

    public ToolCommand {
        Objects.requireNonNull(toolName, "toolName");
        if (argv == null || argv.isEmpty()) {
            throw new IllegalArgumentException("argv must contain at least the executable");
        }
        argv = List.copyOf(argv);
        environment = environment == null ? Map.of() : Map.copyOf(environment);
    }

    public static ToolCommand of(String toolName, List<String> argv) {
        return new ToolCommand(toolName, argv, null, Map.of());
    }

    public ToolCommand inDirectory(Path dir) {
        return new ToolCommand(toolName, argv, dir, environment);
    }

    public ToolCommand withEnvironment(Map<String, String> env) {
        return new ToolCommand(toolName, argv, workingDir, env);
    }

    /** Human readable form for logs; not meant to be executed. */
    public String commandLine() {
        return String.join(" ", argv);
    }
}
