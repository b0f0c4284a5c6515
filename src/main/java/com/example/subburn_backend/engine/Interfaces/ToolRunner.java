package com.example.subburn_backend.engine.Interfaces;

import com.example.subburn_backend.engine.ToolCommand;
import com.example.subburn_backend.exception.ToolInvocationException;
import com.example.subburn_backend.service.events.SubscriberHandle;
import org.springframework.lang.Nullable;

public interface ToolRunner {

    /**
     * Runs the command as a child process and blocks the calling thread until it exits.
     *
     * @param subscriber receives {@code log("Error: <message>")} when the run fails; may be {@code null}
     * @return captured standard output
     * @throws ToolInvocationException on spawn failure, timeout, interruption or non-zero exit
     */
    String run(ToolCommand command, @Nullable SubscriberHandle subscriber) throws ToolInvocationException;
}
