package com.example.subburn_backend.service.events;

import java.io.IOException;

/**
 * Live connection of the client waiting for a job's events.
 *
 * <p>Handed from the upload request to the pipeline; delivery happens on a worker thread.
 */
public interface SubscriberHandle {

    String id();

    /** {@code false} once the client went away; delivery is skipped from then on. */
    boolean isOpen();

    void deliver(JobEvent event) throws IOException;
}
