package com.example.subburn_backend.service.events;

import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;

/**
 * Subscriber backed by a Server-Sent Events stream.
 */
class SseSubscriberHandle implements SubscriberHandle {
    private final String id;
    private final SseEmitter emitter;
    private volatile boolean open = true;

    SseSubscriberHandle(String id, SseEmitter emitter) {
        this.id = id;
        this.emitter = emitter;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    // SseEmitter does not allow concurrent sends
    @Override
    public synchronized void deliver(JobEvent event) throws IOException {
        if (!open) {
            return;
        }
        try {
            emitter.send(SseEmitter.event().name(event.type().eventName()).data(event.payload()));
        } catch (IOException | IllegalStateException e) {
            open = false;
            throw e;
        }
    }

    synchronized void ping() throws IOException {
        if (!open) {
            return;
        }
        try {
            emitter.send(SseEmitter.event().comment("ping"));
        } catch (IOException | IllegalStateException e) {
            open = false;
            throw e;
        }
    }

    SseEmitter emitter() {
        return emitter;
    }

    void close() {
        open = false;
    }
}
