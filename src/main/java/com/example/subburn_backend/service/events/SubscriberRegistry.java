package com.example.subburn_backend.service.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Connected event subscribers by client-chosen id. Consulted only at upload time; the pipeline gets the handle itself.
 */
@Service
public class SubscriberRegistry {
    private static final Logger LOGGER = LoggerFactory.getLogger(SubscriberRegistry.class);

    private final Map<String, SseSubscriberHandle> subscribers = new ConcurrentHashMap<>();
    private final long emitterTimeoutMs;

    public SubscriberRegistry(@Value("${events.emitter-timeout-ms:0}") long emitterTimeoutMs) {
        this.emitterTimeoutMs = emitterTimeoutMs;
    }

    public SseEmitter subscribe(String subscriberId) {
        if (subscriberId == null || subscriberId.isBlank()) {
            throw new IllegalArgumentException("subscriberId is required");
        }
        SseEmitter emitter = new SseEmitter(emitterTimeoutMs);
        SseSubscriberHandle handle = new SseSubscriberHandle(subscriberId, emitter);

        SseSubscriberHandle previous = subscribers.put(subscriberId, handle);
        if (previous != null) {
            previous.close();
            previous.emitter().complete();
        }

        emitter.onCompletion(() -> disconnect(handle, "completed"));
        emitter.onTimeout(() -> disconnect(handle, "timeout"));
        emitter.onError(ex -> disconnect(handle, "error: " + ex.getMessage()));

        LOGGER.info("Subscriber connected id={} connected={}", subscriberId, connectedCount());
        return emitter;
    }

    public Optional<SubscriberHandle> resolve(String subscriberId) {
        if (subscriberId == null || subscriberId.isBlank()) {
            return Optional.empty();
        }
        SseSubscriberHandle handle = subscribers.get(subscriberId);
        if (handle == null || !handle.isOpen()) {
            return Optional.empty();
        }
        return Optional.of(handle);
    }

    public int connectedCount() {
        return subscribers.size();
    }

    /**
     * Sends an SSE comment to every stream. A client that went away without closing cleanly fails the write
     * and is dropped here instead of lingering until its next job event.
     */
    @Scheduled(fixedDelayString = "${events.heartbeat-interval-ms:15000}")
    public void heartbeat() {
        for (SseSubscriberHandle handle : subscribers.values()) {
            try {
                handle.ping();
            } catch (IOException | IllegalStateException e) {
                disconnect(handle, "heartbeat failed: " + e.getMessage());
            }
        }
    }

    private void disconnect(SseSubscriberHandle handle, String reason) {
        handle.close();
        if (subscribers.remove(handle.id(), handle)) {
            LOGGER.info("Subscriber disconnected id={} reason={} connected={}", handle.id(), reason, connectedCount());
        }
    }
}
