package com.example.subburn_backend.service.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Sends job events to the job's subscriber. Never throws: a missing or closed subscriber only costs the event.
 */
@Component
public class JobEventPublisher {
    private static final Logger LOGGER = LoggerFactory.getLogger(JobEventPublisher.class);

    public void emit(@Nullable SubscriberHandle subscriber, JobEventType type, Object payload) {
        if (subscriber == null) {
            LOGGER.trace("No subscriber, dropping {}", type);
            return;
        }
        if (!subscriber.isOpen()) {
            LOGGER.debug("Subscriber id={} closed, dropping {}", subscriber.id(), type);
            return;
        }
        try {
            subscriber.deliver(new JobEvent(type, payload));
        } catch (IOException | RuntimeException e) {
            LOGGER.debug("Event delivery failed subscriber={} type={} err={}", subscriber.id(), type, e.toString());
        }
    }

    public void log(@Nullable SubscriberHandle subscriber, String message) {
        emit(subscriber, JobEventType.LOG, message);
    }
}
