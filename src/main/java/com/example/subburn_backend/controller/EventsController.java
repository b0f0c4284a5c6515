package com.example.subburn_backend.controller;

import com.example.subburn_backend.service.events.SubscriberRegistry;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * Event stream a client opens before uploading; the same id goes along with the upload as {@code subscriberId}.
 */
@RestController
public class EventsController {
    private final SubscriberRegistry subscribers;

    public EventsController(SubscriberRegistry subscribers) {
        this.subscribers = subscribers;
    }

    @GetMapping(value = "/events/{subscriberId}", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter subscribe(@PathVariable String subscriberId) {
        return subscribers.subscribe(subscriberId);
    }
}
