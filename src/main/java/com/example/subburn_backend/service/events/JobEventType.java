package com.example.subburn_backend.service.events;

public enum JobEventType {
    LOG("log"),
    PROGRESS("progress"),
    COMPLETE("complete"),
    ERROR("error");

    private final String eventName;

    JobEventType(String eventName) {
        this.eventName = eventName;
    }

    /** Name the event is sent under on the subscriber's stream. */
    public String eventName() {
        return eventName;
    }
}
