package com.example.subburn_backend.service.events;

import com.example.subburn_backend.testutil.RecordingSubscriber;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class JobEventPublisherTest {

    private final JobEventPublisher publisher = new JobEventPublisher();

    @Test
    void deliversTypedEventToOpenSubscriber() {
        RecordingSubscriber sub = new RecordingSubscriber("a");

        publisher.emit(sub, JobEventType.PROGRESS, 30);
        publisher.log(sub, "Audio extracted.");

        assertThat(sub.events()).containsExactly(
                new JobEvent(JobEventType.PROGRESS, 30),
                new JobEvent(JobEventType.LOG, "Audio extracted."));
    }

    @Test
    void dropsEventsForMissingOrClosedSubscriber() {
        RecordingSubscriber closed = new RecordingSubscriber("b");
        closed.close();

        assertThatCode(() -> publisher.emit(null, JobEventType.LOG, "x")).doesNotThrowAnyException();
        publisher.emit(closed, JobEventType.LOG, "x");

        assertThat(closed.events()).isEmpty();
    }

    @Test
    void deliveryFailureIsNotPropagated() {
        SubscriberHandle broken = new SubscriberHandle() {
            @Override
            public String id() {
                return "broken";
            }

            @Override
            public boolean isOpen() {
                return true;
            }

            @Override
            public void deliver(JobEvent event) throws IOException {
                throw new IOException("Broken pipe");
            }
        };

        assertThatCode(() -> publisher.emit(broken, JobEventType.ERROR, "boom")).doesNotThrowAnyException();
    }

    @Test
    void eventNamesMatchTheStreamProtocol() {
        assertThat(JobEventType.LOG.eventName()).isEqualTo("log");
        assertThat(JobEventType.PROGRESS.eventName()).isEqualTo("progress");
        assertThat(JobEventType.COMPLETE.eventName()).isEqualTo("complete");
        assertThat(JobEventType.ERROR.eventName()).isEqualTo("error");
    }
}
