package com.aiwriter.schedule.support;

import com.aiwriter.schedule.core.port.EventBusPublisher;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;

/**
 * Captures publishes; optionally fails every call.
 */
public class RecordingEventBusPublisher implements EventBusPublisher {

    public record Published(String subject, String messageId, byte[] body) {}

    private final List<Published> published = new ArrayList<>();
    private RuntimeException failure;

    public RecordingEventBusPublisher failWith(RuntimeException failure) {
        this.failure = failure;
        return this;
    }

    @Override
    public synchronized Mono<Void> publish(String subject, String messageId, byte[] body) {
        if (failure != null) {
            return Mono.error(failure);
        }
        published.add(new Published(subject, messageId, body));
        return Mono.empty();
    }

    public synchronized List<Published> published() {
        return List.copyOf(published);
    }
}
