package com.aiwriter.schedule.core.port;

import reactor.core.publisher.Mono;

/**
 * Publishes opaque bytes to a bus subject.
 *
 * <p>{@code messageId} is used by the transport for de-duplication: publishing
 * twice with the same id inside the de-dup window stores one message. A
 * completed Mono means the transport persisted the message, not that anyone
 * consumed it.</p>
 */
public interface EventBusPublisher {

    Mono<Void> publish(String subject, String messageId, byte[] body);
}
