package com.aiwriter.schedule.routing;

import com.aiwriter.schedule.core.model.DomainEvent;
import reactor.core.publisher.Mono;

/**
 * Target of an {@link EventRoute}.
 */
@FunctionalInterface
public interface DomainEventHandler {

    Mono<Void> handle(DomainEvent event);
}
