package com.aiwriter.schedule.routing;

import com.aiwriter.schedule.core.model.DomainEvent;

import java.util.Objects;

/**
 * Binds an exact (source, detailType) pair to a handler.
 */
public record EventRoute(String name, String source, String detailType, DomainEventHandler handler) {

    public EventRoute {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(detailType, "detailType");
        Objects.requireNonNull(handler, "handler");
    }

    public boolean matches(DomainEvent event) {
        return source.equals(event.source()) && detailType.equals(event.detailType());
    }
}
