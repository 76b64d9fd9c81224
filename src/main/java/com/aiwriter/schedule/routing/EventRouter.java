package com.aiwriter.schedule.routing;

import com.aiwriter.schedule.core.model.DomainEvent;
import com.aiwriter.schedule.core.port.AuditSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * =====================================================================
 * EventRouter
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Delivers every bus event to:
 *  - the audit sink, unconditionally
 *  - every route whose (source, detailType) matches exactly
 *
 * FAN-OUT
 * -------
 * Matching routes are independent; there is no priority and no
 * "first match wins". All matching routes run even when an earlier one
 * fails; the failures are reported together once all have finished.
 *
 * An audit sink failure is logged and never affects the routes.
 */
public class EventRouter {

    private static final Logger log = LoggerFactory.getLogger(EventRouter.class);

    private final List<EventRoute> routes;
    private final AuditSink auditSink;

    public EventRouter(List<EventRoute> routes, AuditSink auditSink) {
        this.routes = List.copyOf(routes);
        this.auditSink = auditSink;
    }

    public Mono<Void> route(DomainEvent event) {
        return Mono.fromRunnable(() -> audit(event))
                .thenMany(Flux.fromIterable(routes)
                        .filter(route -> route.matches(event))
                        .concatMapDelayError(route -> invoke(route, event)))
                .then();
    }

    public List<EventRoute> routes() {
        return routes;
    }

    private void audit(DomainEvent event) {
        try {
            auditSink.record(event);
        } catch (RuntimeException e) {
            log.warn("Audit sink failed source={} detailType={} err={}", event.source(), event.detailType(), e.toString());
        }
    }

    private Mono<Void> invoke(EventRoute route, DomainEvent event) {
        return Mono.defer(() -> route.handler().handle(event))
                .doOnError(err -> log.warn("Route {} failed recordId={} err={}",
                        route.name(), event.detail().scheduledContent().id(), err.toString()));
    }
}
