package com.aiwriter.schedule.routing;

import com.aiwriter.schedule.core.model.DomainEvent;
import com.aiwriter.schedule.support.Fixtures;
import org.junit.jupiter.api.Test;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EventRouterTest {

    private final List<String> calls = new ArrayList<>();
    private final List<DomainEvent> audited = new ArrayList<>();

    private EventRoute route(String name, String source, String detailType) {
        return new EventRoute(name, source, detailType, event -> Mono.fromRunnable(() -> calls.add(name)));
    }

    private EventRoute failing(String name) {
        return new EventRoute(name, DomainEvent.SOURCE_SCHEDULED_CONTENT, DomainEvent.DETAIL_TYPE_CREATED,
                event -> Mono.error(new IllegalStateException(name + " broke")));
    }

    private final DomainEvent created = DomainEvent.scheduleContentCreated(Fixtures.abc123());

    @Test
    void every_matching_route_receives_the_event() {
        EventRouter router = new EventRouter(List.of(
                route("creator", "scheduled.content", "ScheduleContentCreated"),
                route("notifier", "scheduled.content", "ScheduleContentCreated"),
                route("other-type", "scheduled.content", "ScheduleContentDeleted"),
                route("other-source", "drafts", "ScheduleContentCreated")
        ), audited::add);

        router.route(created).block();

        assertThat(calls).containsExactly("creator", "notifier");
        assertThat(audited).containsExactly(created);
    }

    @Test
    void event_without_matching_route_is_only_audited() {
        EventRouter router = new EventRouter(List.of(route("other", "drafts", "Whatever")), audited::add);

        router.route(created).block();

        assertThat(calls).isEmpty();
        assertThat(audited).containsExactly(created);
    }

    @Test
    void a_failing_route_does_not_stop_the_others() {
        EventRouter router = new EventRouter(List.of(
                failing("first"),
                route("second", "scheduled.content", "ScheduleContentCreated")
        ), audited::add);

        assertThatThrownBy(() -> router.route(created).block())
                .satisfies(err -> assertThat(Exceptions.unwrapMultiple(Exceptions.unwrap(err)))
                        .anySatisfy(t -> assertThat(t).hasMessage("first broke")));
        assertThat(calls).containsExactly("second");
    }

    @Test
    void audit_failure_never_reaches_the_routes() {
        EventRouter router = new EventRouter(
                List.of(route("creator", "scheduled.content", "ScheduleContentCreated")),
                event -> { throw new IllegalStateException("audit down"); });

        router.route(created).block();

        assertThat(calls).containsExactly("creator");
    }
}
