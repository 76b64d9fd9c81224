package com.aiwriter.schedule.routing;

import com.aiwriter.schedule.config.SchedulingProperties;
import com.aiwriter.schedule.core.codec.ScheduledContentParser;
import com.aiwriter.schedule.core.error.RegistrationException;
import com.aiwriter.schedule.core.model.DomainEvent;
import com.aiwriter.schedule.jetstream.config.ContentSchedulerProperties;
import com.aiwriter.schedule.jetstream.consumer.AckDecision;
import com.aiwriter.schedule.support.Fixtures;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.nats.client.JetStream;
import io.nats.client.Message;
import org.junit.jupiter.api.Test;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class EventBusConsumerTest {

    private final ObjectMapper mapper = Fixtures.mapper();

    private EventBusConsumer consumer(DomainEventHandler handler) {
        EventRouter router = new EventRouter(List.of(new EventRoute("schedule-creator",
                DomainEvent.SOURCE_SCHEDULED_CONTENT, DomainEvent.DETAIL_TYPE_CREATED, handler)), event -> { });
        return new EventBusConsumer(
                mock(JetStream.class),
                new ContentSchedulerProperties(),
                new SchedulingProperties(),
                new ScheduledContentParser(mapper),
                router,
                "SCHEDULED_CONTENT_EVENTS",
                Duration.ofSeconds(1),
                10,
                Duration.ofSeconds(30)
        );
    }

    private Message message(byte[] data) {
        Message msg = mock(Message.class);
        when(msg.getData()).thenReturn(data);
        when(msg.getSubject()).thenReturn("events.scheduled.content.ScheduleContentCreated");
        return msg;
    }

    private byte[] created() throws Exception {
        return mapper.writeValueAsBytes(DomainEvent.scheduleContentCreated(Fixtures.abc123()));
    }

    @Test
    void routed_event_is_acked() throws Exception {
        assertThat(consumer(event -> Mono.empty()).handle(message(created())).block()).isEqualTo(AckDecision.ACK);
    }

    @Test
    void unparseable_event_is_terminated() {
        byte[] body = "{\"source\":\"scheduled.content\"}".getBytes(StandardCharsets.UTF_8);

        assertThat(consumer(event -> Mono.empty()).handle(message(body)).block()).isEqualTo(AckDecision.TERM);
    }

    @Test
    void transient_registration_failure_is_redelivered_later() throws Exception {
        EventBusConsumer c = consumer(event -> Mono.error(
                new RegistrationException("abc123-scheduled-post", true, "gave up after 3 retries", null)));

        assertThat(c.handle(message(created())).block()).isEqualTo(AckDecision.NAK_WITH_DELAY);
    }

    @Test
    void permanent_registration_failure_is_terminated() throws Exception {
        EventBusConsumer c = consumer(event -> Mono.error(
                new RegistrationException("abc123-scheduled-post", false, "invalid target subject", null)));

        assertThat(c.handle(message(created())).block()).isEqualTo(AckDecision.TERM);
    }

    @Test
    void decide_looks_inside_composite_failures() {
        Throwable composite = Exceptions.multiple(
                new IllegalStateException("other route"),
                new RegistrationException("abc123-scheduled-post", false, "rejected", null));

        assertThat(EventBusConsumer.decide("abc123", composite)).isEqualTo(AckDecision.TERM);
        assertThat(EventBusConsumer.decide("abc123", new IllegalStateException("boom")))
                .isEqualTo(AckDecision.NAK_WITH_DELAY);
    }
}
