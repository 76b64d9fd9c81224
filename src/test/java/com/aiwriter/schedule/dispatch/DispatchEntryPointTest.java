package com.aiwriter.schedule.dispatch;

import com.aiwriter.schedule.core.codec.ScheduledContentParser;
import com.aiwriter.schedule.core.error.DispatchException;
import com.aiwriter.schedule.core.model.DispatchPayload;
import com.aiwriter.schedule.support.Fixtures;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DispatchEntryPointTest {

    private final ObjectMapper mapper = Fixtures.mapper();
    private final ScheduledContentParser parser = new ScheduledContentParser(mapper);
    private final List<DispatchPayload> distributed = new ArrayList<>();

    private final DispatchEntryPoint entryPoint = new DispatchEntryPoint(parser,
            payload -> Mono.fromRunnable(() -> distributed.add(payload)));

    @Test
    void fired_payload_is_handed_to_distribution() throws Exception {
        byte[] body = mapper.writeValueAsBytes(new DispatchPayload(Fixtures.abc123(), "24hr"));

        entryPoint.handle(body).block();

        assertThat(distributed).containsExactly(new DispatchPayload(Fixtures.abc123(), "24hr"));
    }

    @Test
    void malformed_payload_is_a_dispatch_error() {
        byte[] body = "{\"context\":\"24hr\"}".getBytes(StandardCharsets.UTF_8);

        assertThatThrownBy(() -> entryPoint.handle(body).block())
                .isInstanceOf(DispatchException.class)
                .hasMessageContaining("scheduledContent: missing");
        assertThat(distributed).isEmpty();
    }

    @Test
    void distribution_failure_is_wrapped_with_record_id() throws Exception {
        DispatchEntryPoint failing = new DispatchEntryPoint(parser,
                payload -> Mono.error(new IllegalStateException("channel down")));
        byte[] body = mapper.writeValueAsBytes(new DispatchPayload(Fixtures.abc123(), "24hr"));

        assertThatThrownBy(() -> failing.handle(body).block())
                .isInstanceOf(DispatchException.class)
                .hasMessageContaining("abc123")
                .hasRootCauseMessage("channel down");
    }

    @Test
    void logging_distributor_completes() {
        new LoggingDistributionService().distribute(new DispatchPayload(Fixtures.abc123(), "24hr")).block();
    }
}
