package com.aiwriter.schedule.jetstream.scheduler;

import com.aiwriter.schedule.core.model.DisposalPolicy;
import com.aiwriter.schedule.core.model.FireExpression;
import com.aiwriter.schedule.core.model.ScheduleJob;
import com.aiwriter.schedule.support.Fixtures;
import com.aiwriter.schedule.support.RecordingEventBusPublisher;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.nats.client.KeyValue;
import io.nats.client.api.KeyValueEntry;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class JobFirerTest {

    private static final Instant NOW = Instant.parse("2025-06-01T10:00:30Z");
    private static final String KEY = "content-schedules.abc123-scheduled-post";

    private final ObjectMapper mapper = Fixtures.mapper();
    private final KeyValue kv = mock(KeyValue.class);
    private final RecordingEventBusPublisher publisher = new RecordingEventBusPublisher();

    private JobFirer firer(RecordingEventBusPublisher pub) {
        return new JobFirer(kv, pub, mapper, Clock.fixed(NOW, ZoneOffset.UTC), Duration.ofSeconds(5));
    }

    private void store(String expression) throws Exception {
        ScheduleJob job = new ScheduleJob("abc123-scheduled-post", "Post abc123 scheduled by u1", Fixtures.TARGET,
                "payload".getBytes(StandardCharsets.UTF_8),
                FireExpression.parse(expression, ZoneOffset.UTC), DisposalPolicy.DELETE_AFTER_FIRE, Duration.ZERO);
        storeRaw(mapper.writeValueAsBytes(StoredJob.of(job, NOW.minusSeconds(3600))));
    }

    private void storeRaw(byte[] value) throws Exception {
        KeyValueEntry entry = mock(KeyValueEntry.class);
        when(entry.getValue()).thenReturn(value);
        when(kv.keys()).thenReturn(List.of(KEY));
        when(kv.get(KEY)).thenReturn(entry);
    }

    @Test
    void due_job_is_published_once_and_deleted() throws Exception {
        store("at(2025-06-01T10:00:00)");

        assertThat(firer(publisher).fireDue().block()).isEqualTo(1);

        assertThat(publisher.published()).singleElement().satisfies(p -> {
            assertThat(p.subject()).isEqualTo("dispatch.scheduled-content");
            assertThat(p.messageId()).isEqualTo("abc123-scheduled-post");
            assertThat(new String(p.body(), StandardCharsets.UTF_8)).isEqualTo("payload");
        });
        verify(kv).delete(KEY);
    }

    @Test
    void job_not_yet_due_is_left_alone() throws Exception {
        store("at(2025-06-01T10:01:00)");

        assertThat(firer(publisher).fireDue().block()).isZero();

        assertThat(publisher.published()).isEmpty();
        verify(kv, never()).delete(anyString());
    }

    @Test
    void failed_publish_keeps_the_job_pending() throws Exception {
        store("at(2025-06-01T10:00:00)");
        RecordingEventBusPublisher failing = new RecordingEventBusPublisher()
                .failWith(new IllegalStateException("no responders"));

        assertThat(firer(failing).fireDue().block()).isZero();

        verify(kv, never()).delete(anyString());
        verify(kv, never()).put(anyString(), any(byte[].class));
    }

    @Test
    void unreadable_job_is_removed() throws Exception {
        storeRaw("not a job".getBytes(StandardCharsets.UTF_8));

        assertThat(firer(publisher).fireDue().block()).isZero();

        assertThat(publisher.published()).isEmpty();
        verify(kv).delete(KEY);
    }
}
