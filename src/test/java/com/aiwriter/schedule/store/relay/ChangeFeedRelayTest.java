package com.aiwriter.schedule.store.relay;

import com.aiwriter.schedule.config.SchedulingProperties;
import com.aiwriter.schedule.core.model.ChangeFeedEntry;
import com.aiwriter.schedule.core.model.ChangeKind;
import com.aiwriter.schedule.store.entity.ChangeLogRow;
import com.aiwriter.schedule.store.entity.ChangeLogStatus;
import com.aiwriter.schedule.store.r2dbc.ChangeLogStore;
import com.aiwriter.schedule.support.Fixtures;
import com.aiwriter.schedule.support.RecordingEventBusPublisher;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ChangeFeedRelayTest {

    private final ObjectMapper mapper = Fixtures.mapper();
    private final ChangeLogStore store = mock(ChangeLogStore.class);

    private ChangeFeedRelay relay(RecordingEventBusPublisher publisher) {
        return new ChangeFeedRelay(store, publisher, mapper, new SchedulingProperties(), 50, Duration.ofSeconds(2), 2);
    }

    private ChangeLogRow pendingRow(int retryCount) throws Exception {
        return new ChangeLogRow(UUID.fromString("00000000-0000-0000-0000-000000000001"), ChangeKind.INSERT,
                "SCHEDULED_CONTENT", mapper.writeValueAsString(Fixtures.abc123()), ChangeLogStatus.PENDING,
                retryCount, Instant.parse("2025-06-01T08:00:00Z"), null);
    }

    private void stubWrites() {
        when(store.markPublished(any(UUID.class))).thenReturn(Mono.empty());
        when(store.markPending(any(UUID.class), anyInt())).thenReturn(Mono.empty());
        when(store.markFailed(any(UUID.class), anyInt())).thenReturn(Mono.empty());
    }

    @Test
    void pending_change_is_published_with_change_id_as_message_id() throws Exception {
        ChangeLogRow row = pendingRow(0);
        when(store.findPending(50)).thenReturn(Flux.just(row));
        stubWrites();
        RecordingEventBusPublisher publisher = new RecordingEventBusPublisher();

        relay(publisher).relayOnce().block();

        assertThat(publisher.published()).singleElement().satisfies(p -> {
            assertThat(p.subject()).isEqualTo("changefeed.scheduled-content");
            assertThat(p.messageId()).isEqualTo(row.id().toString());
            ChangeFeedEntry entry = mapper.readValue(p.body(), ChangeFeedEntry.class);
            assertThat(entry.eventKind()).isEqualTo(ChangeKind.INSERT);
            assertThat(entry.rowImage().get("id").asText()).isEqualTo("abc123");
        });
        verify(store).markPublished(row.id());
    }

    @Test
    void failed_publish_is_retried_later() throws Exception {
        ChangeLogRow row = pendingRow(0);
        when(store.findPending(50)).thenReturn(Flux.just(row));
        stubWrites();

        relay(new RecordingEventBusPublisher().failWith(new IllegalStateException("no stream"))).relayOnce().block();

        verify(store).markPending(row.id(), 1);
        verify(store, never()).markPublished(any(UUID.class));
    }

    @Test
    void change_is_marked_failed_once_retries_are_used_up() throws Exception {
        ChangeLogRow row = pendingRow(2);
        when(store.findPending(50)).thenReturn(Flux.just(row));
        stubWrites();

        relay(new RecordingEventBusPublisher().failWith(new IllegalStateException("no stream"))).relayOnce().block();

        verify(store).markFailed(row.id(), 3);
    }
}
