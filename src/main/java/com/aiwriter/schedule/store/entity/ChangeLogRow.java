package com.aiwriter.schedule.store.entity;

import com.aiwriter.schedule.core.model.ChangeKind;

import java.time.Instant;
import java.util.UUID;

/**
 * Immutable view of a change-log row as read by the relay.
 *
 * <p>{@code rowImageJson} is the row image exactly as stored (JSONB read as text).</p>
 */
public record ChangeLogRow(
        UUID id,
        ChangeKind eventKind,
        String entityType,
        String rowImageJson,
        ChangeLogStatus status,
        int retryCount,
        Instant createdAt,
        Instant publishedAt
) {
}
