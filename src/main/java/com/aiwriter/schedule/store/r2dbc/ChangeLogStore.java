package com.aiwriter.schedule.store.r2dbc;

import java.time.Instant;
import java.util.UUID;

import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Repository;

import com.aiwriter.schedule.core.model.ChangeKind;
import com.aiwriter.schedule.store.entity.ChangeLogEntity;
import com.aiwriter.schedule.store.entity.ChangeLogRow;
import com.aiwriter.schedule.store.entity.ChangeLogStatus;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Database access helper for the content_change_log table.
 *
 * JSONB is bound/read as String to avoid driver-specific Json codec types.
 */
@Repository
public class ChangeLogStore {

	private final DatabaseClient db;

	public ChangeLogStore(DatabaseClient db) {
		this.db = db;
	}

	public Mono<UUID> insertPending(ChangeKind kind, String entityType, String rowImageJson) {
		UUID id = UUID.randomUUID();

		String sql = "INSERT INTO content_change_log (id, event_kind, entity_type, row_image, status, retry_count, created_at) "
				+ "VALUES (:id, :event_kind, :entity_type, :row_image::jsonb, :status, 0, :created_at)";

		return db.sql(sql).bind("id", id).bind("event_kind", kind.name()).bind("entity_type", entityType)
				.bind("row_image", rowImageJson).bind("status", ChangeLogStatus.PENDING.name())
				.bind("created_at", Instant.now()).fetch().rowsUpdated().thenReturn(id);
	}

	/**
	 * Oldest pending changes first, so the feed preserves commit order.
	 */
	public Flux<ChangeLogRow> findPending(int limit) {
		String sql = "SELECT id, event_kind, entity_type, row_image, status, retry_count, created_at, published_at "
				+ "FROM content_change_log WHERE status = :status ORDER BY created_at ASC LIMIT :limit";

		return db.sql(sql).bind("status", ChangeLogStatus.PENDING.name()).bind("limit", limit).map((row, meta) -> {
			ChangeLogEntity e = new ChangeLogEntity();
			e.setId(row.get("id", UUID.class));
			e.setEventKind(row.get("event_kind", String.class));
			e.setEntityType(row.get("entity_type", String.class));

			// read JSONB as String (driver independent)
			e.setRowImageText(asString(row.get("row_image")));

			e.setStatus(row.get("status", String.class));
			e.setRetryCount(row.get("retry_count", Integer.class));
			e.setCreatedAt(row.get("created_at", Instant.class));
			e.setPublishedAt(row.get("published_at", Instant.class));
			return toRow(e);
		}).all();
	}

	public Mono<Void> markPublished(UUID id) {
		String sql = "UPDATE content_change_log SET status = :status, published_at = :published_at WHERE id = :id";
		return db.sql(sql).bind("status", ChangeLogStatus.PUBLISHED.name()).bind("published_at", Instant.now())
				.bind("id", id).fetch().rowsUpdated().then();
	}

	public Mono<Void> markFailed(UUID id, int retryCount) {
		return updateStatus(id, ChangeLogStatus.FAILED, retryCount);
	}

	public Mono<Void> markPending(UUID id, int retryCount) {
		return updateStatus(id, ChangeLogStatus.PENDING, retryCount);
	}

	private Mono<Void> updateStatus(UUID id, ChangeLogStatus status, int retryCount) {
		String sql = "UPDATE content_change_log SET status = :status, retry_count = :retry_count WHERE id = :id";
		return db.sql(sql).bind("status", status.name()).bind("retry_count", retryCount).bind("id", id)
				.fetch().rowsUpdated().then();
	}

	static ChangeLogRow toRow(ChangeLogEntity e) {
		String image = (e.getRowImageText() == null || e.getRowImageText().isBlank()) ? "{}" : e.getRowImageText();
		return new ChangeLogRow(e.getId(), ChangeKind.fromValue(e.getEventKind()), e.getEntityType(), image,
				ChangeLogStatus.valueOf(e.getStatus()), e.getRetryCount() == null ? 0 : e.getRetryCount(),
				e.getCreatedAt(), e.getPublishedAt());
	}

	private static String asString(Object v) {
		if (v == null)
			return null;
		if (v instanceof String s)
			return s;
		return String.valueOf(v);
	}
}
