package com.aiwriter.schedule.store.r2dbc;

import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Repository;

import com.aiwriter.schedule.core.model.ScheduledContentRecord;

import reactor.core.publisher.Mono;

/**
 * Writes scheduled content rows. Rows are never updated: rescheduling is not supported.
 */
@Repository
public class ScheduledContentStore {

	private final DatabaseClient db;

	public ScheduledContentStore(DatabaseClient db) {
		this.db = db;
	}

	public Mono<Void> insert(ScheduledContentRecord r, String scheduleJson) {
		String sql = "INSERT INTO scheduled_content (id, user_id, draft_id, article_id, entity, schedule, created_on) "
				+ "VALUES (:id, :user_id, :draft_id, :article_id, :entity, :schedule::jsonb, :created_on)";

		DatabaseClient.GenericExecuteSpec spec = db.sql(sql).bind("id", r.id()).bind("user_id", r.userId())
				.bind("entity", r.entity()).bind("schedule", scheduleJson).bind("created_on", r.createdOn());

		spec = r.draftId() == null ? spec.bindNull("draft_id", String.class) : spec.bind("draft_id", r.draftId());
		spec = r.articleId() == null ? spec.bindNull("article_id", String.class) : spec.bind("article_id", r.articleId());

		return spec.fetch().rowsUpdated().then();
	}
}
