package com.aiwriter.schedule.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;

/**
 * =====================================================================
 * ScheduledContentRecord
 * =====================================================================
 *
 * PURPOSE ------- The content a user wants published later. Written once by
 * the record store, read once by the change capture filter, and carried
 * verbatim inside the job payload until dispatch.
 *
 * SOURCE CONTENT -------------- At most one of {@link #draftId} or
 * {@link #articleId} is expected. Both are optional at the type level because
 * the pipeline only passes them through.
 *
 * ROUTING ------- Only records whose {@link #entity} equals
 * {@link #ENTITY_TAG} enter the pipeline.
 *
 * IMMUTABILITY ------------ Java record. The pipeline never edits a record;
 * re-scheduling is not supported.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ScheduledContentRecord(

		/** Stable unique identifier, assigned by the record store at creation. */
		String id,

		/** Owner of the content. */
		String userId,

		/** Source draft, when the content is a draft. */
		String draftId,

		/** Source article, when the content is an article. */
		String articleId,

		/** Entity discriminator of the row. */
		String entity,

		/** Naive local wall-clock time of the requested publication. */
		LocalSchedule schedule,

		/** Creation time in epoch millis as stamped by the record store; may be null. */
		Long createdOn) {

	/** Entity tag that marks a row as scheduled content. */
	public static final String ENTITY_TAG = "SCHEDULED_CONTENT";

	public ScheduledContentRecord {
		Objects.requireNonNull(id, "id");
		Objects.requireNonNull(userId, "userId");
		Objects.requireNonNull(entity, "entity");
		Objects.requireNonNull(schedule, "schedule");
	}

	@JsonIgnore
	public boolean isScheduledContent() {
		return ENTITY_TAG.equals(entity);
	}

	/**
	 * Identifier of the source content, whichever form is present.
	 */
	@JsonIgnore
	public String sourceContentId() {
		return draftId != null ? draftId : articleId;
	}
}
