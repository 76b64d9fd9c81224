package com.aiwriter.schedule.core.model;

import java.util.Objects;

/**
 * =====================================================================
 * DomainEvent
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Envelope placed on the internal event bus by the change capture filter and
 * consumed by the event router.
 *
 *   [ Change Feed ] → filter → [ DomainEvent ] → router → [ Route handlers ]
 *
 * ROUTING KEY
 * -----------
 * Routes match on the exact pair ({@link #source}, {@link #detailType}).
 * No wildcard or prefix matching exists.
 *
 * LIFETIME
 * --------
 * Ephemeral. Events are not stored beyond the bus retention window.
 */
public record DomainEvent(String source, String detailType, Detail detail) {

    /** Source name of every event emitted by the change capture filter. */
    public static final String SOURCE_SCHEDULED_CONTENT = "scheduled.content";

    /** Detail type of a newly inserted scheduled content record. */
    public static final String DETAIL_TYPE_CREATED = "ScheduleContentCreated";

    public DomainEvent {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(detailType, "detailType");
        Objects.requireNonNull(detail, "detail");
    }

    public static DomainEvent scheduleContentCreated(ScheduledContentRecord record) {
        return new DomainEvent(SOURCE_SCHEDULED_CONTENT, DETAIL_TYPE_CREATED, new Detail(record));
    }

    /**
     * Event body: the full record, never a partial view.
     */
    public record Detail(ScheduledContentRecord scheduledContent) {

        public Detail {
            Objects.requireNonNull(scheduledContent, "scheduledContent");
        }
    }
}
