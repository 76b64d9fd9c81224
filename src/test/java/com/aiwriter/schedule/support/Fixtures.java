package com.aiwriter.schedule.support;

import com.aiwriter.schedule.config.JacksonConfig;
import com.aiwriter.schedule.core.model.LocalSchedule;
import com.aiwriter.schedule.core.model.ScheduleTarget;
import com.aiwriter.schedule.core.model.ScheduledContentRecord;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Shared test data.
 */
public final class Fixtures {

    public static final ScheduleTarget TARGET =
            new ScheduleTarget("dispatch.scheduled-content", "scheduler-invoke", "content-schedules");

    private Fixtures() {}

    public static ObjectMapper mapper() {
        return JacksonConfig.configure(new ObjectMapper());
    }

    /**
     * Record "abc123" owned by "u1", due 2025-06-01T10:00:00.
     */
    public static ScheduledContentRecord abc123() {
        return record("abc123", new LocalSchedule(2025, 6, 1, 10, 0, 0));
    }

    public static ScheduledContentRecord record(String id, LocalSchedule schedule) {
        return new ScheduledContentRecord(id, "u1", "draft-7", null, ScheduledContentRecord.ENTITY_TAG,
                schedule, 1748768400000L);
    }
}
