package com.aiwriter.schedule.core.model;

import java.time.Duration;
import java.util.Objects;

/**
 * =====================================================================
 * ScheduleJob
 * =====================================================================
 *
 * PURPOSE
 * -------
 * A one-shot job handed to the external scheduler. Fires exactly once at
 * {@link #fireExpression} and invokes {@link #target} with {@link #payload}.
 *
 * IDENTITY
 * --------
 * {@link #name} is derived from the record id, so one record maps to at most
 * one job. The scheduler rejects a second job with the same name in the same
 * group.
 *
 * FIRING POLICY
 * -------------
 * - {@link #flexibleWindow} of {@link Duration#ZERO} means OFF (fire at the exact time)
 * - {@link #disposalPolicy} is {@link DisposalPolicy#DELETE_AFTER_FIRE}
 * - no scheduler-level retry of failed invocations
 *
 * The pipeline creates jobs and never reads them back.
 */
public record ScheduleJob(
        String name,
        String description,
        ScheduleTarget target,
        byte[] payload,
        FireExpression fireExpression,
        DisposalPolicy disposalPolicy,
        Duration flexibleWindow
) {

    /** Suffix appended to the record id to form the job name. */
    public static final String NAME_SUFFIX = "-scheduled-post";

    /** Flexible window value meaning "OFF". */
    public static final Duration FLEXIBLE_WINDOW_OFF = Duration.ZERO;

    public ScheduleJob {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(payload, "payload");
        Objects.requireNonNull(fireExpression, "fireExpression");
        Objects.requireNonNull(disposalPolicy, "disposalPolicy");
        if (flexibleWindow == null) {
            flexibleWindow = FLEXIBLE_WINDOW_OFF;
        }
    }

    public static String nameFor(String recordId) {
        return recordId + NAME_SUFFIX;
    }

    public static String descriptionFor(String recordId, String userId) {
        return "Post " + recordId + " scheduled by " + userId;
    }
}
