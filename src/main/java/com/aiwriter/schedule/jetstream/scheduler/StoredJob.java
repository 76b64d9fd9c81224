package com.aiwriter.schedule.jetstream.scheduler;

import com.aiwriter.schedule.core.model.DisposalPolicy;
import com.aiwriter.schedule.core.model.ScheduleJob;

import java.time.Instant;

/**
 * Job as persisted in the job bucket. Flat and string-typed so the stored JSON stays
 * readable with {@code nats kv get}.
 */
public record StoredJob(
        String name,
        String description,
        String groupRef,
        String targetRef,
        String roleRef,
        byte[] payload,
        String expression,
        String zone,
        Instant fireAt,
        DisposalPolicy disposalPolicy,
        long flexibleWindowSeconds,
        Instant createdAt
) {

    static StoredJob of(ScheduleJob job, Instant createdAt) {
        return new StoredJob(
                job.name(),
                job.description(),
                job.target().groupRef(),
                job.target().targetRef(),
                job.target().roleRef(),
                job.payload(),
                job.fireExpression().expression(),
                job.fireExpression().zone().getId(),
                job.fireExpression().fireAt(),
                job.disposalPolicy(),
                job.flexibleWindow().getSeconds(),
                createdAt
        );
    }

    boolean isDue(Instant now) {
        return !fireAt.isAfter(now);
    }
}
