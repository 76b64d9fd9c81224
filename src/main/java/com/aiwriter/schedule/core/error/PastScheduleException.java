package com.aiwriter.schedule.core.error;

import java.time.Instant;

/**
 * The requested schedule is not at least one whole minute in the future.
 *
 * <p>Carries the candidate instant and the computed minute difference (zero or
 * negative) for diagnostics.</p>
 */
public class PastScheduleException extends ContentScheduleException {

    private final Instant candidate;
    private final long diffMinutes;

    public PastScheduleException(Instant candidate, long diffMinutes) {
        super("Cannot schedule in the past: candidate=" + candidate + " diffMinutes=" + diffMinutes);
        this.candidate = candidate;
        this.diffMinutes = diffMinutes;
    }

    public Instant getCandidate() {
        return candidate;
    }

    public long getDiffMinutes() {
        return diffMinutes;
    }
}
