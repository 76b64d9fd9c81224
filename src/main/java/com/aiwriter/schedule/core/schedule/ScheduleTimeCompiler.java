package com.aiwriter.schedule.core.schedule;

import com.aiwriter.schedule.core.error.MalformedEventException;
import com.aiwriter.schedule.core.error.PastScheduleException;
import com.aiwriter.schedule.core.model.FireExpression;
import com.aiwriter.schedule.core.model.LocalSchedule;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Objects;

/**
 * =====================================================================
 * ScheduleTimeCompiler
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Turns the naive wall-clock time a user picked into a one-shot
 * {@link FireExpression} the scheduler understands.
 *
 * ALGORITHM
 * ---------
 * 1. Interpret the schedule fields in {@link #zone()} → candidate instant
 *    (a time skipped by a spring-forward transition is rejected, a time
 *    repeated by a fall-back transition takes its earlier occurrence)
 * 2. diffMinutes = floor((candidate − now) / 1 minute)
 * 3. diffMinutes ≤ 0 → {@link PastScheduleException}
 * 4. effective = now + diffMinutes, truncated to the minute
 * 5. Render "at(yyyy-MM-ddTHH:mm:ss)" in {@link #zone()}, carrying the effective instant
 *
 * The effective instant never lies after the candidate and is at least one
 * minute after {@code now} rounded down to the minute.
 *
 * DETERMINISM
 * -----------
 * Pure function of (schedule, now, zone). {@code now} is supplied by the
 * caller, which reads its clock exactly once per event.
 */
public class ScheduleTimeCompiler {

    private static final long MILLIS_PER_MINUTE = Duration.ofMinutes(1).toMillis();

    private final ZoneId zone;

    public ScheduleTimeCompiler(ZoneId zone) {
        this.zone = Objects.requireNonNull(zone, "zone");
    }

    public ZoneId zone() {
        return zone;
    }

    /**
     * Compiles {@code schedule} against {@code now}.
     *
     * @throws PastScheduleException if the schedule is less than one whole minute ahead of {@code now}
     * @throws MalformedEventException if the schedule's wall-clock time does not exist in the zone
     */
    public FireExpression compile(LocalSchedule schedule, Instant now) {
        Instant candidate = candidate(schedule);

        long diffMillis = Duration.between(now, candidate).toMillis();
        long diffMinutes = Math.floorDiv(diffMillis, MILLIS_PER_MINUTE);
        if (diffMinutes <= 0) {
            throw new PastScheduleException(candidate, diffMinutes);
        }

        Instant effective = now.plus(Duration.ofMinutes(diffMinutes));
        return FireExpression.at(effective, zone);
    }

    private Instant candidate(LocalSchedule schedule) {
        LocalDateTime wallClock = schedule.toLocalDateTime();
        List<ZoneOffset> offsets = zone.getRules().getValidOffsets(wallClock);
        if (offsets.isEmpty()) {
            throw new MalformedEventException("Schedule " + schedule + " falls in a clock change gap in " + zone);
        }
        return wallClock.toInstant(offsets.get(0));
    }
}
