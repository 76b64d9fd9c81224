package com.aiwriter.schedule.core.model;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * =====================================================================
 * FireExpression
 * =====================================================================
 *
 * PURPOSE
 * -------
 * One-shot "fire at" instruction understood by the job scheduler:
 *
 *   at(yyyy-MM-ddTHH:mm:ss)
 *
 * The wall-clock text is rendered in {@link #zone}, which travels with the
 * expression as the schedule-expression timezone. Seconds are always zero and
 * there is no fractional part.
 *
 * The resolved {@link #fireAt} instant travels with the text. Around a
 * fall-back transition one wall-clock minute names two instants, and only the
 * instant tells them apart.
 *
 * ENCODING / DECODING
 * -------------------
 * {@link #at(Instant, ZoneId)} builds an expression from an instant (truncated to
 * the minute); {@link #parse(String, ZoneId)} turns an expression back into the
 * instant it denotes.
 */
public record FireExpression(String expression, ZoneId zone, Instant fireAt) {

    private static final DateTimeFormatter WALL_CLOCK = DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss")
            .withResolverStyle(ResolverStyle.STRICT);
    private static final Pattern AT = Pattern.compile("^at\\((\\d{4}-\\d{2}-\\d{2}T\\d{2}:\\d{2}:\\d{2})\\)$");

    public FireExpression {
        Objects.requireNonNull(expression, "expression");
        Objects.requireNonNull(zone, "zone");
        Objects.requireNonNull(fireAt, "fireAt");
        LocalDateTime wallClock = wallClock(expression);
        if (!wallClock.equals(LocalDateTime.ofInstant(fireAt, zone))) {
            throw new IllegalArgumentException(
                    "Fire expression " + expression + " does not denote " + fireAt + " in " + zone);
        }
    }

    public static FireExpression at(Instant instant, ZoneId zone) {
        Instant minute = instant.truncatedTo(ChronoUnit.MINUTES);
        String wallClock = WALL_CLOCK.format(LocalDateTime.ofInstant(minute, zone));
        return new FireExpression("at(" + wallClock + ")", zone, minute);
    }

    /**
     * Decodes {@code expression} in {@code zone}.
     *
     * <p>A wall-clock time repeated by a fall-back transition resolves to its earlier
     * occurrence. A wall-clock time skipped by a spring-forward transition is rejected.</p>
     */
    public static FireExpression parse(String expression, ZoneId zone) {
        Objects.requireNonNull(zone, "zone");
        LocalDateTime wallClock = wallClock(expression);
        List<ZoneOffset> offsets = zone.getRules().getValidOffsets(wallClock);
        if (offsets.isEmpty()) {
            throw new IllegalArgumentException("Fire expression " + expression + " does not exist in " + zone);
        }
        return new FireExpression(expression, zone, wallClock.toInstant(offsets.get(0)));
    }

    @Override
    public String toString() {
        return expression + " [" + zone + "]";
    }

    private static LocalDateTime wallClock(String expression) {
        Matcher m = AT.matcher(expression);
        if (!m.matches()) {
            throw new IllegalArgumentException("Not a one-shot fire expression: " + expression);
        }
        try {
            return LocalDateTime.parse(m.group(1), WALL_CLOCK);
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("Invalid date/time in fire expression: " + expression, e);
        }
    }
}
