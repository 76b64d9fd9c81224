package com.aiwriter.schedule.core.schedule;

import com.aiwriter.schedule.core.error.MalformedEventException;
import com.aiwriter.schedule.core.error.PastScheduleException;
import com.aiwriter.schedule.core.model.FireExpression;
import com.aiwriter.schedule.core.model.LocalSchedule;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScheduleTimeCompilerTest {

    private static final LocalSchedule TEN_AM = new LocalSchedule(2025, 6, 1, 10, 0, 0);

    private final ScheduleTimeCompiler compiler = new ScheduleTimeCompiler(ZoneOffset.UTC);

    @Test
    void one_hour_ahead_fires_at_the_requested_minute() {
        FireExpression fire = compiler.compile(TEN_AM, Instant.parse("2025-06-01T09:00:00Z"));

        assertThat(fire.expression()).isEqualTo("at(2025-06-01T10:00:00)");
        assertThat(fire.zone()).isEqualTo(ZoneOffset.UTC);
    }

    @Test
    void schedule_one_second_in_the_past_is_rejected() {
        assertThatThrownBy(() -> compiler.compile(TEN_AM, Instant.parse("2025-06-01T10:00:01Z")))
                .isInstanceOfSatisfying(PastScheduleException.class, e -> {
                    assertThat(e.getDiffMinutes()).isEqualTo(-1);
                    assertThat(e.getCandidate()).isEqualTo(Instant.parse("2025-06-01T10:00:00Z"));
                });
    }

    @Test
    void less_than_a_whole_minute_ahead_is_rejected() {
        assertThatThrownBy(() -> compiler.compile(TEN_AM, Instant.parse("2025-06-01T09:59:01Z")))
                .isInstanceOfSatisfying(PastScheduleException.class,
                        e -> assertThat(e.getDiffMinutes()).isZero());
    }

    @Test
    void schedule_equal_to_now_is_rejected() {
        assertThatThrownBy(() -> compiler.compile(TEN_AM, Instant.parse("2025-06-01T10:00:00Z")))
                .isInstanceOf(PastScheduleException.class);
    }

    @Test
    void partial_minutes_are_dropped_so_the_job_never_fires_late() {
        // 90s ahead: one whole minute, counted from now, then truncated.
        FireExpression fire = compiler.compile(TEN_AM, Instant.parse("2025-06-01T09:58:30Z"));

        assertThat(fire.expression()).isEqualTo("at(2025-06-01T09:59:00)");
        assertThat(fire.fireAt()).isBefore(Instant.parse("2025-06-01T10:00:00Z"));
    }

    @Test
    void schedule_seconds_are_not_carried_into_the_expression() {
        LocalSchedule s = new LocalSchedule(2025, 6, 1, 10, 0, 45);

        FireExpression fire = compiler.compile(s, Instant.parse("2025-06-01T09:00:00Z"));

        assertThat(fire.expression()).isEqualTo("at(2025-06-01T10:00:00)");
    }

    @Test
    void schedule_fields_are_interpreted_in_the_configured_zone() {
        ZoneId berlin = ZoneId.of("Europe/Berlin");
        ScheduleTimeCompiler berlinCompiler = new ScheduleTimeCompiler(berlin);

        // 10:00 in Berlin (CEST) is 08:00 UTC.
        FireExpression fire = berlinCompiler.compile(TEN_AM, Instant.parse("2025-06-01T07:00:00Z"));

        assertThat(fire.expression()).isEqualTo("at(2025-06-01T10:00:00)");
        assertThat(fire.zone()).isEqualTo(berlin);
        assertThat(fire.fireAt()).isEqualTo(Instant.parse("2025-06-01T08:00:00Z"));

        assertThatThrownBy(() -> berlinCompiler.compile(TEN_AM, Instant.parse("2025-06-01T09:00:00Z")))
                .isInstanceOf(PastScheduleException.class);
    }

    @Test
    void effective_time_in_a_repeated_hour_keeps_its_own_offset() {
        ZoneId newYork = ZoneId.of("America/New_York");
        ScheduleTimeCompiler nyCompiler = new ScheduleTimeCompiler(newYork);
        // 06:00:30Z is 01:00:30 EST, the second pass through 01:xx on 2025-11-02.
        Instant now = Instant.parse("2025-11-02T06:00:30Z");

        FireExpression fire = nyCompiler.compile(new LocalSchedule(2025, 11, 2, 2, 0, 10), now);

        assertThat(fire.expression()).isEqualTo("at(2025-11-02T01:59:00)");
        assertThat(fire.fireAt()).isEqualTo(Instant.parse("2025-11-02T06:59:00Z"));
        assertThat(fire.fireAt()).isAfter(now);
    }

    @Test
    void ambiguous_schedule_takes_the_earlier_occurrence() {
        ScheduleTimeCompiler nyCompiler = new ScheduleTimeCompiler(ZoneId.of("America/New_York"));

        // 01:30 on 2025-11-02 is 05:30Z (EDT) and again 06:30Z (EST).
        FireExpression fire = nyCompiler.compile(new LocalSchedule(2025, 11, 2, 1, 30, 0),
                Instant.parse("2025-11-02T05:00:00Z"));

        assertThat(fire.fireAt()).isEqualTo(Instant.parse("2025-11-02T05:30:00Z"));
    }

    @Test
    void schedule_skipped_by_spring_forward_is_rejected() {
        ScheduleTimeCompiler nyCompiler = new ScheduleTimeCompiler(ZoneId.of("America/New_York"));

        // 02:30 on 2025-03-09 never happens in New York.
        assertThatThrownBy(() -> nyCompiler.compile(new LocalSchedule(2025, 3, 9, 2, 30, 0),
                Instant.parse("2025-03-09T05:00:00Z")))
                .isInstanceOf(MalformedEventException.class)
                .hasMessageContaining("America/New_York");
    }
}
