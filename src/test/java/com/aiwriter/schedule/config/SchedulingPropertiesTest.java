package com.aiwriter.schedule.config;

import com.aiwriter.schedule.core.model.ScheduleTarget;
import org.junit.jupiter.api.Test;

import java.time.ZoneId;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SchedulingPropertiesTest {

    @Test
    void event_subject_joins_prefix_source_and_detail_type() {
        SchedulingProperties props = new SchedulingProperties();

        assertThat(props.eventSubject("scheduled.content", "ScheduleContentCreated"))
                .isEqualTo("events.scheduled.content.ScheduleContentCreated");
    }

    @Test
    void blank_zone_falls_back_to_system_zone() {
        SchedulingProperties props = new SchedulingProperties();
        props.setZone(" ");

        assertThat(props.resolveZone()).isEqualTo(ZoneId.systemDefault());

        props.setZone("Europe/Berlin");
        assertThat(props.resolveZone()).isEqualTo(ZoneId.of("Europe/Berlin"));
    }

    @Test
    void default_target_points_at_dispatch_subject() {
        ScheduleTarget target = new ScheduleTargetProperties().toScheduleTarget();

        assertThat(target.targetRef()).isEqualTo("dispatch.scheduled-content");
        assertThat(target.groupRef()).isEqualTo("content-schedules");
        assertThat(target.roleRef()).isEmpty();
    }

    @Test
    void blank_group_is_rejected() {
        ScheduleTargetProperties props = new ScheduleTargetProperties();
        props.setGroupRef("");

        assertThatThrownBy(props::toScheduleTarget).isInstanceOf(IllegalArgumentException.class);
    }
}
