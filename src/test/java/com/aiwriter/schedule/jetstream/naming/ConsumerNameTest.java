package com.aiwriter.schedule.jetstream.naming;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConsumerNameTest {

    @Test
    void joins_parts_with_underscores() {
        assertThat(ConsumerName.of("content-scheduler", "eventbus", "node01"))
                .isEqualTo("content-scheduler_eventbus_node01");
    }

    @Test
    void replaces_characters_jetstream_forbids() {
        assertThat(ConsumerName.of("content.scheduler", "change feed", "node>1*"))
                .isEqualTo("content-scheduler_change-feed_node-1-");
    }

    @Test
    void blank_parts_are_rejected() {
        assertThatThrownBy(() -> ConsumerName.of("content-scheduler", " ", "node01"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ConsumerName.of(null, "dispatch", "node01"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
