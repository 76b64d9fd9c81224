package com.aiwriter.schedule.routing;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.aiwriter.schedule.core.model.DomainEvent;
import com.aiwriter.schedule.support.Fixtures;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import static org.assertj.core.api.Assertions.assertThat;

class LoggingAuditSinkTest {

    private final Logger channel = (Logger) LoggerFactory.getLogger(LoggingAuditSink.CHANNEL);
    private final ListAppender<ILoggingEvent> appender = new ListAppender<>();

    @BeforeEach
    void attach() {
        appender.start();
        channel.addAppender(appender);
    }

    @AfterEach
    void detach() {
        channel.detachAppender(appender);
    }

    @Test
    void every_event_is_written_to_the_audit_channel_as_json() {
        new LoggingAuditSink(Fixtures.mapper()).record(DomainEvent.scheduleContentCreated(Fixtures.abc123()));

        assertThat(appender.list).singleElement().satisfies(e -> {
            assertThat(e.getFormattedMessage()).contains("\"detailType\":\"ScheduleContentCreated\"");
            assertThat(e.getFormattedMessage()).contains("\"id\":\"abc123\"");
        });
    }
}
