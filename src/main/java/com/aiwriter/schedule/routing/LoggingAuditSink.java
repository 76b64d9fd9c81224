package com.aiwriter.schedule.routing;

import com.aiwriter.schedule.core.model.DomainEvent;
import com.aiwriter.schedule.core.port.AuditSink;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes every bus event to the {@code audit.events} log channel as one JSON line.
 */
public class LoggingAuditSink implements AuditSink {

    static final String CHANNEL = "audit.events";

    private static final Logger audit = LoggerFactory.getLogger(CHANNEL);

    private final ObjectMapper mapper;

    public LoggingAuditSink(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public void record(DomainEvent event) {
        try {
            audit.info("{}", mapper.writeValueAsString(event));
        } catch (JsonProcessingException e) {
            audit.warn("Unserializable event source={} detailType={} err={}",
                    event.source(), event.detailType(), e.getMessage());
        }
    }
}
