package com.aiwriter.schedule.core.port;

import com.aiwriter.schedule.core.model.DomainEvent;

/**
 * Receives a copy of every event seen on the bus, matched or not.
 *
 * <p>Implementations must not throw for ordinary failures; the router guards
 * against it anyway.</p>
 */
public interface AuditSink {

    void record(DomainEvent event);
}
