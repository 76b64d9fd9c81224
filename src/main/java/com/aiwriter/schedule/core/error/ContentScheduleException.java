package com.aiwriter.schedule.core.error;

/**
 * Base type of every failure raised by the scheduling pipeline.
 *
 * <p>Unchecked: failures travel through Reactor signals and are mapped to
 * ACK/NAK/TERM decisions at the consumer boundary.</p>
 */
public abstract class ContentScheduleException extends RuntimeException {

    protected ContentScheduleException(String message) {
        super(message);
    }

    protected ContentScheduleException(String message, Throwable cause) {
        super(message, cause);
    }
}
