package com.aiwriter.schedule.core.error;

/**
 * A change feed entry, bus event or dispatch payload does not have the expected
 * shape: a required field is missing, has the wrong type, or the schedule is not
 * a real calendar date/time.
 */
public class MalformedEventException extends ContentScheduleException {

    public MalformedEventException(String message) {
        super(message);
    }

    public MalformedEventException(String message, Throwable cause) {
        super(message, cause);
    }
}
