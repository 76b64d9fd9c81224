package com.aiwriter.schedule.core.error;

/**
 * A fired job could not be handed to distribution.
 *
 * <p>The job is already gone (delete-after-fire), so this is terminal for the
 * post and only gets logged.</p>
 */
public class DispatchException extends ContentScheduleException {

    public DispatchException(String message) {
        super(message);
    }

    public DispatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
