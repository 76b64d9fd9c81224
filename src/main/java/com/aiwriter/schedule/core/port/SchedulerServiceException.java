package com.aiwriter.schedule.core.port;

/**
 * Failure reported by a {@link JobSchedulerClient} implementation.
 *
 * <p>{@code transient} failures (I/O, timeouts, throttling) may succeed when
 * retried; permanent ones (invalid target, bad request, access denied) will not.</p>
 */
public class SchedulerServiceException extends RuntimeException {

    private final boolean transientFailure;

    public SchedulerServiceException(String message, boolean transientFailure, Throwable cause) {
        super(message, cause);
        this.transientFailure = transientFailure;
    }

    public static SchedulerServiceException transientFailure(String message, Throwable cause) {
        return new SchedulerServiceException(message, true, cause);
    }

    public static SchedulerServiceException permanentFailure(String message, Throwable cause) {
        return new SchedulerServiceException(message, false, cause);
    }

    public boolean isTransient() {
        return transientFailure;
    }
}
