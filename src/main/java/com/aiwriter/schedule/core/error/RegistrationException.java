package com.aiwriter.schedule.core.error;

/**
 * The external scheduler rejected or failed a job creation.
 *
 * <p>{@link #isTransient()} tells the bus consumer whether redelivery may help
 * (NAK) or the failure needs an operator (TERM + alert).</p>
 */
public class RegistrationException extends ContentScheduleException {

    private final String jobName;
    private final boolean transientFailure;

    public RegistrationException(String jobName, boolean transientFailure, String message, Throwable cause) {
        super("Job registration failed name=" + jobName + " transient=" + transientFailure + ": " + message, cause);
        this.jobName = jobName;
        this.transientFailure = transientFailure;
    }

    public String getJobName() {
        return jobName;
    }

    public boolean isTransient() {
        return transientFailure;
    }
}
