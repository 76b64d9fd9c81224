package com.aiwriter.schedule.core.port;

/**
 * Outcome of a successful {@link JobSchedulerClient#createJob} call.
 */
public enum JobCreation {

    /** A new job was stored. */
    CREATED,

    /** A job with the same name already exists in the group; nothing was changed. */
    ALREADY_EXISTS
}
