package com.aiwriter.schedule.core.model;

/**
 * What the scheduler does with a one-shot job once it has fired.
 */
public enum DisposalPolicy {

    /** Remove the job right after its single firing. */
    DELETE_AFTER_FIRE
}
