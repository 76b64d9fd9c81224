package com.aiwriter.schedule.jetstream.consumer;

/**
 * How a pulled message is settled once its handler is done with it.
 */
public enum AckDecision {

    /** Processed; remove from the stream. */
    ACK,

    /** Not processed; redeliver as soon as possible. */
    NAK,

    /** Not processed; redeliver after the consumer's NAK delay. */
    NAK_WITH_DELAY,

    /** Never redeliver. */
    TERM
}
