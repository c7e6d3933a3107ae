package com.whereq.forge.worker;

/**
 * What a worker did with one received message
 */
public enum MessageOutcome {
    /**
     * Result recorded, message deleted
     */
    COMPLETED(true),

    /**
     * Permanent failure recorded, message deleted
     */
    FAILED(true),

    /**
     * Delivered too often; job failed as exhausted, message deleted
     */
    EXHAUSTED(true),

    /**
     * Transient failure with deliveries left; message left for redelivery
     */
    RETRY(false),

    /**
     * Job was already terminal; message deleted without work
     */
    DUPLICATE(true),

    /**
     * Job became terminal while generating (cancelled, or another delivery won); result dropped, message deleted
     */
    DISCARDED(true),

    /**
     * No job record for the message; message deleted
     */
    ORPHANED(true),

    /**
     * Body could not be parsed; message deleted
     */
    MALFORMED(true),

    /**
     * Infrastructure error; message left for redelivery
     */
    ERROR(false);

    private final boolean acknowledged;

    MessageOutcome(boolean acknowledged) {
        this.acknowledged = acknowledged;
    }

    /**
     * Whether the worker deletes the message for this outcome
     */
    public boolean isAcknowledged() {
        return acknowledged;
    }
}
