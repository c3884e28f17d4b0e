package io.omnibus.messagemanager.core;

/**
 * What to do when more than one message in a drained batch derives the same id as a targeted id. Brokers do not
 * enforce unique message ids, so a producer sending the same id twice is a real case.
 */
public enum DuplicateIdPolicy {
    /**
     * Target the first message with the id, in queue order; the others are kept. Logs a warning.
     */
    FIRST_OCCURRENCE,

    /**
     * Target the last message with the id, in queue order; the others are kept. Logs a warning.
     */
    LAST_OCCURRENCE,

    /**
     * Put all drained messages back, and fail the operation with an
     * {@link io.omnibus.messagemanager.api.AmbiguousMessageIdException}.
     */
    ABORT
}
