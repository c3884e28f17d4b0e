package io.omnibus.messagemanager.core;

/**
 * The phases a mutation operation goes through. Once {@link #DRAINING} has removed messages from the queue, the
 * operation ends in either {@link #COMPLETED} or {@link #ABORTED}, and in both cases every drained message which was
 * not targeted has been published back.
 */
public enum OperationPhase {
    DRAINING,

    CLASSIFYING,

    REPUBLISHING,

    COMPLETED,

    ABORTED;

    public boolean isTerminal() {
        return this == COMPLETED || this == ABORTED;
    }
}
