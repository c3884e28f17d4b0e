package io.omnibus.messagemanager.core;

/**
 * Gets told whenever a mutation operation enters a phase, on the thread running the operation. A listener throwing
 * from a non-terminal phase halts the operation: it is then aborted, i.e. all drained messages not yet settled are
 * restored to the source queue, and the exception is rethrown. Exceptions from terminal phases are logged and
 * ignored.
 */
@FunctionalInterface
public interface OperationPhaseListener {
    /**
     * @param operation
     *            the operation name, e.g. <code>"deleteOne"</code> or <code>"moveMany"</code>.
     * @param queueId
     *            the source queue of the operation.
     * @param round
     *            the 1-based drain round, for operations needing more than one drain.
     */
    void phaseEntered(String operation, String queueId, int round, OperationPhase phase);
}
