package io.omnibus.messagemanager.api;

/**
 * Some chunks or messages of a bulk operation failed. The contained {@link BulkResult} enumerates them. The failed
 * messages still reside in the source queue.
 *
 * @see BulkResult#throwIfAnyFailed()
 */
public class PartialFailureException extends MessageOperationException {
    private final BulkResult _result;

    public PartialFailureException(BulkResult result) {
        super("Bulk operation partially failed: [" + result.getSuccessCount() + "] succeeded, ["
                + result.getFailCount() + "] failed, in [" + result.getFailures().size() + "] failure(s).");
        _result = result;
    }

    public BulkResult getResult() {
        return _result;
    }
}
