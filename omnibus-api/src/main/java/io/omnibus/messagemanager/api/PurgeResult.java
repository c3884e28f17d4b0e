package io.omnibus.messagemanager.api;

/**
 * Outcome of a purge: how many messages were removed.
 */
public final class PurgeResult {
    private final long _removedCount;

    public PurgeResult(long removedCount) {
        _removedCount = removedCount;
    }

    public long getRemovedCount() {
        return _removedCount;
    }

    @Override
    public String toString() {
        return "PurgeResult{removedCount=" + _removedCount + "}";
    }
}
