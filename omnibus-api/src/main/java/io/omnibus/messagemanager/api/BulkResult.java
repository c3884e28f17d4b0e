package io.omnibus.messagemanager.api;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of a bulk operation: counts, not a boolean. Partial success is an expected outcome - every failure entry
 * describes a set of messages that is guaranteed to still reside in the source queue.
 */
public final class BulkResult {
    private final int _successCount;
    private final int _failCount;
    private final List<Failure> _failures;

    public BulkResult(int successCount, int failCount, List<Failure> failures) {
        if (successCount < 0) {
            throw new IllegalArgumentException("successCount must be >= 0 [" + successCount + "]");
        }
        if (failCount < 0) {
            throw new IllegalArgumentException("failCount must be >= 0 [" + failCount + "]");
        }
        _successCount = successCount;
        _failCount = failCount;
        _failures = Collections.unmodifiableList(new ArrayList<>(failures));
    }

    public static BulkResult empty() {
        return new BulkResult(0, 0, Collections.emptyList());
    }

    public int getSuccessCount() {
        return _successCount;
    }

    public int getFailCount() {
        return _failCount;
    }

    public List<Failure> getFailures() {
        return _failures;
    }

    public boolean isCompleteSuccess() {
        return _failCount == 0;
    }

    /**
     * @throws PartialFailureException
     *             if any message failed.
     */
    public BulkResult throwIfAnyFailed() throws PartialFailureException {
        if (_failCount > 0) {
            throw new PartialFailureException(this);
        }
        return this;
    }

    @Override
    public String toString() {
        return "BulkResult{successCount=" + _successCount + ", failCount=" + _failCount + ", failures="
                + _failures + "}";
    }

    /**
     * Why a set of messages failed.
     */
    public enum FailureReason {
        /**
         * The chunk failed on every attempt, e.g. broker I/O errors or ambiguous receipts.
         */
        RETRIES_EXHAUSTED,

        /**
         * The ids were not present in the queue.
         */
        NOT_FOUND,

        /**
         * A single body failed to be published (import).
         */
        PUBLISH_FAILED,

        /**
         * The calling thread was interrupted before the chunk was run.
         */
        CANCELLED
    }

    /**
     * A failed chunk (bulk delete/move: <code>index</code> is the chunk index) or a failed body (import:
     * <code>index</code> is the body's index in the input).
     */
    public static final class Failure {
        private final int _index;
        private final List<String> _ids;
        private final FailureReason _reason;
        private final String _detail;

        public Failure(int index, List<String> ids, FailureReason reason, String detail) {
            _index = index;
            _ids = Collections.unmodifiableList(new ArrayList<>(ids));
            _reason = reason;
            _detail = detail;
        }

        public int getIndex() {
            return _index;
        }

        public List<String> getIds() {
            return _ids;
        }

        public FailureReason getReason() {
            return _reason;
        }

        public String getDetail() {
            return _detail;
        }

        @Override
        public String toString() {
            return "Failure{index=" + _index + ", reason=" + _reason + ", ids=" + _ids.size() + ", detail='"
                    + _detail + "'}";
        }
    }
}
