package io.omnibus.messagemanager.api;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * One or more drained messages could not be put back where they belong: they are now in neither the source nor the
 * destination queue, only in this exception. This is never retried silently - the caller gets the exact list of
 * affected messages, with bodies, so that manual recovery can be attempted.
 */
public class DataLossRiskException extends MessageOperationException {
    private final String _queueId;
    private final List<AffectedMessage> _affectedMessages;
    private final int _unaccountedCount;
    private final BulkResult _partialResult; // nullable

    public DataLossRiskException(String queueId, List<AffectedMessage> affectedMessages, Throwable cause) {
        this("DATA LOSS RISK: [" + affectedMessages.size() + "] drained message(s) from [" + queueId
                + "] could not be republished and are missing from the queue: " + ids(affectedMessages), queueId,
                affectedMessages, 0, null, cause);
    }

    /**
     * For a drain whose answer never arrived: the broker may have removed up to <code>unaccountedCount</code>
     * messages, which are then known to no one.
     */
    public DataLossRiskException(String queueId, int unaccountedCount, Throwable cause) {
        this("DATA LOSS RISK: a drain of up to [" + unaccountedCount + "] message(s) from [" + queueId
                + "] was sent, but its answer was lost. Those messages may be gone from the queue, check it.",
                queueId, Collections.emptyList(), unaccountedCount, null, cause);
    }

    private DataLossRiskException(String message, String queueId, List<AffectedMessage> affectedMessages,
            int unaccountedCount, BulkResult partialResult, Throwable cause) {
        super(message, cause);
        _queueId = queueId;
        _affectedMessages = Collections.unmodifiableList(new ArrayList<>(affectedMessages));
        _unaccountedCount = unaccountedCount;
        _partialResult = partialResult;
    }

    /**
     * @return a copy of this exception which also carries the result of the bulk chunks that completed before the
     *         loss was detected.
     */
    public DataLossRiskException withPartialResult(BulkResult partialResult) {
        DataLossRiskException copy = new DataLossRiskException(getMessage(), _queueId, _affectedMessages,
                _unaccountedCount, partialResult, getCause());
        copy.setStackTrace(getStackTrace());
        return copy;
    }

    public String getQueueId() {
        return _queueId;
    }

    public List<AffectedMessage> getAffectedMessages() {
        return _affectedMessages;
    }

    /**
     * @return how many messages may have been removed without being seen, <code>0</code> when all affected messages
     *         are in {@link #getAffectedMessages()}.
     */
    public int getUnaccountedCount() {
        return _unaccountedCount;
    }

    public Optional<BulkResult> getPartialResult() {
        return Optional.ofNullable(_partialResult);
    }

    private static String ids(List<AffectedMessage> affectedMessages) {
        StringBuilder buf = new StringBuilder("[");
        for (int i = 0; i < affectedMessages.size(); i++) {
            if (i > 0) {
                buf.append(", ");
            }
            buf.append(affectedMessages.get(i).getMessageId());
        }
        return buf.append(']').toString();
    }

    /**
     * A message that is no longer on any queue: its id, the queue it was meant to go to, and its body.
     */
    public static final class AffectedMessage {
        private final String _messageId;
        private final String _intendedQueueId;
        private final byte[] _body;

        public AffectedMessage(String messageId, String intendedQueueId, byte[] body) {
            _messageId = messageId;
            _intendedQueueId = intendedQueueId;
            _body = body;
        }

        public String getMessageId() {
            return _messageId;
        }

        public String getIntendedQueueId() {
            return _intendedQueueId;
        }

        public byte[] getBody() {
            return _body;
        }

        public String getBodyAsString() {
            return new String(_body, StandardCharsets.UTF_8);
        }

        @Override
        public String toString() {
            return "AffectedMessage{id=" + _messageId + ", intendedQueue=" + _intendedQueueId + ", bodyBytes="
                    + _body.length + "}";
        }
    }
}
