package io.omnibus.messagemanager.api;

/**
 * More than one drained message had the requested id, and the duplicate-id policy is to abort. All drained messages
 * have been put back on the queue before this is thrown.
 */
public class AmbiguousMessageIdException extends MessageOperationException {
    private final String _queueId;
    private final String _messageId;
    private final int _occurrences;

    public AmbiguousMessageIdException(String queueId, String messageId, int occurrences) {
        super("Message id [" + messageId + "] occurred [" + occurrences + "] times in queue [" + queueId
                + "], refusing to pick one.");
        _queueId = queueId;
        _messageId = messageId;
        _occurrences = occurrences;
    }

    public String getQueueId() {
        return _queueId;
    }

    public String getMessageId() {
        return _messageId;
    }

    public int getOccurrences() {
        return _occurrences;
    }
}
