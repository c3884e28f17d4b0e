package io.omnibus.messagemanager.api;

/**
 * The target message id was not present in the queue after a full drain. All drained non-target messages have been
 * republished to the queue before this is thrown.
 */
public class MessageNotFoundException extends MessageOperationException {
    private final String _queueId;
    private final String _messageId;

    public MessageNotFoundException(String queueId, String messageId) {
        super("Message [" + messageId + "] not found in queue [" + queueId + "]");
        _queueId = queueId;
        _messageId = messageId;
    }

    public String getQueueId() {
        return _queueId;
    }

    public String getMessageId() {
        return _messageId;
    }
}
