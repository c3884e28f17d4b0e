package io.omnibus.messagemanager.api;

/**
 * A confirmed publish did not get its receipt within the receipt timeout. The outcome is <b>ambiguous</b>: the broker
 * may or may not have admitted the message. Callers must not treat this as a plain failure - a retry may produce a
 * duplicate, which is accepted (at-least-once), while treating it as "not sent" could lose the message.
 */
public class ReceiptTimeoutException extends BrokerIOException {
    private final String _queueId;
    private final String _receiptId;

    public ReceiptTimeoutException(String queueId, String receiptId, long timeoutMillis) {
        super("No receipt for publish to [" + queueId + "] within [" + timeoutMillis + "] ms, receiptId ["
                + receiptId + "] - the message may or may not have been admitted by the broker.");
        _queueId = queueId;
        _receiptId = receiptId;
    }

    public ReceiptTimeoutException(String queueId, String receiptId, long timeoutMillis, Throwable cause) {
        super("No receipt for publish to [" + queueId + "] within [" + timeoutMillis + "] ms, receiptId ["
                + receiptId + "] - the message may or may not have been admitted by the broker.", cause);
        _queueId = queueId;
        _receiptId = receiptId;
    }

    public String getQueueId() {
        return _queueId;
    }

    public String getReceiptId() {
        return _receiptId;
    }
}
