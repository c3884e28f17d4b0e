package io.omnibus.messagemanager.api;

/**
 * The names under which each broker kind puts its own message properties into {@link RawMessage#getProperties()}.
 * A <code>null</code> name means that the broker does not have such a property.
 */
public enum ProviderFieldNames {
    RABBITMQ("message_id", null, "type", "timestamp", null, "redelivered"),

    AZURE_SERVICE_BUS("messageId", "sequenceNumber", "subject", "enqueuedTimeUtc", "deliveryCount", null),

    JMS("JMSMessageID", null, "JMSType", "JMSTimestamp", "JMSXDeliveryCount", "JMSRedelivered");

    private final String _messageId;
    private final String _sequenceNumber;
    private final String _label;
    private final String _enqueuedTime;
    private final String _deliveryCount;
    private final String _redelivered;

    ProviderFieldNames(String messageId, String sequenceNumber, String label, String enqueuedTime,
            String deliveryCount, String redelivered) {
        _messageId = messageId;
        _sequenceNumber = sequenceNumber;
        _label = label;
        _enqueuedTime = enqueuedTime;
        _deliveryCount = deliveryCount;
        _redelivered = redelivered;
    }

    public static ProviderFieldNames forKind(BrokerKind brokerKind) {
        switch (brokerKind) {
            case RABBITMQ:
                return RABBITMQ;
            case AZURE_SERVICE_BUS:
                return AZURE_SERVICE_BUS;
            case ACTIVEMQ:
            case JMS:
                return JMS;
            default:
                throw new AssertionError("Unknown BrokerKind [" + brokerKind + "]");
        }
    }

    public String getMessageId() {
        return _messageId;
    }

    public String getSequenceNumber() {
        return _sequenceNumber;
    }

    public String getLabel() {
        return _label;
    }

    public String getEnqueuedTime() {
        return _enqueuedTime;
    }

    public String getDeliveryCount() {
        return _deliveryCount;
    }

    public String getRedelivered() {
        return _redelivered;
    }
}
