package io.omnibus.messagemanager.api;

public final class BrokerSubscription {
    private final String _id;
    private final String _name;
    private final String _topicName;
    private final long _messageCount;

    public BrokerSubscription(String id, String name, String topicName, long messageCount) {
        _id = id;
        _name = name;
        _topicName = topicName;
        _messageCount = Math.max(0, messageCount);
    }

    public String getId() {
        return _id;
    }

    public String getName() {
        return _name;
    }

    public String getTopicName() {
        return _topicName;
    }

    public long getMessageCount() {
        return _messageCount;
    }

    @Override
    public String toString() {
        return "BrokerSubscription{" + _topicName + "/" + _name + ", messages=" + _messageCount + "}";
    }
}
