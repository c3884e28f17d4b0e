package io.omnibus.messagemanager.api;

public final class BrokerTopic {
    private final String _id;
    private final String _name;
    private final int _subscriptionCount;

    public BrokerTopic(String id, String name, int subscriptionCount) {
        _id = id;
        _name = name;
        _subscriptionCount = Math.max(0, subscriptionCount);
    }

    public String getId() {
        return _id;
    }

    public String getName() {
        return _name;
    }

    public int getSubscriptionCount() {
        return _subscriptionCount;
    }

    @Override
    public String toString() {
        return "BrokerTopic{" + _name + ", subscriptions=" + _subscriptionCount + "}";
    }
}
