package io.omnibus.messagemanager.api;

/**
 * Read-only projection of a queue on the broker. Never cached beyond a single catalog read.
 */
public final class BrokerQueue {
    private final String _id;
    private final String _name;
    private final long _approximateDepth;

    public BrokerQueue(String id, String name, long approximateDepth) {
        if (id == null) {
            throw new NullPointerException("id");
        }
        _id = id;
        _name = name == null ? id : name;
        // Brokers sometimes report transient negative counts, e.g. while messages are in flight.
        _approximateDepth = Math.max(0, approximateDepth);
    }

    public String getId() {
        return _id;
    }

    public String getName() {
        return _name;
    }

    /**
     * @return the number of messages the broker reported for this queue at read time, always <code>&gt;= 0</code>.
     */
    public long getApproximateDepth() {
        return _approximateDepth;
    }

    @Override
    public String toString() {
        return "BrokerQueue{" + _name + ", depth=" + _approximateDepth + "}";
    }
}
