package io.omnibus.messagemanager.activemq;

/**
 * Constants for the ActiveMQ transport.
 */
public interface Statics {

    String BROKER_TYPE = "ActiveMQ";

    // :: For ActiveMqQueueLister, querying the StatisticsBrokerPlugin

    String QUERY_REQUEST_DESTINATION_PREFIX = "ActiveMQ.Statistics.Destination";
    /**
     * Property making the StatisticsBrokerPlugin end its replies with an empty MapMessage.
     */
    String QUERY_REQUEST_DENOTE_END_LIST = "ActiveMQ.Statistics.Destination.List.End.With.Null";

    /**
     * How long to wait for the first statistics reply. If none arrives, the plugin is assumed not installed.
     */
    int TIMEOUT_MILLIS_FOR_FIRST_STATS_REPLY = 1000;
    int TIMEOUT_MILLIS_FOR_NEXT_STATS_REPLY = 250;

    /**
     * How long to let destination advisories arrive on a new connection before reading the queues.
     */
    int ADVISORY_SETTLE_MILLIS = 500;

    /**
     * Queues with this prefix are the broker's own, and not listed.
     */
    String ACTIVEMQ_INTERNAL_PREFIX = "ActiveMQ.";

    String QUEUE_URL_PREFIX = "queue://";

    /**
     * Converts nanos to millis with 3 decimals.
     */
    default double ms3(long nanosTaken) {
        return Math.round(nanosTaken / 1000d) / 1000d;
    }
}
