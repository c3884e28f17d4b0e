package io.omnibus.messagemanager.azure;

import java.time.Duration;

/**
 * Constants for the Azure Service Bus transport.
 */
public interface Statics {

    String BROKER_TYPE = "Azure Service Bus";

    /**
     * How long a confirmed send waits for the broker's disposition. Sends are not retried by the client library, as a
     * retry after a timeout would give an ambiguous outcome anyway.
     * <p>
     * Value is <code>10_000</code>.
     */
    long RECEIPT_TIMEOUT_MILLIS = 10_000;

    Duration FIRST_RECEIVE_WAIT = Duration.ofMillis(2_000);

    Duration SUBSEQUENT_RECEIVE_WAIT = Duration.ofMillis(500);

    /**
     * Max per peek call; the service caps a peek batch a bit above this.
     */
    int PEEK_BATCH_SIZE = 250;

    /**
     * Max messages per lock-based receive when deleting from a subscription.
     */
    int LOCK_RECEIVE_BATCH_SIZE = 100;

    /**
     * How many messages a subscription delete holds under lock while looking for the match.
     */
    int LOCK_SCAN_MAX_MESSAGES = 1_000;

    String ENDPOINT_PREFIX = "Endpoint=";

    // :: Names of Service Bus message fields put in RawMessage's properties, beyond the ProviderFieldNames ones

    String RAW_PROP_CORRELATION_ID = "correlationId";
    String RAW_PROP_SESSION_ID = "sessionId";
    String RAW_PROP_TIME_TO_LIVE = "timeToLive";

    /**
     * Converts nanos to millis with 3 decimals.
     */
    default double ms3(long nanosTaken) {
        return Math.round(nanosTaken / 1000d) / 1000d;
    }
}
