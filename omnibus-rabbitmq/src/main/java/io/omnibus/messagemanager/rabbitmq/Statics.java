package io.omnibus.messagemanager.rabbitmq;

/**
 * Constants for the RabbitMQ transport.
 */
public interface Statics {

    String BROKER_TYPE = "RabbitMQ";

    /**
     * How long a confirmed publish waits for the broker's ack.
     * <p>
     * Value is <code>5_000</code>.
     */
    long RECEIPT_TIMEOUT_MILLIS = 5_000;

    /**
     * AMQP connect timeout, within the registry's own connect timeout.
     * <p>
     * Value is <code>10_000</code>.
     */
    int AMQP_CONNECTION_TIMEOUT_MILLIS = 10_000;

    int DEFAULT_MANAGEMENT_PORT = 15672;

    // :: Management HTTP API

    long HTTP_CONNECT_TIMEOUT_MILLIS = 10_000;
    long HTTP_REQUEST_TIMEOUT_MILLIS = 60_000;

    /**
     * Ack mode for drain: the messages are removed.
     */
    String ACKMODE_DRAIN = "ack_requeue_false";

    /**
     * Ack mode for peek: the messages are put back where they were.
     */
    String ACKMODE_PEEK = "reject_requeue_true";

    String PAYLOAD_ENCODING_BASE64 = "base64";

    // :: Names of the non-property fields of a management API message, put in RawMessage's properties

    String RAW_PROP_EXCHANGE = "exchange";
    String RAW_PROP_ROUTING_KEY = "routing_key";
    String RAW_PROP_PAYLOAD_BYTES = "payload_bytes";

    /**
     * Converts nanos to millis with 3 decimals.
     */
    default double ms3(long nanosTaken) {
        return Math.round(nanosTaken / 1000d) / 1000d;
    }
}
