package io.omnibus.messagemanager.api;

/**
 * Thrown if problems talking with the broker, e.g. for JMS, if <code>JMSException</code> is raised, or for RabbitMQ if
 * the management API answers with a non-2xx status. Connection-level failures are fatal to the transport instance and
 * are never retried inside the transport: retry policy belongs to the mutation engine and the bulk coordinator.
 */
public class BrokerIOException extends MessageOperationException {
    public BrokerIOException(String message) {
        super(message);
    }

    public BrokerIOException(String message, Throwable cause) {
        super(message, cause);
    }
}
