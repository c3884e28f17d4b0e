package io.omnibus.messagemanager.api;

/**
 * The connection to the broker could not be established within the connect timeout.
 */
public class ConnectionTimeoutException extends BrokerIOException {
    public ConnectionTimeoutException(String message) {
        super(message);
    }

    public ConnectionTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
