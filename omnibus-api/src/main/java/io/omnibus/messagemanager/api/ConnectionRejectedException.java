package io.omnibus.messagemanager.api;

/**
 * The broker refused the connection: bad credentials, missing permissions, or a protocol mismatch.
 */
public class ConnectionRejectedException extends BrokerIOException {
    public ConnectionRejectedException(String message) {
        super(message);
    }

    public ConnectionRejectedException(String message, Throwable cause) {
        super(message, cause);
    }
}
