package io.omnibus.messagemanager.api;

/**
 * Root of all exceptions raised by message operations. Unchecked, as the broker problems they represent can rarely be
 * handled at the call site other than by reporting them.
 */
public class MessageOperationException extends RuntimeException {
    public MessageOperationException(String message) {
        super(message);
    }

    public MessageOperationException(String message, Throwable cause) {
        super(message, cause);
    }
}
