package io.omnibus.messagemanager.api;

/**
 * Snapshot of a registered connection: its definition and its liveness at the time of the call.
 */
public final class ConnectionInfo {
    private final ConnectionDefinition _definition;
    private final Liveness _liveness;

    public ConnectionInfo(ConnectionDefinition definition, Liveness liveness) {
        _definition = definition;
        _liveness = liveness;
    }

    public String getId() {
        return _definition.getId();
    }

    public String getName() {
        return _definition.getName();
    }

    public BrokerKind getBrokerKind() {
        return _definition.getBrokerKind();
    }

    public ConnectionDefinition getDefinition() {
        return _definition;
    }

    public Liveness getLiveness() {
        return _liveness;
    }

    public boolean isConnected() {
        return _liveness == Liveness.CONNECTED;
    }

    @Override
    public String toString() {
        return "ConnectionInfo{" + _definition + ", liveness=" + _liveness + "}";
    }

    /**
     * Only the connection registry changes a connection's liveness.
     */
    public enum Liveness {
        CONNECTING,

        CONNECTED,

        FAILED,

        DISCONNECTED
    }
}
