package io.omnibus.messagemanager.api;

/**
 * Creates unstarted {@link BrokerTransport}s for one {@link BrokerKind}. The connection registry holds one factory per
 * broker kind, and starts the transports it creates.
 */
public interface BrokerTransportFactory {
    BrokerKind getBrokerKind();

    /**
     * @return a new, not yet started, transport for the given connection.
     * @throws IllegalArgumentException
     *             if the endpoint is not usable for this broker kind.
     */
    BrokerTransport createTransport(ConnectionDefinition definition);
}
