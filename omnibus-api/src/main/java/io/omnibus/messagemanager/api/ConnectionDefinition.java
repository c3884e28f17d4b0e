package io.omnibus.messagemanager.api;

/**
 * What it takes to register a connection: an id, a human name, the broker kind and the endpoint string. The endpoint
 * string contains credentials, and is masked in {@link #toString()}.
 */
public final class ConnectionDefinition {
    private final String _id;
    private final String _name;
    private final BrokerKind _brokerKind;
    private final String _endpoint;

    private ConnectionDefinition(String id, String name, BrokerKind brokerKind, String endpoint) {
        _id = id;
        _name = name;
        _brokerKind = brokerKind;
        _endpoint = endpoint;
    }

    public static ConnectionDefinition create(String id, String name, BrokerKind brokerKind, String endpoint) {
        if (id == null) {
            throw new NullPointerException("id");
        }
        if (brokerKind == null) {
            throw new NullPointerException("brokerKind");
        }
        if (endpoint == null) {
            throw new NullPointerException("endpoint");
        }
        return new ConnectionDefinition(id, name == null ? id : name, brokerKind, endpoint);
    }

    public String getId() {
        return _id;
    }

    public String getName() {
        return _name;
    }

    public BrokerKind getBrokerKind() {
        return _brokerKind;
    }

    /**
     * @return the raw endpoint string, containing credentials: never log it.
     */
    public String getEndpoint() {
        return _endpoint;
    }

    public EndpointSpec getEndpointSpec() {
        return EndpointSpec.parse(_brokerKind, _endpoint);
    }

    @Override
    public String toString() {
        return "ConnectionDefinition{id=" + _id + ", name=" + _name + ", kind=" + _brokerKind + ", endpoint="
                + EndpointSpec.mask(_endpoint) + "}";
    }
}
