package io.omnibus.messagemanager.api;

/**
 * The kinds of brokers a {@link BrokerTransport} can talk to. Used by the connection registry to pick the
 * {@link BrokerTransportFactory}, and by the message projection to know which provider field names to read.
 */
public enum BrokerKind {
    RABBITMQ("rabbitmq"),

    AZURE_SERVICE_BUS("azure-service-bus"),

    ACTIVEMQ("activemq"),

    /**
     * Any other JMS broker, accessed through a plain JMS <code>ConnectionFactory</code>.
     */
    JMS("jms");

    private final String _typeName;

    BrokerKind(String typeName) {
        _typeName = typeName;
    }

    /**
     * @return the lower-case type name, as used in saved connection profiles, e.g. <code>"rabbitmq"</code>.
     */
    public String getTypeName() {
        return _typeName;
    }

    public static BrokerKind fromTypeName(String typeName) {
        if (typeName == null) {
            throw new NullPointerException("typeName");
        }
        for (BrokerKind kind : values()) {
            if (kind._typeName.equalsIgnoreCase(typeName) || kind.name().equalsIgnoreCase(typeName)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unsupported broker type [" + typeName + "]");
    }
}
