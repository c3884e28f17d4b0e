package io.omnibus.messagemanager.api;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A message as a {@link BrokerTransport} hands it out from drain or peek, before normalization. The
 * <code>properties</code> map holds the broker's own message properties under the broker's own names (e.g.
 * <code>message_id</code> for RabbitMQ, <code>messageId</code> for Azure Service Bus, <code>JMSMessageID</code> for
 * JMS), while <code>headers</code> holds the application headers which are carried over on republish.
 */
public final class RawMessage {
    private final BrokerKind _brokerKind;
    private final int _position;
    private final Map<String, Object> _properties;
    private final Map<String, Object> _headers;
    private final String _contentType;
    private final byte[] _body;
    private final boolean _redelivered;

    private RawMessage(BrokerKind brokerKind, int position, Map<String, Object> properties,
            Map<String, Object> headers, String contentType, byte[] body, boolean redelivered) {
        _brokerKind = brokerKind;
        _position = position;
        _properties = properties;
        _headers = headers;
        _contentType = contentType;
        _body = body;
        _redelivered = redelivered;
    }

    /**
     * @param position
     *            the 0-based position of this message within the drain or peek batch it came from.
     */
    public static RawMessage create(BrokerKind brokerKind, int position, Map<String, Object> properties,
            Map<String, Object> headers, String contentType, byte[] body, boolean redelivered) {
        if (brokerKind == null) {
            throw new NullPointerException("brokerKind");
        }
        if (position < 0) {
            throw new IllegalArgumentException("position must be >= 0 [" + position + "]");
        }
        return new RawMessage(brokerKind, position,
                properties == null ? Collections.emptyMap()
                        : Collections.unmodifiableMap(new LinkedHashMap<>(properties)),
                headers == null ? Collections.emptyMap()
                        : Collections.unmodifiableMap(new LinkedHashMap<>(headers)),
                contentType,
                body == null ? new byte[0] : body,
                redelivered);
    }

    /**
     * Convenience for tests and simple transports: a message with a text body, given message id and no headers.
     */
    public static RawMessage ofText(BrokerKind brokerKind, int position, String messageId, String body) {
        Map<String, Object> props = new LinkedHashMap<>();
        if (messageId != null) {
            props.put(ProviderFieldNames.forKind(brokerKind).getMessageId(), messageId);
        }
        return create(brokerKind, position, props, null, null, body.getBytes(StandardCharsets.UTF_8), false);
    }

    public BrokerKind getBrokerKind() {
        return _brokerKind;
    }

    public int getPosition() {
        return _position;
    }

    public Map<String, Object> getProperties() {
        return _properties;
    }

    public Object getProperty(String name) {
        return _properties.get(name);
    }

    public Map<String, Object> getHeaders() {
        return _headers;
    }

    /**
     * @return the content type, or <code>null</code> if the broker did not convey one.
     */
    public String getContentType() {
        return _contentType;
    }

    /**
     * @return the body bytes, never <code>null</code>. Not copied: do not modify.
     */
    public byte[] getBody() {
        return _body;
    }

    public boolean isRedelivered() {
        return _redelivered;
    }

    /**
     * @return a copy of this message with a different position, used when a transport renumbers a multi-round read.
     */
    public RawMessage withPosition(int position) {
        return new RawMessage(_brokerKind, position, _properties, _headers, _contentType, _body, _redelivered);
    }

    @Override
    public String toString() {
        return "RawMessage{" + _brokerKind + "#" + _position + ", properties=" + _properties.keySet() + ", bodyBytes="
                + _body.length + "}";
    }
}
