package io.omnibus.messagemanager.api;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * The normalized, broker-independent view of a message. Immutable: an edit is a delete followed by a send of a new
 * message. The {@link #getId() id} is derived deterministically from the raw message, so that a message read twice
 * produces the same id as long as its position in the queue has not changed.
 */
public final class BrokerMessage {
    private final String _id;
    private final Long _sequenceHint;
    private final String _label;
    private final int _sizeBytes;
    private final Instant _enqueuedAt;
    private final int _deliveryCount;
    private final boolean _redelivered;
    private final Map<String, Object> _rawProperties;
    private final Map<String, Object> _headers;
    private final String _contentType;
    private final byte[] _body;
    private final JsonNode _jsonBody;

    public BrokerMessage(String id, Long sequenceHint, String label, Instant enqueuedAt, int deliveryCount,
            boolean redelivered, Map<String, Object> rawProperties, Map<String, Object> headers, String contentType,
            byte[] body, JsonNode jsonBody) {
        if (id == null) {
            throw new NullPointerException("id");
        }
        if (body == null) {
            throw new NullPointerException("body");
        }
        _id = id;
        _sequenceHint = sequenceHint;
        _label = label;
        _sizeBytes = body.length;
        _enqueuedAt = enqueuedAt;
        _deliveryCount = deliveryCount;
        _redelivered = redelivered;
        _rawProperties = rawProperties;
        _headers = headers;
        _contentType = contentType;
        _body = body;
        _jsonBody = jsonBody;
    }

    public String getId() {
        return _id;
    }

    /**
     * @return the broker's sequence number, if it assigns one (Azure Service Bus).
     */
    public OptionalLong getSequenceHint() {
        return _sequenceHint == null ? OptionalLong.empty() : OptionalLong.of(_sequenceHint);
    }

    public String getLabel() {
        return _label;
    }

    public int getSizeBytes() {
        return _sizeBytes;
    }

    public Instant getEnqueuedAt() {
        return _enqueuedAt;
    }

    public int getDeliveryCount() {
        return _deliveryCount;
    }

    public boolean isRedelivered() {
        return _redelivered;
    }

    public Map<String, Object> getRawProperties() {
        return _rawProperties;
    }

    public Map<String, Object> getHeaders() {
        return _headers;
    }

    public String getContentType() {
        return _contentType;
    }

    public byte[] getBody() {
        return _body;
    }

    public String getBodyAsString() {
        return new String(_body, StandardCharsets.UTF_8);
    }

    /**
     * @return the body parsed as JSON, if it is JSON.
     */
    public Optional<JsonNode> getJsonBody() {
        return Optional.ofNullable(_jsonBody);
    }

    @Override
    public String toString() {
        return "BrokerMessage{id=" + _id + ", label=" + _label + ", size=" + _sizeBytes + ", enqueuedAt="
                + _enqueuedAt + ", deliveryCount=" + _deliveryCount + "}";
    }
}
