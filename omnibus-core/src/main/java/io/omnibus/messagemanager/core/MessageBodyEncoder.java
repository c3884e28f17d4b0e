package io.omnibus.messagemanager.core;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Turns the bodies given to send and import into bytes: <code>byte[]</code> as is, a <code>String</code> as UTF-8
 * (content type JSON if it is JSON, else plain text), anything else serialized to JSON with Jackson.
 */
public class MessageBodyEncoder {
    public static final String CONTENT_TYPE_JSON = "application/json";
    public static final String CONTENT_TYPE_TEXT = "text/plain";
    public static final String CONTENT_TYPE_BINARY = "application/octet-stream";

    private final ObjectMapper _objectMapper;

    public MessageBodyEncoder(ObjectMapper objectMapper) {
        if (objectMapper == null) {
            throw new NullPointerException("objectMapper");
        }
        _objectMapper = objectMapper;
    }

    /**
     * @throws IllegalArgumentException
     *             if the body is <code>null</code> or cannot be serialized.
     */
    public EncodedBody encode(Object body) throws IllegalArgumentException {
        if (body == null) {
            throw new IllegalArgumentException("Message body is null.");
        }
        if (body instanceof byte[]) {
            return new EncodedBody((byte[]) body, CONTENT_TYPE_BINARY);
        }
        if (body instanceof String) {
            String text = (String) body;
            return new EncodedBody(text.getBytes(StandardCharsets.UTF_8), isJson(text)
                    ? CONTENT_TYPE_JSON
                    : CONTENT_TYPE_TEXT);
        }
        try {
            return new EncodedBody(_objectMapper.writeValueAsBytes(body), CONTENT_TYPE_JSON);
        }
        catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Could not serialize message body of type ["
                    + body.getClass().getName() + "] to JSON.", e);
        }
    }

    private boolean isJson(String text) {
        String trimmed = text.trim();
        if (!(trimmed.startsWith("{") || trimmed.startsWith("["))) {
            return false;
        }
        try {
            _objectMapper.readTree(trimmed);
            return true;
        }
        catch (IOException e) {
            return false;
        }
    }

    public static final class EncodedBody {
        private final byte[] _bytes;
        private final String _contentType;

        EncodedBody(byte[] bytes, String contentType) {
            _bytes = bytes;
            _contentType = contentType;
        }

        public byte[] getBytes() {
            return _bytes;
        }

        public String getContentType() {
            return _contentType;
        }
    }
}
