package io.omnibus.messagemanager.core;

import java.io.IOException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.Date;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.omnibus.messagemanager.api.BrokerMessage;
import io.omnibus.messagemanager.api.ProviderFieldNames;
import io.omnibus.messagemanager.api.RawMessage;

/**
 * Turns the {@link RawMessage}s of any broker into {@link BrokerMessage}s. Never throws on missing or odd optional
 * fields: they get defaults.
 * <p/>
 * The message id is a pure function of the raw message: the provider's message id if present and non-blank, else the
 * provider's sequence number as <code>"seq-&lt;n&gt;"</code>, else <code>"h-&lt;16 hex chars of SHA-256(body)&gt;-
 * &lt;position&gt;"</code>. Two reads of an unchanged queue thus derive the same ids, which is what makes delete and
 * move by id possible on brokers without ids.
 */
public class MessageProjection {
    private static final Logger log = LoggerFactory.getLogger(MessageProjection.class);

    // Epoch values below this are taken as seconds: 1e11 seconds is year 5138, while 1e11 millis is early 1973.
    private static final long EPOCH_SECONDS_THRESHOLD = 100_000_000_000L;

    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private final ObjectMapper _objectMapper;
    private final Clock _clock;

    private MessageProjection(ObjectMapper objectMapper, Clock clock) {
        _objectMapper = objectMapper;
        _clock = clock;
    }

    public static MessageProjection create() {
        return new MessageProjection(new ObjectMapper(), Clock.systemUTC());
    }

    /**
     * @param clock
     *            gives "now" for messages without an enqueued time.
     */
    public static MessageProjection create(ObjectMapper objectMapper, Clock clock) {
        if (objectMapper == null) {
            throw new NullPointerException("objectMapper");
        }
        if (clock == null) {
            throw new NullPointerException("clock");
        }
        return new MessageProjection(objectMapper, clock);
    }

    public BrokerMessage normalize(RawMessage raw) {
        if (raw == null) {
            throw new NullPointerException("raw");
        }
        ProviderFieldNames names = ProviderFieldNames.forKind(raw.getBrokerKind());
        String id = deriveId(raw);
        Long sequence = sequenceNumber(raw, names);

        String label = stringValue(property(raw, names.getLabel()));
        if (label == null) {
            label = id;
        }

        boolean redelivered = raw.isRedelivered()
                || Boolean.TRUE.equals(property(raw, names.getRedelivered()))
                || "true".equalsIgnoreCase(stringValue(property(raw, names.getRedelivered())));

        Integer providerDeliveryCount = intValue(property(raw, names.getDeliveryCount()));
        int deliveryCount = providerDeliveryCount != null
                ? providerDeliveryCount
                : redelivered ? 1 : 0;

        Instant enqueuedAt = toInstant(property(raw, names.getEnqueuedTime()));
        if (enqueuedAt == null) {
            enqueuedAt = _clock.instant();
        }

        return new BrokerMessage(id, sequence, label, enqueuedAt, deliveryCount, redelivered, raw.getProperties(),
                raw.getHeaders(), raw.getContentType(), raw.getBody(), parseJson(raw.getBody()));
    }

    /**
     * The id derivation, see class JavaDoc.
     */
    public static String deriveId(RawMessage raw) {
        ProviderFieldNames names = ProviderFieldNames.forKind(raw.getBrokerKind());
        String providerId = stringValue(property(raw, names.getMessageId()));
        if (providerId != null && !providerId.trim().isEmpty()) {
            return providerId;
        }
        Long sequence = sequenceNumber(raw, names);
        if (sequence != null) {
            return "seq-" + sequence;
        }
        return "h-" + sha256Hex16(raw.getBody()) + "-" + raw.getPosition();
    }

    /**
     * Interprets the many shapes brokers use for timestamps: epoch seconds or millis as numbers or numeric strings,
     * ISO-8601 strings, {@link Date}, {@link Instant} and other {@link TemporalAccessor}s with an offset.
     *
     * @return the instant, or <code>null</code> if the value is absent or not understood.
     */
    public static Instant toInstant(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Instant) {
            return (Instant) value;
        }
        if (value instanceof Date) {
            return ((Date) value).toInstant();
        }
        if (value instanceof OffsetDateTime) {
            return ((OffsetDateTime) value).toInstant();
        }
        if (value instanceof ZonedDateTime) {
            return ((ZonedDateTime) value).toInstant();
        }
        if (value instanceof Number) {
            return fromEpoch(((Number) value).longValue());
        }
        String text = value.toString().trim();
        if (text.isEmpty()) {
            return null;
        }
        try {
            return fromEpoch(Long.parseLong(text));
        }
        catch (NumberFormatException e) {
            // Not numeric, try ISO below.
        }
        try {
            return OffsetDateTime.parse(text).toInstant();
        }
        catch (DateTimeParseException e) {
            log.debug("Could not parse timestamp [" + text + "], ignoring it.");
            return null;
        }
    }

    private static Instant fromEpoch(long epoch) {
        if (epoch <= 0) {
            return null;
        }
        return epoch < EPOCH_SECONDS_THRESHOLD
                ? Instant.ofEpochSecond(epoch)
                : Instant.ofEpochMilli(epoch);
    }

    private JsonNode parseJson(byte[] body) {
        // ?: Does it look like a JSON object or array?
        int first = firstNonWhitespace(body);
        if (first == -1 || (body[first] != '{' && body[first] != '[')) {
            // -> No, so don't bother.
            return null;
        }
        try {
            return _objectMapper.readTree(body);
        }
        catch (IOException e) {
            log.debug("Body looked like JSON but did not parse, keeping it as bytes only.");
            return null;
        }
    }

    private static int firstNonWhitespace(byte[] body) {
        for (int i = 0; i < body.length; i++) {
            if (!Character.isWhitespace(body[i])) {
                return i;
            }
        }
        return -1;
    }

    private static Long sequenceNumber(RawMessage raw, ProviderFieldNames names) {
        Object value = property(raw, names.getSequenceNumber());
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        String text = stringValue(value);
        if (text == null) {
            return null;
        }
        try {
            return Long.parseLong(text.trim());
        }
        catch (NumberFormatException e) {
            return null;
        }
    }

    private static Object property(RawMessage raw, String name) {
        return name == null ? null : raw.getProperty(name);
    }

    private static String stringValue(Object value) {
        return value == null ? null : value.toString();
    }

    private static Integer intValue(Object value) {
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        if (value == null) {
            return null;
        }
        try {
            return Integer.parseInt(value.toString().trim());
        }
        catch (NumberFormatException e) {
            return null;
        }
    }

    private static String sha256Hex16(byte[] body) {
        byte[] digest;
        try {
            digest = MessageDigest.getInstance("SHA-256").digest(body);
        }
        catch (NoSuchAlgorithmException e) {
            throw new AssertionError("SHA-256 is mandated by the JDK.", e);
        }
        char[] hex = new char[16];
        for (int i = 0; i < 8; i++) {
            hex[i * 2] = HEX[(digest[i] >> 4) & 0xF];
            hex[i * 2 + 1] = HEX[digest[i] & 0xF];
        }
        return new String(hex);
    }
}
