package io.omnibus.messagemanager.core;

import java.util.Random;
import java.util.Set;

/**
 * Constants and small helpers shared by the core components.
 */
public interface Statics {

    /**
     * Max number of messages removed from a queue in one drain call.
     * <p>
     * Value is <code>1000</code>.
     */
    int DEFAULT_DRAIN_BATCH_SIZE = 1000;

    /**
     * Max number of ids handled per chunk of a bulk operation.
     * <p>
     * Value is <code>1000</code>.
     */
    int DEFAULT_CHUNK_SIZE = 1000;

    /**
     * Additional attempts for a failing chunk, after the first.
     * <p>
     * Value is <code>2</code>.
     */
    int DEFAULT_CHUNK_RETRIES = 2;

    /**
     * Base delay for the exponential backoff between chunk attempts: attempt <i>n</i> (0-based) is followed by
     * <code>base * 2^n</code> ms.
     * <p>
     * Value is <code>500</code>.
     */
    long DEFAULT_CHUNK_RETRY_BASE_DELAY_MILLIS = 500;

    /**
     * Pause between two chunks, to not hog the broker.
     * <p>
     * Value is <code>100</code>.
     */
    long DEFAULT_PAUSE_BETWEEN_CHUNKS_MILLIS = 100;

    /**
     * Additional attempts for a confirmed publish which got no receipt in time.
     * <p>
     * Value is <code>2</code>.
     */
    int DEFAULT_RECEIPT_RETRIES = 2;

    /**
     * Max number of drain rounds for a single operation on a queue deeper than one drain batch.
     * <p>
     * Value is <code>100</code>.
     */
    int DEFAULT_MAX_DRAIN_ROUNDS = 100;

    /**
     * Safety cap for the number of drain-and-discard iterations of a purge.
     * <p>
     * Value is <code>10_000</code>.
     */
    int DEFAULT_PURGE_MAX_ITERATIONS = 10_000;

    /**
     * Number of threads publishing kept messages back concurrently.
     * <p>
     * Value is <code>8</code>.
     */
    int DEFAULT_REPUBLISH_PARALLELISM = 8;

    /**
     * Connect timeout for registering a connection.
     * <p>
     * Value is <code>10_000</code>.
     */
    long DEFAULT_CONNECT_TIMEOUT_MILLIS = 10_000;

    /**
     * Headers which belong to one particular delivery, and are thus never carried over when a message is published
     * again. Compared case-insensitively.
     */
    Set<String> RESERVED_HEADERS = Set.of("content-length", "content-type", "message-id", "receipt",
            "destination", "subscription");

    // :: MDC Keys

    String MDC_CONNECTION_ID = "omnibus.connectionId";
    String MDC_QUEUE = "omnibus.queue";
    String MDC_OPERATION = "omnibus.operation";
    String MDC_PHASE = "omnibus.phase";
    String MDC_MESSAGE_ID = "omnibus.messageId";
    String MDC_OPERATION_ID = "omnibus.operationId";

    Random RANDOM = new Random();

    default String random() {
        String ALPHABET = "0123456789ABCDEFGHIJKLMNOPQRSTUVWXYZ";
        int length = 8;
        StringBuilder sb = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            sb.append(ALPHABET.charAt(RANDOM.nextInt(ALPHABET.length())));
        }
        return sb.toString();
    }

    /**
     * Converts nanos to millis with a sane number of significant digits, e.g. 612.0, 61.2, 6.12, 0.612. Never returns
     * 0.0 for a non-zero input.
     */
    default double ms(long nanosTaken) {
        if (nanosTaken == 0) {
            return 0.0;
        }
        // >=5_000 ms?
        if (nanosTaken >= 1_000_000L * 5_000) {
            // -> Yes, so chop into the integer part of the number, zeroing 1 digit, e.g. 6120.0
            return Math.round(nanosTaken / 10_000_000d) * 10d;
        }
        // >=500 ms?
        if (nanosTaken >= 1_000_000L * 500) {
            // -> Yes, so chop off fraction entirely, e.g. 612.0
            return Math.round(nanosTaken / 1_000_000d);
        }
        // >=50 ms?
        if (nanosTaken >= 1_000_000L * 50) {
            // -> Yes, so use 1 decimal, e.g. 61.2
            return Math.round(nanosTaken / 100_000d) / 10d;
        }
        // >=5 ms?
        if (nanosTaken >= 1_000_000L * 5) {
            // -> Yes, so use 2 decimals, e.g. 6.12
            return Math.round(nanosTaken / 10_000d) / 100d;
        }
        // E-> <5 ms: 3 decimals, but at least 0.0001 so as to point out that it is NOT 0.0d
        return Math.max(Math.round(nanosTaken / 1_000d) / 1_000d, 0.0001d);
    }
}
