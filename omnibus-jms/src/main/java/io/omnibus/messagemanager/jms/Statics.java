package io.omnibus.messagemanager.jms;

import java.util.Random;

/**
 * Constants for the JMS transport.
 */
public interface Statics {

    /**
     * How long the first receive of a drain waits for a message.
     * <p>
     * Value is <code>750</code>.
     */
    long RECEIVE_TIMEOUT_MILLIS = 750;

    /**
     * How long each further receive of a drain waits, once at least one message was received.
     * <p>
     * Value is <code>100</code>.
     */
    long SUBSEQUENT_RECEIVE_TIMEOUT_MILLIS = 100;

    /**
     * How long a caller waits for the shared JMS Connection to be created.
     * <p>
     * Value is <code>30_000</code>.
     */
    long CONNECTION_CREATE_TIMEOUT_MILLIS = 30_000;

    // :: MDC Keys

    String MDC_JMS_MESSAGE_ID = "omnibus.jms.MsgSysId";

    // ===== JMS Properties put on the JMS Message via setStringProperty(..)
    // NOTICE: "." is not allowed by JMS, so we use "_".

    /**
     * The stable message id, which the JMS provider's <code>JMSMessageID</code> cannot be since it is assigned anew on
     * every send.
     */
    String JMS_MSG_PROP_MESSAGE_ID = "omnibus_MessageId";

    /**
     * The content type, only set if not the default for the JMS message type.
     */
    String JMS_MSG_PROP_CONTENT_TYPE = "omnibus_ContentType";

    // ===== RawMessage property names beyond the ones of ProviderFieldNames.JMS

    String RAW_PROP_ACTUAL_MESSAGE_ID = "JMSMessageIDActual";
    String RAW_PROP_CORRELATION_ID = "JMSCorrelationID";
    String RAW_PROP_PRIORITY = "JMSPriority";
    String RAW_PROP_EXPIRATION = "JMSExpiration";
    String RAW_PROP_JMS_MESSAGE_TYPE = "JMSMessageClass";

    String CONTENT_TYPE_TEXT = "text/plain";
    String CONTENT_TYPE_BINARY = "application/octet-stream";

    Random RANDOM = new Random();

    /**
     * @return an 8 char random string, used as receipt id of a publish.
     */
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
