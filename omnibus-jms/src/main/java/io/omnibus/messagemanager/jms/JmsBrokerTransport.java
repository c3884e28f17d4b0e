package io.omnibus.messagemanager.jms;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Enumeration;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Set;

import javax.jms.BytesMessage;
import javax.jms.ConnectionFactory;
import javax.jms.DeliveryMode;
import javax.jms.JMSException;
import javax.jms.JMSSecurityException;
import javax.jms.Message;
import javax.jms.MessageConsumer;
import javax.jms.MessageProducer;
import javax.jms.Queue;
import javax.jms.QueueBrowser;
import javax.jms.Session;
import javax.jms.TextMessage;
import javax.jms.TransactionRolledBackException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import io.omnibus.messagemanager.api.BrokerIOException;
import io.omnibus.messagemanager.api.BrokerKind;
import io.omnibus.messagemanager.api.BrokerQueue;
import io.omnibus.messagemanager.api.BrokerTransport;
import io.omnibus.messagemanager.api.BrokerTransport.NativeBulkCapability;
import io.omnibus.messagemanager.api.BrokerTransport.PeekCapability;
import io.omnibus.messagemanager.api.BulkResult;
import io.omnibus.messagemanager.api.BulkResult.Failure;
import io.omnibus.messagemanager.api.BulkResult.FailureReason;
import io.omnibus.messagemanager.api.ConnectionRejectedException;
import io.omnibus.messagemanager.api.ProviderFieldNames;
import io.omnibus.messagemanager.api.RawMessage;
import io.omnibus.messagemanager.api.ReceiptTimeoutException;

/**
 * {@link BrokerTransport} for any JMS 1.1 broker, on top of a JMS <code>ConnectionFactory</code>.
 * <ul>
 * <li>Drain: a transacted session receives up to N messages, and commits once. If any received message cannot be
 * represented (only Text and Bytes messages can), the session is rolled back, so nothing is removed.</li>
 * <li>Publish: a TextMessage for textual content types, a BytesMessage otherwise. When confirming, the send is done in
 * a transacted session, and the commit is the receipt.</li>
 * <li>Peek: a QueueBrowser.</li>
 * <li>Delete and move by id: the broker's own selector-based receive, one transaction per id, where a move is receive
 * and send in the same transaction. This leaves the order of the other messages untouched.</li>
 * </ul>
 * Since JMS providers assign a fresh <code>JMSMessageID</code> on every send, the message id given to publish is
 * stored in the {@link #JMS_MSG_PROP_MESSAGE_ID} property, and handed out as <code>JMSMessageID</code> from drain and
 * peek, keeping ids stable when the message is republished. The provider's own id is handed out as
 * {@link #RAW_PROP_ACTUAL_MESSAGE_ID}.
 * <p/>
 * JMS has no standard way to list queues, so a {@link QueueLister} must be supplied.
 */
public class JmsBrokerTransport implements BrokerTransport, PeekCapability, NativeBulkCapability, Statics {
    private static final Logger log = LoggerFactory.getLogger(JmsBrokerTransport.class);

    private final BrokerKind _brokerKind;
    private final String _name;
    private final JmsConnectionHolder _jmsConnectionHolder;
    private final QueueLister _queueLister;

    private volatile RunStatus _runStatus = RunStatus.NOT_STARTED;

    enum RunStatus {
        NOT_STARTED, RUNNING, CLOSED
    }

    /**
     * @param brokerKind
     *            {@link BrokerKind#JMS} or {@link BrokerKind#ACTIVEMQ}.
     * @param name
     *            a name for logging, never containing credentials.
     */
    public static JmsBrokerTransport create(BrokerKind brokerKind, String name,
            ConnectionFactory connectionFactory, QueueLister queueLister) {
        if (brokerKind == null) {
            throw new NullPointerException("brokerKind");
        }
        if (brokerKind != BrokerKind.JMS && brokerKind != BrokerKind.ACTIVEMQ) {
            throw new IllegalArgumentException("BrokerKind must be a JMS kind, not [" + brokerKind + "]");
        }
        if (name == null) {
            throw new NullPointerException("name");
        }
        if (connectionFactory == null) {
            throw new NullPointerException("connectionFactory");
        }
        if (queueLister == null) {
            throw new NullPointerException("queueLister");
        }
        return new JmsBrokerTransport(brokerKind, name, connectionFactory, queueLister);
    }

    private JmsBrokerTransport(BrokerKind brokerKind, String name, ConnectionFactory connectionFactory,
            QueueLister queueLister) {
        _brokerKind = brokerKind;
        _name = name;
        _jmsConnectionHolder = new JmsConnectionHolder(connectionFactory, name);
        _queueLister = queueLister;
    }

    @Override
    public void start() throws BrokerIOException {
        synchronized (this) {
            if (_runStatus != RunStatus.NOT_STARTED) {
                throw new IllegalStateException("Transport [" + _name + "] is [" + _runStatus
                        + "], can only start once.");
            }
            _runStatus = RunStatus.RUNNING;
        }
        long nanosAtStart = System.nanoTime();
        try {
            // Eagerly get the connection, so that a bad endpoint fails the registration.
            _jmsConnectionHolder.connection();
        }
        catch (BrokerIOException e) {
            // ?: Was the cause a security problem, i.e. bad credentials?
            if (e.getCause() instanceof JMSSecurityException) {
                // -> Yes, so this is a rejection.
                throw new ConnectionRejectedException("The JMS broker [" + _name + "] rejected the credentials.",
                        e.getCause());
            }
            throw e;
        }
        log.info("STARTED JMS transport [" + _name + "], took [" + ms(System.nanoTime() - nanosAtStart) + "] ms.");
    }

    @Override
    public void close() {
        synchronized (this) {
            if (_runStatus == RunStatus.CLOSED) {
                return;
            }
            _runStatus = RunStatus.CLOSED;
        }
        _jmsConnectionHolder.dropConnection();
        log.info("CLOSED JMS transport [" + _name + "].");
    }

    @Override
    public BrokerKind getBrokerKind() {
        return _brokerKind;
    }

    @Override
    public List<RawMessage> drain(String queueId, int maxCount) throws BrokerIOException {
        if (queueId == null) {
            throw new NullPointerException("queueId");
        }
        if (maxCount <= 0) {
            throw new IllegalArgumentException("maxCount must be positive [" + maxCount + "]");
        }
        assertRunning();

        long nanosAtStart_Total = System.nanoTime();
        Session session = null;
        try {
            session = _jmsConnectionHolder.createSession(true);
            Queue queue = session.createQueue(queueId);
            MessageConsumer consumer = session.createConsumer(queue);

            List<RawMessage> drained = new ArrayList<>(Math.min(maxCount, 1024));
            while (drained.size() < maxCount) {
                // First receive waits a tad longer, as the broker may need to get going.
                Message message = consumer.receive(drained.isEmpty()
                        ? RECEIVE_TIMEOUT_MILLIS
                        : SUBSEQUENT_RECEIVE_TIMEOUT_MILLIS);
                // ?: Did we get a message?
                if (message == null) {
                    // -> No, so the queue is empty (or what is left is not yet dispatched to us).
                    break;
                }
                // ?: Can we represent this message?
                if (!(message instanceof TextMessage || message instanceof BytesMessage)) {
                    // -> No, so roll back everything received, and fail the drain.
                    String type = message.getClass().getSimpleName();
                    String messageId = message.getJMSMessageID();
                    session.rollback();
                    throw new BrokerIOException("Message [" + messageId + "] on [" + queueId + "] is a [" + type
                            + "], while only TextMessage and BytesMessage can be handled. The drain was rolled back,"
                            + " so nothing was removed from the queue.");
                }
                drained.add(toRawMessage(message, drained.size()));
            }
            consumer.close();
            // The one commit: now the messages are gone from the broker.
            session.commit();
            log.info("DRAINED [" + drained.size() + "] of max [" + maxCount + "] messages from [" + queueId
                    + "], took [" + ms(System.nanoTime() - nanosAtStart_Total) + "] ms.");
            return drained;
        }
        catch (JMSException e) {
            throw brokerIOException(e);
        }
        finally {
            JmsConnectionHolder.closeQuietly(session);
        }
    }

    @Override
    public void publish(String queueId, byte[] body, Map<String, Object> headers, String contentType,
            String messageId, boolean confirm) throws BrokerIOException {
        if (queueId == null) {
            throw new NullPointerException("queueId");
        }
        if (body == null) {
            throw new NullPointerException("body");
        }
        assertRunning();

        String receiptId = random();
        long nanosAtStart = System.nanoTime();
        Session session = null;
        try {
            session = _jmsConnectionHolder.createSession(confirm);
            Queue queue = session.createQueue(queueId);
            Message message = createMessage(session, body, contentType);
            if (messageId != null) {
                message.setStringProperty(JMS_MSG_PROP_MESSAGE_ID, messageId);
            }
            applyHeaders(message, headers == null ? Collections.emptyMap() : headers);

            MessageProducer producer = session.createProducer(queue);
            producer.setDeliveryMode(DeliveryMode.PERSISTENT);
            producer.send(message);
            producer.close();
            // ?: Confirming?
            if (confirm) {
                // -> Yes, so commit, which returns when the broker has taken the message.
                commitAsReceipt(session, queueId, receiptId, nanosAtStart);
            }
            if (log.isDebugEnabled()) log.debug("PUBLISHED message [" + messageId + "] to [" + queueId
                    + "], receiptId [" + receiptId + "], took [" + ms(System.nanoTime() - nanosAtStart) + "] ms.");
        }
        catch (JMSException e) {
            throw brokerIOException(e);
        }
        finally {
            JmsConnectionHolder.closeQuietly(session);
        }
    }

    @Override
    public List<RawMessage> peek(String queueId, int maxCount) throws BrokerIOException {
        if (queueId == null) {
            throw new NullPointerException("queueId");
        }
        if (maxCount <= 0) {
            throw new IllegalArgumentException("maxCount must be positive [" + maxCount + "]");
        }
        assertRunning();

        long nanosAtStart = System.nanoTime();
        Session session = null;
        try {
            session = _jmsConnectionHolder.createSession(false);
            Queue queue = session.createQueue(queueId);
            QueueBrowser browser = session.createBrowser(queue);
            @SuppressWarnings("unchecked")
            Enumeration<Message> messageEnumeration = (Enumeration<Message>) browser.getEnumeration();
            List<RawMessage> peeked = new ArrayList<>();
            while (peeked.size() < maxCount && messageEnumeration.hasMoreElements()) {
                peeked.add(toRawMessage(messageEnumeration.nextElement(), peeked.size()));
            }
            browser.close();
            log.info("PEEKED [" + peeked.size() + "] of max [" + maxCount + "] messages on [" + queueId
                    + "], took [" + ms(System.nanoTime() - nanosAtStart) + "] ms.");
            return peeked;
        }
        catch (JMSException e) {
            throw brokerIOException(e);
        }
        finally {
            JmsConnectionHolder.closeQuietly(session);
        }
    }

    @Override
    public List<BrokerQueue> listQueues() throws BrokerIOException {
        assertRunning();
        try {
            Map<String, Long> queues = _queueLister.listQueues(_jmsConnectionHolder.connection());
            List<BrokerQueue> result = new ArrayList<>(queues.size());
            for (Entry<String, Long> entry : queues.entrySet()) {
                long depth = entry.getValue() != null
                        ? entry.getValue()
                        : browseCount(entry.getKey());
                result.add(new BrokerQueue(entry.getKey(), entry.getKey(), depth));
            }
            return result;
        }
        catch (JMSException e) {
            throw brokerIOException(e);
        }
    }

    /**
     * Counts by browsing, as JMS has no count. Note that brokers may cap how many messages a browser sees.
     */
    @Override
    public long queueDepth(String queueId) throws BrokerIOException {
        if (queueId == null) {
            throw new NullPointerException("queueId");
        }
        assertRunning();
        try {
            return browseCount(queueId);
        }
        catch (JMSException e) {
            throw brokerIOException(e);
        }
    }

    // ===== NativeBulkCapability

    @Override
    public BulkResult deleteMessages(String queueId, List<String> messageIds) throws BrokerIOException {
        return byIdOperation(queueId, null, messageIds);
    }

    @Override
    public BulkResult moveMessages(String sourceQueueId, String targetQueueId, List<String> messageIds)
            throws BrokerIOException {
        if (targetQueueId == null) {
            throw new NullPointerException("targetQueueId");
        }
        if (targetQueueId.equals(sourceQueueId)) {
            throw new IllegalArgumentException("Source and target queue are the same [" + sourceQueueId + "]");
        }
        return byIdOperation(sourceQueueId, targetQueueId, messageIds);
    }

    /**
     * Delete (targetQueueId == null) or move each id using a selector, committing per id, so that each message is
     * either fully handled or untouched. A broker error on one id rolls back only that id, which is recorded as failed,
     * and the rest continue on a fresh Connection. If no session can be made at all, the remaining ids are recorded as
     * failed, and the counts so far are returned.
     */
    private BulkResult byIdOperation(String queueId, String targetQueueId, List<String> messageIds) {
        if (queueId == null) {
            throw new NullPointerException("queueId");
        }
        if (messageIds == null) {
            throw new NullPointerException("messageIds");
        }
        assertRunning();

        String operation = targetQueueId == null ? "DELETE" : "MOVE";
        // A repeated id is handled once.
        Set<String> uniqueIds = new LinkedHashSet<>(messageIds);
        uniqueIds.remove(null);
        List<String> ids = new ArrayList<>(uniqueIds);

        long nanosAtStart_Total = System.nanoTime();
        int successCount = 0;
        List<Failure> failures = new ArrayList<>();
        Session session = null;
        try {
            for (int i = 0; i < ids.size(); i++) {
                String messageId = ids.get(i);
                // ?: Do we need a session, at start or after a failure?
                if (session == null) {
                    // -> Yes, and without one nothing more can be done.
                    try {
                        session = _jmsConnectionHolder.createSession(true);
                    }
                    catch (JMSException | BrokerIOException e) {
                        _jmsConnectionHolder.dropConnection();
                        List<String> remaining = new ArrayList<>(ids.subList(i, ids.size()));
                        log.warn(operation + " STOPPED on [" + queueId + "]: no JMS session, so the remaining ["
                                + remaining.size() + "] ids are not handled: " + e.getMessage());
                        failures.add(new Failure(i, remaining, FailureReason.RETRIES_EXHAUSTED,
                                "No JMS session to [" + _name + "]: " + e.getMessage()));
                        break;
                    }
                }
                try {
                    MDC.put(MDC_JMS_MESSAGE_ID, messageId);
                    // ?: Was there a message with this id?
                    if (handleById(session, queueId, targetQueueId, messageId)) {
                        // -> Yes, and it is now deleted or moved.
                        successCount++;
                        log.info(operation + " DONE for message [" + messageId + "] on [" + queueId + "]"
                                + (targetQueueId != null ? " to [" + targetQueueId + "]" : "") + ".");
                    }
                    else {
                        log.info(operation + " NOT DONE: Did NOT receive a message for id [" + messageId
                                + "] on [" + queueId + "].");
                        failures.add(new Failure(i, Collections.singletonList(messageId),
                                FailureReason.NOT_FOUND, "No message with id [" + messageId + "] on [" + queueId
                                        + "]"));
                    }
                }
                catch (JMSException e) {
                    log.warn(operation + " FAILED for message [" + messageId + "] on [" + queueId
                            + "], rolled back so it stays on the queue: " + e.getClass().getSimpleName() + ": "
                            + e.getMessage());
                    failures.add(new Failure(i, Collections.singletonList(messageId),
                            FailureReason.RETRIES_EXHAUSTED, "Broker error: " + e.getMessage()));
                    rollbackQuietly(session);
                    JmsConnectionHolder.closeQuietly(session);
                    session = null;
                    _jmsConnectionHolder.dropConnection();
                }
                finally {
                    MDC.remove(MDC_JMS_MESSAGE_ID);
                }
            }
        }
        finally {
            JmsConnectionHolder.closeQuietly(session);
        }
        log.info(operation + " FINISHED for [" + ids.size() + "] ids on [" + queueId + "], of which ["
                + successCount + "] were handled. Total time: " + ms(System.nanoTime() - nanosAtStart_Total)
                + " ms.");
        return new BulkResult(successCount, ids.size() - successCount, failures);
    }

    /**
     * @return <code>false</code> if there was no message with the id, else <code>true</code> when it is committed as
     *         deleted or moved.
     */
    private boolean handleById(Session session, String queueId, String targetQueueId, String messageId)
            throws JMSException {
        MessageConsumer consumer = session.createConsumer(session.createQueue(queueId), selectorFor(messageId));
        Message message;
        try {
            message = consumer.receive(RECEIVE_TIMEOUT_MILLIS);
        }
        finally {
            consumer.close();
        }
        if (message == null) {
            return false;
        }
        // ?: Is this a move?
        if (targetQueueId != null) {
            // -> Yes, so send the received message on to the target, in the same transaction.
            MessageProducer producer = session.createProducer(session.createQueue(targetQueueId));
            try {
                producer.send(message, DeliveryMode.PERSISTENT, message.getJMSPriority(), 0);
            }
            finally {
                producer.close();
            }
        }
        session.commit();
        return true;
    }

    private void rollbackQuietly(Session session) {
        try {
            session.rollback();
        }
        catch (JMSException e) {
            log.warn("Got [" + e.getClass().getSimpleName() + "] when rolling back JMS Session of [" + _name
                    + "], ignoring: the broker rolls back when the Connection is dropped.");
        }
    }

    // ===== Internals

    private void assertRunning() {
        if (_runStatus != RunStatus.RUNNING) {
            throw new IllegalStateException("Transport [" + _name + "] is not running, but [" + _runStatus + "].");
        }
    }

    private BrokerIOException brokerIOException(JMSException e) {
        // Bad, so ditch connection.
        _jmsConnectionHolder.dropConnection();
        return new BrokerIOException("Problems talking to broker [" + _name + "]."
                + " If you retry the operation, a new attempt at making a JMS Connection will be performed.", e);
    }

    private void commitAsReceipt(Session session, String queueId, String receiptId, long nanosAtStart)
            throws JMSException {
        try {
            session.commit();
        }
        catch (TransactionRolledBackException e) {
            // Definitely not sent, the broker rolled it back.
            throw e;
        }
        catch (JMSException e) {
            // We do not know whether the broker got to commit before the failure.
            _jmsConnectionHolder.dropConnection();
            throw new ReceiptTimeoutException(queueId, receiptId,
                    Math.round(ms(System.nanoTime() - nanosAtStart)), e);
        }
    }

    private int browseCount(String queueId) throws JMSException {
        Session session = null;
        try {
            session = _jmsConnectionHolder.createSession(false);
            QueueBrowser browser = session.createBrowser(session.createQueue(queueId));
            Enumeration<?> enumeration = browser.getEnumeration();
            int count = 0;
            while (enumeration.hasMoreElements()) {
                enumeration.nextElement();
                count++;
            }
            browser.close();
            return count;
        }
        finally {
            JmsConnectionHolder.closeQuietly(session);
        }
    }

    /**
     * Matches our stable id if the message has one, else the provider's id.
     */
    static String selectorFor(String messageId) {
        String quoted = "'" + messageId.replace("'", "''") + "'";
        return JMS_MSG_PROP_MESSAGE_ID + " = " + quoted
                + " OR (" + JMS_MSG_PROP_MESSAGE_ID + " IS NULL AND JMSMessageID = " + quoted + ")";
    }

    static boolean isTextual(String contentType) {
        if (contentType == null) {
            return false;
        }
        String lower = contentType.toLowerCase(Locale.ROOT);
        return lower.startsWith("text/") || lower.contains("json") || lower.contains("xml");
    }

    private static Message createMessage(Session session, byte[] body, String contentType) throws JMSException {
        Message message;
        String defaultContentType;
        if (isTextual(contentType)) {
            message = session.createTextMessage(new String(body, StandardCharsets.UTF_8));
            defaultContentType = CONTENT_TYPE_TEXT;
        }
        else {
            BytesMessage bytesMessage = session.createBytesMessage();
            bytesMessage.writeBytes(body);
            message = bytesMessage;
            defaultContentType = CONTENT_TYPE_BINARY;
        }
        // Only set content type if not what the message type implies.
        if (contentType != null && !contentType.equalsIgnoreCase(defaultContentType)) {
            message.setStringProperty(JMS_MSG_PROP_CONTENT_TYPE, contentType);
        }
        return message;
    }

    private static void applyHeaders(Message message, Map<String, Object> headers) throws JMSException {
        for (Entry<String, Object> header : headers.entrySet()) {
            String name = header.getKey();
            Object value = header.getValue();
            if (value == null) {
                continue;
            }
            // :: The carried JMS header fields
            if (RAW_PROP_CORRELATION_ID.equals(name)) {
                message.setJMSCorrelationID(value.toString());
                continue;
            }
            if (ProviderFieldNames.JMS.getLabel().equals(name)) {
                message.setJMSType(value.toString());
                continue;
            }
            // ?: Reserved by JMS, or ours?
            if (name.startsWith("JMS") || name.startsWith("omnibus_")) {
                // -> Yes, the broker or we set those.
                continue;
            }
            // JMS only allows primitive wrappers and String as property values.
            if (value instanceof String || value instanceof Boolean || value instanceof Byte
                    || value instanceof Short || value instanceof Integer || value instanceof Long
                    || value instanceof Float || value instanceof Double) {
                message.setObjectProperty(name, value);
            }
            else {
                message.setStringProperty(name, value.toString());
            }
        }
    }

    private RawMessage toRawMessage(Message message, int position) throws JMSException {
        String actualMessageId = message.getJMSMessageID();
        String stableMessageId = message.getStringProperty(JMS_MSG_PROP_MESSAGE_ID);

        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put(ProviderFieldNames.JMS.getMessageId(), stableMessageId != null
                ? stableMessageId
                : actualMessageId);
        properties.put(RAW_PROP_ACTUAL_MESSAGE_ID, actualMessageId);
        properties.put(ProviderFieldNames.JMS.getEnqueuedTime(), message.getJMSTimestamp());
        properties.put(ProviderFieldNames.JMS.getRedelivered(), message.getJMSRedelivered());
        properties.put(RAW_PROP_PRIORITY, message.getJMSPriority());
        properties.put(RAW_PROP_EXPIRATION, message.getJMSExpiration());
        properties.put(RAW_PROP_JMS_MESSAGE_TYPE, message instanceof TextMessage
                ? "TextMessage"
                : message instanceof BytesMessage ? "BytesMessage" : message.getClass().getSimpleName());
        Object deliveryCount = message.getObjectProperty(ProviderFieldNames.JMS.getDeliveryCount());
        if (deliveryCount != null) {
            properties.put(ProviderFieldNames.JMS.getDeliveryCount(), deliveryCount);
        }

        Map<String, Object> headers = new LinkedHashMap<>();
        if (message.getJMSType() != null) {
            properties.put(ProviderFieldNames.JMS.getLabel(), message.getJMSType());
            headers.put(ProviderFieldNames.JMS.getLabel(), message.getJMSType());
        }
        if (message.getJMSCorrelationID() != null) {
            properties.put(RAW_PROP_CORRELATION_ID, message.getJMSCorrelationID());
            headers.put(RAW_PROP_CORRELATION_ID, message.getJMSCorrelationID());
        }
        @SuppressWarnings("unchecked")
        Enumeration<String> propertyNames = (Enumeration<String>) message.getPropertyNames();
        while (propertyNames.hasMoreElements()) {
            String name = propertyNames.nextElement();
            if (name.startsWith("JMSX") || name.startsWith("omnibus_")) {
                continue;
            }
            headers.put(name, message.getObjectProperty(name));
        }

        String contentType = message.getStringProperty(JMS_MSG_PROP_CONTENT_TYPE);
        byte[] body;
        if (message instanceof TextMessage) {
            String text = ((TextMessage) message).getText();
            body = text == null ? new byte[0] : text.getBytes(StandardCharsets.UTF_8);
            contentType = contentType != null ? contentType : CONTENT_TYPE_TEXT;
        }
        else if (message instanceof BytesMessage) {
            BytesMessage bytesMessage = (BytesMessage) message;
            body = new byte[(int) bytesMessage.getBodyLength()];
            bytesMessage.readBytes(body);
            contentType = contentType != null ? contentType : CONTENT_TYPE_BINARY;
        }
        else {
            // Only when peeking: drain refuses these.
            body = new byte[0];
        }
        return RawMessage.create(_brokerKind, position, properties, headers, contentType, body,
                message.getJMSRedelivered());
    }

    @Override
    public String toString() {
        return "JmsBrokerTransport[" + _name + ", " + _runStatus + "]";
    }
}
