package io.omnibus.messagemanager.azure;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeoutException;
import java.util.function.Predicate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.azure.core.exception.ClientAuthenticationException;
import com.azure.core.exception.ResourceNotFoundException;
import com.azure.messaging.servicebus.ServiceBusClientBuilder;
import com.azure.messaging.servicebus.ServiceBusClientBuilder.ServiceBusReceiverClientBuilder;
import com.azure.messaging.servicebus.ServiceBusException;
import com.azure.messaging.servicebus.ServiceBusFailureReason;
import com.azure.messaging.servicebus.ServiceBusMessage;
import com.azure.messaging.servicebus.ServiceBusReceivedMessage;
import com.azure.messaging.servicebus.ServiceBusReceiverClient;
import com.azure.messaging.servicebus.ServiceBusSenderClient;
import com.azure.messaging.servicebus.administration.ServiceBusAdministrationClient;
import com.azure.messaging.servicebus.administration.models.QueueProperties;
import com.azure.messaging.servicebus.administration.models.SubscriptionProperties;
import com.azure.messaging.servicebus.administration.models.TopicProperties;
import com.azure.messaging.servicebus.models.ServiceBusReceiveMode;

import io.omnibus.messagemanager.api.BrokerIOException;
import io.omnibus.messagemanager.api.BrokerKind;
import io.omnibus.messagemanager.api.BrokerQueue;
import io.omnibus.messagemanager.api.BrokerSubscription;
import io.omnibus.messagemanager.api.BrokerTopic;
import io.omnibus.messagemanager.api.BrokerTransport;
import io.omnibus.messagemanager.api.BrokerTransport.PeekCapability;
import io.omnibus.messagemanager.api.BrokerTransport.TopicCapability;
import io.omnibus.messagemanager.api.ConnectionRejectedException;
import io.omnibus.messagemanager.api.ConnectionTimeoutException;
import io.omnibus.messagemanager.api.ProviderFieldNames;
import io.omnibus.messagemanager.api.RawMessage;
import io.omnibus.messagemanager.api.ReceiptTimeoutException;

/**
 * {@link BrokerTransport} for Azure Service Bus. Drain is a receive in <i>receive-and-delete</i> mode without
 * prefetch, so that closing the receiver never loses messages which were fetched but not handed out. Peek uses the
 * service's own peek, and listing uses the administration client. Topics and subscriptions are supported through
 * {@link TopicCapability}.
 * <p/>
 * Senders are kept per entity and reused, while receivers live for one call. All clients are built from the same
 * {@link ServiceBusClientBuilder}, and thus share one AMQP connection.
 */
public class AzureServiceBusTransport implements BrokerTransport, PeekCapability, TopicCapability, Statics {
    private static final Logger log = LoggerFactory.getLogger(AzureServiceBusTransport.class);

    private static final ProviderFieldNames FIELDS = ProviderFieldNames.AZURE_SERVICE_BUS;

    private final String _name;
    private final ServiceBusClientBuilder _clientBuilder;
    private final ServiceBusAdministrationClient _administrationClient;
    private final long _receiptTimeoutMillis;

    private final ConcurrentHashMap<String, ServiceBusSenderClient> _senders = new ConcurrentHashMap<>();

    private volatile RunStatus _runStatus = RunStatus.NOT_STARTED;

    enum RunStatus {
        NOT_STARTED, RUNNING, CLOSED
    }

    private AzureServiceBusTransport(String name, ServiceBusClientBuilder clientBuilder,
            ServiceBusAdministrationClient administrationClient, long receiptTimeoutMillis) {
        _name = name;
        _clientBuilder = clientBuilder;
        _administrationClient = administrationClient;
        _receiptTimeoutMillis = receiptTimeoutMillis;
    }

    /**
     * @param clientBuilder
     *            builder with the connection string and retry options set, used for all senders and receivers.
     */
    public static AzureServiceBusTransport create(String name, ServiceBusClientBuilder clientBuilder,
            ServiceBusAdministrationClient administrationClient, long receiptTimeoutMillis) {
        if (name == null) {
            throw new NullPointerException("name");
        }
        if (clientBuilder == null) {
            throw new NullPointerException("clientBuilder");
        }
        if (administrationClient == null) {
            throw new NullPointerException("administrationClient");
        }
        return new AzureServiceBusTransport(name, clientBuilder, administrationClient, receiptTimeoutMillis);
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
        // The AMQP side connects lazily, so verify reachability and credentials through the administration API.
        String namespace;
        try {
            namespace = _administrationClient.getNamespaceProperties().getName();
        }
        catch (RuntimeException e) {
            throw brokerException(e, "connecting");
        }
        log.info("STARTED Azure Service Bus transport [" + _name + "], namespace [" + namespace + "], took ["
                + ms3(System.nanoTime() - nanosAtStart) + "] ms.");
    }

    @Override
    public void close() {
        synchronized (this) {
            if (_runStatus == RunStatus.CLOSED) {
                return;
            }
            _runStatus = RunStatus.CLOSED;
        }
        for (ServiceBusSenderClient sender : _senders.values()) {
            try {
                sender.close();
            }
            catch (RuntimeException e) {
                log.warn("Got [" + e.getClass().getSimpleName() + "] when closing sender for ["
                        + sender.getEntityPath() + "] of [" + _name + "], ignoring.");
            }
        }
        _senders.clear();
        log.info("CLOSED Azure Service Bus transport [" + _name + "].");
    }

    @Override
    public BrokerKind getBrokerKind() {
        return BrokerKind.AZURE_SERVICE_BUS;
    }

    // ===== Queues

    @Override
    public List<RawMessage> drain(String queueId, int maxCount) throws BrokerIOException {
        if (queueId == null) {
            throw new NullPointerException("queueId");
        }
        if (maxCount <= 0) {
            throw new IllegalArgumentException("maxCount must be positive [" + maxCount + "]");
        }
        assertRunning();
        long nanosAtStart = System.nanoTime();
        List<RawMessage> drained = new ArrayList<>();
        ServiceBusReceiverClient receiver = _clientBuilder.receiver()
                .queueName(queueId)
                .receiveMode(ServiceBusReceiveMode.RECEIVE_AND_DELETE)
                .prefetchCount(0)
                .buildClient();
        try {
            Duration wait = FIRST_RECEIVE_WAIT;
            while (drained.size() < maxCount) {
                int before = drained.size();
                for (ServiceBusReceivedMessage message : receiver.receiveMessages(maxCount - drained.size(), wait)) {
                    drained.add(toRawMessage(message, drained.size()));
                }
                // ?: Did this round give anything?
                if (drained.size() == before) {
                    // -> No, so the queue is empty for now.
                    break;
                }
                wait = SUBSEQUENT_RECEIVE_WAIT;
            }
        }
        catch (RuntimeException e) {
            // ?: Have we already removed messages from the queue?
            if (!drained.isEmpty()) {
                // -> Yes, so they must be handed out, or they are gone.
                log.warn("Got [" + e.getClass().getSimpleName() + "] while draining [" + queueId + "] after ["
                        + drained.size() + "] messages: returning those.", e);
                return drained;
            }
            if (isEntityNotFound(e)) {
                return Collections.emptyList();
            }
            throw brokerException(e, "draining [" + queueId + "]");
        }
        finally {
            closeReceiver(receiver);
        }
        log.info("DRAINED [" + drained.size() + "] of max [" + maxCount + "] messages from [" + queueId + "], took ["
                + ms3(System.nanoTime() - nanosAtStart) + "] ms.");
        return drained;
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
        return peek(_clientBuilder.receiver().queueName(queueId), queueId, maxCount);
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
        ServiceBusSenderClient sender = _senders.computeIfAbsent("queue:" + queueId,
                key -> _clientBuilder.sender().queueName(queueId).buildClient());
        send(sender, queueId, body, headers, contentType, messageId);
    }

    @Override
    public List<BrokerQueue> listQueues() throws BrokerIOException {
        assertRunning();
        try {
            List<BrokerQueue> queues = new ArrayList<>();
            for (QueueProperties queue : _administrationClient.listQueues()) {
                long depth = _administrationClient.getQueueRuntimeProperties(queue.getName())
                        .getActiveMessageCount();
                queues.add(new BrokerQueue(queue.getName(), queue.getName(), depth));
            }
            return queues;
        }
        catch (RuntimeException e) {
            throw brokerException(e, "listing queues");
        }
    }

    /**
     * The active message count, i.e. not counting scheduled and dead-lettered messages, which drain does not see.
     */
    @Override
    public long queueDepth(String queueId) throws BrokerIOException {
        if (queueId == null) {
            throw new NullPointerException("queueId");
        }
        assertRunning();
        try {
            return _administrationClient.getQueueRuntimeProperties(queueId).getActiveMessageCount();
        }
        catch (ResourceNotFoundException e) {
            return 0;
        }
        catch (RuntimeException e) {
            throw brokerException(e, "getting depth of [" + queueId + "]");
        }
    }

    // ===== Topics

    @Override
    public List<BrokerTopic> listTopics() throws BrokerIOException {
        assertRunning();
        try {
            List<BrokerTopic> topics = new ArrayList<>();
            for (TopicProperties topic : _administrationClient.listTopics()) {
                int subscriptionCount = _administrationClient.getTopicRuntimeProperties(topic.getName())
                        .getSubscriptionCount();
                topics.add(new BrokerTopic(topic.getName(), topic.getName(), subscriptionCount));
            }
            return topics;
        }
        catch (RuntimeException e) {
            throw brokerException(e, "listing topics");
        }
    }

    @Override
    public List<BrokerSubscription> listSubscriptions(String topicName) throws BrokerIOException {
        if (topicName == null) {
            throw new NullPointerException("topicName");
        }
        assertRunning();
        try {
            List<BrokerSubscription> subscriptions = new ArrayList<>();
            for (SubscriptionProperties subscription : _administrationClient.listSubscriptions(topicName)) {
                String subscriptionName = subscription.getSubscriptionName();
                long count = _administrationClient.getSubscriptionRuntimeProperties(topicName, subscriptionName)
                        .getActiveMessageCount();
                subscriptions.add(new BrokerSubscription(subscriptionName, subscriptionName, topicName, count));
            }
            return subscriptions;
        }
        catch (ResourceNotFoundException e) {
            return Collections.emptyList();
        }
        catch (RuntimeException e) {
            throw brokerException(e, "listing subscriptions of [" + topicName + "]");
        }
    }

    @Override
    public List<RawMessage> peekSubscription(String topicName, String subscriptionName, int maxCount)
            throws BrokerIOException {
        if (topicName == null) {
            throw new NullPointerException("topicName");
        }
        if (subscriptionName == null) {
            throw new NullPointerException("subscriptionName");
        }
        if (maxCount <= 0) {
            throw new IllegalArgumentException("maxCount must be positive [" + maxCount + "]");
        }
        assertRunning();
        return peek(_clientBuilder.receiver().topicName(topicName).subscriptionName(subscriptionName),
                topicName + "/" + subscriptionName, maxCount);
    }

    /**
     * Receives under lock until the match is found, or the subscription is exhausted, or
     * {@link #LOCK_SCAN_MAX_MESSAGES} are held. Note that each abandon increments the message's delivery count, so
     * messages near the subscription's max delivery count may be dead-lettered by the service.
     */
    @Override
    public boolean deleteFromSubscription(String topicName, String subscriptionName, Predicate<RawMessage> matcher)
            throws BrokerIOException {
        if (topicName == null) {
            throw new NullPointerException("topicName");
        }
        if (subscriptionName == null) {
            throw new NullPointerException("subscriptionName");
        }
        if (matcher == null) {
            throw new NullPointerException("matcher");
        }
        assertRunning();
        String entity = topicName + "/" + subscriptionName;
        ServiceBusReceiverClient receiver = _clientBuilder.receiver()
                .topicName(topicName)
                .subscriptionName(subscriptionName)
                .receiveMode(ServiceBusReceiveMode.PEEK_LOCK)
                .prefetchCount(0)
                .buildClient();
        List<ServiceBusReceivedMessage> locked = new ArrayList<>();
        ServiceBusReceivedMessage match = null;
        try {
            Duration wait = FIRST_RECEIVE_WAIT;
            while (match == null && locked.size() < LOCK_SCAN_MAX_MESSAGES) {
                int before = locked.size();
                int max = Math.min(LOCK_RECEIVE_BATCH_SIZE, LOCK_SCAN_MAX_MESSAGES - locked.size());
                for (ServiceBusReceivedMessage message : receiver.receiveMessages(max, wait)) {
                    if (match == null && matcher.test(toRawMessage(message, locked.size()))) {
                        match = message;
                    }
                    else {
                        locked.add(message);
                    }
                }
                if (match == null && locked.size() == before) {
                    break;
                }
                wait = SUBSEQUENT_RECEIVE_WAIT;
            }
            if (match != null) {
                receiver.complete(match);
                log.info("DELETED message [" + match.getMessageId() + "] from subscription [" + entity
                        + "], having held [" + locked.size() + "] others under lock.");
                return true;
            }
            log.info("DELETE NOT DONE on subscription [" + entity + "]: no match among [" + locked.size()
                    + "] messages.");
            return false;
        }
        catch (RuntimeException e) {
            throw brokerException(e, "deleting from subscription [" + entity + "]");
        }
        finally {
            abandonAll(receiver, locked, entity);
            closeReceiver(receiver);
        }
    }

    @Override
    public void publishToTopic(String topicName, byte[] body, Map<String, Object> headers, String contentType,
            String messageId, boolean confirm) throws BrokerIOException {
        if (topicName == null) {
            throw new NullPointerException("topicName");
        }
        if (body == null) {
            throw new NullPointerException("body");
        }
        assertRunning();
        ServiceBusSenderClient sender = _senders.computeIfAbsent("topic:" + topicName,
                key -> _clientBuilder.sender().topicName(topicName).buildClient());
        send(sender, topicName, body, headers, contentType, messageId);
    }

    // ===== Internals

    private void assertRunning() {
        if (_runStatus != RunStatus.RUNNING) {
            throw new IllegalStateException("Transport [" + _name + "] is not running, but [" + _runStatus + "].");
        }
    }

    /**
     * A send on the synchronous client returns when the service has accepted the message, so it is always confirmed.
     */
    private void send(ServiceBusSenderClient sender, String entity, byte[] body, Map<String, Object> headers,
            String contentType, String messageId) {
        ServiceBusMessage message = new ServiceBusMessage(body);
        message.setContentType(contentType);
        if (messageId != null) {
            message.setMessageId(messageId);
        }
        if (headers != null) {
            message.getApplicationProperties().putAll(applicationProperties(headers));
        }
        long nanosAtStart = System.nanoTime();
        try {
            sender.sendMessage(message);
        }
        catch (RuntimeException e) {
            // ?: Did it time out, so that we do not know whether the service got it?
            if (isTimeout(e)) {
                // -> Yes, ambiguous.
                throw new ReceiptTimeoutException(entity, messageId, _receiptTimeoutMillis, e);
            }
            throw brokerException(e, "sending message [" + messageId + "] to [" + entity + "]");
        }
        if (log.isDebugEnabled()) log.debug("SENT message [" + messageId + "] to [" + entity + "], took ["
                + ms3(System.nanoTime() - nanosAtStart) + "] ms.");
    }

    private List<RawMessage> peek(ServiceBusReceiverClientBuilder receiverBuilder, String entity, int maxCount) {
        ServiceBusReceiverClient receiver = receiverBuilder
                .receiveMode(ServiceBusReceiveMode.PEEK_LOCK)
                .prefetchCount(0)
                .buildClient();
        List<RawMessage> peeked = new ArrayList<>();
        try {
            Long fromSequenceNumber = null;
            while (peeked.size() < maxCount) {
                int batch = Math.min(PEEK_BATCH_SIZE, maxCount - peeked.size());
                int before = peeked.size();
                Iterable<ServiceBusReceivedMessage> messages = fromSequenceNumber == null
                        ? receiver.peekMessages(batch)
                        : receiver.peekMessages(batch, fromSequenceNumber);
                for (ServiceBusReceivedMessage message : messages) {
                    peeked.add(toRawMessage(message, peeked.size()));
                    fromSequenceNumber = message.getSequenceNumber() + 1;
                }
                if (peeked.size() == before) {
                    break;
                }
            }
            return peeked;
        }
        catch (RuntimeException e) {
            if (isEntityNotFound(e)) {
                return Collections.emptyList();
            }
            throw brokerException(e, "peeking [" + entity + "]");
        }
        finally {
            closeReceiver(receiver);
        }
    }

    private void abandonAll(ServiceBusReceiverClient receiver, List<ServiceBusReceivedMessage> locked,
            String entity) {
        int failed = 0;
        for (ServiceBusReceivedMessage message : locked) {
            try {
                receiver.abandon(message);
            }
            catch (RuntimeException e) {
                // The lock expires by itself, after which the message is available again.
                failed++;
            }
        }
        if (failed > 0) {
            log.warn("Could not abandon [" + failed + "] of [" + locked.size() + "] locked messages on [" + entity
                    + "]: they will be available again when their locks expire.");
        }
    }

    private void closeReceiver(ServiceBusReceiverClient receiver) {
        try {
            receiver.close();
        }
        catch (RuntimeException e) {
            log.warn("Got [" + e.getClass().getSimpleName() + "] when closing receiver for ["
                    + receiver.getEntityPath() + "] of [" + _name + "], ignoring.");
        }
    }

    static RawMessage toRawMessage(ServiceBusReceivedMessage message, int position) {
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put(FIELDS.getMessageId(), message.getMessageId());
        properties.put(FIELDS.getSequenceNumber(), message.getSequenceNumber());
        properties.put(FIELDS.getLabel(), message.getSubject());
        properties.put(FIELDS.getEnqueuedTime(), message.getEnqueuedTime() == null
                ? null
                : message.getEnqueuedTime().toInstant().toString());
        properties.put(FIELDS.getDeliveryCount(), message.getDeliveryCount());
        properties.put(RAW_PROP_CORRELATION_ID, message.getCorrelationId());
        properties.put(RAW_PROP_SESSION_ID, message.getSessionId());
        properties.put(RAW_PROP_TIME_TO_LIVE, message.getTimeToLive() == null
                ? null
                : message.getTimeToLive().toString());
        byte[] body = message.getBody() == null ? new byte[0] : message.getBody().toBytes();
        return RawMessage.create(BrokerKind.AZURE_SERVICE_BUS, position, properties, message
                .getApplicationProperties(), message.getContentType(), body, message.getDeliveryCount() > 1);
    }

    /**
     * Application properties must be of the AMQP simple types: anything else is sent as its string.
     */
    static Map<String, Object> applicationProperties(Map<String, Object> headers) {
        Map<String, Object> properties = new LinkedHashMap<>(headers.size());
        for (Entry<String, Object> header : headers.entrySet()) {
            Object value = header.getValue();
            if (value == null || value instanceof String || value instanceof Number || value instanceof Boolean
                    || value instanceof Character || value instanceof Date || value instanceof UUID) {
                properties.put(header.getKey(), value);
            }
            else {
                properties.put(header.getKey(), value.toString());
            }
        }
        return properties;
    }

    static boolean isTimeout(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof TimeoutException) {
                return true;
            }
            if (t instanceof ServiceBusException
                    && ServiceBusFailureReason.SERVICE_TIMEOUT.equals(((ServiceBusException) t).getReason())) {
                return true;
            }
        }
        return false;
    }

    static boolean isEntityNotFound(RuntimeException e) {
        return e instanceof ResourceNotFoundException || (e instanceof ServiceBusException
                && ServiceBusFailureReason.MESSAGING_ENTITY_NOT_FOUND.equals(((ServiceBusException) e)
                        .getReason()));
    }

    /**
     * Translates the client library's exceptions to the transport's.
     */
    static BrokerIOException brokerException(RuntimeException e, String doing) {
        // ?: Credentials not accepted?
        if (e instanceof ClientAuthenticationException || (e instanceof ServiceBusException
                && ServiceBusFailureReason.UNAUTHORIZED.equals(((ServiceBusException) e).getReason()))) {
            // -> Yes, so rejection.
            return new ConnectionRejectedException("Azure Service Bus rejected the credentials when " + doing + ".",
                    e);
        }
        if (isTimeout(e)) {
            return new ConnectionTimeoutException("Timed out talking to Azure Service Bus when " + doing + ".", e);
        }
        return new BrokerIOException("Problems talking to Azure Service Bus when " + doing + ".", e);
    }

    @Override
    public String toString() {
        return "AzureServiceBusTransport[" + _name + ", " + _runStatus + "]";
    }
}
