package io.omnibus.messagemanager.rabbitmq;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import com.rabbitmq.client.MessageProperties;
import com.rabbitmq.client.PossibleAuthenticationFailureException;
import com.rabbitmq.client.ShutdownSignalException;

import io.omnibus.messagemanager.api.BrokerIOException;
import io.omnibus.messagemanager.api.BrokerKind;
import io.omnibus.messagemanager.api.BrokerQueue;
import io.omnibus.messagemanager.api.BrokerTransport;
import io.omnibus.messagemanager.api.BrokerTransport.NativePurgeCapability;
import io.omnibus.messagemanager.api.BrokerTransport.PeekCapability;
import io.omnibus.messagemanager.api.ConnectionRejectedException;
import io.omnibus.messagemanager.api.ConnectionTimeoutException;
import io.omnibus.messagemanager.api.RawMessage;
import io.omnibus.messagemanager.api.ReceiptTimeoutException;
import io.omnibus.messagemanager.rabbitmq.RabbitMqManagementClient.NotFoundException;

/**
 * {@link BrokerTransport} for RabbitMQ. Publishing is AMQP 0-9-1 on the default exchange with the queue name as
 * routing key, using publisher confirms for the receipt, and the <i>mandatory</i> flag so that a publish to a queue
 * which does not exist fails instead of being silently dropped. Drain, peek, listing and purge use the management HTTP
 * API, as AMQP has no way to take N messages in one call.
 * <p/>
 * AMQP channels are not thread safe, so confirmed publishes borrow a channel from a small pool of idle channels.
 */
public class RabbitMqBrokerTransport implements BrokerTransport, PeekCapability, NativePurgeCapability, Statics {
    private static final Logger log = LoggerFactory.getLogger(RabbitMqBrokerTransport.class);

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<Map<String, Object>>() {
    };

    private final String _name;
    private final ConnectionFactory _connectionFactory;
    private final RabbitMqManagementClient _managementClient;
    private final String _vhost;
    private final ObjectMapper _objectMapper;
    private final long _receiptTimeoutMillis;

    private final ConcurrentLinkedQueue<PublishChannel> _idleChannels = new ConcurrentLinkedQueue<>();

    private volatile Connection _connection;
    private volatile RunStatus _runStatus = RunStatus.NOT_STARTED;

    enum RunStatus {
        NOT_STARTED, RUNNING, CLOSED
    }

    private RabbitMqBrokerTransport(String name, ConnectionFactory connectionFactory,
            RabbitMqManagementClient managementClient, String vhost, ObjectMapper objectMapper,
            long receiptTimeoutMillis) {
        _name = name;
        _connectionFactory = connectionFactory;
        _managementClient = managementClient;
        _vhost = vhost;
        _objectMapper = objectMapper;
        _receiptTimeoutMillis = receiptTimeoutMillis;
    }

    /**
     * @param connectionFactory
     *            AMQP connection factory, with automatic recovery disabled: reconnecting is the registry's business.
     */
    public static RabbitMqBrokerTransport create(String name, ConnectionFactory connectionFactory,
            RabbitMqManagementClient managementClient, String vhost, ObjectMapper objectMapper,
            long receiptTimeoutMillis) {
        if (name == null) {
            throw new NullPointerException("name");
        }
        if (connectionFactory == null) {
            throw new NullPointerException("connectionFactory");
        }
        if (managementClient == null) {
            throw new NullPointerException("managementClient");
        }
        if (vhost == null) {
            throw new NullPointerException("vhost");
        }
        if (objectMapper == null) {
            throw new NullPointerException("objectMapper");
        }
        if (receiptTimeoutMillis <= 0) {
            throw new IllegalArgumentException("receiptTimeoutMillis must be positive [" + receiptTimeoutMillis
                    + "]");
        }
        return new RabbitMqBrokerTransport(name, connectionFactory, managementClient, vhost, objectMapper,
                receiptTimeoutMillis);
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
            _connection = _connectionFactory.newConnection("omnibus: " + _name);
        }
        catch (PossibleAuthenticationFailureException e) {
            // Also AuthenticationFailureException, which is a subclass.
            throw new ConnectionRejectedException("RabbitMQ [" + _name + "] rejected the AMQP credentials.", e);
        }
        catch (TimeoutException e) {
            throw new ConnectionTimeoutException("Could not connect over AMQP to RabbitMQ [" + _name + "] within ["
                    + AMQP_CONNECTION_TIMEOUT_MILLIS + "] ms.", e);
        }
        catch (IOException e) {
            throw new BrokerIOException("Could not connect over AMQP to RabbitMQ [" + _name + "].", e);
        }
        // Verify the management API credentials too, as drain depends on it.
        String user = _managementClient.whoami();
        log.info("STARTED RabbitMQ transport [" + _name + "], vhost [" + _vhost + "], management API user [" + user
                + "], took [" + ms3(System.nanoTime() - nanosAtStart) + "] ms.");
    }

    @Override
    public void close() {
        synchronized (this) {
            if (_runStatus == RunStatus.CLOSED) {
                return;
            }
            _runStatus = RunStatus.CLOSED;
        }
        _idleChannels.clear();
        Connection connection = _connection;
        _connection = null;
        if (connection != null) {
            try {
                // Closes all channels as well.
                connection.close();
            }
            catch (IOException | ShutdownSignalException e) {
                log.warn("Got [" + e.getClass().getSimpleName() + "] when closing AMQP connection of [" + _name
                        + "], ignoring.");
            }
        }
        log.info("CLOSED RabbitMQ transport [" + _name + "].");
    }

    @Override
    public BrokerKind getBrokerKind() {
        return BrokerKind.RABBITMQ;
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
        long nanosAtStart = System.nanoTime();
        List<JsonNode> messages;
        try {
            messages = _managementClient.getMessages(_vhost, queueId, maxCount, ACKMODE_DRAIN, null);
        }
        catch (NotFoundException e) {
            // No such queue: nothing to drain.
            return Collections.emptyList();
        }
        List<RawMessage> drained = toRawMessages(messages);
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
        try {
            // Never truncated: the bodies are exported, and ids of messages without one are hashed over them.
            return toRawMessages(_managementClient.getMessages(_vhost, queueId, maxCount, ACKMODE_PEEK, null));
        }
        catch (NotFoundException e) {
            return Collections.emptyList();
        }
    }

    @Override
    public long purge(String queueId) throws BrokerIOException {
        if (queueId == null) {
            throw new NullPointerException("queueId");
        }
        assertRunning();
        // The API does not say how many it removed, so ask first.
        long depth = _managementClient.queueDepth(_vhost, queueId);
        try {
            _managementClient.purge(_vhost, queueId);
        }
        catch (NotFoundException e) {
            return 0;
        }
        log.info("PURGED queue [" + queueId + "], which had [" + depth + "] messages.");
        return depth;
    }

    @Override
    public List<BrokerQueue> listQueues() throws BrokerIOException {
        assertRunning();
        List<BrokerQueue> queues = new ArrayList<>();
        for (JsonNode queue : _managementClient.listQueues(_vhost)) {
            String name = queue.path("name").asText();
            queues.add(new BrokerQueue(name, name, queue.path("messages").asLong(0)));
        }
        return queues;
    }

    @Override
    public long queueDepth(String queueId) throws BrokerIOException {
        if (queueId == null) {
            throw new NullPointerException("queueId");
        }
        assertRunning();
        return _managementClient.queueDepth(_vhost, queueId);
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

        AMQP.BasicProperties properties = MessageProperties.PERSISTENT_BASIC.builder()
                .contentType(contentType)
                .messageId(messageId)
                .headers(headers == null || headers.isEmpty() ? null : amqpHeaders(headers))
                .build();

        long nanosAtStart = System.nanoTime();
        PublishChannel publishChannel = borrowChannel();
        boolean reusable = false;
        try {
            publishChannel._returned = false;
            publishChannel._channel.basicPublish("", queueId, true, properties, body);
            // ?: Confirming?
            if (confirm) {
                // -> Yes, so wait for the broker's ack, where a nack throws IOException.
                publishChannel._channel.waitForConfirmsOrDie(_receiptTimeoutMillis);
                // A return arrives before the ack, so is seen by now.
                if (publishChannel._returned) {
                    reusable = true;
                    throw new BrokerIOException("Publish of message [" + messageId + "] to [" + queueId
                            + "] was returned by RabbitMQ as unroutable: there is no such queue.");
                }
            }
            reusable = true;
            if (log.isDebugEnabled()) log.debug("PUBLISHED message [" + messageId + "] to [" + queueId + "], took ["
                    + ms3(System.nanoTime() - nanosAtStart) + "] ms.");
        }
        catch (TimeoutException e) {
            // The confirm is still outstanding on this channel, so it is dropped.
            throw new ReceiptTimeoutException(queueId, "channel#" + publishChannel._channel.getChannelNumber(),
                    _receiptTimeoutMillis, e);
        }
        catch (IOException | ShutdownSignalException e) {
            throw new BrokerIOException("Publish of message [" + messageId + "] to [" + queueId + "] on RabbitMQ ["
                    + _name + "] failed.", e);
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ReceiptTimeoutException(queueId, "channel#" + publishChannel._channel.getChannelNumber(),
                    _receiptTimeoutMillis, e);
        }
        finally {
            returnChannel(publishChannel, reusable);
        }
    }

    // ===== Internals

    private void assertRunning() {
        if (_runStatus != RunStatus.RUNNING) {
            throw new IllegalStateException("Transport [" + _name + "] is not running, but [" + _runStatus + "].");
        }
    }

    /**
     * A confirm-mode channel, and whether the last publish on it was returned as unroutable.
     */
    private static class PublishChannel {
        private final Channel _channel;
        private volatile boolean _returned;

        private PublishChannel(Channel channel) {
            _channel = channel;
        }
    }

    private PublishChannel borrowChannel() throws BrokerIOException {
        PublishChannel idle;
        while ((idle = _idleChannels.poll()) != null) {
            if (idle._channel.isOpen()) {
                return idle;
            }
        }
        Connection connection = _connection;
        if (connection == null || !connection.isOpen()) {
            throw new BrokerIOException("The AMQP connection of RabbitMQ [" + _name + "] is closed.");
        }
        try {
            Channel channel = connection.createChannel();
            if (channel == null) {
                throw new BrokerIOException("No more AMQP channels available on RabbitMQ [" + _name + "].");
            }
            channel.confirmSelect();
            PublishChannel publishChannel = new PublishChannel(channel);
            channel.addReturnListener(returned -> publishChannel._returned = true);
            return publishChannel;
        }
        catch (IOException | ShutdownSignalException e) {
            throw new BrokerIOException("Could not create AMQP channel on RabbitMQ [" + _name + "].", e);
        }
    }

    private void returnChannel(PublishChannel publishChannel, boolean reusable) {
        if (reusable && publishChannel._channel.isOpen() && _runStatus == RunStatus.RUNNING) {
            _idleChannels.offer(publishChannel);
            return;
        }
        try {
            publishChannel._channel.abort();
        }
        catch (IOException e) {
            log.warn("Got [" + e.getClass().getSimpleName() + "] when aborting AMQP channel of [" + _name
                    + "], ignoring.");
        }
    }

    /**
     * AMQP header values must be of the field-table types: anything else is sent as its string.
     */
    private static Map<String, Object> amqpHeaders(Map<String, Object> headers) {
        Map<String, Object> amqp = new LinkedHashMap<>(headers.size());
        for (Entry<String, Object> header : headers.entrySet()) {
            Object value = header.getValue();
            if (value == null || value instanceof String || value instanceof Number || value instanceof Boolean
                    || value instanceof byte[] || value instanceof List || value instanceof Map) {
                amqp.put(header.getKey(), value);
            }
            else {
                amqp.put(header.getKey(), value.toString());
            }
        }
        return amqp;
    }

    List<RawMessage> toRawMessages(List<JsonNode> messages) {
        List<RawMessage> raws = new ArrayList<>(messages.size());
        for (JsonNode message : messages) {
            raws.add(toRawMessage(message, raws.size()));
        }
        return raws;
    }

    private RawMessage toRawMessage(JsonNode message, int position) {
        JsonNode amqpProperties = message.path("properties");

        Map<String, Object> properties = new LinkedHashMap<>();
        Iterator<Entry<String, JsonNode>> fields = amqpProperties.fields();
        while (fields.hasNext()) {
            Entry<String, JsonNode> field = fields.next();
            if (!"headers".equals(field.getKey())) {
                properties.put(field.getKey(), _objectMapper.convertValue(field.getValue(), Object.class));
            }
        }
        properties.put("redelivered", message.path("redelivered").asBoolean(false));
        properties.put(RAW_PROP_EXCHANGE, message.path(RAW_PROP_EXCHANGE).asText(""));
        properties.put(RAW_PROP_ROUTING_KEY, message.path(RAW_PROP_ROUTING_KEY).asText(""));
        properties.put(RAW_PROP_PAYLOAD_BYTES, message.path(RAW_PROP_PAYLOAD_BYTES).asLong(0));

        Map<String, Object> headers = amqpProperties.has("headers")
                ? _objectMapper.convertValue(amqpProperties.get("headers"), MAP_TYPE)
                : null;

        String payload = message.path("payload").asText("");
        byte[] body = PAYLOAD_ENCODING_BASE64.equals(message.path("payload_encoding").asText())
                ? Base64.getDecoder().decode(payload)
                : payload.getBytes(StandardCharsets.UTF_8);

        String contentType = amqpProperties.hasNonNull("content_type")
                ? amqpProperties.get("content_type").asText()
                : null;
        return RawMessage.create(BrokerKind.RABBITMQ, position, properties, headers, contentType, body,
                message.path("redelivered").asBoolean(false));
    }

    @Override
    public String toString() {
        return "RabbitMqBrokerTransport[" + _name + ", vhost=" + _vhost + ", " + _runStatus + "]";
    }
}
