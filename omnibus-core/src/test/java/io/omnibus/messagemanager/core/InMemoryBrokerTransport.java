package io.omnibus.messagemanager.core;

import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

import io.omnibus.messagemanager.api.BrokerIOException;
import io.omnibus.messagemanager.api.BrokerKind;
import io.omnibus.messagemanager.api.BrokerQueue;
import io.omnibus.messagemanager.api.BrokerTransport;
import io.omnibus.messagemanager.api.BrokerTransport.NativePurgeCapability;
import io.omnibus.messagemanager.api.BrokerTransport.PeekCapability;
import io.omnibus.messagemanager.api.ProviderFieldNames;
import io.omnibus.messagemanager.api.RawMessage;
import io.omnibus.messagemanager.api.ReceiptTimeoutException;

/**
 * A broker in a map, for testing the engine: FIFO queues with drain and confirmed publish, optional peek and native
 * purge, and hooks for injecting faults into drain and publish.
 */
class InMemoryBrokerTransport implements BrokerTransport, PeekCapability, NativePurgeCapability {
    private static final String MESSAGE_ID = ProviderFieldNames.forKind(BrokerKind.RABBITMQ).getMessageId();

    private final Map<String, Deque<RawMessage>> _queues = new LinkedHashMap<>();
    private final Map<String, AtomicInteger> _publishAttempts = new HashMap<>();
    private final AtomicInteger _drainCount = new AtomicInteger();
    private final Set<Capability> _capabilities = EnumSet.noneOf(Capability.class);

    private volatile DrainFault _drainFault;
    private volatile PublishFault _publishFault;
    private volatile boolean _started;
    private volatile boolean _closed;

    enum Capability {
        PEEK, NATIVE_PURGE
    }

    /**
     * What a publish should do, decided per attempt.
     */
    enum PublishOutcome {
        /**
         * Admitted and confirmed.
         */
        OK,

        /**
         * Not admitted, failing with a {@link BrokerIOException}.
         */
        FAIL,

        /**
         * Not admitted, and no receipt: {@link ReceiptTimeoutException}.
         */
        NO_RECEIPT,

        /**
         * Admitted, but the receipt was lost: {@link ReceiptTimeoutException}.
         */
        ADMITTED_NO_RECEIPT
    }

    @FunctionalInterface
    interface DrainFault {
        /**
         * @param wouldDrain
         *            the messages the drain would remove; throw to fail the drain before anything is removed.
         */
        void beforeDrain(String queueId, List<RawMessage> wouldDrain, int drainNumber);
    }

    @FunctionalInterface
    interface PublishFault {
        /**
         * @param attempt
         *            1-based count of publishes of this message id to this queue.
         */
        PublishOutcome decide(String queueId, String messageId, int attempt);
    }

    static InMemoryBrokerTransport create(Capability... capabilities) {
        InMemoryBrokerTransport transport = new InMemoryBrokerTransport();
        for (Capability capability : capabilities) {
            transport._capabilities.add(capability);
        }
        return transport;
    }

    void setDrainFault(DrainFault drainFault) {
        _drainFault = drainFault;
    }

    void setPublishFault(PublishFault publishFault) {
        _publishFault = publishFault;
    }

    synchronized InMemoryBrokerTransport addMessage(String queueId, String messageId, String body) {
        queue(queueId).addLast(RawMessage.ofText(BrokerKind.RABBITMQ, 0, messageId, body));
        return this;
    }

    synchronized InMemoryBrokerTransport addMessages(String queueId, String... messageIds) {
        for (String messageId : messageIds) {
            addMessage(queueId, messageId, "body of " + messageId);
        }
        return this;
    }

    synchronized List<String> ids(String queueId) {
        List<String> ids = new ArrayList<>();
        for (RawMessage raw : queue(queueId)) {
            Object id = raw.getProperty(MESSAGE_ID);
            ids.add(id == null ? null : id.toString());
        }
        return ids;
    }

    synchronized List<String> bodies(String queueId) {
        List<String> bodies = new ArrayList<>();
        for (RawMessage raw : queue(queueId)) {
            bodies.add(new String(raw.getBody(), StandardCharsets.UTF_8));
        }
        return bodies;
    }

    synchronized int publishAttempts(String queueId, String messageId) {
        AtomicInteger attempts = _publishAttempts.get(queueId + "|" + messageId);
        return attempts == null ? 0 : attempts.get();
    }

    int drainCount() {
        return _drainCount.get();
    }

    boolean isStarted() {
        return _started;
    }

    boolean isClosed() {
        return _closed;
    }

    @Override
    public void start() {
        _started = true;
    }

    @Override
    public void close() {
        _closed = true;
    }

    @Override
    public BrokerKind getBrokerKind() {
        return BrokerKind.RABBITMQ;
    }

    @Override
    public synchronized List<RawMessage> drain(String queueId, int maxCount) {
        Deque<RawMessage> queue = queue(queueId);
        List<RawMessage> wouldDrain = new ArrayList<>();
        int position = 0;
        for (RawMessage raw : queue) {
            if (position == maxCount) {
                break;
            }
            wouldDrain.add(raw.withPosition(position++));
        }
        int drainNumber = _drainCount.incrementAndGet();
        DrainFault drainFault = _drainFault;
        if (drainFault != null) {
            drainFault.beforeDrain(queueId, wouldDrain, drainNumber);
        }
        for (int i = 0; i < wouldDrain.size(); i++) {
            queue.removeFirst();
        }
        return wouldDrain;
    }

    @Override
    public void publish(String queueId, byte[] body, Map<String, Object> headers, String contentType,
            String messageId, boolean confirm) {
        PublishOutcome outcome;
        synchronized (this) {
            int attempt = _publishAttempts.computeIfAbsent(queueId + "|" + messageId, key -> new AtomicInteger())
                    .incrementAndGet();
            PublishFault publishFault = _publishFault;
            outcome = publishFault == null
                    ? PublishOutcome.OK
                    : publishFault.decide(queueId, messageId, attempt);
            if (outcome == PublishOutcome.OK || outcome == PublishOutcome.ADMITTED_NO_RECEIPT) {
                Map<String, Object> properties = new HashMap<>();
                properties.put(MESSAGE_ID, messageId != null ? messageId : UUID.randomUUID().toString());
                queue(queueId).addLast(RawMessage.create(BrokerKind.RABBITMQ, 0, properties, headers,
                        contentType, body, false));
            }
        }
        switch (outcome) {
            case OK:
                return;
            case FAIL:
                throw new BrokerIOException("Injected publish failure to [" + queueId + "] of [" + messageId + "].");
            case NO_RECEIPT:
            case ADMITTED_NO_RECEIPT:
                throw new ReceiptTimeoutException(queueId, UUID.randomUUID().toString(), 10);
            default:
                throw new AssertionError("Unknown outcome " + outcome);
        }
    }

    @Override
    public synchronized List<BrokerQueue> listQueues() {
        List<BrokerQueue> queues = new ArrayList<>();
        for (Map.Entry<String, Deque<RawMessage>> entry : _queues.entrySet()) {
            queues.add(new BrokerQueue(entry.getKey(), entry.getKey(), entry.getValue().size()));
        }
        return queues;
    }

    @Override
    public synchronized long queueDepth(String queueId) {
        return queue(queueId).size();
    }

    @Override
    public synchronized List<RawMessage> peek(String queueId, int maxCount) {
        List<RawMessage> peeked = new ArrayList<>();
        for (RawMessage raw : queue(queueId)) {
            if (peeked.size() == maxCount) {
                break;
            }
            peeked.add(raw.withPosition(peeked.size()));
        }
        return peeked;
    }

    @Override
    public synchronized long purge(String queueId) {
        Deque<RawMessage> queue = queue(queueId);
        int removed = queue.size();
        queue.clear();
        return removed;
    }

    @Override
    public <T extends TransportCapability> Optional<T> getCapability(Class<T> capabilityType) {
        if (capabilityType == PeekCapability.class && !_capabilities.contains(Capability.PEEK)) {
            return Optional.empty();
        }
        if (capabilityType == NativePurgeCapability.class && !_capabilities.contains(Capability.NATIVE_PURGE)) {
            return Optional.empty();
        }
        return BrokerTransport.super.getCapability(capabilityType);
    }

    private Deque<RawMessage> queue(String queueId) {
        return _queues.computeIfAbsent(queueId, id -> new ArrayDeque<>());
    }
}
