package io.omnibus.messagemanager.api;

import java.io.Closeable;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * The minimal set of primitives the message manager needs from a broker: destructively <i>drain</i> up to N messages
 * from a queue, <i>publish</i> a message with broker confirmation, and list the queues. Everything else - delete and
 * move by id, bulk operations, purge, export - is composed on top of these by the mutation engine, unless the
 * transport offers a broker-native way through one of the optional {@link TransportCapability capabilities}.
 * <p/>
 * A transport instance represents one connection to one broker, and its lifecycle is owned by the connection
 * registry: {@link #start()} once, then use, then {@link #close()}. Instances must be thread safe: the mutation
 * engine publishes concurrently from several threads.
 * <p/>
 * Connection-level failures are never retried inside a transport, they are surfaced as
 * {@link ConnectionTimeoutException}, {@link ConnectionRejectedException} or {@link BrokerIOException}.
 */
public interface BrokerTransport extends Closeable {

    /**
     * Opens the connection to the broker.
     *
     * @throws ConnectionTimeoutException
     *             if the broker could not be reached in time.
     * @throws ConnectionRejectedException
     *             if the broker refused the credentials.
     * @throws BrokerIOException
     *             for any other problem talking to the broker.
     */
    void start() throws BrokerIOException;

    /**
     * Closes the connection. Idempotent, and never throws.
     */
    @Override
    void close();

    BrokerKind getBrokerKind();

    /**
     * Destructively removes up to <code>maxCount</code> messages from the head of the queue, in one administrative
     * call. After this returns, the returned messages exist only in the caller's memory: the caller is responsible
     * for publishing back every message it does not intend to remove.
     *
     * @return the removed messages in queue order, possibly fewer than <code>maxCount</code> - an empty list if the
     *         queue is empty.
     */
    List<RawMessage> drain(String queueId, int maxCount) throws BrokerIOException;

    /**
     * Publishes a message to the queue. When <code>confirm</code> is <code>true</code>, returns only after the broker
     * has acknowledged receipt; every invocation uses a fresh receipt token.
     *
     * @param headers
     *            application headers to carry, must not contain the broker's reserved headers.
     * @param contentType
     *            the content type, <code>null</code> if unknown.
     * @param messageId
     *            the message id to set on the published message, <code>null</code> to let the broker decide.
     * @throws ReceiptTimeoutException
     *             if confirming and no receipt arrived within the receipt timeout. The outcome is then ambiguous: the
     *             message may or may not have been admitted.
     * @throws BrokerIOException
     *             if the publish definitely failed.
     */
    void publish(String queueId, byte[] body, Map<String, Object> headers, String contentType, String messageId,
            boolean confirm) throws BrokerIOException;

    List<BrokerQueue> listQueues() throws BrokerIOException;

    /**
     * @return the number of messages on the queue as reported by the broker, <code>0</code> if the queue is not
     *         known. The default implementation looks the queue up in {@link #listQueues()}.
     */
    default long queueDepth(String queueId) throws BrokerIOException {
        for (BrokerQueue queue : listQueues()) {
            if (queue.getId().equals(queueId) || queue.getName().equals(queueId)) {
                return queue.getApproximateDepth();
            }
        }
        return 0;
    }

    /**
     * Capability discovery: callers ask for an optional capability, and fall back to composing the operation from
     * drain and publish if it is absent. The default implementation returns the transport itself if it implements
     * the requested capability interface.
     */
    default <T extends TransportCapability> Optional<T> getCapability(Class<T> capabilityType) {
        if (capabilityType.isInstance(this)) {
            return Optional.of(capabilityType.cast(this));
        }
        return Optional.empty();
    }

    /**
     * Marker for the optional capabilities a transport may offer.
     */
    interface TransportCapability {
    }

    /**
     * Non-destructive browse of a queue.
     */
    interface PeekCapability extends TransportCapability {
        /**
         * @return up to <code>maxCount</code> messages from the head of the queue, which all remain on the queue.
         */
        List<RawMessage> peek(String queueId, int maxCount) throws BrokerIOException;
    }

    /**
     * Broker-side removal of all messages on a queue.
     */
    interface NativePurgeCapability extends TransportCapability {
        /**
         * @return the number of messages removed, as reported by the broker.
         */
        long purge(String queueId) throws BrokerIOException;
    }

    /**
     * Broker-side delete and move by message id, where the broker offers it.
     */
    interface NativeBulkCapability extends TransportCapability {
        /**
         * @return the result, where ids not present on the queue are counted as failed.
         */
        BulkResult deleteMessages(String queueId, List<String> messageIds) throws BrokerIOException;

        /**
         * @return the result, where ids not present on the source queue are counted as failed.
         */
        BulkResult moveMessages(String sourceQueueId, String targetQueueId, List<String> messageIds)
                throws BrokerIOException;
    }

    /**
     * Publish/subscribe topics with durable subscriptions (Azure Service Bus).
     */
    interface TopicCapability extends TransportCapability {
        List<BrokerTopic> listTopics() throws BrokerIOException;

        List<BrokerSubscription> listSubscriptions(String topicName) throws BrokerIOException;

        List<RawMessage> peekSubscription(String topicName, String subscriptionName, int maxCount)
                throws BrokerIOException;

        /**
         * Removes the first message on the subscription matched by the predicate. Messages are received under a
         * lock: the matched message is completed, all others are abandoned so that they return to the
         * subscription.
         *
         * @return <code>true</code> if a message was matched and removed.
         */
        boolean deleteFromSubscription(String topicName, String subscriptionName, Predicate<RawMessage> matcher)
                throws BrokerIOException;

        /**
         * Publishes to the topic, i.e. to all its subscriptions. Same semantics as
         * {@link BrokerTransport#publish(String, byte[], Map, String, String, boolean) publish}.
         */
        void publishToTopic(String topicName, byte[] body, Map<String, Object> headers, String contentType,
                String messageId, boolean confirm) throws BrokerIOException;
    }
}
