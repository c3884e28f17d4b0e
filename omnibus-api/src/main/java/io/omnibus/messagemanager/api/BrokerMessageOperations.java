package io.omnibus.messagemanager.api;

import java.util.List;

/**
 * The operations offered on the queues and topics of one registered connection. Obtained from the message manager,
 * which serializes all mutating operations per queue.
 * <p/>
 * All operations throw unchecked exceptions: {@link BrokerIOException} and its subclasses for broker problems,
 * {@link MessageNotFoundException} when a single targeted message is not on the queue, and
 * {@link DataLossRiskException} if a drained message could not be put back on any queue.
 */
public interface BrokerMessageOperations {

    /**
     * @return the connection these operations work on.
     */
    String getConnectionId();

    /**
     * Reads up to <code>limit</code> messages from the head of the queue without removing them. Where the broker
     * cannot browse, the messages are drained and immediately published back in the same order.
     */
    List<BrokerMessage> getMessages(String queueId, int limit);

    /**
     * Publishes a message, with broker confirmation. A <code>byte[]</code> or <code>String</code> body is sent as
     * is, any other object is serialized to JSON.
     */
    void sendMessage(String queueId, Object body);

    /**
     * Removes the single message with the given id, leaving every other message on the queue.
     *
     * @throws MessageNotFoundException
     *             if no message with the id is on the queue - all other messages are then still on the queue.
     */
    void deleteMessage(String queueId, String messageId);

    /**
     * Moves the single message with the given id to the target queue. At-least-once: under failure the message may
     * end up on both queues, but never on neither.
     *
     * @throws MessageNotFoundException
     *             if no message with the id is on the source queue.
     */
    void moveMessage(String sourceQueueId, String targetQueueId, String messageId);

    /**
     * Replaces the message with the given id with a new message with the new body, by delete followed by send. The
     * new message is put at the tail of the queue.
     */
    void editMessage(String queueId, String messageId, Object newBody);

    /**
     * Deletes the messages with the given ids in chunks. Ids not found, and ids of chunks that failed, are counted
     * as failed - all failed messages remain on the queue.
     */
    BulkResult bulkDeleteMessages(String queueId, List<String> messageIds);

    /**
     * Moves the messages with the given ids in chunks. Ids not found, and ids of chunks that failed, are counted as
     * failed - all failed messages remain on the source queue.
     */
    BulkResult bulkMoveMessages(String sourceQueueId, String targetQueueId, List<String> messageIds);

    /**
     * Removes all messages on the queue.
     */
    PurgeResult purgeQueue(String queueId);

    /**
     * Publishes each body as a new message. One body failing does not stop the rest.
     *
     * @return the result, where {@link BulkResult.Failure#getIndex()} is the index of the failed body.
     */
    BulkResult importMessages(String queueId, List<?> bodies);

    /**
     * Returns the bodies of the messages with the given ids, or of all messages if the list is empty. The queue is
     * left as it was.
     */
    List<BrokerMessage> exportMessages(String queueId, List<String> messageIds);

    /**
     * Non-destructively reads messages from a topic subscription.
     *
     * @throws UnsupportedOperationException
     *             if the broker does not have topics.
     */
    List<BrokerMessage> getTopicMessages(String topicName, String subscriptionName, int limit);

    /**
     * Publishes to a topic, with broker confirmation.
     *
     * @throws UnsupportedOperationException
     *             if the broker does not have topics.
     */
    void sendTopicMessage(String topicName, Object body);

    /**
     * Removes a single message from a topic subscription.
     *
     * @throws MessageNotFoundException
     *             if no message with the id is on the subscription.
     * @throws UnsupportedOperationException
     *             if the broker does not have topics.
     */
    void deleteTopicMessage(String topicName, String subscriptionName, String messageId);
}
