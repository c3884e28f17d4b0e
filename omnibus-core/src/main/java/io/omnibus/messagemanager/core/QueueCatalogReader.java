package io.omnibus.messagemanager.core;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.omnibus.messagemanager.api.BrokerIOException;
import io.omnibus.messagemanager.api.BrokerQueue;
import io.omnibus.messagemanager.api.BrokerSubscription;
import io.omnibus.messagemanager.api.BrokerTopic;
import io.omnibus.messagemanager.api.BrokerTransport;
import io.omnibus.messagemanager.api.BrokerTransport.TopicCapability;

/**
 * Reads queues, topics and subscriptions of a connection, straight from the broker on every call.
 */
public class QueueCatalogReader implements Statics {
    private static final Logger log = LoggerFactory.getLogger(QueueCatalogReader.class);

    private final ConnectionRegistry _registry;

    public QueueCatalogReader(ConnectionRegistry registry) {
        if (registry == null) {
            throw new NullPointerException("registry");
        }
        _registry = registry;
    }

    public List<BrokerQueue> listQueues(String connectionId) {
        BrokerTransport transport = _registry.getTransport(connectionId);
        long nanosAtStart = System.nanoTime();
        try {
            List<BrokerQueue> queues = transport.listQueues();
            _registry.reportSuccess(connectionId);
            log.debug("Listed [" + queues.size() + "] queues on [" + connectionId + "] - "
                    + ms(System.nanoTime() - nanosAtStart) + " ms.");
            return queues;
        }
        catch (BrokerIOException e) {
            _registry.reportFailure(connectionId, e);
            throw e;
        }
    }

    public long queueDepth(String connectionId, String queueId) {
        if (queueId == null) {
            throw new NullPointerException("queueId");
        }
        BrokerTransport transport = _registry.getTransport(connectionId);
        try {
            long depth = Math.max(0, transport.queueDepth(queueId));
            _registry.reportSuccess(connectionId);
            return depth;
        }
        catch (BrokerIOException e) {
            _registry.reportFailure(connectionId, e);
            throw e;
        }
    }

    /**
     * @return the topics, or an empty list if the broker has no topics.
     */
    public List<BrokerTopic> listTopics(String connectionId) {
        Optional<TopicCapability> topics = _registry.getTransport(connectionId).getCapability(
                TopicCapability.class);
        if (topics.isEmpty()) {
            return Collections.emptyList();
        }
        try {
            return topics.get().listTopics();
        }
        catch (BrokerIOException e) {
            _registry.reportFailure(connectionId, e);
            throw e;
        }
    }

    /**
     * @return the subscriptions of the topic, or an empty list if the broker has no topics.
     */
    public List<BrokerSubscription> listSubscriptions(String connectionId, String topicName) {
        if (topicName == null) {
            throw new NullPointerException("topicName");
        }
        Optional<TopicCapability> topics = _registry.getTransport(connectionId).getCapability(
                TopicCapability.class);
        if (topics.isEmpty()) {
            return Collections.emptyList();
        }
        try {
            return topics.get().listSubscriptions(topicName);
        }
        catch (BrokerIOException e) {
            _registry.reportFailure(connectionId, e);
            throw e;
        }
    }
}
