package io.omnibus.messagemanager.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import io.omnibus.messagemanager.api.BrokerIOException;
import io.omnibus.messagemanager.api.BrokerMessage;
import io.omnibus.messagemanager.api.BrokerMessageOperations;
import io.omnibus.messagemanager.api.BrokerTransport;
import io.omnibus.messagemanager.api.BrokerTransport.NativeBulkCapability;
import io.omnibus.messagemanager.api.BrokerTransport.TopicCapability;
import io.omnibus.messagemanager.api.BulkResult;
import io.omnibus.messagemanager.api.BulkResult.Failure;
import io.omnibus.messagemanager.api.BulkResult.FailureReason;
import io.omnibus.messagemanager.api.MessageNotFoundException;
import io.omnibus.messagemanager.api.PurgeResult;
import io.omnibus.messagemanager.api.RawMessage;
import io.omnibus.messagemanager.api.ReceiptTimeoutException;
import io.omnibus.messagemanager.core.MessageBodyEncoder.EncodedBody;

/**
 * The {@link BrokerMessageOperations} of one connection. Looks up the transport in the registry on every call, runs
 * mutating operations under the {@link MessageManager}'s lock for the queue, prefers the transport's native
 * capabilities where present, and reports connection-level failures back to the registry.
 */
class ConnectionMessageOperations implements BrokerMessageOperations, Statics {
    private static final Logger log = LoggerFactory.getLogger(ConnectionMessageOperations.class);

    private final String _connectionId;
    private final MessageManager _messageManager;
    private final ConnectionRegistry _registry;
    private final MessageMutationEngine _engine;
    private final BulkOperationCoordinator _coordinator;

    ConnectionMessageOperations(String connectionId, MessageManager messageManager) {
        _connectionId = connectionId;
        _messageManager = messageManager;
        _registry = messageManager.getRegistry();
        _engine = messageManager.getEngine();
        _coordinator = messageManager.getCoordinator();
    }

    @Override
    public String getConnectionId() {
        return _connectionId;
    }

    @Override
    public List<BrokerMessage> getMessages(String queueId, int limit) {
        // Serialized: without peek, reading is drain and publish back.
        return serialized(queueId, () -> _engine.readMessages(transport(), queueId, limit));
    }

    @Override
    public void sendMessage(String queueId, Object body) {
        unserialized(() -> {
            _engine.send(transport(), queueId, body);
            return null;
        });
    }

    @Override
    public void deleteMessage(String queueId, String messageId) {
        serialized(queueId, () -> {
            _engine.deleteOne(transport(), queueId, messageId);
            return null;
        });
    }

    @Override
    public void moveMessage(String sourceQueueId, String targetQueueId, String messageId) {
        serialized(sourceQueueId, () -> {
            _engine.moveOne(transport(), sourceQueueId, targetQueueId, messageId);
            return null;
        });
    }

    @Override
    public void editMessage(String queueId, String messageId, Object newBody) {
        // Encode first, so that a bad body fails before anything is deleted.
        EncodedBody encoded = _engine.getBodyEncoder().encode(newBody);
        serialized(queueId, () -> {
            BrokerTransport transport = transport();
            _engine.deleteOne(transport, queueId, messageId);
            _engine.sendEncoded(transport, queueId, encoded);
            log.info("EDITED message [" + messageId + "] on [" + queueId + "]: deleted, and sent anew.");
            return null;
        });
    }

    @Override
    public BulkResult bulkDeleteMessages(String queueId, List<String> messageIds) {
        return serialized(queueId, () -> {
            BrokerTransport transport = transport();
            Optional<NativeBulkCapability> nativeBulk = transport.getCapability(NativeBulkCapability.class);
            if (nativeBulk.isPresent()) {
                log.info("BULK DELETE of [" + messageIds.size() + "] ids on [" + queueId
                        + "] using the broker's own bulk delete.");
                return _coordinator.run("bulkDelete", queueId, messageIds, (chunk, onSettled) -> nativeOutcome(
                        chunk, nativeBulk.get().deleteMessages(queueId, chunk), onSettled));
            }
            return _coordinator.run("bulkDelete", queueId, messageIds,
                    (chunk, onSettled) -> _engine.deleteMany(transport, queueId, chunk, onSettled));
        });
    }

    @Override
    public BulkResult bulkMoveMessages(String sourceQueueId, String targetQueueId, List<String> messageIds) {
        return serialized(sourceQueueId, () -> {
            BrokerTransport transport = transport();
            Optional<NativeBulkCapability> nativeBulk = transport.getCapability(NativeBulkCapability.class);
            if (nativeBulk.isPresent()) {
                log.info("BULK MOVE of [" + messageIds.size() + "] ids from [" + sourceQueueId + "] to ["
                        + targetQueueId + "] using the broker's own bulk move.");
                return _coordinator.run("bulkMove", sourceQueueId, messageIds, (chunk, onSettled) -> nativeOutcome(
                        chunk, nativeBulk.get().moveMessages(sourceQueueId, targetQueueId, chunk), onSettled));
            }
            return _coordinator.run("bulkMove", sourceQueueId, messageIds,
                    (chunk, onSettled) -> _engine.moveMany(transport, sourceQueueId, targetQueueId, chunk,
                            onSettled));
        });
    }

    /**
     * Turns a native bulk call's result for one chunk into the coordinator's terms: ids without a failure are
     * settled, {@link FailureReason#NOT_FOUND} ids are missing, and any other failure fails the chunk, so that the
     * coordinator retries the ids not yet settled.
     */
    static MutationOutcome nativeOutcome(List<String> chunk, BulkResult result, Consumer<String> onSettled) {
        Set<String> notFound = new LinkedHashSet<>();
        Set<String> failed = new LinkedHashSet<>();
        List<String> details = new ArrayList<>();
        for (Failure failure : result.getFailures()) {
            if (failure.getReason() == FailureReason.NOT_FOUND) {
                notFound.addAll(failure.getIds());
            }
            else {
                failed.addAll(failure.getIds());
                details.add(failure.getDetail());
            }
        }
        List<String> matched = new ArrayList<>();
        for (String id : chunk) {
            if (!notFound.contains(id) && !failed.contains(id)) {
                matched.add(id);
                onSettled.accept(id);
            }
        }
        if (!failed.isEmpty()) {
            throw new BrokerIOException("The broker's own bulk operation failed for [" + failed.size() + "] of ["
                    + chunk.size() + "] ids, after handling [" + matched.size() + "]: " + details);
        }
        return new MutationOutcome(matched, new ArrayList<>(notFound));
    }

    @Override
    public PurgeResult purgeQueue(String queueId) {
        return serialized(queueId, () -> _engine.purge(transport(), queueId));
    }

    @Override
    public BulkResult importMessages(String queueId, List<?> bodies) {
        return unserialized(() -> _engine.importMessages(transport(), queueId, bodies));
    }

    @Override
    public List<BrokerMessage> exportMessages(String queueId, List<String> messageIds) {
        return serialized(queueId, () -> _engine.exportMessages(transport(), queueId, messageIds));
    }

    // ===== Topics

    @Override
    public List<BrokerMessage> getTopicMessages(String topicName, String subscriptionName, int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive [" + limit + "]");
        }
        return unserialized(() -> {
            List<RawMessage> raws = topics().peekSubscription(topicName, subscriptionName, limit);
            List<BrokerMessage> messages = new ArrayList<>(raws.size());
            for (RawMessage raw : raws) {
                messages.add(_engine.getProjection().normalize(raw));
            }
            return messages;
        });
    }

    @Override
    public void sendTopicMessage(String topicName, Object body) {
        EncodedBody encoded = _engine.getBodyEncoder().encode(body);
        unserialized(() -> {
            TopicCapability topics = topics();
            _engine.withReceiptRetries(topicName, () -> topics.publishToTopic(topicName, encoded.getBytes(),
                    Collections.emptyMap(), encoded.getContentType(), null, true));
            log.info("SENT message of [" + encoded.getBytes().length + "] bytes to topic [" + topicName + "].");
            return null;
        });
    }

    @Override
    public void deleteTopicMessage(String topicName, String subscriptionName, String messageId) {
        if (messageId == null) {
            throw new NullPointerException("messageId");
        }
        String subscriptionPath = topicName + "/subscriptions/" + subscriptionName;
        serialized(subscriptionPath, () -> {
            boolean deleted = topics().deleteFromSubscription(topicName, subscriptionName,
                    raw -> messageId.equals(MessageProjection.deriveId(raw)));
            if (!deleted) {
                throw new MessageNotFoundException(subscriptionPath, messageId);
            }
            log.info("DELETED MESSAGE [" + messageId + "] from [" + subscriptionPath + "].");
            return null;
        });
    }

    // ===== Internals

    private BrokerTransport transport() {
        return _registry.getTransport(_connectionId);
    }

    private TopicCapability topics() {
        return transport().getCapability(TopicCapability.class)
                .orElseThrow(() -> new UnsupportedOperationException("Connection [" + _connectionId
                        + "] is to a broker without topics."));
    }

    private <T> T serialized(String queueId, Supplier<T> operation) {
        if (queueId == null) {
            throw new NullPointerException("queueId");
        }
        return unserialized(() -> _messageManager.withQueueLock(_connectionId, queueId, operation));
    }

    private <T> T unserialized(Supplier<T> operation) {
        try {
            MDC.put(MDC_CONNECTION_ID, _connectionId);
            T result = _messageManager.inFlight(_connectionId, operation);
            _registry.reportSuccess(_connectionId);
            return result;
        }
        catch (ReceiptTimeoutException e) {
            // Ambiguous single publish, not a connection failure.
            throw e;
        }
        catch (BrokerIOException e) {
            _registry.reportFailure(_connectionId, e);
            throw e;
        }
        finally {
            MDC.remove(MDC_CONNECTION_ID);
        }
    }
}
