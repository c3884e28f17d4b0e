package io.omnibus.messagemanager.core;

import java.io.Closeable;
import java.time.Clock;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;

import io.omnibus.messagemanager.api.BrokerMessageOperations;
import io.omnibus.messagemanager.api.BrokerTransportFactory;
import io.omnibus.messagemanager.api.ConnectionDefinition;
import io.omnibus.messagemanager.api.ConnectionInfo;
import io.omnibus.messagemanager.api.MessageOperationException;

/**
 * Entry point of the message management core: composes the {@link ConnectionRegistry}, the
 * {@link QueueCatalogReader}, the {@link MessageMutationEngine} and the {@link BulkOperationCoordinator}, and hands
 * out the {@link BrokerMessageOperations} of each connection.
 * <p/>
 * Operations which drain a queue are serialized per (connection, queue): a second such operation on the same queue
 * waits until the first has finished, so that neither sees the other's drained messages as missing. Operations on
 * different queues run concurrently. Sends and imports only publish, and are not serialized.
 * <p/>
 * A connection cannot be registered again or removed while operations are running on it, as closing its transport
 * would break them halfway.
 */
public class MessageManager implements Statics, Closeable {
    private static final Logger log = LoggerFactory.getLogger(MessageManager.class);

    private final ConnectionRegistry _registry;
    private final QueueCatalogReader _catalog;
    private final MessageMutationEngine _engine;
    private final BulkOperationCoordinator _coordinator;

    // connectionId -> queueId -> lock
    private final ConcurrentHashMap<String, ConcurrentHashMap<String, ReentrantLock>> _queueLocks =
            new ConcurrentHashMap<>();
    // connectionId -> read: an operation in flight, write: re-registering or removing
    private final ConcurrentHashMap<String, ReentrantReadWriteLock> _connectionGuards = new ConcurrentHashMap<>();

    private MessageManager(ConnectionRegistry registry, MessageMutationEngine engine,
            BulkOperationCoordinator coordinator) {
        _registry = registry;
        _catalog = new QueueCatalogReader(registry);
        _engine = engine;
        _coordinator = coordinator;
    }

    /**
     * Creates a manager with all components built from the given settings.
     */
    public static MessageManager create(Collection<BrokerTransportFactory> factories, MutationSettings settings) {
        if (settings == null) {
            throw new NullPointerException("settings");
        }
        ObjectMapper objectMapper = new ObjectMapper();
        ConnectionRegistry registry = ConnectionRegistry.create(factories, settings.getConnectTimeoutMillis());
        MessageMutationEngine engine = MessageMutationEngine.create(
                MessageProjection.create(objectMapper, Clock.systemUTC()),
                new MessageBodyEncoder(objectMapper), settings);
        log.info("Creating MessageManager with " + settings + ".");
        return new MessageManager(registry, engine, BulkOperationCoordinator.create(settings));
    }

    /**
     * Creates a manager from components already built, e.g. with test doubles.
     */
    public static MessageManager create(ConnectionRegistry registry, MessageMutationEngine engine,
            BulkOperationCoordinator coordinator) {
        if (registry == null) {
            throw new NullPointerException("registry");
        }
        if (engine == null) {
            throw new NullPointerException("engine");
        }
        if (coordinator == null) {
            throw new NullPointerException("coordinator");
        }
        return new MessageManager(registry, engine, coordinator);
    }

    // ===== Connections

    /**
     * @see ConnectionRegistry#register(ConnectionDefinition)
     * @throws IllegalStateException
     *             if the connection is already registered and operations are running on it.
     */
    public String registerConnection(ConnectionDefinition definition) {
        if (definition == null) {
            throw new NullPointerException("definition");
        }
        return exclusively(definition.getId(), "register again", () -> _registry.register(definition));
    }

    /**
     * Closes and forgets the connection, and the locks of its queues.
     *
     * @throws IllegalStateException
     *             if operations are running on it.
     */
    public boolean removeConnection(String connectionId) {
        if (connectionId == null) {
            throw new NullPointerException("connectionId");
        }
        return exclusively(connectionId, "remove", () -> {
            boolean removed = _registry.remove(connectionId);
            _queueLocks.remove(connectionId);
            return removed;
        });
    }

    public List<ConnectionInfo> listConnections() {
        return _registry.listConnections();
    }

    /**
     * @return the operations on the given connection's queues and topics.
     * @throws IllegalArgumentException
     *             if there is no such connection.
     */
    public BrokerMessageOperations operations(String connectionId) {
        if (connectionId == null) {
            throw new NullPointerException("connectionId");
        }
        if (!_registry.hasConnection(connectionId)) {
            throw new IllegalArgumentException("No connection registered with id [" + connectionId + "].");
        }
        return new ConnectionMessageOperations(connectionId, this);
    }

    public QueueCatalogReader getCatalog() {
        return _catalog;
    }

    public ConnectionRegistry getRegistry() {
        return _registry;
    }

    public MessageMutationEngine getEngine() {
        return _engine;
    }

    public BulkOperationCoordinator getCoordinator() {
        return _coordinator;
    }

    /**
     * @see MessageMutationEngine#setPhaseListener(OperationPhaseListener)
     */
    public void setOperationPhaseListener(OperationPhaseListener phaseListener) {
        _engine.setPhaseListener(phaseListener);
    }

    /**
     * Removes all connections, and stops the engine's republish threads.
     */
    @Override
    public void close() {
        log.info("Closing MessageManager.");
        _registry.close();
        _queueLocks.clear();
        _engine.close();
    }

    // ===== Serialization

    private ReentrantReadWriteLock guard(String connectionId) {
        return _connectionGuards.computeIfAbsent(connectionId, id -> new ReentrantReadWriteLock());
    }

    private <T> T exclusively(String connectionId, String change, Supplier<T> registryChange) {
        ReentrantReadWriteLock guard = guard(connectionId);
        // ?: Is any operation running on, or waiting for, the connection's transport?
        if (!guard.writeLock().tryLock()) {
            // -> Yes, so the transport must not be closed now.
            throw new IllegalStateException("Cannot " + change + " connection [" + connectionId + "]: ["
                    + guard.getReadLockCount() + "] operation(s) are in flight on it. Try again when they are done.");
        }
        try {
            return registryChange.get();
        }
        finally {
            guard.writeLock().unlock();
        }
    }

    /**
     * Runs an operation on the connection, keeping it from being registered again or removed meanwhile. Waits if
     * that is happening right now.
     */
    <T> T inFlight(String connectionId, Supplier<T> operation) {
        ReentrantReadWriteLock guard = guard(connectionId);
        guard.readLock().lock();
        try {
            return operation.get();
        }
        finally {
            guard.readLock().unlock();
        }
    }

    /**
     * Runs the operation holding the lock of the (connection, queue), waiting for any other operation holding it.
     * Locks are fair, so waiting operations run in arrival order.
     *
     * @throws MessageOperationException
     *             if interrupted while waiting for the lock, with the interrupt flag set again.
     */
    <T> T withQueueLock(String connectionId, String queueId, Supplier<T> operation) {
        ReentrantLock lock = _queueLocks.computeIfAbsent(connectionId, id -> new ConcurrentHashMap<>())
                .computeIfAbsent(queueId, id -> new ReentrantLock(true));
        // ?: Must we wait for another operation on this queue?
        if (lock.isLocked() && !lock.isHeldByCurrentThread()) {
            // -> Yes, so log it, as this may take a while.
            log.info("WAITING for another operation on [" + queueId + "] of [" + connectionId
                    + "] to finish, [" + lock.getQueueLength() + "] already waiting.");
        }
        try {
            lock.lockInterruptibly();
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MessageOperationException("Interrupted while waiting for another operation on [" + queueId
                    + "] of [" + connectionId + "] to finish; nothing was done.", e);
        }
        try {
            return operation.get();
        }
        finally {
            lock.unlock();
        }
    }
}
