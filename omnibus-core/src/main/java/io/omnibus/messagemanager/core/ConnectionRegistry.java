package io.omnibus.messagemanager.core;

import java.io.Closeable;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.FutureTask;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import io.omnibus.messagemanager.api.BrokerIOException;
import io.omnibus.messagemanager.api.BrokerKind;
import io.omnibus.messagemanager.api.BrokerTransport;
import io.omnibus.messagemanager.api.BrokerTransportFactory;
import io.omnibus.messagemanager.api.ConnectionDefinition;
import io.omnibus.messagemanager.api.ConnectionInfo;
import io.omnibus.messagemanager.api.ConnectionInfo.Liveness;
import io.omnibus.messagemanager.api.ConnectionTimeoutException;

/**
 * Owns the connections: creates their transports through the {@link BrokerTransportFactory} registered for the broker
 * kind, starts them under the connect timeout, and closes them on removal. The only writer of a connection's
 * {@link Liveness}.
 * <p/>
 * Not a singleton: the composing application creates one, and hands it to the components that need it.
 */
public class ConnectionRegistry implements Statics, Closeable {
    private static final Logger log = LoggerFactory.getLogger(ConnectionRegistry.class);

    private final Map<BrokerKind, BrokerTransportFactory> _factories;
    private final long _connectTimeoutMillis;

    private final ConcurrentHashMap<String, RegisteredConnection> _connections = new ConcurrentHashMap<>();

    private ConnectionRegistry(Map<BrokerKind, BrokerTransportFactory> factories, long connectTimeoutMillis) {
        _factories = factories;
        _connectTimeoutMillis = connectTimeoutMillis;
    }

    public static ConnectionRegistry create(Collection<BrokerTransportFactory> factories,
            long connectTimeoutMillis) {
        if (factories == null) {
            throw new NullPointerException("factories");
        }
        if (connectTimeoutMillis <= 0) {
            throw new IllegalArgumentException("connectTimeoutMillis must be positive [" + connectTimeoutMillis
                    + "]");
        }
        Map<BrokerKind, BrokerTransportFactory> byKind = new EnumMap<>(BrokerKind.class);
        for (BrokerTransportFactory factory : factories) {
            BrokerTransportFactory existing = byKind.put(factory.getBrokerKind(), factory);
            if (existing != null) {
                throw new IllegalArgumentException("More than one BrokerTransportFactory for broker kind ["
                        + factory.getBrokerKind() + "]: [" + existing + "] and [" + factory + "].");
            }
        }
        return new ConnectionRegistry(byKind, connectTimeoutMillis);
    }

    private static final class RegisteredConnection {
        private final ConnectionDefinition _definition;
        private final BrokerTransport _transport;
        private volatile Liveness _liveness = Liveness.CONNECTING;
        // Whether start() ever succeeded; a connection which never connected has no usable transport.
        private volatile boolean _started;

        private RegisteredConnection(ConnectionDefinition definition, BrokerTransport transport) {
            _definition = definition;
            _transport = transport;
        }
    }

    /**
     * Creates and starts a transport for the connection. A connection with the same id is closed and replaced, even
     * with operations running on it: {@link MessageManager#registerConnection(ConnectionDefinition)} refuses that.
     *
     * @return the connection id.
     * @throws ConnectionTimeoutException
     *             if the transport did not start within the connect timeout. The connection is then registered
     *             with liveness {@link Liveness#FAILED}.
     * @throws BrokerIOException
     *             if starting failed otherwise, likewise leaving the connection as {@link Liveness#FAILED}.
     * @throws IllegalArgumentException
     *             if there is no factory for the broker kind.
     */
    public String register(ConnectionDefinition definition) {
        if (definition == null) {
            throw new NullPointerException("definition");
        }
        BrokerTransportFactory factory = _factories.get(definition.getBrokerKind());
        if (factory == null) {
            throw new IllegalArgumentException("Unsupported broker kind [" + definition.getBrokerKind()
                    + "], no BrokerTransportFactory registered for it.");
        }
        String connectionId = definition.getId();
        try {
            MDC.put(MDC_CONNECTION_ID, connectionId);
            BrokerTransport transport = factory.createTransport(definition);
            RegisteredConnection connection = new RegisteredConnection(definition, transport);
            RegisteredConnection previous = _connections.put(connectionId, connection);
            if (previous != null) {
                log.info("Connection [" + connectionId + "] is registered again, closing the previous transport.");
                closeQuietly(previous);
            }

            log.info("CONNECTING " + definition + ", timeout [" + _connectTimeoutMillis + "] ms.");
            long nanosAtStart = System.nanoTime();
            startWithTimeout(connection);
            connection._started = true;
            connection._liveness = Liveness.CONNECTED;
            log.info("CONNECTED [" + connectionId + "] - " + ms(System.nanoTime() - nanosAtStart) + " ms.");
            return connectionId;
        }
        finally {
            MDC.remove(MDC_CONNECTION_ID);
        }
    }

    private void startWithTimeout(RegisteredConnection connection) {
        String connectionId = connection._definition.getId();
        FutureTask<Void> startTask = new FutureTask<>(connection._transport::start, null);
        Thread starter = new Thread(startTask, "Omnibus ConnectionRegistry: Connecting [" + connectionId + "]");
        starter.setDaemon(true);
        starter.start();
        try {
            startTask.get(_connectTimeoutMillis, TimeUnit.MILLISECONDS);
        }
        catch (TimeoutException e) {
            failed(connection, startTask);
            throw new ConnectionTimeoutException("Could not connect [" + connectionId + "] to "
                    + connection._definition.getBrokerKind() + " within [" + _connectTimeoutMillis + "] ms.", e);
        }
        catch (ExecutionException e) {
            failed(connection, startTask);
            if (e.getCause() instanceof BrokerIOException) {
                throw (BrokerIOException) e.getCause();
            }
            throw new BrokerIOException("Could not connect [" + connectionId + "] to "
                    + connection._definition.getBrokerKind() + ".", e.getCause());
        }
        catch (InterruptedException e) {
            failed(connection, startTask);
            Thread.currentThread().interrupt();
            throw new BrokerIOException("Interrupted while connecting [" + connectionId + "].", e);
        }
    }

    private void failed(RegisteredConnection connection, FutureTask<Void> startTask) {
        connection._liveness = Liveness.FAILED;
        startTask.cancel(true);
        closeQuietly(connection);
        log.warn("Connection [" + connection._definition.getId() + "] FAILED to connect.");
    }

    /**
     * Closes the connection's transport and forgets it. Does nothing if there is no such connection.
     *
     * @return whether there was such a connection.
     */
    public boolean remove(String connectionId) {
        if (connectionId == null) {
            throw new NullPointerException("connectionId");
        }
        RegisteredConnection connection = _connections.remove(connectionId);
        if (connection == null) {
            log.info("Asked to remove connection [" + connectionId + "], but it is not registered. Ignoring.");
            return false;
        }
        closeQuietly(connection);
        connection._liveness = Liveness.DISCONNECTED;
        log.info("DISCONNECTED and removed connection [" + connectionId + "].");
        return true;
    }

    /**
     * @throws IllegalArgumentException
     *             if there is no such connection.
     * @throws BrokerIOException
     *             if the connection never managed to connect.
     */
    public BrokerTransport getTransport(String connectionId) {
        RegisteredConnection connection = registered(connectionId);
        if (!connection._started) {
            throw new BrokerIOException("Connection [" + connectionId + "] is [" + connection._liveness
                    + "], and has never connected. Register it again to retry.");
        }
        return connection._transport;
    }

    public Optional<ConnectionInfo> getConnection(String connectionId) {
        if (connectionId == null) {
            throw new NullPointerException("connectionId");
        }
        RegisteredConnection connection = _connections.get(connectionId);
        return connection == null
                ? Optional.empty()
                : Optional.of(new ConnectionInfo(connection._definition, connection._liveness));
    }

    public List<ConnectionInfo> listConnections() {
        List<ConnectionInfo> result = new ArrayList<>();
        for (RegisteredConnection connection : _connections.values()) {
            result.add(new ConnectionInfo(connection._definition, connection._liveness));
        }
        return result;
    }

    public boolean hasConnection(String connectionId) {
        return connectionId != null && _connections.containsKey(connectionId);
    }

    /**
     * Called by operations which observed a connection-level failure, marking the connection as
     * {@link Liveness#FAILED}. The transport is kept: transports reconnect on their next use where they can.
     */
    public void reportFailure(String connectionId, Throwable failure) {
        RegisteredConnection connection = _connections.get(connectionId);
        if (connection == null) {
            return;
        }
        if (connection._liveness != Liveness.FAILED) {
            log.warn("Connection [" + connectionId + "] marked FAILED due to [" + failure.getClass().getSimpleName()
                    + ": " + failure.getMessage() + "].");
        }
        connection._liveness = Liveness.FAILED;
    }

    /**
     * Called by operations which succeeded on a connection earlier marked as {@link Liveness#FAILED}.
     */
    public void reportSuccess(String connectionId) {
        RegisteredConnection connection = _connections.get(connectionId);
        if (connection != null && connection._started && connection._liveness == Liveness.FAILED) {
            log.info("Connection [" + connectionId + "] works again, marked CONNECTED.");
            connection._liveness = Liveness.CONNECTED;
        }
    }

    /**
     * Removes all connections.
     */
    @Override
    public void close() {
        for (String connectionId : new ArrayList<>(_connections.keySet())) {
            remove(connectionId);
        }
    }

    private RegisteredConnection registered(String connectionId) {
        if (connectionId == null) {
            throw new NullPointerException("connectionId");
        }
        RegisteredConnection connection = _connections.get(connectionId);
        if (connection == null) {
            throw new IllegalArgumentException("No connection registered with id [" + connectionId + "].");
        }
        return connection;
    }

    private static void closeQuietly(RegisteredConnection connection) {
        try {
            connection._transport.close();
        }
        catch (RuntimeException e) {
            log.warn("Got [" + e.getClass().getSimpleName() + "] when closing transport of connection ["
                    + connection._definition.getId() + "], ignoring.", e);
        }
    }
}
