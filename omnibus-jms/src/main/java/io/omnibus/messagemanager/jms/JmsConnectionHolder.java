package io.omnibus.messagemanager.jms;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import javax.jms.Connection;
import javax.jms.ConnectionFactory;
import javax.jms.JMSException;
import javax.jms.Session;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.omnibus.messagemanager.api.BrokerIOException;

/**
 * The one JMS Connection shared by all operations of a {@link JmsBrokerTransport}.
 * <p/>
 * The Connection is made on a connector thread, so that a hanging broker cannot hold the caller longer than
 * {@link #CONNECTION_CREATE_TIMEOUT_MILLIS}; callers arriving while it runs wait for the same attempt. Failures are
 * thrown to the caller as they are: the holder never retries. The transport {@link #dropConnection() drops} the
 * Connection when an operation has seen it fail, and the next operation then makes a new one.
 */
class JmsConnectionHolder implements Statics {
    private static final Logger log = LoggerFactory.getLogger(JmsConnectionHolder.class);

    private final ConnectionFactory _connectionFactory;
    private final String _name;

    // GuardedBy(this)
    private Connection _connection;
    private ConnectAttempt _connectAttempt;

    JmsConnectionHolder(ConnectionFactory connectionFactory, String name) {
        _connectionFactory = connectionFactory;
        _name = name;
    }

    /**
     * One run of the connector thread.
     */
    private static final class ConnectAttempt {
        private final CountDownLatch _finished = new CountDownLatch(1);
        private volatile Connection _connection;
        private volatile Exception _failure;
    }

    /**
     * @param transacted
     *            <code>true</code> for a {@link Session#SESSION_TRANSACTED} session, else auto-acknowledge.
     * @throws JMSException
     *             if the Connection cannot make a session: the caller decides whether to drop the Connection.
     * @throws BrokerIOException
     *             if there is no Connection and none could be made.
     */
    Session createSession(boolean transacted) throws JMSException {
        Connection connection = connection();
        return transacted
                ? connection.createSession(true, Session.SESSION_TRANSACTED)
                : connection.createSession(false, Session.AUTO_ACKNOWLEDGE);
    }

    /**
     * @return the shared Connection, made now if there is none.
     */
    Connection connection() throws BrokerIOException {
        ConnectAttempt attempt;
        synchronized (this) {
            if (_connection != null) {
                return _connection;
            }
            // ?: Is a connector thread already running?
            if (_connectAttempt == null) {
                // -> No, so start one.
                ConnectAttempt started = new ConnectAttempt();
                _connectAttempt = started;
                Thread connector = new Thread(() -> connect(started), "Omnibus JMS connector for [" + _name + "]");
                connector.setDaemon(true);
                connector.start();
            }
            attempt = _connectAttempt;
        }

        boolean finished;
        try {
            finished = attempt._finished.await(CONNECTION_CREATE_TIMEOUT_MILLIS, TimeUnit.MILLISECONDS);
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BrokerIOException("Interrupted while waiting for the JMS Connection to [" + _name + "].", e);
        }
        if (!finished) {
            throw new BrokerIOException("No JMS Connection to [" + _name + "] within ["
                    + CONNECTION_CREATE_TIMEOUT_MILLIS + "] ms.");
        }
        if (attempt._failure != null) {
            throw new BrokerIOException("Could not make a JMS Connection to [" + _name + "].", attempt._failure);
        }
        return attempt._connection;
    }

    private void connect(ConnectAttempt attempt) {
        long nanosAtStart = System.nanoTime();
        Connection connection = null;
        try {
            connection = _connectionFactory.createConnection();
            connection.start();
            attempt._connection = connection;
            log.info("CONNECTED to JMS broker [" + _name + "], took [" + ms(System.nanoTime() - nanosAtStart)
                    + "] ms.");
        }
        catch (JMSException | RuntimeException e) {
            attempt._failure = e;
            log.warn("Could not make a JMS Connection to [" + _name + "]: " + e.getClass().getSimpleName() + ": "
                    + e.getMessage());
            closeQuietly(connection);
        }
        finally {
            synchronized (this) {
                _connectAttempt = null;
                if (attempt._connection != null) {
                    _connection = attempt._connection;
                }
            }
            attempt._finished.countDown();
        }
    }

    /**
     * Closes and forgets the shared Connection, if any.
     */
    void dropConnection() {
        Connection dropped;
        synchronized (this) {
            dropped = _connection;
            _connection = null;
        }
        if (dropped != null) {
            log.info("Dropping the JMS Connection to [" + _name + "].");
            closeQuietly(dropped);
        }
    }

    private void closeQuietly(Connection connection) {
        if (connection == null) {
            return;
        }
        try {
            connection.close();
        }
        catch (JMSException e) {
            log.warn("Got [" + e.getClass().getSimpleName() + "] when closing the JMS Connection to [" + _name
                    + "], ignoring.");
        }
    }

    static void closeQuietly(Session session) {
        if (session == null) {
            return;
        }
        try {
            session.close();
        }
        catch (JMSException e) {
            log.warn("Got [" + e.getClass().getSimpleName() + "] when closing JMS Session [" + session
                    + "], ignoring.");
        }
    }
}
