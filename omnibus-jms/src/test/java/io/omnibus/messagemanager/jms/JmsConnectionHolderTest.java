package io.omnibus.messagemanager.jms;

import java.lang.reflect.Proxy;
import java.util.Collections;
import java.util.concurrent.atomic.AtomicInteger;

import javax.jms.Connection;
import javax.jms.ConnectionFactory;
import javax.jms.JMSException;
import javax.jms.JMSSecurityException;

import org.junit.Assert;
import org.junit.Test;

import io.omnibus.messagemanager.api.BrokerIOException;
import io.omnibus.messagemanager.api.BrokerKind;
import io.omnibus.messagemanager.api.ConnectionRejectedException;

/**
 * The shared JMS Connection: failures reach the caller on the first attempt, and a dropped Connection is only
 * remade by the next operation.
 */
public class JmsConnectionHolderTest {
    private final AtomicInteger _connectionsCreated = new AtomicInteger();
    private final AtomicInteger _connectionsClosed = new AtomicInteger();

    /**
     * A factory whose Connections start fine, but cannot make sessions.
     */
    private ConnectionFactory connectionFactoryWithoutSessions() {
        return (ConnectionFactory) Proxy.newProxyInstance(getClass().getClassLoader(), new Class<?>[] {
                ConnectionFactory.class }, (factory, factoryMethod, factoryArgs) -> {
                    if (!factoryMethod.getName().equals("createConnection")) {
                        throw new UnsupportedOperationException(factoryMethod.getName());
                    }
                    _connectionsCreated.incrementAndGet();
                    return Proxy.newProxyInstance(getClass().getClassLoader(), new Class<?>[] { Connection.class },
                            (connection, method, args) -> {
                                switch (method.getName()) {
                                    case "createSession":
                                        throw new JMSException("Maximum number of sessions reached");
                                    case "close":
                                        _connectionsClosed.incrementAndGet();
                                        return null;
                                    case "toString":
                                        return "SessionlessConnection";
                                    case "hashCode":
                                        return System.identityHashCode(connection);
                                    case "equals":
                                        return connection == args[0];
                                    default:
                                        return null;
                                }
                            });
                });
    }

    @Test
    public void createSessionFailure_isThrown_withoutMakingAnotherConnection() {
        // :: ARRANGE
        JmsConnectionHolder holder = new JmsConnectionHolder(connectionFactoryWithoutSessions(), "test");

        // :: ACT
        try {
            holder.createSession(true);
            Assert.fail("Expected JMSException");
        }
        // :: ASSERT
        catch (JMSException e) {
            Assert.assertEquals("Maximum number of sessions reached", e.getMessage());
        }
        Assert.assertEquals(1, _connectionsCreated.get());
        Assert.assertEquals(0, _connectionsClosed.get());
    }

    @Test
    public void transportOperation_failsOnce_andTheNextOneReconnects() {
        // :: ARRANGE
        JmsBrokerTransport transport = JmsBrokerTransport.create(BrokerKind.JMS, "sessionless",
                connectionFactoryWithoutSessions(), QueueLister.fixed(Collections.singletonList("orders")));
        transport.start();
        Assert.assertEquals(1, _connectionsCreated.get());

        try {
            // :: ACT
            try {
                transport.drain("orders", 10);
                Assert.fail("Expected BrokerIOException");
            }
            // :: ASSERT
            catch (BrokerIOException e) {
                Assert.assertTrue(e.getCause() instanceof JMSException);
            }
            Assert.assertEquals("One attempt, no reconnect within the operation", 1, _connectionsCreated.get());
            Assert.assertEquals("The failed Connection is dropped", 1, _connectionsClosed.get());

            try {
                transport.peek("orders", 10);
                Assert.fail("Expected BrokerIOException");
            }
            catch (BrokerIOException e) {
                Assert.assertEquals(2, _connectionsCreated.get());
            }
        }
        finally {
            transport.close();
        }
    }

    @Test
    public void connectFailure_isThrown_andTheNextCallTriesAgain() {
        // :: ARRANGE
        AtomicInteger attempts = new AtomicInteger();
        ConnectionFactory refusing = (ConnectionFactory) Proxy.newProxyInstance(getClass().getClassLoader(),
                new Class<?>[] { ConnectionFactory.class }, (factory, method, args) -> {
                    attempts.incrementAndGet();
                    throw new JMSException("Connection refused");
                });
        JmsConnectionHolder holder = new JmsConnectionHolder(refusing, "refusing");

        // :: ACT
        for (int i = 0; i < 2; i++) {
            try {
                holder.connection();
                Assert.fail("Expected BrokerIOException");
            }
            // :: ASSERT
            catch (BrokerIOException e) {
                Assert.assertEquals("Connection refused", e.getCause().getMessage());
            }
        }
        Assert.assertEquals(2, attempts.get());
    }

    @Test(expected = ConnectionRejectedException.class)
    public void securityFailureOnStart_isRejection() {
        ConnectionFactory rejecting = (ConnectionFactory) Proxy.newProxyInstance(getClass().getClassLoader(),
                new Class<?>[] { ConnectionFactory.class }, (factory, method, args) -> {
                    throw new JMSSecurityException("User name [guest] or password is invalid.");
                });

        JmsBrokerTransport.create(BrokerKind.JMS, "rejecting", rejecting, QueueLister.fixed(Collections
                .<String> emptyList())).start();
    }
}
