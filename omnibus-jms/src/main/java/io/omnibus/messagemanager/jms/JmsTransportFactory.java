package io.omnibus.messagemanager.jms;

import java.util.function.Function;

import javax.jms.ConnectionFactory;

import io.omnibus.messagemanager.api.BrokerKind;
import io.omnibus.messagemanager.api.BrokerTransport;
import io.omnibus.messagemanager.api.BrokerTransportFactory;
import io.omnibus.messagemanager.api.ConnectionDefinition;
import io.omnibus.messagemanager.api.EndpointSpec;

/**
 * {@link BrokerTransportFactory} for {@link BrokerKind#JMS} connections to any JMS broker: the application supplies
 * how to make the provider's <code>ConnectionFactory</code> from the endpoint, and how to list its queues.
 */
public class JmsTransportFactory implements BrokerTransportFactory {
    private final Function<EndpointSpec, ConnectionFactory> _connectionFactoryProvider;
    private final QueueLister _queueLister;

    private JmsTransportFactory(Function<EndpointSpec, ConnectionFactory> connectionFactoryProvider,
            QueueLister queueLister) {
        _connectionFactoryProvider = connectionFactoryProvider;
        _queueLister = queueLister;
    }

    public static JmsTransportFactory create(Function<EndpointSpec, ConnectionFactory> connectionFactoryProvider,
            QueueLister queueLister) {
        if (connectionFactoryProvider == null) {
            throw new NullPointerException("connectionFactoryProvider");
        }
        if (queueLister == null) {
            throw new NullPointerException("queueLister");
        }
        return new JmsTransportFactory(connectionFactoryProvider, queueLister);
    }

    @Override
    public BrokerKind getBrokerKind() {
        return BrokerKind.JMS;
    }

    @Override
    public BrokerTransport createTransport(ConnectionDefinition definition) {
        if (definition == null) {
            throw new NullPointerException("definition");
        }
        EndpointSpec endpointSpec = definition.getEndpointSpec();
        ConnectionFactory connectionFactory = _connectionFactoryProvider.apply(endpointSpec);
        if (connectionFactory == null) {
            throw new IllegalArgumentException("No JMS ConnectionFactory for [" + definition + "].");
        }
        return JmsBrokerTransport.create(BrokerKind.JMS, definition.getName() + " (JMS "
                + endpointSpec.getTransportUri() + ")", connectionFactory, _queueLister);
    }
}
