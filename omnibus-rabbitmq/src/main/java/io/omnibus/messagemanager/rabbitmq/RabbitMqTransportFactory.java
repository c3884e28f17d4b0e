package io.omnibus.messagemanager.rabbitmq;

import java.net.URI;
import java.security.KeyManagementException;
import java.security.NoSuchAlgorithmException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rabbitmq.client.ConnectionFactory;

import io.omnibus.messagemanager.api.BrokerKind;
import io.omnibus.messagemanager.api.BrokerTransport;
import io.omnibus.messagemanager.api.BrokerTransportFactory;
import io.omnibus.messagemanager.api.ConnectionDefinition;
import io.omnibus.messagemanager.api.EndpointSpec;
import io.omnibus.messagemanager.api.EndpointSpec.Credentials;

/**
 * Creates {@link RabbitMqBrokerTransport}s. The endpoint is <code>amqp[s]://user:pass@host[:port][/vhost]</code>,
 * optionally followed by <code>;http[s]://user:pass@host:15672[?vhost=name]</code> for the management API. Without the
 * admin segment, the management API is assumed on the AMQP host at port 15672, with the AMQP credentials.
 */
public class RabbitMqTransportFactory implements BrokerTransportFactory, Statics {
    private static final Logger log = LoggerFactory.getLogger(RabbitMqTransportFactory.class);

    private final ObjectMapper _objectMapper;
    private final long _receiptTimeoutMillis;

    public RabbitMqTransportFactory() {
        this(new ObjectMapper(), RECEIPT_TIMEOUT_MILLIS);
    }

    public RabbitMqTransportFactory(ObjectMapper objectMapper, long receiptTimeoutMillis) {
        if (objectMapper == null) {
            throw new NullPointerException("objectMapper");
        }
        _objectMapper = objectMapper;
        _receiptTimeoutMillis = receiptTimeoutMillis;
    }

    @Override
    public BrokerKind getBrokerKind() {
        return BrokerKind.RABBITMQ;
    }

    @Override
    public BrokerTransport createTransport(ConnectionDefinition definition) {
        if (definition == null) {
            throw new NullPointerException("definition");
        }
        if (definition.getBrokerKind() != BrokerKind.RABBITMQ) {
            throw new IllegalArgumentException("Connection [" + definition.getId() + "] is of kind ["
                    + definition.getBrokerKind() + "], not " + BrokerKind.RABBITMQ);
        }
        EndpointSpec endpointSpec = definition.getEndpointSpec();
        ConnectionFactory connectionFactory = createConnectionFactory(endpointSpec);
        URI adminUri = adminUri(endpointSpec);
        Credentials adminCredentials = endpointSpec.getAdminUri().isPresent()
                ? endpointSpec.getAdminCredentials()
                : endpointSpec.getTransportCredentials();
        RabbitMqManagementClient managementClient = RabbitMqManagementClient.create(adminUri, adminCredentials,
                _objectMapper);
        String name = definition.getName() + " (" + BROKER_TYPE + " " + endpointSpec.getTransportUri() + ")";
        log.info("Creating transport for [" + definition + "], management API at [" + adminUri + "], vhost ["
                + endpointSpec.getVhost() + "].");
        return RabbitMqBrokerTransport.create(name, connectionFactory, managementClient, endpointSpec.getVhost(),
                _objectMapper, _receiptTimeoutMillis);
    }

    static ConnectionFactory createConnectionFactory(EndpointSpec endpointSpec) {
        URI transportUri = endpointSpec.getTransportUri();
        String scheme = transportUri.getScheme();
        boolean tls = "amqps".equalsIgnoreCase(scheme);
        if (!tls && !"amqp".equalsIgnoreCase(scheme)) {
            throw new IllegalArgumentException("RabbitMQ transport URL must be amqp:// or amqps://, not [" + scheme
                    + "://].");
        }
        if (transportUri.getHost() == null) {
            throw new IllegalArgumentException("RabbitMQ transport URL has no host.");
        }
        ConnectionFactory connectionFactory = new ConnectionFactory();
        connectionFactory.setHost(transportUri.getHost());
        if (tls) {
            try {
                connectionFactory.useSslProtocol();
            }
            catch (NoSuchAlgorithmException | KeyManagementException e) {
                throw new IllegalArgumentException("Could not set up TLS for [" + transportUri + "].", e);
            }
        }
        connectionFactory.setPort(transportUri.getPort() != -1
                ? transportUri.getPort()
                : (tls ? ConnectionFactory.DEFAULT_AMQP_OVER_SSL_PORT : ConnectionFactory.DEFAULT_AMQP_PORT));
        connectionFactory.setVirtualHost(endpointSpec.getVhost());
        Credentials credentials = endpointSpec.getTransportCredentials();
        if (credentials.isPresent()) {
            connectionFactory.setUsername(credentials.getUsername());
            connectionFactory.setPassword(credentials.getPassword() == null ? "" : credentials.getPassword());
        }
        connectionFactory.setConnectionTimeout(AMQP_CONNECTION_TIMEOUT_MILLIS);
        // Reconnect is done by the connection registry, on a new transport.
        connectionFactory.setAutomaticRecoveryEnabled(false);
        connectionFactory.setTopologyRecoveryEnabled(false);
        return connectionFactory;
    }

    static URI adminUri(EndpointSpec endpointSpec) {
        if (endpointSpec.getAdminUri().isPresent()) {
            return endpointSpec.getAdminUri().get();
        }
        URI transportUri = endpointSpec.getTransportUri();
        String scheme = "amqps".equalsIgnoreCase(transportUri.getScheme()) ? "https" : "http";
        return URI.create(scheme + "://" + transportUri.getHost() + ":" + DEFAULT_MANAGEMENT_PORT);
    }
}
