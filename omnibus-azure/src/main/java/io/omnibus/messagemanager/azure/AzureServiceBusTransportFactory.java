package io.omnibus.messagemanager.azure;

import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.azure.core.amqp.AmqpRetryOptions;
import com.azure.messaging.servicebus.ServiceBusClientBuilder;
import com.azure.messaging.servicebus.administration.ServiceBusAdministrationClient;
import com.azure.messaging.servicebus.administration.ServiceBusAdministrationClientBuilder;

import io.omnibus.messagemanager.api.BrokerKind;
import io.omnibus.messagemanager.api.BrokerTransport;
import io.omnibus.messagemanager.api.BrokerTransportFactory;
import io.omnibus.messagemanager.api.ConnectionDefinition;

/**
 * Creates {@link AzureServiceBusTransport}s. The endpoint is the namespace's SAS connection string,
 * <code>Endpoint=sb://&lt;namespace&gt;.servicebus.windows.net/;SharedAccessKeyName=..;SharedAccessKey=..</code>,
 * which needs the <i>Manage</i> right for listing.
 */
public class AzureServiceBusTransportFactory implements BrokerTransportFactory, Statics {
    private static final Logger log = LoggerFactory.getLogger(AzureServiceBusTransportFactory.class);

    private final long _receiptTimeoutMillis;

    public AzureServiceBusTransportFactory() {
        this(RECEIPT_TIMEOUT_MILLIS);
    }

    public AzureServiceBusTransportFactory(long receiptTimeoutMillis) {
        if (receiptTimeoutMillis <= 0) {
            throw new IllegalArgumentException("receiptTimeoutMillis must be positive [" + receiptTimeoutMillis
                    + "]");
        }
        _receiptTimeoutMillis = receiptTimeoutMillis;
    }

    @Override
    public BrokerKind getBrokerKind() {
        return BrokerKind.AZURE_SERVICE_BUS;
    }

    @Override
    public BrokerTransport createTransport(ConnectionDefinition definition) {
        if (definition == null) {
            throw new NullPointerException("definition");
        }
        if (definition.getBrokerKind() != BrokerKind.AZURE_SERVICE_BUS) {
            throw new IllegalArgumentException("Connection [" + definition.getId() + "] is of kind ["
                    + definition.getBrokerKind() + "], not " + BrokerKind.AZURE_SERVICE_BUS);
        }
        String connectionString = definition.getEndpointSpec().getRaw();
        String endpoint = endpointOf(connectionString);

        // Both builders check the connection string, throwing IllegalArgumentException.
        ServiceBusClientBuilder clientBuilder = new ServiceBusClientBuilder()
                .connectionString(connectionString)
                .retryOptions(new AmqpRetryOptions()
                        .setMaxRetries(0)
                        .setTryTimeout(Duration.ofMillis(_receiptTimeoutMillis)));
        ServiceBusAdministrationClient administrationClient = new ServiceBusAdministrationClientBuilder()
                .connectionString(connectionString)
                .buildClient();

        log.info("Creating transport for [" + definition + "].");
        return AzureServiceBusTransport.create(definition.getName() + " (" + BROKER_TYPE + " " + endpoint + ")",
                clientBuilder, administrationClient, _receiptTimeoutMillis);
    }

    /**
     * @return the <code>Endpoint</code> value of the connection string, e.g.
     *         <code>sb://ns.servicebus.windows.net/</code>.
     * @throws IllegalArgumentException
     *             if there is none.
     */
    static String endpointOf(String connectionString) {
        for (String part : connectionString.split(";")) {
            String trimmed = part.trim();
            if (trimmed.regionMatches(true, 0, ENDPOINT_PREFIX, 0, ENDPOINT_PREFIX.length())) {
                return trimmed.substring(ENDPOINT_PREFIX.length());
            }
        }
        throw new IllegalArgumentException("The Azure Service Bus connection string has no ["
                + ENDPOINT_PREFIX + "] part.");
    }
}
