package io.omnibus.messagemanager.activemq;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import javax.jms.Connection;
import javax.jms.DeliveryMode;
import javax.jms.JMSException;
import javax.jms.MapMessage;
import javax.jms.Message;
import javax.jms.MessageConsumer;
import javax.jms.MessageProducer;
import javax.jms.Queue;
import javax.jms.Session;
import javax.jms.TemporaryQueue;

import org.apache.activemq.ActiveMQConnection;
import org.apache.activemq.advisory.DestinationSource;
import org.apache.activemq.command.ActiveMQQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.omnibus.messagemanager.jms.QueueLister;

/**
 * Lists the queues on an ActiveMQ broker. If the broker has the <code>StatisticsBrokerPlugin</code> installed, it is
 * queried for all queues with their sizes. Otherwise the queue names are taken from the destination advisories, and
 * the counts are left to the transport.
 */
public class ActiveMqQueueLister implements QueueLister, Statics {
    private static final Logger log = LoggerFactory.getLogger(ActiveMqQueueLister.class);

    // The connection we last read advisories on; a new one needs time for the advisories to arrive.
    private volatile Connection _advisoryConnection;

    @Override
    public Map<String, Long> listQueues(Connection connection) throws JMSException {
        if (connection == null) {
            throw new NullPointerException("connection");
        }
        Optional<Map<String, Long>> fromStatistics = queryStatisticsPlugin(connection);
        if (fromStatistics.isPresent()) {
            return fromStatistics.get();
        }
        return fromAdvisories(connection);
    }

    Optional<Map<String, Long>> queryStatisticsPlugin(Connection connection) throws JMSException {
        long nanosAtStart = System.nanoTime();
        Session session = connection.createSession(false, Session.AUTO_ACKNOWLEDGE);
        try {
            TemporaryQueue replyQueue = session.createTemporaryQueue();
            MessageConsumer consumer = session.createConsumer(replyQueue);

            MessageProducer producer = session.createProducer(null);
            // If there is no receiver (StatisticsPlugin not installed), then prevent build-up of msgs.
            producer.setTimeToLive(60 * 1000);
            producer.setDeliveryMode(DeliveryMode.NON_PERSISTENT);

            Queue requestQueues = session.createQueue(QUERY_REQUEST_DESTINATION_PREFIX + ".>");
            Message request = session.createMessage();
            request.setJMSReplyTo(replyQueue);
            // .. set the special property which directs the StatisticsPlugin to "empty terminate" the replies.
            request.setBooleanProperty(QUERY_REQUEST_DENOTE_END_LIST, true);
            producer.send(requestQueues, request);

            Map<String, Long> queues = new LinkedHashMap<>();
            boolean first = true;
            while (true) {
                Message reply = consumer.receive(first
                        ? TIMEOUT_MILLIS_FOR_FIRST_STATS_REPLY
                        : TIMEOUT_MILLIS_FOR_NEXT_STATS_REPLY);
                // ?: Got nothing at all?
                if (reply == null && first) {
                    // -> Yes, so the plugin is not there.
                    log.info("No reply from the StatisticsBrokerPlugin within [" + TIMEOUT_MILLIS_FOR_FIRST_STATS_REPLY
                            + "] ms, assuming it is not installed. Falling back to destination advisories.");
                    return Optional.empty();
                }
                first = false;
                // ?: Timeout, or the "null termination", i.e. an empty MapMessage?
                if (!(reply instanceof MapMessage) || ((MapMessage) reply).getObject("destinationName") == null) {
                    // -> Yes, so this was the last.
                    break;
                }
                MapMessage stats = (MapMessage) reply;
                String destinationName = stats.getString("destinationName");
                // ?: Is it a queue, and not one of the broker's own?
                if (destinationName.startsWith(QUEUE_URL_PREFIX)) {
                    String queueName = destinationName.substring(QUEUE_URL_PREFIX.length());
                    if (!queueName.startsWith(ACTIVEMQ_INTERNAL_PREFIX)) {
                        queues.put(queueName, stats.getLong("size"));
                    }
                }
            }
            log.info("LISTED [" + queues.size() + "] queues from the StatisticsBrokerPlugin, took ["
                    + ms3(System.nanoTime() - nanosAtStart) + "] ms.");
            return Optional.of(sorted(queues));
        }
        finally {
            session.close();
        }
    }

    Map<String, Long> fromAdvisories(Connection connection) throws JMSException {
        // ?: Is this an ActiveMQ connection?
        if (!(connection instanceof ActiveMQConnection)) {
            // -> No, so we cannot get at the advisories.
            log.warn("The JMS Connection is a [" + connection.getClass().getName() + "], not an ActiveMQConnection,"
                    + " so cannot list queues from advisories. Returning no queues.");
            return Collections.emptyMap();
        }
        DestinationSource destinationSource = ((ActiveMQConnection) connection).getDestinationSource();
        // ?: First time on this connection?
        if (_advisoryConnection != connection) {
            // -> Yes, so let the advisories for the existing queues arrive.
            try {
                Thread.sleep(ADVISORY_SETTLE_MILLIS);
            }
            catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.info("Interrupted while waiting for destination advisories, listing what we have.");
            }
            _advisoryConnection = connection;
        }
        Map<String, Long> queues = new LinkedHashMap<>();
        for (ActiveMQQueue queue : destinationSource.getQueues()) {
            String queueName = queue.getPhysicalName();
            if (!queueName.startsWith(ACTIVEMQ_INTERNAL_PREFIX)) {
                // Count unknown: the transport browses.
                queues.put(queueName, null);
            }
        }
        log.info("LISTED [" + queues.size() + "] queues from destination advisories.");
        return sorted(queues);
    }

    private static Map<String, Long> sorted(Map<String, Long> queues) {
        List<String> names = new ArrayList<>(queues.keySet());
        Collections.sort(names);
        Map<String, Long> sorted = new LinkedHashMap<>();
        for (String name : names) {
            sorted.put(name, queues.get(name));
        }
        return sorted;
    }
}
