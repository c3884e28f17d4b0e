package io.omnibus.messagemanager.jms;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

import javax.jms.Connection;
import javax.jms.JMSException;

/**
 * JMS has no standard way to enumerate the queues on a broker, so each JMS flavour supplies its own. A generic JMS
 * broker can use {@link #fixed(Collection)} with the queue names it is configured with.
 */
@FunctionalInterface
public interface QueueLister {
    /**
     * @param connection
     *            the transport's shared, started connection. Do not close it.
     * @return queue name to message count, in the order to present them. A <code>null</code> count means that the
     *         lister does not know, in which case the transport counts by browsing the queue.
     */
    Map<String, Long> listQueues(Connection connection) throws JMSException;

    /**
     * @return a lister which always returns the given queue names, with unknown counts.
     */
    static QueueLister fixed(Collection<String> queueNames) {
        if (queueNames == null) {
            throw new NullPointerException("queueNames");
        }
        Map<String, Long> queues = new LinkedHashMap<>();
        for (String queueName : queueNames) {
            queues.put(queueName, null);
        }
        return connection -> new LinkedHashMap<>(queues);
    }
}
