package io.omnibus.messagemanager.rabbitmq;

import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import io.omnibus.messagemanager.api.BrokerIOException;
import io.omnibus.messagemanager.api.ConnectionRejectedException;
import io.omnibus.messagemanager.api.ConnectionTimeoutException;
import io.omnibus.messagemanager.api.DataLossRiskException;
import io.omnibus.messagemanager.api.EndpointSpec.Credentials;

/**
 * Client for the parts of the RabbitMQ management HTTP API the transport uses: getting messages (which is the only
 * way to take N messages from a queue in one call), listing queues, and purging.
 */
public class RabbitMqManagementClient implements Statics {
    private static final Logger log = LoggerFactory.getLogger(RabbitMqManagementClient.class);

    private final URI _baseUri;
    private final String _authorization;
    private final ObjectMapper _objectMapper;
    private final HttpClient _httpClient;

    private RabbitMqManagementClient(URI baseUri, String authorization, ObjectMapper objectMapper) {
        _baseUri = baseUri;
        _authorization = authorization;
        _objectMapper = objectMapper;
        _httpClient = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(Duration.ofMillis(HTTP_CONNECT_TIMEOUT_MILLIS))
                .build();
    }

    /**
     * @param baseUri
     *            the management API base, e.g. <code>http://host:15672</code>, without credentials.
     */
    public static RabbitMqManagementClient create(URI baseUri, Credentials credentials, ObjectMapper objectMapper) {
        if (baseUri == null) {
            throw new NullPointerException("baseUri");
        }
        if (credentials == null) {
            throw new NullPointerException("credentials");
        }
        if (objectMapper == null) {
            throw new NullPointerException("objectMapper");
        }
        String authorization = credentials.isPresent()
                ? "Basic " + Base64.getEncoder().encodeToString((credentials.getUsername() + ":"
                        + (credentials.getPassword() == null ? "" : credentials.getPassword()))
                                .getBytes(StandardCharsets.UTF_8))
                : null;
        String base = baseUri.toString();
        // Strip trailing slash, as all paths start with one.
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return new RabbitMqManagementClient(URI.create(base), authorization, objectMapper);
    }

    /**
     * @return the name of the user we authenticate as, verifying the credentials.
     */
    public String whoami() throws BrokerIOException {
        return send("GET", "/api/whoami", null).path("name").asText(null);
    }

    /**
     * <code>POST /api/queues/{vhost}/{queue}/get</code>.
     *
     * @param truncate
     *            max payload bytes per message, <code>null</code> for the full payload.
     * @return the messages, each with <code>payload</code>, <code>payload_encoding</code>, <code>properties</code>,
     *         <code>redelivered</code> and so on.
     * @throws DataLossRiskException
     *             if the ack mode is {@link #ACKMODE_DRAIN} and the request was sent, but no answer came back.
     */
    public List<JsonNode> getMessages(String vhost, String queueName, int count, String ackmode, Integer truncate)
            throws BrokerIOException {
        ObjectNode request = _objectMapper.createObjectNode();
        request.put("count", count);
        request.put("ackmode", ackmode);
        request.put("encoding", "auto");
        if (truncate != null) {
            request.put("truncate", truncate);
        }
        // ?: Does this get remove the messages?
        boolean draining = ACKMODE_DRAIN.equals(ackmode);
        JsonNode response = send("POST", "/api/queues/" + encode(vhost) + "/" + encode(queueName) + "/get",
                request, draining ? queueName : null, count);
        List<JsonNode> messages = new ArrayList<>(response.size());
        response.forEach(messages::add);
        return messages;
    }

    /**
     * <code>GET /api/queues/{vhost}</code>.
     */
    public List<JsonNode> listQueues(String vhost) throws BrokerIOException {
        JsonNode response = send("GET", "/api/queues/" + encode(vhost), null);
        List<JsonNode> queues = new ArrayList<>(response.size());
        response.forEach(queues::add);
        return queues;
    }

    /**
     * <code>GET /api/queues/{vhost}/{queue}</code>.
     *
     * @return the number of ready plus unacked messages, <code>0</code> if there is no such queue.
     */
    public long queueDepth(String vhost, String queueName) throws BrokerIOException {
        try {
            return send("GET", "/api/queues/" + encode(vhost) + "/" + encode(queueName), null).path("messages")
                    .asLong(0);
        }
        catch (NotFoundException e) {
            return 0;
        }
    }

    /**
     * <code>DELETE /api/queues/{vhost}/{queue}/contents</code>.
     */
    public void purge(String vhost, String queueName) throws BrokerIOException {
        send("DELETE", "/api/queues/" + encode(vhost) + "/" + encode(queueName) + "/contents", null);
    }

    /**
     * Path segment encoding: the default vhost "/" becomes "%2F".
     */
    static String encode(String segment) {
        return URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20");
    }

    private JsonNode send(String method, String path, JsonNode body) throws BrokerIOException {
        return send(method, path, body, null, 0);
    }

    /**
     * @param drainedQueue
     *            set when the request removes messages from this queue. Such a request is waited out whatever
     *            interrupts arrive, and if its answer is lost it is a {@link DataLossRiskException} for up to
     *            <code>drainCount</code> messages.
     */
    private JsonNode send(String method, String path, JsonNode body, String drainedQueue, int drainCount)
            throws BrokerIOException {
        URI uri = URI.create(_baseUri + path);
        HttpRequest request = request(uri, method, body);
        long nanosAtStart = System.nanoTime();
        HttpResponse<byte[]> response;
        try {
            response = drainedQueue == null
                    ? _httpClient.send(request, HttpResponse.BodyHandlers.ofByteArray())
                    : awaitDrainAnswer(drainedQueue, _httpClient.sendAsync(request, HttpResponse.BodyHandlers
                            .ofByteArray()));
        }
        catch (HttpConnectTimeoutException e) {
            throw new ConnectionTimeoutException("Could not connect to the RabbitMQ management API at [" + _baseUri
                    + "] within [" + HTTP_CONNECT_TIMEOUT_MILLIS + "] ms.", e);
        }
        catch (ConnectException e) {
            // Not connected, so nothing was sent.
            throw new BrokerIOException("Could not connect to the RabbitMQ management API at [" + _baseUri + "].",
                    e);
        }
        catch (IOException e) {
            // ?: Could the broker have removed messages we will never see?
            if (drainedQueue != null) {
                // -> Yes, the request may have been carried out.
                throw drainAnswerLost(drainedQueue, drainCount, e);
            }
            throw new BrokerIOException("Problems talking to the RabbitMQ management API at [" + _baseUri + "], "
                    + method + " [" + path + "].", e);
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BrokerIOException("Interrupted while talking to the RabbitMQ management API at [" + _baseUri
                    + "].", e);
        }

        int status = response.statusCode();
        if (log.isDebugEnabled()) log.debug("HTTP " + method + " [" + uri + "] -> [" + status + "], took ["
                + ms3(System.nanoTime() - nanosAtStart) + "] ms.");
        // ?: Credentials or permissions problem?
        if (status == 401 || status == 403) {
            // -> Yes, so this is a rejection, not an I/O problem.
            throw new ConnectionRejectedException("RabbitMQ management API at [" + _baseUri + "] answered ["
                    + status + "] for " + method + " [" + path + "]: check user and permissions.");
        }
        if (status == 404) {
            throw new NotFoundException("RabbitMQ management API at [" + _baseUri + "] answered [404] for "
                    + method + " [" + path + "].");
        }
        if (status < 200 || status >= 300) {
            throw new BrokerIOException("RabbitMQ management API at [" + _baseUri + "] answered [" + status
                    + "] for " + method + " [" + path + "]: " + new String(response.body(), StandardCharsets.UTF_8));
        }
        // ?: Empty body, as for DELETE?
        if (response.body().length == 0) {
            // -> Yes, so nothing to parse.
            return _objectMapper.createObjectNode();
        }
        try {
            return _objectMapper.readTree(response.body());
        }
        catch (IOException e) {
            if (drainedQueue != null) {
                throw drainAnswerLost(drainedQueue, drainCount, e);
            }
            throw new BrokerIOException("Unparseable answer from the RabbitMQ management API at [" + _baseUri
                    + "] for " + method + " [" + path + "].", e);
        }
    }

    private HttpRequest request(URI uri, String method, JsonNode body) throws BrokerIOException {
        HttpRequest.Builder requestBuilder = HttpRequest.newBuilder(uri)
                .timeout(Duration.ofMillis(HTTP_REQUEST_TIMEOUT_MILLIS))
                .header("accept", "application/json");
        if (_authorization != null) {
            requestBuilder.header("authorization", _authorization);
        }
        if (body == null) {
            return requestBuilder.method(method, HttpRequest.BodyPublishers.noBody()).build();
        }
        byte[] json;
        try {
            json = _objectMapper.writeValueAsBytes(body);
        }
        catch (JsonProcessingException e) {
            throw new BrokerIOException("Could not serialize request body for " + method + " [" + uri + "].", e);
        }
        return requestBuilder.header("content-type", "application/json")
                .method(method, HttpRequest.BodyPublishers.ofByteArray(json))
                .build();
    }

    /**
     * Waits for the answer to a drain, deferring any interrupt until it is in: the broker may already have removed
     * the messages, so the answer is their only copy. The request timeout bounds the wait.
     */
    private HttpResponse<byte[]> awaitDrainAnswer(String queueName, CompletableFuture<HttpResponse<byte[]>> future)
            throws IOException {
        boolean interrupted = false;
        try {
            while (true) {
                try {
                    return future.get();
                }
                catch (InterruptedException e) {
                    if (!interrupted) {
                        log.warn("Interrupted while waiting for the answer to a drain of [" + queueName
                                + "]: waiting it out, as it may carry the only copy of the drained messages.");
                    }
                    interrupted = true;
                }
                catch (ExecutionException e) {
                    Throwable cause = e.getCause();
                    if (cause instanceof IOException) {
                        throw (IOException) cause;
                    }
                    if (cause instanceof RuntimeException) {
                        throw (RuntimeException) cause;
                    }
                    throw new IOException("Drain of [" + queueName + "] failed.", cause);
                }
            }
        }
        finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private DataLossRiskException drainAnswerLost(String queueName, int drainCount, IOException cause) {
        DataLossRiskException dataLossRisk = new DataLossRiskException(queueName, drainCount, cause);
        log.error(dataLossRisk.getMessage() + " RabbitMQ management API at [" + _baseUri + "].", cause);
        return dataLossRisk;
    }

    /**
     * The management API answered 404, e.g. for a queue that does not exist.
     */
    static class NotFoundException extends BrokerIOException {
        NotFoundException(String message) {
            super(message);
        }
    }

    @Override
    public String toString() {
        return "RabbitMqManagementClient[" + _baseUri + "]";
    }
}
