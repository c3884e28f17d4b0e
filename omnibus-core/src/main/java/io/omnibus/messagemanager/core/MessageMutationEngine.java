package io.omnibus.messagemanager.core;

import java.io.Closeable;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import io.omnibus.messagemanager.api.AmbiguousMessageIdException;
import io.omnibus.messagemanager.api.BrokerIOException;
import io.omnibus.messagemanager.api.BrokerMessage;
import io.omnibus.messagemanager.api.BrokerTransport;
import io.omnibus.messagemanager.api.BrokerTransport.NativePurgeCapability;
import io.omnibus.messagemanager.api.BrokerTransport.PeekCapability;
import io.omnibus.messagemanager.api.BulkResult;
import io.omnibus.messagemanager.api.BulkResult.Failure;
import io.omnibus.messagemanager.api.BulkResult.FailureReason;
import io.omnibus.messagemanager.api.DataLossRiskException;
import io.omnibus.messagemanager.api.DataLossRiskException.AffectedMessage;
import io.omnibus.messagemanager.api.MessageNotFoundException;
import io.omnibus.messagemanager.api.MessageOperationException;
import io.omnibus.messagemanager.api.ProviderFieldNames;
import io.omnibus.messagemanager.api.PurgeResult;
import io.omnibus.messagemanager.api.RawMessage;
import io.omnibus.messagemanager.api.ReceiptTimeoutException;
import io.omnibus.messagemanager.core.MessageBodyEncoder.EncodedBody;

/**
 * Deletes, moves, reads, purges, imports and exports messages using nothing but the two primitives every
 * {@link BrokerTransport} has: destructive <i>drain</i> and confirmed <i>publish</i>.
 * <p/>
 * A delete or move runs <code>DRAINING &rarr; CLASSIFYING &rarr; REPUBLISHING &rarr; COMPLETED | ABORTED</code>:
 * drain a batch, tag each message as target or keep by its derived id, publish every keep back to the source queue
 * with broker confirmation, and only then discard (delete) or publish to the target queue (move) the targets. Should
 * anything fail after the drain, all messages not yet settled - keeps and targets alike - are published back to the
 * source queue before the exception surfaces. Only if even that fails is a {@link DataLossRiskException} thrown,
 * enumerating every message which is now on no queue.
 * <p/>
 * <b>The engine does not serialize operations</b>: two operations running at the same time on the same queue will
 * see each other's drained messages as missing. The caller must ensure one operation per queue at a time, which is
 * what the {@link MessageManager} does.
 * <p/>
 * Once messages have been drained, an operation is not cancellable: an interrupt of the calling thread is deferred,
 * and the interrupt flag is set again when the operation returns.
 */
public class MessageMutationEngine implements Statics, Closeable {
    private static final Logger log = LoggerFactory.getLogger(MessageMutationEngine.class);

    private final MessageProjection _projection;
    private final MessageBodyEncoder _bodyEncoder;
    private final MutationSettings _settings;
    private final ExecutorService _republishExecutor;
    private final boolean _ownsExecutor;

    private volatile OperationPhaseListener _phaseListener;

    private MessageMutationEngine(MessageProjection projection, MessageBodyEncoder bodyEncoder,
            MutationSettings settings, ExecutorService republishExecutor, boolean ownsExecutor) {
        _projection = projection;
        _bodyEncoder = bodyEncoder;
        _settings = settings;
        _republishExecutor = republishExecutor;
        _ownsExecutor = ownsExecutor;
    }

    /**
     * Creates an engine with its own pool of {@link MutationSettings#getRepublishParallelism()} daemon threads for
     * publishing kept messages back, which is shut down by {@link #close()}.
     */
    public static MessageMutationEngine create(MessageProjection projection, MessageBodyEncoder bodyEncoder,
            MutationSettings settings) {
        if (settings == null) {
            throw new NullPointerException("settings");
        }
        AtomicInteger threadNumber = new AtomicInteger();
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, "Omnibus MessageMutationEngine: Republisher #"
                    + threadNumber.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return create(projection, bodyEncoder, settings,
                Executors.newFixedThreadPool(settings.getRepublishParallelism(), threadFactory), true);
    }

    /**
     * Creates an engine using the given executor for publishing kept messages back. The executor is not shut down by
     * {@link #close()}.
     */
    public static MessageMutationEngine create(MessageProjection projection, MessageBodyEncoder bodyEncoder,
            MutationSettings settings, ExecutorService republishExecutor) {
        return create(projection, bodyEncoder, settings, republishExecutor, false);
    }

    private static MessageMutationEngine create(MessageProjection projection, MessageBodyEncoder bodyEncoder,
            MutationSettings settings, ExecutorService republishExecutor, boolean ownsExecutor) {
        if (projection == null) {
            throw new NullPointerException("projection");
        }
        if (bodyEncoder == null) {
            throw new NullPointerException("bodyEncoder");
        }
        if (settings == null) {
            throw new NullPointerException("settings");
        }
        if (republishExecutor == null) {
            throw new NullPointerException("republishExecutor");
        }
        return new MessageMutationEngine(projection, bodyEncoder, settings, republishExecutor, ownsExecutor);
    }

    /**
     * @param phaseListener
     *            the listener to tell about phase changes, <code>null</code> to remove.
     */
    public void setPhaseListener(OperationPhaseListener phaseListener) {
        _phaseListener = phaseListener;
    }

    public MutationSettings getSettings() {
        return _settings;
    }

    public MessageProjection getProjection() {
        return _projection;
    }

    public MessageBodyEncoder getBodyEncoder() {
        return _bodyEncoder;
    }

    @Override
    public void close() {
        if (!_ownsExecutor) {
            return;
        }
        _republishExecutor.shutdown();
        try {
            if (!_republishExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Republish executor did not terminate within 5 seconds, forcing shutdown.");
                _republishExecutor.shutdownNow();
            }
        }
        catch (InterruptedException e) {
            _republishExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    // ===== Delete and move

    /**
     * Removes the message with the given id from the queue, leaving all other messages.
     *
     * @throws MessageNotFoundException
     *             if no message derived the id. All drained messages have then been published back.
     */
    public void deleteOne(BrokerTransport transport, String queueId, String messageId) {
        if (messageId == null) {
            throw new NullPointerException("messageId");
        }
        MutationOutcome outcome = mutate("deleteOne", transport, queueId, null,
                Collections.singletonList(messageId), null);
        if (!outcome.getMissingIds().isEmpty()) {
            throw new MessageNotFoundException(queueId, messageId);
        }
    }

    /**
     * Moves the message with the given id from the source to the target queue. The message is published to the
     * target queue only after all kept messages are confirmed back on the source queue; if that publish fails, or the
     * operation is halted before it, the message is published back to the source queue instead.
     *
     * @throws MessageNotFoundException
     *             if no message derived the id.
     */
    public void moveOne(BrokerTransport transport, String queueId, String targetQueueId, String messageId) {
        if (targetQueueId == null) {
            throw new NullPointerException("targetQueueId");
        }
        if (messageId == null) {
            throw new NullPointerException("messageId");
        }
        MutationOutcome outcome = mutate("moveOne", transport, queueId, targetQueueId,
                Collections.singletonList(messageId), null);
        if (!outcome.getMissingIds().isEmpty()) {
            throw new MessageNotFoundException(queueId, messageId);
        }
    }

    public MutationOutcome deleteMany(BrokerTransport transport, String queueId, Collection<String> messageIds) {
        return deleteMany(transport, queueId, messageIds, null);
    }

    /**
     * @param onSettled
     *            told about each id as soon as its message is deleted, also if the operation later fails;
     *            <code>null</code> if not interesting.
     */
    public MutationOutcome deleteMany(BrokerTransport transport, String queueId, Collection<String> messageIds,
            Consumer<String> onSettled) {
        return mutate("deleteMany", transport, queueId, null, messageIds, onSettled);
    }

    public MutationOutcome moveMany(BrokerTransport transport, String queueId, String targetQueueId,
            Collection<String> messageIds) {
        return moveMany(transport, queueId, targetQueueId, messageIds, null);
    }

    /**
     * @param onSettled
     *            told about each id as soon as its message is confirmed on the target queue, also if the operation
     *            later fails; <code>null</code> if not interesting.
     */
    public MutationOutcome moveMany(BrokerTransport transport, String queueId, String targetQueueId,
            Collection<String> messageIds, Consumer<String> onSettled) {
        if (targetQueueId == null) {
            throw new NullPointerException("targetQueueId");
        }
        return mutate("moveMany", transport, queueId, targetQueueId, messageIds, onSettled);
    }

    // ===== Read, purge, import, export

    /**
     * Reads up to <code>limit</code> messages from the head of the queue, leaving them on the queue: by peek if the
     * transport can, otherwise by drain followed by publishing every message back.
     */
    public List<BrokerMessage> readMessages(BrokerTransport transport, String queueId, int limit) {
        if (transport == null) {
            throw new NullPointerException("transport");
        }
        if (queueId == null) {
            throw new NullPointerException("queueId");
        }
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive [" + limit + "]");
        }
        Optional<PeekCapability> peek = transport.getCapability(PeekCapability.class);
        if (peek.isPresent()) {
            long nanosAtStart = System.nanoTime();
            List<BrokerMessage> messages = normalizeAll(peek.get().peek(queueId, limit));
            log.info("PEEKED [" + messages.size() + "] messages from [" + queueId + "], limit [" + limit + "] - "
                    + ms(System.nanoTime() - nanosAtStart) + " ms.");
            return messages;
        }
        return scan("readMessages", transport, queueId, limit);
    }

    /**
     * Removes all messages from the queue, by the broker's own purge if the transport can, otherwise by draining and
     * discarding batch by batch until the queue is empty or the iteration cap is reached.
     */
    public PurgeResult purge(BrokerTransport transport, String queueId) {
        if (transport == null) {
            throw new NullPointerException("transport");
        }
        if (queueId == null) {
            throw new NullPointerException("queueId");
        }
        long nanosAtStart = System.nanoTime();
        try {
            MDC.put(MDC_OPERATION, "purge");
            MDC.put(MDC_QUEUE, queueId);
            Optional<NativePurgeCapability> nativePurge = transport.getCapability(NativePurgeCapability.class);
            if (nativePurge.isPresent()) {
                long removed = nativePurge.get().purge(queueId);
                log.info("PURGED queue [" + queueId + "] using the broker's own purge, [" + removed
                        + "] messages removed - " + ms(System.nanoTime() - nanosAtStart) + " ms.");
                return new PurgeResult(removed);
            }

            long removed = 0;
            int iterations = 0;
            while (true) {
                if (iterations >= _settings.getPurgeMaxIterations()) {
                    log.warn("PURGE STOPPED at the safety cap of [" + _settings.getPurgeMaxIterations()
                            + "] iterations, after [" + removed + "] messages. The queue [" + queueId
                            + "] may still contain messages.");
                    break;
                }
                List<RawMessage> drained = transport.drain(queueId, _settings.getDrainBatchSize());
                iterations++;
                if (drained.isEmpty()) {
                    break;
                }
                removed += drained.size();
                log.info("PURGE: discarded [" + drained.size() + "] messages from [" + queueId + "], total ["
                        + removed + "].");
            }
            log.info("PURGED queue [" + queueId + "] by drain-and-discard, [" + removed + "] messages removed in ["
                    + iterations + "] iterations - " + ms(System.nanoTime() - nanosAtStart) + " ms.");
            return new PurgeResult(removed);
        }
        finally {
            MDC.remove(MDC_OPERATION);
            MDC.remove(MDC_QUEUE);
        }
    }

    /**
     * Publishes each body as a new message with confirmation. A body which cannot be encoded or published is recorded
     * as a failure with its index, and does not stop the rest.
     */
    public BulkResult importMessages(BrokerTransport transport, String queueId, List<?> bodies) {
        if (transport == null) {
            throw new NullPointerException("transport");
        }
        if (queueId == null) {
            throw new NullPointerException("queueId");
        }
        if (bodies == null) {
            throw new NullPointerException("bodies");
        }
        long nanosAtStart = System.nanoTime();
        int successCount = 0;
        List<Failure> failures = new ArrayList<>();
        try {
            MDC.put(MDC_OPERATION, "importMessages");
            MDC.put(MDC_QUEUE, queueId);
            for (int i = 0; i < bodies.size(); i++) {
                try {
                    EncodedBody encoded = _bodyEncoder.encode(bodies.get(i));
                    publishConfirmed(transport, queueId, encoded.getBytes(), Collections.emptyMap(),
                            encoded.getContentType(), null);
                    successCount++;
                }
                catch (IllegalArgumentException | MessageOperationException e) {
                    log.warn("IMPORT: body #" + i + " to [" + queueId + "] failed, continuing with the rest: "
                            + e.getMessage());
                    failures.add(new Failure(i, Collections.emptyList(), FailureReason.PUBLISH_FAILED,
                            e.getMessage()));
                }
            }
            log.info("IMPORTED [" + successCount + "] of [" + bodies.size() + "] bodies to [" + queueId + "] - "
                    + ms(System.nanoTime() - nanosAtStart) + " ms.");
            return new BulkResult(successCount, failures.size(), failures);
        }
        finally {
            MDC.remove(MDC_OPERATION);
            MDC.remove(MDC_QUEUE);
        }
    }

    /**
     * Returns the messages with the given ids in queue order, or all messages if the id collection is empty, leaving
     * the queue as it was. Uses peek if the transport can, otherwise drain followed by publishing every message back.
     */
    public List<BrokerMessage> exportMessages(BrokerTransport transport, String queueId,
            Collection<String> messageIds) {
        if (transport == null) {
            throw new NullPointerException("transport");
        }
        if (queueId == null) {
            throw new NullPointerException("queueId");
        }
        if (messageIds == null) {
            throw new NullPointerException("messageIds");
        }
        int maxMessages = _settings.getDrainBatchSize() * _settings.getMaxDrainRounds();
        List<BrokerMessage> all;
        Optional<PeekCapability> peek = transport.getCapability(PeekCapability.class);
        if (peek.isPresent()) {
            long depth = transport.queueDepth(queueId);
            int count = (int) Math.min(Math.max(depth, _settings.getDrainBatchSize()), maxMessages);
            all = normalizeAll(peek.get().peek(queueId, count));
        }
        else {
            all = scan("exportMessages", transport, queueId, maxMessages);
        }
        if (messageIds.isEmpty()) {
            log.info("EXPORTED all [" + all.size() + "] messages from [" + queueId + "].");
            return all;
        }
        Set<String> wanted = new LinkedHashSet<>(messageIds);
        List<BrokerMessage> result = new ArrayList<>();
        for (BrokerMessage message : all) {
            if (wanted.contains(message.getId())) {
                result.add(message);
            }
        }
        log.info("EXPORTED [" + result.size() + "] of [" + wanted.size() + "] requested messages from [" + queueId
                + "].");
        return result;
    }

    /**
     * Publishes a single new message with confirmation, retrying on missing receipt.
     */
    public void send(BrokerTransport transport, String queueId, Object body) {
        if (transport == null) {
            throw new NullPointerException("transport");
        }
        if (queueId == null) {
            throw new NullPointerException("queueId");
        }
        sendEncoded(transport, queueId, _bodyEncoder.encode(body));
    }

    /**
     * Publishes a single new message, already encoded, with confirmation, retrying on missing receipt.
     */
    public void sendEncoded(BrokerTransport transport, String queueId, EncodedBody encoded) {
        publishConfirmed(transport, queueId, encoded.getBytes(), Collections.emptyMap(), encoded.getContentType(),
                null);
        log.info("SENT message of [" + encoded.getBytes().length + "] bytes to [" + queueId + "].");
    }

    /**
     * Runs a confirmed publish, repeating it with a fresh receipt up to {@link MutationSettings#getReceiptRetries()}
     * times when no receipt arrives. A repeat may produce a duplicate, which is accepted: a message must never be
     * taken as lost only because its receipt was.
     */
    public void withReceiptRetries(String destination, ConfirmedPublish publish) {
        ReceiptTimeoutException last = null;
        int attempts = _settings.getReceiptRetries() + 1;
        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                publish.publish();
                if (attempt > 1) {
                    log.info("PUBLISH CONFIRMED to [" + destination + "] on attempt [" + attempt + "].");
                }
                return;
            }
            catch (ReceiptTimeoutException e) {
                last = e;
                log.warn("NO RECEIPT for publish to [" + destination + "], attempt [" + attempt + "] of ["
                        + attempts + "]" + (attempt < attempts
                                ? " - retrying with a fresh receipt, a duplicate is possible."
                                : " - giving up."));
            }
        }
        throw last;
    }

    /**
     * A single confirmed publish, for {@link #withReceiptRetries(String, ConfirmedPublish)}.
     */
    @FunctionalInterface
    public interface ConfirmedPublish {
        void publish() throws BrokerIOException;
    }

    // ===== Internals

    private static final class OperationState {
        private final String _operation;
        private final String _queueId;
        private final String _targetQueueId; // null for delete and scan
        private final Consumer<String> _onSettled; // nullable
        private int _round;
        private boolean _interrupted;

        private OperationState(String operation, String queueId, String targetQueueId,
                Consumer<String> onSettled) {
            _operation = operation;
            _queueId = queueId;
            _targetQueueId = targetQueueId;
            _onSettled = onSettled;
        }
    }

    private MutationOutcome mutate(String operation, BrokerTransport transport, String queueId,
            String targetQueueId, Collection<String> messageIds, Consumer<String> onSettled) {
        if (transport == null) {
            throw new NullPointerException("transport");
        }
        if (queueId == null) {
            throw new NullPointerException("queueId");
        }
        if (messageIds == null) {
            throw new NullPointerException("messageIds");
        }
        if (queueId.equals(targetQueueId)) {
            throw new IllegalArgumentException("Source and target queue are the same [" + queueId + "].");
        }
        Set<String> remaining = new LinkedHashSet<>(messageIds);
        remaining.remove(null);
        List<String> matched = new ArrayList<>();
        if (remaining.isEmpty()) {
            return new MutationOutcome(matched, Collections.emptyList());
        }

        OperationState state = new OperationState(operation, queueId, targetQueueId, onSettled);
        long nanosAtStart = System.nanoTime();
        boolean completed = false;
        try {
            putOperationMdc(state);
            checkNotInterruptedBeforeDrain(state);
            int batchSize = _settings.getDrainBatchSize();
            int scanned = 0;
            long depthAtStart = -1;
            while (true) {
                state._round++;
                List<RawMessage> drained = drainRound(state, transport, batchSize, scanned);
                if (drained.isEmpty()) {
                    break;
                }
                DrainBatch batch = settleRound(state, transport, drained, remaining);
                for (DrainBatch.Entry target : batch.getTargets()) {
                    matched.add(target.getId());
                    remaining.remove(target.getId());
                }
                scanned += drained.size();

                // ?: Done: all found, or the queue had fewer messages than a batch?
                if (remaining.isEmpty() || drained.size() < batchSize) {
                    // -> Yes, no need for more rounds.
                    break;
                }
                // E-> Queue deeper than one batch, and not all found yet.
                // The kept messages are back on the queue, so depth now is depth at start minus what was removed.
                if (depthAtStart < 0) {
                    depthAtStart = transport.queueDepth(queueId) + matched.size();
                }
                if (scanned >= depthAtStart) {
                    break;
                }
                if (state._round >= _settings.getMaxDrainRounds()) {
                    log.warn("Stopping [" + operation + "] on [" + queueId + "] after max [" + state._round
                            + "] drain rounds, having scanned [" + scanned + "] of [" + depthAtStart
                            + "] messages. [" + remaining.size() + "] ids not found.");
                    break;
                }
            }
            completed = true;
            log.info(operation.toUpperCase() + " FINISHED on [" + queueId + "]"
                    + (targetQueueId != null ? " to [" + targetQueueId + "]" : "") + ": [" + matched.size()
                    + "] of [" + (matched.size() + remaining.size()) + "] ids handled in [" + state._round
                    + "] round(s) - " + ms(System.nanoTime() - nanosAtStart) + " ms.");
            return new MutationOutcome(matched, new ArrayList<>(remaining));
        }
        finally {
            firePhase(state, completed ? OperationPhase.COMPLETED : OperationPhase.ABORTED);
            clearOperationMdc();
            if (state._interrupted) {
                log.info("Restoring deferred interrupt after [" + operation + "] on [" + queueId + "].");
                Thread.currentThread().interrupt();
            }
        }
    }

    /**
     * Drain rounds with nothing targeted: every message is published back, and the normalized messages are returned.
     */
    private List<BrokerMessage> scan(String operation, BrokerTransport transport, String queueId, int limit) {
        OperationState state = new OperationState(operation, queueId, null, null);
        List<BrokerMessage> collected = new ArrayList<>();
        long nanosAtStart = System.nanoTime();
        boolean completed = false;
        try {
            putOperationMdc(state);
            checkNotInterruptedBeforeDrain(state);
            long depthAtStart = -1;
            while (collected.size() < limit) {
                state._round++;
                int requested = Math.min(_settings.getDrainBatchSize(), limit - collected.size());
                List<RawMessage> drained = drainRound(state, transport, requested, collected.size());
                if (drained.isEmpty()) {
                    break;
                }
                DrainBatch batch = settleRound(state, transport, drained, Collections.emptySet());
                for (DrainBatch.Entry entry : batch.getEntries()) {
                    collected.add(entry.getMessage());
                }
                if (drained.size() < requested) {
                    break;
                }
                if (depthAtStart < 0) {
                    depthAtStart = transport.queueDepth(queueId);
                }
                if (collected.size() >= depthAtStart || state._round >= _settings.getMaxDrainRounds()) {
                    break;
                }
            }
            completed = true;
            log.info("READ [" + collected.size() + "] messages from [" + queueId + "] by drain and publish back,"
                    + " in [" + state._round + "] round(s) - " + ms(System.nanoTime() - nanosAtStart) + " ms.");
            return collected;
        }
        finally {
            firePhase(state, completed ? OperationPhase.COMPLETED : OperationPhase.ABORTED);
            clearOperationMdc();
            if (state._interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private void checkNotInterruptedBeforeDrain(OperationState state) {
        if (Thread.currentThread().isInterrupted()) {
            throw new MessageOperationException("Interrupted before draining from [" + state._queueId + "], ["
                    + state._operation + "] not started.");
        }
    }

    private List<RawMessage> drainRound(OperationState state, BrokerTransport transport, int maxCount,
            int positionOffset) {
        // Listener may halt here; nothing is drained in this round yet.
        firePhase(state, OperationPhase.DRAINING);
        long nanosAtStart_Drain = System.nanoTime();
        List<RawMessage> drained = transport.drain(state._queueId, maxCount);
        long nanosTaken_Drain = System.nanoTime() - nanosAtStart_Drain;
        // From here the drained messages exist only in memory, so interrupts are deferred.
        deferInterrupt(state);
        log.info("DRAINED [" + drained.size() + "] messages from [" + state._queueId + "], round [" + state._round
                + "] - drain(): " + ms(nanosTaken_Drain) + " ms.");
        if (positionOffset == 0) {
            return drained;
        }
        // Positions relative to the queue as it was at start, so that derived ids match those of a peek.
        List<RawMessage> renumbered = new ArrayList<>(drained.size());
        for (int i = 0; i < drained.size(); i++) {
            renumbered.add(drained.get(i).withPosition(positionOffset + i));
        }
        return renumbered;
    }

    /**
     * Classifies a drained round, publishes the keeps back, and deletes or moves the targets. On any failure, all
     * messages not yet settled are restored to the source queue before an exception is thrown.
     */
    private DrainBatch settleRound(OperationState state, BrokerTransport transport, List<RawMessage> drained,
            Set<String> targetIds) {
        // Identity set: a RawMessage is settled when it is confirmed on a queue, or deleted on purpose.
        Set<RawMessage> settled = Collections.newSetFromMap(new ConcurrentHashMap<>());
        try {
            firePhase(state, OperationPhase.CLASSIFYING);
            DrainBatch batch = DrainBatch.classify(drained, _projection, targetIds,
                    _settings.getDuplicateIdPolicy());
            if (!batch.getAmbiguousTargetIds().isEmpty()) {
                Map.Entry<String, Integer> first = batch.getAmbiguousTargetIds().entrySet().iterator().next();
                if (_settings.getDuplicateIdPolicy() == DuplicateIdPolicy.ABORT) {
                    throw new AmbiguousMessageIdException(state._queueId, first.getKey(), first.getValue());
                }
                log.warn("DUPLICATE IDS on [" + state._queueId + "]: " + batch.getAmbiguousTargetIds()
                        + " (id -> occurrences). Using " + _settings.getDuplicateIdPolicy()
                        + ", the other occurrences are kept.");
            }

            firePhase(state, OperationPhase.REPUBLISHING);
            List<DrainBatch.Entry> keeps = batch.getKeeps();
            long nanosAtStart_Republish = System.nanoTime();
            republishConcurrently(state, transport, keeps, settled);
            if (!keeps.isEmpty()) {
                log.info("REPUBLISHED [" + keeps.size() + "] kept messages to [" + state._queueId + "] - "
                        + ms(System.nanoTime() - nanosAtStart_Republish) + " ms.");
            }

            for (DrainBatch.Entry target : batch.getTargets()) {
                MDC.put(MDC_MESSAGE_ID, target.getId());
                try {
                    // ?: Is this a move?
                    if (state._targetQueueId != null) {
                        // -> Yes, move: onto the target queue, confirmed.
                        republish(transport, state._targetQueueId, target.getRaw());
                        settled.add(target.getRaw());
                        log.info("MOVED MESSAGE [" + target.getId() + "] from [" + state._queueId + "] to ["
                                + state._targetQueueId + "].");
                    }
                    else {
                        // -> No, delete: the keeps are safe, so the target is simply not published.
                        settled.add(target.getRaw());
                        log.info("DELETED MESSAGE [" + target.getId() + "] from [" + state._queueId + "].");
                    }
                }
                finally {
                    MDC.remove(MDC_MESSAGE_ID);
                }
                if (state._onSettled != null) {
                    state._onSettled.accept(target.getId());
                }
            }
            return batch;
        }
        catch (RuntimeException e) {
            throw abort(state, transport, drained, settled, e);
        }
    }

    private RuntimeException abort(OperationState state, BrokerTransport transport, List<RawMessage> drained,
            Set<RawMessage> settled, RuntimeException cause) {
        List<RawMessage> unsettled = new ArrayList<>();
        for (RawMessage raw : drained) {
            if (!settled.contains(raw)) {
                unsettled.add(raw);
            }
        }
        log.warn("ABORTING [" + state._operation + "] on [" + state._queueId + "] due to ["
                + cause.getClass().getSimpleName() + ": " + cause.getMessage() + "]. Restoring [" + unsettled.size()
                + "] unsettled messages to the source queue.");
        deferInterrupt(state);
        List<AffectedMessage> lost = new ArrayList<>();
        for (RawMessage raw : unsettled) {
            try {
                republish(transport, state._queueId, raw);
            }
            catch (RuntimeException restoreFailure) {
                String id = MessageProjection.deriveId(raw);
                log.error("RESTORE FAILED for message [" + id + "] to [" + state._queueId + "].", restoreFailure);
                lost.add(new AffectedMessage(id, state._queueId, raw.getBody()));
            }
        }
        if (!lost.isEmpty()) {
            DataLossRiskException dataLossRisk = new DataLossRiskException(state._queueId, lost, cause);
            log.error(dataLossRisk.getMessage() + " Affected messages: " + lost, cause);
            return dataLossRisk;
        }
        log.info("RESTORED [" + unsettled.size() + "] messages to [" + state._queueId + "], ["
                + state._operation + "] aborted.");
        return cause;
    }

    private void republishConcurrently(OperationState state, BrokerTransport transport,
            List<DrainBatch.Entry> keeps, Set<RawMessage> settled) {
        if (keeps.isEmpty()) {
            return;
        }
        Map<String, String> mdc = MDC.getCopyOfContextMap();
        List<Future<?>> futures = new ArrayList<>(keeps.size());
        RuntimeException firstFailure = null;
        try {
            for (DrainBatch.Entry keep : keeps) {
                futures.add(_republishExecutor.submit(() -> {
                    if (mdc != null) {
                        MDC.setContextMap(mdc);
                    }
                    try {
                        republish(transport, state._queueId, keep.getRaw());
                        settled.add(keep.getRaw());
                    }
                    finally {
                        MDC.clear();
                    }
                }));
            }
        }
        catch (RejectedExecutionException e) {
            firstFailure = new BrokerIOException("Could not schedule republishing of kept messages to ["
                    + state._queueId + "], the engine is closed.", e);
        }
        // Join all that were submitted, also when one fails, so that 'settled' is final.
        int failed = 0;
        for (Future<?> future : futures) {
            try {
                awaitUninterruptibly(state, future);
            }
            catch (ExecutionException e) {
                failed++;
                if (firstFailure == null) {
                    firstFailure = e.getCause() instanceof RuntimeException
                            ? (RuntimeException) e.getCause()
                            : new BrokerIOException("Republishing to [" + state._queueId + "] failed.",
                                    e.getCause());
                }
            }
        }
        if (firstFailure != null) {
            log.warn("REPUBLISH FAILED for [" + failed + "] of [" + keeps.size() + "] kept messages to ["
                    + state._queueId + "].");
            throw firstFailure;
        }
    }

    private void awaitUninterruptibly(OperationState state, Future<?> future) throws ExecutionException {
        while (true) {
            try {
                future.get();
                return;
            }
            catch (InterruptedException e) {
                state._interrupted = true;
            }
        }
    }

    private void deferInterrupt(OperationState state) {
        if (Thread.interrupted()) {
            state._interrupted = true;
            log.info("Deferring interrupt: [" + state._operation + "] on [" + state._queueId
                    + "] holds drained messages, and runs to completion.");
        }
    }

    private void republish(BrokerTransport transport, String queueId, RawMessage raw) {
        publishConfirmed(transport, queueId, raw.getBody(), carriedHeaders(raw.getHeaders()), raw.getContentType(),
                providerMessageId(raw));
    }

    private void publishConfirmed(BrokerTransport transport, String queueId, byte[] body,
            Map<String, Object> headers, String contentType, String messageId) {
        withReceiptRetries(queueId, () -> transport.publish(queueId, body, headers, contentType, messageId, true));
    }

    /**
     * @return the headers minus the {@link #RESERVED_HEADERS}, which the broker sets anew on publish.
     */
    static Map<String, Object> carriedHeaders(Map<String, Object> headers) {
        Map<String, Object> carried = new LinkedHashMap<>(headers.size());
        for (Map.Entry<String, Object> entry : headers.entrySet()) {
            if (!RESERVED_HEADERS.contains(entry.getKey().toLowerCase())) {
                carried.put(entry.getKey(), entry.getValue());
            }
        }
        return carried;
    }

    private static String providerMessageId(RawMessage raw) {
        String name = ProviderFieldNames.forKind(raw.getBrokerKind()).getMessageId();
        Object value = raw.getProperty(name);
        if (value == null || value.toString().trim().isEmpty()) {
            return null;
        }
        return value.toString();
    }

    private List<BrokerMessage> normalizeAll(List<RawMessage> raws) {
        List<BrokerMessage> messages = new ArrayList<>(raws.size());
        for (RawMessage raw : raws) {
            messages.add(_projection.normalize(raw));
        }
        return messages;
    }

    private void firePhase(OperationState state, OperationPhase phase) {
        MDC.put(MDC_PHASE, phase.name());
        OperationPhaseListener listener = _phaseListener;
        if (listener == null) {
            return;
        }
        // ?: Terminal phase?
        if (phase.isTerminal()) {
            // -> Yes, nothing left to halt, so just log a failing listener.
            try {
                listener.phaseEntered(state._operation, state._queueId, state._round, phase);
            }
            catch (RuntimeException e) {
                log.warn("OperationPhaseListener threw on terminal phase [" + phase + "], ignoring.", e);
            }
            return;
        }
        listener.phaseEntered(state._operation, state._queueId, state._round, phase);
        // The listener may have interrupted us; past draining that is deferred.
        if (phase != OperationPhase.DRAINING) {
            deferInterrupt(state);
        }
    }

    private void putOperationMdc(OperationState state) {
        MDC.put(MDC_OPERATION, state._operation);
        MDC.put(MDC_QUEUE, state._queueId);
        MDC.put(MDC_OPERATION_ID, random());
    }

    private void clearOperationMdc() {
        MDC.remove(MDC_OPERATION);
        MDC.remove(MDC_QUEUE);
        MDC.remove(MDC_OPERATION_ID);
        MDC.remove(MDC_PHASE);
    }
}
