package io.omnibus.messagemanager.core;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import io.omnibus.messagemanager.api.BulkResult;
import io.omnibus.messagemanager.api.BulkResult.Failure;
import io.omnibus.messagemanager.api.BulkResult.FailureReason;
import io.omnibus.messagemanager.api.DataLossRiskException;

/**
 * Runs a bulk delete or move as a sequence of independent chunks of at most {@link MutationSettings#getChunkSize()}
 * ids, on the calling thread, one after the other. A failing chunk is retried with exponential backoff, and if it
 * keeps failing it is recorded in the {@link BulkResult} and the next chunk is run: a failed chunk does not affect
 * the others, and its messages are still on the source queue.
 * <p/>
 * A {@link DataLossRiskException} is never retried: it stops the bulk operation, carrying the result so far.
 */
public class BulkOperationCoordinator implements Statics {
    private static final Logger log = LoggerFactory.getLogger(BulkOperationCoordinator.class);

    private final MutationSettings _settings;
    private final Sleeper _sleeper;

    private BulkOperationCoordinator(MutationSettings settings, Sleeper sleeper) {
        _settings = settings;
        _sleeper = sleeper;
    }

    public static BulkOperationCoordinator create(MutationSettings settings) {
        return create(settings, Thread::sleep);
    }

    /**
     * @param sleeper
     *            used for the backoff and the pause between chunks, replaceable in tests.
     */
    public static BulkOperationCoordinator create(MutationSettings settings, Sleeper sleeper) {
        if (settings == null) {
            throw new NullPointerException("settings");
        }
        if (sleeper == null) {
            throw new NullPointerException("sleeper");
        }
        return new BulkOperationCoordinator(settings, sleeper);
    }

    /**
     * Handles one chunk, typically by {@link MessageMutationEngine#deleteMany} or
     * {@link MessageMutationEngine#moveMany}.
     */
    @FunctionalInterface
    public interface ChunkOperation {
        /**
         * @param chunkIds
         *            the ids of the chunk not yet settled.
         * @param onSettled
         *            to be told about each id as soon as it is deleted or moved, also if the chunk then fails.
         */
        MutationOutcome apply(List<String> chunkIds, Consumer<String> onSettled);
    }

    @FunctionalInterface
    public interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }

    /**
     * @param operation
     *            name for logging, e.g. <code>"bulkDelete"</code>.
     * @param messageIds
     *            the ids; duplicates are ignored, order is kept.
     */
    public BulkResult run(String operation, String queueId, Collection<String> messageIds,
            ChunkOperation chunkOperation) {
        if (queueId == null) {
            throw new NullPointerException("queueId");
        }
        if (messageIds == null) {
            throw new NullPointerException("messageIds");
        }
        if (chunkOperation == null) {
            throw new NullPointerException("chunkOperation");
        }
        List<List<String>> chunks = chunk(messageIds, _settings.getChunkSize());
        long nanosAtStart = System.nanoTime();
        log.info(operation.toUpperCase() + " of [" + countIds(chunks) + "] ids on [" + queueId + "] in ["
                + chunks.size() + "] chunk(s).");

        int successCount = 0;
        int failCount = 0;
        List<Failure> failures = new ArrayList<>();
        try {
            MDC.put(MDC_OPERATION, operation);
            MDC.put(MDC_QUEUE, queueId);
            for (int index = 0; index < chunks.size(); index++) {
                List<String> chunk = chunks.get(index);
                ChunkResult chunkResult;
                try {
                    chunkResult = runChunk(operation, queueId, index, chunk, chunkOperation);
                }
                catch (DataLossRiskException e) {
                    BulkResult partial = new BulkResult(successCount, failCount, failures);
                    log.error(operation.toUpperCase() + " STOPPED at chunk #" + index + " on [" + queueId
                            + "] due to data loss risk. Result so far: " + partial, e);
                    throw e.withPartialResult(partial);
                }
                catch (InterruptedException e) {
                    // Chunks not yet drained are cancellable: fail this and the remaining ones.
                    Thread.currentThread().interrupt();
                    for (int rest = index; rest < chunks.size(); rest++) {
                        failCount += chunks.get(rest).size();
                        failures.add(new Failure(rest, chunks.get(rest), FailureReason.CANCELLED,
                                "Interrupted before the chunk was run."));
                    }
                    log.warn(operation.toUpperCase() + " INTERRUPTED at chunk #" + index + " on [" + queueId
                            + "], the remaining [" + (chunks.size() - index) + "] chunk(s) are not run.");
                    break;
                }
                successCount += chunkResult._settledIds.size();
                if (chunkResult._failure != null) {
                    failCount += chunkResult._failure.getIds().size();
                    failures.add(chunkResult._failure);
                }
                if (index < chunks.size() - 1 && _settings.getPauseBetweenChunksMillis() > 0) {
                    try {
                        _sleeper.sleep(_settings.getPauseBetweenChunksMillis());
                    }
                    catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        for (int rest = index + 1; rest < chunks.size(); rest++) {
                            failCount += chunks.get(rest).size();
                            failures.add(new Failure(rest, chunks.get(rest), FailureReason.CANCELLED,
                                    "Interrupted before the chunk was run."));
                        }
                        log.warn(operation.toUpperCase() + " INTERRUPTED after chunk #" + index + " on ["
                                + queueId + "], the remaining chunk(s) are not run.");
                        break;
                    }
                }
            }
        }
        finally {
            MDC.remove(MDC_OPERATION);
            MDC.remove(MDC_QUEUE);
        }
        BulkResult result = new BulkResult(successCount, failCount, failures);
        log.info(operation.toUpperCase() + " FINISHED on [" + queueId + "]: " + result + " - "
                + ms(System.nanoTime() - nanosAtStart) + " ms.");
        return result;
    }

    private static final class ChunkResult {
        private final Set<String> _settledIds;
        private final Failure _failure; // nullable

        private ChunkResult(Set<String> settledIds, Failure failure) {
            _settledIds = settledIds;
            _failure = failure;
        }
    }

    private ChunkResult runChunk(String operation, String queueId, int index, List<String> chunk,
            ChunkOperation chunkOperation) throws InterruptedException {
        // Ids settled by any attempt: a failed attempt may have completed part of its work before failing.
        Set<String> settled = new LinkedHashSet<>();
        int attempts = _settings.getChunkRetries() + 1;
        RuntimeException lastFailure = null;
        for (int attempt = 0; attempt < attempts; attempt++) {
            if (attempt > 0) {
                long delay = _settings.getChunkRetryBaseDelayMillis() * (1L << (attempt - 1));
                log.info("Retrying chunk #" + index + " on [" + queueId + "] in [" + delay + "] ms, attempt ["
                        + (attempt + 1) + "] of [" + attempts + "].");
                _sleeper.sleep(delay);
            }
            else if (Thread.currentThread().isInterrupted()) {
                throw new InterruptedException("Interrupted before chunk #" + index);
            }
            List<String> pending = new ArrayList<>(chunk);
            pending.removeAll(settled);
            try {
                MutationOutcome outcome = chunkOperation.apply(pending, settled::add);
                settled.addAll(outcome.getMatchedIds());
                List<String> missing = new ArrayList<>(outcome.getMissingIds());
                missing.removeAll(settled);
                if (missing.isEmpty()) {
                    return new ChunkResult(settled, null);
                }
                log.info("Chunk #" + index + " on [" + queueId + "]: [" + missing.size()
                        + "] ids not found on the queue.");
                return new ChunkResult(settled, new Failure(index, missing, FailureReason.NOT_FOUND,
                        "Not found on queue [" + queueId + "]"));
            }
            catch (DataLossRiskException e) {
                throw e;
            }
            catch (RuntimeException e) {
                lastFailure = e;
                log.warn("Chunk #" + index + " of " + operation + " on [" + queueId + "] failed on attempt ["
                        + (attempt + 1) + "] of [" + attempts + "]: " + e.getClass().getSimpleName() + ": "
                        + e.getMessage());
            }
        }
        List<String> failedIds = new ArrayList<>(chunk);
        failedIds.removeAll(settled);
        log.error("Chunk #" + index + " of " + operation + " on [" + queueId + "] FAILED after [" + attempts
                + "] attempts, its [" + failedIds.size() + "] unsettled messages remain on the queue.", lastFailure);
        return new ChunkResult(settled, new Failure(index, failedIds, FailureReason.RETRIES_EXHAUSTED,
                lastFailure == null ? null : lastFailure.getMessage()));
    }

    /**
     * Splits the ids into ordered chunks of at most <code>chunkSize</code>, dropping duplicates and
     * <code>null</code>s.
     */
    static List<List<String>> chunk(Collection<String> messageIds, int chunkSize) {
        Set<String> unique = new LinkedHashSet<>(messageIds);
        unique.remove(null);
        List<List<String>> chunks = new ArrayList<>();
        List<String> current = new ArrayList<>(Math.min(chunkSize, unique.size()));
        for (String id : unique) {
            current.add(id);
            if (current.size() == chunkSize) {
                chunks.add(current);
                current = new ArrayList<>(chunkSize);
            }
        }
        if (!current.isEmpty()) {
            chunks.add(current);
        }
        return chunks;
    }

    private static int countIds(List<List<String>> chunks) {
        int count = 0;
        for (List<String> chunk : chunks) {
            count += chunk.size();
        }
        return count;
    }
}
