package io.writebuffer.runtime;

import com.codahale.metrics.Histogram;
import com.codahale.metrics.Meter;
import com.codahale.metrics.Timer;
import io.writebuffer.buffer.Implementation;
import io.writebuffer.config.WriteBufferConfig;
import io.writebuffer.core.BatchResult;
import io.writebuffer.core.ReconcileReport;
import io.writebuffer.core.WriteBatch;
import io.writebuffer.core.WriteBuffer;
import io.writebuffer.core.WriteBufferStats;
import io.writebuffer.core.WriteOpType;
import io.writebuffer.core.WriteOperation;
import io.writebuffer.core.WritePriority;
import io.writebuffer.error.DeadLetterSink;
import io.writebuffer.metrics.Metrics;
import io.writebuffer.retry.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Drives a {@link WriteBuffer}: hands batches to a flush function, reconciles the outcome, forwards dropped
 * operations to the dead-letter sink and keeps metrics and stats listeners current.
 * <p>
 * The flush function always runs outside the buffer's lock, so producers keep queueing while a batch is in
 * transit. Concurrent {@code flushBatch} calls are allowed; the buffer never hands the same operation out twice.
 */
public class WriteBufferService implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(WriteBufferService.class);

    private final WriteBuffer buffer;
    private final Implementation implementation;
    private final WriteBufferConfig config;
    private final RetryPolicy retryPolicy;
    private final Metrics metrics;
    private final DeadLetterSink deadLetters; // optional

    private final List<StatsListener> listeners = new CopyOnWriteArrayList<>();
    private final AtomicInteger activeFlushes = new AtomicInteger(0);
    private final Object autoFlushLock = new Object();
    private ScheduledExecutorService scheduler; // guarded by autoFlushLock
    private ScheduledFuture<?> autoFlush; // guarded by autoFlushLock

    private final Timer flushTimer;
    private final Histogram batchSizes;
    private final Meter committedMeter;
    private final Meter droppedMeter;
    private final Meter flushErrors;

    public WriteBufferService(WriteBuffer buffer, Implementation implementation, WriteBufferConfig config,
                              RetryPolicy retryPolicy, Metrics metrics, DeadLetterSink deadLetters) {
        this.buffer = Objects.requireNonNull(buffer, "buffer");
        this.implementation = Objects.requireNonNull(implementation, "implementation");
        this.config = Objects.requireNonNull(config, "config");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.deadLetters = deadLetters;
        this.flushTimer = metrics.timer("flush.time");
        this.batchSizes = metrics.histogram("batch.size");
        this.committedMeter = metrics.meter("ops.committed");
        this.droppedMeter = metrics.meter("ops.failed");
        this.flushErrors = metrics.meter("flush.errors");
        metrics.gauge("queue.total", buffer::totalQueued);
        metrics.gauge("backpressure", buffer::backpressure);
        metrics.gauge("inflight", buffer::inFlightCount);
    }

    public WriteBuffer buffer() { return buffer; }
    public Implementation implementation() { return implementation; }
    public WriteBufferConfig config() { return config; }
    public Metrics metrics() { return metrics; }
    public boolean isFlushing() { return activeFlushes.get() > 0; }

    public void addStatsListener(StatsListener listener) { listeners.add(Objects.requireNonNull(listener, "listener")); }
    public void removeStatsListener(StatsListener listener) { listeners.remove(listener); }

    // ---- queueing

    public boolean queueWrite(String opId, WriteOpType opType, byte[] payload) {
        return queueWrite(opId, opType, payload, WritePriority.NORMAL);
    }

    public boolean queueWrite(String opId, WriteOpType opType, byte[] payload, WritePriority priority) {
        boolean queued = buffer.queueWrite(opId, opType, payload, priority);
        publishStats();
        return queued;
    }

    public boolean queueWriteWithDedup(String opId, WriteOpType opType, byte[] payload, WritePriority priority, String dedupKey) {
        boolean queued = buffer.queueWriteWithDedup(opId, opType, payload, priority, dedupKey);
        publishStats();
        return queued;
    }

    public boolean queueCreateEntry(String opId, byte[] payload, WritePriority priority) {
        return queueWrite(opId, WriteOpType.CREATE_ENTRY, payload, priority);
    }

    /** Updates collapse on the entry hash: only the latest queued update of an entry is sent. */
    public boolean queueUpdateEntry(String opId, String entryHash, byte[] payload, WritePriority priority) {
        return queueWriteWithDedup(opId, WriteOpType.UPDATE_ENTRY, payload, priority, entryHash);
    }

    public boolean queueCreateLink(String opId, byte[] payload, WritePriority priority) {
        return queueWrite(opId, WriteOpType.CREATE_LINK, payload, priority);
    }

    /** Identity and consent writes: high priority, latest write per identity wins. */
    public boolean queueIdentityWrite(String opId, String identityKey, byte[] payload) {
        return queueWriteWithDedup(opId, WriteOpType.UPDATE_ENTRY, payload, WritePriority.HIGH, identityKey);
    }

    // ---- flushing

    public boolean shouldFlush() { return buffer.shouldFlush(); }

    public BatchResult getPendingBatch() {
        BatchResult result = buffer.getPendingBatch();
        publishStats();
        return result;
    }

    /**
     * Forms one batch and sends it through {@code flushFn}.
     *
     * @return the outcome, or null when nothing was queued (the function is not called)
     */
    public FlushResult flushBatch(FlushFunction flushFn) {
        Objects.requireNonNull(flushFn, "flushFn");
        BatchResult pending = buffer.getPendingBatch();
        if (!pending.hasBatch()) return null;
        WriteBatch batch = pending.batch();
        batchSizes.update(batch.size());
        activeFlushes.incrementAndGet();
        try (Timer.Context ignored = flushTimer.time()) {
            BatchOutcome outcome;
            try {
                outcome = flushFn.flush(batch);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return failWhole(batch, messageOf(e));
            } catch (Exception e) {
                return failWhole(batch, messageOf(e));
            }
            return reconcile(batch, outcome);
        } finally {
            activeFlushes.decrementAndGet();
            publishStats();
        }
    }

    /** Like {@link #flushBatch(FlushFunction)} for a flush function that completes asynchronously. */
    public CompletionStage<FlushResult> flushBatchAsync(AsyncFlushFunction flushFn) {
        Objects.requireNonNull(flushFn, "flushFn");
        BatchResult pending = buffer.getPendingBatch();
        if (!pending.hasBatch()) return CompletableFuture.completedFuture(null);
        WriteBatch batch = pending.batch();
        batchSizes.update(batch.size());
        activeFlushes.incrementAndGet();
        Timer.Context timing = flushTimer.time();
        CompletionStage<BatchOutcome> stage;
        try {
            stage = flushFn.flush(batch);
            if (stage == null) stage = CompletableFuture.completedFuture(null);
        } catch (RuntimeException e) {
            stage = CompletableFuture.failedFuture(e);
        }
        return stage
                .handle((outcome, ex) -> ex != null ? failWhole(batch, messageOf(unwrap(ex))) : reconcile(batch, outcome))
                .whenComplete((r, ex) -> {
                    timing.stop();
                    activeFlushes.decrementAndGet();
                    publishStats();
                });
    }

    private FlushResult reconcile(WriteBatch batch, BatchOutcome outcome) {
        if (outcome == null || (outcome.success() && !outcome.hasOperationResults())) {
            return commitWhole(batch);
        }
        if (!outcome.hasOperationResults()) {
            return failWhole(batch, outcome.error() != null ? outcome.error() : "Batch failed");
        }

        Set<String> failedIds = new LinkedHashSet<>();
        String firstError = null;
        for (OperationResult r : outcome.operationResults()) {
            if (r.success()) continue;
            failedIds.add(r.opId());
            if (firstError == null) firstError = r.error();
        }
        if (firstError == null) firstError = outcome.error();

        List<String> failedInBatch = new ArrayList<>();
        for (WriteOperation op : batch.operations()) {
            if (failedIds.contains(op.opId())) failedInBatch.add(op.opId());
        }
        if (failedInBatch.isEmpty()) return commitWhole(batch);
        if (failedInBatch.size() == batch.size()) {
            return failWhole(batch, firstError != null ? firstError : "All operations failed");
        }

        String error = firstError != null ? firstError : "Operations rejected";
        ReconcileReport report = buffer.markOperationsFailed(batch.batchId(), failedIds);
        int successCount = report.committedCount();
        List<String> failed = failedIds(batch, report);
        committedMeter.mark(successCount);
        LOG.info("Partial batch success for {}: {} of {} committed, {} failed",
                batch.batchId(), successCount, batch.size(), failed.size());
        deadLetter(report, error);
        return new FlushResult(false, batch.batchId(), batch.size(), successCount, failed.size(),
                failed, report.droppedOpIds(), error);
    }

    /** Requeued and dropped ids in batch order; ops superseded while in flight are neither. */
    private static List<String> failedIds(WriteBatch batch, ReconcileReport report) {
        Set<String> ids = new HashSet<>(report.requeuedOpIds());
        ids.addAll(report.droppedOpIds());
        List<String> ordered = new ArrayList<>(ids.size());
        for (WriteOperation op : batch.operations()) {
            if (ids.contains(op.opId())) ordered.add(op.opId());
        }
        return ordered;
    }

    private FlushResult commitWhole(WriteBatch batch) {
        buffer.markBatchCommitted(batch.batchId());
        committedMeter.mark(batch.size());
        return new FlushResult(true, batch.batchId(), batch.size(), batch.size(), 0, List.of(), List.of(), null);
    }

    private FlushResult failWhole(WriteBatch batch, String error) {
        flushErrors.mark();
        ReconcileReport report = buffer.markBatchFailed(batch.batchId(), error);
        LOG.warn("Flush of {} ({} operations) failed: {}", batch.batchId(), batch.size(), error);
        deadLetter(report, error);
        List<String> failed = failedIds(batch, report);
        return new FlushResult(false, batch.batchId(), batch.size(), 0, failed.size(), failed, report.droppedOpIds(), error);
    }

    private void deadLetter(ReconcileReport report, String reason) {
        if (!report.hasDropped()) return;
        droppedMeter.mark(report.droppedOperations().size());
        if (deadLetters == null) return;
        for (WriteOperation op : report.droppedOperations()) {
            deadLetters.acceptDropped(op, reason);
        }
    }

    /**
     * Flushes until the queues are empty or {@code maxConsecutiveFailures} batches in a row fail outright.
     *
     * @return number of operations committed
     */
    public int flushAll(FlushFunction flushFn) {
        return flushAll(flushFn, null);
    }

    public int flushAll(FlushFunction flushFn, FlushProgressListener onProgress) {
        return flushAllWithDetails(flushFn, onProgress).totalCommitted();
    }

    public FlushAllResult flushAllWithDetails(FlushFunction flushFn, FlushProgressListener onProgress) {
        Objects.requireNonNull(flushFn, "flushFn");
        int totalCommitted = 0;
        int totalFailed = 0;
        int batchCount = 0;
        int consecutiveFailures = 0;
        boolean aborted = false;
        List<String> failedIds = new ArrayList<>();
        List<String> droppedIds = new ArrayList<>();

        while (buffer.totalQueued() > 0) {
            FlushResult result = flushBatch(flushFn);
            if (result == null) break; // drained by another driver
            batchCount++;
            totalCommitted += result.successCount();
            totalFailed += result.failureCount();
            failedIds.addAll(result.failedOperationIds());
            droppedIds.addAll(result.droppedOperationIds());

            if (result.success()) {
                consecutiveFailures = 0;
            } else {
                consecutiveFailures++;
                if (consecutiveFailures >= config.maxConsecutiveFailures() && result.successCount() == 0) {
                    LOG.warn("Stopping flush after {} consecutive failures ({} committed, {} failed, {} still queued)",
                            consecutiveFailures, totalCommitted, totalFailed, buffer.totalQueued());
                    aborted = true;
                }
            }
            if (onProgress != null) onProgress.onProgress(totalCommitted, buffer.totalQueued(), totalFailed);
            if (aborted) break;

            long pause = result.success()
                    ? config.interBatchDelayMillis()
                    : Math.max(config.interBatchDelayMillis(), retryPolicy.backoffMillis(consecutiveFailures));
            if (!pause(pause)) {
                LOG.warn("Flush interrupted with {} operations still queued", buffer.totalQueued());
                aborted = true;
                break;
            }
        }
        if (totalFailed > 0) {
            LOG.warn("Flush finished with failures: {} committed, {} failed, {} batches", totalCommitted, totalFailed, batchCount);
        }
        return new FlushAllResult(totalCommitted, totalFailed, batchCount, failedIds, droppedIds, aborted);
    }

    /**
     * Checks {@link #shouldFlush()} every {@code interval} on a daemon thread and flushes one batch when it holds.
     * Replaces any previous auto-flush.
     */
    public void startAutoFlush(FlushFunction flushFn, Duration interval) {
        Objects.requireNonNull(flushFn, "flushFn");
        long millis = Math.max(1, interval.toMillis());
        synchronized (autoFlushLock) {
            stopAutoFlush();
            if (scheduler == null) {
                scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
                    Thread t = new Thread(r, "write-buffer-autoflush");
                    t.setDaemon(true);
                    return t;
                });
            }
            autoFlush = scheduler.scheduleWithFixedDelay(() -> {
                try {
                    if (buffer.shouldFlush()) flushBatch(flushFn);
                } catch (RuntimeException e) {
                    LOG.error("Auto-flush tick failed", e);
                }
            }, millis, millis, TimeUnit.MILLISECONDS);
            LOG.debug("Auto-flush started every {} ms", millis);
        }
    }

    public void stopAutoFlush() {
        synchronized (autoFlushLock) {
            if (autoFlush != null) {
                autoFlush.cancel(false);
                autoFlush = null;
            }
        }
    }

    public boolean isAutoFlushing() {
        synchronized (autoFlushLock) {
            return autoFlush != null;
        }
    }

    // ---- reconciliation reported by external drivers

    public ReconcileReport markBatchCommitted(String batchId) {
        ReconcileReport report = buffer.markBatchCommitted(batchId);
        committedMeter.mark(report.committedCount());
        publishStats();
        return report;
    }

    public ReconcileReport markBatchFailed(String batchId, String error) {
        ReconcileReport report = buffer.markBatchFailed(batchId, error);
        deadLetter(report, error);
        publishStats();
        return report;
    }

    public ReconcileReport markOperationsFailed(String batchId, Collection<String> failedOpIds) {
        ReconcileReport report = buffer.markOperationsFailed(batchId, failedOpIds);
        committedMeter.mark(report.committedCount());
        deadLetter(report, "operation rejected");
        publishStats();
        return report;
    }

    // ---- status

    public int totalQueued() { return buffer.totalQueued(); }
    public int inFlightCount() { return buffer.inFlightCount(); }
    public int backpressure() { return buffer.backpressure(); }
    public boolean isBackpressured() { return buffer.isBackpressured(); }
    public WriteBufferStats getStats() { return buffer.getStats(); }

    public void resetStats() {
        buffer.resetStats();
        publishStats();
    }

    public void setMaxQueueSize(int size) {
        buffer.setMaxQueueSize(size);
        publishStats();
    }

    // ---- persistence

    public void clear() {
        buffer.clear();
        publishStats();
    }

    public List<WriteOperation> drainAll() {
        List<WriteOperation> ops = buffer.drainAll();
        publishStats();
        return ops;
    }

    public void restore(Collection<WriteOperation> operations) {
        buffer.restore(operations);
        publishStats();
    }

    private void publishStats() {
        if (listeners.isEmpty()) return;
        WriteBufferStats stats = buffer.getStats();
        for (StatsListener l : listeners) {
            try {
                l.onStats(stats);
            } catch (RuntimeException e) {
                LOG.warn("Stats listener {} failed", l, e);
            }
        }
    }

    private static boolean pause(long millis) {
        if (millis <= 0) return !Thread.currentThread().isInterrupted();
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static Throwable unwrap(Throwable t) {
        while ((t instanceof CompletionException || t instanceof ExecutionException) && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }

    private static String messageOf(Throwable t) {
        return t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
    }

    /** Stops auto-flush, disposes the buffer and closes the dead-letter sink. Drain first to keep queued work. */
    @Override
    public void close() {
        synchronized (autoFlushLock) {
            stopAutoFlush();
            if (scheduler != null) scheduler.shutdownNow();
        }
        buffer.dispose();
        if (deadLetters != null) {
            try {
                deadLetters.close();
            } catch (Exception e) {
                LOG.warn("Closing dead-letter sink failed", e);
            }
        }
        listeners.clear();
    }
}
