package io.writebuffer.buffer;

import io.writebuffer.config.WriteBufferConfig;
import io.writebuffer.core.BatchResult;
import io.writebuffer.core.BatchState;
import io.writebuffer.core.ReconcileReport;
import io.writebuffer.core.WriteBatch;
import io.writebuffer.core.WriteBuffer;
import io.writebuffer.core.WriteBufferStats;
import io.writebuffer.core.WriteOpType;
import io.writebuffer.core.WriteOperation;
import io.writebuffer.core.WritePriority;
import io.writebuffer.retry.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Admission, deduplication, batch formation, the in-flight ledger and result reconciliation.
 * Subclasses only decide how a lane stores its operations.
 * <p>
 * Every public method is synchronized on the buffer: lanes, dedup index and ledger change together.
 */
public abstract class AbstractWriteBuffer implements WriteBuffer {
    private static final Logger LOG = LoggerFactory.getLogger(AbstractWriteBuffer.class);

    private final int batchSize;
    private final long flushIntervalMillis;
    private final RetryPolicy retryPolicy;
    private final Clock clock;

    /** dedup key -> the single queued operation holding it. */
    private final Map<String, Slot> dedupIndex = new HashMap<>();
    /** dedup key -> most recently admitted operation for it, queued or in flight. */
    private final Map<String, WriteOperation> newestByKey = new HashMap<>();
    private final Map<String, WriteBatch> inFlight = new LinkedHashMap<>();

    private int maxQueueSize;
    private long nextBatchId = 0;

    private long batchesFlushed;
    private long opsCommitted;
    private long opsFailed;
    private long opsDeduplicated;

    protected AbstractWriteBuffer(WriteBufferConfig config, RetryPolicy retryPolicy, Clock clock) {
        Objects.requireNonNull(config, "config");
        this.batchSize = config.batchSize();
        this.flushIntervalMillis = config.flushIntervalMillis();
        this.maxQueueSize = config.maxQueueSize();
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    protected abstract void append(Lane lane, WriteOperation op);

    /** Remove this exact instance from the lane. */
    protected abstract boolean remove(Lane lane, WriteOperation op);

    /** Remove and return up to {@code max} operations from the head of the lane. */
    protected abstract List<WriteOperation> poll(Lane lane, int max);

    protected abstract WriteOperation peek(Lane lane);

    protected abstract int size(Lane lane);

    protected abstract List<WriteOperation> removeAll(Lane lane);

    @Override
    public boolean queueWrite(String opId, WriteOpType opType, byte[] payload, WritePriority priority) {
        return queueWriteWithDedup(opId, opType, payload, priority, null);
    }

    @Override
    public synchronized boolean queueWriteWithDedup(String opId, WriteOpType opType, byte[] payload,
                                                    WritePriority priority, String dedupKey) {
        WriteOperation op = new WriteOperation(opId, opType, payload, priority, clock.instant(), 0, dedupKey);
        if (totalQueued() >= maxQueueSize) {
            LOG.debug("Rejected {}: buffer at capacity ({})", opId, maxQueueSize);
            return false;
        }
        admit(Lane.of(priority), op);
        return true;
    }

    private void admit(Lane lane, WriteOperation op) {
        if (op.hasDedupKey()) {
            Slot previous = dedupIndex.put(op.dedupKey(), new Slot(lane, op));
            if (previous != null) {
                remove(previous.lane(), previous.op());
                opsDeduplicated++;
            }
            newestByKey.put(op.dedupKey(), op);
        }
        append(lane, op);
    }

    @Override
    public synchronized boolean shouldFlush() {
        if (totalQueued() == 0) return false;
        if (size(Lane.HIGH) > 0 || size(Lane.RETRY) > 0) return true;
        for (Lane lane : Lane.FORMATION_ORDER) {
            if (size(lane) >= batchSize) return true;
        }
        Instant oldest = oldestQueuedAt();
        return oldest != null && Duration.between(oldest, clock.instant()).toMillis() >= flushIntervalMillis;
    }

    private Instant oldestQueuedAt() {
        Instant oldest = null;
        for (Lane lane : Lane.FORMATION_ORDER) {
            WriteOperation head = peek(lane);
            if (head != null && (oldest == null || head.queuedAt().isBefore(oldest))) oldest = head.queuedAt();
        }
        return oldest;
    }

    @Override
    public synchronized BatchResult getPendingBatch() {
        List<WriteOperation> ops = new ArrayList<>(Math.min(batchSize, totalQueued()));
        for (Lane lane : Lane.FORMATION_ORDER) {
            int room = batchSize - ops.size();
            if (room <= 0) break;
            if (size(lane) > 0) ops.addAll(poll(lane, room));
        }
        if (ops.isEmpty()) return BatchResult.empty();

        for (WriteOperation op : ops) unindex(op);

        WriteBatch batch = new WriteBatch("batch-" + nextBatchId++, ops, clock.instant());
        batch.transition(BatchState.PENDING, BatchState.IN_FLIGHT);
        inFlight.put(batch.batchId(), batch);
        batchesFlushed++;
        int remaining = totalQueued();
        LOG.debug("Formed {} with {} operations ({} remaining)", batch.batchId(), batch.size(), remaining);
        return BatchResult.of(batch, remaining);
    }

    private void unindex(WriteOperation op) {
        if (!op.hasDedupKey()) return;
        Slot slot = dedupIndex.get(op.dedupKey());
        if (slot != null && slot.op() == op) dedupIndex.remove(op.dedupKey());
    }

    private void forget(WriteOperation op) {
        if (op.hasDedupKey() && newestByKey.get(op.dedupKey()) == op) newestByKey.remove(op.dedupKey());
    }

    @Override
    public synchronized ReconcileReport markBatchCommitted(String batchId) {
        WriteBatch batch = inFlight.remove(batchId);
        if (batch == null) {
            LOG.debug("Ignoring commit of unknown batch {}", batchId);
            return ReconcileReport.unknown(batchId);
        }
        batch.transition(BatchState.IN_FLIGHT, BatchState.COMMITTED);
        for (WriteOperation op : batch.operations()) forget(op);
        opsCommitted += batch.size();
        return new ReconcileReport(batchId, batch.size(), List.of(), List.of());
    }

    @Override
    public synchronized ReconcileReport markBatchFailed(String batchId, String error) {
        WriteBatch batch = inFlight.remove(batchId);
        if (batch == null) {
            LOG.debug("Ignoring failure of unknown batch {}", batchId);
            return ReconcileReport.unknown(batchId);
        }
        batch.transition(BatchState.IN_FLIGHT, BatchState.FAILED);
        List<String> requeued = new ArrayList<>();
        List<WriteOperation> dropped = new ArrayList<>();
        for (WriteOperation op : batch.operations()) {
            retryOrDrop(op, error, requeued, dropped);
        }
        return new ReconcileReport(batchId, 0, requeued, dropped);
    }

    @Override
    public synchronized ReconcileReport markOperationsFailed(String batchId, Collection<String> failedOpIds) {
        WriteBatch batch = inFlight.remove(batchId);
        if (batch == null) {
            LOG.debug("Ignoring partial failure of unknown batch {}", batchId);
            return ReconcileReport.unknown(batchId);
        }
        Set<String> failed = new HashSet<>(failedOpIds);
        batch.transition(BatchState.IN_FLIGHT, failed.isEmpty() ? BatchState.COMMITTED : BatchState.FAILED);
        int committed = 0;
        List<String> requeued = new ArrayList<>();
        List<WriteOperation> dropped = new ArrayList<>();
        for (WriteOperation op : batch.operations()) {
            if (failed.contains(op.opId())) {
                retryOrDrop(op, "operation rejected", requeued, dropped);
            } else {
                forget(op);
                committed++;
            }
        }
        opsCommitted += committed;
        return new ReconcileReport(batchId, committed, requeued, dropped);
    }

    private void retryOrDrop(WriteOperation op, String error, List<String> requeued, List<WriteOperation> dropped) {
        if (op.hasDedupKey() && newestByKey.get(op.dedupKey()) != op) {
            // a newer write for the same key was admitted while this one was in flight
            opsDeduplicated++;
            return;
        }
        WriteOperation retried = op.withRetryCount(op.retryCount() + 1);
        if (retryPolicy.shouldRetry(retried.retryCount(), error)) {
            admit(Lane.RETRY, retried);
            requeued.add(op.opId());
        } else {
            forget(op);
            opsFailed++;
            dropped.add(retried);
            LOG.warn("Dropping {} after {} attempts: {}", op.opId(), retried.retryCount(), error);
        }
    }

    @Override
    public synchronized int totalQueued() {
        int total = 0;
        for (Lane lane : Lane.FORMATION_ORDER) total += size(lane);
        return total;
    }

    @Override
    public synchronized int inFlightCount() { return inFlight.size(); }

    @Override
    public synchronized int backpressure() {
        int total = totalQueued();
        if (total >= maxQueueSize) return 100;
        return (int) Math.min(99, Math.round(100.0 * total / maxQueueSize));
    }

    @Override
    public synchronized boolean isBackpressured() { return backpressure() >= 100; }

    @Override
    public synchronized WriteBufferStats getStats() {
        return new WriteBufferStats(
                size(Lane.HIGH), size(Lane.NORMAL), size(Lane.BULK), size(Lane.RETRY),
                inFlight.size(), batchesFlushed, opsCommitted, opsFailed, opsDeduplicated,
                backpressure(), maxQueueSize);
    }

    @Override
    public synchronized void resetStats() {
        batchesFlushed = 0;
        opsCommitted = 0;
        opsFailed = 0;
        opsDeduplicated = 0;
    }

    @Override
    public synchronized int maxQueueSize() { return maxQueueSize; }

    @Override
    public synchronized void setMaxQueueSize(int size) {
        if (size < 1) throw new IllegalArgumentException("maxQueueSize must be >= 1 but was " + size);
        this.maxQueueSize = size;
    }

    @Override
    public synchronized void clear() {
        drainAll();
    }

    @Override
    public synchronized List<WriteOperation> drainAll() {
        List<WriteOperation> all = new ArrayList<>(totalQueued());
        for (Lane lane : Lane.FORMATION_ORDER) all.addAll(removeAll(lane));
        for (WriteOperation op : all) forget(op);
        dedupIndex.clear();
        return all;
    }

    @Override
    public synchronized void restore(Collection<WriteOperation> operations) {
        for (WriteOperation op : operations) {
            Objects.requireNonNull(op, "operation");
            if (op.hasDedupKey()) {
                // newestByKey also covers writes that are in flight
                WriteOperation live = newestByKey.get(op.dedupKey());
                if (live != null && live.queuedAt().isAfter(op.queuedAt())) {
                    opsDeduplicated++;
                    continue;
                }
            }
            admit(op.retryCount() > 0 ? Lane.RETRY : Lane.of(op.priority()), op);
        }
    }

    @Override
    public synchronized void dispose() {
        drainAll();
        inFlight.clear();
        newestByKey.clear();
    }

    private record Slot(Lane lane, WriteOperation op) {}
}
