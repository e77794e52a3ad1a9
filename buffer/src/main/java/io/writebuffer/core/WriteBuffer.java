package io.writebuffer.core;

import java.util.Collection;
import java.util.List;

/**
 * Bounded, priority-ordered buffer between write producers and a backend that absorbs writes in batches.
 * <p>
 * Operations are admitted into one of three priority lanes (or the retry lane after a failure), formed into
 * immutable batches in lane-then-age order, and reconciled once the caller reports the outcome of sending a batch.
 * Admission never blocks: when the buffer is at capacity {@code queueWrite*} returns {@code false}.
 * Implementations are thread-safe; all mutations are atomic with respect to each other.
 */
public interface WriteBuffer extends AutoCloseable {

    default boolean queueWrite(String opId, WriteOpType opType, byte[] payload) {
        return queueWrite(opId, opType, payload, WritePriority.NORMAL);
    }

    /** Queue a write; returns false without queuing when the buffer is at capacity. */
    boolean queueWrite(String opId, WriteOpType opType, byte[] payload, WritePriority priority);

    /**
     * Queue a write that supersedes any live operation sharing {@code dedupKey} (last write wins).
     * A null key behaves like {@link #queueWrite(String, WriteOpType, byte[], WritePriority)}.
     */
    boolean queueWriteWithDedup(String opId, WriteOpType opType, byte[] payload, WritePriority priority, String dedupKey);

    /** Whether a driver should form a batch now. */
    boolean shouldFlush();

    /** Drain up to one batch worth of operations and move it in flight. */
    BatchResult getPendingBatch();

    ReconcileReport markBatchCommitted(String batchId);

    /** Every operation of the batch is retried or, past the retry ceiling, dropped and reported. */
    ReconcileReport markBatchFailed(String batchId, String error);

    /** Listed operations are retried or dropped; the rest of the batch counts as committed. */
    ReconcileReport markOperationsFailed(String batchId, Collection<String> failedOpIds);

    int totalQueued();

    int inFlightCount();

    /** Occupancy relative to the ceiling, 0-100. Reports 100 only at capacity. */
    int backpressure();

    boolean isBackpressured();

    WriteBufferStats getStats();

    void resetStats();

    int maxQueueSize();

    /** Change the admission ceiling; never evicts queued operations. */
    void setMaxQueueSize(int size);

    /** Drop every queued operation. In-flight batches are left alone. */
    void clear();

    /** Remove and return every queued operation in formation order. In-flight batches are left alone. */
    List<WriteOperation> drainAll();

    /** Re-admit previously drained operations, bypassing the admission ceiling. */
    void restore(Collection<WriteOperation> operations);

    /** Drop queued operations and forget in-flight batches. */
    void dispose();

    @Override
    default void close() { dispose(); }
}
