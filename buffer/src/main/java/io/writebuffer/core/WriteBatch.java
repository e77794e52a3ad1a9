package io.writebuffer.core;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * An immutable, ordered slice of operations handed to a flush function as one transmission.
 * Only the lifecycle state changes after formation.
 */
public final class WriteBatch {
    private final String batchId;
    private final List<WriteOperation> operations;
    private final Instant createdAt;
    private final WritePriority priority;
    private final AtomicReference<BatchState> state = new AtomicReference<>(BatchState.PENDING);

    public WriteBatch(String batchId, List<WriteOperation> operations, Instant createdAt) {
        this.batchId = Objects.requireNonNull(batchId, "batchId");
        this.operations = List.copyOf(Objects.requireNonNull(operations, "operations"));
        if (this.operations.isEmpty()) throw new IllegalArgumentException("Batch " + batchId + " has no operations");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
        this.priority = highestPriority(this.operations);
    }

    public String batchId() { return batchId; }
    public List<WriteOperation> operations() { return operations; }
    public int size() { return operations.size(); }
    public Instant createdAt() { return createdAt; }
    /** Highest priority among the contained operations. */
    public WritePriority priority() { return priority; }
    public BatchState state() { return state.get(); }

    /**
     * Moves the batch from {@code expected} to {@code next}.
     *
     * @throws IllegalStateException if the batch is not in {@code expected} or the transition is not allowed
     */
    public void transition(BatchState expected, BatchState next) {
        if (!expected.canMoveTo(next)) {
            throw new IllegalStateException("Illegal batch transition " + expected + " -> " + next);
        }
        if (!state.compareAndSet(expected, next)) {
            throw new IllegalStateException("Batch " + batchId + " is " + state.get() + ", expected " + expected);
        }
    }

    private static WritePriority highestPriority(List<WriteOperation> ops) {
        WritePriority best = WritePriority.BULK;
        for (WriteOperation op : ops) {
            if (op.priority().code() < best.code()) best = op.priority();
        }
        return best;
    }

    @Override
    public String toString() {
        return "WriteBatch{" +
                "batchId='" + batchId + '\'' +
                ", operations=" + operations.size() +
                ", priority=" + priority +
                ", state=" + state.get() +
                '}';
    }
}
