package io.writebuffer.core;

import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;

/**
 * A single write waiting to be flushed. Immutable; a retry produces a copy with a higher retry count.
 */
public final class WriteOperation {
    private final String opId;
    private final WriteOpType opType;
    private final byte[] payload;
    private final WritePriority priority;
    private final Instant queuedAt;
    private final int retryCount;
    private final String dedupKey; // nullable

    public WriteOperation(String opId, WriteOpType opType, byte[] payload, WritePriority priority,
                          Instant queuedAt, int retryCount, String dedupKey) {
        this.opId = Objects.requireNonNull(opId, "opId");
        this.opType = Objects.requireNonNull(opType, "opType");
        this.payload = Objects.requireNonNull(payload, "payload").clone();
        this.priority = Objects.requireNonNull(priority, "priority");
        this.queuedAt = Objects.requireNonNull(queuedAt, "queuedAt");
        if (retryCount < 0) throw new IllegalArgumentException("retryCount must be >= 0 but was " + retryCount);
        this.retryCount = retryCount;
        this.dedupKey = dedupKey;
    }

    public String opId() { return opId; }
    public WriteOpType opType() { return opType; }
    public byte[] payload() { return payload.clone(); }
    public int payloadLength() { return payload.length; }
    public WritePriority priority() { return priority; }
    public Instant queuedAt() { return queuedAt; }
    public int retryCount() { return retryCount; }
    public String dedupKey() { return dedupKey; }
    public boolean hasDedupKey() { return dedupKey != null; }

    public WriteOperation withRetryCount(int count) {
        return new WriteOperation(opId, opType, payload, priority, queuedAt, count, dedupKey);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof WriteOperation that)) return false;
        return retryCount == that.retryCount
                && opId.equals(that.opId)
                && opType == that.opType
                && Arrays.equals(payload, that.payload)
                && priority == that.priority
                && queuedAt.equals(that.queuedAt)
                && Objects.equals(dedupKey, that.dedupKey);
    }

    @Override
    public int hashCode() {
        int h = Objects.hash(opId, opType, priority, queuedAt, retryCount, dedupKey);
        return 31 * h + Arrays.hashCode(payload);
    }

    @Override
    public String toString() {
        return "WriteOperation{" +
                "opId='" + opId + '\'' +
                ", opType=" + opType +
                ", priority=" + priority +
                ", payloadBytes=" + payload.length +
                ", queuedAt=" + queuedAt +
                ", retryCount=" + retryCount +
                ", dedupKey=" + dedupKey +
                '}';
    }
}
