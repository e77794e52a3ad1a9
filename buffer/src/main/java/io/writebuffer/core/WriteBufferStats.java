package io.writebuffer.core;

/**
 * Point-in-time snapshot of buffer occupancy and lifetime counters.
 * Counters are cleared by {@link WriteBuffer#resetStats()}; occupancy is not.
 */
public record WriteBufferStats(
        int highCount,
        int normalCount,
        int bulkCount,
        int retryCount,
        int inFlightBatches,
        long batchesFlushed,
        long opsCommitted,
        long opsFailed,
        long opsDeduplicated,
        int backpressure,
        int maxQueueSize
) {
    public int totalQueued() { return highCount + normalCount + bulkCount + retryCount; }
}
