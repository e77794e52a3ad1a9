package io.writebuffer.runtime;

import java.util.List;

/**
 * What happened to one flushed batch. {@code droppedOperationIds} lists operations that exhausted their
 * retries and are gone for good.
 */
public record FlushResult(
        boolean success,
        String batchId,
        int operationCount,
        int successCount,
        int failureCount,
        List<String> failedOperationIds,
        List<String> droppedOperationIds,
        String error
) {
    public FlushResult {
        failedOperationIds = List.copyOf(failedOperationIds);
        droppedOperationIds = List.copyOf(droppedOperationIds);
    }
}
