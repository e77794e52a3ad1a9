package io.writebuffer.runtime;

import java.util.List;

/** Totals over a {@code flushAll} run. {@code aborted} is set when consecutive failures stopped it early. */
public record FlushAllResult(
        int totalCommitted,
        int totalFailed,
        int batchCount,
        List<String> failedOperationIds,
        List<String> droppedOperationIds,
        boolean aborted
) {
    public FlushAllResult {
        failedOperationIds = List.copyOf(failedOperationIds);
        droppedOperationIds = List.copyOf(droppedOperationIds);
    }
}
