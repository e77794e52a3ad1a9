package io.writebuffer.core;

import java.util.List;

/**
 * What reconciling a batch outcome did: how many operations were committed, which went back
 * to the retry lane, and which were dropped for good after exhausting their retries.
 */
public record ReconcileReport(String batchId, int committedCount, List<String> requeuedOpIds,
                              List<WriteOperation> droppedOperations) {
    public ReconcileReport {
        requeuedOpIds = List.copyOf(requeuedOpIds);
        droppedOperations = List.copyOf(droppedOperations);
    }

    /** Report for a batch id the buffer does not know (never formed or already reconciled). */
    public static ReconcileReport unknown(String batchId) {
        return new ReconcileReport(batchId, 0, List.of(), List.of());
    }

    public boolean hasDropped() { return !droppedOperations.isEmpty(); }

    public List<String> droppedOpIds() {
        return droppedOperations.stream().map(WriteOperation::opId).toList();
    }
}
