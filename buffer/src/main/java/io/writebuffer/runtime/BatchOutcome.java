package io.writebuffer.runtime;

import java.util.List;

/**
 * Structured result a flush function may return. Operations missing from {@code operationResults}
 * count as stored.
 */
public record BatchOutcome(boolean success, List<OperationResult> operationResults, String error) {
    private static final BatchOutcome COMMITTED = new BatchOutcome(true, List.of(), null);

    public BatchOutcome {
        operationResults = operationResults == null ? List.of() : List.copyOf(operationResults);
    }

    public static BatchOutcome committed() { return COMMITTED; }

    public static BatchOutcome failed(String error) { return new BatchOutcome(false, List.of(), error); }

    public static BatchOutcome of(List<OperationResult> results) {
        boolean allOk = results.stream().allMatch(OperationResult::success);
        return new BatchOutcome(allOk, results, null);
    }

    public boolean hasOperationResults() { return !operationResults.isEmpty(); }
}
