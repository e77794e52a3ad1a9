package io.writebuffer.runtime;

import java.util.Objects;

public record OperationResult(String opId, boolean success, String error) {
    public OperationResult {
        Objects.requireNonNull(opId, "opId");
    }

    public static OperationResult ok(String opId) { return new OperationResult(opId, true, null); }

    public static OperationResult failed(String opId, String error) { return new OperationResult(opId, false, error); }
}
