package io.writebuffer.core;

import java.util.Optional;

public record BatchResult(boolean hasBatch, WriteBatch batch, int remainingCount) {
    private static final BatchResult EMPTY = new BatchResult(false, null, 0);

    public static BatchResult empty() { return EMPTY; }

    public static BatchResult of(WriteBatch batch, int remainingCount) {
        return new BatchResult(true, batch, remainingCount);
    }

    public Optional<WriteBatch> asOptional() { return Optional.ofNullable(batch); }
}
