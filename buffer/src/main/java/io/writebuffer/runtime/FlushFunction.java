package io.writebuffer.runtime;

import io.writebuffer.core.WriteBatch;

/**
 * Transmits one batch to the backend.
 * <p>
 * Return {@code null} or {@link BatchOutcome#committed()} when the whole batch was stored, a {@link BatchOutcome}
 * with per-operation results when the backend judged operations individually, and throw when the transport failed.
 */
@FunctionalInterface
public interface FlushFunction {
    BatchOutcome flush(WriteBatch batch) throws Exception;
}
