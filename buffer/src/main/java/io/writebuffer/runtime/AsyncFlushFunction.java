package io.writebuffer.runtime;

import io.writebuffer.core.WriteBatch;

import java.util.concurrent.CompletionStage;

/** Non-blocking variant of {@link FlushFunction}; a failed stage fails the whole batch. */
@FunctionalInterface
public interface AsyncFlushFunction {
    CompletionStage<BatchOutcome> flush(WriteBatch batch);
}
