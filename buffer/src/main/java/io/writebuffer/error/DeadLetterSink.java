package io.writebuffer.error;

import io.writebuffer.core.WriteOperation;

public interface DeadLetterSink extends AutoCloseable {
    void acceptDropped(WriteOperation op, String reason);
    @Override default void close() {}
}
