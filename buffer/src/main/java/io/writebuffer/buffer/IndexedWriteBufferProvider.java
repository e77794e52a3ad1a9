package io.writebuffer.buffer;

import io.writebuffer.config.WriteBufferConfig;
import io.writebuffer.core.WriteBuffer;
import io.writebuffer.retry.RetryPolicy;
import io.writebuffer.spi.WriteBufferProvider;

import java.time.Clock;

/** Registers {@link IndexedWriteBuffer} as the native backend. Disable with {@code -Dwritebuffer.native.enabled=false}. */
public class IndexedWriteBufferProvider implements WriteBufferProvider {
    public static final String ENABLED_PROPERTY = "writebuffer.native.enabled";

    @Override
    public String name() { return "indexed"; }

    @Override
    public boolean isAvailable() {
        return Boolean.parseBoolean(System.getProperty(ENABLED_PROPERTY, "true"));
    }

    @Override
    public WriteBuffer create(WriteBufferConfig config, RetryPolicy retryPolicy, Clock clock) {
        return new IndexedWriteBuffer(config, retryPolicy, clock);
    }
}
