package io.writebuffer.buffer;

import io.writebuffer.config.WriteBufferConfig;
import io.writebuffer.core.WriteBuffer;
import io.writebuffer.retry.RetryPolicy;
import io.writebuffer.spi.WriteBufferProvider;

import java.time.Clock;

/** Fallback backend; always available and never registered with the service loader. */
public class PortableWriteBufferProvider implements WriteBufferProvider {
    @Override
    public String name() { return "portable"; }

    @Override
    public boolean isAvailable() { return true; }

    @Override
    public WriteBuffer create(WriteBufferConfig config, RetryPolicy retryPolicy, Clock clock) {
        return new PortableWriteBuffer(config, retryPolicy, clock);
    }
}
