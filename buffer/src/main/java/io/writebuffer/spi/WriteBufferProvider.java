package io.writebuffer.spi;

import io.writebuffer.config.WriteBufferConfig;
import io.writebuffer.core.WriteBuffer;
import io.writebuffer.retry.RetryPolicy;

import java.time.Clock;

/**
 * Optimized buffer backend discovered through {@link java.util.ServiceLoader}.
 * Register implementations in {@code META-INF/services/io.writebuffer.spi.WriteBufferProvider}.
 */
public interface WriteBufferProvider {
    String name();

    /** Cheap capability probe; called once when the factory first looks for a backend. */
    boolean isAvailable();

    WriteBuffer create(WriteBufferConfig config, RetryPolicy retryPolicy, Clock clock);
}
