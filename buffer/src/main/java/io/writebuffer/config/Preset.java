package io.writebuffer.config;

import java.util.Locale;

/**
 * Tuned starting points. The numbers are observed defaults, not load-tested optima; override as needed.
 */
public enum Preset {
    DEFAULT(50, 100, 3, 5_000),
    /** Larger batches, faster flush, more retries. */
    SEEDING(100, 50, 5, 10_000),
    INTERACTIVE(20, 100, 3, 1_000),
    RECOVERY(200, 25, 10, 50_000);

    static final int CONSECUTIVE_FAILURES = 3;
    static final long INTER_BATCH_DELAY_MILLIS = 10;

    private final int batchSize;
    private final long flushIntervalMillis;
    private final int maxRetries;
    private final int maxQueueSize;

    Preset(int batchSize, long flushIntervalMillis, int maxRetries, int maxQueueSize) {
        this.batchSize = batchSize;
        this.flushIntervalMillis = flushIntervalMillis;
        this.maxRetries = maxRetries;
        this.maxQueueSize = maxQueueSize;
    }

    public WriteBufferConfig config() {
        return new WriteBufferConfig(batchSize, flushIntervalMillis, maxRetries, maxQueueSize,
                CONSECUTIVE_FAILURES, INTER_BATCH_DELAY_MILLIS, true);
    }

    public static Preset parse(String name) {
        if (name == null || name.isBlank()) return DEFAULT;
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown write buffer preset: " + name, e);
        }
    }
}
