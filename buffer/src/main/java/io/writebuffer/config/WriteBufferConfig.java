package io.writebuffer.config;

/**
 * Tunables for one buffer instance. Invalid values fail at construction.
 */
public record WriteBufferConfig(
        int batchSize,
        long flushIntervalMillis,
        int maxRetries,
        int maxQueueSize,
        int maxConsecutiveFailures,
        long interBatchDelayMillis,
        boolean preferNative
) {
    public WriteBufferConfig {
        require(batchSize >= 1, "batchSize must be >= 1 but was " + batchSize);
        require(flushIntervalMillis >= 0, "flushIntervalMillis must be >= 0 but was " + flushIntervalMillis);
        require(maxRetries >= 0, "maxRetries must be >= 0 but was " + maxRetries);
        require(maxQueueSize >= 1, "maxQueueSize must be >= 1 but was " + maxQueueSize);
        require(maxConsecutiveFailures >= 1, "maxConsecutiveFailures must be >= 1 but was " + maxConsecutiveFailures);
        require(interBatchDelayMillis >= 0, "interBatchDelayMillis must be >= 0 but was " + interBatchDelayMillis);
    }

    public static WriteBufferConfig defaults() { return Preset.DEFAULT.config(); }

    /**
     * Reads {@code writebuffer.*} system properties, falling back to {@code WRITEBUFFER_*} environment variables,
     * on top of the preset named by {@code writebuffer.preset}.
     */
    public static WriteBufferConfig fromEnv() {
        WriteBufferConfig base = Preset.parse(setting("writebuffer.preset", "WRITEBUFFER_PRESET", "default")).config();
        int batch = Integer.parseInt(setting("writebuffer.batchSize", "WRITEBUFFER_BATCH_SIZE", String.valueOf(base.batchSize())));
        long interval = Long.parseLong(setting("writebuffer.flushIntervalMs", "WRITEBUFFER_FLUSH_INTERVAL_MS", String.valueOf(base.flushIntervalMillis())));
        int retries = Integer.parseInt(setting("writebuffer.maxRetries", "WRITEBUFFER_MAX_RETRIES", String.valueOf(base.maxRetries())));
        int queue = Integer.parseInt(setting("writebuffer.maxQueueSize", "WRITEBUFFER_MAX_QUEUE_SIZE", String.valueOf(base.maxQueueSize())));
        int failures = Integer.parseInt(setting("writebuffer.maxConsecutiveFailures", "WRITEBUFFER_MAX_CONSECUTIVE_FAILURES", String.valueOf(base.maxConsecutiveFailures())));
        long delay = Long.parseLong(setting("writebuffer.interBatchDelayMs", "WRITEBUFFER_INTER_BATCH_DELAY_MS", String.valueOf(base.interBatchDelayMillis())));
        boolean preferNative = Boolean.parseBoolean(setting("writebuffer.preferNative", "WRITEBUFFER_PREFER_NATIVE", String.valueOf(base.preferNative())));
        return new WriteBufferConfig(batch, interval, retries, queue, failures, delay, preferNative);
    }

    public WriteBufferConfig withBatchSize(int size) {
        return new WriteBufferConfig(size, flushIntervalMillis, maxRetries, maxQueueSize, maxConsecutiveFailures, interBatchDelayMillis, preferNative);
    }

    public WriteBufferConfig withFlushIntervalMillis(long millis) {
        return new WriteBufferConfig(batchSize, millis, maxRetries, maxQueueSize, maxConsecutiveFailures, interBatchDelayMillis, preferNative);
    }

    public WriteBufferConfig withMaxRetries(int retries) {
        return new WriteBufferConfig(batchSize, flushIntervalMillis, retries, maxQueueSize, maxConsecutiveFailures, interBatchDelayMillis, preferNative);
    }

    public WriteBufferConfig withMaxQueueSize(int size) {
        return new WriteBufferConfig(batchSize, flushIntervalMillis, maxRetries, size, maxConsecutiveFailures, interBatchDelayMillis, preferNative);
    }

    public WriteBufferConfig withMaxConsecutiveFailures(int failures) {
        return new WriteBufferConfig(batchSize, flushIntervalMillis, maxRetries, maxQueueSize, failures, interBatchDelayMillis, preferNative);
    }

    public WriteBufferConfig withInterBatchDelayMillis(long millis) {
        return new WriteBufferConfig(batchSize, flushIntervalMillis, maxRetries, maxQueueSize, maxConsecutiveFailures, millis, preferNative);
    }

    public WriteBufferConfig withPreferNative(boolean prefer) {
        return new WriteBufferConfig(batchSize, flushIntervalMillis, maxRetries, maxQueueSize, maxConsecutiveFailures, interBatchDelayMillis, prefer);
    }

    private static String setting(String property, String env, String fallback) {
        return System.getProperty(property, System.getenv().getOrDefault(env, fallback));
    }

    private static void require(boolean condition, String message) {
        if (!condition) throw new IllegalArgumentException(message);
    }
}
