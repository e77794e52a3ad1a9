package io.writebuffer.retry;

import io.writebuffer.config.WriteBufferConfig;

public class ExponentialBackoffRetryPolicy implements RetryPolicy {
    private final int maxRetries;
    private final long baseMillis;
    private final long maxMillis;

    public ExponentialBackoffRetryPolicy(int maxRetries, long baseMillis, long maxMillis) {
        if (maxRetries < 0) throw new IllegalArgumentException("maxRetries must be >= 0 but was " + maxRetries);
        this.maxRetries = maxRetries;
        this.baseMillis = Math.max(1, baseMillis);
        this.maxMillis = Math.max(this.baseMillis, maxMillis);
    }

    public static ExponentialBackoffRetryPolicy fromConfig(WriteBufferConfig config) {
        return new ExponentialBackoffRetryPolicy(config.maxRetries(), config.interBatchDelayMillis(), 1_000);
    }

    public int maxRetries() { return maxRetries; }

    @Override
    public boolean shouldRetry(int retryCount, String error) {
        return retryCount <= maxRetries;
    }

    @Override
    public long backoffMillis(int attempt) {
        long delay = baseMillis * (1L << Math.min(20, Math.max(0, attempt - 1)));
        return Math.min(delay, maxMillis);
    }
}
