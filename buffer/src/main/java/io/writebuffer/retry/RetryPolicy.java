package io.writebuffer.retry;

public interface RetryPolicy {
    /** Whether an operation that has now failed {@code retryCount} times goes back to the retry lane. */
    boolean shouldRetry(int retryCount, String error);

    /** Pause before the next attempt after {@code attempt} consecutive failures. */
    long backoffMillis(int attempt);
}
