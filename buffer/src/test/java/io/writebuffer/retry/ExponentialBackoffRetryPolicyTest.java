package io.writebuffer.retry;

import io.writebuffer.config.WriteBufferConfig;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ExponentialBackoffRetryPolicyTest {
    @Test
    void retries_up_to_ceiling() {
        ExponentialBackoffRetryPolicy p = new ExponentialBackoffRetryPolicy(3, 10, 1000);
        assertTrue(p.shouldRetry(1, "x"));
        assertTrue(p.shouldRetry(3, "x"));
        assertFalse(p.shouldRetry(4, "x"));
    }

    @Test
    void backoff_doubles_and_caps() {
        ExponentialBackoffRetryPolicy p = new ExponentialBackoffRetryPolicy(3, 10, 50);
        assertEquals(10, p.backoffMillis(1));
        assertEquals(20, p.backoffMillis(2));
        assertEquals(40, p.backoffMillis(3));
        assertEquals(50, p.backoffMillis(4));
        assertEquals(50, p.backoffMillis(1_000));
    }

    @Test
    void derives_from_config() {
        ExponentialBackoffRetryPolicy p = ExponentialBackoffRetryPolicy.fromConfig(WriteBufferConfig.defaults().withMaxRetries(7));
        assertEquals(7, p.maxRetries());
        assertThrows(IllegalArgumentException.class, () -> new ExponentialBackoffRetryPolicy(-1, 1, 1));
    }
}
