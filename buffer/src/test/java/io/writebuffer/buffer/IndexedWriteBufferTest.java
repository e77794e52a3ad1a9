package io.writebuffer.buffer;

import io.writebuffer.config.WriteBufferConfig;
import io.writebuffer.core.WriteBuffer;
import io.writebuffer.core.WriteOpType;
import io.writebuffer.core.WritePriority;
import io.writebuffer.retry.RetryPolicy;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class IndexedWriteBufferTest extends WriteBufferContract {
    @Override
    WriteBuffer newBuffer(WriteBufferConfig config, RetryPolicy retryPolicy, Clock clock) {
        return new IndexedWriteBuffer(config, retryPolicy, clock);
    }

    @Test
    void heavy_dedup_churn_keeps_fifo_of_survivors() {
        WriteBuffer b = buffer(100, 10_000);
        for (int round = 0; round < 50; round++) {
            for (int key = 0; key < 20; key++) {
                b.queueWriteWithDedup("k" + key + "-r" + round, WriteOpType.UPDATE_ENTRY, bytes("x"),
                        WritePriority.NORMAL, "k" + key);
            }
        }
        assertEquals(20, b.totalQueued());
        assertEquals(49 * 20, b.getStats().opsDeduplicated());
        List<String> ids = ids(next(b));
        assertEquals("k0-r49", ids.get(0));
        assertEquals("k19-r49", ids.get(19));
    }
}
