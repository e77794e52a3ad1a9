package io.writebuffer.runtime;

import com.codahale.metrics.MetricRegistry;
import io.writebuffer.buffer.Implementation;
import io.writebuffer.config.WriteBufferConfig;
import io.writebuffer.core.WriteBufferStats;
import io.writebuffer.core.WriteOpType;
import io.writebuffer.core.WriteOperation;
import io.writebuffer.core.WritePriority;
import io.writebuffer.error.DeadLetterSink;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

public class WriteBufferServiceTest {
    static class CollectingDeadLetters implements DeadLetterSink {
        final List<String> dropped = new CopyOnWriteArrayList<>();
        volatile boolean closed;
        @Override public void acceptDropped(WriteOperation op, String reason) { dropped.add(op.opId() + ":" + reason); }
        @Override public void close() { closed = true; }
    }

    WriteBufferService service;
    final CollectingDeadLetters dlq = new CollectingDeadLetters();
    final MetricRegistry registry = new MetricRegistry();

    @AfterEach
    void tearDown() {
        if (service != null) service.close();
    }

    WriteBufferService service(WriteBufferConfig cfg) {
        service = new WriteBufferServiceBuilder()
                .config(cfg.withInterBatchDelayMillis(0))
                .metrics(registry)
                .deadLetters(dlq)
                .build();
        return service;
    }

    static byte[] payload(int i) { return ("entry-" + i).getBytes(); }

    @Test
    void flush_all_commits_everything_in_bounded_batches() {
        WriteBufferService s = service(WriteBufferConfig.defaults().withBatchSize(100).withMaxQueueSize(1_000));
        for (int i = 0; i < 250; i++) {
            assertTrue(s.queueCreateEntry("op-" + i, payload(i), WritePriority.BULK));
        }
        List<Integer> sizes = new ArrayList<>();
        List<Integer> remaining = new ArrayList<>();
        FlushAllResult result = s.flushAllWithDetails(batch -> {
            sizes.add(batch.size());
            return BatchOutcome.committed();
        }, (committed, left, failed) -> remaining.add(left));

        assertEquals(250, result.totalCommitted());
        assertEquals(3, result.batchCount());
        assertFalse(result.aborted());
        assertEquals(List.of(100, 100, 50), sizes);
        assertEquals(List.of(150, 50, 0), remaining);
        assertEquals(0, s.totalQueued());
        assertEquals(0, s.inFlightCount());
        assertEquals(250, s.getStats().opsCommitted());
        assertEquals(250, registry.meter("writebuffer.ops.committed").getCount());
        assertEquals(3, registry.histogram("writebuffer.batch.size").getCount());
    }

    @Test
    void flush_batch_on_empty_buffer_does_not_call_function() {
        WriteBufferService s = service(WriteBufferConfig.defaults());
        AtomicInteger calls = new AtomicInteger();
        assertNull(s.flushBatch(batch -> { calls.incrementAndGet(); return null; }));
        assertEquals(0, calls.get());
        assertEquals(0, s.flushAll(batch -> null));
    }

    @Test
    void transport_failure_requeues_the_batch() {
        WriteBufferService s = service(WriteBufferConfig.defaults());
        s.queueCreateEntry("a", payload(1), WritePriority.NORMAL);
        s.queueCreateLink("b", payload(2), WritePriority.NORMAL);

        FlushResult r = s.flushBatch(batch -> { throw new IOException("connection reset"); });
        assertFalse(r.success());
        assertEquals("connection reset", r.error());
        assertEquals(List.of("a", "b"), r.failedOperationIds());
        assertTrue(r.droppedOperationIds().isEmpty());
        assertEquals(2, s.getStats().retryCount());
        assertEquals(1, registry.meter("writebuffer.flush.errors").getCount());
    }

    @Test
    void per_operation_results_reconcile_partially() {
        WriteBufferService s = service(WriteBufferConfig.defaults());
        s.queueCreateEntry("a", payload(1), WritePriority.NORMAL);
        s.queueCreateEntry("b", payload(2), WritePriority.NORMAL);
        s.queueCreateEntry("c", payload(3), WritePriority.NORMAL);

        FlushResult r = s.flushBatch(batch -> BatchOutcome.of(List.of(
                OperationResult.ok("a"), OperationResult.failed("b", "constraint violation"), OperationResult.ok("c"))));
        assertFalse(r.success());
        assertEquals(2, r.successCount());
        assertEquals(1, r.failureCount());
        assertEquals(List.of("b"), r.failedOperationIds());
        assertEquals("constraint violation", r.error());
        WriteBufferStats stats = s.getStats();
        assertEquals(2, stats.opsCommitted());
        assertEquals(1, stats.retryCount());
    }

    @Test
    void all_operations_failing_fails_the_batch() {
        WriteBufferService s = service(WriteBufferConfig.defaults());
        s.queueCreateEntry("a", payload(1), WritePriority.NORMAL);
        FlushResult r = s.flushBatch(batch -> BatchOutcome.of(List.of(OperationResult.failed("a", "nope"))));
        assertEquals(0, r.successCount());
        assertEquals("nope", r.error());
        assertEquals(1, s.getStats().retryCount());
    }

    @Test
    void failed_outcome_without_error_uses_default_message() {
        WriteBufferService s = service(WriteBufferConfig.defaults());
        s.queueCreateEntry("a", payload(1), WritePriority.NORMAL);
        FlushResult r = s.flushBatch(batch -> BatchOutcome.failed(null));
        assertEquals("Batch failed", r.error());
    }

    @Test
    void flush_all_stops_after_consecutive_failures() {
        WriteBufferService s = service(WriteBufferConfig.defaults().withBatchSize(1).withMaxRetries(10));
        for (int i = 0; i < 5; i++) s.queueCreateEntry("op-" + i, payload(i), WritePriority.NORMAL);

        AtomicInteger calls = new AtomicInteger();
        FlushAllResult result = s.flushAllWithDetails(batch -> {
            calls.incrementAndGet();
            return BatchOutcome.failed("backend down");
        }, null);

        assertTrue(result.aborted());
        assertEquals(3, calls.get());
        assertEquals(3, result.batchCount());
        assertEquals(0, result.totalCommitted());
        assertEquals(5, s.totalQueued());
    }

    @Test
    void exhausted_operations_reach_dead_letter_sink() {
        WriteBufferService s = service(WriteBufferConfig.defaults().withMaxRetries(0));
        s.queueCreateEntry("a", payload(1), WritePriority.NORMAL);
        FlushAllResult result = s.flushAllWithDetails(batch -> { throw new IllegalStateException("rejected"); }, null);

        assertEquals(List.of("a"), result.droppedOperationIds());
        assertEquals(List.of("a:rejected"), dlq.dropped);
        assertEquals(1, s.getStats().opsFailed());
        assertEquals(1, registry.meter("writebuffer.ops.failed").getCount());
        assertEquals(0, s.totalQueued());
    }

    @Test
    void entry_updates_collapse_on_entry_hash() {
        WriteBufferService s = service(WriteBufferConfig.defaults());
        s.queueUpdateEntry("u1", "hash-1", payload(1), WritePriority.NORMAL);
        s.queueUpdateEntry("u2", "hash-1", payload(2), WritePriority.NORMAL);
        s.queueIdentityWrite("id1", "agent-1", payload(3));
        assertEquals(2, s.totalQueued());
        assertEquals(1, s.getStats().highCount());

        List<String> sent = new ArrayList<>();
        s.flushAll(batch -> {
            batch.operations().forEach(op -> sent.add(op.opId()));
            return null;
        });
        assertEquals(List.of("id1", "u2"), sent);
    }

    @Test
    void superseded_writes_are_not_counted_as_failed() {
        WriteBufferService s = service(WriteBufferConfig.defaults());
        s.queueCreateEntry("a", payload(1), WritePriority.NORMAL);
        s.queueUpdateEntry("u1", "hash-1", payload(2), WritePriority.NORMAL);

        FlushResult r = s.flushBatch(batch -> {
            s.queueUpdateEntry("u2", "hash-1", payload(3), WritePriority.NORMAL);
            throw new IOException("connection reset");
        });
        assertFalse(r.success());
        assertEquals(2, r.operationCount());
        assertEquals(1, r.failureCount());
        assertEquals(List.of("a"), r.failedOperationIds());

        FlushAllResult rest = s.flushAllWithDetails(batch -> BatchOutcome.committed(), null);
        assertEquals(2, rest.totalCommitted());
        assertEquals(0, rest.totalFailed());
        assertEquals(1, s.getStats().opsDeduplicated());
    }

    @Test
    void stats_listeners_see_changes_and_failures_are_contained() {
        WriteBufferService s = service(WriteBufferConfig.defaults());
        List<Integer> totals = new ArrayList<>();
        s.addStatsListener(stats -> { throw new IllegalStateException("listener bug"); });
        s.addStatsListener(stats -> totals.add(stats.totalQueued()));

        s.queueCreateEntry("a", payload(1), WritePriority.NORMAL);
        s.queueCreateEntry("b", payload(2), WritePriority.NORMAL);
        s.flushBatch(batch -> null);
        assertEquals(List.of(1, 2, 0), totals);
    }

    @Test
    void async_flush_reconciles_on_completion() throws Exception {
        WriteBufferService s = service(WriteBufferConfig.defaults());
        s.queueCreateEntry("a", payload(1), WritePriority.NORMAL);
        CompletableFuture<BatchOutcome> pending = new CompletableFuture<>();

        CompletableFuture<FlushResult> result = s.flushBatchAsync(batch -> pending).toCompletableFuture();
        assertTrue(s.isFlushing());
        assertEquals(1, s.inFlightCount());
        pending.complete(BatchOutcome.committed());

        FlushResult r = result.get(5, TimeUnit.SECONDS);
        assertTrue(r.success());
        assertFalse(s.isFlushing());
        assertEquals(0, s.inFlightCount());
    }

    @Test
    void async_flush_failure_requeues() throws Exception {
        WriteBufferService s = service(WriteBufferConfig.defaults());
        s.queueCreateEntry("a", payload(1), WritePriority.NORMAL);
        FlushResult r = s.flushBatchAsync(batch -> CompletableFuture.failedFuture(new IOException("gone")))
                .toCompletableFuture().get(5, TimeUnit.SECONDS);
        assertFalse(r.success());
        assertEquals("gone", r.error());
        assertEquals(1, s.getStats().retryCount());
    }

    @Test
    void auto_flush_sends_urgent_writes() throws Exception {
        WriteBufferService s = service(WriteBufferConfig.defaults());
        CopyOnWriteArrayList<String> sent = new CopyOnWriteArrayList<>();
        s.startAutoFlush(batch -> {
            batch.operations().forEach(op -> sent.add(op.opId()));
            return null;
        }, Duration.ofMillis(5));
        assertTrue(s.isAutoFlushing());
        s.queueIdentityWrite("id-1", "agent-1", payload(1));

        long deadline = System.currentTimeMillis() + 5_000;
        while (sent.isEmpty() && System.currentTimeMillis() < deadline) Thread.sleep(10);
        assertEquals(List.of("id-1"), sent);
        s.stopAutoFlush();
        assertFalse(s.isAutoFlushing());
    }

    @Test
    void external_driver_can_reconcile_batches() {
        WriteBufferService s = service(WriteBufferConfig.defaults());
        s.queueCreateEntry("a", payload(1), WritePriority.NORMAL);
        s.queueCreateEntry("b", payload(2), WritePriority.NORMAL);
        String batchId = s.getPendingBatch().batch().batchId();
        assertEquals(1, s.markOperationsFailed(batchId, List.of("a")).committedCount());
        assertEquals(1, registry.meter("writebuffer.ops.committed").getCount());
    }

    @Test
    void close_releases_buffer_and_sink() {
        WriteBufferService s = service(WriteBufferConfig.defaults());
        assertEquals(Implementation.NATIVE, s.implementation());
        s.queueCreateEntry("a", payload(1), WritePriority.NORMAL);
        s.close();
        assertTrue(dlq.closed);
        assertEquals(0, s.totalQueued());
        service = null;
    }
}
