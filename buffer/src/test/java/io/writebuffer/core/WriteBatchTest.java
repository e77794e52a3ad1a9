package io.writebuffer.core;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class WriteBatchTest {
    static WriteOperation op(String id, WritePriority p) {
        return new WriteOperation(id, WriteOpType.CREATE_ENTRY, new byte[]{1}, p, Instant.EPOCH, 0, null);
    }

    @Test
    void priority_is_highest_among_operations() {
        WriteBatch batch = new WriteBatch("b", List.of(op("a", WritePriority.BULK), op("b", WritePriority.NORMAL)), Instant.EPOCH);
        assertEquals(WritePriority.NORMAL, batch.priority());
        assertEquals(2, batch.size());
    }

    @Test
    void operations_are_an_immutable_copy() {
        List<WriteOperation> ops = new ArrayList<>(List.of(op("a", WritePriority.NORMAL)));
        WriteBatch batch = new WriteBatch("b", ops, Instant.EPOCH);
        ops.add(op("x", WritePriority.HIGH));
        assertEquals(1, batch.size());
        assertThrows(UnsupportedOperationException.class, () -> batch.operations().add(op("y", WritePriority.HIGH)));
    }

    @Test
    void rejects_empty_batch() {
        assertThrows(IllegalArgumentException.class, () -> new WriteBatch("b", List.of(), Instant.EPOCH));
    }

    @Test
    void lifecycle_only_moves_forward() {
        WriteBatch batch = new WriteBatch("b", List.of(op("a", WritePriority.NORMAL)), Instant.EPOCH);
        assertEquals(BatchState.PENDING, batch.state());
        assertThrows(IllegalStateException.class, () -> batch.transition(BatchState.PENDING, BatchState.COMMITTED));
        batch.transition(BatchState.PENDING, BatchState.IN_FLIGHT);
        batch.transition(BatchState.IN_FLIGHT, BatchState.FAILED);
        assertTrue(batch.state().isTerminal());
        assertThrows(IllegalStateException.class, () -> batch.transition(BatchState.FAILED, BatchState.IN_FLIGHT));
    }
}
