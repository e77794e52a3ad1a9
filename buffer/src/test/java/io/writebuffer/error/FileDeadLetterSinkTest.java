package io.writebuffer.error;

import io.writebuffer.core.WriteOpType;
import io.writebuffer.core.WriteOperation;
import io.writebuffer.core.WritePriority;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class FileDeadLetterSinkTest {
    @Test
    void appends_one_line_per_dropped_operation() throws Exception {
        Path dir = Files.createTempDirectory("dlq-test");
        Path file = dir.resolve("nested/dropped.jsonl");
        FileDeadLetterSink sink = new FileDeadLetterSink(file);
        sink.acceptDropped(new WriteOperation("op-1", WriteOpType.CREATE_ENTRY, new byte[]{1, 2, 3},
                WritePriority.BULK, Instant.EPOCH, 4, null), "backend said \"no\"");
        sink.acceptDropped(new WriteOperation("op-2", WriteOpType.UPDATE_ENTRY, new byte[0],
                WritePriority.HIGH, Instant.EPOCH, 4, "hash-2"), "timeout\nagain");

        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        assertEquals(2, lines.size());
        assertTrue(lines.get(0).contains("\"opId\":\"op-1\""));
        assertTrue(lines.get(0).contains("\"payloadBytes\":3"));
        assertTrue(lines.get(0).contains("\"dedupKey\":null"));
        assertTrue(lines.get(1).contains("\"dedupKey\":\"hash-2\""));
        assertTrue(lines.get(1).contains("timeout again"));
    }
}
