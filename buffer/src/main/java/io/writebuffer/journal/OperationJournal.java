package io.writebuffer.journal;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.writebuffer.core.WriteOpType;
import io.writebuffer.core.WriteOperation;
import io.writebuffer.core.WritePriority;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Keeps drained operations on disk between runs, one JSON object per line.
 * {@link #save} replaces the whole file atomically where the file system allows it.
 */
public class OperationJournal {
    private static final Logger LOG = LoggerFactory.getLogger(OperationJournal.class);

    private final Path file;
    private final ObjectMapper mapper;

    public OperationJournal(Path file) {
        this(file, new ObjectMapper());
    }

    public OperationJournal(Path file, ObjectMapper mapper) {
        this.file = Objects.requireNonNull(file, "file");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public Path file() { return file; }

    public boolean exists() { return Files.isRegularFile(file); }

    public void save(Collection<WriteOperation> operations) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        try (BufferedWriter w = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8)) {
            for (WriteOperation op : operations) {
                w.write(mapper.writeValueAsString(JournalEntry.of(op)));
                w.newLine();
            }
        }
        try {
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (java.nio.file.AtomicMoveNotSupportedException e) {
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
        }
        LOG.info("Journaled {} operations to {}", operations.size(), file);
    }

    /** Returns the saved operations in file order; empty when there is no journal. */
    public List<WriteOperation> load() throws IOException {
        if (!exists()) return List.of();
        List<WriteOperation> ops = new ArrayList<>();
        int lineNo = 0;
        try (BufferedReader r = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            while ((line = r.readLine()) != null) {
                lineNo++;
                if (line.isBlank()) continue;
                try {
                    ops.add(mapper.readValue(line, JournalEntry.class).toOperation());
                } catch (JsonProcessingException | IllegalArgumentException | DateTimeParseException e) {
                    throw new IOException("Corrupt journal entry at " + file + ":" + lineNo, e);
                }
            }
        }
        LOG.info("Loaded {} operations from {}", ops.size(), file);
        return ops;
    }

    public void delete() throws IOException {
        Files.deleteIfExists(file);
    }

    public record JournalEntry(
            String opId,
            String opType,
            String priority,
            String payload,
            String queuedAt,
            int retryCount,
            String dedupKey
    ) {
        static JournalEntry of(WriteOperation op) {
            return new JournalEntry(op.opId(), op.opType().name(), op.priority().name(),
                    Base64.getEncoder().encodeToString(op.payload()), op.queuedAt().toString(),
                    op.retryCount(), op.dedupKey());
        }

        WriteOperation toOperation() {
            if (queuedAt == null) throw new IllegalArgumentException("queuedAt missing for " + opId);
            byte[] bytes = payload == null ? new byte[0] : Base64.getDecoder().decode(payload);
            return new WriteOperation(opId, WriteOpType.parse(opType), bytes, WritePriority.parse(priority),
                    Instant.parse(queuedAt), retryCount, dedupKey);
        }
    }
}
