package io.writebuffer.error;

import io.writebuffer.core.WriteOperation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;

/** Appends one JSON line per dropped operation. The payload is not written, only its size. */
public class FileDeadLetterSink implements DeadLetterSink {
    private static final Logger LOG = LoggerFactory.getLogger(FileDeadLetterSink.class);

    private final Path file;

    public FileDeadLetterSink(Path file) throws IOException {
        this.file = file;
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        if (!Files.exists(file)) {
            Files.writeString(file, "", StandardCharsets.UTF_8, StandardOpenOption.CREATE);
        }
    }

    public Path file() { return file; }

    @Override
    public synchronized void acceptDropped(WriteOperation op, String reason) {
        String json = String.format(
                "{\"ts\":\"%s\",\"opId\":\"%s\",\"opType\":\"%s\",\"priority\":\"%s\",\"retryCount\":%d,\"dedupKey\":%s,\"payloadBytes\":%d,\"reason\":\"%s\"}%n",
                Instant.now(), safe(op.opId()), op.opType(), op.priority(), op.retryCount(),
                op.hasDedupKey() ? "\"" + safe(op.dedupKey()) + "\"" : "null",
                op.payloadLength(), safe(String.valueOf(reason))
        );
        try {
            Files.writeString(file, json, StandardCharsets.UTF_8, StandardOpenOption.APPEND);
        } catch (IOException e) {
            LOG.error("Could not record dropped operation {} in {}", op.opId(), file, e);
        }
    }

    private static String safe(String s) {
        return s.replace("\\", "\\\\").replace("\"", "'").replace("\n", " ").replace("\r", " ");
    }
}
