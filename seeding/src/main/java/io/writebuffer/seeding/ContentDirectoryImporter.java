package io.writebuffer.seeding;

import io.writebuffer.core.WriteOpType;
import io.writebuffer.core.WritePriority;
import io.writebuffer.runtime.FlushFunction;
import io.writebuffer.runtime.FlushResult;
import io.writebuffer.runtime.WriteBufferService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Queues every regular file of a directory as a bulk {@code CREATE_ENTRY}, keyed by file name.
 * When the buffer is full it flushes a batch to make room instead of dropping the file.
 */
public class ContentDirectoryImporter {
    private static final Logger LOG = LoggerFactory.getLogger(ContentDirectoryImporter.class);

    public record ImportSummary(int filesSeen, int queued, int batchesFlushedForRoom, boolean stopped) {}

    private final WriteBufferService service;
    private final FlushFunction flushFn;

    public ContentDirectoryImporter(WriteBufferService service, FlushFunction flushFn) {
        this.service = service;
        this.flushFn = flushFn;
    }

    public ImportSummary importAll(Path dir) throws IOException {
        List<Path> files;
        try (Stream<Path> s = Files.list(dir)) {
            files = s.filter(Files::isRegularFile).sorted().collect(Collectors.toList());
        }
        int maxFailures = service.config().maxConsecutiveFailures();
        int queued = 0;
        int flushes = 0;
        int consecutiveFailures = 0;
        for (Path file : files) {
            String name = file.getFileName().toString();
            byte[] content = Files.readAllBytes(file);
            while (!service.queueWriteWithDedup(name, WriteOpType.CREATE_ENTRY, content, WritePriority.BULK, name)) {
                FlushResult r = service.flushBatch(flushFn);
                if (r == null) {
                    throw new IllegalStateException("Buffer rejected " + name + " but has nothing to flush");
                }
                flushes++;
                consecutiveFailures = r.successCount() > 0 ? 0 : consecutiveFailures + 1;
                if (consecutiveFailures >= maxFailures) {
                    LOG.warn("Stopping import at {}: {} flushes in a row made no progress", name, consecutiveFailures);
                    return new ImportSummary(files.size(), queued, flushes, true);
                }
            }
            queued++;
        }
        LOG.info("Queued {} files from {} ({} flushes to make room)", queued, dir, flushes);
        return new ImportSummary(files.size(), queued, flushes, false);
    }
}
