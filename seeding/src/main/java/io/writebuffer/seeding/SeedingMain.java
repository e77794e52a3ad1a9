package io.writebuffer.seeding;

import com.google.inject.Guice;
import com.google.inject.Injector;
import io.writebuffer.admin.BufferAdminServer;
import io.writebuffer.config.Preset;
import io.writebuffer.config.WriteBufferConfig;
import io.writebuffer.core.WriteBufferStats;
import io.writebuffer.core.WriteOperation;
import io.writebuffer.journal.OperationJournal;
import io.writebuffer.runtime.FlushAllResult;
import io.writebuffer.runtime.WriteBufferService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Seeds a JDBC table from a directory of content files through the write buffer.
 * Work that cannot be delivered is journaled and picked up by the next run.
 */
@CommandLine.Command(name = "seed", mixinStandardHelpOptions = true, description = "Bulk-import content files into a database table")
public final class SeedingMain implements Callable<Integer> {
    private static final Logger LOG = LoggerFactory.getLogger(SeedingMain.class);

    @CommandLine.Option(names = {"-i", "--in"}, required = true, description = "Directory of content files")
    Path inputDir;

    @CommandLine.Option(names = {"-u", "--jdbc-url"}, description = "Target database", defaultValue = "jdbc:h2:file:./seeding-db")
    String jdbcUrl;

    @CommandLine.Option(names = "--jdbc-user", description = "Database user")
    String jdbcUser;

    @CommandLine.Option(names = "--jdbc-password", description = "Database password")
    String jdbcPassword;

    @CommandLine.Option(names = {"-t", "--table"}, description = "Target table", defaultValue = "content_entries")
    String table;

    @CommandLine.Option(names = {"-p", "--preset"}, description = "Buffer preset: ${COMPLETION-CANDIDATES}", defaultValue = "SEEDING")
    Preset preset;

    @CommandLine.Option(names = {"-b", "--batch-size"}, description = "Override preset batch size")
    Integer batchSize;

    @CommandLine.Option(names = {"-q", "--max-queue"}, description = "Override preset queue ceiling")
    Integer maxQueue;

    @CommandLine.Option(names = {"-j", "--journal"}, description = "Journal of undelivered operations", defaultValue = "seeding-pending.jsonl")
    Path journalFile;

    @CommandLine.Option(names = "--dlq", description = "File receiving operations dropped after retries", defaultValue = "seeding-dropped.jsonl")
    Path deadLetterFile;

    @CommandLine.Option(names = "--admin-port", description = "Admin HTTP port; -1 disables, 0 picks a free port", defaultValue = "-1")
    int adminPort;

    public static void main(String[] args) {
        System.exit(commandLine().execute(args));
    }

    static CommandLine commandLine() {
        return new CommandLine(new SeedingMain()).setCaseInsensitiveEnumValuesAllowed(true);
    }

    SeedingConfig toConfig() {
        WriteBufferConfig buffer = preset.config();
        if (batchSize != null) buffer = buffer.withBatchSize(batchSize);
        if (maxQueue != null) buffer = buffer.withMaxQueueSize(maxQueue);
        return new SeedingConfig(inputDir, jdbcUrl, jdbcUser, jdbcPassword, table, journalFile, deadLetterFile, adminPort, buffer);
    }

    @Override
    public Integer call() throws Exception {
        if (!Files.isDirectory(inputDir)) {
            System.err.println("Input directory does not exist: " + inputDir);
            return 2;
        }
        SeedingConfig cfg;
        try {
            cfg = toConfig();
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            return 2;
        }
        Injector injector = Guice.createInjector(new SeedingModule(cfg));
        WriteBufferService service = injector.getInstance(WriteBufferService.class);
        JdbcBatchWriter writer = injector.getInstance(JdbcBatchWriter.class);
        OperationJournal journal = injector.getInstance(OperationJournal.class);
        writer.ensureTable();

        BufferAdminServer admin = null;
        try {
            if (cfg.adminEnabled()) {
                admin = new BufferAdminServer(cfg.adminPort(), service);
                admin.start();
            }
            if (journal.exists()) {
                List<WriteOperation> pending = journal.load();
                service.restore(pending);
                LOG.info("Restored {} operations from {}", pending.size(), journal.file());
            }

            ContentDirectoryImporter.ImportSummary imported = injector.getInstance(ContentDirectoryImporter.class).importAll(inputDir);
            FlushAllResult result = service.flushAllWithDetails(writer,
                    (committed, remaining, failed) -> LOG.info("Progress: {} committed, {} remaining, {} failed", committed, remaining, failed));

            List<WriteOperation> leftover = service.drainAll();
            if (leftover.isEmpty()) {
                journal.delete();
            } else {
                journal.save(leftover);
            }

            WriteBufferStats stats = service.getStats();
            System.out.println("Seeding summary: files=" + imported.filesSeen()
                    + " queued=" + imported.queued()
                    + " committed=" + stats.opsCommitted()
                    + " batches=" + stats.batchesFlushed()
                    + " deduplicated=" + stats.opsDeduplicated()
                    + " dropped=" + stats.opsFailed()
                    + " journaled=" + leftover.size());
            if (stats.opsFailed() > 0) {
                LOG.warn("{} operations were dropped, see {}", stats.opsFailed(), cfg.deadLetterFile());
            }
            if (result.aborted()) {
                LOG.warn("Flushing stopped early after repeated failures ({} failed attempts)", result.totalFailed());
            }
            boolean incomplete = imported.stopped() || !leftover.isEmpty() || stats.opsFailed() > 0;
            return incomplete ? 1 : 0;
        } finally {
            if (admin != null) admin.close();
            service.close();
        }
    }
}
