package io.writebuffer.seeding;

import com.codahale.metrics.MetricRegistry;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import io.writebuffer.buffer.WriteBufferFactory;
import io.writebuffer.config.WriteBufferConfig;
import io.writebuffer.error.DeadLetterSink;
import io.writebuffer.error.FileDeadLetterSink;
import io.writebuffer.journal.OperationJournal;
import io.writebuffer.retry.ExponentialBackoffRetryPolicy;
import io.writebuffer.runtime.WriteBufferService;
import io.writebuffer.runtime.WriteBufferServiceBuilder;

import java.io.IOException;

public class SeedingModule extends AbstractModule {
    private final SeedingConfig config;

    public SeedingModule(SeedingConfig config) { this.config = config; }

    @Override
    protected void configure() {
        bind(SeedingConfig.class).toInstance(config);
        bind(WriteBufferConfig.class).toInstance(config.buffer());
    }

    @Provides @Singleton MetricRegistry metricRegistry() { return new MetricRegistry(); }

    @Provides @Singleton WriteBufferFactory factory() { return new WriteBufferFactory(); }

    @Provides @Singleton DeadLetterSink deadLetters() throws IOException { return new FileDeadLetterSink(config.deadLetterFile()); }

    @Provides @Singleton OperationJournal journal() { return new OperationJournal(config.journalFile()); }

    @Provides @Singleton JdbcBatchWriter writer() {
        return new JdbcBatchWriter(config.jdbcUrl(), config.jdbcUser(), config.jdbcPassword(), config.table());
    }

    @Provides @Singleton WriteBufferService service(WriteBufferConfig cfg, WriteBufferFactory factory, MetricRegistry registry, DeadLetterSink dlq) {
        return new WriteBufferServiceBuilder()
                .config(cfg)
                .factory(factory)
                .retry(ExponentialBackoffRetryPolicy.fromConfig(cfg))
                .metrics(registry)
                .deadLetters(dlq)
                .build();
    }

    @Provides ContentDirectoryImporter importer(WriteBufferService service, JdbcBatchWriter writer) {
        return new ContentDirectoryImporter(service, writer);
    }
}
