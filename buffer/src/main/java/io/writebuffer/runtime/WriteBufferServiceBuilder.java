package io.writebuffer.runtime;

import com.codahale.metrics.MetricRegistry;
import io.writebuffer.buffer.WriteBufferFactory;
import io.writebuffer.buffer.WriteBufferInit;
import io.writebuffer.config.WriteBufferConfig;
import io.writebuffer.error.DeadLetterSink;
import io.writebuffer.metrics.Metrics;
import io.writebuffer.retry.ExponentialBackoffRetryPolicy;
import io.writebuffer.retry.RetryPolicy;

import java.time.Clock;
import java.util.Objects;

public class WriteBufferServiceBuilder {
    private WriteBufferConfig config = WriteBufferConfig.defaults();
    private RetryPolicy retryPolicy; // defaults to one derived from config
    private WriteBufferFactory factory = new WriteBufferFactory();
    private MetricRegistry metricRegistry = new MetricRegistry();
    private DeadLetterSink deadLetters;
    private Clock clock = Clock.systemUTC();

    public WriteBufferServiceBuilder config(WriteBufferConfig c) { this.config = c; return this; }
    public WriteBufferServiceBuilder retry(RetryPolicy r) { this.retryPolicy = r; return this; }
    public WriteBufferServiceBuilder factory(WriteBufferFactory f) { this.factory = f; return this; }
    public WriteBufferServiceBuilder metrics(MetricRegistry r) { this.metricRegistry = r; return this; }
    public WriteBufferServiceBuilder deadLetters(DeadLetterSink d) { this.deadLetters = d; return this; }
    public WriteBufferServiceBuilder clock(Clock c) { this.clock = c; return this; }

    public WriteBufferService build() {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(factory, "factory");
        Objects.requireNonNull(metricRegistry, "metricRegistry");
        Objects.requireNonNull(clock, "clock");
        RetryPolicy retry = retryPolicy != null ? retryPolicy : ExponentialBackoffRetryPolicy.fromConfig(config);
        WriteBufferInit init = factory.create(config, retry, clock);
        return new WriteBufferService(init.buffer(), init.implementation(), config, retry, new Metrics(metricRegistry), deadLetters);
    }
}
