package io.writebuffer.metrics;

import com.codahale.metrics.Counter;
import com.codahale.metrics.Gauge;
import com.codahale.metrics.Histogram;
import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;

public class Metrics {
    public static final String PREFIX = "writebuffer.";

    private final MetricRegistry registry;

    public Metrics(MetricRegistry registry) {
        this.registry = registry;
    }

    public MetricRegistry registry() { return registry; }

    public Counter counter(String name) { return registry.counter(PREFIX + name); }
    public Meter meter(String name) { return registry.meter(PREFIX + name); }
    public Timer timer(String name) { return registry.timer(PREFIX + name); }
    public Histogram histogram(String name) { return registry.histogram(PREFIX + name); }

    public <T> void gauge(String name, Gauge<T> gauge) {
        registry.gauge(PREFIX + name, () -> gauge);
    }
}
