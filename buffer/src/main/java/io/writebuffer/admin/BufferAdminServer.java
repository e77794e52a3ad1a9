package io.writebuffer.admin;

import com.codahale.metrics.Counter;
import com.codahale.metrics.Gauge;
import com.codahale.metrics.Histogram;
import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Snapshot;
import com.codahale.metrics.Timer;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import io.writebuffer.core.WriteBufferStats;
import io.writebuffer.runtime.WriteBufferService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Minimal admin server providing buffer status, JSON metrics and a health probe.
 * Port 0 binds an ephemeral port; see {@link #port()}.
 */
public class BufferAdminServer implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(BufferAdminServer.class);
    private static final double NANOS_PER_MS = TimeUnit.MILLISECONDS.toNanos(1);

    private final HttpServer server;
    private final ExecutorService executor;
    private final WriteBufferService service;
    private final ObjectMapper mapper = new ObjectMapper();

    public BufferAdminServer(int port, WriteBufferService service) throws IOException {
        this.service = service;
        this.server = HttpServer.create(new InetSocketAddress(port), 0);
        this.executor = Executors.newFixedThreadPool(2, r -> {
            Thread t = new Thread(r, "write-buffer-admin");
            t.setDaemon(true);
            return t;
        });
        server.createContext("/status", new JsonHandler(this::status));
        server.createContext("/metrics", new JsonHandler(this::metrics));
        server.createContext("/health", new JsonHandler(this::health));
        server.setExecutor(executor);
    }

    public void start() {
        server.start();
        LOG.info("Admin server listening on port {}", port());
    }

    public int port() { return server.getAddress().getPort(); }

    @Override
    public void close() {
        server.stop(0);
        executor.shutdownNow();
    }

    private ObjectNode status() {
        WriteBufferStats s = service.getStats();
        ObjectNode node = mapper.valueToTree(s);
        node.put("totalQueued", s.totalQueued());
        node.put("backpressured", service.isBackpressured());
        node.put("implementation", service.implementation().name());
        node.put("flushing", service.isFlushing());
        node.put("autoFlushing", service.isAutoFlushing());
        return node;
    }

    private ObjectNode metrics() {
        MetricRegistry registry = service.metrics().registry();
        ObjectNode node = mapper.createObjectNode();
        for (Map.Entry<String, Gauge> e : registry.getGauges().entrySet()) {
            node.putPOJO(e.getKey(), e.getValue().getValue());
        }
        for (Map.Entry<String, Counter> e : registry.getCounters().entrySet()) {
            node.put(e.getKey(), e.getValue().getCount());
        }
        for (Map.Entry<String, Meter> e : registry.getMeters().entrySet()) {
            ObjectNode m = node.putObject(e.getKey());
            m.put("count", e.getValue().getCount());
            m.put("rate1m", e.getValue().getOneMinuteRate());
        }
        for (Map.Entry<String, Histogram> e : registry.getHistograms().entrySet()) {
            Snapshot snap = e.getValue().getSnapshot();
            ObjectNode h = node.putObject(e.getKey());
            h.put("count", e.getValue().getCount());
            h.put("mean", snap.getMean());
            h.put("p95", snap.get95thPercentile());
        }
        for (Map.Entry<String, Timer> e : registry.getTimers().entrySet()) {
            Snapshot snap = e.getValue().getSnapshot();
            ObjectNode t = node.putObject(e.getKey());
            t.put("count", e.getValue().getCount());
            t.put("meanMs", snap.getMean() / NANOS_PER_MS);
            t.put("p99Ms", snap.get99thPercentile() / NANOS_PER_MS);
        }
        return node;
    }

    private ObjectNode health() {
        ObjectNode node = mapper.createObjectNode();
        boolean backpressured = service.isBackpressured();
        node.put("status", backpressured ? "DEGRADED" : "UP");
        node.put("backpressure", service.backpressure());
        return node;
    }

    private interface Body {
        ObjectNode build();
    }

    private class JsonHandler implements HttpHandler {
        private final Body body;
        JsonHandler(Body body) { this.body = body; }

        @Override
        public void handle(HttpExchange exchange) throws IOException {
            try {
                if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                    exchange.sendResponseHeaders(405, -1);
                    return;
                }
                byte[] bytes;
                int code = 200;
                try {
                    bytes = mapper.writeValueAsBytes(body.build());
                } catch (RuntimeException e) {
                    LOG.warn("Admin request {} failed", exchange.getRequestURI(), e);
                    code = 500;
                    bytes = mapper.writeValueAsBytes(Map.of("error", String.valueOf(e.getMessage())));
                }
                exchange.getResponseHeaders().add("Content-Type", "application/json; charset=utf-8");
                exchange.sendResponseHeaders(code, bytes.length);
                try (OutputStream os = exchange.getResponseBody()) { os.write(bytes); }
            } finally {
                exchange.close();
            }
        }
    }
}
