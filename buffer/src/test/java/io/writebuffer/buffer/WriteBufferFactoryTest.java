package io.writebuffer.buffer;

import io.writebuffer.config.WriteBufferConfig;
import io.writebuffer.core.WriteBuffer;
import io.writebuffer.retry.RetryPolicy;
import io.writebuffer.spi.WriteBufferProvider;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

public class WriteBufferFactoryTest {
    static class CountingProvider implements WriteBufferProvider {
        final AtomicInteger availabilityChecks = new AtomicInteger();
        final boolean available;
        final boolean failOnCreate;
        CountingProvider(boolean available, boolean failOnCreate) { this.available = available; this.failOnCreate = failOnCreate; }
        @Override public String name() { return "counting"; }
        @Override public boolean isAvailable() { availabilityChecks.incrementAndGet(); return available; }
        @Override public WriteBuffer create(WriteBufferConfig config, RetryPolicy retryPolicy, Clock clock) {
            if (failOnCreate) throw new IllegalStateException("native library missing");
            return new IndexedWriteBuffer(config, retryPolicy, clock);
        }
    }

    static class BrokenPortable implements WriteBufferProvider {
        @Override public String name() { return "broken"; }
        @Override public boolean isAvailable() { return true; }
        @Override public WriteBuffer create(WriteBufferConfig config, RetryPolicy retryPolicy, Clock clock) {
            throw new IllegalStateException("out of luck");
        }
    }

    @Test
    void service_loader_finds_indexed_backend() {
        WriteBufferFactory factory = new WriteBufferFactory();
        assertTrue(factory.checkNativeAvailable());
        WriteBufferInit init = factory.create(WriteBufferConfig.defaults());
        assertEquals(Implementation.NATIVE, init.implementation());
        assertInstanceOf(IndexedWriteBuffer.class, init.buffer());
        assertTrue(init.fallback().isEmpty());
    }

    @Test
    void uses_portable_when_native_not_preferred() {
        WriteBufferFactory factory = new WriteBufferFactory();
        WriteBufferInit init = factory.create(WriteBufferConfig.defaults().withPreferNative(false));
        assertEquals(Implementation.PORTABLE, init.implementation());
        assertInstanceOf(PortableWriteBuffer.class, init.buffer());
        assertTrue(init.fallback().isPresent());
    }

    @Test
    void falls_back_when_native_unavailable() {
        CountingProvider unavailable = new CountingProvider(false, false);
        WriteBufferFactory factory = new WriteBufferFactory(List.of(unavailable), new PortableWriteBufferProvider());
        assertFalse(factory.checkNativeAvailable());
        WriteBufferInit init = factory.create(WriteBufferConfig.defaults());
        assertEquals(Implementation.PORTABLE, init.implementation());
        assertEquals("no native backend available", init.fallbackReason());
    }

    @Test
    void falls_back_when_native_fails_to_start() {
        CountingProvider failing = new CountingProvider(true, true);
        WriteBufferFactory factory = new WriteBufferFactory(List.of(failing), new PortableWriteBufferProvider());
        WriteBufferInit init = factory.create(WriteBufferConfig.defaults());
        assertEquals(Implementation.PORTABLE, init.implementation());
        assertTrue(init.fallbackReason().contains("native library missing"));
    }

    @Test
    void checks_capability_once() {
        CountingProvider provider = new CountingProvider(true, false);
        WriteBufferFactory factory = new WriteBufferFactory(List.of(provider), new PortableWriteBufferProvider());
        factory.checkNativeAvailable();
        factory.create(WriteBufferConfig.defaults());
        factory.create(WriteBufferConfig.defaults());
        assertEquals(1, provider.availabilityChecks.get());
    }

    @Test
    void fails_when_no_backend_starts() {
        WriteBufferFactory factory = new WriteBufferFactory(List.of(new CountingProvider(true, true)), new BrokenPortable());
        assertThrows(WriteBufferInitializationException.class, () -> factory.create(WriteBufferConfig.defaults()));
    }

    @Test
    void native_can_be_disabled_by_property() {
        String before = System.getProperty(IndexedWriteBufferProvider.ENABLED_PROPERTY);
        System.setProperty(IndexedWriteBufferProvider.ENABLED_PROPERTY, "false");
        try {
            assertFalse(new WriteBufferFactory().checkNativeAvailable());
        } finally {
            if (before == null) System.clearProperty(IndexedWriteBufferProvider.ENABLED_PROPERTY);
            else System.setProperty(IndexedWriteBufferProvider.ENABLED_PROPERTY, before);
        }
    }
}
