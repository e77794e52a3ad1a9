package io.writebuffer.buffer;

import io.writebuffer.config.WriteBufferConfig;
import io.writebuffer.retry.ExponentialBackoffRetryPolicy;
import io.writebuffer.retry.RetryPolicy;
import io.writebuffer.spi.WriteBufferProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Iterator;
import java.util.Objects;
import java.util.Optional;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;

/**
 * Picks the buffer backend: the first available {@link WriteBufferProvider} on the class path when native is
 * preferred, otherwise (or when it fails to start) the portable implementation.
 * The capability probe runs once per factory.
 */
public class WriteBufferFactory {
    private static final Logger LOG = LoggerFactory.getLogger(WriteBufferFactory.class);

    private final Iterable<WriteBufferProvider> candidates;
    private final WriteBufferProvider portable;
    private Optional<WriteBufferProvider> probed; // guarded by this

    public WriteBufferFactory() {
        this(ServiceLoader.load(WriteBufferProvider.class), new PortableWriteBufferProvider());
    }

    public WriteBufferFactory(Iterable<WriteBufferProvider> candidates, WriteBufferProvider portable) {
        this.candidates = Objects.requireNonNull(candidates, "candidates");
        this.portable = Objects.requireNonNull(portable, "portable");
    }

    public boolean checkNativeAvailable() {
        return nativeProvider().isPresent();
    }

    public WriteBufferInit create(WriteBufferConfig config) {
        return create(config, ExponentialBackoffRetryPolicy.fromConfig(config), Clock.systemUTC());
    }

    public WriteBufferInit create(WriteBufferConfig config, RetryPolicy retryPolicy, Clock clock) {
        Objects.requireNonNull(config, "config");
        String reason;
        if (!config.preferNative()) {
            reason = "native backend not preferred by configuration";
        } else {
            Optional<WriteBufferProvider> provider = nativeProvider();
            if (provider.isEmpty()) {
                reason = "no native backend available";
            } else {
                try {
                    WriteBufferInit init = new WriteBufferInit(provider.get().create(config, retryPolicy, clock), Implementation.NATIVE, null);
                    LOG.info("Write buffer initialized with native backend '{}'", provider.get().name());
                    return init;
                } catch (RuntimeException | LinkageError e) {
                    LOG.warn("Native write buffer backend '{}' failed to start, falling back to portable", provider.get().name(), e);
                    reason = "native backend failed: " + e.getMessage();
                }
            }
        }
        try {
            WriteBufferInit init = new WriteBufferInit(portable.create(config, retryPolicy, clock), Implementation.PORTABLE, reason);
            LOG.info("Write buffer initialized with portable backend ({})", reason);
            return init;
        } catch (RuntimeException e) {
            throw new WriteBufferInitializationException("All write buffer backends failed to initialize: " + reason, e);
        }
    }

    private synchronized Optional<WriteBufferProvider> nativeProvider() {
        if (probed == null) probed = probe();
        return probed;
    }

    private Optional<WriteBufferProvider> probe() {
        Iterator<WriteBufferProvider> it = candidates.iterator();
        while (true) {
            WriteBufferProvider candidate;
            try {
                if (!it.hasNext()) return Optional.empty();
                candidate = it.next();
            } catch (ServiceConfigurationError e) {
                LOG.warn("Skipping write buffer provider that could not be loaded", e);
                continue;
            }
            try {
                if (candidate.isAvailable()) return Optional.of(candidate);
                LOG.debug("Write buffer provider '{}' reports itself unavailable", candidate.name());
            } catch (RuntimeException e) {
                LOG.warn("Write buffer provider probe failed", e);
            }
        }
    }
}
