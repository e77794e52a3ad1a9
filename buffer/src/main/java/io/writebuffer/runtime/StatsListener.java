package io.writebuffer.runtime;

import io.writebuffer.core.WriteBufferStats;

@FunctionalInterface
public interface StatsListener {
    void onStats(WriteBufferStats stats);
}
