package io.writebuffer.buffer;

import io.writebuffer.core.WritePriority;

import java.util.List;

enum Lane {
    RETRY,
    HIGH,
    NORMAL,
    BULK;

    static final List<Lane> FORMATION_ORDER = List.of(values());

    static Lane of(WritePriority priority) {
        return switch (priority) {
            case HIGH -> HIGH;
            case NORMAL -> NORMAL;
            case BULK -> BULK;
        };
    }
}
