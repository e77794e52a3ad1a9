package io.writebuffer.core;

import java.util.Locale;

public enum WritePriority {
    /** Identity, authentication, consent: flushed as soon as possible. */
    HIGH(0),
    NORMAL(1),
    BULK(2);

    private final int code;

    WritePriority(int code) { this.code = code; }

    public int code() { return code; }

    public static WritePriority fromCode(int code) {
        for (WritePriority p : values()) {
            if (p.code == code) return p;
        }
        throw new IllegalArgumentException("Unknown write priority code: " + code);
    }

    public static WritePriority parse(String name) {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("Write priority must not be blank");
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown write priority: " + name, e);
        }
    }
}
