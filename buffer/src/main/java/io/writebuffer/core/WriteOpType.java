package io.writebuffer.core;

import java.util.Locale;

public enum WriteOpType {
    CREATE_ENTRY(0),
    UPDATE_ENTRY(1),
    DELETE_ENTRY(2),
    CREATE_LINK(3),
    DELETE_LINK(4);

    private final int code;

    WriteOpType(int code) { this.code = code; }

    public int code() { return code; }

    public static WriteOpType fromCode(int code) {
        for (WriteOpType t : values()) {
            if (t.code == code) return t;
        }
        throw new IllegalArgumentException("Unknown write op type code: " + code);
    }

    public static WriteOpType parse(String name) {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("Write op type must not be blank");
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown write op type: " + name, e);
        }
    }
}
