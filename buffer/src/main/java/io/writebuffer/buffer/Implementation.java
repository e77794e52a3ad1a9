package io.writebuffer.buffer;

public enum Implementation {
    NATIVE,
    PORTABLE
}
