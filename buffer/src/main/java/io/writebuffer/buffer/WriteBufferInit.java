package io.writebuffer.buffer;

import io.writebuffer.core.WriteBuffer;

import java.util.Optional;

public record WriteBufferInit(WriteBuffer buffer, Implementation implementation, String fallbackReason) {
    public Optional<String> fallback() { return Optional.ofNullable(fallbackReason); }
}
