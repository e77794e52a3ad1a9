package io.writebuffer.buffer;

public class WriteBufferInitializationException extends RuntimeException {
    public WriteBufferInitializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
