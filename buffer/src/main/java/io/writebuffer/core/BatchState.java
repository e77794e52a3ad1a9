package io.writebuffer.core;

public enum BatchState {
    PENDING,
    IN_FLIGHT,
    COMMITTED,
    FAILED;

    public boolean canMoveTo(BatchState next) {
        return switch (this) {
            case PENDING -> next == IN_FLIGHT;
            case IN_FLIGHT -> next == COMMITTED || next == FAILED;
            case COMMITTED, FAILED -> false;
        };
    }

    public boolean isTerminal() { return this == COMMITTED || this == FAILED; }
}
