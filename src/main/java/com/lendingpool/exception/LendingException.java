package com.lendingpool.exception;

import java.util.Objects;

/**
 * Raised whenever a precondition of an accounting operation fails.
 *
 * Thrown inside a transactional boundary, so the whole operation rolls back:
 * there is no partial mutation and no local recovery.
 */
public class LendingException extends RuntimeException {

    private final LendingError error;

    public LendingException(LendingError error, String message) {
        super(message);
        this.error = Objects.requireNonNull(error, "error");
    }

    public LendingException(LendingError error, String message, Throwable cause) {
        super(message, cause);
        this.error = Objects.requireNonNull(error, "error");
    }

    public LendingError getError() {
        return error;
    }

    public static LendingException of(LendingError error, String format, Object... args) {
        return new LendingException(error, String.format(format, args));
    }
}
