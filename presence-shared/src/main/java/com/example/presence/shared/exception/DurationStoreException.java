package com.example.presence.shared.exception;

/**
 * Raised when a read or write against the duration ledger fails.
 * Committed presence time is assumed durable, so callers must surface this
 * rather than continue as if the write happened.
 */
public class DurationStoreException extends RuntimeException {

    public DurationStoreException(String message) {
        super(message);
    }

    public DurationStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
