package io.peerbench.bank.error;

import java.io.IOException;

/**
 * A single unit of remote work failed (connection error, timeout, non-200 status).
 * Retried, then recorded and skipped; never fatal to the run.
 */
public class TransientFetchException extends IOException {
    private final int statusCode;

    public TransientFetchException(String message) {
        this(message, -1, null);
    }

    public TransientFetchException(String message, Throwable cause) {
        this(message, -1, cause);
    }

    public TransientFetchException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /** HTTP status of the failed call, or -1 when no response arrived. */
    public int statusCode() { return statusCode; }
}
