package com.vigil.engine.probe;

/**
 * A probe request could not be completed: timeout, refused connection, DNS failure, malformed
 * endpoint or interruption. Executors map it to a {@code down} result; it never escapes a run.
 */
public class TransportException extends Exception {

    private final boolean timeout;

    public TransportException(String message, boolean timeout, Throwable cause) {
        super(message, cause);
        this.timeout = timeout;
    }

    /** Whether the request exceeded its timeout, as opposed to failing outright. */
    public boolean isTimeout() {
        return timeout;
    }
}
