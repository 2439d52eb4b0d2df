package com.vigil.aggregation.transition;

/**
 * The persisted transition state could not be read or written. Fatal for the invocation, so that
 * a lost state never turns into a silent duplicate or a silently missed notification.
 */
public class TransitionStateException extends RuntimeException {

    public TransitionStateException(String message, Throwable cause) {
        super(message, cause);
    }
}
