package com.vigil.resultstore;

/**
 * A partition could not be read or appended. Fatal for the invocation: callers must not degrade
 * it to "no data", which would be indistinguishable from a genuine gap.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
