package com.kgbio.lookup.exception;

/**
 * Base type for hard failures raised by the lookup core. "Not found" is never one of these;
 * it is returned as a {@link com.kgbio.lookup.model.LookupOutcome}.
 */
public class LookupException extends RuntimeException {
    public LookupException(String message) {
        super(message);
    }

    public LookupException(String message, Throwable cause) {
        super(message, cause);
    }
}
