package com.kgbio.lookup.exception;

/**
 * Malformed identifier, language tag or out-of-range year. Local input error, never retried.
 */
public class ValidationException extends LookupException {
    public ValidationException(String message) {
        super(message);
    }
}
