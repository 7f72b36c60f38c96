package com.kgbio.lookup.exception;

/**
 * Query service answered with a body that is not well-formed SPARQL JSON results.
 */
public class ResultParseException extends LookupException {
    public ResultParseException(String message) {
        super(message);
    }

    public ResultParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
