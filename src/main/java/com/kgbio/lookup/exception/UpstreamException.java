package com.kgbio.lookup.exception;

/**
 * Non-success response, timeout or connection failure from the search endpoint or the query service.
 */
public class UpstreamException extends LookupException {
    private final int status;

    public UpstreamException(String message, int status) {
        super(message);
        this.status = status;
    }

    public UpstreamException(String message, Throwable cause) {
        super(message, cause);
        this.status = -1;
    }

    /** HTTP status of the failed call, or -1 when no status applies (no response, or a malformed 200 body). */
    public int getStatus() { return status; }
}
