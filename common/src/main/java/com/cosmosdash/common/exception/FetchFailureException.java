package com.cosmosdash.common.exception;

/**
 * Upstream source unreachable, answered non-2xx, returned a malformed body,
 * or did not answer before the invocation deadline.
 * Never fatal; the next scheduled tick retries.
 */
public class FetchFailureException extends CosmosException {

    private final String source;

    public FetchFailureException(String source, String message) {
        super("SYNC-FETCH", "Fetch from " + source + " failed: " + message);
        this.source = source;
    }

    public FetchFailureException(String source, String message, Throwable cause) {
        super("SYNC-FETCH", "Fetch from " + source + " failed: " + message, cause);
        this.source = source;
    }

    public String getSource() {
        return source;
    }
}
