package com.cosmosdash.common.exception;

/**
 * The cache store could not be reached. Distinct from a plain miss.
 */
public class CacheUnavailableException extends CosmosException {

    public CacheUnavailableException(String operation, String key, Throwable cause) {
        super("CACHE-UNAVAILABLE", "Cache " + operation + " failed for key '" + key + "'", cause);
    }
}
