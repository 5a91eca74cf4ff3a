package com.cosmosdash.common.exception;

/**
 * Durable store rejected or could not accept a write.
 */
public class PersistFailureException extends CosmosException {

    public PersistFailureException(String entity, Throwable cause) {
        super("SYNC-PERSIST", "Failed to persist " + entity + ": " + cause.getMessage(), cause);
    }
}
