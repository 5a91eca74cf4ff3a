package com.cosmosdash.common.exception;

/**
 * A required URL or credential is missing for one worker.
 */
public class ConfigurationFailureException extends CosmosException {

    public ConfigurationFailureException(String worker, String message) {
        super("CONFIG", "Worker '" + worker + "' misconfigured: " + message);
    }
}
