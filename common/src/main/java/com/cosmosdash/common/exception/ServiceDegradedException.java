package com.cosmosdash.common.exception;

/**
 * Read path could not reach the durable store. Callers should report the
 * service as degraded rather than as having no data.
 */
public class ServiceDegradedException extends CosmosException {

    public ServiceDegradedException(String domain, Throwable cause) {
        super("SERVICE-DEGRADED", "Domain '" + domain + "' is degraded: " + cause.getMessage(), cause);
    }
}
