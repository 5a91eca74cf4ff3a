package com.cosmosdash.common.logging;

import org.slf4j.MDC;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Scoped MDC values for log lines emitted by a worker tick.
 *
 * <pre>
 * LogContext.forWorker("iss", "iss").wrap(service::sync);
 * LogContext.with(LogContext.WORKER, "telemetry-retention").run(this::sweep);
 * </pre>
 */
public final class LogContext {

    public static final String WORKER = "worker";
    public static final String DOMAIN = "domain";

    private LogContext() {}

    public static Builder with(String key, Object value) {
        return new Builder().and(key, value);
    }

    public static Builder forWorker(String worker, String domain) {
        return new Builder().and(WORKER, worker).and(DOMAIN, domain);
    }

    public static class Builder {
        private final Map<String, String> context = new HashMap<>();

        public Builder and(String key, Object value) {
            if (key != null && value != null) {
                context.put(key, value.toString());
            }
            return this;
        }

        public void run(Runnable task) {
            Map<String, String> previous = MDC.getCopyOfContextMap();
            try {
                context.forEach(MDC::put);
                task.run();
            } finally {
                restorePrevious(previous);
            }
        }

        public <T> T call(Callable<T> task) throws Exception {
            Map<String, String> previous = MDC.getCopyOfContextMap();
            try {
                context.forEach(MDC::put);
                return task.call();
            } finally {
                restorePrevious(previous);
            }
        }

        /**
         * Wrap a callable so it runs with this context on whichever thread executes it.
         */
        public <T> Callable<T> wrap(Callable<T> task) {
            return () -> call(task);
        }

        private void restorePrevious(Map<String, String> previous) {
            context.keySet().forEach(MDC::remove);
            if (previous != null) {
                MDC.setContextMap(previous);
            }
        }
    }
}
