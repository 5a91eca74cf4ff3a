package com.cosmosdash.common.lifecycle;

import java.time.Duration;

/**
 * Independently started and stopped unit of background work.
 */
public interface Worker {

    String name();

    /**
     * Launch the worker and return immediately. A second call is a no-op.
     */
    void start();

    /**
     * Signal the worker to exit. Does not wait. A second call is a no-op.
     */
    void stop();

    /**
     * Block until the worker has fully stopped or the timeout elapses.
     *
     * @return true if the worker reached {@link LifecycleState#STOPPED}
     */
    boolean awaitTermination(Duration timeout) throws InterruptedException;

    LifecycleState state();
}
