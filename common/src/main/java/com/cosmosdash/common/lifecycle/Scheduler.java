package com.cosmosdash.common.lifecycle;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Owns an ordered set of workers, starts them together and stops them
 * within a bounded time.
 */
@Slf4j
public class Scheduler {

    public static final Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(10);

    private final List<Worker> workers = new ArrayList<>();
    private final Duration shutdownTimeout;
    private LifecycleState state = LifecycleState.IDLE;

    public Scheduler() {
        this(DEFAULT_SHUTDOWN_TIMEOUT);
    }

    public Scheduler(Duration shutdownTimeout) {
        this.shutdownTimeout = shutdownTimeout;
    }

    /**
     * @throws IllegalStateException once the scheduler has been started or stopped
     */
    public synchronized void addWorker(Worker worker) {
        if (state != LifecycleState.IDLE) {
            throw new IllegalStateException("Cannot add worker " + worker.name() + " to a " + state + " scheduler");
        }
        workers.add(worker);
    }

    /**
     * Launch every registered worker and return without waiting on them.
     *
     * @throws IllegalStateException if the scheduler was already stopped
     */
    public synchronized void start() {
        if (state == LifecycleState.RUNNING) {
            log.warn("Scheduler already running");
            return;
        }
        if (state != LifecycleState.IDLE) {
            throw new IllegalStateException("Scheduler cannot be restarted once " + state);
        }
        state = LifecycleState.RUNNING;
        log.info("Starting scheduler with {} worker(s)", workers.size());
        for (Worker worker : workers) {
            try {
                worker.start();
            } catch (RuntimeException e) {
                log.error("Worker {} failed to start: {}", worker.name(), e.getMessage(), e);
            }
        }
    }

    /**
     * Signal every worker and wait for them up to the shutdown timeout.
     * Later calls return immediately.
     *
     * @return true if all workers stopped in time
     */
    public boolean stop() {
        List<Worker> snapshot;
        synchronized (this) {
            if (state == LifecycleState.STOPPING || state == LifecycleState.STOPPED) {
                return state == LifecycleState.STOPPED;
            }
            state = LifecycleState.STOPPING;
            snapshot = new ArrayList<>(workers);
        }
        log.info("Stopping scheduler ({} worker(s), timeout {} ms)", snapshot.size(), shutdownTimeout.toMillis());

        snapshot.forEach(Worker::stop);

        long deadline = System.nanoTime() + shutdownTimeout.toNanos();
        List<String> lagging = new ArrayList<>();
        try {
            for (Worker worker : snapshot) {
                Duration remaining = Duration.ofNanos(Math.max(0, deadline - System.nanoTime()));
                if (!worker.awaitTermination(remaining)) {
                    lagging.add(worker.name());
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for workers to stop");
            lagging.add("<interrupted>");
        }

        synchronized (this) {
            state = LifecycleState.STOPPED;
        }
        if (lagging.isEmpty()) {
            log.info("Scheduler stopped gracefully");
            return true;
        }
        log.warn("Scheduler stop timed out after {} ms, still running: {}", shutdownTimeout.toMillis(), lagging);
        return false;
    }

    public synchronized boolean isRunning() {
        return state == LifecycleState.RUNNING;
    }

    public synchronized LifecycleState state() {
        return state;
    }

    public synchronized List<Worker> workers() {
        return Collections.unmodifiableList(new ArrayList<>(workers));
    }
}
