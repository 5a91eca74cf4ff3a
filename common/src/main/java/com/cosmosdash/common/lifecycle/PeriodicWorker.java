package com.cosmosdash.common.lifecycle;

import com.cosmosdash.common.exception.FetchFailureException;
import com.cosmosdash.common.logging.LogContext;
import com.cosmosdash.common.sync.SyncResult;
import com.cosmosdash.common.sync.SyncService;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs one {@link SyncService} on a fixed interval.
 * <p>
 * The run loop lives on its own thread. Each tick hands the invocation to a
 * single-thread invoker and waits for it under a {@link TimeLimiter} deadline,
 * so ticks of one worker never overlap and a hung fetch only delays the
 * schedule by the deadline. Every failure is logged; none ends the loop.
 * Stopping is observed between ticks; an in-flight invocation is not
 * interrupted by {@link #stop()}.
 */
@Slf4j
public class PeriodicWorker implements Worker {

    private final String name;
    private final SyncService service;
    private final WorkerSettings settings;
    private final TimeLimiter timeLimiter;
    private final ExecutorService invoker;

    private final AtomicReference<LifecycleState> state = new AtomicReference<>(LifecycleState.IDLE);
    private final CountDownLatch stopSignal = new CountDownLatch(1);
    private final CountDownLatch terminated = new CountDownLatch(1);
    private final AtomicLong completedTicks = new AtomicLong();
    private final AtomicLong failedTicks = new AtomicLong();

    public PeriodicWorker(String name, SyncService service, WorkerSettings settings) {
        this.name = name;
        this.service = service;
        this.settings = settings;
        this.timeLimiter = TimeLimiter.of("worker-" + name, TimeLimiterConfig.custom()
                .timeoutDuration(settings.invocationTimeout())
                .cancelRunningFuture(true)
                .build());
        this.invoker = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "sync-" + name);
            thread.setDaemon(true);
            return thread;
        });
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public void start() {
        if (!state.compareAndSet(LifecycleState.IDLE, LifecycleState.RUNNING)) {
            log.debug("Worker {} already {}, start ignored", name, state.get());
            return;
        }
        Thread loop = new Thread(this::runLoop, "worker-" + name);
        loop.setDaemon(true);
        loop.start();
        log.info("Worker {} started (interval={}s, runOnStart={}, deadline={}s)", name,
                settings.interval().toSeconds(), settings.runOnStart(), settings.invocationTimeout().toSeconds());
    }

    @Override
    public void stop() {
        while (true) {
            LifecycleState current = state.get();
            if (current == LifecycleState.IDLE) {
                if (state.compareAndSet(LifecycleState.IDLE, LifecycleState.STOPPED)) {
                    invoker.shutdownNow();
                    terminated.countDown();
                    return;
                }
            } else if (current == LifecycleState.RUNNING) {
                if (state.compareAndSet(LifecycleState.RUNNING, LifecycleState.STOPPING)) {
                    log.info("Worker {} stopping", name);
                    stopSignal.countDown();
                    return;
                }
            } else {
                return;
            }
        }
    }

    @Override
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        return terminated.await(Math.max(0, timeout.toMillis()), TimeUnit.MILLISECONDS);
    }

    @Override
    public LifecycleState state() {
        return state.get();
    }

    public long completedTicks() {
        return completedTicks.get();
    }

    public long failedTicks() {
        return failedTicks.get();
    }

    private void runLoop() {
        try {
            if (settings.runOnStart() && stopSignal.getCount() > 0) {
                tick();
            }
            while (!stopSignal.await(settings.interval().toMillis(), TimeUnit.MILLISECONDS)) {
                tick();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Worker {} loop interrupted", name);
        } finally {
            invoker.shutdownNow();
            state.set(LifecycleState.STOPPED);
            terminated.countDown();
            log.info("Worker {} stopped after {} tick(s), {} failed", name, completedTicks.get(), failedTicks.get());
        }
    }

    private void tick() throws InterruptedException {
        LogContext.Builder context = LogContext.forWorker(name, service.domain());
        try {
            SyncResult result = timeLimiter.executeFutureSupplier(
                    () -> invoker.submit(context.wrap(service::sync)));
            completedTicks.incrementAndGet();
            log.debug("Worker {} tick finished: {}", name, result.outcome());
        } catch (TimeoutException e) {
            failedTicks.incrementAndGet();
            log.warn("Worker {} tick exceeded deadline of {}s", name, settings.invocationTimeout().toSeconds());
        } catch (InterruptedException e) {
            throw e;
        } catch (Exception e) {
            failedTicks.incrementAndGet();
            logFailure(e instanceof ExecutionException && e.getCause() != null ? e.getCause() : e);
        }
    }

    private void logFailure(Throwable failure) {
        if (failure instanceof FetchFailureException) {
            log.warn("Worker {} fetch failed, will retry next tick: {}", name, failure.getMessage());
        } else {
            log.error("Worker {} tick failed: {}", name, failure.getMessage(), failure);
        }
    }
}
