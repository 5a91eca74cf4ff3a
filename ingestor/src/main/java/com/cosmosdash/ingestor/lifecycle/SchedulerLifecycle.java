package com.cosmosdash.ingestor.lifecycle;

import com.cosmosdash.common.lifecycle.Scheduler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationListener;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Starts the workers once the application is ready and stops them, within
 * the scheduler's bounded timeout, when the context closes.
 */
@Slf4j
@Component
public class SchedulerLifecycle implements ApplicationListener<ContextClosedEvent> {

    private final Scheduler scheduler;

    public SchedulerLifecycle(Scheduler scheduler) {
        this.scheduler = scheduler;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void startWorkers() {
        scheduler.start();
    }

    @Override
    public void onApplicationEvent(ContextClosedEvent event) {
        log.warn("Shutdown initiated, stopping synchronization workers");
        boolean graceful = scheduler.stop();
        if (!graceful) {
            log.warn("Some workers were still mid-invocation at shutdown");
        }
    }
}
