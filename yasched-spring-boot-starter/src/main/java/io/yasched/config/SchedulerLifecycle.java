package io.yasched.config;

import io.yasched.Scheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

import java.time.Duration;

/**
 * Bridges the scheduler's blocking poll loop with the Spring container lifecycle.
 * The loop runs on a dedicated daemon thread.
 */
public class SchedulerLifecycle implements SmartLifecycle {
    private static final Logger log = LoggerFactory.getLogger(SchedulerLifecycle.class);

    private final Scheduler scheduler;
    private final Duration pollInterval;
    private final boolean autoStartup;

    private volatile Thread pollerThread;

    public SchedulerLifecycle(Scheduler scheduler, Duration pollInterval, boolean autoStartup) {
        this.scheduler = scheduler;
        this.pollInterval = pollInterval;
        this.autoStartup = autoStartup;
    }

    @Override
    public synchronized void start() {
        Thread previous = pollerThread;
        if (previous != null) {
            if (previous.isAlive()) {
                log.warn("Scheduler poller still alive, not starting another name={}", previous.getName());
                return;
            }
            pollerThread = null;
        }
        Thread t = new Thread(() -> scheduler.run(pollInterval));
        t.setName("yasched.poller");
        t.setDaemon(true);
        t.start();
        pollerThread = t;
    }

    @Override
    public synchronized void stop() {
        Thread t = pollerThread;
        if (t == null) {
            return;
        }
        scheduler.stop();
        try {
            // waits for an in-flight action; it is never interrupted
            t.join(pollInterval.toMillis() + 5_000L);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (t.isAlive()) {
            // kept so that start() does not launch a second loop next to it
            log.warn("Scheduler poller did not stop in time; leaving daemon thread name={}", t.getName());
            return;
        }
        pollerThread = null;
    }

    @Override
    public boolean isRunning() {
        Thread t = pollerThread;
        return t != null && t.isAlive();
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }

    @Override
    public boolean isAutoStartup() {
        return autoStartup;
    }
}
