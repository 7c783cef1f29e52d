package io.yasched.internal;

import io.yasched.ActionResolver;
import io.yasched.Scheduler;
import io.yasched.TaskBuilder;
import io.yasched.core.ActionExecutionException;
import io.yasched.core.DuplicateTaskNameException;
import io.yasched.core.PollResult;
import io.yasched.core.TaskDefinition;
import io.yasched.core.TaskInfo;
import io.yasched.core.TaskNotFoundException;
import io.yasched.core.TaskSpec;
import io.yasched.core.UnknownActionException;
import io.yasched.timing.Moment;
import io.yasched.trigger.RecurrenceParser;
import io.yasched.trigger.Trigger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory, single-threaded polling scheduler.
 *
 * <p>Each instance owns its own task set, so several schedulers can coexist in one
 * process. Registry operations and the start-of-cycle snapshot share one lock;
 * actions run outside it, one at a time.
 */
public class PollingScheduler implements Scheduler {
    private static final Logger log = LoggerFactory.getLogger(PollingScheduler.class);

    private final ActionResolver actionResolver;
    private final Clock clock;
    private final Duration matchWindow;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, ScheduledTask> tasks = new LinkedHashMap<>();

    // serializes action execution between the poll loop and runNow; never re-entered
    private final ReentrantLock executionLock = new ReentrantLock();

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final Semaphore wakeSignal = new Semaphore(0);

    public PollingScheduler(Clock clock) {
        this(name -> {
            throw new UnknownActionException(name);
        }, clock, RecurrenceParser.DEFAULT_MATCH_WINDOW);
    }

    public PollingScheduler(ActionResolver actionResolver, Clock clock) {
        this(actionResolver, clock, RecurrenceParser.DEFAULT_MATCH_WINDOW);
    }

    public PollingScheduler(ActionResolver actionResolver, Clock clock, Duration matchWindow) {
        this.actionResolver = Objects.requireNonNull(actionResolver, "actionResolver must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.matchWindow = Objects.requireNonNull(matchWindow, "matchWindow must not be null");
    }

    @Override
    public TaskBuilder create(String name, String schedule) {
        return new SimpleTaskBuilder(name, schedule, actionResolver, this::register);
    }

    @Override
    public TaskInfo register(TaskSpec spec) {
        Objects.requireNonNull(spec, "spec must not be null");
        Moment now = nowMoment();

        TaskInfo info;
        lock.lock();
        try {
            if (tasks.containsKey(spec.name())) {
                throw new DuplicateTaskNameException(spec.name());
            }
            Trigger trigger = RecurrenceParser.parse(spec.schedule(), matchWindow);
            ScheduledTask task = new ScheduledTask(spec, trigger, trigger.nextDue(now, null));
            tasks.put(spec.name(), task);
            info = task.toInfo();
        } finally {
            lock.unlock();
        }

        log.info("Added task name={} schedule={} enabled={}", spec.name(), spec.schedule(), spec.enabled());
        return info;
    }

    @Override
    public TaskInfo register(TaskDefinition definition) {
        Objects.requireNonNull(definition, "definition must not be null");
        Objects.requireNonNull(definition.name(), "task name must not be null");
        Objects.requireNonNull(definition.schedule(), "schedule must not be null");
        Objects.requireNonNull(definition.action(), "action must not be null");

        TaskBuilder builder = create(definition.name(), definition.schedule())
                .action(definition.action())
                .description(definition.description())
                .enabled(definition.enabled());
        if (definition.parameters() != null) {
            builder.parameters(definition.parameters());
        }
        return builder.register();
    }

    @Override
    public void remove(String name) {
        lock.lock();
        try {
            requireTask(name);
            tasks.remove(name);
        } finally {
            lock.unlock();
        }
        log.info("Removed task name={}", name);
    }

    @Override
    public void enable(String name) {
        setEnabled(name, true);
        log.info("Enabled task name={}", name);
    }

    @Override
    public void disable(String name) {
        setEnabled(name, false);
        log.info("Disabled task name={}", name);
    }

    @Override
    public TaskInfo get(String name) {
        lock.lock();
        try {
            return requireTask(name).toInfo();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<TaskInfo> list() {
        lock.lock();
        try {
            List<TaskInfo> infos = new ArrayList<>(tasks.size());
            for (ScheduledTask task : tasks.values()) {
                infos.add(task.toInfo());
            }
            return List.copyOf(infos);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void clear() {
        lock.lock();
        try {
            tasks.clear();
        } finally {
            lock.unlock();
        }
        log.info("All tasks cleared");
    }

    @Override
    public boolean runNow(String name) {
        rejectNestedExecution("runNow");
        ScheduledTask task;
        lock.lock();
        try {
            task = requireTask(name);
            if (!task.isEnabled()) {
                log.debug("Task name={} is disabled, skipping execution", name);
                return false;
            }
        } finally {
            lock.unlock();
        }

        ActionExecutionException failure;
        executionLock.lock();
        try {
            failure = execute(task, nowMoment());
        } finally {
            executionLock.unlock();
        }
        if (failure != null) {
            throw failure;
        }
        return true;
    }

    @Override
    public PollResult pollOnce(Moment now) {
        Objects.requireNonNull(now, "now must not be null");
        rejectNestedExecution("pollOnce");

        List<ScheduledTask> snapshot;
        lock.lock();
        try {
            snapshot = new ArrayList<>(tasks.values());
        } finally {
            lock.unlock();
        }

        List<String> executed = new ArrayList<>();
        List<ActionExecutionException> failures = new ArrayList<>();

        executionLock.lock();
        try {
            for (ScheduledTask task : snapshot) {
                if (!isDue(task, now)) {
                    continue;
                }
                ActionExecutionException failure = execute(task, now);
                executed.add(task.name());
                if (failure != null) {
                    failures.add(failure);
                }
            }
        } finally {
            executionLock.unlock();
        }

        log.debug("Scheduler polled tasks count={} executed={} failed={} now={}",
                snapshot.size(), executed.size(), failures.size(), now);
        return new PollResult(executed, failures);
    }

    /**
     * Blocks the calling thread until {@link #stop()} is called or the thread is interrupted.
     */
    @Override
    public void run(Duration pollInterval) {
        Objects.requireNonNull(pollInterval, "pollInterval must not be null");
        if (pollInterval.isZero() || pollInterval.isNegative()) {
            throw new IllegalArgumentException("pollInterval must be a positive duration");
        }
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("Scheduler is already running");
        }
        wakeSignal.drainPermits();

        log.info("Scheduler started with pollInterval={}, matchWindow={}", pollInterval, matchWindow);
        try {
            while (running.get()) {
                try {
                    pollOnce(nowMoment());
                } catch (Exception e) {
                    log.error("scheduler pollOnce failed msg={}", e.getMessage(), e);
                }

                if (!running.get()) {
                    break;
                }

                try {
                    wakeSignal.tryAcquire(pollInterval.toMillis(), TimeUnit.MILLISECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        } finally {
            running.set(false);
            log.info("Scheduler stopped");
        }
    }

    public void run(long pollIntervalSeconds) {
        run(Duration.ofSeconds(pollIntervalSeconds));
    }

    @Override
    public void stop() {
        if (running.compareAndSet(true, false)) {
            log.info("Scheduler stopping...");
            wakeSignal.release();
        }
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    /**
     * Utility: current scheduler time source.
     */
    protected Moment nowMoment() {
        return Moment.now(clock);
    }

    private boolean isDue(ScheduledTask task, Moment now) {
        lock.lock();
        try {
            // removed since the snapshot was taken
            if (tasks.get(task.name()) != task) {
                return false;
            }
            if (!task.isEnabled()) {
                log.debug("Task name={} is disabled, skipping", task.name());
                return false;
            }
            return task.trigger().isDue(now, task.lastRun());
        } finally {
            lock.unlock();
        }
    }

    private ActionExecutionException execute(ScheduledTask task, Moment now) {
        ActionExecutionException failure = null;
        log.info("Executing task name={} at={}", task.name(), now);
        try {
            task.action().execute(task.parameters());
            log.info("Task name={} completed successfully", task.name());
        } catch (Exception e) {
            failure = new ActionExecutionException(task.name(), e);
            log.error("scheduler task failed name={} msg={}", task.name(), e.getMessage(), e);
        }

        lock.lock();
        try {
            task.recordRun(now, failure == null ? null : failure.getMessage());
        } finally {
            lock.unlock();
        }
        return failure;
    }

    private void rejectNestedExecution(String operation) {
        if (executionLock.isHeldByCurrentThread()) {
            throw new IllegalStateException(operation + " cannot be called from a running task action");
        }
    }

    private void setEnabled(String name, boolean enabled) {
        lock.lock();
        try {
            requireTask(name).setEnabled(enabled);
        } finally {
            lock.unlock();
        }
    }

    private ScheduledTask requireTask(String name) {
        Objects.requireNonNull(name, "task name must not be null");
        ScheduledTask task = tasks.get(name);
        if (task == null) {
            throw new TaskNotFoundException(name);
        }
        return task;
    }
}
