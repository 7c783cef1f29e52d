package io.yasched.internal;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.yasched.ActionHandler;
import io.yasched.core.ActionExecutionException;
import io.yasched.core.ActionHandlerRegistry;
import io.yasched.core.DuplicateTaskNameException;
import io.yasched.core.InvalidScheduleSpecException;
import io.yasched.core.PollResult;
import io.yasched.core.TaskDefinition;
import io.yasched.core.TaskInfo;
import io.yasched.core.TaskNotFoundException;
import io.yasched.core.UnknownActionException;
import io.yasched.timing.Moment;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PollingSchedulerTest {

    private static final Moment NOW = Moment.of(2025, 6, 1, 10, 30, 0);

    private final List<String> messages = new ArrayList<>();
    private PollingScheduler scheduler;

    record Message(String message) {
    }

    class RecordingHandler implements ActionHandler<Message> {
        @Override
        public String name() {
            return "record";
        }

        @Override
        public Class<Message> parameterClass() {
            return Message.class;
        }

        @Override
        public void execute(Message parameters) {
            messages.add(parameters.message());
        }
    }

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2025-06-01T10:30:00Z"), ZoneOffset.UTC);
        ActionHandlerRegistry registry = new ActionHandlerRegistry(List.of(new RecordingHandler()), new ObjectMapper());
        scheduler = new PollingScheduler(registry, clock);
    }

    @Test
    void duplicateNameShouldBeRejected() {
        scheduler.create("backup", "every 1 hour").action(params -> messages.add("first")).register();

        assertThrows(DuplicateTaskNameException.class,
                () -> scheduler.create("backup", "every 2 hours").action(params -> messages.add("second")).register());

        assertEquals(1, scheduler.list().size());
        assertEquals("every 1 hour", scheduler.get("backup").schedule());
    }

    @Test
    void invalidScheduleShouldLeaveRegistryUntouched() {
        assertThrows(InvalidScheduleSpecException.class,
                () -> scheduler.create("fruit", "every banana").action(params -> { }).register());

        assertTrue(scheduler.list().isEmpty());
        assertThrows(TaskNotFoundException.class, () -> scheduler.get("fruit"));
    }

    @Test
    void unknownActionShouldLeaveRegistryUntouched() {
        TaskDefinition definition = new TaskDefinition("report", "every hour", "email");

        assertThrows(UnknownActionException.class, () -> scheduler.register(definition));
        assertTrue(scheduler.list().isEmpty());
    }

    @Test
    void failingActionShouldBeContainedAndCounted() {
        AtomicInteger siblingRuns = new AtomicInteger();
        scheduler.create("broken", "every 1 minute")
                .action(params -> {
                    throw new IllegalStateException("disk full");
                })
                .register();
        scheduler.create("sibling", "every 1 minute").action(params -> siblingRuns.incrementAndGet()).register();

        PollResult result = scheduler.pollOnce(NOW);

        assertEquals(List.of("broken", "sibling"), result.executed());
        assertEquals(1, result.failures().size());
        ActionExecutionException failure = result.failures().get(0);
        assertEquals("broken", failure.taskName());
        assertEquals("disk full", failure.getCause().getMessage());

        TaskInfo broken = scheduler.get("broken");
        assertEquals(1, broken.runCount());
        assertEquals(NOW, broken.lastRun());
        assertNotNull(broken.lastError());

        assertEquals(1, siblingRuns.get());
        assertEquals(1, scheduler.get("sibling").runCount());
        assertNull(scheduler.get("sibling").lastError());
    }

    @Test
    void fixedIntervalTaskShouldRunWhenIntervalElapsed() {
        AtomicInteger runs = new AtomicInteger();
        scheduler.create("tick", "every 1 minute").action(params -> runs.incrementAndGet()).register();

        scheduler.pollOnce(NOW);
        scheduler.pollOnce(NOW.plusSeconds(30));
        scheduler.pollOnce(NOW.plusSeconds(60));

        assertEquals(2, runs.get());
        TaskInfo info = scheduler.get("tick");
        assertEquals(2, info.runCount());
        assertEquals(NOW.plusSeconds(60), info.lastRun());
        assertEquals(NOW.plusSeconds(120), info.nextRunHint());
    }

    @Test
    void dailyTaskShouldRunOnceInItsWindow() {
        AtomicInteger runs = new AtomicInteger();
        scheduler.create("standup", "every day at 10:30").action(params -> runs.incrementAndGet()).register();

        scheduler.pollOnce(Moment.of(2025, 6, 1, 9, 59, 59));
        assertEquals(0, runs.get());

        scheduler.pollOnce(NOW);
        scheduler.pollOnce(NOW.plusSeconds(20));
        assertEquals(1, runs.get());
        assertEquals(Moment.of(2025, 6, 2, 10, 30, 0), scheduler.get("standup").nextRunHint());
    }

    @Test
    void disabledTaskShouldBeSkippedUntilEnabled() {
        AtomicInteger runs = new AtomicInteger();
        scheduler.create("nightly", "every 1 second").action(params -> runs.incrementAndGet()).enabled(false).register();

        assertTrue(scheduler.pollOnce(NOW).executed().isEmpty());
        assertFalse(scheduler.runNow("nightly"));

        scheduler.enable("nightly");
        scheduler.pollOnce(NOW);
        assertEquals(1, runs.get());

        scheduler.disable("nightly");
        assertFalse(scheduler.get("nightly").enabled());
        scheduler.pollOnce(NOW.plusSeconds(5));
        assertEquals(1, runs.get());
    }

    @Test
    void runNowShouldBypassTrigger() {
        AtomicInteger runs = new AtomicInteger();
        scheduler.create("weekly", "every monday at 09:00").action(params -> runs.incrementAndGet()).register();

        assertTrue(scheduler.pollOnce(NOW).executed().isEmpty());
        assertTrue(scheduler.runNow("weekly"));

        assertEquals(1, runs.get());
        assertEquals(1, scheduler.get("weekly").runCount());
        assertEquals(NOW, scheduler.get("weekly").lastRun());
    }

    @Test
    void runNowShouldReportFailureAfterRecordingRun() {
        scheduler.create("broken", "every hour")
                .action(params -> {
                    throw new IllegalStateException("boom");
                })
                .register();

        ActionExecutionException ex = assertThrows(ActionExecutionException.class, () -> scheduler.runNow("broken"));

        assertEquals("broken", ex.taskName());
        assertEquals(1, scheduler.get("broken").runCount());
    }

    @Test
    void descriptorShouldResolveActionAndForwardParameters() {
        scheduler.register(new TaskDefinition(
                "hello", "every 5 minutes", "record", "says hello", true, Map.of("message", "hello")));

        scheduler.pollOnce(NOW);

        assertEquals(List.of("hello"), messages);
        assertEquals("says hello", scheduler.get("hello").description());
    }

    @Test
    void unknownTaskOperationsShouldFail() {
        assertThrows(TaskNotFoundException.class, () -> scheduler.remove("ghost"));
        assertThrows(TaskNotFoundException.class, () -> scheduler.enable("ghost"));
        assertThrows(TaskNotFoundException.class, () -> scheduler.disable("ghost"));
        assertThrows(TaskNotFoundException.class, () -> scheduler.get("ghost"));
        assertThrows(TaskNotFoundException.class, () -> scheduler.runNow("ghost"));
    }

    @Test
    void removedTaskShouldNoLongerRun() {
        AtomicInteger runs = new AtomicInteger();
        scheduler.create("temp", "every second").action(params -> runs.incrementAndGet()).register();
        scheduler.create("other", "every second").action(params -> { }).register();

        scheduler.remove("temp");
        scheduler.pollOnce(NOW);

        assertEquals(0, runs.get());
        assertEquals(List.of("other"), scheduler.list().stream().map(TaskInfo::name).toList());

        scheduler.clear();
        assertTrue(scheduler.list().isEmpty());
    }

    @Test
    void taskRemovedDuringCycleShouldBeSkipped() {
        AtomicInteger secondRuns = new AtomicInteger();
        scheduler.create("first", "every second").action(params -> scheduler.remove("second")).register();
        scheduler.create("second", "every second").action(params -> secondRuns.incrementAndGet()).register();

        PollResult result = scheduler.pollOnce(NOW);

        assertEquals(List.of("first"), result.executed());
        assertFalse(result.hasFailures());
        assertEquals(0, secondRuns.get());
        assertEquals(List.of("first"), scheduler.list().stream().map(TaskInfo::name).toList());
    }

    @Test
    void actionShouldNotStartAnotherActionInline() {
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger maxInFlight = new AtomicInteger();
        List<Exception> nestedErrors = new ArrayList<>();
        scheduler.create("inner", "every monday at 09:00")
                .action(params -> {
                    maxInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
                    inFlight.decrementAndGet();
                })
                .register();
        scheduler.create("outer", "every second")
                .action(params -> {
                    maxInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
                    try {
                        scheduler.runNow("inner");
                    } catch (IllegalStateException e) {
                        nestedErrors.add(e);
                    }
                    try {
                        scheduler.pollOnce(NOW);
                    } catch (IllegalStateException e) {
                        nestedErrors.add(e);
                    }
                    inFlight.decrementAndGet();
                })
                .register();

        PollResult result = scheduler.pollOnce(NOW);

        assertEquals(List.of("outer"), result.executed());
        assertFalse(result.hasFailures());
        assertEquals(1, maxInFlight.get());
        assertEquals(2, nestedErrors.size());
        assertEquals(0, scheduler.get("inner").runCount());

        assertTrue(scheduler.runNow("inner"));
        assertEquals(1, scheduler.get("inner").runCount());
    }

    @Test
    void schedulersShouldNotShareTasks() {
        PollingScheduler other = new PollingScheduler(Clock.systemUTC());
        scheduler.create("backup", "every hour").action(params -> { }).register();
        other.create("backup", "every hour").action(params -> { }).register();

        assertEquals(1, scheduler.list().size());
        assertEquals(1, other.list().size());
    }

    @Test
    void runShouldPollUntilStopped() throws Exception {
        AtomicInteger runs = new AtomicInteger();
        scheduler.create("beat", "every 1 second").action(params -> runs.incrementAndGet()).register();

        Thread loop = new Thread(() -> scheduler.run(Duration.ofMillis(20)), "scheduler-test-loop");
        loop.start();

        boolean reached = waitUntil(5, TimeUnit.SECONDS, () -> runs.get() >= 1 && scheduler.isRunning());
        scheduler.stop();
        loop.join(TimeUnit.SECONDS.toMillis(5));

        assertTrue(reached);
        assertFalse(loop.isAlive());
        assertFalse(scheduler.isRunning());
        // the fixed clock never advances, so the task ran once
        assertEquals(1, runs.get());
    }

    @Test
    void runShouldRejectNonPositiveInterval() {
        assertThrows(IllegalArgumentException.class, () -> scheduler.run(Duration.ZERO));
        assertFalse(scheduler.isRunning());
    }

    private static boolean waitUntil(long timeout, TimeUnit unit, BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + unit.toNanos(timeout);
        while (System.nanoTime() < deadline) {
            if (condition.getAsBoolean()) {
                return true;
            }
            Thread.sleep(20);
        }
        return false;
    }
}
