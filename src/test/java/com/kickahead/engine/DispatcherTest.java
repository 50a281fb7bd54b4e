package com.kickahead.engine;

import com.kickahead.core.BaseJob;
import com.kickahead.core.ConfigurationException;
import com.kickahead.core.InvalidStrategyException;
import com.kickahead.core.JobDescriptor;
import com.kickahead.core.JobRegistry;
import com.kickahead.core.OutOfIntervalException;
import com.kickahead.core.OutOfTimeStrategy;
import com.kickahead.core.UnknownJobTypeException;
import com.kickahead.db.DueJobCallback;
import com.kickahead.db.InMemoryJobRepository;
import com.kickahead.db.JobRepository;
import com.kickahead.testing.MutableClock;
import com.kickahead.testing.RecordingJob;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for tick processing: due detection, staleness classification and the
 * out-of-time strategies.
 */
public class DispatcherTest {

    private static final Instant START = Instant.parse("2024-03-01T08:00:00Z");
    private static final Duration TICK_INTERVAL = Duration.ofMinutes(10);

    private final Map<String, String> proofs = new HashMap<>();

    private MutableClock clock;
    private InMemoryJobRepository repository;
    private JobRegistry registry;
    private DispatcherContext context;
    private Dispatcher dispatcher;
    private JobScheduler scheduler;

    @BeforeEach
    public void setUp() {
        clock = new MutableClock(START);
        repository = new InMemoryJobRepository();
        registry = new JobRegistry();
        registry.register("MyJob", () -> new RecordingJob(proofs));
        registry.register("SubJob", "MyJob", () -> new RecordingJob(proofs));

        context = new DispatcherContext(TICK_INTERVAL, repository, clock);
        dispatcher = new Dispatcher(context, registry);
        scheduler = new JobScheduler(context, registry);
    }

    // ==================== CONFIGURATION ====================

    @Test
    public void testTickFailsWithoutTickInterval() {
        context.setTickInterval(null);

        assertThrows(ConfigurationException.class, () -> dispatcher.tick());
    }

    @Test
    public void testTickFailsWithNonPositiveTickInterval() {
        context.setTickInterval(Duration.ZERO);

        assertThrows(ConfigurationException.class, () -> dispatcher.tick());
    }

    @Test
    public void testTickFailsWithoutClock() {
        context.setClock(null);

        assertThrows(ConfigurationException.class, () -> dispatcher.tick());
    }

    /**
     * Configuration errors surface before the repository is read.
     */
    @Test
    public void testConfigurationErrorDoesNotTouchRepository() {
        context.setRepository(new UntouchableRepository());
        context.setTickInterval(null);

        assertThrows(ConfigurationException.class, () -> dispatcher.tick());
    }

    @Test
    public void testTickFailsWithoutRepository() {
        context.setRepository(null);

        assertThrows(ConfigurationException.class, () -> dispatcher.tick());
    }

    // ==================== ON-TIME EXECUTION ====================

    /**
     * A job scheduled an hour ahead is not run early and is run once due.
     */
    @Test
    public void testExecutesWithDeltaOnGivenTime() throws Exception {
        scheduler.runIn("MyJob", Duration.ofHours(1), "delta_basic_test");
        assertEquals(1, repository.size());

        clock.set(START.plusSeconds(3000));
        TickResult early = dispatcher.tick();

        assertNull(proofs.get("delta_basic_test"));
        assertEquals(1, repository.size());
        assertEquals(0, early.getTotal());

        clock.set(START.plusSeconds(3650));
        TickResult due = dispatcher.tick();

        assertEquals("Job done!", proofs.get("delta_basic_test"));
        assertEquals(0, repository.size());
        assertEquals(1, due.getExecuted());
    }

    @Test
    public void testExecutesWithAbsoluteTime() throws Exception {
        scheduler.runAt("MyJob", START.plusSeconds(3600), "time_basic_test");

        clock.set(START.plusSeconds(3600).plus(TICK_INTERVAL.dividedBy(2)));
        dispatcher.tick();

        assertEquals("Job done!", proofs.get("time_basic_test"));
        assertEquals(0, repository.size());
    }

    @Test
    public void testJobDueExactlyNowIsExecuted() throws Exception {
        scheduler.runAt("MyJob", START, "now");

        dispatcher.tick();

        assertEquals("Job done!", proofs.get("now"));
    }

    /**
     * Once handled, a descriptor is gone and a second tick does nothing with it.
     */
    @Test
    public void testSecondTickDoesNotRepeatExecution() throws Exception {
        List<String> performed = new ArrayList<>();
        registry.register("CountingJob", () -> new BaseJob() {
            @Override
            public void perform(List<Object> args) {
                performed.add(arg(args, 0, String.class));
            }
        });
        scheduler.runAt("CountingJob", START.minusSeconds(1), "once");

        dispatcher.tick();
        dispatcher.tick();

        assertEquals(List.of("once"), performed);
        assertEquals(0, repository.size());
    }

    /**
     * A job overdue by more than one interval still runs inside its tolerance.
     */
    @Test
    public void testStillExecutesIfOutOfTimeButAllowedByTolerance() throws Exception {
        registry.setTolerance("MyJob", Duration.ofMinutes(30));
        registry.setOutOfTimeStrategy("MyJob", OutOfTimeStrategy.RAISE_EXCEPTION);
        scheduler.runIn("MyJob", Duration.ofHours(1), "tolerance test");

        clock.set(START.plusSeconds(3600 + 1500));
        dispatcher.tick();

        assertEquals("Job done!", proofs.get("tolerance test"));
        assertEquals(0, repository.size());
    }

    /**
     * A failing job aborts the tick and stays scheduled.
     */
    @Test
    public void testDoesNotRemoveJobOnInternalFailure() {
        scheduler.runIn("MyJob", Duration.ofHours(1), "FAIL: this will raise when executed");
        clock.set(START.plusSeconds(3600));

        IllegalStateException e = assertThrows(IllegalStateException.class, () -> dispatcher.tick());

        assertTrue(e.getMessage().contains("FAIL"));
        assertEquals(1, repository.size());
    }

    /**
     * A failure stops the tick: descriptors not reached yet are left untouched.
     */
    @Test
    public void testFailureAbortsRemainingBatch() {
        InMemoryJobRepository ordered = new InMemoryJobRepository() {
            @Override
            public void eachDueJob(Instant now, DueJobCallback callback) throws Exception {
                // Deterministic order for the test: by id
                List<JobDescriptor> due = new ArrayList<>();
                for (int i = 1; i <= size() + 10; i++) {
                    find(Integer.toString(i)).filter(d -> !d.getScheduledAt().isAfter(now)).ifPresent(due::add);
                }
                for (JobDescriptor d : due) {
                    callback.accept(d);
                }
            }
        };
        context.setRepository(ordered);
        scheduler.runAt("MyJob", START, "first");
        scheduler.runAt("MyJob", START, "FAIL second");
        scheduler.runAt("MyJob", START, "third");

        assertThrows(IllegalStateException.class, () -> dispatcher.tick());

        assertEquals("Job done!", proofs.get("first"));
        assertNull(proofs.get("third"));
        assertEquals(2, ordered.size());
        assertTrue(ordered.find("2").isPresent());
        assertTrue(ordered.find("3").isPresent());
    }

    @Test
    public void testUnknownJobTypeFailsTickAndKeepsDescriptor() {
        repository.create("NoSuchJob", START, List.of("x"));

        UnknownJobTypeException e = assertThrows(UnknownJobTypeException.class, () -> dispatcher.tick());

        assertEquals("NoSuchJob", e.getJobType());
        assertEquals(1, repository.size());
    }

    // ==================== STALENESS BOUNDARY ====================

    /**
     * stale = scheduledAt < now - interval - tolerance, strictly.
     */
    @Test
    public void testStalenessBoundary() {
        Duration tolerance = Duration.ofMinutes(7);
        registry.setTolerance("MyJob", tolerance);
        Instant boundary = START.minus(TICK_INTERVAL).minus(tolerance);

        assertTrue(dispatcher.isStale(descriptor(boundary.minusSeconds(1)), START, TICK_INTERVAL));
        assertFalse(dispatcher.isStale(descriptor(boundary), START, TICK_INTERVAL));
        assertFalse(dispatcher.isStale(descriptor(boundary.plusSeconds(1)), START, TICK_INTERVAL));
    }

    @Test
    public void testStalenessBoundaryWithZeroTolerance() {
        Instant boundary = START.minus(TICK_INTERVAL);

        assertTrue(dispatcher.isStale(descriptor(boundary.minusMillis(1)), START, TICK_INTERVAL));
        assertFalse(dispatcher.isStale(descriptor(boundary), START, TICK_INTERVAL));
    }

    @Test
    public void testSubtypeUsesInheritedToleranceForStaleness() {
        registry.setTolerance("MyJob", Duration.ofHours(1));
        JobDescriptor sub = new JobDescriptor("1", "SubJob", START.minus(Duration.ofMinutes(30)), List.of("x"));

        assertFalse(dispatcher.isStale(sub, START, TICK_INTERVAL));

        registry.setTolerance("SubJob", Duration.ZERO);

        assertTrue(dispatcher.isStale(sub, START, TICK_INTERVAL));
    }

    // ==================== OUT-OF-TIME STRATEGIES ====================

    /**
     * The default strategy raises and keeps the descriptor; a repeated tick raises again.
     */
    @Test
    public void testRaiseExceptionStrategyKeepsJob() {
        scheduler.runIn("MyJob", Duration.ofHours(1), "out of time test");
        clock.set(START.plusSeconds(3600 + 600 + 1));

        OutOfIntervalException e = assertThrows(OutOfIntervalException.class, () -> dispatcher.tick());

        assertEquals("MyJob", e.getJobType());
        assertEquals(List.of("out of time test"), e.getArgs());
        assertEquals(START.plusSeconds(3600), e.getScheduledAt());
        assertEquals("The job of class MyJob with args [out of time test] was not possible to run because "
            + "of an out of interval tick (we didn't receive a tick in time to run it) and its maximum "
            + "tolerance threshold is also overdue.", e.getMessage());
        assertNull(proofs.get("out of time test"));
        assertEquals(1, repository.size());

        assertThrows(OutOfIntervalException.class, () -> dispatcher.tick());
        assertEquals(1, repository.size());
    }

    /**
     * Ignore drops the job without running it.
     */
    @Test
    public void testIgnoreStrategyDropsJob() throws Exception {
        scheduler.runIn("MyJob", Duration.ofHours(1), "out of time test");
        registry.setOutOfTimeStrategy("MyJob", OutOfTimeStrategy.IGNORE);
        clock.set(START.plusSeconds(3600 + 600 + 1));

        TickResult result = dispatcher.tick();

        assertNull(proofs.get("out of time test"));
        assertEquals(0, repository.size());
        assertEquals(1, result.getIgnored());
        assertEquals(0, result.getExecuted());
    }

    /**
     * Hook runs once with the original schedule time and args.
     */
    @Test
    public void testHookStrategyRunsHookOnce() throws Exception {
        List<String> hookCalls = new ArrayList<>();
        registry.register("HookedJob", () -> new BaseJob() {
            @Override
            public void perform(List<Object> args) {
                fail("perform must not run for a stale job");
            }

            @Override
            public void outOfTimeHook(Instant scheduledAt, List<Object> args) {
                hookCalls.add(scheduledAt + " " + args);
            }
        });
        registry.setOutOfTimeStrategy("HookedJob", OutOfTimeStrategy.HOOK);
        Instant time = START.plusSeconds(3600);
        scheduler.runAt("HookedJob", time, "out of time test", 42);
        clock.set(START.plusSeconds(3600 + 600 + 1));

        TickResult result = dispatcher.tick();
        dispatcher.tick();

        assertEquals(List.of(time + " [out of time test, 42]"), hookCalls);
        assertEquals(0, repository.size());
        assertEquals(1, result.getHooked());
    }

    @Test
    public void testHookStrategyWithRecordingJob() throws Exception {
        Instant time = START.plusSeconds(3600);
        scheduler.runAt("MyJob", time, "out of time test");
        registry.setOutOfTimeStrategy("MyJob", OutOfTimeStrategy.HOOK);
        clock.set(START.plusSeconds(3600 + 600 + 1));

        dispatcher.tick();

        assertEquals("Out of time!. Scheduling was: " + time, proofs.get("out of time test"));
        assertEquals(0, repository.size());
    }

    @Test
    public void testFailingHookKeepsJob() {
        scheduler.runIn("MyJob", Duration.ofHours(1), "FAIL in hook");
        registry.setOutOfTimeStrategy("MyJob", OutOfTimeStrategy.HOOK);
        clock.set(START.plusSeconds(3600 + 600 + 1));

        assertThrows(IllegalStateException.class, () -> dispatcher.tick());
        assertEquals(1, repository.size());
    }

    @Test
    public void testHookStrategyWithoutHookImplementation() {
        registry.register("PlainJob", () -> new BaseJob() {
            @Override
            public void perform(List<Object> args) {
            }
        });
        registry.setOutOfTimeStrategy("PlainJob", OutOfTimeStrategy.HOOK);
        scheduler.runAt("PlainJob", START.minus(Duration.ofHours(1)));

        assertThrows(UnsupportedOperationException.class, () -> dispatcher.tick());
        assertEquals(1, repository.size());
    }

    @Test
    public void testInvalidStrategyNameFailsTick() {
        registry.setOutOfTimeStrategy("MyJob", "retry_later");
        scheduler.runAt("MyJob", START.minus(Duration.ofHours(1)), "stale");

        InvalidStrategyException e = assertThrows(InvalidStrategyException.class, () -> dispatcher.tick());

        assertEquals("retry_later", e.getStrategy());
        assertEquals("MyJob", e.getJobType());
        assertEquals(1, repository.size());
    }

    /**
     * An invalid strategy only matters once a job of that type is stale.
     */
    @Test
    public void testInvalidStrategyIgnoredForOnTimeJobs() throws Exception {
        registry.setOutOfTimeStrategy("MyJob", "retry_later");
        scheduler.runAt("MyJob", START, "on time");

        dispatcher.tick();

        assertEquals("Job done!", proofs.get("on time"));
    }

    @Test
    public void testSubtypeInheritsStrategy() throws Exception {
        registry.setOutOfTimeStrategy("MyJob", OutOfTimeStrategy.IGNORE);
        scheduler.runAt("SubJob", START.minus(Duration.ofHours(1)), "sub");

        dispatcher.tick();

        assertNull(proofs.get("sub"));
        assertEquals(0, repository.size());
    }

    @Test
    public void testMixedBatchCounts() throws Exception {
        registry.setOutOfTimeStrategy("SubJob", OutOfTimeStrategy.IGNORE);
        scheduler.runAt("MyJob", START.minusSeconds(60), "fresh-1");
        scheduler.runAt("MyJob", START.minusSeconds(120), "fresh-2");
        scheduler.runAt("SubJob", START.minus(Duration.ofHours(2)), "stale");
        scheduler.runAt("MyJob", START.plusSeconds(60), "future");

        TickResult result = dispatcher.tick();

        assertEquals(2, result.getExecuted());
        assertEquals(1, result.getIgnored());
        assertEquals(0, result.getHooked());
        assertEquals(1, repository.size());
        assertNull(proofs.get("future"));
    }

    private static JobDescriptor descriptor(Instant scheduledAt) {
        return new JobDescriptor("1", "MyJob", scheduledAt, List.of("x"));
    }

    /** Repository that fails the test on any access. */
    private static final class UntouchableRepository implements JobRepository {
        @Override
        public String create(String jobType, Instant scheduledAt, List<Object> args) {
            throw new AssertionError("create must not be called");
        }

        @Override
        public void eachDueJob(Instant now, DueJobCallback callback) {
            throw new AssertionError("eachDueJob must not be called");
        }

        @Override
        public void delete(String id) {
            throw new AssertionError("delete must not be called");
        }

        @Override
        public int size() {
            throw new AssertionError("size must not be called");
        }
    }
}
