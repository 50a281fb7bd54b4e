package com.kickahead.engine;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.logging.Logger;

import com.kickahead.core.InvalidStrategyException;
import com.kickahead.core.Job;
import com.kickahead.core.JobDescriptor;
import com.kickahead.core.JobRegistry;
import com.kickahead.core.OutOfIntervalException;
import com.kickahead.core.OutOfTimeStrategy;
import com.kickahead.db.JobRepository;

/**
 * Runs due jobs once per externally triggered tick.
 *
 * <p>The Dispatcher has no timer of its own. A host poller calls {@link #tick()} at least
 * once per tick interval; each call pulls every descriptor whose scheduled time has passed
 * and decides, per descriptor, whether it is still on time:</p>
 * <pre>
 * stale = scheduledAt &lt; now - tickInterval - tolerance(jobType)
 * </pre>
 * <p>Selecting the due set uses {@code scheduledAt <= now}; staleness uses a strict
 * {@code <}, so a job overdue by exactly one interval plus its tolerance still runs.</p>
 *
 * <ul>
 *   <li>On time: a fresh job instance performs it, then the descriptor is deleted</li>
 *   <li>Stale: the job type's {@link OutOfTimeStrategy} decides (raise, ignore or hook)</li>
 * </ul>
 *
 * <p><b>Error Handling:</b> nothing is caught. The first exception (from a job, a hook, the
 * raise strategy, configuration or the repository) aborts the tick and propagates unchanged.
 * The descriptor that failed and every descriptor not reached yet stay in the repository and
 * are evaluated again on the next tick.</p>
 *
 * <p><b>Thread Safety:</b> the Dispatcher does no locking. At most one tick may run at a time
 * across every process sharing the repository; callers provide that guarantee.</p>
 *
 * <p><b>Usage Example:</b></p>
 * <pre>{@code
 * DispatcherContext context = new DispatcherContext(Duration.ofMinutes(10), repository, Clock.systemUTC());
 * Dispatcher dispatcher = new Dispatcher(context, registry);
 *
 * // From the host's poller, once per interval:
 * dispatcher.tick();
 * }</pre>
 *
 * @see JobScheduler
 * @see JobRepository#eachDueJob
 */
public class Dispatcher {
    private static final Logger logger = Logger.getLogger(Dispatcher.class.getName());

    private final DispatcherContext context;
    private final JobRegistry registry;

    public Dispatcher(DispatcherContext context, JobRegistry registry) {
        this.context = Objects.requireNonNull(context, "context");
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    /**
     * Process every due job once.
     *
     * @return counts of executed, ignored and hooked jobs
     * @throws com.kickahead.core.ConfigurationException if the context cannot run a tick;
     *         the repository is not touched
     * @throws OutOfIntervalException if a stale job's strategy is RAISE_EXCEPTION
     * @throws InvalidStrategyException if a stale job's strategy is not recognized
     * @throws com.kickahead.core.UnknownJobTypeException if a descriptor names an unregistered type
     * @throws Exception anything a job's perform or out-of-time hook throws, unchanged
     */
    public TickResult tick() throws Exception {
        context.validate();

        Duration interval = context.getTickInterval();
        JobRepository repository = context.getRepository();
        Instant now = context.getClock().instant();
        TickCounter counter = new TickCounter();

        repository.eachDueJob(now, descriptor -> {
            if (isStale(descriptor, now, interval)) {
                handleOutOfTime(descriptor, counter);
            } else {
                execute(descriptor);
                counter.executed++;
            }
        });

        TickResult result = counter.toResult();
        if (result.getTotal() > 0) {
            logger.info("Tick at " + now + " handled " + result.getTotal() + " job(s): " + result);
        } else {
            logger.fine("Tick at " + now + ": nothing due");
        }
        return result;
    }

    /**
     * Check whether a due descriptor missed its window.
     *
     * @param descriptor a due descriptor
     * @param now the time the current tick started
     * @param interval the configured tick interval
     * @return true if the job is overdue by more than one interval plus its type's tolerance
     */
    public boolean isStale(JobDescriptor descriptor, Instant now, Duration interval) {
        Duration tolerance = registry.getTolerance(descriptor.getJobType());
        Instant deadline = now.minus(interval).minus(tolerance);
        return descriptor.getScheduledAt().isBefore(deadline);
    }

    /**
     * Perform a job on a fresh instance and delete its descriptor once it succeeds.
     * A failure leaves the descriptor in the repository.
     *
     * @param descriptor the on-time descriptor
     * @throws Exception whatever the job throws
     */
    public void execute(JobDescriptor descriptor) throws Exception {
        Job job = registry.newInstance(descriptor.getJobType());
        logger.fine("Performing " + descriptor.getJobType() + " " + descriptor.getId());

        job.perform(descriptor.getArgs());
        context.getRepository().delete(descriptor.getId());
    }

    // Applies the job type's out-of-time strategy to a stale descriptor
    private void handleOutOfTime(JobDescriptor descriptor, TickCounter counter) throws Exception {
        String jobType = descriptor.getJobType();
        OutOfTimeStrategy strategy = registry.getOutOfTimeStrategy(jobType);
        logger.warning("Job " + descriptor.getId() + " (" + jobType + ") scheduled at "
            + descriptor.getScheduledAt() + " is out of time, strategy: " + strategy);

        switch (strategy) {
            case RAISE_EXCEPTION:
                throw new OutOfIntervalException(descriptor);

            case IGNORE:
                context.getRepository().delete(descriptor.getId());
                counter.ignored++;
                break;

            case HOOK:
                Job job = registry.newInstance(jobType);
                job.outOfTimeHook(descriptor.getScheduledAt(), descriptor.getArgs());
                context.getRepository().delete(descriptor.getId());
                counter.hooked++;
                break;
        }
    }

    private static final class TickCounter {
        private int executed;
        private int ignored;
        private int hooked;

        private TickResult toResult() {
            return new TickResult(executed, ignored, hooked);
        }
    }
}
