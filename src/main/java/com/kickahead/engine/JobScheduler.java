package com.kickahead.engine;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

import com.kickahead.core.ConfigurationException;
import com.kickahead.core.JobRegistry;
import com.kickahead.core.UnknownJobTypeException;
import com.kickahead.db.JobRepository;

/**
 * Schedules jobs for a later tick.
 *
 * <p>Both operations only write a descriptor to the repository; nothing runs until a
 * {@link Dispatcher#tick()} finds it due.</p>
 *
 * <pre>{@code
 * JobScheduler scheduler = new JobScheduler(context, registry);
 * scheduler.runIn("ReminderJob", Duration.ofHours(1), "ana@example.com", "Standup");
 * scheduler.runAt("ReminderJob", Instant.parse("2030-01-01T09:00:00Z"), "ana@example.com", "New year");
 * }</pre>
 */
public class JobScheduler {
    private static final Logger logger = Logger.getLogger(JobScheduler.class.getName());

    private final DispatcherContext context;
    private final JobRegistry registry;

    public JobScheduler(DispatcherContext context, JobRegistry registry) {
        this.context = Objects.requireNonNull(context, "context");
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    /**
     * Schedule a job {@code delta} after the context clock's current time.
     *
     * @param jobType a registered job type
     * @param delta how far ahead to run it
     * @param args arguments passed to the job, in order
     * @return the id assigned by the repository
     * @throws UnknownJobTypeException if the job type is not registered
     * @throws ConfigurationException if no clock or repository is configured
     */
    public String runIn(String jobType, Duration delta, Object... args) {
        Objects.requireNonNull(delta, "delta");
        Clock clock = context.getClock();
        if (clock == null) {
            throw new ConfigurationException("No clock configured: cannot compute a relative schedule time");
        }
        return runAt(jobType, clock.instant().plus(delta), args);
    }

    /**
     * Schedule a job at an absolute time.
     *
     * @param jobType a registered job type
     * @param time when to run it
     * @param args arguments passed to the job, in order
     * @return the id assigned by the repository
     * @throws UnknownJobTypeException if the job type is not registered
     * @throws ConfigurationException if no repository is configured
     */
    public String runAt(String jobType, Instant time, Object... args) {
        Objects.requireNonNull(time, "time");
        if (!registry.isRegistered(jobType)) {
            throw new UnknownJobTypeException(jobType);
        }
        JobRepository repository = context.getRepository();
        if (repository == null) {
            throw new ConfigurationException("No job repository configured");
        }

        List<Object> argList = args == null ? List.of() : Arrays.asList(args);
        String id = repository.create(jobType, time, argList);
        logger.info("Scheduled " + jobType + " " + id + " at " + time);
        return id;
    }
}
