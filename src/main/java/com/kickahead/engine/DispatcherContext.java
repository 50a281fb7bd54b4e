package com.kickahead.engine;

import com.kickahead.core.ConfigurationException;
import com.kickahead.db.JobRepository;

import java.time.Clock;
import java.time.Duration;

/**
 * Settings shared by the {@link Dispatcher} and the {@link JobScheduler}: the tick interval,
 * the repository and the clock.
 *
 * <p>The context is owned by the host application. It can be changed between ticks; nothing
 * is validated on assignment, {@link #validate()} runs at the start of every tick instead.</p>
 *
 * <p>The clock must be the same time source the repository's "now" is compared against;
 * pass the same context to every component that reads the time.</p>
 */
public class DispatcherContext {
    private volatile Duration tickInterval;
    private volatile JobRepository repository;
    private volatile Clock clock;

    public DispatcherContext() {
        this(null, null, Clock.systemUTC());
    }

    /**
     * Create a fully configured context.
     *
     * @param tickInterval the declared upper bound between consecutive ticks
     * @param repository the store of pending jobs
     * @param clock the time source shared with the repository
     */
    public DispatcherContext(Duration tickInterval, JobRepository repository, Clock clock) {
        this.tickInterval = tickInterval;
        this.repository = repository;
        this.clock = clock;
    }

    public Duration getTickInterval() {
        return tickInterval;
    }

    public void setTickInterval(Duration tickInterval) {
        this.tickInterval = tickInterval;
    }

    public JobRepository getRepository() {
        return repository;
    }

    public void setRepository(JobRepository repository) {
        this.repository = repository;
    }

    public Clock getClock() {
        return clock;
    }

    public void setClock(Clock clock) {
        this.clock = clock;
    }

    /**
     * Check that a tick can run.
     *
     * @throws ConfigurationException if the tick interval is missing or not positive, or
     *                                the clock or repository is missing
     */
    public void validate() {
        Duration interval = tickInterval;
        if (interval == null) {
            throw new ConfigurationException("No tick interval configured! Please set the dispatcher's tick interval");
        }
        if (interval.isZero() || interval.isNegative()) {
            throw new ConfigurationException("Tick interval must be > 0 but was " + interval);
        }
        if (clock == null) {
            throw new ConfigurationException("No clock configured: the dispatcher needs a way to know the current time");
        }
        if (repository == null) {
            throw new ConfigurationException("No job repository configured");
        }
    }

    @Override
    public String toString() {
        return "DispatcherContext{" +
                "tickInterval=" + tickInterval +
                ", repository=" + (repository == null ? null : repository.getClass().getSimpleName()) +
                ", clock=" + clock +
                '}';
    }
}
