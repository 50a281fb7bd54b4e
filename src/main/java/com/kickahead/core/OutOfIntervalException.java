package com.kickahead.core;

import java.time.Instant;
import java.util.List;

/**
 * Exception thrown when a job became stale and its out-of-time strategy is
 * {@link OutOfTimeStrategy#RAISE_EXCEPTION}.
 *
 * <p>A job is stale when no tick arrived to run it within one tick interval plus its
 * tolerance. Raising is the default strategy: the dispatcher refuses to make progress
 * past the breach, and the descriptor is left in the repository for an operator to
 * resolve (reschedule, delete, or switch the job type to another strategy).</p>
 *
 * <p><b>Example Handling:</b></p>
 * <pre>{@code
 * try {
 *     dispatcher.tick();
 * } catch (OutOfIntervalException e) {
 *     logger.severe("Stale job " + e.getJobType() + " " + e.getArgs()
 *                   + " scheduled at " + e.getScheduledAt());
 *     alertOperator(e);
 * }
 * }</pre>
 *
 * @see com.kickahead.engine.Dispatcher#tick()
 */
public class OutOfIntervalException extends RuntimeException {

    private final String jobType;
    private final List<Object> args;
    private final Instant scheduledAt;

    /**
     * Create a new OutOfIntervalException for a stale descriptor.
     *
     * @param descriptor the descriptor that could not run in time
     */
    public OutOfIntervalException(JobDescriptor descriptor) {
        super("The job of class " + descriptor.getJobType() + " with args " + descriptor.getArgs()
            + " was not possible to run because of an out of interval tick"
            + " (we didn't receive a tick in time to run it) and its maximum tolerance"
            + " threshold is also overdue.");
        this.jobType = descriptor.getJobType();
        this.args = descriptor.getArgs();
        this.scheduledAt = descriptor.getScheduledAt();
    }

    /**
     * Get the job type of the stale descriptor.
     *
     * @return the job type name
     */
    public String getJobType() {
        return jobType;
    }

    /**
     * Get the arguments of the stale descriptor.
     *
     * @return the unmodifiable argument list
     */
    public List<Object> getArgs() {
        return args;
    }

    /**
     * Get the moment the stale descriptor was scheduled for.
     *
     * @return the scheduled time
     */
    public Instant getScheduledAt() {
        return scheduledAt;
    }
}
