package com.kickahead.core;

/**
 * Exception thrown when a job type's out-of-time strategy does not name a known strategy.
 *
 * <p>Strategies configured by name (for example from a properties file) are only resolved
 * when a stale job of that type is handled, so a typo surfaces during the tick that first
 * needs it. The tick is aborted and the descriptor stays persisted.</p>
 *
 * @see OutOfTimeStrategy#fromName(String)
 */
public class InvalidStrategyException extends RuntimeException {

    private final String strategy;
    private final String jobType;

    /**
     * Create a new InvalidStrategyException for a strategy value.
     *
     * @param strategy the unrecognized value (may be null)
     */
    public InvalidStrategyException(String strategy) {
        super("Invalid out of time strategy: " + strategy);
        this.strategy = strategy;
        this.jobType = null;
    }

    /**
     * Create a new InvalidStrategyException naming the job type it was configured on.
     *
     * @param strategy the unrecognized value (may be null)
     * @param jobType the job type whose configuration holds the value
     */
    public InvalidStrategyException(String strategy, String jobType) {
        super("Invalid out of time strategy '" + strategy + "' configured for job type " + jobType);
        this.strategy = strategy;
        this.jobType = jobType;
    }

    /**
     * Get the unrecognized strategy value.
     *
     * @return the value as configured, or null
     */
    public String getStrategy() {
        return strategy;
    }

    /**
     * Get the job type the value was resolved for.
     *
     * @return the job type, or null if not known
     */
    public String getJobType() {
        return jobType;
    }
}
