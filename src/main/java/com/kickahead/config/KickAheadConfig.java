package com.kickahead.config;

import com.kickahead.core.JobRegistry;

import java.time.Duration;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Strongly-typed dispatcher configuration.
 */
public record KickAheadConfig(
        Duration tickInterval,
        String databaseUrl,
        Map<String, JobSettings> jobSettings
) {
    private static final Logger logger = Logger.getLogger(KickAheadConfig.class.getName());

    public KickAheadConfig {
        if (tickInterval == null || tickInterval.isZero() || tickInterval.isNegative()) {
            throw new IllegalArgumentException("tickInterval must be > 0");
        }
        if (databaseUrl == null || databaseUrl.isBlank()) {
            throw new IllegalArgumentException("databaseUrl must not be blank");
        }
        jobSettings = jobSettings == null ? Map.of() : Map.copyOf(jobSettings);
    }

    /**
     * Copy the per-type tolerance and strategy overrides into {@code registry}.
     * Every configured job type must already be registered.
     *
     * @param registry the registry holding the job types
     */
    public void applyTo(JobRegistry registry) {
        jobSettings.forEach((jobType, settings) -> {
            if (settings.tolerance() != null) {
                registry.setTolerance(jobType, settings.tolerance());
            }
            if (settings.outOfTimeStrategy() != null) {
                registry.setOutOfTimeStrategy(jobType, settings.outOfTimeStrategy());
            }
            logger.fine("Applied settings for " + jobType + ": " + settings);
        });
    }
}
