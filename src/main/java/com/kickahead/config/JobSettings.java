package com.kickahead.config;

import java.time.Duration;

/**
 * Per-job-type overrides read from configuration. A null component means "not set here":
 * the job type keeps inheriting that value.
 */
public record JobSettings(Duration tolerance, String outOfTimeStrategy) {
    public JobSettings {
        if (tolerance != null && tolerance.isNegative()) {
            throw new IllegalArgumentException("tolerance must be >= 0");
        }
    }
}
