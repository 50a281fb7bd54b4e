package com.kickahead.core;

import java.util.Locale;
import java.util.Optional;

/**
 * Policy selecting how a stale job is handled.
 *
 * <p>A job is stale when it became due but no tick arrived in time to run it within one
 * tick interval plus its tolerance. The strategy is resolved per job type at the moment
 * staleness is detected:</p>
 * <ul>
 *   <li>RAISE_EXCEPTION: the tick fails with {@link OutOfIntervalException}; descriptor kept</li>
 *   <li>IGNORE: no job code runs; descriptor deleted</li>
 *   <li>HOOK: {@link Job#outOfTimeHook} runs; descriptor deleted once it returns</li>
 * </ul>
 *
 * @see JobRegistry#getOutOfTimeStrategy(String)
 */
public enum OutOfTimeStrategy {
    RAISE_EXCEPTION("raise_exception"),
    IGNORE("ignore"),
    HOOK("hook");

    private final String configName;

    OutOfTimeStrategy(String configName) {
        this.configName = configName;
    }

    /**
     * Get the name used for this strategy in configuration files.
     *
     * @return the configuration name (e.g., "raise_exception", "hook")
     */
    public String getConfigName() {
        return configName;
    }

    /**
     * Resolve a strategy from its configuration name or enum constant name, ignoring case.
     *
     * @param name the strategy name, e.g. "ignore" or "RAISE_EXCEPTION"
     * @return the matching strategy
     * @throws InvalidStrategyException if the name matches no strategy
     */
    public static OutOfTimeStrategy fromName(String name) {
        return lookup(name).orElseThrow(() -> new InvalidStrategyException(name));
    }

    /**
     * Find a strategy by name without failing.
     *
     * @param name the strategy name, may be null
     * @return the matching strategy, or empty
     */
    public static Optional<OutOfTimeStrategy> lookup(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (OutOfTimeStrategy strategy : values()) {
            if (strategy.configName.equals(normalized)) {
                return Optional.of(strategy);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return configName;
    }
}
