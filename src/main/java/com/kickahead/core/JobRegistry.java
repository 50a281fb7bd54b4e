package com.kickahead.core;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Registry of job definitions keyed by job type name.
 *
 * <p>Each entry holds a factory producing fresh {@link Job} instances, an optional parent
 * type, and the type's own tolerance and out-of-time strategy. Reading a setting walks the
 * parent chain: a type that has not set a value uses the value of its nearest ancestor that
 * has one, falling back to the registry-wide default. Setting a value on a type never
 * changes what its parent or siblings resolve to.</p>
 *
 * <p>A parent must be registered before its children, so the chain cannot contain cycles.
 * Types may be registered without a factory to carry configuration shared by their
 * children only.</p>
 *
 * <p><b>Usage:</b></p>
 * <pre>{@code
 * JobRegistry registry = new JobRegistry();
 * registry.register("ReminderJob", () -> new ReminderJob(outbox));
 * registry.register("InvoiceReminderJob", "ReminderJob", () -> new InvoiceReminderJob(outbox));
 *
 * registry.setTolerance("ReminderJob", Duration.ofMinutes(9));
 * registry.getTolerance("InvoiceReminderJob"); // PT9M, inherited
 * }</pre>
 *
 * <p><b>Thread Safety:</b> Registration and configuration may happen while another thread
 * reads settings; entries live in a ConcurrentHashMap and their settings are volatile.</p>
 */
public class JobRegistry {
    private static final Logger logger = Logger.getLogger(JobRegistry.class.getName());

    public static final Duration DEFAULT_TOLERANCE = Duration.ZERO;
    public static final OutOfTimeStrategy DEFAULT_OUT_OF_TIME_STRATEGY = OutOfTimeStrategy.RAISE_EXCEPTION;

    private final Map<String, Definition> definitions = new ConcurrentHashMap<>();

    private volatile Duration defaultTolerance = DEFAULT_TOLERANCE;
    private volatile OutOfTimeStrategy defaultOutOfTimeStrategy = DEFAULT_OUT_OF_TIME_STRATEGY;

    private static final class Definition {
        private final String jobType;
        private final String parentType;
        private final Supplier<? extends Job> factory;
        private volatile Duration tolerance;
        // Kept as a name so that invalid values configured as text fail at resolution time
        private volatile String outOfTimeStrategy;

        private Definition(String jobType, String parentType, Supplier<? extends Job> factory) {
            this.jobType = jobType;
            this.parentType = parentType;
            this.factory = factory;
        }
    }

    /**
     * Register a root job type.
     *
     * @param jobType the stable type name stored in job descriptors
     * @param factory creates a fresh job instance per execution
     * @return this registry
     */
    public JobRegistry register(String jobType, Supplier<? extends Job> factory) {
        return register(jobType, null, factory);
    }

    /**
     * Register a job type that inherits configuration from {@code parentType}.
     *
     * @param jobType the stable type name stored in job descriptors
     * @param parentType an already registered type, or null for a root type
     * @param factory creates a fresh job instance per execution
     * @return this registry
     * @throws UnknownJobTypeException if the parent is not registered
     * @throws IllegalArgumentException if the job type is already registered
     */
    public JobRegistry register(String jobType, String parentType, Supplier<? extends Job> factory) {
        Objects.requireNonNull(factory, "factory");
        define(jobType, parentType, factory);
        return this;
    }

    /**
     * Register a job type that only carries configuration for its children.
     * Instances of it cannot be created.
     *
     * @param jobType the type name
     * @param parentType an already registered type, or null for a root type
     * @return this registry
     */
    public JobRegistry registerAbstract(String jobType, String parentType) {
        define(jobType, parentType, null);
        return this;
    }

    private void define(String jobType, String parentType, Supplier<? extends Job> factory) {
        Objects.requireNonNull(jobType, "jobType");
        if (parentType != null && !definitions.containsKey(parentType)) {
            throw new UnknownJobTypeException(parentType,
                "Parent job type " + parentType + " must be registered before " + jobType);
        }
        Definition previous = definitions.putIfAbsent(jobType, new Definition(jobType, parentType, factory));
        if (previous != null) {
            throw new IllegalArgumentException("Job type already registered: " + jobType);
        }
        logger.fine("Registered job type " + jobType + (parentType != null ? " (parent: " + parentType + ")" : ""));
    }

    public boolean isRegistered(String jobType) {
        return jobType != null && definitions.containsKey(jobType);
    }

    /**
     * Get the parent of a registered job type.
     *
     * @param jobType a registered type
     * @return the parent type, or empty for a root type
     */
    public Optional<String> getParent(String jobType) {
        return Optional.ofNullable(lookup(jobType).parentType);
    }

    /**
     * Get the chain from {@code jobType} up to its root, starting with the type itself.
     *
     * @param jobType a registered type
     * @return the unmodifiable ancestry
     */
    public List<String> getLineage(String jobType) {
        List<String> lineage = new ArrayList<>();
        for (Definition d = lookup(jobType); d != null; d = parentOf(d)) {
            lineage.add(d.jobType);
        }
        return Collections.unmodifiableList(lineage);
    }

    /**
     * Create a fresh instance of the job registered under {@code jobType}.
     *
     * @param jobType the type name from a job descriptor
     * @return a new job instance
     * @throws UnknownJobTypeException if the type is not registered or has no factory
     */
    public Job newInstance(String jobType) {
        Definition definition = lookup(jobType);
        if (definition.factory == null) {
            throw new UnknownJobTypeException(jobType,
                "Job type " + jobType + " is registered without a factory and cannot be instantiated");
        }
        Job job = definition.factory.get();
        if (job == null) {
            throw new IllegalStateException("Factory for job type " + jobType + " returned null");
        }
        return job;
    }

    // ==================== TOLERANCE ====================

    /**
     * Set the tolerance of a job type: the grace period beyond one tick interval before
     * a due job of this type is considered stale.
     *
     * @param jobType a registered type
     * @param tolerance zero or positive duration
     */
    public void setTolerance(String jobType, Duration tolerance) {
        lookup(jobType).tolerance = requireNonNegative(tolerance);
    }

    /** Remove the type's own tolerance so it inherits again. */
    public void clearTolerance(String jobType) {
        lookup(jobType).tolerance = null;
    }

    /**
     * Resolve the tolerance for a job type through its parent chain.
     *
     * @param jobType a registered type
     * @return the type's own value, else the nearest ancestor's, else the registry default
     */
    public Duration getTolerance(String jobType) {
        for (Definition d = lookup(jobType); d != null; d = parentOf(d)) {
            Duration tolerance = d.tolerance;
            if (tolerance != null) {
                return tolerance;
            }
        }
        return defaultTolerance;
    }

    public Duration getDefaultTolerance() {
        return defaultTolerance;
    }

    public void setDefaultTolerance(Duration tolerance) {
        this.defaultTolerance = requireNonNegative(tolerance);
    }

    // ==================== OUT OF TIME STRATEGY ====================

    public void setOutOfTimeStrategy(String jobType, OutOfTimeStrategy strategy) {
        Objects.requireNonNull(strategy, "strategy");
        lookup(jobType).outOfTimeStrategy = strategy.getConfigName();
    }

    /**
     * Set the strategy of a job type by name, as read from configuration.
     * The name is not validated here; an unknown name fails when it is resolved.
     *
     * @param jobType a registered type
     * @param strategyName e.g. "raise_exception", "ignore" or "hook"
     */
    public void setOutOfTimeStrategy(String jobType, String strategyName) {
        Objects.requireNonNull(strategyName, "strategyName");
        lookup(jobType).outOfTimeStrategy = strategyName;
    }

    /** Remove the type's own strategy so it inherits again. */
    public void clearOutOfTimeStrategy(String jobType) {
        lookup(jobType).outOfTimeStrategy = null;
    }

    /**
     * Resolve the out-of-time strategy for a job type through its parent chain.
     *
     * @param jobType a registered type
     * @return the resolved strategy
     * @throws InvalidStrategyException if the value found does not name a strategy
     */
    public OutOfTimeStrategy getOutOfTimeStrategy(String jobType) {
        for (Definition d = lookup(jobType); d != null; d = parentOf(d)) {
            String name = d.outOfTimeStrategy;
            if (name != null) {
                String definedOn = d.jobType;
                return OutOfTimeStrategy.lookup(name)
                    .orElseThrow(() -> new InvalidStrategyException(name, definedOn));
            }
        }
        return defaultOutOfTimeStrategy;
    }

    public OutOfTimeStrategy getDefaultOutOfTimeStrategy() {
        return defaultOutOfTimeStrategy;
    }

    public void setDefaultOutOfTimeStrategy(OutOfTimeStrategy strategy) {
        this.defaultOutOfTimeStrategy = Objects.requireNonNull(strategy, "strategy");
    }

    private Definition lookup(String jobType) {
        Definition definition = jobType == null ? null : definitions.get(jobType);
        if (definition == null) {
            throw new UnknownJobTypeException(jobType);
        }
        return definition;
    }

    private Definition parentOf(Definition definition) {
        return definition.parentType == null ? null : definitions.get(definition.parentType);
    }

    private static Duration requireNonNegative(Duration tolerance) {
        Objects.requireNonNull(tolerance, "tolerance");
        if (tolerance.isNegative()) {
            throw new IllegalArgumentException("tolerance must be >= 0 but was " + tolerance);
        }
        return tolerance;
    }
}
