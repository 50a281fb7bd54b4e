package com.kickahead.app;

import com.kickahead.core.OutOfIntervalException;
import com.kickahead.engine.Dispatcher;
import com.kickahead.engine.TickResult;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Host-side poller that calls {@link Dispatcher#tick()} periodically.
 *
 * <p>Ticks start at a fixed rate on a single thread, so a slow tick delays the next start
 * but never stretches the gap that follows it, and two ticks never overlap inside this
 * process. Running several processes against one shared repository still needs an
 * external lock.</p>
 *
 * <p>A failed tick is logged and the poller keeps going: the dispatcher left the failing
 * job in the repository, so the next tick sees it again.</p>
 */
public class TickPoller {
    private static final Logger logger = Logger.getLogger(TickPoller.class.getName());

    private final Dispatcher dispatcher;
    private final Duration period;
    private final ScheduledExecutorService executor;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicInteger tickCount = new AtomicInteger();
    private final AtomicInteger failureCount = new AtomicInteger();
    private final AtomicReference<TickResult> lastResult = new AtomicReference<>();

    /**
     * Create a poller that starts ticks twice per tick interval, leaving half an interval
     * of headroom for slow ticks and scheduler jitter.
     *
     * @param dispatcher the dispatcher to drive
     * @param tickInterval the dispatcher's configured tick interval
     * @return a poller, not started yet
     */
    public static TickPoller forTickInterval(Dispatcher dispatcher, Duration tickInterval) {
        if (tickInterval == null || tickInterval.isZero() || tickInterval.isNegative()) {
            throw new IllegalArgumentException("tickInterval must be > 0");
        }
        return new TickPoller(dispatcher, tickInterval.dividedBy(2));
    }

    /**
     * Create a poller.
     *
     * @param dispatcher the dispatcher to drive
     * @param period time between the starts of consecutive ticks; must stay below the
     *               dispatcher's tick interval or on-time jobs turn stale
     */
    public TickPoller(Dispatcher dispatcher, Duration period) {
        if (period == null || period.isZero() || period.isNegative()) {
            throw new IllegalArgumentException("period must be > 0");
        }
        this.dispatcher = dispatcher;
        this.period = period;
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "kickahead-tick");
            thread.setDaemon(true);
            return thread;
        });
    }

    public void start() {
        if (!running.compareAndSet(false, true)) {
            logger.warning("Tick poller is already running");
            return;
        }
        long millis = period.toMillis();
        executor.scheduleAtFixedRate(this::runTick, 0, millis, TimeUnit.MILLISECONDS);
        logger.info("Tick poller started, period " + period);
    }

    private void runTick() {
        tickCount.incrementAndGet();
        try {
            lastResult.set(dispatcher.tick());
        } catch (OutOfIntervalException e) {
            failureCount.incrementAndGet();
            logger.severe("Stale job needs an operator: " + e.getMessage());
        } catch (Exception e) {
            failureCount.incrementAndGet();
            logger.log(Level.SEVERE, "Tick failed, remaining jobs wait for the next tick", e);
        }
    }

    public void shutdown() {
        running.set(false);
        executor.shutdown();
        try {
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                logger.warning("Forcing shutdown of the running tick");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        logger.info("Tick poller stopped after " + tickCount.get() + " tick(s)");
    }

    public boolean isRunning() {
        return running.get();
    }

    public int getTickCount() {
        return tickCount.get();
    }

    public int getFailureCount() {
        return failureCount.get();
    }

    /** Result of the most recent successful tick, or null if none succeeded yet. */
    public TickResult getLastResult() {
        return lastResult.get();
    }
}
