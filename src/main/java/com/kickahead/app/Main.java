package com.kickahead.app;

import com.kickahead.config.KickAheadConfig;
import com.kickahead.config.KickAheadConfigLoader;
import com.kickahead.core.JobRegistry;
import com.kickahead.db.Database;
import com.kickahead.db.JdbcJobRepository;
import com.kickahead.engine.Dispatcher;
import com.kickahead.engine.DispatcherContext;
import com.kickahead.engine.JobScheduler;
import com.kickahead.jobs.InvoiceReminderJob;
import com.kickahead.jobs.LoggingOutbox;
import com.kickahead.jobs.Outbox;
import com.kickahead.jobs.ReminderJob;

import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;
import java.time.Duration;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Demo host application.
 * Loads kickahead.properties, opens the H2 store, schedules a few reminders and ticks
 * until the JVM is stopped.
 */
public class Main {
    private static final Logger logger = Logger.getLogger(Main.class.getName());
    private static final String CONFIG_FILE = "kickahead.properties";

    public static void main(String[] args) {
        configureLogging();
        logger.info("=== Kick Ahead starting ===");

        try {
            KickAheadConfig config = KickAheadConfigLoader.loadFromClasspath(CONFIG_FILE);

            Database database = new Database(config.databaseUrl());
            database.initialize();

            JobRegistry registry = createRegistry(new LoggingOutbox());
            config.applyTo(registry);

            Clock clock = Clock.systemUTC();
            DispatcherContext context = new DispatcherContext(
                config.tickInterval(), new JdbcJobRepository(database, clock), clock);
            Dispatcher dispatcher = new Dispatcher(context, registry);

            scheduleDemoJobs(new JobScheduler(context, registry));

            TickPoller poller = TickPoller.forTickInterval(dispatcher, config.tickInterval());
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                logger.info("Shutdown signal received");
                poller.shutdown();
                database.close();
            }, "kickahead-shutdown"));
            poller.start();

            logger.info("=== Kick Ahead is running, press Ctrl+C to stop ===");
            Thread.currentThread().join();

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            logger.log(Level.SEVERE, "Fatal error during startup", e);
            System.exit(1);
        }
    }

    /**
     * Register the job types this application knows about.
     *
     * @param outbox where the reminder jobs deliver their messages
     * @return the populated registry
     */
    static JobRegistry createRegistry(Outbox outbox) {
        JobRegistry registry = new JobRegistry();
        registry.register(ReminderJob.TYPE, () -> new ReminderJob(outbox));
        registry.register(InvoiceReminderJob.TYPE, ReminderJob.TYPE, () -> new InvoiceReminderJob(outbox));
        return registry;
    }

    private static void scheduleDemoJobs(JobScheduler scheduler) {
        scheduler.runIn(ReminderJob.TYPE, Duration.ofSeconds(5), "ana@example.com", "Standup in 10 minutes");
        scheduler.runIn(InvoiceReminderJob.TYPE, Duration.ofSeconds(20), "billing@example.com", "INV-1042", 129_900L);
    }

    private static void configureLogging() {
        try (InputStream in = Main.class.getClassLoader().getResourceAsStream("logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            logger.log(Level.WARNING, "Could not read logging.properties, using JVM defaults", e);
        }
    }
}
