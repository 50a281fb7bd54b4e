package com.kickahead.config;

import com.kickahead.core.ConfigurationException;
import com.kickahead.db.Database;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.HashMap;
import java.util.Map;
import java.util.Properties;

/**
 * Loads KickAheadConfig from a properties file on the classpath.
 *
 * Required keys:
 *  - kickahead.tickInterval (ISO-8601 duration, e.g. PT10M)
 *
 * Optional keys:
 *  - kickahead.database.url (defaults to {@value Database#DEFAULT_URL})
 *  - kickahead.job.&lt;type&gt;.tolerance (ISO-8601 duration)
 *  - kickahead.job.&lt;type&gt;.outOfTimeStrategy (raise_exception, ignore or hook)
 */
public final class KickAheadConfigLoader {

    private static final String JOB_PREFIX = "kickahead.job.";
    private static final String TOLERANCE_SUFFIX = ".tolerance";
    private static final String STRATEGY_SUFFIX = ".outOfTimeStrategy";

    private KickAheadConfigLoader() {}

    public static KickAheadConfig loadFromClasspath(String fileName) {
        Properties props = new Properties();

        try (InputStream in = KickAheadConfigLoader.class.getClassLoader().getResourceAsStream(fileName)) {
            if (in == null) {
                throw new ConfigurationException("Config file not found on classpath: " + fileName);
            }
            props.load(in);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load config: " + fileName, e);
        }

        return fromProperties(props);
    }

    public static KickAheadConfig fromProperties(Properties props) {
        Duration tickInterval = getDuration("kickahead.tickInterval", getString(props, "kickahead.tickInterval"));
        String databaseUrl = props.getProperty("kickahead.database.url", Database.DEFAULT_URL).trim();

        Map<String, Duration> tolerances = new HashMap<>();
        Map<String, String> strategies = new HashMap<>();
        for (String key : props.stringPropertyNames()) {
            if (!key.startsWith(JOB_PREFIX)) {
                continue;
            }
            String value = props.getProperty(key).trim();
            if (key.endsWith(TOLERANCE_SUFFIX)) {
                tolerances.put(jobType(key, TOLERANCE_SUFFIX), getDuration(key, value));
            } else if (key.endsWith(STRATEGY_SUFFIX)) {
                strategies.put(jobType(key, STRATEGY_SUFFIX), value);
            } else {
                throw new IllegalStateException("Unknown job config key: " + key);
            }
        }

        Map<String, JobSettings> jobSettings = new HashMap<>();
        for (String jobType : tolerances.keySet()) {
            jobSettings.put(jobType, new JobSettings(tolerances.get(jobType), strategies.get(jobType)));
        }
        for (String jobType : strategies.keySet()) {
            jobSettings.putIfAbsent(jobType, new JobSettings(null, strategies.get(jobType)));
        }

        return new KickAheadConfig(tickInterval, databaseUrl, jobSettings);
    }

    private static String jobType(String key, String suffix) {
        String jobType = key.substring(JOB_PREFIX.length(), key.length() - suffix.length());
        if (jobType.isEmpty()) {
            throw new IllegalStateException("Missing job type in config key: " + key);
        }
        return jobType;
    }

    private static Duration getDuration(String key, String value) {
        try {
            return Duration.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw new IllegalStateException("Invalid duration for " + key + ": " + value, e);
        }
    }

    private static String getString(Properties props, String key) {
        String value = props.getProperty(key);
        if (value == null) throw new IllegalStateException("Missing required config key: " + key);
        return value;
    }
}
