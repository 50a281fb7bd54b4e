package com.kickahead.db;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.ToNumberPolicy;
import com.google.gson.reflect.TypeToken;
import com.kickahead.core.JobDescriptor;
import com.kickahead.core.RepositoryException;

import java.lang.reflect.Type;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.logging.Logger;

/**
 * {@link JobRepository} persisting descriptors in the {@code scheduled_jobs} table.
 *
 * <p>Arguments are stored as a JSON array. Values come back as JSON types: strings,
 * booleans, {@code Long} for integral numbers, {@code Double} for the rest, and lists and
 * maps for structured values. Timestamps are stored in UTC with nanosecond precision.</p>
 *
 * <p>All methods use PreparedStatement and try-with-resources; SQL failures are rethrown
 * as {@link RepositoryException}.</p>
 */
public class JdbcJobRepository implements JobRepository {
    private static final Logger logger = Logger.getLogger(JdbcJobRepository.class.getName());

    private static final Gson gson = new GsonBuilder()
        .serializeNulls()
        .setObjectToNumberStrategy(ToNumberPolicy.LONG_OR_DOUBLE)
        .create();
    private static final Type ARGS_TYPE = new TypeToken<List<Object>>() {}.getType();

    private final Database database;
    private final Clock clock;

    public JdbcJobRepository(Database database) {
        this(database, Clock.systemUTC());
    }

    /**
     * @param database an initialized database
     * @param clock stamps {@code created_at}; pass the dispatcher context's clock
     */
    public JdbcJobRepository(Database database, Clock clock) {
        this.database = Objects.requireNonNull(database, "database");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public String create(String jobType, Instant scheduledAt, List<Object> args) {
        String id = UUID.randomUUID().toString();
        String sql = "INSERT INTO scheduled_jobs (id, job_type, scheduled_at, job_args, created_at) VALUES (?, ?, ?, ?, ?)";

        try {
            database.withConnection(conn -> {
                try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                    stmt.setString(1, id);
                    stmt.setString(2, jobType);
                    stmt.setObject(3, toUtc(scheduledAt));
                    stmt.setString(4, gson.toJson(args == null ? List.of() : args));
                    stmt.setObject(5, toUtc(clock.instant()));
                    return stmt.executeUpdate();
                }
            });
        } catch (SQLException e) {
            throw new RepositoryException("Failed to create job of type " + jobType, e);
        }

        logger.fine("Stored job " + id + " (" + jobType + ") for " + scheduledAt);
        return id;
    }

    @Override
    public void eachDueJob(Instant now, DueJobCallback callback) throws Exception {
        // Read the whole due set before calling back; callbacks delete rows as they go
        for (JobDescriptor descriptor : findDueJobs(now)) {
            callback.accept(descriptor);
        }
    }

    /**
     * Get every descriptor scheduled at or before {@code now}.
     *
     * @param now the current time of the caller
     * @return the due descriptors, oldest first
     */
    public List<JobDescriptor> findDueJobs(Instant now) {
        String sql = "SELECT id, job_type, scheduled_at, job_args FROM scheduled_jobs WHERE scheduled_at <= ? ORDER BY scheduled_at ASC";

        try {
            return database.withConnection(conn -> {
                try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                    stmt.setObject(1, toUtc(now));
                    try (ResultSet rs = stmt.executeQuery()) {
                        List<JobDescriptor> due = new ArrayList<>();
                        while (rs.next()) {
                            due.add(mapRow(rs));
                        }
                        return due;
                    }
                }
            });
        } catch (SQLException e) {
            throw new RepositoryException("Failed to query due jobs", e);
        }
    }

    /**
     * Look up a pending descriptor.
     *
     * @param id the descriptor identifier
     * @return the descriptor, or empty if it is not pending
     */
    public Optional<JobDescriptor> find(String id) {
        String sql = "SELECT id, job_type, scheduled_at, job_args FROM scheduled_jobs WHERE id = ?";

        try {
            return database.withConnection(conn -> {
                try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                    stmt.setString(1, id);
                    try (ResultSet rs = stmt.executeQuery()) {
                        return rs.next() ? Optional.of(mapRow(rs)) : Optional.<JobDescriptor>empty();
                    }
                }
            });
        } catch (SQLException e) {
            throw new RepositoryException("Failed to load job " + id, e);
        }
    }

    @Override
    public void delete(String id) {
        if (id == null) {
            throw new IllegalArgumentException("Cannot delete a job without an id");
        }
        String sql = "DELETE FROM scheduled_jobs WHERE id = ?";

        try {
            int deleted = database.withConnection(conn -> {
                try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                    stmt.setString(1, id);
                    return stmt.executeUpdate();
                }
            });
            if (deleted == 0) {
                logger.fine("Job " + id + " was already gone");
            }
        } catch (SQLException e) {
            throw new RepositoryException("Failed to delete job " + id, e);
        }
    }

    @Override
    public int size() {
        String sql = "SELECT COUNT(*) FROM scheduled_jobs";

        try {
            return database.withConnection(conn -> {
                try (PreparedStatement stmt = conn.prepareStatement(sql);
                     ResultSet rs = stmt.executeQuery()) {
                    return rs.next() ? rs.getInt(1) : 0;
                }
            });
        } catch (SQLException e) {
            throw new RepositoryException("Failed to count jobs", e);
        }
    }

    private JobDescriptor mapRow(ResultSet rs) throws SQLException {
        OffsetDateTime scheduledAt = rs.getObject("scheduled_at", OffsetDateTime.class);
        List<Object> args = gson.fromJson(rs.getString("job_args"), ARGS_TYPE);
        return new JobDescriptor(
            rs.getString("id"),
            rs.getString("job_type"),
            scheduledAt.toInstant(),
            args
        );
    }

    private static OffsetDateTime toUtc(Instant instant) {
        return instant.atOffset(ZoneOffset.UTC);
    }
}
