package com.kickahead.core;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A pending unit of deferred work as stored by a {@link com.kickahead.db.JobRepository}.
 *
 * <p>Descriptors are immutable. The dispatcher never changes one; it either deletes it
 * from the repository or leaves it in place.</p>
 */
public final class JobDescriptor {
    private final String id;
    private final String jobType;
    private final Instant scheduledAt;
    private final List<Object> args;

    public JobDescriptor(String id, String jobType, Instant scheduledAt, List<Object> args) {
        this.id = id;
        this.jobType = Objects.requireNonNull(jobType, "jobType");
        this.scheduledAt = Objects.requireNonNull(scheduledAt, "scheduledAt");
        // ArrayList copy: args may legitimately contain nulls
        this.args = args == null
            ? Collections.emptyList()
            : Collections.unmodifiableList(new ArrayList<>(args));
    }

    /** Repository-assigned identifier, used for deletion. */
    public String getId() {
        return id;
    }

    public String getJobType() {
        return jobType;
    }

    public Instant getScheduledAt() {
        return scheduledAt;
    }

    public List<Object> getArgs() {
        return args;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof JobDescriptor)) return false;
        JobDescriptor that = (JobDescriptor) o;
        return Objects.equals(id, that.id)
            && jobType.equals(that.jobType)
            && scheduledAt.equals(that.scheduledAt)
            && args.equals(that.args);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, jobType, scheduledAt, args);
    }

    @Override
    public String toString() {
        return "JobDescriptor{" +
                "id='" + id + '\'' +
                ", jobType='" + jobType + '\'' +
                ", scheduledAt=" + scheduledAt +
                ", args=" + args +
                '}';
    }
}
