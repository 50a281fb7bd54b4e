package com.kickahead.db;

import com.kickahead.core.JobDescriptor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Non-durable {@link JobRepository} keeping descriptors in a map.
 * Ids are sequential decimal strings starting at "1". Suitable for tests and for hosts
 * that do not need jobs to survive a restart.
 */
public class InMemoryJobRepository implements JobRepository {
    private final Map<String, JobDescriptor> jobs = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    @Override
    public String create(String jobType, Instant scheduledAt, List<Object> args) {
        String id = Long.toString(sequence.incrementAndGet());
        jobs.put(id, new JobDescriptor(id, jobType, scheduledAt, args));
        return id;
    }

    @Override
    public void eachDueJob(Instant now, DueJobCallback callback) throws Exception {
        // Snapshot first: the callback deletes while we iterate
        List<JobDescriptor> due = new ArrayList<>();
        for (JobDescriptor descriptor : jobs.values()) {
            if (!descriptor.getScheduledAt().isAfter(now)) {
                due.add(descriptor);
            }
        }
        for (JobDescriptor descriptor : due) {
            callback.accept(descriptor);
        }
    }

    @Override
    public void delete(String id) {
        if (id == null) {
            throw new IllegalArgumentException("Cannot delete a job without an id");
        }
        jobs.remove(id);
    }

    @Override
    public int size() {
        return jobs.size();
    }

    /**
     * Look up a pending descriptor.
     *
     * @param id the descriptor identifier
     * @return the descriptor, or empty if it is not pending
     */
    public Optional<JobDescriptor> find(String id) {
        return Optional.ofNullable(jobs.get(id));
    }
}
