package com.kickahead.db;

import java.time.Instant;
import java.util.List;

/**
 * Durable store of pending job descriptors.
 *
 * <p>The dispatcher treats the repository as a trusted, consistent read/delete surface:
 * it performs no caching, retries or transactional grouping across descriptors. Storage
 * failures are reported as {@link com.kickahead.core.RepositoryException}.</p>
 *
 * <p>The "now" passed to {@link #eachDueJob} comes from the same clock the dispatcher uses,
 * so implementations must not consult a clock of their own.</p>
 */
public interface JobRepository {

    /**
     * Persist a new descriptor.
     *
     * @param jobType the registered job type name
     * @param scheduledAt the earliest moment the job may run
     * @param args the job arguments, in order
     * @return the identifier assigned to the new descriptor
     */
    String create(String jobType, Instant scheduledAt, List<Object> args);

    /**
     * Invoke {@code callback} once for every descriptor whose scheduled time is at or
     * before {@code now}. No ordering is guaranteed. The callback may delete the descriptor
     * it receives.
     *
     * @param now the current time of the caller
     * @param callback receives each due descriptor
     * @throws Exception whatever the callback throws, unchanged
     */
    void eachDueJob(Instant now, DueJobCallback callback) throws Exception;

    /**
     * Delete a descriptor. Deleting an identifier that is no longer stored is a no-op.
     *
     * @param id the descriptor identifier
     * @throws IllegalArgumentException if {@code id} is null
     */
    void delete(String id);

    /**
     * Get the number of pending descriptors.
     *
     * @return the pending count
     */
    int size();
}
