package com.kickahead.core;

import java.time.Instant;
import java.util.List;

/**
 * Job interface representing a deferred unit of work.
 * Implementations are registered in the {@link JobRegistry} under a stable job type name
 * and a fresh instance is created for every descriptor the dispatcher handles.
 */
public interface Job {

    /**
     * Execute the job's business logic.
     * This method is called when a descriptor is due and still within its tolerance window.
     *
     * @param args the arguments the job was scheduled with, in their original order
     * @throws Exception if job execution fails. The exception is not caught by the dispatcher:
     *                   it aborts the current tick and the descriptor stays persisted so the
     *                   next tick sees it again.
     */
    void perform(List<Object> args) throws Exception;

    /**
     * Called instead of {@link #perform(List)} when the descriptor is stale and the job type's
     * out-of-time strategy is {@link OutOfTimeStrategy#HOOK}.
     *
     * <p>The descriptor is deleted only after this method returns normally.</p>
     *
     * @param scheduledAt the moment the job was originally scheduled for
     * @param args the arguments the job was scheduled with
     * @throws Exception if the remediation fails; propagates out of the tick
     */
    default void outOfTimeHook(Instant scheduledAt, List<Object> args) throws Exception {
        throw new UnsupportedOperationException(
            getClass().getSimpleName() + " does not implement outOfTimeHook");
    }
}
