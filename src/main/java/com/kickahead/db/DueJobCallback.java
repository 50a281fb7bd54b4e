package com.kickahead.db;

import com.kickahead.core.JobDescriptor;

/**
 * Receives each due descriptor from {@link JobRepository#eachDueJob}.
 * Anything thrown here propagates out of {@code eachDueJob} unchanged and stops the iteration.
 */
@FunctionalInterface
public interface DueJobCallback {

    void accept(JobDescriptor descriptor) throws Exception;
}
