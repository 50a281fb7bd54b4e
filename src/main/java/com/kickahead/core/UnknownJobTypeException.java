package com.kickahead.core;

/**
 * Exception thrown when a job type name has no usable entry in the {@link JobRegistry}.
 *
 * <p>This covers names that were never registered as well as types registered without a
 * factory when an instance of them is needed.</p>
 */
public class UnknownJobTypeException extends RuntimeException {

    private final String jobType;

    public UnknownJobTypeException(String jobType) {
        super("Unknown job type: " + jobType);
        this.jobType = jobType;
    }

    public UnknownJobTypeException(String jobType, String message) {
        super(message);
        this.jobType = jobType;
    }

    public String getJobType() {
        return jobType;
    }
}
