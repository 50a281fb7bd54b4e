package com.kickahead.core;

/**
 * Exception thrown when a job repository cannot complete a storage operation.
 * Wraps the underlying {@link java.sql.SQLException} for JDBC-backed repositories.
 */
public class RepositoryException extends RuntimeException {

    public RepositoryException(String message, Throwable cause) {
        super(message, cause);
    }
}
