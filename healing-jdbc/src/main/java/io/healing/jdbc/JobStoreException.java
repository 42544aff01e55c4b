package io.healing.jdbc;

/**
 * Unchecked exception wrapping JDBC errors thrown by {@link io.healing.jdbc.store.AbstractJdbcJobStore}
 * and its subclasses.
 */
public final class JobStoreException extends RuntimeException {
    public JobStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
