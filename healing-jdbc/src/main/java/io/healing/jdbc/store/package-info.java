/**
 * JDBC {@link io.healing.spi.JobStore} implementations for H2, MySQL/TiDB and PostgreSQL,
 * discovered through {@link io.healing.jdbc.store.JdbcJobStores}.
 */
package io.healing.jdbc.store;
