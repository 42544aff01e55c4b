/**
 * JDBC support for the healing queue: connection provider, table name validation and
 * the statement helper shared by the stores in {@link io.healing.jdbc.store}.
 */
package io.healing.jdbc;
