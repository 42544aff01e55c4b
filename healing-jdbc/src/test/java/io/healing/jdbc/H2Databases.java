package io.healing.jdbc;

import org.h2.jdbcx.JdbcDataSource;

import java.util.UUID;

/**
 * Fresh in-memory H2 databases with the healing_job table created from the shipped DDL.
 */
public final class H2Databases {

    public static final String SCHEMA = "classpath:io/healing/jdbc/schema/h2.sql";

    private H2Databases() {
    }

    public static JdbcDataSource withSchema() {
        JdbcDataSource dataSource = new JdbcDataSource();
        dataSource.setURL("jdbc:h2:mem:" + UUID.randomUUID()
                + ";DB_CLOSE_DELAY=-1;INIT=RUNSCRIPT FROM '" + SCHEMA + "'");
        return dataSource;
    }
}
