package io.healing.jdbc;

import java.util.Objects;

/**
 * Shared table name validation for JDBC job stores.
 */
public final class TableNames {
    public static final String DEFAULT_TABLE = "healing_job";
    private static final String TABLE_NAME_PATTERN = "[a-zA-Z_][a-zA-Z0-9_]*";

    private TableNames() {
    }

    public static String validate(String tableName) {
        Objects.requireNonNull(tableName, "tableName");
        if (!tableName.matches(TABLE_NAME_PATTERN)) {
            throw new IllegalArgumentException("Invalid table name: " + tableName);
        }
        return tableName;
    }
}
