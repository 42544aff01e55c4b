package io.healing.jdbc;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Lightweight JDBC helper to reduce boilerplate in job store implementations.
 *
 * <p>Every {@link SQLException} is rethrown as a {@link JobStoreException}.
 */
public final class JdbcTemplate {

    /** SQLState class for integrity constraint violations (duplicate keys among them). */
    private static final String INTEGRITY_VIOLATION_CLASS = "23";

    @FunctionalInterface
    public interface RowMapper<T> {
        T map(ResultSet rs) throws SQLException;
    }

    private JdbcTemplate() {
    }

    /** Execute UPDATE, return rows affected. */
    public static int update(Connection conn, String sql, Object... params) {
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            bindParams(ps, params);
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw new JobStoreException("Failed to execute update", e);
        }
    }

    /**
     * Execute INSERT, treating an integrity constraint violation as "row already present".
     *
     * <p>Only safe where a failed statement leaves the surrounding transaction usable
     * (H2, MySQL). PostgreSQL aborts the transaction instead, so its store uses
     * {@code ON CONFLICT DO NOTHING}.
     *
     * @return {@code true} if a row was inserted
     */
    public static boolean insertIgnoringDuplicate(Connection conn, String sql, Object... params) {
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            bindParams(ps, params);
            return ps.executeUpdate() > 0;
        } catch (SQLException e) {
            String state = e.getSQLState();
            if (state != null && state.startsWith(INTEGRITY_VIOLATION_CLASS)) {
                return false;
            }
            throw new JobStoreException("Failed to execute insert", e);
        }
    }

    /** Execute SELECT, map rows. */
    public static <T> List<T> query(Connection conn, String sql, RowMapper<T> mapper, Object... params) {
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            bindParams(ps, params);
            try (ResultSet rs = ps.executeQuery()) {
                List<T> results = new ArrayList<>();
                while (rs.next()) {
                    results.add(mapper.map(rs));
                }
                return results;
            }
        } catch (SQLException e) {
            throw new JobStoreException("Failed to execute query", e);
        }
    }

    /** Execute UPDATE ... RETURNING, map returned rows (PostgreSQL). */
    public static <T> List<T> updateReturning(Connection conn, String sql, RowMapper<T> mapper, Object... params) {
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            bindParams(ps, params);
            try (ResultSet rs = ps.executeQuery()) {
                List<T> results = new ArrayList<>();
                while (rs.next()) {
                    results.add(mapper.map(rs));
                }
                return results;
            }
        } catch (SQLException e) {
            throw new JobStoreException("Failed to execute updateReturning", e);
        }
    }

    /** Null-safe {@link Timestamp} to {@link Instant} read. */
    public static Instant instant(ResultSet rs, String column) throws SQLException {
        Timestamp ts = rs.getTimestamp(column);
        return ts == null ? null : ts.toInstant();
    }

    private static void bindParams(PreparedStatement ps, Object... params) throws SQLException {
        for (int i = 0; i < params.length; i++) {
            Object param = params[i];
            if (param == null) {
                ps.setObject(i + 1, null);
            } else if (param instanceof String s) {
                ps.setString(i + 1, s);
            } else if (param instanceof Integer n) {
                ps.setInt(i + 1, n);
            } else if (param instanceof Long n) {
                ps.setLong(i + 1, n);
            } else if (param instanceof Timestamp ts) {
                ps.setTimestamp(i + 1, ts);
            } else if (param instanceof Instant instant) {
                ps.setTimestamp(i + 1, Timestamp.from(instant));
            } else {
                ps.setObject(i + 1, param);
            }
        }
    }
}
