package io.healing.jdbc.store;

import io.healing.jdbc.JdbcTemplate;
import io.healing.model.JobState;
import io.healing.model.QueuedJob;

import java.sql.Connection;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Objects;

/**
 * MySQL job store. Also compatible with TiDB.
 *
 * <p>Inserts with {@code INSERT IGNORE}. Claims with {@code UPDATE...ORDER BY...LIMIT}
 * followed by a {@code SELECT} of the rows stamped with this owner and lock time. Bounded
 * deletes use {@code DELETE...ORDER BY...LIMIT}, since MySQL rejects a subquery on the
 * table being deleted from.
 *
 * <p>The read-back matches on owner and lock timestamp, so two claims by the same owner
 * within one millisecond can return overlapping rows. Workers claim once per drain cycle,
 * which keeps them apart; for tighter loops prefer {@link PostgresJobStore}.
 */
public final class MySqlJobStore extends AbstractJdbcJobStore {

    public MySqlJobStore() {
        super();
    }

    public MySqlJobStore(String tableName) {
        super(tableName);
    }

    @Override
    public AbstractJdbcJobStore withTableName(String tableName) {
        return new MySqlJobStore(tableName);
    }

    @Override
    public String name() {
        return "mysql";
    }

    @Override
    public List<String> jdbcUrlPrefixes() {
        return List.of("jdbc:mysql:", "jdbc:tidb:");
    }

    @Override
    public boolean insertIfAbsent(Connection conn, QueuedJob job) {
        return JdbcTemplate.update(conn, insertSql("INSERT IGNORE INTO"), insertParams(job)) > 0;
    }

    @Override
    public List<QueuedJob> claim(Connection conn, String queueName, String ownerId, Instant now, int limit) {
        Objects.requireNonNull(ownerId, "ownerId");
        // Truncate to millis so stored value matches query (DB may drop nanos)
        Instant nowMs = now.truncatedTo(ChronoUnit.MILLIS);
        String claimSql = "UPDATE " + tableName() +
                " SET state=" + ACTIVE + ", attempts_made=attempts_made+1, locked_by=?, locked_at=?" +
                " WHERE queue_name=? AND state IN " + CLAIMABLE_STATE_IN + " AND available_at <= ?" +
                " ORDER BY available_at, created_at LIMIT ?";
        int updated = JdbcTemplate.update(conn, claimSql, ownerId, nowMs, queueName, now, limit);
        if (updated == 0) return List.of();
        return selectClaimed(conn, queueName, ownerId, nowMs);
    }

    @Override
    public int purgeExpired(Connection conn, String queueName, Instant now, int limit) {
        String sql = "DELETE FROM " + tableName() +
                " WHERE queue_name=? AND state IN " + TERMINAL_STATE_IN +
                " AND expires_at IS NOT NULL AND expires_at < ?" +
                " ORDER BY expires_at LIMIT ?";
        return JdbcTemplate.update(conn, sql, queueName, now, limit);
    }

    @Override
    public int deleteByState(Connection conn, String queueName, JobState state, int limit) {
        String sql = "DELETE FROM " + tableName() +
                " WHERE queue_name=? AND state=? ORDER BY created_at LIMIT ?";
        return JdbcTemplate.update(conn, sql, queueName, state.code(), limit);
    }
}
