package io.healing.jdbc.store;

import io.healing.jdbc.JdbcTemplate;
import io.healing.model.QueuedJob;

import java.sql.Connection;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * PostgreSQL job store.
 *
 * <p>Inserts with {@code ON CONFLICT DO NOTHING}, since a failed insert would abort the
 * surrounding transaction. Claims with {@code FOR UPDATE SKIP LOCKED} and {@code RETURNING}
 * in a single round-trip.
 */
public final class PostgresJobStore extends AbstractJdbcJobStore {

    public PostgresJobStore() {
        super();
    }

    public PostgresJobStore(String tableName) {
        super(tableName);
    }

    @Override
    public AbstractJdbcJobStore withTableName(String tableName) {
        return new PostgresJobStore(tableName);
    }

    @Override
    public String name() {
        return "postgresql";
    }

    @Override
    public List<String> jdbcUrlPrefixes() {
        return List.of("jdbc:postgresql:");
    }

    @Override
    public boolean insertIfAbsent(Connection conn, QueuedJob job) {
        String sql = insertSql("INSERT INTO") + " ON CONFLICT (queue_name, job_id) DO NOTHING";
        return JdbcTemplate.update(conn, sql, insertParams(job)) > 0;
    }

    @Override
    public List<QueuedJob> claim(Connection conn, String queueName, String ownerId, Instant now, int limit) {
        Instant nowMs = now.truncatedTo(ChronoUnit.MILLIS);
        String sql = "UPDATE " + tableName() +
                " SET state=" + ACTIVE + ", attempts_made=attempts_made+1, locked_by=?, locked_at=?" +
                " WHERE queue_name=? AND job_id IN (" +
                "SELECT job_id FROM " + tableName() +
                " WHERE queue_name=? AND state IN " + CLAIMABLE_STATE_IN + " AND available_at <= ?" +
                " ORDER BY available_at, created_at LIMIT ?" +
                " FOR UPDATE SKIP LOCKED" +
                ") RETURNING " + COLUMNS;
        return JdbcTemplate.updateReturning(conn, sql, JOB_ROW_MAPPER,
                ownerId, nowMs, queueName, queueName, now, limit);
    }
}
