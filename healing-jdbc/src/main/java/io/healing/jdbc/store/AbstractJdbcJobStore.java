package io.healing.jdbc.store;

import io.healing.jdbc.JdbcTemplate;
import io.healing.jdbc.TableNames;
import io.healing.model.JobState;
import io.healing.model.QueuedJob;
import io.healing.spi.JobStore;

import java.sql.Connection;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Base JDBC job store with standard SQL implementations.
 *
 * <p>Subclasses override {@link #insertIfAbsent}, {@link #claim} and the bounded deletes to
 * provide database-specific strategies. Register custom implementations via
 * {@code META-INF/services/io.healing.jdbc.store.AbstractJdbcJobStore}. Table DDL for the
 * built-in stores ships under {@code io/healing/jdbc/schema/}.
 *
 * <p>Owner-guarded updates ({@code markCompleted}, {@code markFailed}, {@code markRetry},
 * {@code renewLock}) skip the {@code locked_by} check when {@code ownerId} is {@code null}.
 *
 * @see JdbcJobStores
 */
public abstract class AbstractJdbcJobStore implements JobStore {
    private static final int MAX_REASON_LENGTH = 4000;

    protected static final String COLUMNS =
            "queue_name, job_id, job_name, payload, state, attempts_made, max_attempts, stalled_count, " +
            "available_at, created_at, finished_at, failed_reason, remove_on_complete_ms, " +
            "remove_on_fail_ms, locked_by, locked_at";

    protected static final String CLAIMABLE_STATE_IN =
            "(" + JobState.WAITING.code() + "," + JobState.DELAYED.code() + ")";

    protected static final String TERMINAL_STATE_IN =
            "(" + JobState.COMPLETED.code() + "," + JobState.FAILED.code() + ")";

    protected static final int ACTIVE = JobState.ACTIVE.code();

    protected static final JdbcTemplate.RowMapper<QueuedJob> JOB_ROW_MAPPER = rs -> new QueuedJob(
            rs.getString("queue_name"),
            rs.getString("job_id"),
            rs.getString("job_name"),
            rs.getString("payload"),
            JobState.fromCode(rs.getInt("state")),
            rs.getInt("attempts_made"),
            rs.getInt("max_attempts"),
            rs.getInt("stalled_count"),
            JdbcTemplate.instant(rs, "available_at"),
            JdbcTemplate.instant(rs, "created_at"),
            JdbcTemplate.instant(rs, "finished_at"),
            rs.getString("failed_reason"),
            rs.getLong("remove_on_complete_ms"),
            rs.getLong("remove_on_fail_ms"),
            rs.getString("locked_by"),
            JdbcTemplate.instant(rs, "locked_at"));

    private final String tableName;

    protected AbstractJdbcJobStore() {
        this(TableNames.DEFAULT_TABLE);
    }

    protected AbstractJdbcJobStore(String tableName) {
        this.tableName = TableNames.validate(tableName);
    }

    /**
     * Unique identifier for this job store (e.g., "mysql", "postgresql", "h2").
     */
    public abstract String name();

    /**
     * JDBC URL prefixes this job store handles (e.g., "jdbc:mysql:", "jdbc:tidb:").
     */
    public abstract List<String> jdbcUrlPrefixes();

    /**
     * Returns a store of the same kind bound to another table.
     */
    public abstract AbstractJdbcJobStore withTableName(String tableName);

    protected String tableName() {
        return tableName;
    }

    @Override
    public boolean insertIfAbsent(Connection conn, QueuedJob job) {
        return JdbcTemplate.insertIgnoringDuplicate(conn, insertSql("INSERT INTO"), insertParams(job));
    }

    /**
     * Builds the insert statement with the given leading keywords, so subclasses can swap
     * in {@code INSERT IGNORE INTO} or append a conflict clause.
     */
    protected String insertSql(String insertKeyword) {
        return insertKeyword + " " + tableName() + " (" +
                "queue_name, job_id, job_name, payload, state, attempts_made, max_attempts, stalled_count, " +
                "remove_on_complete_ms, remove_on_fail_ms, available_at, created_at, " +
                "finished_at, expires_at, failed_reason, locked_by, locked_at" +
                ") VALUES (?,?,?,?,?,?,?,?,?,?,?,?,NULL,NULL,NULL,NULL,NULL)";
    }

    protected Object[] insertParams(QueuedJob job) {
        return new Object[]{
                job.queueName(), job.jobId(), job.jobName(), job.payloadJson(), job.state().code(),
                job.attemptsMade(), job.maxAttempts(), job.stalledCount(),
                job.removeOnCompleteMs(), job.removeOnFailMs(),
                job.availableAt(), job.createdAt()};
    }

    /**
     * Selects due jobs, then moves each to {@code ACTIVE} with an update guarded on its
     * current state. A row taken by a concurrent claimer in between updates zero rows and
     * is skipped, so a job is never handed to two owners.
     */
    @Override
    public List<QueuedJob> claim(Connection conn, String queueName, String ownerId, Instant now, int limit) {
        // Truncate to millis so stored value matches what is returned (DB may drop nanos)
        Instant nowMs = now.truncatedTo(ChronoUnit.MILLIS);
        String dueSql = "SELECT " + COLUMNS + " FROM " + tableName() +
                " WHERE queue_name=? AND state IN " + CLAIMABLE_STATE_IN + " AND available_at <= ?" +
                " ORDER BY available_at, created_at LIMIT ?";
        List<QueuedJob> due = JdbcTemplate.query(conn, dueSql, JOB_ROW_MAPPER, queueName, now, limit);
        if (due.isEmpty()) return List.of();

        String claimSql = "UPDATE " + tableName() +
                " SET state=" + ACTIVE + ", attempts_made=attempts_made+1, locked_by=?, locked_at=?" +
                " WHERE queue_name=? AND job_id=? AND state IN " + CLAIMABLE_STATE_IN;
        List<QueuedJob> claimed = new ArrayList<>(due.size());
        for (QueuedJob job : due) {
            if (JdbcTemplate.update(conn, claimSql, ownerId, nowMs, queueName, job.jobId()) == 1) {
                claimed.add(asClaimed(job, ownerId, nowMs));
            }
        }
        return claimed;
    }

    /**
     * Selects rows claimed by the given owner at the given lock timestamp. Shared by
     * subclasses that claim with a bulk UPDATE and read the rows back afterwards.
     */
    protected List<QueuedJob> selectClaimed(Connection conn, String queueName, String ownerId, Instant lockedAt) {
        String sql = "SELECT " + COLUMNS + " FROM " + tableName() +
                " WHERE queue_name=? AND state=" + ACTIVE + " AND locked_by=? AND locked_at=?" +
                " ORDER BY available_at, created_at";
        return JdbcTemplate.query(conn, sql, JOB_ROW_MAPPER, queueName, ownerId, lockedAt);
    }

    @Override
    public int renewLock(Connection conn, String queueName, String jobId, String ownerId, Instant now) {
        String sql = "UPDATE " + tableName() + " SET locked_at=?" +
                " WHERE queue_name=? AND job_id=? AND state=" + ACTIVE + ownerGuard(ownerId);
        return JdbcTemplate.update(conn, sql, withOwner(ownerId, now, queueName, jobId));
    }

    @Override
    public List<QueuedJob> findStalled(Connection conn, String queueName, Instant lockedBefore, int limit) {
        String sql = "SELECT " + COLUMNS + " FROM " + tableName() +
                " WHERE queue_name=? AND state=" + ACTIVE + " AND locked_at < ?" +
                " ORDER BY locked_at LIMIT ?";
        return JdbcTemplate.query(conn, sql, JOB_ROW_MAPPER, queueName, lockedBefore, limit);
    }

    @Override
    public int requeueStalled(Connection conn, String queueName, String jobId, Instant lockedBefore, Instant now) {
        String sql = "UPDATE " + tableName() +
                " SET state=" + JobState.WAITING.code() + ", stalled_count=stalled_count+1, available_at=?," +
                " locked_by=NULL, locked_at=NULL" +
                " WHERE queue_name=? AND job_id=? AND state=" + ACTIVE + " AND locked_at < ?";
        return JdbcTemplate.update(conn, sql, now, queueName, jobId, lockedBefore);
    }

    @Override
    public int markCompleted(Connection conn, String queueName, String jobId, String ownerId,
                             Instant finishedAt, Instant expiresAt) {
        String sql = "UPDATE " + tableName() +
                " SET state=" + JobState.COMPLETED.code() + ", finished_at=?, expires_at=?, failed_reason=NULL," +
                " locked_by=NULL, locked_at=NULL" +
                " WHERE queue_name=? AND job_id=? AND state=" + ACTIVE + ownerGuard(ownerId);
        return JdbcTemplate.update(conn, sql, withOwner(ownerId, finishedAt, expiresAt, queueName, jobId));
    }

    @Override
    public int markFailed(Connection conn, String queueName, String jobId, String ownerId, String reason,
                          Instant finishedAt, Instant expiresAt) {
        String sql = "UPDATE " + tableName() +
                " SET state=" + JobState.FAILED.code() + ", failed_reason=?, finished_at=?, expires_at=?," +
                " locked_by=NULL, locked_at=NULL" +
                " WHERE queue_name=? AND job_id=? AND state=" + ACTIVE + ownerGuard(ownerId);
        return JdbcTemplate.update(conn, sql,
                withOwner(ownerId, truncateReason(reason), finishedAt, expiresAt, queueName, jobId));
    }

    @Override
    public int markRetry(Connection conn, String queueName, String jobId, String ownerId, String reason,
                         Instant availableAt) {
        String sql = "UPDATE " + tableName() +
                " SET state=" + JobState.WAITING.code() + ", failed_reason=?, available_at=?," +
                " locked_by=NULL, locked_at=NULL" +
                " WHERE queue_name=? AND job_id=? AND state=" + ACTIVE + ownerGuard(ownerId);
        return JdbcTemplate.update(conn, sql,
                withOwner(ownerId, truncateReason(reason), availableAt, queueName, jobId));
    }

    @Override
    public int delete(Connection conn, String queueName, String jobId) {
        String sql = "DELETE FROM " + tableName() + " WHERE queue_name=? AND job_id=? AND state<>" + ACTIVE;
        return JdbcTemplate.update(conn, sql, queueName, jobId);
    }

    @Override
    public Optional<QueuedJob> find(Connection conn, String queueName, String jobId) {
        String sql = "SELECT " + COLUMNS + " FROM " + tableName() + " WHERE queue_name=? AND job_id=?";
        List<QueuedJob> rows = JdbcTemplate.query(conn, sql, JOB_ROW_MAPPER, queueName, jobId);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    @Override
    public List<QueuedJob> findByState(Connection conn, String queueName, JobState state, int limit) {
        String sql = "SELECT " + COLUMNS + " FROM " + tableName() +
                " WHERE queue_name=? AND state=? ORDER BY created_at LIMIT ?";
        return JdbcTemplate.query(conn, sql, JOB_ROW_MAPPER, queueName, state.code(), limit);
    }

    @Override
    public Map<JobState, Integer> countByState(Connection conn, String queueName) {
        String sql = "SELECT state, COUNT(*) AS cnt FROM " + tableName() +
                " WHERE queue_name=? GROUP BY state";
        List<Map.Entry<JobState, Integer>> rows = JdbcTemplate.query(conn, sql,
                rs -> Map.entry(JobState.fromCode(rs.getInt("state")), rs.getInt("cnt")), queueName);
        Map<JobState, Integer> counts = new EnumMap<>(JobState.class);
        rows.forEach(e -> counts.put(e.getKey(), e.getValue()));
        return counts;
    }

    @Override
    public int requeueFailed(Connection conn, String queueName, String jobId, Instant availableAt) {
        String sql = "UPDATE " + tableName() +
                " SET state=" + JobState.WAITING.code() + ", attempts_made=0, stalled_count=0, available_at=?," +
                " finished_at=NULL, expires_at=NULL, failed_reason=NULL" +
                " WHERE queue_name=? AND job_id=? AND state=" + JobState.FAILED.code();
        return JdbcTemplate.update(conn, sql, availableAt, queueName, jobId);
    }

    @Override
    public int purgeExpired(Connection conn, String queueName, Instant now, int limit) {
        String sql = "DELETE FROM " + tableName() + " WHERE queue_name=? AND job_id IN (" +
                "SELECT job_id FROM " + tableName() +
                " WHERE queue_name=? AND state IN " + TERMINAL_STATE_IN +
                " AND expires_at IS NOT NULL AND expires_at < ?" +
                " ORDER BY expires_at LIMIT ?)";
        return JdbcTemplate.update(conn, sql, queueName, queueName, now, limit);
    }

    @Override
    public int deleteByState(Connection conn, String queueName, JobState state, int limit) {
        String sql = "DELETE FROM " + tableName() + " WHERE queue_name=? AND job_id IN (" +
                "SELECT job_id FROM " + tableName() +
                " WHERE queue_name=? AND state=? ORDER BY created_at LIMIT ?)";
        return JdbcTemplate.update(conn, sql, queueName, queueName, state.code(), limit);
    }

    protected static QueuedJob asClaimed(QueuedJob job, String ownerId, Instant lockedAt) {
        return new QueuedJob(job.queueName(), job.jobId(), job.jobName(), job.payloadJson(), JobState.ACTIVE,
                job.attemptsMade() + 1, job.maxAttempts(), job.stalledCount(), job.availableAt(),
                job.createdAt(), job.finishedAt(), job.failedReason(), job.removeOnCompleteMs(),
                job.removeOnFailMs(), ownerId, lockedAt);
    }

    protected static String truncateReason(String reason) {
        if (reason == null || reason.length() <= MAX_REASON_LENGTH) {
            return reason;
        }
        return reason.substring(0, MAX_REASON_LENGTH - 3) + "...";
    }

    private static String ownerGuard(String ownerId) {
        return ownerId == null ? "" : " AND locked_by=?";
    }

    private static Object[] withOwner(String ownerId, Object... params) {
        if (ownerId == null) {
            return params;
        }
        Object[] all = new Object[params.length + 1];
        System.arraycopy(params, 0, all, 0, params.length);
        all[params.length] = ownerId;
        return all;
    }
}
