package io.healing.spi;

import io.healing.model.JobState;
import io.healing.model.QueuedJob;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Persistence contract for queued jobs.
 *
 * <p>All methods take an explicit {@link Connection}; the caller owns transaction boundaries.
 * Every operation is scoped to one queue name so several queues can share a table.
 *
 * <p>State transitions that take an {@code ownerId} only apply while the job is
 * {@code ACTIVE} and locked by that owner, so a worker that lost its lock to the stalled-job
 * check cannot overwrite the new owner's outcome.
 */
public interface JobStore {

    /**
     * Inserts the job unless a job with the same {@code (queueName, jobId)} already exists.
     *
     * @return {@code true} if inserted, {@code false} for a duplicate id
     */
    boolean insertIfAbsent(Connection conn, QueuedJob job);

    /**
     * Claims due {@code WAITING}/{@code DELAYED} jobs: moves them to {@code ACTIVE}, locks
     * them for {@code ownerId} and increments {@code attemptsMade}.
     *
     * @return the claimed jobs, earliest availability first
     */
    List<QueuedJob> claim(Connection conn, String queueName, String ownerId, Instant now, int limit);

    /**
     * Refreshes the lock timestamp of a job the owner is still running.
     *
     * @return rows updated (0 if the lock was lost)
     */
    int renewLock(Connection conn, String queueName, String jobId, String ownerId, Instant now);

    /**
     * Lists {@code ACTIVE} jobs whose lock is older than {@code lockedBefore}.
     */
    List<QueuedJob> findStalled(Connection conn, String queueName, Instant lockedBefore, int limit);

    /**
     * Moves a stalled job back to {@code WAITING}, available at {@code now}, and increments
     * its {@code stalledCount}.
     *
     * @return rows updated (0 if the job is no longer stalled)
     */
    int requeueStalled(Connection conn, String queueName, String jobId, Instant lockedBefore, Instant now);

    /**
     * @param expiresAt when the retention purge may delete the job ({@code null} to keep)
     * @return rows updated (0 or 1)
     */
    int markCompleted(Connection conn, String queueName, String jobId, String ownerId,
                      Instant finishedAt, Instant expiresAt);

    /**
     * @param expiresAt when the retention purge may delete the job ({@code null} to keep)
     * @return rows updated (0 or 1)
     */
    int markFailed(Connection conn, String queueName, String jobId, String ownerId, String reason,
                   Instant finishedAt, Instant expiresAt);

    /**
     * Returns an {@code ACTIVE} job to {@code WAITING} so it runs again at {@code availableAt}.
     *
     * @return rows updated (0 or 1)
     */
    int markRetry(Connection conn, String queueName, String jobId, String ownerId, String reason,
                  Instant availableAt);

    /**
     * Deletes a job unless it is {@code ACTIVE}. A running job keeps its id until it finishes.
     *
     * @return rows deleted (0 or 1)
     */
    int delete(Connection conn, String queueName, String jobId);

    Optional<QueuedJob> find(Connection conn, String queueName, String jobId);

    /**
     * Lists jobs in a state, oldest first.
     */
    List<QueuedJob> findByState(Connection conn, String queueName, JobState state, int limit);

    /**
     * Counts jobs per state. States without jobs may be absent from the map.
     */
    Map<JobState, Integer> countByState(Connection conn, String queueName);

    /**
     * Resets a {@code FAILED} job to {@code WAITING} with its attempt, stall and failure
     * bookkeeping cleared.
     *
     * @return rows updated (0 or 1)
     */
    int requeueFailed(Connection conn, String queueName, String jobId, Instant availableAt);

    /**
     * Deletes up to {@code limit} terminal jobs whose retention expired before {@code now}.
     *
     * @return rows deleted
     */
    int purgeExpired(Connection conn, String queueName, Instant now, int limit);

    /**
     * Deletes up to {@code limit} jobs in the given state.
     *
     * @return rows deleted
     */
    int deleteByState(Connection conn, String queueName, JobState state, int limit);
}
