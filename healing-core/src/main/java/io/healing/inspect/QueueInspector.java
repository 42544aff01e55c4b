package io.healing.inspect;

import io.healing.event.QueueEvent;
import io.healing.model.JobState;
import io.healing.model.QueuedJob;
import io.healing.queue.HealingQueue;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Operator view of a queue: job counts, listings and recent events, plus retry, remove and
 * clean operations.
 *
 * <p>In read-only mode (the default in production) every mutation throws
 * {@link ReadOnlyQueueException}; reads are always allowed.
 */
public final class QueueInspector {
    private static final Logger logger = Logger.getLogger(QueueInspector.class.getName());

    private final HealingQueue queue;
    private final boolean readOnly;

    public QueueInspector(HealingQueue queue) {
        this(queue, queue.config().inspectionReadOnly());
    }

    public QueueInspector(HealingQueue queue, boolean readOnly) {
        this.queue = Objects.requireNonNull(queue, "queue");
        this.readOnly = readOnly;
    }

    public String queueName() {
        return queue.name();
    }

    public boolean isReadOnly() {
        return readOnly;
    }

    /**
     * @return job count for every state, zero for empty states
     */
    public Map<JobState, Integer> counts() {
        return queue.counts();
    }

    public List<QueuedJob> jobs(JobState state, int limit) {
        return queue.list(state, limit);
    }

    public Optional<QueuedJob> job(String jobId) {
        return queue.find(jobId);
    }

    /**
     * @return up to {@code limit} of the newest terminal events, newest first
     */
    public List<QueueEvent> recentEvents(int limit) {
        return queue.recentEvents(limit);
    }

    /**
     * Moves a failed job back to waiting with its attempts reset.
     *
     * @return {@code true} if the job was failed and has been requeued
     * @throws ReadOnlyQueueException in read-only mode
     */
    public boolean retry(String jobId) {
        checkWritable("retry");
        boolean requeued = queue.requeueFailed(jobId);
        if (requeued) {
            logger.info("Requeued failed job " + jobId + " on queue " + queue.name());
        }
        return requeued;
    }

    /**
     * Deletes a job that is not running. Removing a job frees its id for a new submission, so
     * an {@code ACTIVE} job is left in place.
     *
     * @return {@code true} if the job existed and was not active
     * @throws ReadOnlyQueueException in read-only mode
     */
    public boolean remove(String jobId) {
        checkWritable("remove");
        boolean removed = queue.remove(jobId);
        if (removed) {
            logger.info("Removed job " + jobId + " from queue " + queue.name());
        }
        return removed;
    }

    /**
     * Deletes up to {@code limit} jobs in {@code state}.
     *
     * @return number of jobs deleted
     * @throws ReadOnlyQueueException in read-only mode
     */
    public int clean(JobState state, int limit) {
        checkWritable("clean");
        if (state == JobState.ACTIVE) {
            throw new IllegalArgumentException("Active jobs cannot be cleaned");
        }
        int deleted = queue.clean(state, limit);
        logger.info("Cleaned " + deleted + " " + state + " job(s) from queue " + queue.name());
        return deleted;
    }

    private void checkWritable(String operation) {
        if (readOnly) {
            throw new ReadOnlyQueueException(queue.name(), operation);
        }
    }
}
