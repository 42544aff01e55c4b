package io.healing.model;

import java.time.Instant;

/**
 * Read-only view of a persisted job row.
 *
 * @param queueName    queue the job belongs to
 * @param jobId        idempotency key, unique within the queue
 * @param jobName      routing name used to pick a processor
 * @param payloadJson  encoded job data
 * @param state        current lifecycle state
 * @param attemptsMade number of times a worker has started the job
 * @param maxAttempts  attempts allowed before the job fails for good
 * @param stalledCount times the job was reclaimed after its lock expired
 * @param availableAt  earliest time the job may run
 * @param createdAt    enqueue time
 * @param finishedAt   completion or failure time ({@code null} while pending)
 * @param failedReason last failure reason ({@code null} unless failed)
 * @param removeOnCompleteMs encoded completion retention, see {@link io.healing.Retention#toMillis()}
 * @param removeOnFailMs     encoded failure retention, see {@link io.healing.Retention#toMillis()}
 * @param lockedBy     id of the worker holding the job ({@code null} unless active)
 * @param lockedAt     when the lock was taken or last renewed
 */
public record QueuedJob(
        String queueName,
        String jobId,
        String jobName,
        String payloadJson,
        JobState state,
        int attemptsMade,
        int maxAttempts,
        int stalledCount,
        Instant availableAt,
        Instant createdAt,
        Instant finishedAt,
        String failedReason,
        long removeOnCompleteMs,
        long removeOnFailMs,
        String lockedBy,
        Instant lockedAt
) {

    public boolean isDelayed(Instant now) {
        return availableAt != null && availableAt.isAfter(now);
    }
}
