package io.healing.model;

import java.time.Instant;

/**
 * Snapshot of a failed job handed to a {@link io.healing.spi.DeadLetterSink}.
 *
 * @param originalQueueName queue the job ran on
 * @param originalJobId     job id (the idempotency key)
 * @param originalJobName   job name
 * @param originalJobData   encoded job data
 * @param failedReason      failure reason, never {@code null}
 * @param stacktrace        stack trace of the processing failure ({@code null} when the job
 *                          failed without an exception, e.g. after stalling)
 * @param timestamp         failure time
 */
public record DeadLetterRecord(
        String originalQueueName,
        String originalJobId,
        String originalJobName,
        String originalJobData,
        String failedReason,
        String stacktrace,
        Instant timestamp
) {
}
