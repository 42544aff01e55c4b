package io.healing;

import java.util.Objects;

/**
 * Per-job submission options understood by a {@link io.healing.spi.JobQueue}.
 *
 * @param jobId            idempotency key; a second add with the same id is ignored while
 *                         the first job is still stored ({@code null} lets the queue generate one)
 * @param attempts         executions the queue may make before the job fails (&ge; 1)
 * @param delayMs          milliseconds before the job becomes eligible to run (&ge; 0)
 * @param removeOnComplete retention once completed ({@code null} uses the queue default)
 * @param removeOnFail     retention once failed ({@code null} uses the queue default)
 */
public record JobOptions(
        String jobId,
        int attempts,
        long delayMs,
        Retention removeOnComplete,
        Retention removeOnFail
) {

    public JobOptions {
        if (attempts < 1) {
            throw new IllegalArgumentException("attempts must be >= 1, got: " + attempts);
        }
        if (delayMs < 0) {
            throw new IllegalArgumentException("delayMs must be >= 0, got: " + delayMs);
        }
    }

    /**
     * Options with a single attempt, no delay and the queue's default retention.
     */
    public static JobOptions defaults(String jobId) {
        return new JobOptions(jobId, 1, 0L, null, null);
    }

    public JobOptions withDefaults(Retention defaultOnComplete, Retention defaultOnFail) {
        return new JobOptions(jobId, attempts, delayMs,
                removeOnComplete != null ? removeOnComplete : Objects.requireNonNull(defaultOnComplete),
                removeOnFail != null ? removeOnFail : Objects.requireNonNull(defaultOnFail));
    }
}
