package io.healing;

import io.healing.spi.JobQueue;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.logging.Logger;

/**
 * Submits self-healing attempts for failed CI runs.
 *
 * <p>Each {@code (runId, attemptNo)} pair becomes one job keyed by
 * {@link HealingJobKeys#jobKey(String, int)}, so resubmitting a pair leaves a single live job.
 * The first attempt is due immediately; later attempts are delayed by the
 * {@link BackoffPolicy}. The queue makes exactly one execution attempt per job: retries are
 * driven by the caller submitting the next {@code attemptNo}.
 *
 * <p>The producer holds no mutable state and is safe to share.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * HealingJobProducer producer = new HealingJobProducer(queue);
 * producer.submit("run-42", 1);   // due now
 * producer.submit("run-42", 2);   // due in 10 seconds
 * }</pre>
 */
public final class HealingJobProducer {
    private static final Logger logger = Logger.getLogger(HealingJobProducer.class.getName());

    private final JobQueue queue;
    private final String jobName;
    private final BackoffPolicy backoffPolicy;
    private final Executor executor;

    public HealingJobProducer(JobQueue queue) {
        this(queue, QueueNames.CI_HEALING_PROCESS, FlatBackoffPolicy.DEFAULT, ForkJoinPool.commonPool());
    }

    public HealingJobProducer(JobQueue queue, BackoffPolicy backoffPolicy) {
        this(queue, QueueNames.CI_HEALING_PROCESS, backoffPolicy, ForkJoinPool.commonPool());
    }

    /**
     * @param queue         queue receiving the jobs
     * @param jobName       job name the worker routes on
     * @param backoffPolicy delay per attempt number
     * @param executor      runs {@link #submitHealingAttempt}
     */
    public HealingJobProducer(JobQueue queue, String jobName, BackoffPolicy backoffPolicy, Executor executor) {
        this.queue = Objects.requireNonNull(queue, "queue");
        this.jobName = Objects.requireNonNull(jobName, "jobName");
        this.backoffPolicy = Objects.requireNonNull(backoffPolicy, "backoffPolicy");
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    /**
     * Submits one healing attempt.
     *
     * <p>A pair that is already queued is absorbed silently.
     *
     * @param runId     healing run identifier (non-empty)
     * @param attemptNo 1-based attempt number
     * @throws IllegalArgumentException if {@code runId} is empty or {@code attemptNo < 1}
     * @throws SubmissionException      if the queue is unreachable or rejects the job
     */
    public void submit(String runId, int attemptNo) {
        JobOptions options = schedule(runId, attemptNo);
        HealingJobPayload payload = new HealingJobPayload(runId);

        logger.fine("Adding CI healing process job for run " + runId + ", attempt " + attemptNo);

        boolean added;
        try {
            added = queue.add(jobName, payload.toData(), options);
        } catch (SubmissionException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new SubmissionException("Failed to submit CI healing job " + options.jobId(), e);
        }
        if (!added) {
            logger.fine("CI healing job " + options.jobId() + " already queued; submission ignored");
        }
    }

    /**
     * Runs {@link #submit} on the producer's executor.
     *
     * <p>Argument errors are thrown immediately. Queue failures complete the future
     * exceptionally with a {@link SubmissionException}.
     */
    public CompletableFuture<Void> submitHealingAttempt(String runId, int attemptNo) {
        HealingJobKeys.validate(runId, attemptNo);
        return CompletableFuture.runAsync(() -> submit(runId, attemptNo), executor)
                .exceptionallyCompose(HealingJobProducer::unwrap);
    }

    /**
     * Job options for an attempt: keyed by {@code (runId, attemptNo)}, one execution, delayed
     * by the backoff policy, removed once completed and kept once failed.
     *
     * @throws IllegalArgumentException if {@code runId} is empty or {@code attemptNo < 1}
     */
    public JobOptions schedule(String runId, int attemptNo) {
        String jobKey = HealingJobKeys.jobKey(runId, attemptNo);
        return new JobOptions(jobKey, 1, backoffPolicy.delayMs(attemptNo),
                Retention.removeImmediately(), Retention.keep());
    }

    private static CompletableFuture<Void> unwrap(Throwable failure) {
        Throwable cause = failure instanceof CompletionException && failure.getCause() != null
                ? failure.getCause() : failure;
        return CompletableFuture.failedFuture(cause);
    }
}
