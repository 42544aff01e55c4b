package io.healing.worker;

import io.healing.HealingJobPayload;
import io.healing.model.DeadLetterRecord;
import io.healing.model.QueuedJob;
import io.healing.queue.HealingQueue;
import io.healing.spi.DeadLetterSink;
import io.healing.spi.MetricsExporter;
import io.healing.util.DaemonThreadFactory;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Consumes jobs from a {@link HealingQueue} and runs them through registered
 * {@link HealingJobProcessor}s.
 *
 * <p>Every {@code drainDelayMs} the worker claims as many due jobs as it has free slots
 * (at most {@code concurrency} jobs run at once). A job whose processor returns normally is
 * completed; a job whose processor throws is retried while it has attempts left, otherwise
 * it fails, is logged at {@code SEVERE} and handed to the {@link DeadLetterSink}.
 *
 * <p>A lock counts as stalled once it is older than {@code stalledIntervalMs}. The worker renews
 * the locks of the jobs it is running every half interval, so a healthy worker's locks never
 * reach that age even when a renewal runs late. Every {@code stalledIntervalMs} it also looks
 * for jobs whose lock was not renewed in time (their worker died). A stalled job is put back in
 * line up to {@code maxStalledCount} times; after that it fails with {@value #STALLED_REASON}.
 *
 * <p>Create instances via {@link #builder()}. The {@link #start()} and {@link #close()} methods
 * are synchronized.
 *
 * @see HealingWorker.Builder
 */
public final class HealingWorker implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(HealingWorker.class.getName());

    public static final String STALLED_REASON = "job stalled more than allowable limit";
    public static final String UNKNOWN_FAILURE = "Unknown processing failure";

    private static final int STALLED_BATCH = 100;

    private final HealingQueue queue;
    private final ProcessorRegistry processorRegistry;
    private final DeadLetterSink deadLetterSink;
    private final MetricsExporter metrics;
    private final int concurrency;
    private final long drainDelayMs;
    private final long stalledIntervalMs;
    private final int maxStalledCount;
    private final long drainTimeoutMs;
    private final String ownerId;

    private final Semaphore slots;
    private final Map<String, QueuedJob> running = new ConcurrentHashMap<>();

    private ScheduledExecutorService scheduler;
    private final ExecutorService processors;
    private volatile boolean closed;

    private HealingWorker(Builder builder) {
        this.queue = Objects.requireNonNull(builder.queue, "queue");
        this.processorRegistry = Objects.requireNonNull(builder.processorRegistry, "processorRegistry");
        this.deadLetterSink = builder.deadLetterSink != null ? builder.deadLetterSink : DeadLetterSink.NOOP;
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;

        if (builder.concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be >= 1");
        }
        if (builder.drainDelayMs <= 0L) {
            throw new IllegalArgumentException("drainDelayMs must be > 0");
        }
        if (builder.stalledIntervalMs <= 0L) {
            throw new IllegalArgumentException("stalledIntervalMs must be > 0");
        }
        if (builder.maxStalledCount < 0) {
            throw new IllegalArgumentException("maxStalledCount must be >= 0");
        }
        if (builder.drainTimeoutMs < 0L) {
            throw new IllegalArgumentException("drainTimeoutMs must be >= 0");
        }
        this.concurrency = builder.concurrency;
        this.drainDelayMs = builder.drainDelayMs;
        this.stalledIntervalMs = builder.stalledIntervalMs;
        this.maxStalledCount = builder.maxStalledCount;
        this.drainTimeoutMs = builder.drainTimeoutMs;
        this.ownerId = builder.ownerId != null
                ? builder.ownerId : "worker-" + UUID.randomUUID().toString().substring(0, 8);
        this.slots = new Semaphore(concurrency);
        this.processors = Executors.newFixedThreadPool(concurrency, new DaemonThreadFactory("healing-worker-"));
    }

    public static Builder builder() {
        return new Builder();
    }

    public String ownerId() {
        return ownerId;
    }

    /**
     * @return number of jobs currently being processed
     */
    public int activeCount() {
        return running.size();
    }

    /**
     * Starts the claim loop and the stalled-job check. Subsequent calls are no-ops.
     */
    public synchronized void start() {
        if (closed) {
            throw new IllegalStateException("HealingWorker has been closed");
        }
        if (scheduler != null) {
            return;
        }
        scheduler = Executors.newScheduledThreadPool(3, new DaemonThreadFactory("healing-worker-scheduler-"));
        scheduler.scheduleWithFixedDelay(this::poll, 0L, drainDelayMs, TimeUnit.MILLISECONDS);
        long renewIntervalMs = Math.max(1L, stalledIntervalMs / 2);
        scheduler.scheduleWithFixedDelay(this::renewLocks, renewIntervalMs, renewIntervalMs, TimeUnit.MILLISECONDS);
        scheduler.scheduleWithFixedDelay(this::checkStalled, stalledIntervalMs, stalledIntervalMs, TimeUnit.MILLISECONDS);
        logger.log(Level.INFO, "Healing worker {0} started on queue {1} (concurrency {2})",
                new Object[]{ownerId, queue.name(), concurrency});
    }

    /**
     * Claims due jobs for the free slots and hands them to the processing pool. Called by the
     * scheduler, but may be invoked directly for testing.
     *
     * @return number of jobs claimed
     */
    public int poll() {
        if (closed) {
            return 0;
        }
        try {
            int free = slots.availablePermits();
            if (free <= 0) {
                return 0;
            }
            List<QueuedJob> claimed = queue.claim(ownerId, free);
            for (QueuedJob job : claimed) {
                dispatch(job);
            }
            return claimed.size();
        } catch (Throwable t) {
            logger.log(Level.SEVERE, "Claim cycle failed on queue " + queue.name(), t);
            return 0;
        }
    }

    private void dispatch(QueuedJob job) {
        slots.acquireUninterruptibly();
        running.put(job.jobId(), job);
        safeMetrics(() -> metrics.recordActiveJobs(running.size()));
        try {
            processors.execute(() -> runJob(job));
        } catch (RejectedExecutionException e) {
            // claimed while shutting down; the stalled check on another worker picks it up
            running.remove(job.jobId());
            slots.release();
            logger.log(Level.WARNING, "Worker shutting down; left claimed job " + job.jobId() + " for reclaim");
        }
    }

    private void runJob(QueuedJob job) {
        long startNanos = System.nanoTime();
        try {
            try {
                process(job);
            } catch (Throwable t) {
                handleFailure(job, t);
                return;
            }
            if (!queue.complete(job, ownerId)) {
                logger.warning("Lost lock on job " + job.jobId() + " before completion was recorded");
            }
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Failed to record completion of job " + job.jobId(), e);
        } finally {
            long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
            safeMetrics(() -> metrics.recordProcessingDurationMs(durationMs));
            running.remove(job.jobId());
            slots.release();
            safeMetrics(() -> metrics.recordActiveJobs(running.size()));
        }
    }

    private void process(QueuedJob job) throws Exception {
        HealingJobProcessor processor = processorRegistry.processorFor(job.jobName());
        if (processor == null) {
            throw new UnknownJobException(job.jobName());
        }
        HealingJobPayload payload = HealingJobPayload.fromData(queue.payloadCodec().decode(job.payloadJson()));
        processor.process(payload);
    }

    private void handleFailure(QueuedJob job, Throwable failure) {
        String reason = failure.getMessage();
        boolean retryable = !(failure instanceof UnknownJobException)
                && job.attemptsMade() < job.maxAttempts();
        try {
            if (retryable) {
                logger.log(Level.WARNING, "CI healing job " + job.jobId() + " attempt " + job.attemptsMade()
                        + " of " + job.maxAttempts() + " failed: " + describe(reason), failure);
                queue.retry(job, ownerId, reason);
                return;
            }
            logger.log(Level.SEVERE, "CI healing job " + job.jobId() + " failed: " + describe(reason), failure);
            if (queue.fail(job, ownerId, reason)) {
                deadLetter(job, describe(reason), stackTrace(failure));
            }
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Failed to record failure of job " + job.jobId(), e);
        }
    }

    /**
     * Renews the locks of the jobs this worker is running. Called by the scheduler every half
     * stalled interval, but may be invoked directly for testing.
     */
    public void renewLocks() {
        if (closed) {
            return;
        }
        try {
            renewRunning();
        } catch (Throwable t) {
            logger.log(Level.SEVERE, "Lock renewal failed on queue " + queue.name(), t);
        }
    }

    private void renewRunning() {
        for (QueuedJob job : running.values()) {
            if (!queue.renewLock(job, ownerId)) {
                logger.warning("Lost lock on running job " + job.jobId());
            }
        }
    }

    /**
     * Renews the locks of running jobs, then requeues or fails jobs whose lock went stale.
     * Called by the scheduler, but may be invoked directly for testing.
     */
    public void checkStalled() {
        if (closed) {
            return;
        }
        try {
            renewRunning();
            Instant lockedBefore = queue.clock().instant().minus(Duration.ofMillis(stalledIntervalMs));
            for (QueuedJob job : queue.findStalled(lockedBefore, STALLED_BATCH)) {
                if (running.containsKey(job.jobId())) {
                    continue;
                }
                handleStalled(job, lockedBefore);
            }
        } catch (Throwable t) {
            logger.log(Level.SEVERE, "Stalled-job check failed on queue " + queue.name(), t);
        }
    }

    private void handleStalled(QueuedJob job, Instant lockedBefore) {
        safeMetrics(metrics::incrementStalled);
        if (job.stalledCount() + 1 > maxStalledCount) {
            logger.severe("CI healing job " + job.jobId() + " failed: " + STALLED_REASON);
            if (queue.fail(job, job.lockedBy(), STALLED_REASON)) {
                deadLetter(job, STALLED_REASON, null);
            }
        } else if (queue.requeueStalled(job, lockedBefore)) {
            logger.warning("Requeued stalled job " + job.jobId() + " (previous owner " + job.lockedBy() + ")");
        }
    }

    private void deadLetter(QueuedJob job, String reason, String stacktrace) {
        try {
            deadLetterSink.accept(new DeadLetterRecord(
                    queue.name(), job.jobId(), job.jobName(), job.payloadJson(),
                    reason, stacktrace, queue.clock().instant()));
        } catch (Throwable t) {
            logger.log(Level.SEVERE, "Dead-letter hand-off failed for job " + job.jobId(), t);
        }
    }

    private static String describe(String reason) {
        return reason != null ? reason : UNKNOWN_FAILURE;
    }

    private static String stackTrace(Throwable failure) {
        StringWriter out = new StringWriter();
        failure.printStackTrace(new PrintWriter(out));
        return out.toString();
    }

    private void safeMetrics(Runnable update) {
        try {
            update.run();
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Metrics exporter failed", e);
        }
    }

    /**
     * Stops claiming, waits up to {@code drainTimeoutMs} for running jobs to finish, then
     * interrupts whatever is left. Unfinished jobs stay {@code ACTIVE} and are reclaimed by the
     * stalled-job check.
     */
    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (scheduler != null) {
            scheduler.shutdownNow();
        }
        processors.shutdown();
        try {
            if (!processors.awaitTermination(drainTimeoutMs, TimeUnit.MILLISECONDS)) {
                logger.log(Level.WARNING, "Drain timeout exceeded; interrupting " + running.size() + " running job(s)");
                processors.shutdownNow();
                processors.awaitTermination(5, TimeUnit.SECONDS);
            }
        } catch (InterruptedException e) {
            processors.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /** Builder for {@link HealingWorker}. */
    public static final class Builder {
        private HealingQueue queue;
        private ProcessorRegistry processorRegistry;
        private DeadLetterSink deadLetterSink;
        private MetricsExporter metrics;
        private int concurrency = 3;
        private long drainDelayMs = 300;
        private long stalledIntervalMs = 300_000;
        private int maxStalledCount = 2;
        private long drainTimeoutMs = 5000;
        private String ownerId;

        private Builder() {
        }

        /**
         * Sets the queue to consume.
         *
         * <p><b>Required.</b>
         *
         * @param queue the queue
         * @return this builder
         */
        public Builder queue(HealingQueue queue) {
            this.queue = queue;
            return this;
        }

        /**
         * Sets the registry used to resolve a processor from the job name.
         *
         * <p><b>Required.</b>
         *
         * @param processorRegistry the processor registry
         * @return this builder
         */
        public Builder processorRegistry(ProcessorRegistry processorRegistry) {
            this.processorRegistry = processorRegistry;
            return this;
        }

        /**
         * Sets the sink receiving jobs that failed for good.
         *
         * <p>Optional. Defaults to {@link DeadLetterSink#NOOP}.
         *
         * @param deadLetterSink the dead-letter sink
         * @return this builder
         */
        public Builder deadLetterSink(DeadLetterSink deadLetterSink) {
            this.deadLetterSink = deadLetterSink;
            return this;
        }

        /**
         * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
         *
         * @param metrics the metrics exporter
         * @return this builder
         */
        public Builder metrics(MetricsExporter metrics) {
            this.metrics = metrics;
            return this;
        }

        /**
         * Sets the maximum number of jobs processed at the same time.
         *
         * <p>Optional. Defaults to {@code 3}. Must be &ge; 1.
         *
         * @param concurrency parallel job count
         * @return this builder
         */
        public Builder concurrency(int concurrency) {
            this.concurrency = concurrency;
            return this;
        }

        /**
         * Sets the pause between claim cycles.
         *
         * <p>Optional. Defaults to {@code 300} ms. Must be &gt; 0.
         *
         * @param drainDelayMs delay in milliseconds
         * @return this builder
         */
        public Builder drainDelayMs(long drainDelayMs) {
            this.drainDelayMs = drainDelayMs;
            return this;
        }

        /**
         * Sets how old a lock must be to count as stalled, and how often stalled jobs are
         * looked for. Running jobs renew their locks every half interval.
         *
         * <p>Optional. Defaults to {@code 300000} ms (5 minutes). Must be &gt; 0.
         *
         * @param stalledIntervalMs interval in milliseconds
         * @return this builder
         */
        public Builder stalledIntervalMs(long stalledIntervalMs) {
            this.stalledIntervalMs = stalledIntervalMs;
            return this;
        }

        /**
         * Sets how many times a job may be recovered from a stall before it fails.
         *
         * <p>Optional. Defaults to {@code 2}. Must be &ge; 0.
         *
         * @param maxStalledCount stall recoveries allowed
         * @return this builder
         */
        public Builder maxStalledCount(int maxStalledCount) {
            this.maxStalledCount = maxStalledCount;
            return this;
        }

        /**
         * Sets how long {@link HealingWorker#close()} waits for running jobs.
         *
         * <p>Optional. Defaults to {@code 5000} ms. Must be &ge; 0.
         *
         * @param drainTimeoutMs drain timeout in milliseconds
         * @return this builder
         */
        public Builder drainTimeoutMs(long drainTimeoutMs) {
            this.drainTimeoutMs = drainTimeoutMs;
            return this;
        }

        /**
         * Sets the lock owner id of this worker.
         *
         * <p>Optional. Defaults to {@code worker-} followed by a random suffix.
         *
         * @param ownerId unique id, e.g. host or pod name
         * @return this builder
         */
        public Builder ownerId(String ownerId) {
            this.ownerId = ownerId;
            return this;
        }

        public HealingWorker build() {
            return new HealingWorker(this);
        }
    }
}
