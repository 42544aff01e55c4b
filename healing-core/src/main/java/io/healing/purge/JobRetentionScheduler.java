package io.healing.purge;

import io.healing.queue.HealingQueue;
import io.healing.util.DaemonThreadFactory;

import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Scheduled component that deletes finished jobs whose retention window has passed
 * (for example completed jobs older than 24 hours).
 *
 * <p>Each cycle deletes in batches until fewer than {@code batchSize} rows are deleted, then
 * sleeps until the next interval. Jobs kept with {@link io.healing.Retention#keep()} are
 * never touched.
 *
 * <p>Create instances via {@link #builder()}.
 */
public final class JobRetentionScheduler implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(JobRetentionScheduler.class.getName());

    private final HealingQueue queue;
    private final int batchSize;
    private final long intervalSeconds;

    private ScheduledExecutorService scheduler;
    private volatile ScheduledFuture<?> purgeTask;
    private volatile boolean closed;

    private JobRetentionScheduler(Builder builder) {
        this.queue = Objects.requireNonNull(builder.queue, "queue");
        if (builder.batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be > 0");
        }
        if (builder.intervalSeconds <= 0L) {
            throw new IllegalArgumentException("intervalSeconds must be > 0");
        }
        this.batchSize = builder.batchSize;
        this.intervalSeconds = builder.intervalSeconds;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Starts the purge loop. Subsequent calls are no-ops.
     */
    public synchronized void start() {
        if (closed) {
            throw new IllegalStateException("JobRetentionScheduler has been closed");
        }
        if (purgeTask != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("healing-retention-"));
        purgeTask = scheduler.scheduleWithFixedDelay(this::runOnce, intervalSeconds, intervalSeconds, TimeUnit.SECONDS);
    }

    /**
     * Executes a single purge cycle. May be invoked directly for testing or one-off purges.
     *
     * @return number of jobs deleted
     */
    public long runOnce() {
        if (closed) {
            return 0;
        }
        try {
            long total = 0;
            int deleted;
            do {
                deleted = queue.purgeExpired(batchSize);
                total += deleted;
            } while (deleted >= batchSize);
            if (total > 0) {
                logger.log(Level.INFO, "Purged {0} expired job(s) from queue {1}", new Object[]{total, queue.name()});
            }
            return total;
        } catch (Throwable t) {
            logger.log(Level.SEVERE, "Retention purge failed on queue " + queue.name(), t);
            return 0;
        }
    }

    @Override
    public synchronized void close() {
        closed = true;
        if (purgeTask != null) {
            purgeTask.cancel(false);
            purgeTask = null;
        }
        if (scheduler != null) {
            scheduler.shutdownNow();
            try {
                scheduler.awaitTermination(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    /** Builder for {@link JobRetentionScheduler}. */
    public static final class Builder {
        private HealingQueue queue;
        private int batchSize = 500;
        private long intervalSeconds = 3600;

        private Builder() {
        }

        /**
         * <p><b>Required.</b>
         */
        public Builder queue(HealingQueue queue) {
            this.queue = queue;
            return this;
        }

        /**
         * Sets the maximum number of jobs deleted per batch.
         *
         * <p>Optional. Defaults to {@code 500}. Must be &gt; 0.
         */
        public Builder batchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        /**
         * Sets the interval between purge cycles.
         *
         * <p>Optional. Defaults to {@code 3600} (1 hour). Must be &gt; 0.
         */
        public Builder intervalSeconds(long intervalSeconds) {
            this.intervalSeconds = intervalSeconds;
            return this;
        }

        public JobRetentionScheduler build() {
            return new JobRetentionScheduler(this);
        }
    }
}
