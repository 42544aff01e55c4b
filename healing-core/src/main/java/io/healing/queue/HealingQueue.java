package io.healing.queue;

import io.healing.HealingQueueConfig;
import io.healing.JobOptions;
import io.healing.Retention;
import io.healing.SubmissionException;
import io.healing.event.QueueEvent;
import io.healing.event.QueueEventListener;
import io.healing.event.QueueEventStream;
import io.healing.event.Subscription;
import io.healing.model.JobState;
import io.healing.model.QueuedJob;
import io.healing.spi.ConnectionProvider;
import io.healing.spi.JobQueue;
import io.healing.spi.JobStore;
import io.healing.spi.MetricsExporter;
import io.healing.util.DaemonThreadFactory;
import io.healing.util.PayloadCodec;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Delayed-job queue backed by a {@link JobStore}.
 *
 * <p>{@link #add} stores a job atomically by id; a second add with an id that is still
 * stored is a no-op. Terminal outcomes are appended to a bounded {@link QueueEventStream}
 * and delivered to subscribed {@link QueueEventListener}s on a dedicated daemon thread, so
 * listeners never run on the submitting or processing thread.
 *
 * <p>Jobs are executed by a {@link io.healing.worker.HealingWorker} through the claim and
 * outcome methods of this class.
 *
 * <p>Create instances via {@link #builder()}. This class is thread-safe.
 *
 * @see HealingQueue.Builder
 */
public final class HealingQueue implements JobQueue, AutoCloseable {
    private static final Logger logger = Logger.getLogger(HealingQueue.class.getName());

    private final HealingQueueConfig config;
    private final ConnectionProvider connectionProvider;
    private final JobStore jobStore;
    private final PayloadCodec payloadCodec;
    private final MetricsExporter metrics;
    private final Clock clock;
    private final QueueEventStream eventStream;
    private final List<QueueEventListener> listeners = new CopyOnWriteArrayList<>();
    private final ExecutorService eventExecutor;
    private volatile boolean closed;

    private HealingQueue(Builder builder) {
        this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
        this.jobStore = Objects.requireNonNull(builder.jobStore, "jobStore");
        this.config = builder.config != null ? builder.config : HealingQueueConfig.builder().build();
        this.payloadCodec = builder.payloadCodec != null ? builder.payloadCodec : PayloadCodec.getDefault();
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
        this.eventStream = new QueueEventStream(config.eventsMaxLen());
        this.eventExecutor = Executors.newSingleThreadExecutor(
                new DaemonThreadFactory("healing-events-" + config.queueName() + "-"));
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String name() {
        return config.queueName();
    }

    public HealingQueueConfig config() {
        return config;
    }

    public PayloadCodec payloadCodec() {
        return payloadCodec;
    }

    public QueueEventStream eventStream() {
        return eventStream;
    }

    public Clock clock() {
        return clock;
    }

    @Override
    public boolean add(String jobName, Map<String, String> data, JobOptions options) {
        Objects.requireNonNull(jobName, "jobName");
        Objects.requireNonNull(options, "options");
        if (closed) {
            throw new SubmissionException("Queue " + name() + " is closed");
        }
        JobOptions effective = options.withDefaults(config.defaultRemoveOnComplete(), config.defaultRemoveOnFail());
        String jobId = effective.jobId() != null ? effective.jobId() : UUID.randomUUID().toString();

        String payloadJson;
        try {
            payloadJson = payloadCodec.encode(data);
        } catch (RuntimeException e) {
            throw new SubmissionException("Job data rejected for job " + jobId, e);
        }

        Instant now = clock.instant();
        QueuedJob job = new QueuedJob(
                name(), jobId, jobName, payloadJson,
                effective.delayMs() > 0 ? JobState.DELAYED : JobState.WAITING,
                0, effective.attempts(), 0,
                now.plusMillis(effective.delayMs()), now, null, null,
                effective.removeOnComplete().toMillis(), effective.removeOnFail().toMillis(),
                null, null);

        boolean inserted;
        try (Connection conn = connectionProvider.getConnection()) {
            conn.setAutoCommit(true);
            inserted = jobStore.insertIfAbsent(conn, job);
        } catch (SQLException | RuntimeException e) {
            throw new SubmissionException("Failed to add job " + jobId + " to queue " + name(), e);
        }

        if (inserted) {
            safeMetrics(metrics::incrementSubmitted);
        } else {
            logger.fine("Job " + jobId + " already present in queue " + name() + ", add ignored");
            safeMetrics(metrics::incrementDuplicate);
        }
        return inserted;
    }

    @Override
    public Subscription subscribe(QueueEventListener listener) {
        Objects.requireNonNull(listener, "listener");
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    // ---- worker-facing operations ----

    /**
     * Claims up to {@code limit} due jobs for {@code ownerId}. The claim runs in its own
     * transaction.
     */
    public List<QueuedJob> claim(String ownerId, int limit) {
        Instant now = clock.instant();
        return inTransaction("claim jobs", conn -> jobStore.claim(conn, name(), ownerId, now, limit));
    }

    /**
     * @return {@code true} if the owner still holds the lock
     */
    public boolean renewLock(QueuedJob job, String ownerId) {
        Instant now = clock.instant();
        return autoCommit("renew lock", conn -> jobStore.renewLock(conn, name(), job.jobId(), ownerId, now)) > 0;
    }

    public List<QueuedJob> findStalled(Instant lockedBefore, int limit) {
        return autoCommit("find stalled jobs", conn -> jobStore.findStalled(conn, name(), lockedBefore, limit));
    }

    /**
     * @return {@code true} if the job was moved back to waiting
     */
    public boolean requeueStalled(QueuedJob job, Instant lockedBefore) {
        Instant now = clock.instant();
        return autoCommit("requeue stalled job",
                conn -> jobStore.requeueStalled(conn, name(), job.jobId(), lockedBefore, now)) > 0;
    }

    /**
     * Marks the job completed and applies its completion retention. Publishes a
     * {@code COMPLETED} event when the transition took effect.
     *
     * @return {@code true} if the owner still held the job
     */
    public boolean complete(QueuedJob job, String ownerId) {
        Instant finishedAt = clock.instant();
        Retention retention = Retention.fromMillis(job.removeOnCompleteMs());
        boolean updated = inTransaction("mark COMPLETED", conn -> {
            int rows = jobStore.markCompleted(conn, name(), job.jobId(), ownerId, finishedAt,
                    expiresAt(retention, finishedAt));
            if (rows > 0 && retention instanceof Retention.RemoveImmediately) {
                jobStore.delete(conn, name(), job.jobId());
            }
            return rows > 0;
        });
        if (updated) {
            publish(QueueEvent.completed(job.jobId(), finishedAt));
        }
        return updated;
    }

    /**
     * Marks the job failed for good and applies its failure retention. Publishes a
     * {@code FAILED} event when the transition took effect.
     *
     * @return {@code true} if the owner still held the job
     */
    public boolean fail(QueuedJob job, String ownerId, String reason) {
        Instant finishedAt = clock.instant();
        Retention retention = Retention.fromMillis(job.removeOnFailMs());
        boolean updated = inTransaction("mark FAILED", conn -> {
            int rows = jobStore.markFailed(conn, name(), job.jobId(), ownerId, reason, finishedAt,
                    expiresAt(retention, finishedAt));
            if (rows > 0 && retention instanceof Retention.RemoveImmediately) {
                jobStore.delete(conn, name(), job.jobId());
            }
            return rows > 0;
        });
        if (updated) {
            publish(QueueEvent.failed(job.jobId(), reason, finishedAt));
        }
        return updated;
    }

    /**
     * Puts an active job back in line after a failed attempt. No event is published.
     */
    public boolean retry(QueuedJob job, String ownerId, String reason) {
        Instant now = clock.instant();
        return autoCommit("mark RETRY",
                conn -> jobStore.markRetry(conn, name(), job.jobId(), ownerId, reason, now)) > 0;
    }

    // ---- inspection and maintenance ----

    public Map<JobState, Integer> counts() {
        Map<JobState, Integer> counts = new EnumMap<>(JobState.class);
        for (JobState state : JobState.values()) {
            counts.put(state, 0);
        }
        counts.putAll(autoCommit("count jobs", conn -> jobStore.countByState(conn, name())));
        return counts;
    }

    public List<QueuedJob> list(JobState state, int limit) {
        Objects.requireNonNull(state, "state");
        return autoCommit("list jobs", conn -> jobStore.findByState(conn, name(), state, limit));
    }

    public Optional<QueuedJob> find(String jobId) {
        Objects.requireNonNull(jobId, "jobId");
        return autoCommit("find job", conn -> jobStore.find(conn, name(), jobId));
    }

    public boolean requeueFailed(String jobId) {
        Instant now = clock.instant();
        return autoCommit("requeue failed job", conn -> jobStore.requeueFailed(conn, name(), jobId, now)) > 0;
    }

    /**
     * Deletes a job unless it is {@code ACTIVE}.
     */
    public boolean remove(String jobId) {
        return autoCommit("remove job", conn -> jobStore.delete(conn, name(), jobId)) > 0;
    }

    public int clean(JobState state, int limit) {
        Objects.requireNonNull(state, "state");
        return autoCommit("clean jobs", conn -> jobStore.deleteByState(conn, name(), state, limit));
    }

    /**
     * Deletes up to {@code limit} finished jobs whose retention has expired.
     */
    public int purgeExpired(int limit) {
        Instant now = clock.instant();
        return autoCommit("purge expired jobs", conn -> jobStore.purgeExpired(conn, name(), now, limit));
    }

    public List<QueueEvent> recentEvents(int limit) {
        return eventStream.latest(limit);
    }

    private static Instant expiresAt(Retention retention, Instant finishedAt) {
        if (retention instanceof Retention.RemoveAfter after) {
            return finishedAt.plus(after.age());
        }
        return null;
    }

    private void publish(QueueEvent event) {
        eventStream.append(event);
        try {
            eventExecutor.execute(() -> deliver(event));
        } catch (RejectedExecutionException e) {
            logger.log(Level.WARNING, "Event delivery stopped; dropped " + event.outcome()
                    + " notification for job " + event.jobId());
        }
    }

    private void deliver(QueueEvent event) {
        for (QueueEventListener listener : listeners) {
            try {
                if (event.outcome() == QueueEvent.Outcome.COMPLETED) {
                    listener.onCompleted(event.jobId());
                } else {
                    listener.onFailed(event.jobId(), event.reason());
                }
            } catch (Throwable t) {
                logger.log(Level.WARNING, "Queue event listener failed for job " + event.jobId(), t);
            }
        }
    }

    private void safeMetrics(Runnable update) {
        try {
            update.run();
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Metrics exporter failed", e);
        }
    }

    private <T> T autoCommit(String action, SqlWork<T> work) {
        try (Connection conn = connectionProvider.getConnection()) {
            conn.setAutoCommit(true);
            return work.execute(conn);
        } catch (SQLException e) {
            throw new QueueAccessException("Failed to " + action + " on queue " + name(), e);
        }
    }

    private <T> T inTransaction(String action, SqlWork<T> work) {
        try (Connection conn = connectionProvider.getConnection()) {
            conn.setAutoCommit(false);
            try {
                T result = work.execute(conn);
                conn.commit();
                return result;
            } catch (SQLException | RuntimeException e) {
                try {
                    conn.rollback();
                } catch (SQLException rollbackFailure) {
                    e.addSuppressed(rollbackFailure);
                }
                throw e;
            }
        } catch (SQLException e) {
            throw new QueueAccessException("Failed to " + action + " on queue " + name(), e);
        }
    }

    @FunctionalInterface
    private interface SqlWork<T> {
        T execute(Connection conn) throws SQLException;
    }

    /**
     * Stops accepting jobs and delivers the notifications already queued, waiting up to five
     * seconds.
     */
    @Override
    public void close() {
        closed = true;
        eventExecutor.shutdown();
        try {
            if (!eventExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                logger.warning("Event delivery did not drain within 5s; forcing shutdown");
                eventExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            eventExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        listeners.clear();
    }

    /** Builder for {@link HealingQueue}. */
    public static final class Builder {
        private HealingQueueConfig config;
        private ConnectionProvider connectionProvider;
        private JobStore jobStore;
        private PayloadCodec payloadCodec;
        private MetricsExporter metrics;
        private Clock clock;

        private Builder() {
        }

        /**
         * <p>Optional. Defaults to {@code HealingQueueConfig.builder().build()}.
         */
        public Builder config(HealingQueueConfig config) {
            this.config = config;
            return this;
        }

        /**
         * <p><b>Required.</b>
         */
        public Builder connectionProvider(ConnectionProvider connectionProvider) {
            this.connectionProvider = connectionProvider;
            return this;
        }

        /**
         * <p><b>Required.</b>
         */
        public Builder jobStore(JobStore jobStore) {
            this.jobStore = jobStore;
            return this;
        }

        /**
         * <p>Optional. Defaults to {@link PayloadCodec#getDefault()}.
         */
        public Builder payloadCodec(PayloadCodec payloadCodec) {
            this.payloadCodec = payloadCodec;
            return this;
        }

        /**
         * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
         */
        public Builder metrics(MetricsExporter metrics) {
            this.metrics = metrics;
            return this;
        }

        /**
         * <p>Optional. Defaults to {@link Clock#systemUTC()}.
         */
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public HealingQueue build() {
            return new HealingQueue(this);
        }
    }
}
