package io.healing;

import io.healing.event.HealingQueueEvents;
import io.healing.event.Subscription;
import io.healing.inspect.QueueInspector;
import io.healing.purge.JobRetentionScheduler;
import io.healing.queue.HealingQueue;
import io.healing.spi.ConnectionProvider;
import io.healing.spi.DeadLetterSink;
import io.healing.spi.JobStore;
import io.healing.spi.MetricsExporter;
import io.healing.util.PayloadCodec;
import io.healing.worker.HealingWorker;
import io.healing.worker.ProcessorRegistry;

import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Composite entry point that wires a {@link HealingQueue}, {@link HealingJobProducer},
 * {@link HealingQueueEvents} observer, {@link QueueInspector}, optional
 * {@link HealingWorker} and optional {@link JobRetentionScheduler} into a single
 * {@link AutoCloseable} unit.
 *
 * <p>Building the runtime registers the observer and starts the worker and the retention
 * scheduler, unless {@link Builder#autoStart(boolean) autoStart(false)} defers that to
 * {@link #start()}. Closing it stops them in reverse order and drains pending notifications.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * try (HealingQueueRuntime runtime = HealingQueueRuntime.builder()
 *     .connectionProvider(connectionProvider)
 *     .jobStore(store)
 *     .processorRegistry(new DefaultProcessorRegistry()
 *         .register(QueueNames.CI_HEALING_PROCESS, payload -> healer.heal(payload.runId())))
 *     .build()) {
 *   runtime.producer().submit("run-42", 1);
 * }
 * }</pre>
 *
 * <p>Leave the processor registry unset for producer-only deployments: no worker is started
 * and jobs are consumed by another process sharing the same store. Queue events are delivered
 * only inside the process whose worker finished the job, so the observer and the inspector's
 * recent events of a producer-only runtime never see those completions or failures. Job states
 * in the shared store stay visible through {@link #inspector()}.
 */
public final class HealingQueueRuntime implements AutoCloseable {

    private final HealingQueue queue;
    private final HealingJobProducer producer;
    private final HealingQueueEvents events;
    private final Subscription eventsSubscription;
    private final QueueInspector inspector;
    private final HealingWorker worker;
    private final JobRetentionScheduler retentionScheduler;
    private final MetricsExporter metrics;

    private HealingQueueRuntime(HealingQueue queue, HealingJobProducer producer, HealingQueueEvents events,
                                Subscription eventsSubscription, QueueInspector inspector, HealingWorker worker,
                                JobRetentionScheduler retentionScheduler, MetricsExporter metrics) {
        this.queue = queue;
        this.producer = producer;
        this.events = events;
        this.eventsSubscription = eventsSubscription;
        this.inspector = inspector;
        this.worker = worker;
        this.retentionScheduler = retentionScheduler;
        this.metrics = metrics;
    }

    public static Builder builder() {
        return new Builder();
    }

    public HealingQueue queue() {
        return queue;
    }

    public HealingJobProducer producer() {
        return producer;
    }

    public HealingQueueEvents events() {
        return events;
    }

    public QueueInspector inspector() {
        return inspector;
    }

    /**
     * @return the worker, or {@code null} in producer-only mode
     */
    public HealingWorker worker() {
        return worker;
    }

    /**
     * @return the retention scheduler, or {@code null} when retention purging is disabled
     */
    public JobRetentionScheduler retentionScheduler() {
        return retentionScheduler;
    }

    /**
     * Starts the worker and the retention scheduler. Subsequent calls are no-ops.
     */
    public void start() {
        if (worker != null) {
            worker.start();
        }
        if (retentionScheduler != null) {
            retentionScheduler.start();
        }
    }

    /**
     * Shuts down components in order: retention scheduler, worker, queue, observer.
     * Null components are skipped.
     */
    @Override
    public void close() {
        RuntimeException first = null;
        if (retentionScheduler != null) {
            try {
                retentionScheduler.close();
            } catch (RuntimeException e) {
                first = e;
            }
        }
        if (worker != null) {
            try {
                worker.close();
            } catch (RuntimeException e) {
                first = merge(first, e);
            }
        }
        try {
            queue.close();
        } catch (RuntimeException e) {
            first = merge(first, e);
        }
        eventsSubscription.close();
        if (metrics instanceof AutoCloseable closeable) {
            try {
                closeable.close();
            } catch (Exception e) {
                first = merge(first, e instanceof RuntimeException r ? r : new RuntimeException(e));
            }
        }
        if (first != null) {
            throw first;
        }
    }

    private static RuntimeException merge(RuntimeException first, RuntimeException next) {
        if (first == null) {
            return next;
        }
        first.addSuppressed(next);
        return first;
    }

    /** Builder for {@link HealingQueueRuntime}. Each builder builds once. */
    public static final class Builder {
        private HealingQueueConfig config;
        private ConnectionProvider connectionProvider;
        private JobStore jobStore;
        private ProcessorRegistry processorRegistry;
        private DeadLetterSink deadLetterSink;
        private MetricsExporter metrics;
        private BackoffPolicy backoffPolicy;
        private PayloadCodec payloadCodec;
        private Clock clock;
        private int concurrency = 3;
        private long drainDelayMs = 300;
        private long stalledIntervalMs = 300_000;
        private int maxStalledCount = 2;
        private long drainTimeoutMs = 5000;
        private String ownerId;
        private boolean retentionEnabled = true;
        private int retentionBatchSize = 500;
        private long retentionIntervalSeconds = 3600;
        private boolean autoStart = true;
        private final AtomicBoolean built = new AtomicBoolean(false);

        private Builder() {
        }

        /** <p>Optional. Defaults to {@code HealingQueueConfig.builder().build()}. */
        public Builder config(HealingQueueConfig config) {
            this.config = config;
            return this;
        }

        /** <p><b>Required.</b> */
        public Builder connectionProvider(ConnectionProvider connectionProvider) {
            this.connectionProvider = connectionProvider;
            return this;
        }

        /** <p><b>Required.</b> */
        public Builder jobStore(JobStore jobStore) {
            this.jobStore = jobStore;
            return this;
        }

        /**
         * Sets the processors run by the worker. Without a registry no worker is started.
         */
        public Builder processorRegistry(ProcessorRegistry processorRegistry) {
            this.processorRegistry = processorRegistry;
            return this;
        }

        public Builder deadLetterSink(DeadLetterSink deadLetterSink) {
            this.deadLetterSink = deadLetterSink;
            return this;
        }

        /**
         * Shared by the queue, the worker and the observer. Closed with the runtime when it
         * implements {@link AutoCloseable}.
         */
        public Builder metrics(MetricsExporter metrics) {
            this.metrics = metrics;
            return this;
        }

        /** <p>Optional. Defaults to {@link FlatBackoffPolicy#DEFAULT}. */
        public Builder backoffPolicy(BackoffPolicy backoffPolicy) {
            this.backoffPolicy = backoffPolicy;
            return this;
        }

        public Builder payloadCodec(PayloadCodec payloadCodec) {
            this.payloadCodec = payloadCodec;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder concurrency(int concurrency) {
            this.concurrency = concurrency;
            return this;
        }

        public Builder drainDelayMs(long drainDelayMs) {
            this.drainDelayMs = drainDelayMs;
            return this;
        }

        public Builder stalledIntervalMs(long stalledIntervalMs) {
            this.stalledIntervalMs = stalledIntervalMs;
            return this;
        }

        public Builder maxStalledCount(int maxStalledCount) {
            this.maxStalledCount = maxStalledCount;
            return this;
        }

        public Builder drainTimeoutMs(long drainTimeoutMs) {
            this.drainTimeoutMs = drainTimeoutMs;
            return this;
        }

        public Builder ownerId(String ownerId) {
            this.ownerId = ownerId;
            return this;
        }

        /**
         * Configures the retention purge; {@code enabled = false} skips the scheduler.
         */
        public Builder retention(boolean enabled, int batchSize, long intervalSeconds) {
            this.retentionEnabled = enabled;
            this.retentionBatchSize = batchSize;
            this.retentionIntervalSeconds = intervalSeconds;
            return this;
        }

        /**
         * <p>Optional. Defaults to {@code true}. With {@code false}, {@link #build()} leaves the
         * worker and the retention scheduler stopped until {@link HealingQueueRuntime#start()}.
         */
        public Builder autoStart(boolean autoStart) {
            this.autoStart = autoStart;
            return this;
        }

        /**
         * Builds the runtime and, unless auto-start is off, starts it.
         *
         * @throws IllegalStateException if called twice on the same builder
         */
        public HealingQueueRuntime build() {
            if (!built.compareAndSet(false, true)) {
                throw new IllegalStateException("build() already called on this builder");
            }
            Objects.requireNonNull(connectionProvider, "connectionProvider");
            Objects.requireNonNull(jobStore, "jobStore");
            MetricsExporter effectiveMetrics = metrics != null ? metrics : MetricsExporter.NOOP;
            HealingQueueConfig effectiveConfig = config != null ? config : HealingQueueConfig.builder().build();

            HealingQueue queue = HealingQueue.builder()
                    .config(effectiveConfig)
                    .connectionProvider(connectionProvider)
                    .jobStore(jobStore)
                    .payloadCodec(payloadCodec)
                    .metrics(effectiveMetrics)
                    .clock(clock)
                    .build();

            HealingWorker worker = null;
            JobRetentionScheduler retentionScheduler = null;
            try {
                HealingJobProducer producer = new HealingJobProducer(queue, effectiveConfig.jobName(),
                        backoffPolicy != null ? backoffPolicy : FlatBackoffPolicy.DEFAULT,
                        ForkJoinPool.commonPool());
                HealingQueueEvents events = new HealingQueueEvents(effectiveMetrics);
                Subscription subscription = events.register(queue);
                QueueInspector inspector = new QueueInspector(queue);

                if (processorRegistry != null) {
                    worker = HealingWorker.builder()
                            .queue(queue)
                            .processorRegistry(processorRegistry)
                            .deadLetterSink(deadLetterSink)
                            .metrics(effectiveMetrics)
                            .concurrency(concurrency)
                            .drainDelayMs(drainDelayMs)
                            .stalledIntervalMs(stalledIntervalMs)
                            .maxStalledCount(maxStalledCount)
                            .drainTimeoutMs(drainTimeoutMs)
                            .ownerId(ownerId)
                            .build();
                }
                if (retentionEnabled) {
                    retentionScheduler = JobRetentionScheduler.builder()
                            .queue(queue)
                            .batchSize(retentionBatchSize)
                            .intervalSeconds(retentionIntervalSeconds)
                            .build();
                }
                HealingQueueRuntime runtime = new HealingQueueRuntime(queue, producer, events, subscription,
                        inspector, worker, retentionScheduler, effectiveMetrics);
                if (autoStart) {
                    runtime.start();
                }
                return runtime;
            } catch (RuntimeException e) {
                if (retentionScheduler != null) {
                    retentionScheduler.close();
                }
                if (worker != null) {
                    worker.close();
                }
                queue.close();
                throw e;
            }
        }
    }
}
