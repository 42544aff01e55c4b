package io.healing.micrometer;

import io.healing.spi.MetricsExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code healing.queue.jobs.submitted}: jobs stored by an add</li>
 *   <li>{@code healing.queue.jobs.duplicate}: adds absorbed because the key was taken</li>
 *   <li>{@code healing.queue.jobs.completed}: jobs completed</li>
 *   <li>{@code healing.queue.jobs.failed}: jobs failed for good</li>
 *   <li>{@code healing.queue.jobs.stalled}: stalled jobs detected</li>
 * </ul>
 *
 * <h3>Gauges and timers</h3>
 * <ul>
 *   <li>{@code healing.queue.jobs.active}: jobs the worker is running right now</li>
 *   <li>{@code healing.queue.job.duration}: processor run time per job</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

    public static final String DEFAULT_PREFIX = "healing.queue";

    private final MeterRegistry registry;
    private final Counter submitted;
    private final Counter duplicate;
    private final Counter completed;
    private final Counter failed;
    private final Counter stalled;
    private final Gauge activeGauge;
    private final Timer duration;

    private final AtomicInteger active = new AtomicInteger();
    private volatile boolean closed;

    /**
     * Creates an exporter with the default metric name prefix {@code "healing.queue"}.
     */
    public MicrometerMetricsExporter(MeterRegistry registry) {
        this(registry, DEFAULT_PREFIX);
    }

    /**
     * Creates an exporter with a custom metric name prefix, for several queues in one registry.
     *
     * @param registry   the Micrometer meter registry
     * @param namePrefix prefix for all meter names (e.g. {@code "deploy.healing"})
     */
    public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
        Objects.requireNonNull(registry, "registry");
        Objects.requireNonNull(namePrefix, "namePrefix");
        if (namePrefix.isEmpty()) {
            throw new IllegalArgumentException("namePrefix must not be empty");
        }
        if (namePrefix.endsWith(".")) {
            throw new IllegalArgumentException("namePrefix must not end with '.'");
        }

        this.registry = registry;
        this.submitted = Counter.builder(namePrefix + ".jobs.submitted")
                .description("Healing jobs stored by an add")
                .register(registry);
        this.duplicate = Counter.builder(namePrefix + ".jobs.duplicate")
                .description("Adds absorbed because the job id was already present")
                .register(registry);
        this.completed = Counter.builder(namePrefix + ".jobs.completed")
                .description("Healing jobs completed")
                .register(registry);
        this.failed = Counter.builder(namePrefix + ".jobs.failed")
                .description("Healing jobs failed for good")
                .register(registry);
        this.stalled = Counter.builder(namePrefix + ".jobs.stalled")
                .description("Stalled healing jobs detected")
                .register(registry);
        this.activeGauge = Gauge.builder(namePrefix + ".jobs.active", active, AtomicInteger::get)
                .description("Healing jobs currently running")
                .register(registry);
        this.duration = Timer.builder(namePrefix + ".job.duration")
                .description("Processor run time per healing job")
                .register(registry);
    }

    @Override
    public void incrementSubmitted() {
        if (closed) return;
        submitted.increment();
    }

    @Override
    public void incrementDuplicate() {
        if (closed) return;
        duplicate.increment();
    }

    @Override
    public void incrementCompleted() {
        if (closed) return;
        completed.increment();
    }

    @Override
    public void incrementFailed() {
        if (closed) return;
        failed.increment();
    }

    @Override
    public void incrementStalled() {
        if (closed) return;
        stalled.increment();
    }

    @Override
    public void recordActiveJobs(int active) {
        if (closed) return;
        this.active.set(active);
    }

    @Override
    public void recordProcessingDurationMs(long durationMs) {
        if (closed) return;
        duration.record(durationMs, TimeUnit.MILLISECONDS);
    }

    /**
     * Removes all meters registered by this exporter from the registry, so a closed
     * runtime leaves no stale gauge behind.
     */
    @Override
    public void close() {
        closed = true;
        RuntimeException first = null;
        for (Meter meter : List.of(submitted, duplicate, completed, failed, stalled, activeGauge, duration)) {
            try {
                registry.remove(meter);
            } catch (RuntimeException e) {
                if (first == null) first = e; else first.addSuppressed(e);
            }
        }
        if (first != null) throw first;
    }
}
