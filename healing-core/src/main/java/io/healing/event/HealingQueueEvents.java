package io.healing.event;

import io.healing.spi.JobQueue;
import io.healing.spi.MetricsExporter;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Observer for the CI healing queue: turns completion and failure notifications into log
 * records and metrics. It never feeds back into scheduling.
 *
 * <p>Neither callback throws. A failing metrics exporter is logged and ignored.
 */
public final class HealingQueueEvents implements QueueEventListener {
    private static final Logger logger = Logger.getLogger(HealingQueueEvents.class.getName());

    static final String UNKNOWN_REASON = "unknown";

    private final MetricsExporter metrics;

    public HealingQueueEvents() {
        this(MetricsExporter.NOOP);
    }

    public HealingQueueEvents(MetricsExporter metrics) {
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /**
     * Subscribes this observer to the given queue. Call once at startup.
     *
     * @return the subscription; close it on shutdown
     */
    public Subscription register(JobQueue queue) {
        return queue.subscribe(this);
    }

    @Override
    public void onCompleted(String jobId) {
        logger.fine("CI healing job completed: " + jobId);
        try {
            metrics.incrementCompleted();
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Metrics exporter failed on completed event", e);
        }
    }

    @Override
    public void onFailed(String jobId, String reason) {
        logger.warning("CI healing job failed: " + jobId + " (" + (reason != null ? reason : UNKNOWN_REASON) + ")");
        try {
            metrics.incrementFailed();
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Metrics exporter failed on failed event", e);
        }
    }
}
