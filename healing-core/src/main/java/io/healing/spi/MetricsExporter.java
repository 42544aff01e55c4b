package io.healing.spi;

/**
 * Observability hook for exporting queue counters and timings to a metrics backend.
 *
 * <p>{@link #NOOP} discards everything.
 */
public interface MetricsExporter {

    MetricsExporter NOOP = new Noop();

    /** A new job was stored. */
    void incrementSubmitted();

    /** An add was absorbed because the job id was already taken. */
    void incrementDuplicate();

    /** A job completed. */
    void incrementCompleted();

    /** A job failed for good. */
    void incrementFailed();

    /** A stalled job was reclaimed or failed for stalling. */
    default void incrementStalled() {
    }

    /**
     * Records the number of jobs a worker is currently running.
     */
    default void recordActiveJobs(int active) {
    }

    /**
     * Records how long a processor ran for one job.
     *
     * @param durationMs processing time in milliseconds (non-negative)
     */
    default void recordProcessingDurationMs(long durationMs) {
    }

    final class Noop implements MetricsExporter {
        @Override
        public void incrementSubmitted() {
        }

        @Override
        public void incrementDuplicate() {
        }

        @Override
        public void incrementCompleted() {
        }

        @Override
        public void incrementFailed() {
        }
    }
}
