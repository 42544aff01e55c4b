/**
 * Scheduling of self-healing attempts for failed CI runs.
 *
 * <p>{@link io.healing.HealingJobProducer} turns a {@code (runId, attemptNo)} pair into one
 * idempotent, optionally delayed job on a {@link io.healing.spi.JobQueue}.
 * {@link io.healing.HealingQueueRuntime} wires the store-backed queue, a worker and the
 * logging observer into a single closeable unit.
 */
package io.healing;
