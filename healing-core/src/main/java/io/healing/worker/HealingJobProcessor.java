package io.healing.worker;

import io.healing.HealingJobPayload;

/**
 * Performs one healing attempt for a run. Invoked by a {@link HealingWorker}.
 *
 * <p>Returning normally completes the job. Throwing fails it; the exception message becomes
 * the failure reason reported to queue listeners.
 */
@FunctionalInterface
public interface HealingJobProcessor {

    void process(HealingJobPayload payload) throws Exception;
}
