package io.healing.worker;

/**
 * Looks up the processor for a job name.
 *
 * @see DefaultProcessorRegistry
 */
public interface ProcessorRegistry {

    /**
     * @param jobName the job name
     * @return the processor, or {@code null} if none is registered
     */
    HealingJobProcessor processorFor(String jobName);
}
