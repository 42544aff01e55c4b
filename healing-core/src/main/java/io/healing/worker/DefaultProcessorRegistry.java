package io.healing.worker;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe registry mapping each job name to exactly one processor.
 *
 * <pre>{@code
 * ProcessorRegistry registry = new DefaultProcessorRegistry()
 *     .register(QueueNames.CI_HEALING_PROCESS, payload -> healer.heal(payload.runId()));
 * }</pre>
 */
public final class DefaultProcessorRegistry implements ProcessorRegistry {
    private final Map<String, HealingJobProcessor> processors = new ConcurrentHashMap<>();

    /**
     * @return this registry for chaining
     * @throws IllegalStateException if a processor is already registered for {@code jobName}
     */
    public DefaultProcessorRegistry register(String jobName, HealingJobProcessor processor) {
        Objects.requireNonNull(jobName, "jobName");
        Objects.requireNonNull(processor, "processor");
        HealingJobProcessor existing = processors.putIfAbsent(jobName, processor);
        if (existing != null) {
            throw new IllegalStateException("Duplicate processor for job name: " + jobName);
        }
        return this;
    }

    @Override
    public HealingJobProcessor processorFor(String jobName) {
        return processors.get(jobName);
    }
}
