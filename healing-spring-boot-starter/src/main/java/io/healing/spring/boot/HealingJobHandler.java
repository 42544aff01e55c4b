package io.healing.spring.boot;

import io.healing.QueueNames;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a Spring bean as the processor for a healing job name.
 *
 * <p>The annotated bean must implement {@link io.healing.worker.HealingJobProcessor}.
 *
 * <pre>{@code
 * @Component
 * @HealingJobHandler
 * public class PipelineHealer implements HealingJobProcessor {
 *   public void process(HealingJobPayload payload) { ... }
 * }
 * }</pre>
 *
 * @see HealingJobHandlerRegistrar
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface HealingJobHandler {

    /**
     * Job name handled by the bean.
     */
    String jobName() default QueueNames.CI_HEALING_PROCESS;
}
