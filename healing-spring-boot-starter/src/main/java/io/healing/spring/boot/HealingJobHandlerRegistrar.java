package io.healing.spring.boot;

import io.healing.HealingQueueRuntime;
import io.healing.worker.DefaultProcessorRegistry;
import io.healing.worker.HealingJobProcessor;
import org.springframework.beans.factory.BeanCreationException;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.core.annotation.AnnotationUtils;

import java.util.Map;

/**
 * Scans for beans annotated with {@link HealingJobHandler}, registers them in the
 * {@link DefaultProcessorRegistry}, then starts the {@link HealingQueueRuntime}.
 *
 * <p>Runs after all singleton beans are initialized via {@link SmartInitializingSingleton},
 * so the worker never claims a job before its processor is known.
 *
 * @see HealingJobHandler
 */
public class HealingJobHandlerRegistrar implements SmartInitializingSingleton {

    private final ListableBeanFactory beanFactory;
    private final DefaultProcessorRegistry registry;
    private final ObjectProvider<HealingQueueRuntime> runtimeProvider;

    public HealingJobHandlerRegistrar(ListableBeanFactory beanFactory, DefaultProcessorRegistry registry,
                                      ObjectProvider<HealingQueueRuntime> runtimeProvider) {
        this.beanFactory = beanFactory;
        this.registry = registry;
        this.runtimeProvider = runtimeProvider;
    }

    @Override
    public void afterSingletonsInstantiated() {
        Map<String, Object> beans = beanFactory.getBeansWithAnnotation(HealingJobHandler.class);
        for (Map.Entry<String, Object> entry : beans.entrySet()) {
            String beanName = entry.getKey();
            Object bean = entry.getValue();

            if (!(bean instanceof HealingJobProcessor processor)) {
                throw new BeanCreationException(beanName,
                        "Bean annotated with @HealingJobHandler must implement HealingJobProcessor, " +
                                "but " + bean.getClass().getName() + " does not");
            }

            // Proxies may hide the annotation; findAnnotation walks the hierarchy
            HealingJobHandler annotation = AnnotationUtils.findAnnotation(bean.getClass(), HealingJobHandler.class);
            if (annotation == null) {
                throw new BeanCreationException(beanName,
                        "Could not find @HealingJobHandler annotation on " + bean.getClass().getName());
            }
            if (annotation.jobName().isBlank()) {
                throw new BeanCreationException(beanName, "@HealingJobHandler jobName must not be blank");
            }

            try {
                registry.register(annotation.jobName(), processor);
            } catch (IllegalStateException e) {
                throw new BeanCreationException(beanName, e.getMessage(), e);
            }
        }
        runtimeProvider.ifAvailable(HealingQueueRuntime::start);
    }
}
