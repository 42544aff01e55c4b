package io.healing.spring.boot;

import io.healing.micrometer.MicrometerMetricsExporter;
import io.healing.spi.MetricsExporter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Creates a {@link MicrometerMetricsExporter} when Micrometer is on the classpath, a
 * {@link MeterRegistry} bean exists and {@code healing.queue.metrics.enabled} is true
 * (default).
 *
 * <p>Runs before {@link HealingQueueAutoConfiguration} so the {@link MetricsExporter}
 * bean is available to the runtime. The runtime closes the exporter, which removes its
 * meters from the registry.
 */
@AutoConfiguration(before = HealingQueueAutoConfiguration.class,
        afterName = "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration")
@ConditionalOnClass({MicrometerMetricsExporter.class, MeterRegistry.class})
@ConditionalOnBean(MeterRegistry.class)
@ConditionalOnProperty(prefix = "healing.queue.metrics", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(HealingQueueProperties.class)
public class HealingMicrometerAutoConfiguration {

    @Bean(destroyMethod = "")
    @ConditionalOnMissingBean(MetricsExporter.class)
    public MicrometerMetricsExporter micrometerMetricsExporter(MeterRegistry meterRegistry,
                                                               HealingQueueProperties props) {
        return new MicrometerMetricsExporter(meterRegistry, props.getMetrics().getNamePrefix());
    }
}
