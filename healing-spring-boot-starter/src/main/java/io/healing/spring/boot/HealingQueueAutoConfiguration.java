package io.healing.spring.boot;

import io.healing.BackoffPolicy;
import io.healing.HealingJobProducer;
import io.healing.HealingQueueConfig;
import io.healing.HealingQueueRuntime;
import io.healing.Retention;
import io.healing.inspect.QueueInspector;
import io.healing.jdbc.DataSourceConnectionProvider;
import io.healing.jdbc.TableNames;
import io.healing.jdbc.store.AbstractJdbcJobStore;
import io.healing.jdbc.store.JdbcJobStores;
import io.healing.spi.ConnectionProvider;
import io.healing.spi.DeadLetterSink;
import io.healing.spi.MetricsExporter;
import io.healing.worker.DefaultProcessorRegistry;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.core.env.Environment;
import org.springframework.core.env.Profiles;

import javax.sql.DataSource;
import java.time.Duration;

/**
 * Auto-configuration for the CI healing queue.
 *
 * <p>Wires a {@link HealingQueueRuntime} from a {@link DataSource} and
 * {@link HealingQueueProperties}. The runtime is built stopped and started by
 * {@link HealingJobHandlerRegistrar} once every {@link HealingJobHandler} bean is registered.
 * With {@code healing.queue.worker.enabled=false} the application only produces jobs.
 *
 * @see HealingQueueProperties
 * @see HealingMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(HealingQueueRuntime.class)
@ConditionalOnBean(DataSource.class)
@EnableConfigurationProperties(HealingQueueProperties.class)
public class HealingQueueAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public AbstractJdbcJobStore jobStore(DataSource dataSource, HealingQueueProperties props) {
        String tableName = props.getTableName();
        if (!TableNames.DEFAULT_TABLE.equals(tableName)) {
            return JdbcJobStores.detect(dataSource, tableName);
        }
        return JdbcJobStores.detect(dataSource);
    }

    @Bean
    @ConditionalOnMissingBean(ConnectionProvider.class)
    public DataSourceConnectionProvider connectionProvider(DataSource dataSource) {
        return new DataSourceConnectionProvider(dataSource);
    }

    @Bean
    @ConditionalOnMissingBean
    public HealingQueueConfig healingQueueConfig(HealingQueueProperties props, Environment environment) {
        HealingQueueProperties.Retention retention = props.getRetention();
        Boolean readOnly = props.getInspection().getReadOnly();
        return HealingQueueConfig.builder()
                .queueName(props.getName())
                .jobName(props.getJobName())
                .eventsMaxLen(props.getEvents().getMaxLen())
                .defaultRemoveOnComplete(retentionOf(retention.getCompletedAge()))
                .defaultRemoveOnFail(retentionOf(retention.getFailedAge()))
                .inspectionReadOnly(readOnly != null
                        ? readOnly
                        : environment.acceptsProfiles(Profiles.of(HealingQueueConfig.PRODUCTION)))
                .build();
    }

    @Bean
    @ConditionalOnMissingBean
    public DefaultProcessorRegistry processorRegistry() {
        return new DefaultProcessorRegistry();
    }

    @Bean
    @ConditionalOnMissingBean
    public HealingJobHandlerRegistrar healingJobHandlerRegistrar(
            ListableBeanFactory beanFactory,
            DefaultProcessorRegistry processorRegistry,
            ObjectProvider<HealingQueueRuntime> runtimeProvider) {
        return new HealingJobHandlerRegistrar(beanFactory, processorRegistry, runtimeProvider);
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public HealingQueueRuntime healingQueueRuntime(HealingQueueProperties props,
                                                   HealingQueueConfig config,
                                                   ConnectionProvider connectionProvider,
                                                   AbstractJdbcJobStore jobStore,
                                                   DefaultProcessorRegistry processorRegistry,
                                                   ObjectProvider<MetricsExporter> metricsProvider,
                                                   ObjectProvider<DeadLetterSink> deadLetterSinkProvider,
                                                   ObjectProvider<BackoffPolicy> backoffPolicyProvider) {
        HealingQueueProperties.Worker worker = props.getWorker();
        HealingQueueProperties.Retention retention = props.getRetention();
        var builder = HealingQueueRuntime.builder()
                .config(config)
                .connectionProvider(connectionProvider)
                .jobStore(jobStore)
                .metrics(metricsProvider.getIfAvailable())
                .deadLetterSink(deadLetterSinkProvider.getIfAvailable())
                .backoffPolicy(backoffPolicyProvider.getIfAvailable())
                .concurrency(worker.getConcurrency())
                .drainDelayMs(worker.getDrainDelayMs())
                .stalledIntervalMs(worker.getStalledIntervalMs())
                .maxStalledCount(worker.getMaxStalledCount())
                .drainTimeoutMs(worker.getDrainTimeoutMs())
                .retention(retention.isEnabled(), retention.getBatchSize(), retention.getIntervalSeconds())
                .autoStart(false);
        if (worker.isEnabled()) {
            builder.processorRegistry(processorRegistry);
        }
        if (worker.getOwnerId() != null && !worker.getOwnerId().isEmpty()) {
            builder.ownerId(worker.getOwnerId());
        }
        return builder.build();
    }

    @Bean
    @ConditionalOnMissingBean
    public HealingJobProducer healingJobProducer(HealingQueueRuntime runtime) {
        return runtime.producer();
    }

    @Bean
    @ConditionalOnMissingBean
    public QueueInspector queueInspector(HealingQueueRuntime runtime) {
        return runtime.inspector();
    }

    private static Retention retentionOf(Duration age) {
        return age == null ? Retention.keep() : Retention.fromMillis(age.toMillis());
    }
}
