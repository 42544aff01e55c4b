package io.healing.spring.boot;

import io.healing.BackoffPolicy;
import io.healing.HealingJobPayload;
import io.healing.HealingJobProducer;
import io.healing.HealingQueueConfig;
import io.healing.HealingQueueRuntime;
import io.healing.inspect.QueueInspector;
import io.healing.inspect.ReadOnlyQueueException;
import io.healing.jdbc.DataSourceConnectionProvider;
import io.healing.jdbc.store.AbstractJdbcJobStore;
import io.healing.jdbc.store.H2JobStore;
import io.healing.jdbc.store.JdbcJobStores;
import io.healing.model.JobState;
import io.healing.spi.ConnectionProvider;
import io.healing.worker.DefaultProcessorRegistry;
import io.healing.worker.HealingJobProcessor;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.BeanCreationException;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HealingQueueAutoConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(
                    DataSourceAutoConfiguration.class,
                    HealingQueueAutoConfiguration.class))
            .withPropertyValues(
                    "spring.datasource.url=jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1;"
                            + "INIT=RUNSCRIPT FROM 'classpath:io/healing/jdbc/schema/h2.sql'",
                    "spring.datasource.driver-class-name=org.h2.Driver",
                    "healing.queue.worker.drain-delay-ms=20");

    @Test
    void createsAllBeans() {
        runner.run(ctx -> {
            assertTrue(ctx.containsBean("jobStore"));
            assertTrue(ctx.containsBean("connectionProvider"));
            assertTrue(ctx.containsBean("healingQueueConfig"));
            assertTrue(ctx.containsBean("processorRegistry"));
            assertTrue(ctx.containsBean("healingJobHandlerRegistrar"));
            assertTrue(ctx.containsBean("healingQueueRuntime"));
            assertTrue(ctx.containsBean("healingJobProducer"));
            assertTrue(ctx.containsBean("queueInspector"));

            assertInstanceOf(H2JobStore.class, ctx.getBean(AbstractJdbcJobStore.class));
            assertInstanceOf(DataSourceConnectionProvider.class, ctx.getBean(ConnectionProvider.class));
            HealingQueueRuntime runtime = ctx.getBean(HealingQueueRuntime.class);
            assertNotNull(runtime.worker());
            assertNotNull(runtime.retentionScheduler());
            assertEquals("ci-healing", runtime.queue().name());
        });
    }

    @Test
    void annotatedHandlerProcessesSubmittedAttempt() {
        runner.withUserConfiguration(HandlerConfig.class).run(ctx -> {
            RecordingHandler handler = ctx.getBean(RecordingHandler.class);
            ctx.getBean(HealingJobProducer.class).submit("run-42", 1);

            assertTrue(handler.processed.await(5, TimeUnit.SECONDS));
            assertEquals(List.of("run-42"), handler.runs);
            assertNotNull(ctx.getBean(DefaultProcessorRegistry.class).processorFor("ci-healing-process"));
        });
    }

    @Test
    void secondAttemptIsDelayed() {
        runner.withPropertyValues("healing.queue.worker.enabled=false").run(ctx -> {
            ctx.getBean(HealingJobProducer.class).submit("run-42", 2);

            assertEquals(1, ctx.getBean(QueueInspector.class).counts().get(JobState.DELAYED));
        });
    }

    @Test
    void producerOnlyWhenWorkerDisabled() {
        runner.withPropertyValues("healing.queue.worker.enabled=false").run(ctx -> {
            HealingQueueRuntime runtime = ctx.getBean(HealingQueueRuntime.class);
            assertNull(runtime.worker());
        });
    }

    @Test
    void retentionCanBeDisabled() {
        runner.withPropertyValues("healing.queue.retention.enabled=false").run(ctx -> {
            assertNull(ctx.getBean(HealingQueueRuntime.class).retentionScheduler());
        });
    }

    @Test
    void inspectionIsWritableOutsideProduction() {
        runner.run(ctx -> {
            assertFalse(ctx.getBean(HealingQueueConfig.class).inspectionReadOnly());
            assertFalse(ctx.getBean(QueueInspector.class).isReadOnly());
        });
    }

    @Test
    void inspectionIsReadOnlyInProductionProfile() {
        runner.withPropertyValues("spring.profiles.active=production").run(ctx -> {
            QueueInspector inspector = ctx.getBean(QueueInspector.class);
            assertTrue(inspector.isReadOnly());
            assertThrows(ReadOnlyQueueException.class, () -> inspector.remove("run-1:attempt:1"));
        });
    }

    @Test
    void explicitReadOnlyOverridesProfile() {
        runner.withPropertyValues("spring.profiles.active=production",
                "healing.queue.inspection.read-only=false").run(ctx -> {
            assertFalse(ctx.getBean(QueueInspector.class).isReadOnly());
        });
    }

    @Test
    void retentionPropertiesBecomeQueueDefaults() {
        runner.withPropertyValues("healing.queue.retention.completed-age=PT1H",
                "healing.queue.retention.failed-age=P7D").run(ctx -> {
            HealingQueueConfig config = ctx.getBean(HealingQueueConfig.class);
            assertEquals(Duration.ofHours(1).toMillis(), config.defaultRemoveOnComplete().toMillis());
            assertEquals(Duration.ofDays(7).toMillis(), config.defaultRemoveOnFail().toMillis());
        });
    }

    @Test
    void customTableName() {
        runner.withPropertyValues("healing.queue.table-name=ci_healing_job").run(ctx -> {
            AbstractJdbcJobStore store = ctx.getBean(AbstractJdbcJobStore.class);
            assertInstanceOf(H2JobStore.class, store);
            assertNotSame(JdbcJobStores.get("h2"), store);
        });
    }

    @Test
    void invalidTableNameFailsStartup() {
        runner.withPropertyValues("healing.queue.table-name=bad name").run(ctx -> {
            assertNotNull(ctx.getStartupFailure());
            assertInstanceOf(IllegalArgumentException.class, rootCause(ctx.getStartupFailure()));
        });
    }

    @Test
    void customBackoffPolicyIsUsed() {
        runner.withPropertyValues("healing.queue.worker.enabled=false")
                .withUserConfiguration(NoDelayBackoffConfig.class).run(ctx -> {
                    ctx.getBean(HealingJobProducer.class).submit("run-42", 2);

                    assertEquals(1, ctx.getBean(QueueInspector.class).counts().get(JobState.WAITING));
                });
    }

    @Test
    void failsWhenHandlerDoesNotImplementProcessor() {
        runner.withUserConfiguration(NotAProcessorConfig.class).run(ctx -> {
            assertNotNull(ctx.getStartupFailure());
            assertInstanceOf(BeanCreationException.class, ctx.getStartupFailure());
        });
    }

    @Test
    void failsOnDuplicateHandlers() {
        runner.withUserConfiguration(HandlerConfig.class, SecondHandlerConfig.class).run(ctx -> {
            assertNotNull(ctx.getStartupFailure());
            assertInstanceOf(BeanCreationException.class, ctx.getStartupFailure());
        });
    }

    @Test
    void backsOffWithoutDataSource() {
        new ApplicationContextRunner()
                .withConfiguration(AutoConfigurations.of(HealingQueueAutoConfiguration.class))
                .run(ctx -> assertFalse(ctx.containsBean("healingQueueRuntime")));
    }

    private static Throwable rootCause(Throwable t) {
        while (t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }

    // ── Test support ─────────────────────────────────────────────

    @HealingJobHandler
    static class RecordingHandler implements HealingJobProcessor {
        final CountDownLatch processed = new CountDownLatch(1);
        final List<String> runs = new CopyOnWriteArrayList<>();

        @Override
        public void process(HealingJobPayload payload) {
            runs.add(payload.runId());
            processed.countDown();
        }
    }

    @Configuration
    static class HandlerConfig {
        @Bean
        RecordingHandler recordingHandler() {
            return new RecordingHandler();
        }
    }

    @HealingJobHandler
    static class OtherHandler implements HealingJobProcessor {
        @Override
        public void process(HealingJobPayload payload) {
        }
    }

    @Configuration
    static class SecondHandlerConfig {
        @Bean
        OtherHandler otherHandler() {
            return new OtherHandler();
        }
    }

    @HealingJobHandler
    static class NotAProcessor {
    }

    @Configuration
    static class NotAProcessorConfig {
        @Bean
        NotAProcessor notAProcessor() {
            return new NotAProcessor();
        }
    }

    @Configuration
    static class NoDelayBackoffConfig {
        @Bean
        BackoffPolicy backoffPolicy() {
            return attemptNo -> 0L;
        }
    }
}
