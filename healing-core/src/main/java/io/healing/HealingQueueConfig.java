package io.healing;

import java.time.Duration;
import java.util.Objects;

/**
 * Queue-level settings shared by the queue, the worker and the inspector.
 *
 * <p>Create instances via {@link #builder()} or {@link #forEnvironment(String)}.
 */
public final class HealingQueueConfig {
    public static final int DEFAULT_EVENTS_MAX_LEN = 1000;
    public static final Duration DEFAULT_COMPLETED_RETENTION = Duration.ofHours(24);
    public static final String PRODUCTION = "production";

    private final String queueName;
    private final String jobName;
    private final int eventsMaxLen;
    private final Retention defaultRemoveOnComplete;
    private final Retention defaultRemoveOnFail;
    private final boolean inspectionReadOnly;

    private HealingQueueConfig(Builder builder) {
        this.queueName = Objects.requireNonNull(builder.queueName, "queueName");
        this.jobName = Objects.requireNonNull(builder.jobName, "jobName");
        if (queueName.isEmpty()) {
            throw new IllegalArgumentException("queueName must not be empty");
        }
        if (jobName.isEmpty()) {
            throw new IllegalArgumentException("jobName must not be empty");
        }
        if (builder.eventsMaxLen <= 0) {
            throw new IllegalArgumentException("eventsMaxLen must be > 0");
        }
        this.eventsMaxLen = builder.eventsMaxLen;
        this.defaultRemoveOnComplete = Objects.requireNonNull(builder.defaultRemoveOnComplete, "defaultRemoveOnComplete");
        this.defaultRemoveOnFail = Objects.requireNonNull(builder.defaultRemoveOnFail, "defaultRemoveOnFail");
        this.inspectionReadOnly = builder.inspectionReadOnly;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Defaults for the given deployment environment: inspection is read-only when the
     * environment is {@code production} (case-insensitive), writable otherwise.
     *
     * @param environment deployment environment name, may be {@code null}
     */
    public static HealingQueueConfig forEnvironment(String environment) {
        return builder().inspectionReadOnly(isProduction(environment)).build();
    }

    public static boolean isProduction(String environment) {
        return environment != null && PRODUCTION.equalsIgnoreCase(environment.trim());
    }

    public String queueName() {
        return queueName;
    }

    public String jobName() {
        return jobName;
    }

    public int eventsMaxLen() {
        return eventsMaxLen;
    }

    public Retention defaultRemoveOnComplete() {
        return defaultRemoveOnComplete;
    }

    public Retention defaultRemoveOnFail() {
        return defaultRemoveOnFail;
    }

    public boolean inspectionReadOnly() {
        return inspectionReadOnly;
    }

    /** Builder for {@link HealingQueueConfig}. */
    public static final class Builder {
        private String queueName = QueueNames.CI_HEALING;
        private String jobName = QueueNames.CI_HEALING_PROCESS;
        private int eventsMaxLen = DEFAULT_EVENTS_MAX_LEN;
        private Retention defaultRemoveOnComplete = Retention.removeAfter(DEFAULT_COMPLETED_RETENTION);
        private Retention defaultRemoveOnFail = Retention.keep();
        private boolean inspectionReadOnly;

        private Builder() {
        }

        /**
         * <p>Optional. Defaults to {@value QueueNames#CI_HEALING}.
         */
        public Builder queueName(String queueName) {
            this.queueName = queueName;
            return this;
        }

        /**
         * Job name the producer submits under.
         *
         * <p>Optional. Defaults to {@value QueueNames#CI_HEALING_PROCESS}.
         */
        public Builder jobName(String jobName) {
            this.jobName = jobName;
            return this;
        }

        /**
         * Maximum number of events kept on the queue's event stream.
         *
         * <p>Optional. Defaults to {@code 1000}. Must be &gt; 0.
         */
        public Builder eventsMaxLen(int eventsMaxLen) {
            this.eventsMaxLen = eventsMaxLen;
            return this;
        }

        /**
         * Retention applied to completed jobs whose options leave it unset.
         *
         * <p>Optional. Defaults to removal after 24 hours.
         */
        public Builder defaultRemoveOnComplete(Retention retention) {
            this.defaultRemoveOnComplete = retention;
            return this;
        }

        /**
         * Retention applied to failed jobs whose options leave it unset.
         *
         * <p>Optional. Defaults to {@link Retention#keep()}.
         */
        public Builder defaultRemoveOnFail(Retention retention) {
            this.defaultRemoveOnFail = retention;
            return this;
        }

        /**
         * When {@code true}, {@link io.healing.inspect.QueueInspector} rejects mutations.
         *
         * <p>Optional. Defaults to {@code false}.
         */
        public Builder inspectionReadOnly(boolean inspectionReadOnly) {
            this.inspectionReadOnly = inspectionReadOnly;
            return this;
        }

        public HealingQueueConfig build() {
            return new HealingQueueConfig(this);
        }
    }
}
