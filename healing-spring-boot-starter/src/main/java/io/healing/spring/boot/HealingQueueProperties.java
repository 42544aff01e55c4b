package io.healing.spring.boot;

import io.healing.HealingQueueConfig;
import io.healing.QueueNames;
import io.healing.jdbc.TableNames;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for the CI healing queue.
 *
 * @see HealingQueueAutoConfiguration
 */
@ConfigurationProperties(prefix = "healing.queue")
public class HealingQueueProperties {

    /**
     * Queue name shared by producer and worker.
     */
    private String name = QueueNames.CI_HEALING;

    /**
     * Job name the producer submits under.
     */
    private String jobName = QueueNames.CI_HEALING_PROCESS;

    /**
     * Database table holding queued jobs.
     */
    private String tableName = TableNames.DEFAULT_TABLE;

    private final Worker worker = new Worker();
    private final Retention retention = new Retention();
    private final Events events = new Events();
    private final Inspection inspection = new Inspection();
    private final Metrics metrics = new Metrics();

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getJobName() {
        return jobName;
    }

    public void setJobName(String jobName) {
        this.jobName = jobName;
    }

    public String getTableName() {
        return tableName;
    }

    public void setTableName(String tableName) {
        this.tableName = tableName;
    }

    public Worker getWorker() {
        return worker;
    }

    public Retention getRetention() {
        return retention;
    }

    public Events getEvents() {
        return events;
    }

    public Inspection getInspection() {
        return inspection;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public static class Worker {
        /**
         * Whether this application consumes jobs. Disable for producer-only deployments.
         */
        private boolean enabled = true;
        private int concurrency = 3;
        private long drainDelayMs = 300;
        private long stalledIntervalMs = 300_000;
        private int maxStalledCount = 2;
        private long drainTimeoutMs = 5000;
        private String ownerId = "";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getConcurrency() {
            return concurrency;
        }

        public void setConcurrency(int concurrency) {
            this.concurrency = concurrency;
        }

        public long getDrainDelayMs() {
            return drainDelayMs;
        }

        public void setDrainDelayMs(long drainDelayMs) {
            this.drainDelayMs = drainDelayMs;
        }

        public long getStalledIntervalMs() {
            return stalledIntervalMs;
        }

        public void setStalledIntervalMs(long stalledIntervalMs) {
            this.stalledIntervalMs = stalledIntervalMs;
        }

        public int getMaxStalledCount() {
            return maxStalledCount;
        }

        public void setMaxStalledCount(int maxStalledCount) {
            this.maxStalledCount = maxStalledCount;
        }

        public long getDrainTimeoutMs() {
            return drainTimeoutMs;
        }

        public void setDrainTimeoutMs(long drainTimeoutMs) {
            this.drainTimeoutMs = drainTimeoutMs;
        }

        public String getOwnerId() {
            return ownerId;
        }

        public void setOwnerId(String ownerId) {
            this.ownerId = ownerId;
        }
    }

    public static class Retention {
        private boolean enabled = true;
        private int batchSize = 500;
        private long intervalSeconds = 3600;

        /**
         * Default age for completed jobs submitted without their own retention. Zero removes
         * them immediately.
         */
        private Duration completedAge = HealingQueueConfig.DEFAULT_COMPLETED_RETENTION;

        /**
         * Default age for failed jobs. Unset keeps them until removed by hand.
         */
        private Duration failedAge;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public long getIntervalSeconds() {
            return intervalSeconds;
        }

        public void setIntervalSeconds(long intervalSeconds) {
            this.intervalSeconds = intervalSeconds;
        }

        public Duration getCompletedAge() {
            return completedAge;
        }

        public void setCompletedAge(Duration completedAge) {
            this.completedAge = completedAge;
        }

        public Duration getFailedAge() {
            return failedAge;
        }

        public void setFailedAge(Duration failedAge) {
            this.failedAge = failedAge;
        }
    }

    public static class Events {
        /**
         * Number of recent queue events kept for inspection.
         */
        private int maxLen = HealingQueueConfig.DEFAULT_EVENTS_MAX_LEN;

        public int getMaxLen() {
            return maxLen;
        }

        public void setMaxLen(int maxLen) {
            this.maxLen = maxLen;
        }
    }

    public static class Inspection {
        /**
         * Forces inspection read-only on or off. Unset means read-only exactly when the
         * {@code production} profile is active.
         */
        private Boolean readOnly;

        public Boolean getReadOnly() {
            return readOnly;
        }

        public void setReadOnly(Boolean readOnly) {
            this.readOnly = readOnly;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "healing.queue";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
