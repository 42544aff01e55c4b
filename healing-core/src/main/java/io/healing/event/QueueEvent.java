package io.healing.event;

import java.time.Instant;
import java.util.Objects;

/**
 * Terminal notification for a job, as recorded on the {@link QueueEventStream}.
 *
 * @param jobId      the job id
 * @param outcome    how the job ended
 * @param reason     failure reason ({@code null} for completed jobs or when unknown)
 * @param occurredAt when the outcome was recorded
 */
public record QueueEvent(String jobId, Outcome outcome, String reason, Instant occurredAt) {

    public enum Outcome {
        COMPLETED,
        FAILED
    }

    public QueueEvent {
        Objects.requireNonNull(jobId, "jobId");
        Objects.requireNonNull(outcome, "outcome");
        Objects.requireNonNull(occurredAt, "occurredAt");
    }

    public static QueueEvent completed(String jobId, Instant occurredAt) {
        return new QueueEvent(jobId, Outcome.COMPLETED, null, occurredAt);
    }

    public static QueueEvent failed(String jobId, String reason, Instant occurredAt) {
        return new QueueEvent(jobId, Outcome.FAILED, reason, occurredAt);
    }
}
