package io.healing.event;

/**
 * Receives terminal job notifications from a {@link io.healing.spi.JobQueue}.
 *
 * <p>Callbacks run on the queue's event-delivery thread, never on the submitting thread.
 * Implementations should return quickly; exceptions are logged by the queue and dropped.
 */
public interface QueueEventListener {

    /**
     * @param jobId id of the job that finished successfully
     */
    void onCompleted(String jobId);

    /**
     * @param jobId  id of the job that failed
     * @param reason failure reason, or {@code null} when the queue has none
     */
    void onFailed(String jobId, String reason);
}
