package io.healing.spi;

import io.healing.JobOptions;
import io.healing.event.QueueEventListener;
import io.healing.event.Subscription;

import java.util.Map;

/**
 * Client handle for a named delayed-job queue: enqueue by key and subscribe to terminal
 * notifications.
 *
 * <p>{@link #add} must be atomic per job id: when a job with the same id is already stored,
 * the call is a no-op and returns {@code false}.
 *
 * @see io.healing.queue.HealingQueue
 */
public interface JobQueue {

    /**
     * @return the queue name
     */
    String name();

    /**
     * Enqueues a job.
     *
     * @param jobName routing name of the job
     * @param data    job data
     * @param options submission options
     * @return {@code true} if a new job was stored, {@code false} if the id was already taken
     * @throws io.healing.SubmissionException if the queue is unreachable or rejects the job
     */
    boolean add(String jobName, Map<String, String> data, JobOptions options);

    /**
     * Attaches a listener for completed and failed notifications.
     *
     * @param listener the listener
     * @return a handle that detaches the listener when closed
     */
    Subscription subscribe(QueueEventListener listener);
}
