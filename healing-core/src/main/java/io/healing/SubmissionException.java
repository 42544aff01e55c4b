package io.healing;

/**
 * Thrown when a job cannot be handed to the queue: the store is unreachable or rejected
 * the job. Never thrown for a duplicate job id.
 */
public class SubmissionException extends RuntimeException {

    public SubmissionException(String message) {
        super(message);
    }

    public SubmissionException(String message, Throwable cause) {
        super(message, cause);
    }
}
