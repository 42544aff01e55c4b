package io.healing.worker;

/**
 * Thrown when no processor is registered for a job's name. The job fails without being
 * retried.
 */
public class UnknownJobException extends RuntimeException {

    public UnknownJobException(String jobName) {
        super("Unknown CI healing job name: " + jobName);
    }
}
