package io.healing.inspect;

/**
 * Thrown by {@link QueueInspector} mutations when inspection is read-only.
 */
public class ReadOnlyQueueException extends RuntimeException {

    public ReadOnlyQueueException(String queueName, String operation) {
        super("Queue " + queueName + " is read-only; " + operation + " is not allowed");
    }
}
