package io.healing.queue;

/**
 * Thrown when the queue cannot reach its job store, typically because no connection could
 * be obtained.
 */
public class QueueAccessException extends RuntimeException {

    public QueueAccessException(String message, Throwable cause) {
        super(message, cause);
    }
}
