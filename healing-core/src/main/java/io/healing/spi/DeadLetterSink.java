package io.healing.spi;

import io.healing.model.DeadLetterRecord;

/**
 * Receives every job that fails for good, e.g. to copy it into a dead-letter queue.
 *
 * <p>Exceptions thrown here are logged by the worker and never affect the job's state.
 */
@FunctionalInterface
public interface DeadLetterSink {

    DeadLetterSink NOOP = record -> {
    };

    void accept(DeadLetterRecord record);
}
