package io.healing.event;

/**
 * Handle returned by {@link io.healing.spi.JobQueue#subscribe}; closing it detaches the
 * listener. Closing twice is a no-op.
 */
@FunctionalInterface
public interface Subscription extends AutoCloseable {

    @Override
    void close();
}
