package io.healing;

/**
 * Maps an attempt number to the delay before that attempt becomes eligible to run.
 *
 * <p>Implementations must be pure functions of {@code attemptNo}: no jitter, no state.
 *
 * @see FlatBackoffPolicy
 */
@FunctionalInterface
public interface BackoffPolicy {

    /**
     * @param attemptNo 1-based attempt number
     * @return delay in milliseconds (non-negative)
     */
    long delayMs(int attemptNo);
}
