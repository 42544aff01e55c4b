package io.healing;

/**
 * Single-tier backoff: the first attempt runs immediately, every later attempt waits the
 * same fixed delay regardless of how many attempts came before.
 */
public final class FlatBackoffPolicy implements BackoffPolicy {

    /** Delay applied to every attempt after the first. */
    public static final long DEFAULT_RETRY_DELAY_MS = 10_000L;

    /** First attempt immediate, later attempts after {@value #DEFAULT_RETRY_DELAY_MS} ms. */
    public static final FlatBackoffPolicy DEFAULT = new FlatBackoffPolicy(DEFAULT_RETRY_DELAY_MS);

    private final long retryDelayMs;

    /**
     * @param retryDelayMs delay for any attempt after the first (milliseconds)
     */
    public FlatBackoffPolicy(long retryDelayMs) {
        if (retryDelayMs < 0) {
            throw new IllegalArgumentException("retryDelayMs must be >= 0, got: " + retryDelayMs);
        }
        this.retryDelayMs = retryDelayMs;
    }

    @Override
    public long delayMs(int attemptNo) {
        return attemptNo > 1 ? retryDelayMs : 0L;
    }

    public long retryDelayMs() {
        return retryDelayMs;
    }
}
