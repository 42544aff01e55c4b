package io.healing;

/**
 * Derives the idempotency key of a healing attempt.
 *
 * <p>The key is {@code runId + ":attempt:" + attemptNo}, so resubmitting the same
 * {@code (runId, attemptNo)} pair always collides on the same job id.
 */
public final class HealingJobKeys {
    static final String ATTEMPT_SEPARATOR = ":attempt:";

    private HealingJobKeys() {
    }

    /**
     * @param runId     healing run identifier (non-empty)
     * @param attemptNo 1-based attempt number
     * @return the job key
     * @throws IllegalArgumentException if {@code runId} is empty or {@code attemptNo < 1}
     */
    public static String jobKey(String runId, int attemptNo) {
        validate(runId, attemptNo);
        return runId + ATTEMPT_SEPARATOR + attemptNo;
    }

    static void validate(String runId, int attemptNo) {
        if (runId == null || runId.isEmpty()) {
            throw new IllegalArgumentException("runId must not be empty");
        }
        if (attemptNo < 1) {
            throw new IllegalArgumentException("attemptNo must be >= 1, got: " + attemptNo);
        }
    }
}
