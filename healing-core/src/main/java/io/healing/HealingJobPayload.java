package io.healing;

import java.util.Map;
import java.util.Objects;

/**
 * Data carried by a healing job: the run to re-evaluate. The attempt number lives only in
 * the job key.
 *
 * @param runId healing run identifier
 */
public record HealingJobPayload(String runId) {
    static final String RUN_ID = "runId";

    public HealingJobPayload {
        Objects.requireNonNull(runId, "runId");
        if (runId.isEmpty()) {
            throw new IllegalArgumentException("runId must not be empty");
        }
    }

    public Map<String, String> toData() {
        return Map.of(RUN_ID, runId);
    }

    /**
     * @throws IllegalArgumentException if the data has no {@code runId}
     */
    public static HealingJobPayload fromData(Map<String, String> data) {
        String runId = data == null ? null : data.get(RUN_ID);
        if (runId == null) {
            throw new IllegalArgumentException("Healing job data has no runId");
        }
        return new HealingJobPayload(runId);
    }
}
