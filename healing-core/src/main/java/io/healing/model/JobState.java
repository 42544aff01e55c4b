package io.healing.model;

import java.util.Arrays;

/**
 * Lifecycle state of a queued job, persisted as a small integer code.
 *
 * <p>{@code WAITING}/{@code DELAYED} → {@code ACTIVE} → {@code COMPLETED} or {@code FAILED}.
 * An {@code ACTIVE} job whose lock expires is stalled and may be claimed again.
 */
public enum JobState {
    WAITING(0),
    DELAYED(1),
    ACTIVE(2),
    COMPLETED(3),
    FAILED(4);

    private final int code;

    JobState(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    public static JobState fromCode(int code) {
        return Arrays.stream(values())
                .filter(state -> state.code == code)
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown job state code: " + code));
    }
}
