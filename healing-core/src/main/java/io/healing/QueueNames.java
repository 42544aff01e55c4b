package io.healing;

/**
 * Queue and job name constants shared by producers, workers and configuration.
 */
public final class QueueNames {

    /** Name of the queue carrying self-healing attempts for failed CI runs. */
    public static final String CI_HEALING = "ci-healing";

    /** Job name of a single healing attempt. */
    public static final String CI_HEALING_PROCESS = "ci-healing-process";

    private QueueNames() {
    }
}
