package io.healing;

import java.time.Duration;
import java.util.Objects;

/**
 * How long a job is kept once it reaches a terminal state.
 *
 * <ul>
 *   <li>{@link Keep}: retained until explicitly removed or cleaned.</li>
 *   <li>{@link RemoveImmediately}: deleted as soon as the job finishes.</li>
 *   <li>{@link RemoveAfter}: deleted by the retention scheduler once the age window passes.</li>
 * </ul>
 *
 * <p>Stores persist a retention as a single {@code long}: {@code -1} keep, {@code 0} remove
 * immediately, positive values an age in milliseconds.
 */
public sealed interface Retention permits Retention.Keep, Retention.RemoveImmediately, Retention.RemoveAfter {

    Keep KEEP = new Keep();
    RemoveImmediately REMOVE_IMMEDIATELY = new RemoveImmediately();

    static Retention keep() {
        return KEEP;
    }

    static Retention removeImmediately() {
        return REMOVE_IMMEDIATELY;
    }

    /**
     * @param age how long a finished job is kept
     * @return an age-based retention
     * @throws IllegalArgumentException if {@code age} is shorter than 1 ms
     */
    static Retention removeAfter(Duration age) {
        return new RemoveAfter(age);
    }

    /**
     * Maps the boolean form used by most queue APIs: {@code true} removes immediately,
     * {@code false} keeps the job.
     */
    static Retention of(boolean remove) {
        return remove ? REMOVE_IMMEDIATELY : KEEP;
    }

    static Retention fromMillis(long millis) {
        if (millis < 0) {
            return KEEP;
        }
        if (millis == 0) {
            return REMOVE_IMMEDIATELY;
        }
        return new RemoveAfter(Duration.ofMillis(millis));
    }

    long toMillis();

    record Keep() implements Retention {
        @Override
        public long toMillis() {
            return -1L;
        }
    }

    record RemoveImmediately() implements Retention {
        @Override
        public long toMillis() {
            return 0L;
        }
    }

    record RemoveAfter(Duration age) implements Retention {
        public RemoveAfter {
            Objects.requireNonNull(age, "age");
            if (age.toMillis() < 1) {
                throw new IllegalArgumentException("age must be at least 1 ms");
            }
        }

        @Override
        public long toMillis() {
            return age.toMillis();
        }
    }
}
