package io.healing;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class HealingJobKeysTest {

    @Test
    void keyJoinsRunIdAndAttempt() {
        assertEquals("run-42:attempt:1", HealingJobKeys.jobKey("run-42", 1));
        assertEquals("run-42:attempt:2", HealingJobKeys.jobKey("run-42", 2));
    }

    @Test
    void samePairGivesSameKey() {
        assertEquals(HealingJobKeys.jobKey("abc", 7), HealingJobKeys.jobKey("abc", 7));
    }

    @Test
    void differentAttemptsGiveDifferentKeys() {
        assertNotEquals(HealingJobKeys.jobKey("abc", 1), HealingJobKeys.jobKey("abc", 2));
    }

    @Test
    void runIdIsNotInterpreted() {
        assertEquals("a:attempt:1:attempt:3", HealingJobKeys.jobKey("a:attempt:1", 3));
    }

    @Test
    void rejectsEmptyRunId() {
        assertThrows(IllegalArgumentException.class, () -> HealingJobKeys.jobKey("", 1));
        assertThrows(IllegalArgumentException.class, () -> HealingJobKeys.jobKey(null, 1));
    }

    @Test
    void rejectsAttemptBelowOne() {
        assertThrows(IllegalArgumentException.class, () -> HealingJobKeys.jobKey("run", 0));
        assertThrows(IllegalArgumentException.class, () -> HealingJobKeys.jobKey("run", -3));
    }
}
