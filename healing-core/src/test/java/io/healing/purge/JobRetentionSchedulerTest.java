package io.healing.purge;

import io.healing.JobOptions;
import io.healing.Retention;
import io.healing.model.QueuedJob;
import io.healing.queue.HealingQueue;
import io.healing.support.InMemoryJobStore;
import io.healing.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static io.healing.support.StubConnections.failingCp;
import static io.healing.support.StubConnections.stubCp;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JobRetentionSchedulerTest {

    private final InMemoryJobStore store = new InMemoryJobStore();
    private final MutableClock clock = new MutableClock(Instant.parse("2024-03-01T10:00:00Z"));
    private final HealingQueue queue = HealingQueue.builder()
            .connectionProvider(stubCp())
            .jobStore(store)
            .clock(clock)
            .build();

    @AfterEach
    void tearDown() {
        queue.close();
    }

    @Test
    void builderValidation() {
        assertThrows(NullPointerException.class, () -> JobRetentionScheduler.builder().build());
        assertThrows(IllegalArgumentException.class, () -> JobRetentionScheduler.builder().queue(queue).batchSize(0).build());
        assertThrows(IllegalArgumentException.class, () -> JobRetentionScheduler.builder().queue(queue).intervalSeconds(0).build());
    }

    @Test
    void purgesOnlyExpiredJobs() {
        complete("old", Retention.removeAfter(Duration.ofHours(24)));
        clock.advance(Duration.ofHours(12));
        complete("recent", Retention.removeAfter(Duration.ofHours(24)));
        complete("kept", Retention.keep());
        clock.advance(Duration.ofHours(13));

        JobRetentionScheduler scheduler = JobRetentionScheduler.builder().queue(queue).build();
        assertEquals(1, scheduler.runOnce());

        assertTrue(queue.find("old").isEmpty());
        assertTrue(queue.find("recent").isPresent());
        assertTrue(queue.find("kept").isPresent());
        scheduler.close();
    }

    @Test
    void deletesInBatchesUntilDone() {
        for (int i = 0; i < 5; i++) {
            complete("job-" + i, Retention.removeAfter(Duration.ofMinutes(1)));
        }
        clock.advance(Duration.ofMinutes(2));

        JobRetentionScheduler scheduler = JobRetentionScheduler.builder().queue(queue).batchSize(2).build();
        assertEquals(5, scheduler.runOnce());
        assertEquals(0, store.size());
        scheduler.close();
    }

    @Test
    void failuresAreContained() {
        try (HealingQueue down = HealingQueue.builder().connectionProvider(failingCp()).jobStore(store).build();
             JobRetentionScheduler scheduler = JobRetentionScheduler.builder().queue(down).build()) {
            assertEquals(0, scheduler.runOnce());
        }
    }

    @Test
    void closedSchedulerCannotStart() {
        JobRetentionScheduler scheduler = JobRetentionScheduler.builder().queue(queue).build();
        scheduler.close();

        assertEquals(0, scheduler.runOnce());
        assertThrows(IllegalStateException.class, scheduler::start);
    }

    private void complete(String jobId, Retention retention) {
        queue.add("ci-healing-process", Map.of(), new JobOptions(jobId, 1, 0, retention, null));
        QueuedJob claimed = queue.claim("w", 1).get(0);
        queue.complete(claimed, "w");
    }
}
