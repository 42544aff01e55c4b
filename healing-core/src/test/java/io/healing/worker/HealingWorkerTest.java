package io.healing.worker;

import io.healing.JobOptions;
import io.healing.Retention;
import io.healing.event.QueueEventListener;
import io.healing.model.DeadLetterRecord;
import io.healing.model.JobState;
import io.healing.model.QueuedJob;
import io.healing.queue.HealingQueue;
import io.healing.support.InMemoryJobStore;
import io.healing.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static io.healing.support.StubConnections.stubCp;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HealingWorkerTest {

    private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");
    private static final String JOB = "ci-healing-process";

    private final InMemoryJobStore store = new InMemoryJobStore();
    private final MutableClock clock = new MutableClock(T0);
    private final HealingQueue queue = HealingQueue.builder()
            .connectionProvider(stubCp())
            .jobStore(store)
            .clock(clock)
            .build();
    private final List<DeadLetterRecord> deadLetters = new CopyOnWriteArrayList<>();
    private HealingWorker worker;

    @AfterEach
    void tearDown() {
        if (worker != null) {
            worker.close();
        }
        queue.close();
    }

    // ── Builder validation ──────────────────────────────────────────

    @Test
    void builderRequiresQueueAndRegistry() {
        assertThrows(NullPointerException.class, () ->
                HealingWorker.builder().processorRegistry(new DefaultProcessorRegistry()).build());
        assertThrows(NullPointerException.class, () -> HealingWorker.builder().queue(queue).build());
    }

    @Test
    void builderRejectsInvalidSettings() {
        assertThrows(IllegalArgumentException.class, () -> builder(new DefaultProcessorRegistry()).concurrency(0).build());
        assertThrows(IllegalArgumentException.class, () -> builder(new DefaultProcessorRegistry()).drainDelayMs(0).build());
        assertThrows(IllegalArgumentException.class, () -> builder(new DefaultProcessorRegistry()).stalledIntervalMs(0).build());
        assertThrows(IllegalArgumentException.class, () -> builder(new DefaultProcessorRegistry()).maxStalledCount(-1).build());
    }

    // ── Processing ──────────────────────────────────────────────────

    @Test
    void successfulJobCompletes() throws Exception {
        List<String> processedRuns = new CopyOnWriteArrayList<>();
        worker = builder(new DefaultProcessorRegistry().register(JOB, p -> processedRuns.add(p.runId()))).build();
        OutcomeLatch outcomes = OutcomeLatch.on(queue, 1);

        queue.add(JOB, Map.of("runId", "run-42"), new JobOptions("run-42:attempt:1", 1, 0,
                Retention.removeImmediately(), Retention.keep()));
        assertEquals(1, worker.poll());

        assertTrue(outcomes.await());
        assertEquals(List.of("completed:run-42:attempt:1"), outcomes.calls);
        assertEquals(List.of("run-42"), processedRuns);
        assertTrue(queue.find("run-42:attempt:1").isEmpty());
        assertTrue(deadLetters.isEmpty());
    }

    @Test
    void failingJobFailsOnceAndIsDeadLettered() throws Exception {
        worker = builder(new DefaultProcessorRegistry().register(JOB, p -> {
            throw new IllegalStateException("tests still red");
        })).build();
        OutcomeLatch outcomes = OutcomeLatch.on(queue, 1);

        queue.add(JOB, Map.of("runId", "run-42"), JobOptions.defaults("run-42:attempt:1"));
        worker.poll();

        assertTrue(outcomes.await());
        assertEquals(List.of("failed:run-42:attempt:1:tests still red"), outcomes.calls);
        QueuedJob failed = queue.find("run-42:attempt:1").orElseThrow();
        assertEquals(JobState.FAILED, failed.state());
        assertEquals(1, failed.attemptsMade());

        DeadLetterRecord record = awaitDeadLetter();
        assertEquals("ci-healing", record.originalQueueName());
        assertEquals("run-42:attempt:1", record.originalJobId());
        assertEquals(JOB, record.originalJobName());
        assertEquals("{\"runId\":\"run-42\"}", record.originalJobData());
        assertEquals("tests still red", record.failedReason());
        assertTrue(record.stacktrace().contains("IllegalStateException"));
        assertEquals(T0, record.timestamp());
    }

    @Test
    void failureWithoutMessageUsesDefaultReasonForDeadLetter() throws Exception {
        worker = builder(new DefaultProcessorRegistry().register(JOB, p -> {
            throw new RuntimeException();
        })).build();
        OutcomeLatch outcomes = OutcomeLatch.on(queue, 1);

        queue.add(JOB, Map.of("runId", "r"), JobOptions.defaults("r:attempt:1"));
        worker.poll();

        assertTrue(outcomes.await());
        assertEquals(List.of("failed:r:attempt:1:null"), outcomes.calls);
        assertEquals(HealingWorker.UNKNOWN_FAILURE, awaitDeadLetter().failedReason());
    }

    @Test
    void unknownJobNameFails() throws Exception {
        worker = builder(new DefaultProcessorRegistry().register(JOB, p -> { })).build();
        OutcomeLatch outcomes = OutcomeLatch.on(queue, 1);

        queue.add("mystery", Map.of("runId", "r"), new JobOptions("m", 3, 0, null, null));
        worker.poll();

        assertTrue(outcomes.await());
        assertEquals(List.of("failed:m:Unknown CI healing job name: mystery"), outcomes.calls);
        assertEquals(1, queue.find("m").orElseThrow().attemptsMade());
    }

    @Test
    void jobWithAttemptsLeftIsRetriedWithoutEvent() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        CountDownLatch twice = new CountDownLatch(2);
        worker = builder(new DefaultProcessorRegistry().register(JOB, p -> {
            twice.countDown();
            if (calls.incrementAndGet() == 1) {
                throw new IllegalStateException("flaky");
            }
        })).build();
        OutcomeLatch outcomes = OutcomeLatch.on(queue, 1);

        queue.add(JOB, Map.of("runId", "r"), new JobOptions("r:attempt:1", 2, 0, null, null));
        worker.poll();
        awaitState("r:attempt:1", JobState.WAITING);
        assertTrue(outcomes.calls.isEmpty());

        worker.poll();
        assertTrue(twice.await(5, TimeUnit.SECONDS));
        assertTrue(outcomes.await());
        assertEquals(List.of("completed:r:attempt:1"), outcomes.calls);
        assertEquals(2, queue.find("r:attempt:1").orElseThrow().attemptsMade());
    }

    @Test
    void neverRunsMoreThanConcurrencyJobs() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch started = new CountDownLatch(2);
        worker = builder(new DefaultProcessorRegistry().register(JOB, p -> {
            started.countDown();
            release.await(5, TimeUnit.SECONDS);
        })).concurrency(2).build();

        for (int i = 0; i < 5; i++) {
            queue.add(JOB, Map.of("runId", "r" + i), JobOptions.defaults("r" + i));
        }
        assertEquals(2, worker.poll());
        assertTrue(started.await(5, TimeUnit.SECONDS));
        assertEquals(0, worker.poll());
        assertEquals(2, worker.activeCount());
        assertEquals(3, queue.counts().get(JobState.WAITING));

        release.countDown();
    }

    @Test
    void startedWorkerDrainsQueue() throws Exception {
        worker = builder(new DefaultProcessorRegistry().register(JOB, p -> { })).drainDelayMs(20).build();
        OutcomeLatch outcomes = OutcomeLatch.on(queue, 4);
        for (int i = 0; i < 4; i++) {
            queue.add(JOB, Map.of("runId", "r" + i), JobOptions.defaults("r" + i));
        }

        worker.start();

        assertTrue(outcomes.await());
        assertEquals(4, queue.counts().get(JobState.COMPLETED));
    }

    // ── Stalled jobs ────────────────────────────────────────────────

    @Test
    void stalledJobIsRequeued() {
        worker = builder(new DefaultProcessorRegistry().register(JOB, p -> { })).build();
        queue.add(JOB, Map.of("runId", "r"), JobOptions.defaults("r:attempt:1"));
        queue.claim("dead-worker", 1);

        clock.advance(Duration.ofMinutes(6));
        worker.checkStalled();

        QueuedJob job = queue.find("r:attempt:1").orElseThrow();
        assertEquals(JobState.WAITING, job.state());
        assertEquals(1, job.stalledCount());
        assertNull(job.lockedBy());
    }

    @Test
    void freshLockIsNotStalled() {
        worker = builder(new DefaultProcessorRegistry().register(JOB, p -> { })).build();
        queue.add(JOB, Map.of("runId", "r"), JobOptions.defaults("r:attempt:1"));
        queue.claim("other-worker", 1);

        clock.advance(Duration.ofMinutes(4));
        worker.checkStalled();

        assertEquals(JobState.ACTIVE, queue.find("r:attempt:1").orElseThrow().state());
    }

    @Test
    void jobStalledTooOftenFails() throws Exception {
        worker = builder(new DefaultProcessorRegistry().register(JOB, p -> { })).build();
        OutcomeLatch outcomes = OutcomeLatch.on(queue, 1);
        queue.add(JOB, Map.of("runId", "r"), JobOptions.defaults("r:attempt:1"));

        for (int stall = 0; stall < 3; stall++) {
            assertEquals(1, queue.claim("dead-worker-" + stall, 1).size());
            clock.advance(Duration.ofMinutes(6));
            worker.checkStalled();
        }

        assertTrue(outcomes.await());
        assertEquals(List.of("failed:r:attempt:1:" + HealingWorker.STALLED_REASON), outcomes.calls);
        QueuedJob job = queue.find("r:attempt:1").orElseThrow();
        assertEquals(JobState.FAILED, job.state());
        assertEquals(2, job.stalledCount());

        DeadLetterRecord record = awaitDeadLetter();
        assertEquals(HealingWorker.STALLED_REASON, record.failedReason());
        assertNull(record.stacktrace());
    }

    @Test
    void runningJobsKeepTheirLock() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch started = new CountDownLatch(1);
        worker = builder(new DefaultProcessorRegistry().register(JOB, p -> {
            started.countDown();
            release.await(5, TimeUnit.SECONDS);
        })).build();
        queue.add(JOB, Map.of("runId", "r"), JobOptions.defaults("r:attempt:1"));
        worker.poll();
        assertTrue(started.await(5, TimeUnit.SECONDS));

        clock.advance(Duration.ofMinutes(6));
        worker.checkStalled();

        QueuedJob job = queue.find("r:attempt:1").orElseThrow();
        assertEquals(JobState.ACTIVE, job.state());
        assertEquals(0, job.stalledCount());
        assertEquals(clock.instant(), job.lockedAt());
        release.countDown();
    }

    @Test
    void lateRenewalDoesNotLetPeerRequeueRunningJob() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch started = new CountDownLatch(1);
        worker = builder(new DefaultProcessorRegistry().register(JOB, p -> {
            started.countDown();
            release.await(5, TimeUnit.SECONDS);
        })).ownerId("worker-a").build();
        HealingWorker peer = builder(new DefaultProcessorRegistry().register(JOB, p -> { }))
                .ownerId("worker-b").build();
        try {
            queue.add(JOB, Map.of("runId", "r"), JobOptions.defaults("r:attempt:1"));
            worker.poll();
            assertTrue(started.await(5, TimeUnit.SECONDS));

            clock.advance(Duration.ofMillis(150_000));
            worker.renewLocks();
            clock.advance(Duration.ofMillis(150_001));
            peer.checkStalled();

            QueuedJob job = queue.find("r:attempt:1").orElseThrow();
            assertEquals(JobState.ACTIVE, job.state());
            assertEquals("worker-a", job.lockedBy());
            assertEquals(0, job.stalledCount());
        } finally {
            release.countDown();
            peer.close();
        }
    }

    @Test
    void deadLetterSinkFailureIsContained() throws Exception {
        worker = HealingWorker.builder()
                .queue(queue)
                .processorRegistry(new DefaultProcessorRegistry().register(JOB, p -> {
                    throw new IllegalStateException("boom");
                }))
                .deadLetterSink(record -> {
                    throw new IllegalStateException("dlq down");
                })
                .build();
        OutcomeLatch outcomes = OutcomeLatch.on(queue, 1);
        queue.add(JOB, Map.of("runId", "r"), JobOptions.defaults("k"));

        worker.poll();

        assertTrue(outcomes.await());
        assertEquals(JobState.FAILED, queue.find("k").orElseThrow().state());
    }

    // ── helpers ─────────────────────────────────────────────────────

    private HealingWorker.Builder builder(ProcessorRegistry registry) {
        return HealingWorker.builder()
                .queue(queue)
                .processorRegistry(registry)
                .deadLetterSink(deadLetters::add)
                .ownerId("test-worker")
                .drainTimeoutMs(1000);
    }

    private DeadLetterRecord awaitDeadLetter() throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (deadLetters.isEmpty() && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertNotNull(deadLetters.isEmpty() ? null : deadLetters.get(0), "no dead letter recorded");
        return deadLetters.get(0);
    }

    private void awaitState(String jobId, JobState state) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (System.currentTimeMillis() < deadline) {
            if (queue.find(jobId).map(QueuedJob::state).orElse(null) == state) {
                return;
            }
            Thread.sleep(10);
        }
        throw new AssertionError("job " + jobId + " never reached " + state);
    }

    static final class OutcomeLatch implements QueueEventListener {
        final List<String> calls = new CopyOnWriteArrayList<>();
        final CountDownLatch latch;

        private OutcomeLatch(int expected) {
            this.latch = new CountDownLatch(expected);
        }

        static OutcomeLatch on(HealingQueue queue, int expected) {
            OutcomeLatch listener = new OutcomeLatch(expected);
            queue.subscribe(listener);
            return listener;
        }

        boolean await() throws InterruptedException {
            return latch.await(5, TimeUnit.SECONDS);
        }

        @Override
        public void onCompleted(String jobId) {
            calls.add("completed:" + jobId);
            latch.countDown();
        }

        @Override
        public void onFailed(String jobId, String reason) {
            calls.add("failed:" + jobId + ":" + reason);
            latch.countDown();
        }
    }
}
