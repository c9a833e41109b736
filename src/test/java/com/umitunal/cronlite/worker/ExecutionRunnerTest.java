package com.umitunal.cronlite.worker;

import com.umitunal.cronlite.MutableClock;
import com.umitunal.cronlite.TestJobs;
import com.umitunal.cronlite.config.EngineConfig;
import com.umitunal.cronlite.core.Delivery;
import com.umitunal.cronlite.core.ExecutionRecord;
import com.umitunal.cronlite.core.Job;
import com.umitunal.cronlite.core.JobPayload;
import com.umitunal.cronlite.core.JobResult;
import com.umitunal.cronlite.core.JobStore;
import com.umitunal.cronlite.delivery.DeliveryChannel;
import com.umitunal.cronlite.delivery.DeliveryRouter;
import com.umitunal.cronlite.lease.Lease;
import com.umitunal.cronlite.lease.LeaseManager;
import com.umitunal.cronlite.model.JobRecord;
import com.umitunal.cronlite.schedule.ScheduleCalculator;
import com.umitunal.cronlite.storage.FileJobStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.*;

class ExecutionRunnerTest {
    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");
    private static final Duration LEASE = Duration.ofMinutes(5);

    @TempDir
    Path tempDir;

    private JobStore store;
    private MutableClock clock;
    private HandlerRegistry handlers;
    private final List<String> delivered = new ArrayList<>();
    private DeliveryChannel channel;

    private LeaseManager leaseManager;
    private ExecutionRunner runner;

    @BeforeEach
    void setUp() {
        store = new FileJobStore(tempDir);
        clock = new MutableClock(NOW);
        handlers = new HandlerRegistry();
        channel = (target, job, result) -> delivered.add(target + ":" + result.getMessage());
        useConfig(baseConfig().build());
    }

    @AfterEach
    void tearDown() {
        runner.close();
        store.close();
    }

    private EngineConfig.Builder baseConfig() {
        return EngineConfig.newBuilder()
                .withWorkerId("worker-1")
                .withLeaseDuration(LEASE)
                .withMaxAttempts(3)
                .withRetryBackoff(Duration.ofSeconds(30), Duration.ofMinutes(15))
                .withStoreRetry(1, Duration.ZERO);
    }

    private void useConfig(EngineConfig config) {
        if (runner != null) {
            runner.close();
        }
        leaseManager = new LeaseManager(store, config.getWorkerId(), config.getLeaseDuration(), clock);
        runner = new ExecutionRunner(handlers, leaseManager, store, new ScheduleCalculator(),
                new DeliveryRouter((target, job, result) -> channel.deliver(target, job, result)), config, clock);
    }

    private ExecutionRecord runNow(String jobId) {
        JobRecord snapshot = store.get(jobId);
        Lease lease = leaseManager.claim(snapshot).orElseThrow();
        return runner.execute(snapshot, lease);
    }

    @Test
    @DisplayName("Should record a success and move to the next occurrence")
    void testSuccess() {
        // Given
        handlers.register(TestJobs.KIND, ctx -> JobResult.success("did " + ctx.getPayload().getParams().get("n")));
        store.create(TestJobs.dueHourly("job-1", NOW));

        // When
        ExecutionRecord record = runNow("job-1");

        // Then
        assertThat(record.getOutcome()).isEqualTo(ExecutionRecord.Outcome.SUCCESS);
        assertThat(record.getAttemptNumber()).isEqualTo(1);
        assertThat(record.getHolder()).startsWith("worker-1/");

        JobRecord job = store.get("job-1");
        assertThat(job.getLastRunStatus()).isEqualTo(Job.RunStatus.SUCCESS);
        assertThat(job.getLastRunAt()).isEqualTo(NOW);
        assertThat(job.getNextRunAt()).isEqualTo(NOW.plusSeconds(3600));
        assertThat(job.getConsecutiveFailures()).isZero();
        assertThat(job.getLeaseHolder()).isNull();
        assertThat(store.history("job-1")).containsExactly(record);
    }

    @Test
    @DisplayName("Should leave a fired one-shot with no next run")
    void testOnceCompletes() {
        // Given
        handlers.register(TestJobs.KIND, ctx -> JobResult.success());
        store.create(TestJobs.once("once", NOW.minusSeconds(5), NOW));

        // When
        runNow("once");

        // Then
        JobRecord job = store.get("once");
        assertThat(job.getNextRunAt()).isNull();
        assertThat(job.getLastRunStatus()).isEqualTo(Job.RunStatus.SUCCESS);
        assertThat(store.listDue(NOW.plusSeconds(3600))).isEmpty();
    }

    @Test
    @DisplayName("Should retry a throwing handler with exponential backoff, then roll over")
    void testRetryThenExhaust() {
        // Given
        handlers.register(TestJobs.KIND, ctx -> {
            throw new IllegalStateException("boom");
        });
        store.create(TestJobs.dueHourly("job-1", NOW));

        // When: first attempt
        ExecutionRecord first = runNow("job-1");

        // Then
        assertThat(first.getErrorSummary()).isEqualTo("IllegalStateException: boom");
        JobRecord afterFirst = store.get("job-1");
        assertThat(afterFirst.getCurrentAttempt()).isEqualTo(1);
        assertThat(afterFirst.getNextRunAt()).isEqualTo(NOW.plusSeconds(60));
        assertThat(afterFirst.getLastRunStatus()).isEqualTo(Job.RunStatus.ERROR);

        // When: second attempt
        clock.set(afterFirst.getNextRunAt());
        ExecutionRecord second = runNow("job-1");

        // Then
        assertThat(second.getAttemptNumber()).isEqualTo(2);
        assertThat(store.get("job-1").getNextRunAt()).isEqualTo(NOW.plusSeconds(60 + 120));

        // When: last attempt
        clock.set(store.get("job-1").getNextRunAt());
        ExecutionRecord third = runNow("job-1");

        // Then
        assertThat(third.getAttemptNumber()).isEqualTo(3);
        JobRecord exhausted = store.get("job-1");
        assertThat(exhausted.getCurrentAttempt()).isZero();
        assertThat(exhausted.getConsecutiveFailures()).isEqualTo(3);
        assertThat(exhausted.getNextRunAt()).isEqualTo(NOW.plusSeconds(3600));
        assertThat(exhausted.isEnabled()).isTrue();
        assertThat(store.history("job-1")).extracting(ExecutionRecord::getAttemptNumber).containsExactly(1, 2, 3);
    }

    @Test
    @DisplayName("Should treat a failure result like a thrown error")
    void testFailureResult() {
        // Given
        handlers.register(TestJobs.KIND, ctx -> JobResult.failure("quota exceeded"));
        store.create(TestJobs.dueHourly("job-1", NOW));

        // When
        ExecutionRecord record = runNow("job-1");

        // Then
        assertThat(record.getOutcome()).isEqualTo(ExecutionRecord.Outcome.FAILURE);
        assertThat(record.getErrorSummary()).isEqualTo("handler reported failure: quota exceeded");
        assertThat(store.get("job-1").getCurrentAttempt()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should not retry a job whose kind has no handler")
    void testNoHandler() {
        // Given
        JobRecord job = TestJobs.dueHourly("job-1", NOW);
        job.setPayload(JobPayload.of("unknown"));
        store.create(job);

        // When
        ExecutionRecord record = runNow("job-1");

        // Then
        assertThat(record.getOutcome()).isEqualTo(ExecutionRecord.Outcome.FAILURE);
        assertThat(record.getErrorSummary()).contains("No handler registered for job kind: unknown");
        JobRecord stored = store.get("job-1");
        assertThat(stored.getCurrentAttempt()).isZero();
        assertThat(stored.getNextRunAt()).isEqualTo(NOW.plusSeconds(3600));
        assertThat(stored.getLastError()).contains("unknown");
    }

    @Test
    @DisplayName("Should abandon a handler at its deadline and cancel its context")
    void testTimeout() {
        // Given
        useConfig(baseConfig().withExecutionTimeout(Duration.ofMillis(200)).build());
        AtomicReference<ExecutionContext> seen = new AtomicReference<>();
        handlers.register(TestJobs.KIND, ctx -> {
            seen.set(ctx);
            Thread.sleep(10_000);
            return JobResult.success();
        });
        store.create(TestJobs.dueHourly("job-1", NOW));

        // When
        ExecutionRecord record = runNow("job-1");

        // Then
        assertThat(record.getOutcome()).isEqualTo(ExecutionRecord.Outcome.TIMEOUT);
        assertThat(record.getErrorSummary()).isEqualTo("timed out after 200ms");
        assertThat(seen.get().isCancelled()).isTrue();
        assertThat(seen.get().getDeadline()).isEqualTo(NOW.plusMillis(200));
        assertThat(store.get("job-1").getCurrentAttempt()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should disable a job after the configured number of consecutive failures")
    void testAutoDisable() {
        // Given
        useConfig(baseConfig().withMaxAttempts(1).withAutoDisableThreshold(2).build());
        handlers.register(TestJobs.KIND, ctx -> JobResult.failure("down"));
        store.create(TestJobs.dueHourly("job-1", NOW));

        // When
        runNow("job-1");
        JobRecord afterOne = store.get("job-1");
        clock.set(afterOne.getNextRunAt());
        runNow("job-1");

        // Then
        assertThat(afterOne.isEnabled()).isTrue();
        JobRecord disabled = store.get("job-1");
        assertThat(disabled.isEnabled()).isFalse();
        assertThat(disabled.getNextRunAt()).isNull();
        assertThat(disabled.getConsecutiveFailures()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should record the run but leave the job to the new holder when the lease was lost")
    void testLostLease() {
        // Given
        LeaseManager rival = new LeaseManager(store, "worker-2", LEASE, clock);
        handlers.register(TestJobs.KIND, ctx -> {
            clock.advance(LEASE.plusSeconds(1));
            rival.claim(store.get(ctx.getJobId())).orElseThrow();
            return JobResult.success();
        });
        store.create(TestJobs.dueHourly("job-1", NOW));

        // When
        ExecutionRecord record = runNow("job-1");

        // Then
        assertThat(record.getOutcome()).isEqualTo(ExecutionRecord.Outcome.SUCCESS);
        JobRecord job = store.get("job-1");
        assertThat(job.getLastRunStatus()).isEqualTo(Job.RunStatus.NEVER);
        assertThat(job.getLeaseHolder()).startsWith("worker-2/");
        assertThat(store.history("job-1")).containsExactly(record);
    }

    @Test
    @DisplayName("Should cancel the context when a lease renewal fails")
    void testRenewalLost() {
        // Given
        AtomicReference<Boolean> renewed = new AtomicReference<>();
        AtomicReference<Boolean> cancelled = new AtomicReference<>();
        handlers.register(TestJobs.KIND, ctx -> {
            store.releaseLease(ctx.getJobId(), ctx.getHolder());
            store.tryClaim(ctx.getJobId(), "intruder/1", LEASE, store.get(ctx.getJobId()).getVersion(), clock.instant());
            renewed.set(ctx.renewLease());
            cancelled.set(ctx.isCancelled());
            return JobResult.success();
        });
        store.create(TestJobs.dueHourly("job-1", NOW));

        // When
        runNow("job-1");

        // Then
        assertThat(renewed.get()).isFalse();
        assertThat(cancelled.get()).isTrue();
    }

    @Test
    @DisplayName("Should keep waiting for a handler that renews its lease past the first window")
    void testRenewalExtendsDeadline() {
        // Given: no explicit timeout, so the first deadline is one lease away
        useConfig(baseConfig().withLeaseDuration(Duration.ofMillis(300)).build());
        List<Boolean> renewals = new ArrayList<>();
        handlers.register(TestJobs.KIND, ctx -> {
            for (int i = 0; i < 3; i++) {
                Thread.sleep(200);
                renewals.add(ctx.renewLease());
            }
            return JobResult.success("long run");
        });
        store.create(TestJobs.dueHourly("job-1", NOW));

        // When
        ExecutionRecord record = runNow("job-1");

        // Then
        assertThat(record.getOutcome()).isEqualTo(ExecutionRecord.Outcome.SUCCESS);
        assertThat(renewals).containsExactly(true, true, true);
        JobRecord job = store.get("job-1");
        assertThat(job.getLastRunStatus()).isEqualTo(Job.RunStatus.SUCCESS);
        assertThat(job.getLeaseHolder()).isNull();
    }

    @Test
    @DisplayName("Should clear the failure count when a retry finally succeeds")
    void testRetryThenSucceed() {
        // Given: fails on the first two attempts, succeeds on the third
        AtomicInteger calls = new AtomicInteger();
        handlers.register(TestJobs.KIND, ctx -> {
            if (calls.incrementAndGet() < 3) {
                throw new IllegalStateException("flaky " + calls.get());
            }
            return JobResult.success("third time");
        });
        store.create(TestJobs.dueHourly("job-1", NOW));

        // When
        runNow("job-1");
        clock.set(store.get("job-1").getNextRunAt());
        runNow("job-1");
        clock.set(store.get("job-1").getNextRunAt());
        ExecutionRecord last = runNow("job-1");

        // Then
        assertThat(last.getOutcome()).isEqualTo(ExecutionRecord.Outcome.SUCCESS);
        assertThat(last.getAttemptNumber()).isEqualTo(3);
        assertThat(store.history("job-1"))
                .extracting(ExecutionRecord::getOutcome)
                .containsExactly(ExecutionRecord.Outcome.FAILURE, ExecutionRecord.Outcome.FAILURE,
                        ExecutionRecord.Outcome.SUCCESS);
        JobRecord job = store.get("job-1");
        assertThat(job.getConsecutiveFailures()).isZero();
        assertThat(job.getCurrentAttempt()).isZero();
        assertThat(job.getLastError()).isNull();
        assertThat(job.getLastRunStatus()).isEqualTo(Job.RunStatus.SUCCESS);
    }

    @Test
    @DisplayName("Should fail the run when a required delivery fails")
    void testRequiredDeliveryFails() {
        // Given
        channel = (target, job, result) -> {
            throw new IOException("smtp down");
        };
        handlers.register(TestJobs.KIND, ctx -> JobResult.success("report ready"));
        JobRecord job = TestJobs.dueHourly("job-1", NOW);
        job.setDelivery(Delivery.announce("ops", false));
        store.create(job);

        // When
        ExecutionRecord record = runNow("job-1");

        // Then
        assertThat(record.getOutcome()).isEqualTo(ExecutionRecord.Outcome.FAILURE);
        assertThat(record.getErrorSummary()).isEqualTo("delivery failed: smtp down");
        assertThat(store.get("job-1").getCurrentAttempt()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should ignore a failed best-effort delivery and deliver otherwise")
    void testBestEffortDelivery() {
        // Given
        handlers.register(TestJobs.KIND, ctx -> JobResult.success("report ready"));
        JobRecord delivered1 = TestJobs.dueHourly("delivered", NOW);
        delivered1.setDelivery(Delivery.announce("ops", false));
        store.create(delivered1);
        JobRecord ignored = TestJobs.dueHourly("ignored", NOW);
        ignored.setDelivery(Delivery.announce("ops", true));
        store.create(ignored);

        // When
        ExecutionRecord ok = runNow("delivered");
        channel = (target, job, result) -> {
            throw new IOException("smtp down");
        };
        ExecutionRecord stillOk = runNow("ignored");

        // Then
        assertThat(ok.getOutcome()).isEqualTo(ExecutionRecord.Outcome.SUCCESS);
        assertThat(stillOk.getOutcome()).isEqualTo(ExecutionRecord.Outcome.SUCCESS);
        assertThat(delivered).containsExactly("ops:report ready");
    }

    @Test
    @DisplayName("Should double the retry delay up to the configured maximum")
    void testRetryDelay() {
        assertThat(runner.retryDelay(1)).isEqualTo(Duration.ofSeconds(60));
        assertThat(runner.retryDelay(2)).isEqualTo(Duration.ofSeconds(120));
        assertThat(runner.retryDelay(4)).isEqualTo(Duration.ofSeconds(480));
        assertThat(runner.retryDelay(5)).isEqualTo(Duration.ofMinutes(15));
        assertThat(runner.retryDelay(40)).isEqualTo(Duration.ofMinutes(15));
    }
}
