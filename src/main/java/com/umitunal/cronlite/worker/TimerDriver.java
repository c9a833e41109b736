package com.umitunal.cronlite.worker;

import com.umitunal.cronlite.admin.JobChangeListener;
import com.umitunal.cronlite.core.JobStore;
import com.umitunal.cronlite.core.StoreUnavailableException;
import com.umitunal.cronlite.lease.Lease;
import com.umitunal.cronlite.lease.LeaseManager;
import com.umitunal.cronlite.model.JobRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Driver for a single always-on worker: one delayed callback per enabled job, armed at its
 * {@code nextRunAt}.
 * <p>
 * The timers are only a cache of the store. When one fires the job is re-read, claimed and
 * run if it is still due, and the timer is re-armed from whatever the store says afterwards.
 * The timer thread never runs handlers or touches the store; it only hands each firing to a
 * thread of its own from the execution pool, so one slow job cannot hold back another's timer.
 */
public class TimerDriver extends AbstractTriggerDriver implements JobChangeListener {
    private static final Logger log = LoggerFactory.getLogger(TimerDriver.class);

    // Pause before re-arming a job whose claim was lost, so contention cannot spin
    private static final Duration LOST_CLAIM_PAUSE = Duration.ofSeconds(1);

    private final ScheduledExecutorService timer;
    private final Map<String, ScheduledFuture<?>> timers = new ConcurrentHashMap<>();
    private final Duration storeFailurePause;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public TimerDriver(JobStore store, LeaseManager leaseManager, ExecutionRunner runner,
                       ExecutorService executionPool, StoreRetry storeRetry, Clock clock,
                       Duration storeFailurePause) {
        super(store, leaseManager, runner, executionPool, storeRetry, clock);
        this.storeFailurePause = storeFailurePause;
        this.timer = Executors.newSingleThreadScheduledExecutor(new NamedThreadFactory("cronlite-timer", true));
    }

    /**
     * Arm a timer for every enabled job in the store.
     */
    @Override
    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        int armed = rearmAll();
        log.info("Timer driver started with {} armed jobs", armed);
    }

    @Override
    public TickSummary runOnceCycle() {
        TickSummary summary = runAll(dueJobs());
        if (running.get()) {
            rearmAll();
        }
        return summary;
    }

    /**
     * Re-read one job and re-arm (or drop) its timer.
     */
    public void reschedule(String jobId) {
        if (!running.get()) {
            return;
        }
        Optional<JobRecord> job = storeRetry.call("find", () -> store.find(jobId));
        if (job.isPresent()) {
            arm(job.get(), Duration.ZERO);
        } else {
            cancel(jobId);
        }
    }

    public void cancel(String jobId) {
        ScheduledFuture<?> existing = timers.remove(jobId);
        if (existing != null) {
            existing.cancel(false);
            log.debug("Timer for job {} cancelled", jobId);
        }
    }

    @Override
    public void jobChanged(JobRecord job) {
        if (running.get()) {
            arm(job, Duration.ZERO);
        }
    }

    @Override
    public void jobDeleted(String jobId) {
        cancel(jobId);
    }

    /**
     * Jobs with a pending timer.
     */
    public int armedCount() {
        return timers.size();
    }

    @Override
    public void close() {
        running.set(false);
        timer.shutdownNow();
        timers.values().forEach(f -> f.cancel(false));
        timers.clear();
        log.info("Timer driver stopped");
    }

    private int rearmAll() {
        int armed = 0;
        for (JobRecord job : storeRetry.call("list", store::list)) {
            if (arm(job, Duration.ZERO)) {
                armed++;
            }
        }
        return armed;
    }

    /**
     * @return true if a timer is now pending for the job
     */
    private boolean arm(JobRecord job, Duration minimumDelay) {
        String jobId = job.getId();
        if (!job.isEnabled() || job.getNextRunAt() == null) {
            cancel(jobId);
            return false;
        }

        Instant now = clock.instant();
        Instant fireAt = job.getNextRunAt();
        // A leased job cannot be claimed before its lease lapses
        if (job.hasActiveLease(now) && job.getLeaseUntil().isAfter(fireAt)) {
            fireAt = job.getLeaseUntil();
        }
        long delayMs = Math.max(minimumDelay.toMillis(), Duration.between(now, fireAt).toMillis());

        try {
            ScheduledFuture<?> next = timer.schedule(() -> fire(jobId), Math.max(0, delayMs), TimeUnit.MILLISECONDS);
            ScheduledFuture<?> previous = timers.put(jobId, next);
            if (previous != null) {
                previous.cancel(false);
            }
            log.debug("Job {} armed to fire in {}ms", jobId, delayMs);
            return true;
        } catch (RejectedExecutionException e) {
            // Timer already shut down
            return false;
        }
    }

    private void fire(String jobId) {
        if (!running.get()) {
            return;
        }
        try {
            executionPool.execute(() -> runTimer(jobId));
        } catch (RejectedExecutionException e) {
            log.warn("Execution pool rejected job {}; retrying in {}", jobId, storeFailurePause);
            retryLater(jobId);
        }
    }

    private void runTimer(String jobId) {
        try {
            Optional<JobRecord> job = store.find(jobId);
            if (!job.isPresent()) {
                cancel(jobId);
                return;
            }

            Duration pause = Duration.ZERO;
            if (job.get().isDue(clock.instant())) {
                // Already on a run thread of its own, so the run happens right here
                Optional<Lease> lease = claim(job.get());
                if (lease.isPresent()) {
                    runner.execute(job.get(), lease.get());
                } else {
                    pause = LOST_CLAIM_PAUSE;
                }
            }

            Optional<JobRecord> after = store.find(jobId);
            if (after.isPresent() && running.get()) {
                arm(after.get(), pause);
            } else {
                cancel(jobId);
            }
        } catch (StoreUnavailableException e) {
            log.error("Store unavailable while running timer for job {}; retrying in {}", jobId, storeFailurePause, e);
            retryLater(jobId);
        }
    }

    private void retryLater(String jobId) {
        if (!running.get()) {
            return;
        }
        try {
            ScheduledFuture<?> next = timer.schedule(() -> fire(jobId),
                    storeFailurePause.toMillis(), TimeUnit.MILLISECONDS);
            ScheduledFuture<?> previous = timers.put(jobId, next);
            if (previous != null) {
                previous.cancel(false);
            }
        } catch (RejectedExecutionException e) {
            log.debug("Timer shut down; job {} not re-armed", jobId);
        }
    }
}
