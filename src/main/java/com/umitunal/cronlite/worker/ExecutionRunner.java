package com.umitunal.cronlite.worker;

import com.umitunal.cronlite.config.EngineConfig;
import com.umitunal.cronlite.core.ExecutionRecord;
import com.umitunal.cronlite.core.Job;
import com.umitunal.cronlite.core.JobMutation;
import com.umitunal.cronlite.core.JobResult;
import com.umitunal.cronlite.core.JobStore;
import com.umitunal.cronlite.core.NoHandlerException;
import com.umitunal.cronlite.core.StoreUnavailableException;
import com.umitunal.cronlite.delivery.DeliveryException;
import com.umitunal.cronlite.delivery.DeliveryRouter;
import com.umitunal.cronlite.lease.Lease;
import com.umitunal.cronlite.lease.LeaseManager;
import com.umitunal.cronlite.model.JobRecord;
import com.umitunal.cronlite.schedule.ScheduleCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs one claimed job to completion: handler, deadline, delivery, then a single atomic
 * write of the execution record, the job summary and the lease release.
 * <p>
 * Nothing a handler does escapes this class. Failures are classified, recorded and either
 * retried with exponential backoff or rolled over to the next scheduled occurrence.
 */
public class ExecutionRunner implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ExecutionRunner.class);

    private static final long WAIT_SLICE_NANOS = TimeUnit.MILLISECONDS.toNanos(100);

    private final HandlerRegistry handlers;
    private final LeaseManager leaseManager;
    private final JobStore store;
    private final ScheduleCalculator calculator;
    private final DeliveryRouter deliveryRouter;
    private final EngineConfig config;
    private final Clock clock;
    private final StoreRetry storeRetry;
    private final ExecutorService handlerPool;

    public ExecutionRunner(HandlerRegistry handlers, LeaseManager leaseManager, JobStore store,
                           ScheduleCalculator calculator, DeliveryRouter deliveryRouter,
                           EngineConfig config, Clock clock) {
        this.handlers = handlers;
        this.leaseManager = leaseManager;
        this.store = store;
        this.calculator = calculator;
        this.deliveryRouter = deliveryRouter;
        this.config = config;
        this.clock = clock;
        this.storeRetry = new StoreRetry(config.getStoreRetryAttempts(), config.getStoreRetryBackoff());
        // Handlers get their own threads so a stuck one can be abandoned at its deadline
        this.handlerPool = Executors.newCachedThreadPool(new NamedThreadFactory("cronlite-handler", true));
    }

    /**
     * Execute {@code job} under {@code lease}. The job must be the snapshot the lease was
     * claimed against.
     *
     * @return the record written for this attempt
     */
    public ExecutionRecord execute(JobRecord job, Lease lease) {
        Instant startedAt = clock.instant();
        int attempt = job.getCurrentAttempt() + 1;
        String kind = job.getPayload().getKind();
        AttemptState state = AttemptState.CLAIMED;

        ExecutionRecord.Outcome outcome;
        String error = null;
        boolean retryable = true;

        Optional<JobHandler> handler = handlers.find(kind);
        if (!handler.isPresent()) {
            NoHandlerException e = new NoHandlerException(kind);
            log.error("Configuration error: job {} cannot run: {}", job.getId(), e.getMessage());
            outcome = ExecutionRecord.Outcome.FAILURE;
            error = e.getMessage();
            retryable = false;
            state = AttemptState.FAILED;
        } else {
            state = AttemptState.RUNNING;
            Duration timeout = config.getExecutionTimeout();
            ExecutionContext context = new ExecutionContext(job, attempt, lease, leaseManager, startedAt, timeout);
            log.debug("Job {} attempt {} is {}", job.getId(), attempt, state);

            JobResult result = null;
            Future<JobResult> future = null;
            try {
                future = handlerPool.submit(() -> handler.get().handle(context));
                result = await(future, context);
                if (result == null) {
                    result = JobResult.success();
                }
                if (result.isSuccess()) {
                    state = AttemptState.SUCCEEDED;
                } else {
                    state = AttemptState.FAILED;
                    error = "handler reported failure: " + result.getMessage();
                }
            } catch (TimeoutException e) {
                context.cancel();
                future.cancel(true);
                state = AttemptState.TIMED_OUT;
                error = "timed out after " + context.allowedMillis() + "ms";
            } catch (ExecutionException e) {
                state = AttemptState.FAILED;
                error = describe(e.getCause());
            } catch (RejectedExecutionException e) {
                state = AttemptState.FAILED;
                error = "handler pool is shut down";
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                context.cancel();
                future.cancel(true);
                state = AttemptState.FAILED;
                error = "interrupted while waiting for handler";
            }

            if (state == AttemptState.SUCCEEDED) {
                try {
                    deliveryRouter.route(job, result);
                } catch (DeliveryException e) {
                    state = AttemptState.FAILED;
                    error = e.getMessage();
                }
            }

            outcome = switch (state) {
                case SUCCEEDED -> ExecutionRecord.Outcome.SUCCESS;
                case TIMED_OUT -> ExecutionRecord.Outcome.TIMEOUT;
                default -> ExecutionRecord.Outcome.FAILURE;
            };
        }

        Instant finishedAt = clock.instant();
        ExecutionRecord record = new ExecutionRecord(job.getId(), attempt, startedAt,
                Duration.between(startedAt, finishedAt), outcome, error, lease.getHolder());

        AtomicBoolean disabled = new AtomicBoolean(false);
        JobMutation mutation = outcome == ExecutionRecord.Outcome.SUCCESS
                ? onSuccess(startedAt, finishedAt)
                : onFailure(attempt, retryable, record.getErrorSummary(), startedAt, finishedAt, disabled);

        boolean applied;
        try {
            applied = storeRetry.call("complete", () -> store.complete(job.getId(), lease.getHolder(), mutation, record));
        } catch (StoreUnavailableException e) {
            // The lease will lapse and the job will run again
            log.error("Could not record attempt {} of job {}: {}", attempt, job.getId(), e.getMessage());
            return record;
        }

        if (!applied) {
            log.warn("Lease on job {} was lost during attempt {}; run recorded, job state left to the new holder",
                    job.getId(), attempt);
        } else if (disabled.get()) {
            log.error("Job {} disabled after {} consecutive failures; last error: {}",
                    job.getId(), config.getAutoDisableThreshold(), record.getErrorSummary());
        }

        if (outcome == ExecutionRecord.Outcome.SUCCESS) {
            log.info("Job {} attempt {} succeeded in {}ms", job.getId(), attempt, record.getDuration().toMillis());
        } else {
            log.warn("Job {} attempt {}/{} ended with {}: {}", job.getId(), attempt, config.getMaxAttempts(),
                    outcome, record.getErrorSummary());
        }
        return record;
    }

    /**
     * Wait for the handler until the context's deadline, which a lease renewal may push out
     * while we wait.
     */
    private static JobResult await(Future<JobResult> future, ExecutionContext context)
            throws ExecutionException, InterruptedException, TimeoutException {
        while (true) {
            long remaining = context.remainingNanos();
            if (remaining <= 0) {
                throw new TimeoutException();
            }
            try {
                return future.get(Math.min(remaining, WAIT_SLICE_NANOS), TimeUnit.NANOSECONDS);
            } catch (TimeoutException e) {
                // re-read the deadline
            }
        }
    }

    /**
     * Delay before retry number {@code attempt}: {@code min(max, base * 2^attempt)}.
     */
    Duration retryDelay(int attempt) {
        Duration max = config.getRetryMaxDelay();
        if (attempt >= 31) {
            return max;
        }
        Duration delay = config.getRetryBaseDelay().multipliedBy(1L << attempt);
        return delay.compareTo(max) > 0 ? max : delay;
    }

    private JobMutation onSuccess(Instant startedAt, Instant finishedAt) {
        return current -> {
            current.setLastRunAt(startedAt);
            current.setLastRunStatus(Job.RunStatus.SUCCESS);
            current.setLastError(null);
            current.setConsecutiveFailures(0);
            current.setCurrentAttempt(0);
            current.setNextRunAt(current.isEnabled()
                    ? calculator.nextRunAt(current.getSchedule(), finishedAt).orElse(null)
                    : null);
            current.setUpdatedAt(finishedAt);
        };
    }

    private JobMutation onFailure(int attempt, boolean retryable, String error,
                                  Instant startedAt, Instant finishedAt, AtomicBoolean disabled) {
        return current -> {
            current.setLastRunAt(startedAt);
            current.setLastRunStatus(Job.RunStatus.ERROR);
            current.setLastError(error);
            current.setConsecutiveFailures(current.getConsecutiveFailures() + 1);
            current.setUpdatedAt(finishedAt);

            if (retryable && attempt < config.getMaxAttempts()) {
                current.setCurrentAttempt(attempt);
                current.setNextRunAt(finishedAt.plus(retryDelay(attempt)));
            } else {
                current.setCurrentAttempt(0);
                current.setNextRunAt(calculator.nextRunAt(current.getSchedule(), finishedAt).orElse(null));

                int threshold = config.getAutoDisableThreshold();
                if (threshold > 0 && current.getConsecutiveFailures() >= threshold) {
                    current.setEnabled(false);
                    disabled.set(true);
                }
            }

            if (!current.isEnabled()) {
                current.setNextRunAt(null);
            }
        };
    }

    private static String describe(Throwable t) {
        if (t == null) {
            return "unknown error";
        }
        String message = t.getMessage();
        return message == null ? t.getClass().getName() : t.getClass().getSimpleName() + ": " + message;
    }

    @Override
    public void close() {
        handlerPool.shutdownNow();
    }
}
