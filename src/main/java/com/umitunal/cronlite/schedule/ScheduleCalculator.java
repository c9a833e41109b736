package com.umitunal.cronlite.schedule;

import com.cronutils.model.Cron;
import com.cronutils.model.CronType;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.model.time.ExecutionTime;
import com.cronutils.parser.CronParser;
import com.umitunal.cronlite.core.InvalidScheduleException;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Computes the next due instant of a schedule. Pure: the answer depends only on the
 * arguments, never on the wall clock.
 */
public class ScheduleCalculator {
    private static final CronParser PARSER =
            new CronParser(CronDefinitionBuilder.instanceDefinitionFor(CronType.UNIX));

    // Parsed expressions; parsing is the expensive part and the result is immutable.
    private final Map<String, ExecutionTime> cronCache = new ConcurrentHashMap<>();

    /**
     * First instant strictly after {@code now} at which the schedule fires.
     *
     * @return empty when the schedule has no future run (a fired or past one-shot)
     */
    public Optional<Instant> nextRunAt(Schedule schedule, Instant now) {
        return switch (schedule.kind()) {
            case ONCE -> nextOnce((OnceSchedule) schedule, now);
            case INTERVAL -> Optional.of(nextInterval((IntervalSchedule) schedule, now));
            case CRON -> nextCron((CronSchedule) schedule, now);
        };
    }

    /**
     * Run time for a job that was just created, re-enabled or re-scheduled. Same as
     * {@link #nextRunAt} except that a one-shot in the past is due immediately.
     */
    public Optional<Instant> initialRunAt(Schedule schedule, Instant now) {
        if (schedule.kind() == Schedule.Kind.ONCE) {
            return Optional.of(((OnceSchedule) schedule).getAt());
        }
        return nextRunAt(schedule, now);
    }

    /**
     * Rejects schedules that could never be evaluated.
     *
     * @throws InvalidScheduleException with the reason
     */
    public void validate(Schedule schedule) {
        if (schedule == null) {
            throw new InvalidScheduleException("Schedule must not be null");
        }
        switch (schedule.kind()) {
            case INTERVAL -> {
                Duration period = ((IntervalSchedule) schedule).getPeriod();
                if (period.isNegative() || period.toMillis() == 0) {
                    throw new InvalidScheduleException("Interval period must be at least 1ms: " + period);
                }
            }
            case CRON -> {
                CronSchedule cron = (CronSchedule) schedule;
                try {
                    cron.zone();
                } catch (DateTimeException e) {
                    throw new InvalidScheduleException("Unknown timezone: " + cron.getTimezone(), e);
                }
                executionTime(cron.getExpression());
            }
            case ONCE -> {
                // any instant is acceptable
            }
        }
    }

    private Optional<Instant> nextOnce(OnceSchedule schedule, Instant now) {
        Instant at = schedule.getAt();
        return at.isAfter(now) ? Optional.of(at) : Optional.empty();
    }

    private Instant nextInterval(IntervalSchedule schedule, Instant now) {
        Instant anchor = schedule.getAnchor();
        if (anchor.isAfter(now)) {
            return anchor;
        }
        long periodMs = schedule.getPeriod().toMillis();
        if (periodMs <= 0) {
            throw new InvalidScheduleException("Interval period must be at least 1ms");
        }
        // Only the next boundary, missed ticks are not replayed.
        long elapsed = Duration.between(anchor, now).toMillis();
        long k = elapsed / periodMs + 1;
        return anchor.plusMillis(k * periodMs);
    }

    private Optional<Instant> nextCron(CronSchedule schedule, Instant now) {
        ExecutionTime executionTime = executionTime(schedule.getExpression());
        ZoneId zone = schedule.zone();
        ZonedDateTime from = ZonedDateTime.ofInstant(now, zone);

        // cron-utils may answer with `from` itself when it lies on a boundary.
        for (int i = 0; i < 3; i++) {
            Optional<ZonedDateTime> next = executionTime.nextExecution(from);
            if (!next.isPresent()) {
                return Optional.empty();
            }
            Instant candidate = next.get().toInstant();
            if (candidate.isAfter(now)) {
                return Optional.of(candidate);
            }
            from = next.get().plusSeconds(1);
        }
        return Optional.empty();
    }

    private ExecutionTime executionTime(String expression) {
        return cronCache.computeIfAbsent(expression, expr -> {
            try {
                Cron cron = PARSER.parse(expr);
                cron.validate();
                return ExecutionTime.forCron(cron);
            } catch (IllegalArgumentException e) {
                throw new InvalidScheduleException("Invalid cron expression '" + expr + "': " + e.getMessage(), e);
            }
        });
    }
}
