package com.umitunal.cronlite.schedule;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Fires every {@code period}, on the grid {@code anchor + k * period}.
 */
public final class IntervalSchedule implements Schedule {
    private final Duration period;
    private final Instant anchor;

    @JsonCreator
    public IntervalSchedule(@JsonProperty("period") Duration period,
                            @JsonProperty("anchor") Instant anchor) {
        this.period = Objects.requireNonNull(period, "period");
        this.anchor = Objects.requireNonNull(anchor, "anchor");
    }

    public static IntervalSchedule every(Duration period, Instant anchor) {
        return new IntervalSchedule(period, anchor);
    }

    public Duration getPeriod() {
        return period;
    }

    public Instant getAnchor() {
        return anchor;
    }

    @Override
    public Kind kind() {
        return Kind.INTERVAL;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IntervalSchedule)) return false;
        IntervalSchedule that = (IntervalSchedule) o;
        return period.equals(that.period) && anchor.equals(that.anchor);
    }

    @Override
    public int hashCode() {
        return Objects.hash(period, anchor);
    }

    @Override
    public String toString() {
        return "Interval{every " + period + " from " + anchor + '}';
    }
}
