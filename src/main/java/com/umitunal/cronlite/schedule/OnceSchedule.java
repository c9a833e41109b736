package com.umitunal.cronlite.schedule;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;

/**
 * Fires a single time at {@code at}, then never again.
 */
public final class OnceSchedule implements Schedule {
    private final Instant at;

    @JsonCreator
    public OnceSchedule(@JsonProperty("at") Instant at) {
        this.at = Objects.requireNonNull(at, "at");
    }

    public static OnceSchedule at(Instant at) {
        return new OnceSchedule(at);
    }

    public Instant getAt() {
        return at;
    }

    @Override
    public Kind kind() {
        return Kind.ONCE;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof OnceSchedule)) return false;
        return at.equals(((OnceSchedule) o).at);
    }

    @Override
    public int hashCode() {
        return at.hashCode();
    }

    @Override
    public String toString() {
        return "Once{" + at + '}';
    }
}
