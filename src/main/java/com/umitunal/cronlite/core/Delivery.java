package com.umitunal.cronlite.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Where the result of a successful run goes.
 */
public final class Delivery {
    private final Mode mode;
    private final String target;
    private final boolean bestEffort;

    @JsonCreator
    public Delivery(@JsonProperty("mode") Mode mode,
                    @JsonProperty("target") String target,
                    @JsonProperty("bestEffort") boolean bestEffort) {
        this.mode = mode == null ? Mode.SILENT : mode;
        this.target = target;
        this.bestEffort = bestEffort;
    }

    public static Delivery silent() {
        return new Delivery(Mode.SILENT, null, true);
    }

    public static Delivery announce(String target, boolean bestEffort) {
        return new Delivery(Mode.ANNOUNCE, target, bestEffort);
    }

    public Mode getMode() { return mode; }
    public String getTarget() { return target; }
    public boolean isBestEffort() { return bestEffort; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Delivery)) return false;
        Delivery that = (Delivery) o;
        return bestEffort == that.bestEffort && mode == that.mode && Objects.equals(target, that.target);
    }

    @Override
    public int hashCode() {
        return Objects.hash(mode, target, bestEffort);
    }

    @Override
    public String toString() {
        return "Delivery{mode=" + mode + ", target='" + target + "', bestEffort=" + bestEffort + '}';
    }

    public enum Mode {
        ANNOUNCE,
        SILENT
    }
}
