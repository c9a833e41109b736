package com.umitunal.cronlite.schedule;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Objects;

/**
 * Standard five-field UNIX cron expression evaluated in a timezone.
 */
public final class CronSchedule implements Schedule {
    private final String expression;
    private final String timezone;

    @JsonCreator
    public CronSchedule(@JsonProperty("expression") String expression,
                        @JsonProperty("timezone") String timezone) {
        this.expression = Objects.requireNonNull(expression, "expression").trim();
        this.timezone = timezone == null || timezone.trim().isEmpty() ? "UTC" : timezone.trim();
    }

    public static CronSchedule of(String expression) {
        return new CronSchedule(expression, null);
    }

    public static CronSchedule of(String expression, String timezone) {
        return new CronSchedule(expression, timezone);
    }

    public String getExpression() {
        return expression;
    }

    public String getTimezone() {
        return timezone;
    }

    @JsonIgnore
    public ZoneId zone() {
        return "UTC".equals(timezone) ? ZoneOffset.UTC : ZoneId.of(timezone);
    }

    @Override
    public Kind kind() {
        return Kind.CRON;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CronSchedule)) return false;
        CronSchedule that = (CronSchedule) o;
        return expression.equals(that.expression) && timezone.equals(that.timezone);
    }

    @Override
    public int hashCode() {
        return Objects.hash(expression, timezone);
    }

    @Override
    public String toString() {
        return "Cron{'" + expression + "' " + timezone + '}';
    }
}
