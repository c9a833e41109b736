package com.umitunal.cronlite.schedule;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * When a job runs. One of {@link CronSchedule}, {@link IntervalSchedule} or {@link OnceSchedule}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = CronSchedule.class, name = "cron"),
        @JsonSubTypes.Type(value = IntervalSchedule.class, name = "interval"),
        @JsonSubTypes.Type(value = OnceSchedule.class, name = "once")
})
public interface Schedule {

    Kind kind();

    /**
     * Schedule variants. The ordinal is part of the RocksDB record format; append only.
     */
    enum Kind {
        CRON,
        INTERVAL,
        ONCE
    }
}
