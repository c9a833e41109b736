package com.umitunal.cronlite.admin;

import com.umitunal.cronlite.core.Delivery;
import com.umitunal.cronlite.core.JobPayload;
import com.umitunal.cronlite.schedule.Schedule;

import java.util.Objects;

/**
 * The user-editable part of a job.
 */
public class JobSpec {
    private final String name;
    private final boolean enabled;
    private final Schedule schedule;
    private final JobPayload payload;
    private final Delivery delivery;

    private JobSpec(Builder builder) {
        this.name = builder.name;
        this.enabled = builder.enabled;
        this.schedule = Objects.requireNonNull(builder.schedule, "schedule");
        this.payload = Objects.requireNonNull(builder.payload, "payload");
        this.delivery = builder.delivery;
    }

    public String getName() { return name; }
    public boolean isEnabled() { return enabled; }
    public Schedule getSchedule() { return schedule; }
    public JobPayload getPayload() { return payload; }
    public Delivery getDelivery() { return delivery; }

    public static Builder newBuilder(Schedule schedule, JobPayload payload) {
        return new Builder(schedule, payload);
    }

    public static class Builder {
        private final Schedule schedule;
        private final JobPayload payload;
        private String name;
        private boolean enabled = true;
        private Delivery delivery;

        private Builder(Schedule schedule, JobPayload payload) {
            this.schedule = schedule;
            this.payload = payload;
        }

        public Builder withName(String name) {
            this.name = name;
            return this;
        }

        /**
         * Default: true
         */
        public Builder withEnabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        /**
         * Default: none (silent)
         */
        public Builder withDelivery(Delivery delivery) {
            this.delivery = delivery;
            return this;
        }

        public JobSpec build() {
            return new JobSpec(this);
        }
    }
}
