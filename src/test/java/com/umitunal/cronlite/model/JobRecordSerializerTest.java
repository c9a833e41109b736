package com.umitunal.cronlite.model;

import com.umitunal.cronlite.core.Delivery;
import com.umitunal.cronlite.core.Job;
import com.umitunal.cronlite.core.JobPayload;
import com.umitunal.cronlite.schedule.CronSchedule;
import com.umitunal.cronlite.schedule.IntervalSchedule;
import com.umitunal.cronlite.schedule.OnceSchedule;
import com.umitunal.cronlite.serialization.JsonCodec;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class JobRecordSerializerTest {
    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00.123456789Z");

    private final JobRecordSerializer serializer = new JobRecordSerializer(new JsonCodec<>(JobPayload.class));

    @Test
    @DisplayName("Should preserve every field of a leased cron job")
    void testFullRecord() {
        // Given
        JobRecord job = new JobRecord("report", CronSchedule.of("0 9 * * 1-5", "Europe/Istanbul"),
                JobPayload.of("report", Map.of("format", "pdf", "pages", 3)), NOW);
        job.setName("Daily report");
        job.setDelivery(Delivery.announce("ops-channel", false));
        job.setUpdatedAt(NOW.plusSeconds(5));
        job.setNextRunAt(NOW.plusSeconds(3600));
        job.setLastRunAt(NOW.minusSeconds(3600));
        job.setLastRunStatus(Job.RunStatus.ERROR);
        job.setLastError("IOException: şebeke erişilemez");
        job.setConsecutiveFailures(2);
        job.setCurrentAttempt(1);
        job.lease("worker-1/abc", NOW.plusSeconds(300));
        job.setVersion(17);

        // When
        JobRecord decoded = serializer.deserialize(serializer.serialize(job));

        // Then
        assertThat(decoded).usingRecursiveComparison().isEqualTo(job);
    }

    @Test
    @DisplayName("Should keep nulls distinct from empty values")
    void testNulls() {
        // Given
        JobRecord job = new JobRecord("once", OnceSchedule.at(NOW), JobPayload.of("noop"), NOW);
        job.setName("");

        // When
        JobRecord decoded = serializer.deserialize(serializer.serialize(job));

        // Then
        assertThat(decoded.getName()).isEmpty();
        assertThat(decoded.getDelivery()).isNull();
        assertThat(decoded.getNextRunAt()).isNull();
        assertThat(decoded.getLastError()).isNull();
        assertThat(decoded.getLeaseHolder()).isNull();
        assertThat(decoded.getLeaseUntil()).isNull();
        assertThat(decoded.getSchedule()).isEqualTo(OnceSchedule.at(NOW));
    }

    @Test
    @DisplayName("Should keep sub-second interval periods")
    void testIntervalPeriod() {
        // Given
        IntervalSchedule schedule = IntervalSchedule.every(Duration.ofMillis(1500), NOW);
        JobRecord job = new JobRecord("fast", schedule, JobPayload.of("noop"), NOW);

        // When
        JobRecord decoded = serializer.deserialize(serializer.serialize(job));

        // Then
        assertThat(decoded.getSchedule()).isEqualTo(schedule);
    }

    @Test
    @DisplayName("Should refuse records written in an unknown format")
    void testUnknownFormat() {
        // Given
        byte[] bytes = serializer.serialize(new JobRecord("x", OnceSchedule.at(NOW), JobPayload.of("noop"), NOW));
        bytes[0] = 99;

        // When / Then
        assertThatThrownBy(() -> serializer.deserialize(bytes))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("99");
    }
}
