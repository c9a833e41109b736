package com.umitunal.cronlite.model;

import com.umitunal.cronlite.core.Delivery;
import com.umitunal.cronlite.core.Job;
import com.umitunal.cronlite.core.JobPayload;
import com.umitunal.cronlite.schedule.CronSchedule;
import com.umitunal.cronlite.schedule.IntervalSchedule;
import com.umitunal.cronlite.schedule.OnceSchedule;
import com.umitunal.cronlite.schedule.Schedule;
import com.umitunal.cronlite.serialization.PayloadCodec;

import java.nio.ByteBuffer;
import java.time.Duration;
import java.time.Instant;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Compact serializer for JobRecord using ByteBuffer.
 *
 * Binary format (strings are length-prefixed UTF-8, length -1 for null;
 * instants are epoch seconds (8 bytes) + nanos (4 bytes), seconds = Long.MIN_VALUE for null):
 * - format version (1 byte)
 * - id, name (strings)
 * - enabled (1 byte)
 * - schedule kind ordinal (4 bytes), then
 *   CRON: expression, timezone (strings) |
 *   INTERVAL: period seconds (8) + nanos (4), anchor (instant) |
 *   ONCE: at (instant)
 * - payload length (4 bytes) + payload bytes (codec)
 * - delivery present (1 byte), then mode ordinal (4), target (string), bestEffort (1)
 * - createdAt, updatedAt, nextRunAt, lastRunAt (instants)
 * - lastRunStatus ordinal (4 bytes), lastError (string)
 * - consecutiveFailures (4 bytes), currentAttempt (4 bytes)
 * - leaseHolder (string), leaseUntil (instant)
 * - version (8 bytes)
 */
public class JobRecordSerializer {
    private static final byte FORMAT_VERSION = 1;
    private static final int INSTANT_SIZE = 12;

    private final PayloadCodec<JobPayload> payloadCodec;

    public JobRecordSerializer(PayloadCodec<JobPayload> payloadCodec) {
        this.payloadCodec = payloadCodec;
    }

    /**
     * Serialize a JobRecord to bytes for storage.
     *
     * @param job the record to serialize
     * @return byte array representation
     */
    public byte[] serialize(JobRecord job) {
        byte[] idBytes = bytes(job.getId());
        byte[] nameBytes = bytes(job.getName());
        byte[] payloadBytes = payloadCodec.encode(job.getPayload());
        byte[] errorBytes = bytes(job.getLastError());
        byte[] holderBytes = bytes(job.getLeaseHolder());

        Schedule schedule = job.getSchedule();
        byte[] cronExpression = null;
        byte[] cronZone = null;
        int scheduleSize = 4;
        switch (schedule.kind()) {
            case CRON -> {
                CronSchedule cron = (CronSchedule) schedule;
                cronExpression = bytes(cron.getExpression());
                cronZone = bytes(cron.getTimezone());
                scheduleSize += stringSize(cronExpression) + stringSize(cronZone);
            }
            case INTERVAL -> scheduleSize += 12 + INSTANT_SIZE;
            case ONCE -> scheduleSize += INSTANT_SIZE;
        }

        Delivery delivery = job.getDelivery();
        byte[] targetBytes = delivery == null ? null : bytes(delivery.getTarget());

        int totalSize = 1 +                                   // format version
                stringSize(idBytes) +                         // id
                stringSize(nameBytes) +                       // name
                1 +                                           // enabled
                scheduleSize +                                // schedule
                4 + payloadBytes.length +                     // payload
                1 + (delivery == null ? 0 : 4 + stringSize(targetBytes) + 1) + // delivery
                4 * INSTANT_SIZE +                            // created, updated, next, last run
                4 +                                           // lastRunStatus
                stringSize(errorBytes) +                      // lastError
                4 + 4 +                                       // failures, currentAttempt
                stringSize(holderBytes) +                     // leaseHolder
                INSTANT_SIZE +                                // leaseUntil
                8;                                            // version

        ByteBuffer buffer = ByteBuffer.allocate(totalSize);
        buffer.put(FORMAT_VERSION);

        putString(buffer, idBytes);
        putString(buffer, nameBytes);
        buffer.put((byte) (job.isEnabled() ? 1 : 0));

        // Write schedule
        buffer.putInt(schedule.kind().ordinal());
        switch (schedule.kind()) {
            case CRON -> {
                putString(buffer, cronExpression);
                putString(buffer, cronZone);
            }
            case INTERVAL -> {
                IntervalSchedule interval = (IntervalSchedule) schedule;
                buffer.putLong(interval.getPeriod().getSeconds());
                buffer.putInt(interval.getPeriod().getNano());
                putInstant(buffer, interval.getAnchor());
            }
            case ONCE -> putInstant(buffer, ((OnceSchedule) schedule).getAt());
        }

        // Write payload
        buffer.putInt(payloadBytes.length);
        buffer.put(payloadBytes);

        // Write delivery
        if (delivery == null) {
            buffer.put((byte) 0);
        } else {
            buffer.put((byte) 1);
            buffer.putInt(delivery.getMode().ordinal());
            putString(buffer, targetBytes);
            buffer.put((byte) (delivery.isBestEffort() ? 1 : 0));
        }

        // Write timestamps
        putInstant(buffer, job.getCreatedAt());
        putInstant(buffer, job.getUpdatedAt());
        putInstant(buffer, job.getNextRunAt());
        putInstant(buffer, job.getLastRunAt());

        // Write run summary
        buffer.putInt(job.getLastRunStatus().ordinal());
        putString(buffer, errorBytes);
        buffer.putInt(job.getConsecutiveFailures());
        buffer.putInt(job.getCurrentAttempt());

        // Write lease
        putString(buffer, holderBytes);
        putInstant(buffer, job.getLeaseUntil());

        buffer.putLong(job.getVersion());

        return buffer.array();
    }

    /**
     * Deserialize bytes to a JobRecord.
     *
     * @param bytes the byte array to deserialize
     * @return reconstructed record
     */
    public JobRecord deserialize(byte[] bytes) {
        ByteBuffer buffer = ByteBuffer.wrap(bytes);

        byte format = buffer.get();
        if (format != FORMAT_VERSION) {
            throw new IllegalStateException("Unsupported job record format: " + format);
        }

        JobRecord job = new JobRecord();
        job.setId(getString(buffer));
        job.setName(getString(buffer));
        job.setEnabled(buffer.get() == 1);

        // Read schedule
        Schedule.Kind kind = Schedule.Kind.values()[buffer.getInt()];
        switch (kind) {
            case CRON -> {
                String expression = getString(buffer);
                String timezone = getString(buffer);
                job.setSchedule(new CronSchedule(expression, timezone));
            }
            case INTERVAL -> {
                long seconds = buffer.getLong();
                int nanos = buffer.getInt();
                job.setSchedule(new IntervalSchedule(Duration.ofSeconds(seconds, nanos), getInstant(buffer)));
            }
            case ONCE -> job.setSchedule(new OnceSchedule(getInstant(buffer)));
        }

        // Read payload
        byte[] payloadBytes = new byte[buffer.getInt()];
        buffer.get(payloadBytes);
        job.setPayload(payloadCodec.decode(payloadBytes));

        // Read delivery
        if (buffer.get() == 1) {
            Delivery.Mode mode = Delivery.Mode.values()[buffer.getInt()];
            String target = getString(buffer);
            boolean bestEffort = buffer.get() == 1;
            job.setDelivery(new Delivery(mode, target, bestEffort));
        }

        // Read timestamps
        job.setCreatedAt(getInstant(buffer));
        job.setUpdatedAt(getInstant(buffer));
        job.setNextRunAt(getInstant(buffer));
        job.setLastRunAt(getInstant(buffer));

        // Read run summary
        job.setLastRunStatus(Job.RunStatus.values()[buffer.getInt()]);
        job.setLastError(getString(buffer));
        job.setConsecutiveFailures(buffer.getInt());
        job.setCurrentAttempt(buffer.getInt());

        // Read lease
        job.setLeaseHolder(getString(buffer));
        job.setLeaseUntil(getInstant(buffer));

        job.setVersion(buffer.getLong());
        return job;
    }

    private static byte[] bytes(String value) {
        return value == null ? null : value.getBytes(UTF_8);
    }

    private static int stringSize(byte[] value) {
        return 4 + (value == null ? 0 : value.length);
    }

    private static void putString(ByteBuffer buffer, byte[] value) {
        if (value == null) {
            buffer.putInt(-1);
        } else {
            buffer.putInt(value.length);
            buffer.put(value);
        }
    }

    private static String getString(ByteBuffer buffer) {
        int length = buffer.getInt();
        if (length < 0) {
            return null;
        }
        byte[] value = new byte[length];
        buffer.get(value);
        return new String(value, UTF_8);
    }

    private static void putInstant(ByteBuffer buffer, Instant instant) {
        if (instant == null) {
            buffer.putLong(Long.MIN_VALUE);
            buffer.putInt(0);
        } else {
            buffer.putLong(instant.getEpochSecond());
            buffer.putInt(instant.getNano());
        }
    }

    private static Instant getInstant(ByteBuffer buffer) {
        long seconds = buffer.getLong();
        int nanos = buffer.getInt();
        return seconds == Long.MIN_VALUE ? null : Instant.ofEpochSecond(seconds, nanos);
    }
}
