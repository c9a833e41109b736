package com.umitunal.cronlite.storage;

import com.umitunal.cronlite.TestJobs;
import com.umitunal.cronlite.core.Delivery;
import com.umitunal.cronlite.core.ExecutionRecord;
import com.umitunal.cronlite.core.JobStore;
import com.umitunal.cronlite.core.StoreUnavailableException;
import com.umitunal.cronlite.model.JobRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

class FileJobStoreTest extends JobStoreContractTest {

    @Override
    protected JobStore openStore(Path directory) {
        return new FileJobStore(directory);
    }

    @Test
    @DisplayName("Should reload jobs, leases and history after reopening")
    void testReopen() {
        // Given
        JobRecord job = TestJobs.dueHourly("job-1", NOW);
        job.setDelivery(Delivery.announce("ops", true));
        store.create(job);
        store.tryClaim("job-1", "worker-a/1", LEASE, 1, NOW);
        store.create(TestJobs.dueHourly("job-2", NOW));
        ExecutionRecord record = new ExecutionRecord("job-2", 1, NOW, Duration.ofMillis(40),
                ExecutionRecord.Outcome.FAILURE, "IllegalStateException: boom", "worker-a/2");
        store.tryClaim("job-2", "worker-a/2", LEASE, 1, NOW);
        store.complete("job-2", "worker-a/2", j -> j.setConsecutiveFailures(1), record);
        store.close();

        // When
        store = openStore(tempDir);

        // Then
        JobRecord reloaded = store.get("job-1");
        assertThat(reloaded.getLeaseHolder()).isEqualTo("worker-a/1");
        assertThat(reloaded.getLeaseUntil()).isEqualTo(NOW.plus(LEASE));
        assertThat(reloaded.getDelivery()).isEqualTo(Delivery.announce("ops", true));
        assertThat(reloaded.getVersion()).isEqualTo(2);
        assertThat(store.get("job-2").getConsecutiveFailures()).isEqualTo(1);
        assertThat(store.history("job-2")).containsExactly(record);
        assertThat(store.getMetrics(NOW).getExecutionRecords()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should keep the job file free of temporary leftovers")
    void testAtomicReplace() throws Exception {
        // When
        store.create(TestJobs.dueHourly("job-1", NOW));
        store.update("job-1", 1, j -> j.setName("renamed"));

        // Then
        assertThat(tempDir.resolve(FileJobStore.JOBS_FILE)).exists();
        assertThat(tempDir.resolve(FileJobStore.JOBS_FILE + ".tmp")).doesNotExist();
        assertThat(Files.readString(tempDir.resolve(FileJobStore.JOBS_FILE))).contains("renamed");
    }

    @Test
    @DisplayName("Should write one history record when a completion is retried after a failed job write")
    void testCompleteRetryAfterJobWriteFailure() throws Exception {
        // Given: the temp file path is taken by a directory, so the job file cannot be replaced
        store.create(TestJobs.dueHourly("job-1", NOW));
        store.tryClaim("job-1", "worker-a/1", LEASE, 1, NOW);
        ExecutionRecord record = new ExecutionRecord("job-1", 1, NOW, Duration.ofMillis(20),
                ExecutionRecord.Outcome.SUCCESS, null, "worker-a/1");
        Path blocker = Files.createDirectory(tempDir.resolve(FileJobStore.JOBS_FILE + ".tmp"));

        // When
        assertThatThrownBy(() -> store.complete("job-1", "worker-a/1", j -> j.setName("done"), record))
                .isInstanceOf(StoreUnavailableException.class);

        // Then: nothing of the attempt is visible
        assertThat(store.history("job-1")).isEmpty();
        assertThat(store.get("job-1").getLeaseHolder()).isEqualTo("worker-a/1");

        // When: the same completion is retried once the disk recovers
        Files.delete(blocker);
        boolean applied = store.complete("job-1", "worker-a/1", j -> j.setName("done"), record);

        // Then
        assertThat(applied).isTrue();
        assertThat(store.history("job-1")).containsExactly(record);
        assertThat(store.get("job-1").getName()).isEqualTo("done");
        assertThat(store.get("job-1").getLeaseHolder()).isNull();
    }

    @Test
    @DisplayName("Should roll the job back when its history record cannot be appended")
    void testCompleteRollsBackOnAppendFailure() throws Exception {
        // Given: the history file path is taken by a directory
        store.create(TestJobs.dueHourly("job-1", NOW));
        store.tryClaim("job-1", "worker-a/1", LEASE, 1, NOW);
        ExecutionRecord record = new ExecutionRecord("job-1", 1, NOW, Duration.ofMillis(20),
                ExecutionRecord.Outcome.FAILURE, "boom", "worker-a/1");
        Path blocker = Files.createDirectory(tempDir.resolve(FileJobStore.EXECUTIONS_FILE));

        // When
        assertThatThrownBy(() -> store.complete("job-1", "worker-a/1", j -> j.setConsecutiveFailures(1), record))
                .isInstanceOf(StoreUnavailableException.class);

        // Then
        JobRecord unchanged = store.get("job-1");
        assertThat(unchanged.getConsecutiveFailures()).isZero();
        assertThat(unchanged.getLeaseHolder()).isEqualTo("worker-a/1");
        assertThat(unchanged.getVersion()).isEqualTo(2);

        // When
        Files.delete(blocker);
        assertThat(store.complete("job-1", "worker-a/1", j -> j.setConsecutiveFailures(1), record)).isTrue();

        // Then
        assertThat(store.history("job-1")).containsExactly(record);
        assertThat(store.get("job-1").getConsecutiveFailures()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should refuse work once closed")
    void testClosed() {
        // Given
        store.close();

        // When / Then
        assertThatThrownBy(() -> store.list()).isInstanceOf(StoreUnavailableException.class);
        assertThatThrownBy(() -> store.create(TestJobs.dueHourly("job-1", NOW)))
                .isInstanceOf(StoreUnavailableException.class);
    }
}
