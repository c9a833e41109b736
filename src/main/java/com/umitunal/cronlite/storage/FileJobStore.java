package com.umitunal.cronlite.storage;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.umitunal.cronlite.core.ExecutionRecord;
import com.umitunal.cronlite.core.StoreUnavailableException;
import com.umitunal.cronlite.model.JobRecord;
import com.umitunal.cronlite.serialization.JsonCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Single-writer store kept in memory and mirrored to {@code jobs.json} plus an
 * append-only {@code executions.jsonl}.
 * <p>
 * The process-local lock stands in for a transaction. Only one process may own the
 * directory; two processes sharing it will overwrite each other's leases.
 */
public class FileJobStore extends AbstractJobStore {
    private static final Logger log = LoggerFactory.getLogger(FileJobStore.class);

    static final String JOBS_FILE = "jobs.json";
    static final String EXECUTIONS_FILE = "executions.jsonl";

    private final Path jobsFile;
    private final Path executionsFile;
    private final ObjectMapper mapper;
    private final ReentrantLock lock = new ReentrantLock();

    private final Map<String, JobRecord> jobs = new LinkedHashMap<>();
    private final Map<String, List<ExecutionRecord>> executions = new LinkedHashMap<>();
    private long executionCount;
    private volatile boolean closed;

    public FileJobStore(Path directory) {
        this(directory, JsonCodec.createDefaultMapper());
    }

    public FileJobStore(Path directory, ObjectMapper mapper) {
        this.mapper = mapper;
        this.jobsFile = directory.resolve(JOBS_FILE);
        this.executionsFile = directory.resolve(EXECUTIONS_FILE);

        try {
            Files.createDirectories(directory);
            load();
        } catch (IOException e) {
            throw new StoreUnavailableException("Failed to open file store at " + directory, e);
        }

        log.warn("File job store at {} does not coordinate between processes; run a single worker only", directory);
        log.info("Loaded {} jobs and {} execution records from {}", jobs.size(), executionCount, directory);
    }

    @Override
    protected <R> R atomically(String id, Step<R> step) {
        lock.lock();
        try {
            ensureOpen();
            JobRecord stored = jobs.get(id);
            StepResult<R> result = step.apply(stored == null ? null : stored.copy());

            // Job state first: a failed write must not leave a record behind for a retry to repeat
            if (result.isDelete()) {
                JobRecord removed = jobs.remove(id);
                try {
                    persistJobs();
                } catch (StoreUnavailableException e) {
                    jobs.put(id, removed);
                    throw e;
                }
            } else if (result.toWrite() != null) {
                jobs.put(id, result.toWrite().copy());
                try {
                    persistJobs();
                } catch (StoreUnavailableException e) {
                    restore(id, stored);
                    throw e;
                }
            }
            if (result.toAppend() != null) {
                try {
                    appendExecution(result.toAppend());
                } catch (StoreUnavailableException e) {
                    if (result.toWrite() != null) {
                        rollBack(id, stored, e);
                    }
                    throw e;
                }
            }
            return result.value();
        } finally {
            lock.unlock();
        }
    }

    @Override
    protected List<JobRecord> scanJobs() {
        lock.lock();
        try {
            ensureOpen();
            List<JobRecord> copies = new ArrayList<>(jobs.size());
            for (JobRecord job : jobs.values()) {
                copies.add(job.copy());
            }
            return copies;
        } finally {
            lock.unlock();
        }
    }

    @Override
    protected List<ExecutionRecord> scanHistory(String jobId) {
        lock.lock();
        try {
            ensureOpen();
            return new ArrayList<>(executions.getOrDefault(jobId, Collections.emptyList()));
        } finally {
            lock.unlock();
        }
    }

    @Override
    protected long countExecutions() {
        lock.lock();
        try {
            return executionCount;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void close() {
        closed = true;
    }

    private void load() throws IOException {
        if (Files.exists(jobsFile)) {
            List<JobRecord> loaded = mapper.readValue(jobsFile.toFile(), new TypeReference<List<JobRecord>>() { });
            for (JobRecord job : loaded) {
                jobs.put(job.getId(), job);
            }
        }
        if (Files.exists(executionsFile)) {
            try (BufferedReader reader = Files.newBufferedReader(executionsFile, UTF_8)) {
                String line;
                while ((line = reader.readLine()) != null) {
                    if (line.isBlank()) {
                        continue;
                    }
                    ExecutionRecord record = mapper.readValue(line, ExecutionRecord.class);
                    executions.computeIfAbsent(record.getJobId(), k -> new ArrayList<>()).add(record);
                    executionCount++;
                }
            }
        }
    }

    private void persistJobs() {
        Path temp = jobsFile.resolveSibling(JOBS_FILE + ".tmp");
        try {
            mapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), new ArrayList<>(jobs.values()));
            Files.move(temp, jobsFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new StoreUnavailableException("Failed to write " + jobsFile, e);
        }
    }

    private void appendExecution(ExecutionRecord record) {
        try {
            String line = mapper.writeValueAsString(record) + System.lineSeparator();
            Files.write(executionsFile, line.getBytes(UTF_8), StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            throw new StoreUnavailableException("Failed to append to " + executionsFile, e);
        }
        executions.computeIfAbsent(record.getJobId(), k -> new ArrayList<>()).add(record);
        executionCount++;
    }

    /**
     * Undo a job write whose execution record could not be appended.
     */
    private void rollBack(String id, JobRecord previous, StoreUnavailableException cause) {
        restore(id, previous);
        try {
            persistJobs();
        } catch (StoreUnavailableException e) {
            cause.addSuppressed(e);
            log.error("Could not roll back job {} after a failed history append; {} and {} disagree",
                    id, JOBS_FILE, EXECUTIONS_FILE);
        }
    }

    private void restore(String id, JobRecord previous) {
        if (previous == null) {
            jobs.remove(id);
        } else {
            jobs.put(id, previous);
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new StoreUnavailableException("File job store is closed");
        }
    }
}
