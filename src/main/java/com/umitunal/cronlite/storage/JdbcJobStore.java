package com.umitunal.cronlite.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.umitunal.cronlite.config.StorageConfig;
import com.umitunal.cronlite.core.ExecutionRecord;
import com.umitunal.cronlite.core.JobNotFoundException;
import com.umitunal.cronlite.core.StoreUnavailableException;
import com.umitunal.cronlite.model.JobRecord;
import com.umitunal.cronlite.serialization.JsonCodec;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import com.zaxxer.hikari.pool.HikariPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Relational implementation of JobStore that any number of worker processes can share.
 * <p>
 * Columns that conditions are evaluated on ({@code version}, {@code enabled},
 * {@code next_run_at}, the lease) live next to a JSON body holding the full record.
 * The lease and version columns win over the body when a row is read.
 * <p>
 * A claim is one conditional {@code UPDATE}: it matches only while the version is unchanged
 * and no other holder's lease is active, so the database decides the race. Every other
 * write locks the row with {@code SELECT ... FOR UPDATE}, applies the step and writes back
 * under the version it read. Lock timeouts, deadlocks and duplicate inserts re-run the step
 * up to {@link StorageConfig#getMaxCommitAttempts()} times.
 * <p>
 * Written for PostgreSQL; H2 accepts the same statements.
 */
public class JdbcJobStore extends AbstractJobStore {
    private static final Logger log = LoggerFactory.getLogger(JdbcJobStore.class);

    private static final String JOB_TABLE = "cronlite_job";
    private static final String EXECUTION_TABLE = "cronlite_execution";

    private static final String[] SCHEMA = {
            "CREATE TABLE IF NOT EXISTS " + JOB_TABLE + " ("
                    + "id VARCHAR(255) NOT NULL PRIMARY KEY, "
                    + "version BIGINT NOT NULL, "
                    + "enabled BOOLEAN NOT NULL, "
                    + "next_run_at BIGINT, "
                    + "lease_holder VARCHAR(255), "
                    + "lease_until BIGINT, "
                    + "body VARCHAR NOT NULL)",
            "CREATE INDEX IF NOT EXISTS cronlite_job_due ON " + JOB_TABLE + " (next_run_at)",
            "CREATE TABLE IF NOT EXISTS " + EXECUTION_TABLE + " ("
                    + "job_id VARCHAR(255) NOT NULL, "
                    + "started_sec BIGINT NOT NULL, "
                    + "started_nano INTEGER NOT NULL, "
                    + "attempt INTEGER NOT NULL, "
                    + "body VARCHAR NOT NULL, "
                    + "PRIMARY KEY (job_id, started_sec, started_nano, attempt))"
    };

    private static final String JOB_COLUMNS = "version, lease_holder, lease_until, body";

    private static final String CLAIM_SQL = "UPDATE " + JOB_TABLE
            + " SET lease_holder = ?, lease_until = ?, version = version + 1"
            + " WHERE id = ? AND version = ?"
            + " AND (lease_until IS NULL OR lease_until <= ? OR lease_holder = ?)";

    private final DataSource dataSource;
    private final HikariDataSource ownedPool;
    private final ObjectMapper mapper;
    private final int maxCommitAttempts;

    /**
     * Opens a connection pool of its own; {@link #close()} shuts it down.
     */
    public JdbcJobStore(StorageConfig config) {
        this(openPool(config), true, config.getMaxCommitAttempts());
        log.info("Opened JDBC job store at {}", config.getJdbcUrl());
    }

    /**
     * Uses a pool managed by the caller; {@link #close()} leaves it open.
     */
    public JdbcJobStore(DataSource dataSource, int maxCommitAttempts) {
        this(dataSource, false, maxCommitAttempts);
    }

    private JdbcJobStore(DataSource dataSource, boolean owned, int maxCommitAttempts) {
        this.dataSource = dataSource;
        this.ownedPool = owned ? (HikariDataSource) dataSource : null;
        this.mapper = JsonCodec.createDefaultMapper();
        this.maxCommitAttempts = maxCommitAttempts;
        try {
            createSchema();
        } catch (StoreUnavailableException e) {
            close();
            throw e;
        }
    }

    private static HikariDataSource openPool(StorageConfig config) {
        HikariConfig hikari = new HikariConfig();
        hikari.setPoolName("cronlite-jdbc");
        hikari.setJdbcUrl(config.getJdbcUrl());
        hikari.setUsername(config.getJdbcUser());
        hikari.setPassword(config.getJdbcPassword());
        hikari.setMaximumPoolSize(config.getJdbcPoolSize());
        hikari.setMinimumIdle(1);
        try {
            return new HikariDataSource(hikari);
        } catch (HikariPool.PoolInitializationException e) {
            throw new StoreUnavailableException("Failed to connect to " + config.getJdbcUrl(), e);
        }
    }

    private void createSchema() {
        try (Connection conn = dataSource.getConnection();
             Statement statement = conn.createStatement()) {
            for (String ddl : SCHEMA) {
                statement.execute(ddl);
            }
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to create the job tables", e);
        }
    }

    @Override
    protected <R> R atomically(String id, Step<R> step) {
        for (int attempt = 1; ; attempt++) {
            try (Connection conn = dataSource.getConnection()) {
                conn.setAutoCommit(false);
                try {
                    R value = runStep(conn, id, step);
                    conn.commit();
                    return value;
                } catch (SQLException | RuntimeException e) {
                    rollback(conn, e);
                    throw e;
                }
            } catch (SQLException e) {
                if (isConflict(e) && attempt < maxCommitAttempts) {
                    log.debug("Write conflict on job {} (attempt {}): {}, retrying", id, attempt, e.getMessage());
                    continue;
                }
                throw new StoreUnavailableException("JDBC operation on job " + id + " failed: "
                        + e.getMessage(), e);
            }
        }
    }

    private <R> R runStep(Connection conn, String id, Step<R> step) throws SQLException {
        JobRecord current;
        try (PreparedStatement select = conn.prepareStatement(
                "SELECT " + JOB_COLUMNS + " FROM " + JOB_TABLE + " WHERE id = ? FOR UPDATE")) {
            select.setString(1, id);
            try (ResultSet rs = select.executeQuery()) {
                current = rs.next() ? readJob(rs) : null;
            }
        }
        long readVersion = current == null ? -1 : current.getVersion();

        StepResult<R> result = step.apply(current);

        if (result.isDelete()) {
            try (PreparedStatement delete = conn.prepareStatement(
                    "DELETE FROM " + JOB_TABLE + " WHERE id = ? AND version = ?")) {
                delete.setString(1, id);
                delete.setLong(2, readVersion);
                expectOneRow(delete.executeUpdate(), id);
            }
        } else if (result.toWrite() != null) {
            if (current == null) {
                insertJob(conn, result.toWrite());
            } else {
                updateJob(conn, result.toWrite(), readVersion);
            }
        }
        if (result.toAppend() != null) {
            appendExecution(conn, result.toAppend());
        }
        return result.value();
    }

    private void insertJob(Connection conn, JobRecord job) throws SQLException {
        try (PreparedStatement insert = conn.prepareStatement("INSERT INTO " + JOB_TABLE
                + " (version, enabled, next_run_at, lease_holder, lease_until, body, id)"
                + " VALUES (?, ?, ?, ?, ?, ?, ?)")) {
            bindJob(insert, job);
            insert.executeUpdate();
        }
    }

    private void updateJob(Connection conn, JobRecord job, long readVersion) throws SQLException {
        try (PreparedStatement update = conn.prepareStatement("UPDATE " + JOB_TABLE
                + " SET version = ?, enabled = ?, next_run_at = ?, lease_holder = ?, lease_until = ?, body = ?"
                + " WHERE id = ? AND version = ?")) {
            bindJob(update, job);
            update.setLong(8, readVersion);
            expectOneRow(update.executeUpdate(), job.getId());
        }
    }

    private void bindJob(PreparedStatement statement, JobRecord job) throws SQLException {
        statement.setLong(1, job.getVersion());
        statement.setBoolean(2, job.isEnabled());
        setMillis(statement, 3, job.getNextRunAt() == null ? null : job.getNextRunAt().toEpochMilli());
        statement.setString(4, job.getLeaseHolder());
        setMillis(statement, 5, job.getLeaseUntil() == null ? null : ceilMillis(job.getLeaseUntil()));
        statement.setString(6, toJson(job));
        statement.setString(7, job.getId());
    }

    /**
     * Rows are keyed by start time and attempt, so a repeated append of the same run is a no-op.
     */
    private void appendExecution(Connection conn, ExecutionRecord record) throws SQLException {
        try (PreparedStatement exists = conn.prepareStatement("SELECT 1 FROM " + EXECUTION_TABLE
                + " WHERE job_id = ? AND started_sec = ? AND started_nano = ? AND attempt = ?")) {
            bindExecutionKey(exists, record);
            try (ResultSet rs = exists.executeQuery()) {
                if (rs.next()) {
                    log.debug("Execution {} of job {} already recorded", record.getAttemptNumber(), record.getJobId());
                    return;
                }
            }
        }
        try (PreparedStatement insert = conn.prepareStatement("INSERT INTO " + EXECUTION_TABLE
                + " (job_id, started_sec, started_nano, attempt, body) VALUES (?, ?, ?, ?, ?)")) {
            bindExecutionKey(insert, record);
            insert.setString(5, toJson(record));
            insert.executeUpdate();
        }
    }

    private static void bindExecutionKey(PreparedStatement statement, ExecutionRecord record) throws SQLException {
        statement.setString(1, record.getJobId());
        statement.setLong(2, record.getStartedAt().getEpochSecond());
        statement.setInt(3, record.getStartedAt().getNano());
        statement.setInt(4, record.getAttemptNumber());
    }

    @Override
    public boolean tryClaim(String id, String holder, Duration leaseDuration, long expectedVersion, Instant now) {
        for (int attempt = 1; ; attempt++) {
            try (Connection conn = dataSource.getConnection();
                 PreparedStatement claim = conn.prepareStatement(CLAIM_SQL)) {
                claim.setString(1, holder);
                claim.setLong(2, ceilMillis(now.plus(leaseDuration)));
                claim.setString(3, id);
                claim.setLong(4, expectedVersion);
                claim.setLong(5, now.toEpochMilli());
                claim.setString(6, holder);
                if (claim.executeUpdate() == 1) {
                    return true;
                }
                if (!exists(conn, id)) {
                    throw new JobNotFoundException(id);
                }
                return false;
            } catch (SQLException e) {
                if (isConflict(e) && attempt < maxCommitAttempts) {
                    log.debug("Claim of job {} hit a lock conflict (attempt {}), retrying", id, attempt);
                    continue;
                }
                throw new StoreUnavailableException("Failed to claim job " + id + ": " + e.getMessage(), e);
            }
        }
    }

    private static boolean exists(Connection conn, String id) throws SQLException {
        try (PreparedStatement select = conn.prepareStatement("SELECT 1 FROM " + JOB_TABLE + " WHERE id = ?")) {
            select.setString(1, id);
            try (ResultSet rs = select.executeQuery()) {
                return rs.next();
            }
        }
    }

    @Override
    public Optional<JobRecord> find(String id) {
        List<JobRecord> found = queryJobs(
                "SELECT " + JOB_COLUMNS + " FROM " + JOB_TABLE + " WHERE id = ?",
                statement -> statement.setString(1, id));
        return found.stream().findFirst();
    }

    /**
     * The indexed {@code next_run_at} column narrows the candidates; the record decides.
     */
    @Override
    public List<JobRecord> listDue(Instant now) {
        return queryJobs(
                "SELECT " + JOB_COLUMNS + " FROM " + JOB_TABLE
                        + " WHERE enabled = TRUE AND next_run_at IS NOT NULL AND next_run_at <= ?",
                statement -> statement.setLong(1, now.toEpochMilli()))
                .stream()
                .filter(job -> job.isDue(now))
                .sorted(Comparator.comparing(JobRecord::getNextRunAt).thenComparing(JobRecord::getId))
                .collect(Collectors.toList());
    }

    @Override
    protected List<JobRecord> scanJobs() {
        return queryJobs("SELECT " + JOB_COLUMNS + " FROM " + JOB_TABLE, statement -> { });
    }

    @Override
    protected List<ExecutionRecord> scanHistory(String jobId) {
        String sql = "SELECT body FROM " + EXECUTION_TABLE
                + " WHERE job_id = ? ORDER BY started_sec, started_nano, attempt";
        List<ExecutionRecord> records = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement select = conn.prepareStatement(sql)) {
            select.setString(1, jobId);
            try (ResultSet rs = select.executeQuery()) {
                while (rs.next()) {
                    records.add(fromJson(rs.getString(1), ExecutionRecord.class));
                }
            }
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to read history of job " + jobId, e);
        }
        return records;
    }

    @Override
    protected long countExecutions() {
        try (Connection conn = dataSource.getConnection();
             Statement statement = conn.createStatement();
             ResultSet rs = statement.executeQuery("SELECT COUNT(*) FROM " + EXECUTION_TABLE)) {
            return rs.next() ? rs.getLong(1) : 0;
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to count executions", e);
        }
    }

    private List<JobRecord> queryJobs(String sql, Binder binder) {
        List<JobRecord> jobs = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement select = conn.prepareStatement(sql)) {
            binder.bind(select);
            try (ResultSet rs = select.executeQuery()) {
                while (rs.next()) {
                    jobs.add(readJob(rs));
                }
            }
        } catch (SQLException e) {
            throw new StoreUnavailableException("Job query failed: " + e.getMessage(), e);
        }
        return jobs;
    }

    private JobRecord readJob(ResultSet rs) throws SQLException {
        JobRecord job = fromJson(rs.getString("body"), JobRecord.class);
        job.setVersion(rs.getLong("version"));
        long leaseUntil = rs.getLong("lease_until");
        if (rs.wasNull()) {
            job.clearLease();
        } else {
            job.lease(rs.getString("lease_holder"), Instant.ofEpochMilli(leaseUntil));
        }
        return job;
    }

    @Override
    public void close() {
        if (ownedPool != null && !ownedPool.isClosed()) {
            ownedPool.close();
            log.info("Closed JDBC job store");
        }
    }

    private String toJson(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new StoreUnavailableException("Failed to encode " + value.getClass().getSimpleName(), e);
        }
    }

    private <T> T fromJson(String json, Class<T> type) {
        try {
            return mapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new StoreUnavailableException("Corrupt " + type.getSimpleName() + " row", e);
        }
    }

    private static void setMillis(PreparedStatement statement, int index, Long millis) throws SQLException {
        if (millis == null) {
            statement.setNull(index, Types.BIGINT);
        } else {
            statement.setLong(index, millis);
        }
    }

    /**
     * Leases are stored rounded up to the millisecond so a stored lease never ends early.
     */
    static long ceilMillis(Instant instant) {
        long millis = instant.toEpochMilli();
        return instant.getNano() % 1_000_000 == 0 ? millis : millis + 1;
    }

    private static void expectOneRow(int rows, String id) throws SQLException {
        if (rows != 1) {
            throw new SQLException("Job " + id + " changed while locked", "40001");
        }
    }

    private static void rollback(Connection conn, Exception cause) {
        try {
            conn.rollback();
        } catch (SQLException e) {
            cause.addSuppressed(e);
        }
    }

    /**
     * Serialization failures, deadlocks, lock timeouts and duplicate keys from a racing insert.
     */
    static boolean isConflict(SQLException e) {
        String state = e.getSQLState();
        if (state == null) {
            return false;
        }
        return state.startsWith("40")      // 40001 serialization, 40P01 deadlock
                || state.equals("55P03")   // PostgreSQL lock not available
                || state.equals("23505")   // unique violation
                || state.equals("HYT00")   // H2 lock timeout
                || state.equals("90131");  // H2 concurrent update
    }

    @FunctionalInterface
    private interface Binder {
        void bind(PreparedStatement statement) throws SQLException;
    }
}
