package com.umitunal.cronlite.storage;

import com.umitunal.cronlite.config.StorageConfig;
import com.umitunal.cronlite.core.ExecutionRecord;
import com.umitunal.cronlite.core.JobPayload;
import com.umitunal.cronlite.core.StoreUnavailableException;
import com.umitunal.cronlite.model.JobRecord;
import com.umitunal.cronlite.model.JobRecordSerializer;
import com.umitunal.cronlite.serialization.JsonCodec;
import com.umitunal.cronlite.serialization.KryoCodec;
import com.umitunal.cronlite.serialization.PayloadCodec;
import org.rocksdb.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * RocksDB-backed implementation of JobStore.
 * <p>
 * Every conditional operation runs inside an optimistic transaction: the job key is read
 * with {@code getForUpdate}, the step decides, and the commit fails if anybody else wrote
 * the key in between. A failed commit re-runs the whole step against the fresh state.
 * <p>
 * Key layout:
 * <pre>
 *   job/&lt;id&gt;                                       -> JobRecordSerializer bytes
 *   exec/&lt;jobId&gt;\0&lt;seconds:8&gt;&lt;nanos:4&gt;&lt;attempt:4&gt; -> Kryo ExecutionRecord
 * </pre>
 */
public class RocksJobStore extends AbstractJobStore {
    private static final Logger log = LoggerFactory.getLogger(RocksJobStore.class);

    private static final byte[] JOB_PREFIX = "job/".getBytes(UTF_8);
    private static final byte[] EXEC_PREFIX = "exec/".getBytes(UTF_8);

    private final OptimisticTransactionDB transactionDB;
    private final JobRecordSerializer serializer;
    private final PayloadCodec<ExecutionRecord> executionCodec;
    private final WriteOptions writeOpts;
    private final OptimisticTransactionOptions txnOpts;
    private final ReadOptions scanReadOpts;
    private final Options dbOptions;
    private final BlockBasedTableConfig tableConfig;
    private final Cache blockCache;
    private final Filter bloomFilter;
    private final int maxCommitAttempts;

    public RocksJobStore(StorageConfig config) {
        this(config, new JobRecordSerializer(new JsonCodec<>(JobPayload.class)),
                new KryoCodec<>(ExecutionRecord.class));
    }

    public RocksJobStore(StorageConfig config, JobRecordSerializer serializer,
                         PayloadCodec<ExecutionRecord> executionCodec) {
        this.serializer = serializer;
        this.executionCodec = executionCodec;
        this.maxCommitAttempts = config.getMaxCommitAttempts();

        RocksDB.loadLibrary();

        this.blockCache = new LRUCache(32 * 1024 * 1024);
        this.bloomFilter = new BloomFilter(10, false);

        this.tableConfig = new BlockBasedTableConfig()
                .setBlockCache(blockCache)
                .setFilterPolicy(bloomFilter)
                .setCacheIndexAndFilterBlocks(true)
                .setPinL0FilterAndIndexBlocksInCache(true);

        this.dbOptions = new Options()
                .setCreateIfMissing(true)
                .setCompressionType(CompressionType.LZ4_COMPRESSION)
                .setWriteBufferSize((long) config.getMemoryBufferSizeMB() * 1024 * 1024)
                .setMaxWriteBufferNumber(config.getMaxMemoryBuffers())
                .setMaxBackgroundJobs(config.getBackgroundThreads())
                .setTableFormatConfig(tableConfig)
                .setMaxOpenFiles(-1);

        try {
            this.transactionDB = OptimisticTransactionDB.open(dbOptions, config.getDataDirectory());
        } catch (RocksDBException e) {
            dbOptions.close();
            blockCache.close();
            bloomFilter.close();
            throw new StoreUnavailableException("Failed to open RocksDB at " + config.getDataDirectory(), e);
        }

        // Leases must survive a crash, so the WAL stays on even without fsync
        this.writeOpts = new WriteOptions()
                .setSync(config.isDurableWrites());

        this.txnOpts = new OptimisticTransactionOptions()
                .setSetSnapshot(true);

        // Scans must not pollute the block cache
        this.scanReadOpts = new ReadOptions()
                .setFillCache(false);

        log.info("Opened RocksDB job store at {}", config.getDataDirectory());
    }

    @Override
    protected <R> R atomically(String id, Step<R> step) {
        byte[] key = jobKey(id);

        for (int attempt = 1; ; attempt++) {
            try (Transaction txn = transactionDB.beginTransaction(writeOpts, txnOpts);
                 ReadOptions readOpts = new ReadOptions()) {
                byte[] value = txn.getForUpdate(readOpts, key, true);
                JobRecord current = value == null ? null : serializer.deserialize(value);

                StepResult<R> result = step.apply(current);

                boolean dirty = false;
                if (result.toAppend() != null) {
                    ExecutionRecord record = result.toAppend();
                    txn.put(executionKey(record), executionCodec.encode(record));
                    dirty = true;
                }
                if (result.isDelete()) {
                    txn.delete(key);
                    dirty = true;
                } else if (result.toWrite() != null) {
                    txn.put(key, serializer.serialize(result.toWrite()));
                    dirty = true;
                }

                if (dirty) {
                    txn.commit();
                } else {
                    txn.rollback();
                }
                return result.value();

            } catch (RocksDBException e) {
                if (isConflict(e) && attempt < maxCommitAttempts) {
                    // Someone else wrote this job first; re-run against the new state
                    log.debug("Commit conflict on job {} (attempt {}), retrying", id, attempt);
                    continue;
                }
                throw new StoreUnavailableException("RocksDB operation on job " + id + " failed: "
                        + e.getMessage(), e);
            }
        }
    }

    @Override
    public Optional<JobRecord> find(String id) {
        try {
            byte[] value = transactionDB.get(jobKey(id));
            return value == null ? Optional.empty() : Optional.of(serializer.deserialize(value));
        } catch (RocksDBException e) {
            throw new StoreUnavailableException("Failed to read job " + id, e);
        }
    }

    @Override
    protected List<JobRecord> scanJobs() {
        List<JobRecord> jobs = new ArrayList<>();
        try (final RocksIterator iter = transactionDB.newIterator(scanReadOpts)) {
            for (iter.seek(JOB_PREFIX); iter.isValid() && startsWith(iter.key(), JOB_PREFIX); iter.next()) {
                jobs.add(serializer.deserialize(iter.value()));
            }
            checkIterator(iter);
        }
        return jobs;
    }

    @Override
    protected List<ExecutionRecord> scanHistory(String jobId) {
        byte[] prefix = historyPrefix(jobId);
        List<ExecutionRecord> records = new ArrayList<>();
        try (final RocksIterator iter = transactionDB.newIterator(scanReadOpts)) {
            for (iter.seek(prefix); iter.isValid() && startsWith(iter.key(), prefix); iter.next()) {
                records.add(executionCodec.decode(iter.value()));
            }
            checkIterator(iter);
        }
        return records;
    }

    @Override
    protected long countExecutions() {
        long count = 0;
        try (final RocksIterator iter = transactionDB.newIterator(scanReadOpts)) {
            for (iter.seek(EXEC_PREFIX); iter.isValid() && startsWith(iter.key(), EXEC_PREFIX); iter.next()) {
                count++;
            }
            checkIterator(iter);
        }
        return count;
    }

    @Override
    public void close() {
        if (scanReadOpts != null) {
            scanReadOpts.close();
        }
        if (txnOpts != null) {
            txnOpts.close();
        }
        if (writeOpts != null) {
            writeOpts.close();
        }
        if (transactionDB != null) {
            transactionDB.close();
        }
        if (dbOptions != null) {
            dbOptions.close();
        }
        // BlockBasedTableConfig is released with Options
        if (blockCache != null) {
            blockCache.close();
        }
        if (bloomFilter != null) {
            bloomFilter.close();
        }
    }

    private static boolean isConflict(RocksDBException e) {
        Status status = e.getStatus();
        if (status == null) {
            return false;
        }
        return status.getCode() == Status.Code.Busy || status.getCode() == Status.Code.TryAgain;
    }

    private static void checkIterator(RocksIterator iter) {
        try {
            iter.status();
        } catch (RocksDBException e) {
            throw new StoreUnavailableException("RocksDB scan failed", e);
        }
    }

    static byte[] jobKey(String id) {
        return concat(JOB_PREFIX, id.getBytes(UTF_8));
    }

    static byte[] historyPrefix(String jobId) {
        byte[] id = jobId.getBytes(UTF_8);
        ByteBuffer buffer = ByteBuffer.allocate(EXEC_PREFIX.length + id.length + 1);
        buffer.put(EXEC_PREFIX);
        buffer.put(id);
        buffer.put((byte) 0);
        return buffer.array();
    }

    /**
     * Big-endian timestamp so that keys of one job sort chronologically.
     */
    static byte[] executionKey(ExecutionRecord record) {
        byte[] prefix = historyPrefix(record.getJobId());
        ByteBuffer buffer = ByteBuffer.allocate(prefix.length + 8 + 4 + 4);
        buffer.put(prefix);
        buffer.putLong(record.getStartedAt().getEpochSecond());
        buffer.putInt(record.getStartedAt().getNano());
        buffer.putInt(record.getAttemptNumber());
        return buffer.array();
    }

    private static byte[] concat(byte[] a, byte[] b) {
        byte[] result = Arrays.copyOf(a, a.length + b.length);
        System.arraycopy(b, 0, result, a.length, b.length);
        return result;
    }

    private static boolean startsWith(byte[] key, byte[] prefix) {
        if (key.length < prefix.length) {
            return false;
        }
        for (int i = 0; i < prefix.length; i++) {
            if (key[i] != prefix[i]) {
                return false;
            }
        }
        return true;
    }
}
