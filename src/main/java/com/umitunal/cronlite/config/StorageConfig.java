package com.umitunal.cronlite.config;

/**
 * Configuration for the job store backend.
 */
public class StorageConfig {
    private final Backend backend;
    private final String dataDirectory;
    private final boolean durableWrites;
    private final int memoryBufferSizeMB;
    private final int maxMemoryBuffers;
    private final int backgroundThreads;
    private final int maxCommitAttempts;
    private final String jdbcUrl;
    private final String jdbcUser;
    private final String jdbcPassword;
    private final int jdbcPoolSize;

    private StorageConfig(Builder builder) {
        this.backend = builder.backend;
        this.dataDirectory = builder.dataDirectory;
        this.durableWrites = builder.durableWrites;
        this.memoryBufferSizeMB = builder.memoryBufferSizeMB;
        this.maxMemoryBuffers = builder.maxMemoryBuffers;
        this.backgroundThreads = builder.backgroundThreads;
        this.maxCommitAttempts = builder.maxCommitAttempts;
        this.jdbcUrl = builder.jdbcUrl;
        this.jdbcUser = builder.jdbcUser;
        this.jdbcPassword = builder.jdbcPassword;
        this.jdbcPoolSize = builder.jdbcPoolSize;
    }

    public Backend getBackend() { return backend; }
    public String getDataDirectory() { return dataDirectory; }
    public boolean isDurableWrites() { return durableWrites; }
    public int getMemoryBufferSizeMB() { return memoryBufferSizeMB; }
    public int getMaxMemoryBuffers() { return maxMemoryBuffers; }
    public int getBackgroundThreads() { return backgroundThreads; }
    public int getMaxCommitAttempts() { return maxCommitAttempts; }
    public String getJdbcUrl() { return jdbcUrl; }
    public String getJdbcUser() { return jdbcUser; }
    public String getJdbcPassword() { return jdbcPassword; }
    public int getJdbcPoolSize() { return jdbcPoolSize; }

    public static Builder newBuilder(String dataDirectory) {
        return new Builder(dataDirectory);
    }

    @Override
    public String toString() {
        if (backend == Backend.JDBC) {
            return "StorageConfig{backend=JDBC, url='" + jdbcUrl + "', user='" + jdbcUser
                    + "', poolSize=" + jdbcPoolSize + '}';
        }
        return "StorageConfig{backend=" + backend + ", dataDirectory='" + dataDirectory
                + "', durableWrites=" + durableWrites + '}';
    }

    /**
     * Available store implementations.
     */
    public enum Backend {
        /** JSON files, one process only. */
        FILE,
        /** RocksDB optimistic transactions; one process owns the directory. */
        ROCKSDB,
        /** Relational database shared by any number of worker processes. */
        JDBC
    }

    public static class Builder {
        private final String dataDirectory;
        private Backend backend = Backend.ROCKSDB;
        private boolean durableWrites = true;
        private int memoryBufferSizeMB = 16;
        private int maxMemoryBuffers = 3;
        private int backgroundThreads = 2;
        private int maxCommitAttempts = 5;
        private String jdbcUrl;
        private String jdbcUser;
        private String jdbcPassword;
        private int jdbcPoolSize = 4;

        private Builder(String dataDirectory) {
            if (dataDirectory == null || dataDirectory.trim().isEmpty()) {
                throw new IllegalArgumentException("Data directory must not be empty");
            }
            this.dataDirectory = dataDirectory;
        }

        /**
         * Default: ROCKSDB
         */
        public Builder withBackend(Backend backend) {
            this.backend = backend;
            return this;
        }

        /**
         * Enable durable writes (fsync on every commit).
         * Lease and completion state must survive a crash, so this defaults to true.
         */
        public Builder withDurableWrites(boolean enable) {
            this.durableWrites = enable;
            return this;
        }

        /**
         * Set memory buffer size in MB.
         * Default: 16 MB
         */
        public Builder withMemoryBufferSize(int sizeMB) {
            this.memoryBufferSizeMB = sizeMB;
            return this;
        }

        /**
         * Set maximum number of memory buffers.
         * Default: 3
         */
        public Builder withMaxMemoryBuffers(int count) {
            this.maxMemoryBuffers = count;
            return this;
        }

        /**
         * Set number of background compaction threads.
         * Default: 2
         */
        public Builder withBackgroundThreads(int count) {
            this.backgroundThreads = count;
            return this;
        }

        /**
         * How many times one store operation is attempted when its transaction
         * loses a commit race (RocksDB) or a lock wait (JDBC).
         * Default: 5
         */
        public Builder withMaxCommitAttempts(int attempts) {
            if (attempts < 1) {
                throw new IllegalArgumentException("Commit attempts must be at least 1");
            }
            this.maxCommitAttempts = attempts;
            return this;
        }

        /**
         * Database for the {@link Backend#JDBC} backend. User and password may be null.
         */
        public Builder withJdbc(String url, String user, String password) {
            if (url == null || url.trim().isEmpty()) {
                throw new IllegalArgumentException("JDBC url must not be empty");
            }
            this.jdbcUrl = url;
            this.jdbcUser = user;
            this.jdbcPassword = password;
            return this;
        }

        /**
         * Connections kept by one worker.
         * Default: 4
         */
        public Builder withJdbcPoolSize(int size) {
            if (size < 1) {
                throw new IllegalArgumentException("JDBC pool size must be at least 1");
            }
            this.jdbcPoolSize = size;
            return this;
        }

        public StorageConfig build() {
            if (backend == Backend.JDBC && jdbcUrl == null) {
                throw new IllegalStateException("The JDBC backend needs a url");
            }
            return new StorageConfig(this);
        }
    }
}
