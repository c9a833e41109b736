package com.umitunal.cronlite.storage;

import com.umitunal.cronlite.config.StorageConfig;
import com.umitunal.cronlite.core.JobStore;

import java.nio.file.Paths;

/**
 * Opens the backend named in a {@link StorageConfig}.
 */
public final class JobStoreFactory {

    private JobStoreFactory() {
    }

    /**
     * @throws com.umitunal.cronlite.core.StoreUnavailableException if the store cannot be opened
     */
    public static JobStore open(StorageConfig config) {
        return switch (config.getBackend()) {
            case FILE -> new FileJobStore(Paths.get(config.getDataDirectory()));
            case ROCKSDB -> new RocksJobStore(config);
            case JDBC -> new JdbcJobStore(config);
        };
    }
}
