package com.umitunal.cronlite.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Layered configuration: {@code cronlite.properties} on the classpath, then an optional
 * external properties file, then environment variables.
 * <p>
 * An environment variable {@code CRONLITE_LEASE_DURATION} overrides the key
 * {@code cronlite.lease.duration}. {@code CRON_SECRET} sets the tick endpoint secret.
 * Durations are ISO-8601 ({@code PT5M}) or a plain number of seconds.
 */
public class ConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    public static final String DEFAULTS_RESOURCE = "cronlite.properties";
    static final String ENV_PREFIX = "CRONLITE_";
    static final String SECRET_ENV = "CRON_SECRET";

    public static final String MODE = "cronlite.mode";
    public static final String STORAGE_BACKEND = "cronlite.storage.backend";
    public static final String STORAGE_DIR = "cronlite.storage.dir";
    public static final String STORAGE_DURABLE = "cronlite.storage.durable";
    public static final String STORAGE_JDBC_URL = "cronlite.storage.jdbc.url";
    public static final String STORAGE_JDBC_USER = "cronlite.storage.jdbc.user";
    public static final String STORAGE_JDBC_PASSWORD = "cronlite.storage.jdbc.password";
    public static final String STORAGE_JDBC_POOL_SIZE = "cronlite.storage.jdbc.pool.size";
    public static final String WORKER_ID = "cronlite.worker.id";
    public static final String LEASE_DURATION = "cronlite.lease.duration";
    public static final String EXECUTION_TIMEOUT = "cronlite.execution.timeout";
    public static final String EXECUTION_THREADS = "cronlite.execution.threads";
    public static final String EXECUTION_MAX_RUNS = "cronlite.execution.max.runs";
    public static final String RETRY_ATTEMPTS = "cronlite.retry.attempts";
    public static final String RETRY_BASE = "cronlite.retry.base";
    public static final String RETRY_MAX = "cronlite.retry.max";
    public static final String AUTODISABLE_THRESHOLD = "cronlite.autodisable.threshold";
    public static final String STORE_RETRY_ATTEMPTS = "cronlite.store.retry.attempts";
    public static final String STORE_RETRY_BACKOFF = "cronlite.store.retry.backoff";
    public static final String TICK_INTERVAL = "cronlite.tick.interval";
    public static final String TICK_LOOP = "cronlite.tick.loop";
    public static final String TICK_SECRET = "cronlite.tick.secret";
    public static final String HTTP_PORT = "cronlite.http.port";
    public static final String HANDLERS_STRICT = "cronlite.handlers.strict";

    private final Properties properties;

    ConfigLoader(Properties properties) {
        this.properties = properties;
    }

    /**
     * Load from the classpath defaults, the given file (may be null) and the process environment.
     */
    public static ConfigLoader load(Path externalFile) {
        return load(externalFile, System.getenv());
    }

    public static ConfigLoader load(Path externalFile, Map<String, String> env) {
        Properties properties = new Properties();

        try (InputStream in = ConfigLoader.class.getClassLoader().getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in != null) {
                properties.load(in);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read " + DEFAULTS_RESOURCE, e);
        }

        if (externalFile != null) {
            try (Reader reader = Files.newBufferedReader(externalFile, UTF_8)) {
                properties.load(reader);
                log.info("Loaded configuration from {}", externalFile);
            } catch (IOException e) {
                throw new IllegalStateException("Failed to read configuration file " + externalFile, e);
            }
        }

        for (Map.Entry<String, String> entry : env.entrySet()) {
            String name = entry.getKey();
            if (name.startsWith(ENV_PREFIX)) {
                properties.setProperty(toKey(name), entry.getValue());
            }
        }
        String secret = env.get(SECRET_ENV);
        if (secret != null) {
            properties.setProperty(TICK_SECRET, secret);
        }

        return new ConfigLoader(properties);
    }

    static String toKey(String envName) {
        return envName.toLowerCase(Locale.ROOT).replace('_', '.');
    }

    public EngineConfig engineConfig() {
        EngineConfig.Builder builder = EngineConfig.newBuilder()
                .withLeaseDuration(getDuration(LEASE_DURATION, Duration.ofMinutes(5)))
                .withMaxAttempts(getInt(RETRY_ATTEMPTS, 3))
                .withRetryBackoff(getDuration(RETRY_BASE, Duration.ofSeconds(30)),
                        getDuration(RETRY_MAX, Duration.ofMinutes(15)))
                .withAutoDisableThreshold(getInt(AUTODISABLE_THRESHOLD, 0))
                .withExecutionThreads(getInt(EXECUTION_THREADS, 4))
                .withMaxConcurrentRuns(getInt(EXECUTION_MAX_RUNS, 64))
                .withStoreRetry(getInt(STORE_RETRY_ATTEMPTS, 3), getDuration(STORE_RETRY_BACKOFF, Duration.ofMillis(200)))
                .withTickInterval(getDuration(TICK_INTERVAL, Duration.ofSeconds(60)))
                .withExecutionTimeout(getDuration(EXECUTION_TIMEOUT, null));

        String workerId = getString(WORKER_ID, null);
        if (workerId != null) {
            builder.withWorkerId(workerId);
        }
        return builder.build();
    }

    public StorageConfig storageConfig() {
        String backend = getString(STORAGE_BACKEND, "rocksdb").toUpperCase(Locale.ROOT);
        StorageConfig.Backend parsed;
        try {
            parsed = StorageConfig.Backend.valueOf(backend);
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Unknown storage backend '" + backend + "' for " + STORAGE_BACKEND, e);
        }
        StorageConfig.Builder builder = StorageConfig.newBuilder(getString(STORAGE_DIR, "./cronlite-data"))
                .withBackend(parsed)
                .withDurableWrites(getBoolean(STORAGE_DURABLE, true))
                .withJdbcPoolSize(getInt(STORAGE_JDBC_POOL_SIZE, 4));
        if (parsed == StorageConfig.Backend.JDBC) {
            String url = getString(STORAGE_JDBC_URL, null);
            if (url == null) {
                throw new IllegalStateException(STORAGE_JDBC_URL + " is required for the jdbc backend");
            }
            builder.withJdbc(url, getString(STORAGE_JDBC_USER, null), getString(STORAGE_JDBC_PASSWORD, null));
        }
        return builder.build();
    }

    public String mode() {
        return getString(MODE, "tick").toLowerCase(Locale.ROOT);
    }

    public int httpPort() {
        return getInt(HTTP_PORT, 8080);
    }

    public String tickSecret() {
        return getString(TICK_SECRET, null);
    }

    public boolean tickLoopEnabled() {
        return getBoolean(TICK_LOOP, false);
    }

    public boolean strictHandlers() {
        return getBoolean(HANDLERS_STRICT, false);
    }

    /**
     * @return the trimmed value, or {@code defaultValue} when missing or blank
     */
    public String getString(String key, String defaultValue) {
        String value = properties.getProperty(key);
        if (value == null || value.trim().isEmpty()) {
            return defaultValue;
        }
        return value.trim();
    }

    public int getInt(String key, int defaultValue) {
        String value = getString(key, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Invalid integer for " + key + ": " + value, e);
        }
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        String value = getString(key, null);
        return value == null ? defaultValue : Boolean.parseBoolean(value);
    }

    public Duration getDuration(String key, Duration defaultValue) {
        String value = getString(key, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            if (value.chars().allMatch(Character::isDigit)) {
                return Duration.ofSeconds(Long.parseLong(value));
            }
            return Duration.parse(value);
        } catch (DateTimeParseException | NumberFormatException e) {
            throw new IllegalStateException("Invalid duration for " + key + ": " + value, e);
        }
    }
}
