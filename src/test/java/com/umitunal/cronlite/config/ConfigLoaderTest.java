package com.umitunal.cronlite.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Properties;

import static org.assertj.core.api.Assertions.*;

class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Should start from the packaged defaults")
    void testDefaults() {
        // When
        ConfigLoader config = ConfigLoader.load(null, Map.of());
        EngineConfig engine = config.engineConfig();
        StorageConfig storage = config.storageConfig();

        // Then
        assertThat(config.mode()).isEqualTo("tick");
        assertThat(config.httpPort()).isEqualTo(8080);
        assertThat(config.tickSecret()).isNull();
        assertThat(config.tickLoopEnabled()).isFalse();
        assertThat(engine.getLeaseDuration()).isEqualTo(Duration.ofMinutes(5));
        assertThat(engine.getExecutionTimeout()).isEqualTo(engine.getLeaseDuration());
        assertThat(engine.getMaxAttempts()).isEqualTo(3);
        assertThat(engine.getStoreRetryBackoff()).isEqualTo(Duration.ofMillis(200));
        assertThat(engine.getWorkerId()).isNotBlank();
        assertThat(storage.getBackend()).isEqualTo(StorageConfig.Backend.ROCKSDB);
        assertThat(storage.isDurableWrites()).isTrue();
    }

    @Test
    @DisplayName("Should let a file override defaults and the environment override the file")
    void testLayering() throws Exception {
        // Given
        Path file = tempDir.resolve("worker.properties");
        Files.writeString(file, String.join("\n",
                "cronlite.mode=timer",
                "cronlite.lease.duration=120",
                "cronlite.storage.backend=file",
                "cronlite.storage.dir=" + tempDir.resolve("data").toString().replace("\\", "/"),
                "cronlite.worker.id=from-file",
                "cronlite.retry.attempts=5"));
        Map<String, String> env = Map.of(
                "CRONLITE_WORKER_ID", "from-env",
                "CRONLITE_EXECUTION_TIMEOUT", "PT45S",
                "CRON_SECRET", "s3cret",
                "PATH", "/usr/bin");

        // When
        ConfigLoader config = ConfigLoader.load(file, env);
        EngineConfig engine = config.engineConfig();

        // Then
        assertThat(config.mode()).isEqualTo("timer");
        assertThat(engine.getLeaseDuration()).isEqualTo(Duration.ofMinutes(2));
        assertThat(engine.getExecutionTimeout()).isEqualTo(Duration.ofSeconds(45));
        assertThat(engine.getWorkerId()).isEqualTo("from-env");
        assertThat(engine.getMaxAttempts()).isEqualTo(5);
        assertThat(config.tickSecret()).isEqualTo("s3cret");
        assertThat(config.storageConfig().getBackend()).isEqualTo(StorageConfig.Backend.FILE);
        assertThat(config.storageConfig().getDataDirectory()).endsWith("data");
    }

    @Test
    @DisplayName("Should map environment variable names to keys")
    void testEnvKeys() {
        assertThat(ConfigLoader.toKey("CRONLITE_TICK_LOOP")).isEqualTo("cronlite.tick.loop");
        assertThat(ConfigLoader.toKey("CRONLITE_STORE_RETRY_BACKOFF")).isEqualTo(ConfigLoader.STORE_RETRY_BACKOFF);
    }

    @Test
    @DisplayName("Should fail loudly on malformed values")
    void testInvalidValues() {
        // Given
        Properties properties = new Properties();
        properties.setProperty(ConfigLoader.LEASE_DURATION, "five minutes");
        properties.setProperty(ConfigLoader.HTTP_PORT, "eighty");
        properties.setProperty(ConfigLoader.STORAGE_BACKEND, "postgres");
        ConfigLoader config = new ConfigLoader(properties);

        // When / Then
        assertThatThrownBy(config::engineConfig)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining(ConfigLoader.LEASE_DURATION);
        assertThatThrownBy(config::httpPort).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(config::storageConfig)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("POSTGRES");
    }

    @Test
    @DisplayName("Should read the shared database settings of the jdbc backend")
    void testJdbcBackend() {
        // Given
        Properties properties = new Properties();
        properties.setProperty(ConfigLoader.STORAGE_BACKEND, "jdbc");
        properties.setProperty(ConfigLoader.STORAGE_JDBC_URL, "jdbc:postgresql://db:5432/cronlite");
        properties.setProperty(ConfigLoader.STORAGE_JDBC_USER, "cron");
        properties.setProperty(ConfigLoader.STORAGE_JDBC_PASSWORD, "hunter2");
        properties.setProperty(ConfigLoader.STORAGE_JDBC_POOL_SIZE, "8");

        // When
        StorageConfig storage = new ConfigLoader(properties).storageConfig();

        // Then
        assertThat(storage.getBackend()).isEqualTo(StorageConfig.Backend.JDBC);
        assertThat(storage.getJdbcUrl()).isEqualTo("jdbc:postgresql://db:5432/cronlite");
        assertThat(storage.getJdbcUser()).isEqualTo("cron");
        assertThat(storage.getJdbcPoolSize()).isEqualTo(8);
        assertThat(storage.toString()).doesNotContain("hunter2");
    }

    @Test
    @DisplayName("Should require a url for the jdbc backend")
    void testJdbcWithoutUrl() {
        // Given
        Properties properties = new Properties();
        properties.setProperty(ConfigLoader.STORAGE_BACKEND, "jdbc");

        // When / Then
        assertThatThrownBy(() -> new ConfigLoader(properties).storageConfig())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining(ConfigLoader.STORAGE_JDBC_URL);
    }

    @Test
    @DisplayName("Should reject a missing configuration file")
    void testMissingFile() {
        assertThatThrownBy(() -> ConfigLoader.load(tempDir.resolve("absent.properties"), Map.of()))
                .isInstanceOf(IllegalStateException.class);
    }
}
