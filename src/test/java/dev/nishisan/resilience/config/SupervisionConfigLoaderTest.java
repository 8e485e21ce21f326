package dev.nishisan.resilience.config;

import dev.nishisan.resilience.pool.PoolThresholds;
import dev.nishisan.resilience.reconnect.RetryPolicy;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SupervisionConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldLoadFullConfig() throws IOException {
        Path yamlFile = tempDir.resolve("supervision.yaml");
        Files.writeString(yamlFile,
                "health:\n" +
                "  interval: 10s\n" +
                "  query: SELECT 1\n" +
                "  maxFailures: 5\n" +
                "retry:\n" +
                "  enabled: true\n" +
                "  maxAttempts: 4\n" +
                "  initialDelay: 500ms\n" +
                "  maxDelay: 10s\n" +
                "  multiplier: 1.5\n" +
                "monitor:\n" +
                "  enabled: true\n" +
                "  interval: 1m\n" +
                "  usageThreshold: 0.7\n" +
                "  waitThreshold: PT2S\n" +
                "  waitCountThreshold: 3\n" +
                "reconnect:\n" +
                "  enabled: false\n" +
                "  interval: 2s\n" +
                "  maxAttempts: 7\n" +
                "leakDetection:\n" +
                "  enabled: true\n" +
                "  threshold: 2m\n" +
                "slowQuery:\n" +
                "  enabled: true\n" +
                "  threshold: 250ms\n" +
                "somethingElse: ignored\n");

        SupervisionConfig config = SupervisionConfigLoader.convertToDomain(
                SupervisionConfigLoader.load(yamlFile, name -> null));

        assertEquals(Duration.ofSeconds(10), config.healthCheckInterval());
        assertEquals("SELECT 1", config.healthCheckQuery());
        assertEquals(5, config.healthMaxFailures());
        assertTrue(config.retryEnabled());
        assertEquals(new RetryPolicy(4, Duration.ofMillis(500), Duration.ofSeconds(10), 1.5), config.retryPolicy());
        assertTrue(config.monitorEnabled());
        assertEquals(Duration.ofMinutes(1), config.monitorInterval());
        assertEquals(new PoolThresholds(0.7, Duration.ofSeconds(2), 3), config.thresholds());
        assertFalse(config.autoReconnectEnabled());
        assertEquals(Duration.ofSeconds(2), config.autoReconnectInterval());
        assertEquals(7, config.autoReconnectMaxAttempts());
        assertTrue(config.leakDetectionEnabled());
        assertEquals(Duration.ofMinutes(2), config.leakDetectionThreshold());
        assertTrue(config.slowQueryEnabled());
        assertEquals(Duration.ofMillis(250), config.slowQueryThreshold());
    }

    @Test
    void missingSectionsKeepDefaults() throws IOException {
        Path yamlFile = tempDir.resolve("partial.yaml");
        Files.writeString(yamlFile, "health:\n  query: SELECT 1\n");

        SupervisionConfig config = SupervisionConfigLoader.convertToDomain(
                SupervisionConfigLoader.load(yamlFile, name -> null));

        assertEquals(Duration.ofSeconds(30), config.healthCheckInterval());
        assertTrue(config.healthCheckEnabled());
        assertEquals(3, config.healthMaxFailures());
        assertFalse(config.retryEnabled());
        assertEquals(RetryPolicy.defaults(), config.retryPolicy());
        assertFalse(config.monitorEnabled());
        assertEquals(PoolThresholds.defaults(), config.thresholds());
        assertTrue(config.autoReconnectEnabled());
        assertEquals(Duration.ofSeconds(5), config.autoReconnectInterval());
        assertEquals(0, config.autoReconnectMaxAttempts());
        assertFalse(config.leakDetectionEnabled());
        assertEquals(Duration.ofSeconds(300), config.leakDetectionThreshold());
        assertFalse(config.slowQueryEnabled());
        assertEquals(Duration.ofSeconds(1), config.slowQueryThreshold());
    }

    @Test
    void emptyFileYieldsDefaults() throws IOException {
        Path yamlFile = tempDir.resolve("empty.yaml");
        Files.writeString(yamlFile, "");

        SupervisionYamlConfig yaml = SupervisionConfigLoader.load(yamlFile, name -> null);

        assertNotNull(yaml);
        SupervisionConfig config = SupervisionConfigLoader.convertToDomain(yaml);
        assertTrue(config.autoReconnectEnabled());
        assertFalse(config.monitorEnabled());
    }

    @Test
    void zeroHealthIntervalDisablesHealthChecks() throws IOException {
        Path yamlFile = tempDir.resolve("no-health.yaml");
        Files.writeString(yamlFile, "health:\n  interval: 0s\n");

        SupervisionConfig config = SupervisionConfigLoader.convertToDomain(
                SupervisionConfigLoader.load(yamlFile, name -> null));

        assertFalse(config.healthCheckEnabled());
    }

    @Test
    void shouldInterpolateVariables() throws IOException {
        Path yamlFile = tempDir.resolve("interpolated.yaml");
        Files.writeString(yamlFile,
                "health:\n" +
                "  interval: ${HEALTH_INTERVAL}\n" +
                "  query: ${HEALTH_QUERY:SELECT 1}\n" +
                "monitor:\n" +
                "  enabled: ${MONITOR_ENABLED:false}\n");

        Map<String, String> env = new HashMap<>();
        env.put("HEALTH_INTERVAL", "15s");
        env.put("MONITOR_ENABLED", "true");

        SupervisionYamlConfig yaml = SupervisionConfigLoader.load(yamlFile, env::get);

        assertEquals("15s", yaml.getHealth().getInterval());
        assertEquals("SELECT 1", yaml.getHealth().getQuery());
        assertTrue(yaml.getMonitor().isEnabled());
    }

    @Test
    void shouldFailWhenVariableMissingAndNoDefault() throws IOException {
        Path yamlFile = tempDir.resolve("missing.yaml");
        Files.writeString(yamlFile, "health:\n  interval: ${MISSING_VAR}\n");

        IllegalArgumentException exception = assertThrows(IllegalArgumentException.class,
                () -> SupervisionConfigLoader.load(yamlFile, name -> null));

        assertTrue(exception.getMessage().contains("MISSING_VAR"));
    }

    @Test
    void invalidDurationIsRejected() throws IOException {
        Path yamlFile = tempDir.resolve("bad.yaml");
        Files.writeString(yamlFile, "slowQuery:\n  threshold: soon\n");
        SupervisionYamlConfig yaml = SupervisionConfigLoader.load(yamlFile, name -> null);

        assertThrows(IllegalArgumentException.class, () -> SupervisionConfigLoader.convertToDomain(yaml));
    }

    @Test
    void outOfRangeValuesAreRejected() {
        SupervisionYamlConfig yaml = new SupervisionYamlConfig();
        SupervisionYamlConfig.MonitorConfig monitor = new SupervisionYamlConfig.MonitorConfig();
        monitor.setUsageThreshold(1.5);
        yaml.setMonitor(monitor);

        assertThrows(IllegalArgumentException.class, () -> SupervisionConfigLoader.convertToDomain(yaml));
    }

    @Test
    void parsesShortAndIsoDurations() {
        assertEquals(Duration.ofMillis(250), SupervisionConfigLoader.parseDuration("250ms"));
        assertEquals(Duration.ofSeconds(30), SupervisionConfigLoader.parseDuration("30s"));
        assertEquals(Duration.ofMinutes(5), SupervisionConfigLoader.parseDuration("5m"));
        assertEquals(Duration.ofHours(2), SupervisionConfigLoader.parseDuration("2h"));
        assertEquals(Duration.ofSeconds(45), SupervisionConfigLoader.parseDuration("45"));
        assertEquals(Duration.ofSeconds(10), SupervisionConfigLoader.parseDuration("PT10S"));
        assertNull(SupervisionConfigLoader.parseDuration(" "));
        assertNull(SupervisionConfigLoader.parseDuration(null));
    }

    @Test
    void saveAndLoadPreservesSettings() throws IOException {
        SupervisionYamlConfig yaml = new SupervisionYamlConfig();
        SupervisionYamlConfig.SlowQueryConfig slowQuery = new SupervisionYamlConfig.SlowQueryConfig();
        slowQuery.setEnabled(true);
        slowQuery.setThreshold("2s");
        yaml.setSlowQuery(slowQuery);

        Path yamlFile = tempDir.resolve("saved.yaml");
        SupervisionConfigLoader.save(yamlFile, yaml);
        SupervisionConfig config = SupervisionConfigLoader.convertToDomain(
                SupervisionConfigLoader.load(yamlFile, name -> null));

        assertTrue(config.slowQueryEnabled());
        assertEquals(Duration.ofSeconds(2), config.slowQueryThreshold());
    }

    @Test
    void nullYamlYieldsDefaults() {
        SupervisionConfig config = SupervisionConfigLoader.convertToDomain(null);
        assertEquals(SupervisionConfig.defaults().healthCheckInterval(), config.healthCheckInterval());
        assertTrue(config.autoReconnectEnabled());
    }
}
