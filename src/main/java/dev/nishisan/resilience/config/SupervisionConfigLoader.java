package dev.nishisan.resilience.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import dev.nishisan.resilience.pool.PoolThresholds;
import dev.nishisan.resilience.reconnect.RetryPolicy;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads {@link SupervisionYamlConfig} files and converts them to
 * {@link SupervisionConfig}. Placeholders of the form {@code ${VAR}} and
 * {@code ${VAR:default}} are resolved against the environment before parsing.
 */
public class SupervisionConfigLoader {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\$\\{([^}]+)\\}");
    private static final ObjectMapper mapper;

    static {
        YAMLFactory yamlFactory = new YAMLFactory()
                .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
                .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES);
        mapper = new ObjectMapper(yamlFactory);
    }

    private SupervisionConfigLoader() {
    }

    public static SupervisionYamlConfig load(Path yamlFile) throws IOException {
        return load(yamlFile, System::getenv);
    }

    public static SupervisionYamlConfig load(Path yamlFile, Function<String, String> envProvider) throws IOException {
        String content = Files.readString(yamlFile);
        String processedContent = resolveVariables(content, envProvider);
        if (processedContent.isBlank()) {
            return new SupervisionYamlConfig();
        }
        SupervisionYamlConfig config = mapper.readValue(processedContent, SupervisionYamlConfig.class);
        return config != null ? config : new SupervisionYamlConfig();
    }

    /**
     * Loads and converts in one step.
     */
    public static SupervisionConfig loadDomain(Path yamlFile) throws IOException {
        return convertToDomain(load(yamlFile));
    }

    public static void save(Path yamlFile, SupervisionYamlConfig config) throws IOException {
        mapper.writeValue(yamlFile.toFile(), config);
    }

    private static String resolveVariables(String content, Function<String, String> envProvider) {
        Matcher matcher = PLACEHOLDER.matcher(content);
        StringBuilder builder = new StringBuilder();
        int i = 0;
        while (matcher.find()) {
            String replacement = getReplacement(matcher.group(1), envProvider);
            builder.append(content, i, matcher.start());
            builder.append(replacement);
            i = matcher.end();
        }
        builder.append(content.substring(i));
        return builder.toString();
    }

    private static String getReplacement(String group, Function<String, String> envProvider) {
        String[] parts = group.split(":", 2);
        String varName = parts[0];
        String defaultValue = parts.length > 1 ? parts[1] : null;

        String value = envProvider.apply(varName);
        if (value != null) {
            return value;
        }
        if (defaultValue != null) {
            return defaultValue;
        }
        throw new IllegalArgumentException(
                "Environment variable or property '" + varName + "' not found and no default value provided.");
    }

    /**
     * Converts the file model to the domain value. Missing sections and fields
     * keep the defaults of {@link SupervisionConfig.Builder}.
     *
     * @param yamlConfig the parsed file
     * @return the domain configuration
     * @throws IllegalArgumentException when a value is out of range or a duration cannot be parsed
     */
    public static SupervisionConfig convertToDomain(SupervisionYamlConfig yamlConfig) {
        SupervisionConfig.Builder builder = SupervisionConfig.builder();
        if (yamlConfig == null) {
            return builder.build();
        }

        SupervisionYamlConfig.HealthConfig health = yamlConfig.getHealth();
        if (health != null) {
            Duration interval = parseDuration(health.getInterval());
            if (interval != null) {
                builder.healthCheckInterval(interval);
            }
            builder.healthCheckQuery(health.getQuery());
            if (health.getMaxFailures() != null) {
                builder.healthMaxFailures(health.getMaxFailures());
            }
        }

        SupervisionYamlConfig.RetryConfig retry = yamlConfig.getRetry();
        if (retry != null) {
            builder.retryEnabled(retry.isEnabled());
            RetryPolicy defaults = RetryPolicy.defaults();
            Duration initialDelay = parseDuration(retry.getInitialDelay());
            Duration maxDelay = parseDuration(retry.getMaxDelay());
            builder.retryPolicy(new RetryPolicy(
                    retry.getMaxAttempts() != null ? retry.getMaxAttempts() : defaults.maxAttempts(),
                    initialDelay != null ? initialDelay : defaults.initialDelay(),
                    maxDelay != null ? maxDelay : defaults.maxDelay(),
                    retry.getMultiplier() != null ? retry.getMultiplier() : defaults.multiplier()));
        }

        SupervisionYamlConfig.MonitorConfig monitor = yamlConfig.getMonitor();
        if (monitor != null) {
            builder.monitorEnabled(monitor.isEnabled());
            Duration interval = parseDuration(monitor.getInterval());
            if (interval != null) {
                builder.monitorInterval(interval);
            }
            Duration waitThreshold = parseDuration(monitor.getWaitThreshold());
            builder.thresholds(new PoolThresholds(
                    monitor.getUsageThreshold() != null
                            ? monitor.getUsageThreshold()
                            : PoolThresholds.DEFAULT_USAGE_PERCENTAGE,
                    waitThreshold != null ? waitThreshold : PoolThresholds.DEFAULT_WAIT_DURATION,
                    monitor.getWaitCountThreshold() != null
                            ? monitor.getWaitCountThreshold()
                            : PoolThresholds.DEFAULT_WAIT_COUNT));
        }

        SupervisionYamlConfig.ReconnectConfig reconnect = yamlConfig.getReconnect();
        if (reconnect != null) {
            builder.autoReconnectEnabled(reconnect.isEnabled());
            Duration interval = parseDuration(reconnect.getInterval());
            if (interval != null) {
                builder.autoReconnectInterval(interval);
            }
            if (reconnect.getMaxAttempts() != null) {
                builder.autoReconnectMaxAttempts(reconnect.getMaxAttempts());
            }
        }

        SupervisionYamlConfig.LeakDetectionConfig leak = yamlConfig.getLeakDetection();
        if (leak != null) {
            builder.leakDetectionEnabled(leak.isEnabled());
            Duration threshold = parseDuration(leak.getThreshold());
            if (threshold != null) {
                builder.leakDetectionThreshold(threshold);
            }
        }

        SupervisionYamlConfig.SlowQueryConfig slowQuery = yamlConfig.getSlowQuery();
        if (slowQuery != null) {
            builder.slowQueryEnabled(slowQuery.isEnabled());
            Duration threshold = parseDuration(slowQuery.getThreshold());
            if (threshold != null) {
                builder.slowQueryThreshold(threshold);
            }
        }

        return builder.build();
    }

    /**
     * Parses ISO-8601 ({@code PT10S}) or the short forms {@code 250ms},
     * {@code 30s}, {@code 5m}, {@code 2h}; a bare number is read as seconds.
     *
     * @param s the text, may be {@code null}
     * @return the duration, or {@code null} for blank input
     */
    static Duration parseDuration(String s) {
        if (s == null || s.isBlank()) {
            return null;
        }
        String value = s.trim().toUpperCase();
        try {
            return Duration.parse(value);
        } catch (DateTimeParseException e) {
            try {
                if (value.endsWith("MS")) {
                    return Duration.ofMillis(Long.parseLong(value.substring(0, value.length() - 2).trim()));
                } else if (value.endsWith("H")) {
                    return Duration.ofHours(Long.parseLong(value.substring(0, value.length() - 1).trim()));
                } else if (value.endsWith("M")) {
                    return Duration.ofMinutes(Long.parseLong(value.substring(0, value.length() - 1).trim()));
                } else if (value.endsWith("S")) {
                    return Duration.ofSeconds(Long.parseLong(value.substring(0, value.length() - 1).trim()));
                }
                return Duration.ofSeconds(Long.parseLong(value));
            } catch (NumberFormatException nfe) {
                throw new IllegalArgumentException("Invalid duration: '" + s + "'", nfe);
            }
        }
    }
}
