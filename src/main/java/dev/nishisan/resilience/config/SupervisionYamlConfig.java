package dev.nishisan.resilience.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * File model of the supervision settings, deserialized from YAML/JSON.
 * Durations are strings such as {@code 30s}, {@code 5m}, {@code 250ms} or
 * ISO-8601 {@code PT10S}; missing sections fall back to the defaults of
 * {@link SupervisionConfig}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class SupervisionYamlConfig {

    @JsonProperty("health")
    private HealthConfig health;

    @JsonProperty("retry")
    private RetryConfig retry;

    @JsonProperty("monitor")
    private MonitorConfig monitor;

    @JsonProperty("reconnect")
    private ReconnectConfig reconnect;

    @JsonProperty("leakDetection")
    private LeakDetectionConfig leakDetection;

    @JsonProperty("slowQuery")
    private SlowQueryConfig slowQuery;

    public HealthConfig getHealth() {
        return health;
    }

    public void setHealth(HealthConfig health) {
        this.health = health;
    }

    public RetryConfig getRetry() {
        return retry;
    }

    public void setRetry(RetryConfig retry) {
        this.retry = retry;
    }

    public MonitorConfig getMonitor() {
        return monitor;
    }

    public void setMonitor(MonitorConfig monitor) {
        this.monitor = monitor;
    }

    public ReconnectConfig getReconnect() {
        return reconnect;
    }

    public void setReconnect(ReconnectConfig reconnect) {
        this.reconnect = reconnect;
    }

    public LeakDetectionConfig getLeakDetection() {
        return leakDetection;
    }

    public void setLeakDetection(LeakDetectionConfig leakDetection) {
        this.leakDetection = leakDetection;
    }

    public SlowQueryConfig getSlowQuery() {
        return slowQuery;
    }

    public void setSlowQuery(SlowQueryConfig slowQuery) {
        this.slowQuery = slowQuery;
    }

    /**
     * Health check settings. An interval of zero disables the checker.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class HealthConfig {
        private String interval;
        private String query;
        private Integer maxFailures;

        public String getInterval() {
            return interval;
        }

        public void setInterval(String interval) {
            this.interval = interval;
        }

        public String getQuery() {
            return query;
        }

        public void setQuery(String query) {
            this.query = query;
        }

        public Integer getMaxFailures() {
            return maxFailures;
        }

        public void setMaxFailures(Integer maxFailures) {
            this.maxFailures = maxFailures;
        }
    }

    /**
     * Startup connect retry settings.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RetryConfig {
        private boolean enabled;
        private Integer maxAttempts;
        private String initialDelay;
        private String maxDelay;
        private Double multiplier;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Integer getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(Integer maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public String getInitialDelay() {
            return initialDelay;
        }

        public void setInitialDelay(String initialDelay) {
            this.initialDelay = initialDelay;
        }

        public String getMaxDelay() {
            return maxDelay;
        }

        public void setMaxDelay(String maxDelay) {
            this.maxDelay = maxDelay;
        }

        public Double getMultiplier() {
            return multiplier;
        }

        public void setMultiplier(Double multiplier) {
            this.multiplier = multiplier;
        }
    }

    /**
     * Pool monitor settings.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class MonitorConfig {
        private boolean enabled;
        private String interval;
        private Double usageThreshold;
        private String waitThreshold;
        private Long waitCountThreshold;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getInterval() {
            return interval;
        }

        public void setInterval(String interval) {
            this.interval = interval;
        }

        public Double getUsageThreshold() {
            return usageThreshold;
        }

        public void setUsageThreshold(Double usageThreshold) {
            this.usageThreshold = usageThreshold;
        }

        public String getWaitThreshold() {
            return waitThreshold;
        }

        public void setWaitThreshold(String waitThreshold) {
            this.waitThreshold = waitThreshold;
        }

        public Long getWaitCountThreshold() {
            return waitCountThreshold;
        }

        public void setWaitCountThreshold(Long waitCountThreshold) {
            this.waitCountThreshold = waitCountThreshold;
        }
    }

    /**
     * Runtime auto-reconnect settings.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ReconnectConfig {
        private boolean enabled = true;
        private String interval;
        private Integer maxAttempts;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getInterval() {
            return interval;
        }

        public void setInterval(String interval) {
            this.interval = interval;
        }

        public Integer getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(Integer maxAttempts) {
            this.maxAttempts = maxAttempts;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class LeakDetectionConfig {
        private boolean enabled;
        private String threshold;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getThreshold() {
            return threshold;
        }

        public void setThreshold(String threshold) {
            this.threshold = threshold;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SlowQueryConfig {
        private boolean enabled;
        private String threshold;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getThreshold() {
            return threshold;
        }

        public void setThreshold(String threshold) {
            this.threshold = threshold;
        }
    }
}
