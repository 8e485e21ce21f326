package dev.nishisan.resilience.config;

import dev.nishisan.resilience.health.HealthChecker;
import dev.nishisan.resilience.monitor.LeakDetector;
import dev.nishisan.resilience.monitor.PoolMonitor;
import dev.nishisan.resilience.pool.PoolThresholds;
import dev.nishisan.resilience.reconnect.AutoReconnector;
import dev.nishisan.resilience.reconnect.RetryPolicy;

import java.time.Duration;
import java.util.Objects;

/**
 * Immutable supervision settings for one resource. Values are already
 * parsed; {@link SupervisionConfigLoader} produces one from YAML.
 */
public final class SupervisionConfig {

    public static final Duration DEFAULT_HEALTH_CHECK_INTERVAL = Duration.ofSeconds(30);
    public static final Duration DEFAULT_SLOW_QUERY_THRESHOLD = Duration.ofSeconds(1);

    private final Duration healthCheckInterval;
    private final String healthCheckQuery;
    private final int healthMaxFailures;
    private final boolean retryEnabled;
    private final RetryPolicy retryPolicy;
    private final boolean monitorEnabled;
    private final Duration monitorInterval;
    private final PoolThresholds thresholds;
    private final boolean autoReconnectEnabled;
    private final Duration autoReconnectInterval;
    private final int autoReconnectMaxAttempts;
    private final boolean leakDetectionEnabled;
    private final Duration leakDetectionThreshold;
    private final boolean slowQueryEnabled;
    private final Duration slowQueryThreshold;

    private SupervisionConfig(Builder builder) {
        this.healthCheckInterval = builder.healthCheckInterval;
        this.healthCheckQuery = builder.healthCheckQuery;
        this.healthMaxFailures = builder.healthMaxFailures;
        this.retryEnabled = builder.retryEnabled;
        this.retryPolicy = builder.retryPolicy;
        this.monitorEnabled = builder.monitorEnabled;
        this.monitorInterval = builder.monitorInterval;
        this.thresholds = builder.thresholds;
        this.autoReconnectEnabled = builder.autoReconnectEnabled;
        this.autoReconnectInterval = builder.autoReconnectInterval;
        this.autoReconnectMaxAttempts = builder.autoReconnectMaxAttempts;
        this.leakDetectionEnabled = builder.leakDetectionEnabled;
        this.leakDetectionThreshold = builder.leakDetectionThreshold;
        this.slowQueryEnabled = builder.slowQueryEnabled;
        this.slowQueryThreshold = builder.slowQueryThreshold;
    }

    public static SupervisionConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return {@code true} when the health checker should run
     */
    public boolean healthCheckEnabled() {
        return !healthCheckInterval.isZero();
    }

    public Duration healthCheckInterval() {
        return healthCheckInterval;
    }

    public String healthCheckQuery() {
        return healthCheckQuery;
    }

    public int healthMaxFailures() {
        return healthMaxFailures;
    }

    public boolean retryEnabled() {
        return retryEnabled;
    }

    public RetryPolicy retryPolicy() {
        return retryPolicy;
    }

    public boolean monitorEnabled() {
        return monitorEnabled;
    }

    public Duration monitorInterval() {
        return monitorInterval;
    }

    public PoolThresholds thresholds() {
        return thresholds;
    }

    public boolean autoReconnectEnabled() {
        return autoReconnectEnabled;
    }

    public Duration autoReconnectInterval() {
        return autoReconnectInterval;
    }

    public int autoReconnectMaxAttempts() {
        return autoReconnectMaxAttempts;
    }

    public boolean leakDetectionEnabled() {
        return leakDetectionEnabled;
    }

    public Duration leakDetectionThreshold() {
        return leakDetectionThreshold;
    }

    public boolean slowQueryEnabled() {
        return slowQueryEnabled;
    }

    public Duration slowQueryThreshold() {
        return slowQueryThreshold;
    }

    /**
     * Builder for {@link SupervisionConfig}.
     */
    public static final class Builder {
        private Duration healthCheckInterval = DEFAULT_HEALTH_CHECK_INTERVAL;
        private String healthCheckQuery;
        private int healthMaxFailures = HealthChecker.DEFAULT_MAX_FAILURES;
        private boolean retryEnabled = false;
        private RetryPolicy retryPolicy = RetryPolicy.defaults();
        private boolean monitorEnabled = false;
        private Duration monitorInterval = PoolMonitor.DEFAULT_INTERVAL;
        private PoolThresholds thresholds = PoolThresholds.defaults();
        private boolean autoReconnectEnabled = true;
        private Duration autoReconnectInterval = AutoReconnector.DEFAULT_INTERVAL;
        private int autoReconnectMaxAttempts = 0;
        private boolean leakDetectionEnabled = false;
        private Duration leakDetectionThreshold = LeakDetector.DEFAULT_WAIT_THRESHOLD;
        private boolean slowQueryEnabled = false;
        private Duration slowQueryThreshold = DEFAULT_SLOW_QUERY_THRESHOLD;

        private Builder() {
        }

        /**
         * Sets the health check interval; {@link Duration#ZERO} disables health checking.
         *
         * @param interval the interval
         * @return this builder
         */
        public Builder healthCheckInterval(Duration interval) {
            Objects.requireNonNull(interval, "interval");
            if (interval.isNegative()) {
                throw new IllegalArgumentException("healthCheckInterval must not be negative");
            }
            this.healthCheckInterval = interval;
            return this;
        }

        public Builder healthCheckQuery(String query) {
            this.healthCheckQuery = query;
            return this;
        }

        public Builder healthMaxFailures(int maxFailures) {
            if (maxFailures < 1) {
                throw new IllegalArgumentException("healthMaxFailures must be at least 1: " + maxFailures);
            }
            this.healthMaxFailures = maxFailures;
            return this;
        }

        public Builder retryEnabled(boolean enabled) {
            this.retryEnabled = enabled;
            return this;
        }

        public Builder retryPolicy(RetryPolicy policy) {
            this.retryPolicy = Objects.requireNonNull(policy, "policy");
            return this;
        }

        public Builder monitorEnabled(boolean enabled) {
            this.monitorEnabled = enabled;
            return this;
        }

        public Builder monitorInterval(Duration interval) {
            this.monitorInterval = requirePositive(interval, "monitorInterval");
            return this;
        }

        public Builder thresholds(PoolThresholds thresholds) {
            this.thresholds = Objects.requireNonNull(thresholds, "thresholds");
            return this;
        }

        public Builder autoReconnectEnabled(boolean enabled) {
            this.autoReconnectEnabled = enabled;
            return this;
        }

        public Builder autoReconnectInterval(Duration interval) {
            this.autoReconnectInterval = requirePositive(interval, "autoReconnectInterval");
            return this;
        }

        /**
         * @param maxAttempts consecutive failed attempts before giving up, {@code 0} for unlimited
         * @return this builder
         */
        public Builder autoReconnectMaxAttempts(int maxAttempts) {
            if (maxAttempts < 0) {
                throw new IllegalArgumentException("autoReconnectMaxAttempts must not be negative: " + maxAttempts);
            }
            this.autoReconnectMaxAttempts = maxAttempts;
            return this;
        }

        public Builder leakDetectionEnabled(boolean enabled) {
            this.leakDetectionEnabled = enabled;
            return this;
        }

        public Builder leakDetectionThreshold(Duration threshold) {
            Objects.requireNonNull(threshold, "threshold");
            if (threshold.isNegative()) {
                throw new IllegalArgumentException("leakDetectionThreshold must not be negative");
            }
            this.leakDetectionThreshold = threshold;
            return this;
        }

        public Builder slowQueryEnabled(boolean enabled) {
            this.slowQueryEnabled = enabled;
            return this;
        }

        public Builder slowQueryThreshold(Duration threshold) {
            Objects.requireNonNull(threshold, "threshold");
            if (threshold.isNegative()) {
                throw new IllegalArgumentException("slowQueryThreshold must not be negative");
            }
            this.slowQueryThreshold = threshold;
            return this;
        }

        public SupervisionConfig build() {
            return new SupervisionConfig(this);
        }

        private static Duration requirePositive(Duration value, String name) {
            Objects.requireNonNull(value, name);
            if (value.isZero() || value.isNegative()) {
                throw new IllegalArgumentException(name + " must be positive: " + value);
            }
            return value;
        }
    }
}
