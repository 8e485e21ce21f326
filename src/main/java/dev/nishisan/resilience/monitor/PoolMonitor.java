/*
 *  Copyright (C) 2020-2025 Lucas Nishimura <lucas.nishimura at gmail.com>
 *
 *  This program is free software: you can redistribute it and/or modify
 *  it under the terms of the GNU General Public License as published by
 *  the Free Software Foundation, either version 3 of the License, or
 *  (at your option) any later version.
 *
 *  This program is distributed in the hope that it will be useful,
 *  but WITHOUT ANY WARRANTY; without even the implied warranty of
 *  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 *  GNU General Public License for more details.
 *
 *  You should have received a copy of the GNU General Public License
 *  along with this program.  If not, see <https://www.gnu.org/licenses/>
 */

package dev.nishisan.resilience.monitor;

import dev.nishisan.resilience.capability.Monitorable;
import dev.nishisan.resilience.metrics.MetricsRecorder;
import dev.nishisan.resilience.pool.PoolSnapshot;
import dev.nishisan.resilience.pool.PoolThresholds;
import dev.nishisan.resilience.supervisor.AbstractSupervisor;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Periodically compares pool counters against {@link PoolThresholds} and
 * raises rate-limited, severity-tagged {@link PoolAlert}s.
 *
 * <h2>Conditions</h2>
 * <ul>
 * <li>{@value #HIGH_POOL_USAGE}: {@code open / maxOpen} reaches the usage
 * threshold; CRITICAL from {@value #CRITICAL_USAGE}</li>
 * <li>{@value #HIGH_WAIT_DURATION}: cumulative wait time reaches the threshold;
 * CRITICAL above twice the threshold</li>
 * <li>{@value #HIGH_WAIT_COUNT}: cumulative wait count reaches the threshold;
 * CRITICAL above five times the threshold</li>
 * </ul>
 *
 * <p>
 * At most one alert is emitted per cooldown window. When the severity
 * escalates to CRITICAL from anything else, the critical cooldown applies
 * when it is the shorter of the two. A cycle where nothing fires clears the remembered severity.
 * </p>
 */
public final class PoolMonitor extends AbstractSupervisor {

    private static final Logger LOGGER = Logger.getLogger(PoolMonitor.class.getName());

    public static final String HIGH_POOL_USAGE = "high pool usage";
    public static final String HIGH_WAIT_DURATION = "high wait duration";
    public static final String HIGH_WAIT_COUNT = "high wait count";

    public static final double CRITICAL_USAGE = 0.95;
    public static final int CRITICAL_WAIT_DURATION_FACTOR = 2;
    public static final int CRITICAL_WAIT_COUNT_FACTOR = 5;

    public static final Duration DEFAULT_INTERVAL = Duration.ofSeconds(30);
    public static final Duration DEFAULT_COOLDOWN = Duration.ofSeconds(60);
    public static final Duration DEFAULT_CRITICAL_COOLDOWN = Duration.ofSeconds(30);

    private final Monitorable target;
    private final PoolThresholds thresholds;
    private final Duration cooldown;
    private final Duration criticalCooldown;
    private final MetricsRecorder recorder;
    private final Clock clock;
    private final List<PoolAlertListener> listeners = new CopyOnWriteArrayList<>();

    private final ReentrantLock lock = new ReentrantLock();
    private Instant lastAlertTime;
    private AlertSeverity lastSeverity;

    private PoolMonitor(Builder builder) {
        super("pool-monitor", builder.target.name(), builder.interval);
        this.target = builder.target;
        this.thresholds = builder.thresholds;
        this.cooldown = builder.cooldown;
        this.criticalCooldown = builder.criticalCooldown;
        this.recorder = builder.recorder;
        this.clock = builder.clock;
    }

    public void addListener(PoolAlertListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeListener(PoolAlertListener listener) {
        listeners.remove(listener);
    }

    public int listenerCount() {
        return listeners.size();
    }

    @Override
    protected void tick() {
        evaluate();
    }

    /**
     * Takes one snapshot, records it and evaluates the thresholds.
     *
     * @return the alert emitted by this cycle, if any
     */
    Optional<PoolAlert> evaluate() {
        PoolSnapshot stats = target.getStats();
        if (stats == null) {
            return Optional.empty();
        }
        recorder.recordPoolStats(stats);

        List<String> reasons = new ArrayList<>(3);
        AlertSeverity severity = AlertSeverity.WARNING;

        if (stats.maxOpen() > 0) {
            double usage = stats.usageRatio();
            if (usage >= thresholds.usagePercentage()) {
                reasons.add(HIGH_POOL_USAGE);
                if (usage >= CRITICAL_USAGE) {
                    severity = AlertSeverity.CRITICAL;
                }
            }
        }

        Duration waited = stats.waitDuration();
        if (!waited.isZero() && waited.compareTo(thresholds.waitDuration()) >= 0) {
            reasons.add(HIGH_WAIT_DURATION);
            if (exceedsMultiple(waited, thresholds.waitDuration(), CRITICAL_WAIT_DURATION_FACTOR)) {
                severity = AlertSeverity.CRITICAL;
            }
        }

        long waits = stats.waitCount();
        if (waits > 0 && waits >= thresholds.waitCount()) {
            reasons.add(HIGH_WAIT_COUNT);
            if (exceedsMultiple(waits, thresholds.waitCount(), CRITICAL_WAIT_COUNT_FACTOR)) {
                severity = AlertSeverity.CRITICAL;
            }
        }

        PoolAlert alert;
        lock.lock();
        try {
            if (reasons.isEmpty()) {
                lastSeverity = null;
                return Optional.empty();
            }
            boolean escalating = severity == AlertSeverity.CRITICAL && lastSeverity != AlertSeverity.CRITICAL;
            Duration effective = escalating && criticalCooldown.compareTo(cooldown) < 0
                    ? criticalCooldown
                    : cooldown;
            Instant now = clock.instant();
            if (lastAlertTime != null && Duration.between(lastAlertTime, now).compareTo(effective) < 0) {
                return Optional.empty();
            }
            lastAlertTime = now;
            lastSeverity = severity;
            alert = new PoolAlert(target.name(), severity, reasons, stats, now);
        } finally {
            lock.unlock();
        }
        dispatch(alert);
        return Optional.of(alert);
    }

    /**
     * {@code value > threshold * factor}, where a product beyond the range of
     * the type is never exceeded.
     */
    static boolean exceedsMultiple(long value, long threshold, int factor) {
        if (threshold > Long.MAX_VALUE / factor) {
            return false;
        }
        return value > threshold * factor;
    }

    static boolean exceedsMultiple(Duration value, Duration threshold, int factor) {
        Duration limit;
        try {
            limit = threshold.multipliedBy(factor);
        } catch (ArithmeticException e) {
            return false;
        }
        return value.compareTo(limit) > 0;
    }

    private void dispatch(PoolAlert alert) {
        LOGGER.warning(alert::describe);
        for (PoolAlertListener listener : listeners) {
            try {
                listener.onAlert(alert);
            } catch (Throwable t) {
                LOGGER.log(Level.WARNING, "Pool alert listener threw exception", t);
            }
        }
    }

    /**
     * @return the severity of the last emitted alert, or {@code null} when the
     * last cycle found nothing
     */
    AlertSeverity lastSeverity() {
        lock.lock();
        try {
            return lastSeverity;
        } finally {
            lock.unlock();
        }
    }

    public PoolThresholds thresholds() {
        return thresholds;
    }

    // ── Builder ──

    /**
     * Creates a builder for a pool monitor.
     *
     * @param target the resource to monitor
     * @return the builder
     */
    public static Builder builder(Monitorable target) {
        return new Builder(target);
    }

    /**
     * Builder for {@link PoolMonitor}.
     */
    public static final class Builder {
        private final Monitorable target;
        private Duration interval = DEFAULT_INTERVAL;
        private PoolThresholds thresholds = PoolThresholds.defaults();
        private Duration cooldown = DEFAULT_COOLDOWN;
        private Duration criticalCooldown = DEFAULT_CRITICAL_COOLDOWN;
        private MetricsRecorder recorder = MetricsRecorder.noOp();
        private Clock clock = Clock.systemUTC();

        private Builder(Monitorable target) {
            this.target = Objects.requireNonNull(target, "target");
        }

        public Builder interval(Duration interval) {
            this.interval = Objects.requireNonNull(interval, "interval");
            return this;
        }

        /**
         * Sets the thresholds; {@code null} restores the defaults.
         *
         * @param thresholds the thresholds
         * @return this builder
         */
        public Builder thresholds(PoolThresholds thresholds) {
            this.thresholds = thresholds != null ? thresholds : PoolThresholds.defaults();
            return this;
        }

        public Builder cooldown(Duration cooldown) {
            this.cooldown = requireNotNegative(cooldown, "cooldown");
            return this;
        }

        public Builder criticalCooldown(Duration criticalCooldown) {
            this.criticalCooldown = requireNotNegative(criticalCooldown, "criticalCooldown");
            return this;
        }

        public Builder recorder(MetricsRecorder recorder) {
            this.recorder = Objects.requireNonNull(recorder, "recorder");
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        public PoolMonitor build() {
            return new PoolMonitor(this);
        }

        private static Duration requireNotNegative(Duration value, String name) {
            Objects.requireNonNull(value, name);
            if (value.isNegative()) {
                throw new IllegalArgumentException(name + " must not be negative");
            }
            return value;
        }
    }
}
