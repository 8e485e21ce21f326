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

package dev.nishisan.resilience.health;

import dev.nishisan.resilience.capability.HealthCheckable;
import dev.nishisan.resilience.capability.Recoverable;
import dev.nishisan.resilience.capability.ResourceException;
import dev.nishisan.resilience.metrics.MetricsRecorder;
import dev.nishisan.resilience.supervisor.AbstractSupervisor;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Logger;

/**
 * Polls a resource's liveness and tracks the current failure streak.
 * <p>
 * The checker starts optimistic ({@code healthy = true}). A failed probe marks
 * the resource unhealthy and extends the streak; only the first failure after
 * a healthy period is logged. Whenever the streak reaches a multiple of
 * {@code maxFailures} and the target is also {@link Recoverable}, one recovery
 * attempt is made. A successful probe or recovery resets the streak.
 * <p>
 * The state lock is released while {@link Recoverable#reconnect()} runs, so
 * {@link #isHealthy()} never waits on a slow reconnect.
 */
public final class HealthChecker extends AbstractSupervisor {

    private static final Logger LOGGER = Logger.getLogger(HealthChecker.class.getName());

    public static final int DEFAULT_MAX_FAILURES = 3;

    private final HealthCheckable target;
    private final Recoverable recoverable;
    private final String probe;
    private final int maxFailures;
    private final MetricsRecorder recorder;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private Instant lastCheckTime;
    private boolean healthy = true;
    private int consecutiveFailures;

    public HealthChecker(HealthCheckable target, Duration interval) {
        this(target, interval, null);
    }

    public HealthChecker(HealthCheckable target, Duration interval, String probe) {
        this(target, interval, probe, DEFAULT_MAX_FAILURES, MetricsRecorder.noOp());
    }

    /**
     * @param target      the resource to probe
     * @param interval    time between probes
     * @param probe       optional payload handed to {@link HealthCheckable#checkHealth(String)}
     * @param maxFailures streak length that triggers a recovery attempt, at least 1
     * @param recorder    sink for probe outcomes
     */
    public HealthChecker(HealthCheckable target, Duration interval, String probe, int maxFailures,
                         MetricsRecorder recorder) {
        this(target, interval, probe, maxFailures, recorder, Clock.systemUTC());
    }

    HealthChecker(HealthCheckable target, Duration interval, String probe, int maxFailures,
                  MetricsRecorder recorder, Clock clock) {
        super("health-checker", Objects.requireNonNull(target, "target").name(), interval);
        if (maxFailures < 1) {
            throw new IllegalArgumentException("maxFailures must be at least 1: " + maxFailures);
        }
        this.target = target;
        this.recoverable = target instanceof Recoverable ? (Recoverable) target : null;
        this.probe = probe == null || probe.isBlank() ? null : probe;
        this.maxFailures = maxFailures;
        this.recorder = Objects.requireNonNull(recorder, "recorder");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    protected void tick() {
        check();
    }

    /**
     * Runs one probe and, if the streak crossed the threshold, one recovery.
     */
    void check() {
        Exception failure = probeTarget();
        recorder.recordHealthCheck(failure == null);

        int streak;
        lock.lock();
        try {
            lastCheckTime = clock.instant();
            if (failure == null) {
                if (!healthy) {
                    int previous = consecutiveFailures;
                    LOGGER.info(() -> "Health check recovered for " + target.name()
                            + " after " + previous + " consecutive failure(s)");
                }
                consecutiveFailures = 0;
                healthy = true;
                return;
            }
            consecutiveFailures++;
            if (healthy) {
                LOGGER.warning(() -> "Health check failed for " + target.name() + ": " + failure.getMessage());
            }
            healthy = false;
            streak = consecutiveFailures;
        } finally {
            lock.unlock();
        }

        if (recoverable != null && streak % maxFailures == 0) {
            attemptRecovery(streak);
        }
    }

    private Exception probeTarget() {
        try {
            if (probe != null) {
                target.checkHealth(probe);
            } else {
                target.checkHealth();
            }
            return null;
        } catch (ResourceException | RuntimeException e) {
            return e;
        }
    }

    private void attemptRecovery(int streak) {
        LOGGER.info(() -> "Attempting recovery of " + target.name() + " after " + streak + " consecutive failures");
        try {
            recoverable.reconnect();
        } catch (ResourceException | RuntimeException e) {
            LOGGER.warning(() -> "Recovery of " + target.name() + " failed after " + streak
                    + " consecutive failures: " + e.getMessage());
            return;
        }
        lock.lock();
        try {
            consecutiveFailures = 0;
            healthy = true;
        } finally {
            lock.unlock();
        }
        LOGGER.info(() -> "Recovered " + target.name() + " after " + streak + " consecutive failures");
    }

    public boolean isHealthy() {
        lock.lock();
        try {
            return healthy;
        } finally {
            lock.unlock();
        }
    }

    public int consecutiveFailures() {
        lock.lock();
        try {
            return consecutiveFailures;
        } finally {
            lock.unlock();
        }
    }

    public HealthStatus status() {
        lock.lock();
        try {
            return new HealthStatus(lastCheckTime, healthy, consecutiveFailures);
        } finally {
            lock.unlock();
        }
    }

    public int maxFailures() {
        return maxFailures;
    }
}
