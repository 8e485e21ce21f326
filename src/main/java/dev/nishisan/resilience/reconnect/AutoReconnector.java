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

package dev.nishisan.resilience.reconnect;

import dev.nishisan.resilience.capability.Recoverable;
import dev.nishisan.resilience.capability.ResourceException;
import dev.nishisan.resilience.metrics.MetricsRecorder;
import dev.nishisan.resilience.supervisor.AbstractSupervisor;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Logger;

/**
 * Re-establishes a resource once it reports itself disconnected.
 * <p>
 * Acts only on {@link Recoverable#isConnected()} returning {@code false};
 * failing health checks are the {@code HealthChecker}'s concern. At most one
 * reconnect is in flight at any instant, and after {@code maxAttempts}
 * consecutive failures (when non-zero) the reconnector waits for the resource
 * to come back on its own.
 */
public final class AutoReconnector extends AbstractSupervisor {

    private static final Logger LOGGER = Logger.getLogger(AutoReconnector.class.getName());

    /** Default poll interval. */
    public static final Duration DEFAULT_INTERVAL = Duration.ofSeconds(5);

    private final Recoverable target;
    private final int maxAttempts;
    private final MetricsRecorder recorder;
    private final AtomicLong attempts = new AtomicLong();
    private final AtomicBoolean reconnecting = new AtomicBoolean(false);

    public AutoReconnector(Recoverable target, Duration interval, int maxAttempts) {
        this(target, interval, maxAttempts, MetricsRecorder.noOp());
    }

    /**
     * @param target      the resource to reconnect
     * @param interval    time between connectivity checks
     * @param maxAttempts consecutive failed attempts after which the reconnector gives up, {@code 0} for unlimited
     * @param recorder    sink for connect attempts and outcomes
     */
    public AutoReconnector(Recoverable target, Duration interval, int maxAttempts, MetricsRecorder recorder) {
        super("auto-reconnector", Objects.requireNonNull(target, "target").name(), interval);
        if (maxAttempts < 0) {
            throw new IllegalArgumentException("maxAttempts must not be negative: " + maxAttempts);
        }
        this.target = target;
        this.maxAttempts = maxAttempts;
        this.recorder = Objects.requireNonNull(recorder, "recorder");
    }

    @Override
    protected void tick() {
        checkAndReconnect();
    }

    /**
     * Runs one connectivity check and, when needed, one reconnect attempt.
     * Safe to call concurrently with the scheduled tick.
     */
    void checkAndReconnect() {
        if (reconnecting.get()) {
            return;
        }
        if (target.isConnected()) {
            attempts.set(0);
            return;
        }
        long current = attempts.get();
        if (maxAttempts > 0 && current >= maxAttempts) {
            return;
        }
        if (!reconnecting.compareAndSet(false, true)) {
            return;
        }
        try {
            long attempt = attempts.get() + 1;
            LOGGER.info(() -> "Attempting to reconnect " + target.name() + " (attempt " + attempt + ")");
            recorder.incConnectAttempt();
            if (attempt > 1) {
                recorder.incConnectRetry();
            }
            try {
                target.reconnect();
            } catch (ResourceException | RuntimeException e) {
                long failed = attempts.incrementAndGet();
                recorder.incConnectFailure();
                LOGGER.warning(() -> "Reconnection attempt " + failed + " failed for " + target.name()
                        + ": " + e.getMessage());
                if (maxAttempts > 0 && failed >= maxAttempts) {
                    LOGGER.warning(() -> "Giving up on " + target.name() + " after " + failed
                            + " reconnection attempts");
                }
                return;
            }
            attempts.set(0);
            recorder.incConnectSuccess();
            LOGGER.info(() -> "Successfully reconnected " + target.name());
        } finally {
            reconnecting.set(false);
        }
    }

    public long getAttempts() {
        return attempts.get();
    }

    public int maxAttempts() {
        return maxAttempts;
    }
}
