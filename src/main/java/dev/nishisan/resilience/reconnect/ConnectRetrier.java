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

import dev.nishisan.resilience.capability.ResourceException;
import dev.nishisan.resilience.metrics.MetricsRecorder;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Runs a {@link ConnectAction} until it succeeds or the {@link RetryPolicy}
 * is exhausted, sleeping with exponential backoff in between. Used when a
 * resource is opened at startup; runtime reconnection belongs to
 * {@link AutoReconnector}.
 */
public final class ConnectRetrier {

    private static final Logger LOGGER = Logger.getLogger(ConnectRetrier.class.getName());

    /**
     * Blocks the calling thread between attempts.
     */
    @FunctionalInterface
    interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private final String resourceName;
    private final RetryPolicy policy;
    private final MetricsRecorder recorder;
    private final Sleeper sleeper;

    public ConnectRetrier(String resourceName, RetryPolicy policy, MetricsRecorder recorder) {
        this(resourceName, policy, recorder, duration -> Thread.sleep(duration.toMillis()));
    }

    ConnectRetrier(String resourceName, RetryPolicy policy, MetricsRecorder recorder, Sleeper sleeper) {
        this.resourceName = Objects.requireNonNull(resourceName, "resourceName");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.recorder = Objects.requireNonNull(recorder, "recorder");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    /**
     * @param action the connect attempt
     * @throws ResourceException the last failure once every attempt failed, with
     *                           earlier failures attached as suppressed exceptions
     */
    public void connect(ConnectAction action) throws ResourceException {
        Objects.requireNonNull(action, "action");
        List<Exception> failures = new ArrayList<>();
        for (int attempt = 1; attempt <= policy.maxAttempts(); attempt++) {
            if (attempt > 1) {
                Duration delay = policy.delayBeforeRetry(attempt - 1);
                int next = attempt;
                LOGGER.info(() -> "Retrying connection to " + resourceName + " in " + delay.toMillis()
                        + "ms (attempt " + next + "/" + policy.maxAttempts() + ")");
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    ResourceException interrupted = new ResourceException(resourceName,
                            "Interrupted while waiting to reconnect " + resourceName, e);
                    failures.forEach(interrupted::addSuppressed);
                    throw interrupted;
                }
                recorder.incConnectRetry();
            }
            recorder.incConnectAttempt();
            try {
                action.connect();
                recorder.incConnectSuccess();
                if (attempt > 1) {
                    int succeeded = attempt;
                    LOGGER.info(() -> "Connected to " + resourceName + " on attempt " + succeeded);
                }
                return;
            } catch (ResourceException | RuntimeException e) {
                recorder.incConnectFailure();
                failures.add(e);
                int failed = attempt;
                LOGGER.warning(() -> "Connection attempt " + failed + "/" + policy.maxAttempts() + " to "
                        + resourceName + " failed: " + e.getMessage());
            }
        }
        Exception last = failures.get(failures.size() - 1);
        ResourceException exhausted = new ResourceException(resourceName,
                "Could not connect to " + resourceName + " after " + policy.maxAttempts() + " attempt(s)", last);
        for (int i = 0; i < failures.size() - 1; i++) {
            exhausted.addSuppressed(failures.get(i));
        }
        throw exhausted;
    }

    public RetryPolicy policy() {
        return policy;
    }
}
