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

package dev.nishisan.resilience;

import dev.nishisan.resilience.capability.ResourceException;
import dev.nishisan.resilience.capability.SupervisedResource;
import dev.nishisan.resilience.config.SupervisionConfig;
import dev.nishisan.resilience.health.HealthChecker;
import dev.nishisan.resilience.metrics.MetricsRecorder;
import dev.nishisan.resilience.metrics.QueryMonitor;
import dev.nishisan.resilience.monitor.LeakDetector;
import dev.nishisan.resilience.monitor.LeakSuspicionListener;
import dev.nishisan.resilience.monitor.PoolAlertListener;
import dev.nishisan.resilience.monitor.PoolMonitor;
import dev.nishisan.resilience.reconnect.AutoReconnector;
import dev.nishisan.resilience.reconnect.ConnectRetrier;
import dev.nishisan.resilience.supervisor.AbstractSupervisor;

import java.io.Closeable;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Logger;

/**
 * Wires the supervisors enabled by a {@link SupervisionConfig} around one
 * {@link SupervisedResource} and owns their lifecycle.
 * <p>
 * {@link #start()} opens the resource when it is not connected yet (through a
 * {@link ConnectRetrier} when retry is enabled) and then starts the health
 * checker, auto-reconnector, pool monitor and leak detector that the
 * configuration enables. {@link #stop()} stops them in reverse order.
 * <p>
 * Alert and leak listeners may be registered before or after {@link #start()}.
 */
public class ResourceSupervisor implements Closeable {

    private static final Logger LOGGER = Logger.getLogger(ResourceSupervisor.class.getName());

    private final SupervisedResource resource;
    private final SupervisionConfig config;
    private final MetricsRecorder recorder;
    private final QueryMonitor queryMonitor;

    private final HealthChecker healthChecker;
    private final AutoReconnector autoReconnector;
    private final PoolMonitor poolMonitor;
    private final LeakDetector leakDetector;
    private final List<AbstractSupervisor> supervisors = new ArrayList<>(4);

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    public ResourceSupervisor(SupervisedResource resource, SupervisionConfig config) {
        this(resource, config, MetricsRecorder.noOp());
    }

    public ResourceSupervisor(SupervisedResource resource, SupervisionConfig config, MetricsRecorder recorder) {
        this.resource = Objects.requireNonNull(resource, "resource");
        this.config = Objects.requireNonNull(config, "config");
        this.recorder = Objects.requireNonNull(recorder, "recorder");
        this.queryMonitor = new QueryMonitor(config.slowQueryEnabled(), config.slowQueryThreshold(), recorder);

        if (config.healthCheckEnabled()) {
            healthChecker = new HealthChecker(resource, config.healthCheckInterval(), config.healthCheckQuery(),
                    config.healthMaxFailures(), recorder);
            supervisors.add(healthChecker);
        } else {
            healthChecker = null;
        }
        if (config.autoReconnectEnabled()) {
            autoReconnector = new AutoReconnector(resource, config.autoReconnectInterval(),
                    config.autoReconnectMaxAttempts(), recorder);
            supervisors.add(autoReconnector);
        } else {
            autoReconnector = null;
        }
        if (config.monitorEnabled()) {
            poolMonitor = PoolMonitor.builder(resource)
                    .interval(config.monitorInterval())
                    .thresholds(config.thresholds())
                    .recorder(recorder)
                    .build();
            supervisors.add(poolMonitor);
        } else {
            poolMonitor = null;
        }
        if (config.leakDetectionEnabled()) {
            leakDetector = new LeakDetector(resource, config.leakDetectionThreshold());
            supervisors.add(leakDetector);
        } else {
            leakDetector = null;
        }
    }

    /**
     * Opens the resource if needed and starts the enabled supervisors.
     * Calling it again while running has no effect.
     *
     * @throws ResourceException     when the initial connection cannot be established;
     *                               no supervisor is started in that case
     * @throws IllegalStateException when the supervisor was already stopped
     */
    public void start() throws ResourceException {
        if (stopped.get()) {
            throw new IllegalStateException("ResourceSupervisor for " + resource.name() + " was stopped");
        }
        if (!started.compareAndSet(false, true)) {
            return;
        }
        try {
            connectIfNeeded();
        } catch (ResourceException | RuntimeException e) {
            started.set(false);
            throw e;
        }
        for (AbstractSupervisor supervisor : supervisors) {
            if (stopped.get()) {
                // stop() ran while the resource was connecting
                return;
            }
            try {
                supervisor.start();
            } catch (IllegalStateException e) {
                if (!stopped.get()) {
                    throw e;
                }
                return;
            }
        }
        LOGGER.info(() -> "Supervision started for " + resource.name() + " (" + supervisors.size()
                + " supervisors)");
    }

    private void connectIfNeeded() throws ResourceException {
        if (resource.isConnected()) {
            return;
        }
        if (config.retryEnabled()) {
            new ConnectRetrier(resource.name(), config.retryPolicy(), recorder).connect(resource::reconnect);
            return;
        }
        recorder.incConnectAttempt();
        try {
            resource.reconnect();
        } catch (ResourceException e) {
            recorder.incConnectFailure();
            throw e;
        }
        recorder.incConnectSuccess();
    }

    /**
     * Stops every running supervisor, last started first. Idempotent.
     */
    public void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        for (int i = supervisors.size() - 1; i >= 0; i--) {
            supervisors.get(i).stop();
        }
        LOGGER.info(() -> "Supervision stopped for " + resource.name());
    }

    @Override
    public void close() {
        stop();
    }

    /**
     * @return {@code true} while supervisors are running
     */
    public boolean isRunning() {
        return started.get() && !stopped.get();
    }

    /**
     * Health as last observed by the health checker. Without a health checker
     * the resource's connection state is reported.
     */
    public boolean isHealthy() {
        if (healthChecker != null) {
            return healthChecker.isHealthy();
        }
        return resource.isConnected();
    }

    /**
     * @return consecutive failed reconnect attempts, {@code 0} without an auto-reconnector
     */
    public long reconnectAttempts() {
        return autoReconnector != null ? autoReconnector.getAttempts() : 0;
    }

    public QueryMonitor queryMonitor() {
        return queryMonitor;
    }

    /**
     * @return {@code false} when pool monitoring is disabled
     */
    public boolean addAlertListener(PoolAlertListener listener) {
        if (poolMonitor == null) {
            return false;
        }
        poolMonitor.addListener(listener);
        return true;
    }

    /**
     * @return {@code false} when leak detection is disabled
     */
    public boolean addLeakListener(LeakSuspicionListener listener) {
        if (leakDetector == null) {
            return false;
        }
        leakDetector.addListener(listener);
        return true;
    }

    public Optional<HealthChecker> healthChecker() {
        return Optional.ofNullable(healthChecker);
    }

    public Optional<AutoReconnector> autoReconnector() {
        return Optional.ofNullable(autoReconnector);
    }

    public Optional<PoolMonitor> poolMonitor() {
        return Optional.ofNullable(poolMonitor);
    }

    public Optional<LeakDetector> leakDetector() {
        return Optional.ofNullable(leakDetector);
    }

    public SupervisedResource resource() {
        return resource;
    }

    public SupervisionConfig config() {
        return config;
    }
}
