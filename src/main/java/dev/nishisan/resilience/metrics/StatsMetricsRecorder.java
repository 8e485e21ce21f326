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

package dev.nishisan.resilience.metrics;

import dev.nishisan.resilience.pool.PoolSnapshot;
import dev.nishisan.resilience.stats.StatsRegistry;

import java.time.Duration;
import java.util.Objects;

/**
 * Default in-process sink: records every observation for one resource into a
 * caller supplied {@link StatsRegistry}.
 */
public final class StatsMetricsRecorder implements MetricsRecorder {
    private final StatsRegistry stats;
    private final String resource;

    public StatsMetricsRecorder(StatsRegistry stats, String resource) {
        this.stats = Objects.requireNonNull(stats, "stats");
        this.resource = Objects.requireNonNull(resource, "resource");
    }

    @Override
    public void recordPoolStats(PoolSnapshot snapshot) {
        if (snapshot == null) {
            return;
        }
        stats.notifyCurrentValue(MetricKeys.poolMaxOpen(resource), snapshot.maxOpen());
        stats.notifyCurrentValue(MetricKeys.poolOpen(resource), snapshot.open());
        stats.notifyCurrentValue(MetricKeys.poolInUse(resource), snapshot.inUse());
        stats.notifyCurrentValue(MetricKeys.poolIdle(resource), snapshot.idle());
        stats.notifyCurrentValue(MetricKeys.poolMaxIdle(resource), snapshot.maxIdle());
        stats.notifyCurrentValue(MetricKeys.poolWaitCount(resource), snapshot.waitCount());
        stats.notifyCurrentValue(MetricKeys.poolWaitMs(resource), snapshot.waitDuration().toMillis());
        stats.notifyCurrentValue(MetricKeys.poolIdleClosed(resource), snapshot.idleClosedCount());
        stats.notifyCurrentValue(MetricKeys.poolLifetimeClosed(resource), snapshot.lifetimeClosedCount());
    }

    @Override
    public void recordHealthCheck(boolean success) {
        stats.notifyHitCounter(MetricKeys.healthTotal(resource));
        stats.notifyHitCounter(success ? MetricKeys.healthSuccess(resource) : MetricKeys.healthFailure(resource));
    }

    @Override
    public void recordQuery(Duration duration, Throwable error, Duration slowThreshold) {
        Objects.requireNonNull(duration, "duration");
        stats.notifyHitCounter(MetricKeys.queryTotal(resource));
        stats.notifyAverageCounter(MetricKeys.queryMs(resource), duration.toMillis());
        if (error != null) {
            stats.notifyHitCounter(MetricKeys.queryErrors(resource));
        }
        if (slowThreshold != null && duration.compareTo(slowThreshold) >= 0) {
            stats.notifyHitCounter(MetricKeys.querySlow(resource));
        }
    }

    @Override
    public void recordTx(Duration duration, boolean committed) {
        Objects.requireNonNull(duration, "duration");
        stats.notifyAverageCounter(MetricKeys.txMs(resource), duration.toMillis());
        stats.notifyHitCounter(committed ? MetricKeys.txCommitted(resource) : MetricKeys.txRolledBack(resource));
    }

    @Override
    public void incConnectAttempt() {
        stats.notifyHitCounter(MetricKeys.connectAttempt(resource));
    }

    @Override
    public void incConnectRetry() {
        stats.notifyHitCounter(MetricKeys.connectRetry(resource));
    }

    @Override
    public void incConnectSuccess() {
        stats.notifyHitCounter(MetricKeys.connectSuccess(resource));
    }

    @Override
    public void incConnectFailure() {
        stats.notifyHitCounter(MetricKeys.connectFailure(resource));
    }
}
