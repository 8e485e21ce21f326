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

import java.time.Duration;

/**
 * Recorder used when no metrics sink is configured.
 */
public final class NoOpMetricsRecorder implements MetricsRecorder {

    public static final NoOpMetricsRecorder INSTANCE = new NoOpMetricsRecorder();

    private NoOpMetricsRecorder() {
    }

    @Override
    public void recordPoolStats(PoolSnapshot snapshot) {
        // no-op
    }

    @Override
    public void recordHealthCheck(boolean success) {
        // no-op
    }

    @Override
    public void recordQuery(Duration duration, Throwable error, Duration slowThreshold) {
        // no-op
    }

    @Override
    public void recordTx(Duration duration, boolean committed) {
        // no-op
    }

    @Override
    public void incConnectAttempt() {
        // no-op
    }

    @Override
    public void incConnectRetry() {
        // no-op
    }

    @Override
    public void incConnectSuccess() {
        // no-op
    }

    @Override
    public void incConnectFailure() {
        // no-op
    }
}
