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
 * Sink for the observations produced by the supervisors and by the resource
 * adapters. Implementations must be thread-safe and must not block callers;
 * supervisors never reference a concrete metrics system, only this contract.
 */
public interface MetricsRecorder {

    /**
     * Records the counters of a pool snapshot.
     *
     * @param snapshot the snapshot, never {@code null}
     */
    void recordPoolStats(PoolSnapshot snapshot);

    /**
     * Records the outcome of one liveness probe.
     *
     * @param success whether the probe succeeded
     */
    void recordHealthCheck(boolean success);

    /**
     * Records one query execution.
     *
     * @param duration      how long the query took
     * @param error         the failure, or {@code null} when the query succeeded
     * @param slowThreshold duration at or above which the query counts as slow
     */
    void recordQuery(Duration duration, Throwable error, Duration slowThreshold);

    /**
     * Records one transaction.
     *
     * @param duration  how long the transaction took
     * @param committed {@code true} when committed, {@code false} when rolled back
     */
    void recordTx(Duration duration, boolean committed);

    void incConnectAttempt();

    void incConnectRetry();

    void incConnectSuccess();

    void incConnectFailure();

    /**
     * @return the shared recorder that discards every observation
     */
    static MetricsRecorder noOp() {
        return NoOpMetricsRecorder.INSTANCE;
    }
}
