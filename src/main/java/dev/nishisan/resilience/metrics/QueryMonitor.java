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

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.logging.Logger;

/**
 * Times queries and transactions run through it, reports them to a
 * {@link MetricsRecorder} and logs slow queries.
 */
public final class QueryMonitor {

    private static final Logger LOGGER = Logger.getLogger(QueryMonitor.class.getName());

    private final boolean enabled;
    private final Duration slowThreshold;
    private final MetricsRecorder recorder;

    public QueryMonitor(boolean enabled, Duration slowThreshold, MetricsRecorder recorder) {
        this.enabled = enabled;
        this.slowThreshold = Objects.requireNonNull(slowThreshold, "slowThreshold");
        this.recorder = Objects.requireNonNull(recorder, "recorder");
        if (slowThreshold.isNegative()) {
            throw new IllegalArgumentException("slowThreshold must not be negative");
        }
    }

    /**
     * Runs a query. The query's own exception is rethrown unchanged.
     *
     * @param description text identifying the query in the slow query log
     * @param query       the work to run
     * @param <T>         result type
     * @return the query result
     * @throws Exception whatever the query throws
     */
    public <T> T monitor(String description, Callable<T> query) throws Exception {
        Objects.requireNonNull(query, "query");
        if (!enabled) {
            return query.call();
        }
        long start = System.nanoTime();
        Throwable error = null;
        try {
            return query.call();
        } catch (Exception | Error e) {
            error = e;
            throw e;
        } finally {
            Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
            recorder.recordQuery(elapsed, error, slowThreshold);
            if (elapsed.compareTo(slowThreshold) >= 0) {
                Throwable failure = error;
                LOGGER.warning(() -> "Slow query detected: duration=" + elapsed.toMillis() + "ms, query="
                        + description + (failure != null ? ", error=" + failure.getMessage() : ""));
            }
        }
    }

    /**
     * Runs a transaction whose result tells whether it committed.
     *
     * @param description text identifying the transaction
     * @param tx          the work to run, returning {@code true} on commit
     * @return the value returned by {@code tx}
     * @throws Exception whatever the transaction throws; a throwing transaction counts as rolled back
     */
    public boolean monitorTx(String description, Callable<Boolean> tx) throws Exception {
        Objects.requireNonNull(tx, "tx");
        if (!enabled) {
            return Boolean.TRUE.equals(tx.call());
        }
        long start = System.nanoTime();
        boolean committed = false;
        try {
            committed = Boolean.TRUE.equals(tx.call());
            return committed;
        } finally {
            Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
            recorder.recordTx(elapsed, committed);
            if (!committed) {
                LOGGER.fine(() -> "Transaction rolled back: " + description);
            }
        }
    }

    public boolean isEnabled() {
        return enabled;
    }

    public Duration slowThreshold() {
        return slowThreshold;
    }
}
