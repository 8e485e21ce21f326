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

/**
 * Metric keys used by {@link StatsMetricsRecorder}. Every key is scoped by
 * the name of the supervised resource.
 */
public final class MetricKeys {
    private static final String PREFIX = "resilience.";

    private static final String POOL_MAX_OPEN = ".pool.max_open";
    private static final String POOL_OPEN = ".pool.open";
    private static final String POOL_IN_USE = ".pool.in_use";
    private static final String POOL_IDLE = ".pool.idle";
    private static final String POOL_MAX_IDLE = ".pool.max_idle";
    private static final String POOL_WAIT_COUNT = ".pool.wait_count";
    private static final String POOL_WAIT_MS = ".pool.wait_ms";
    private static final String POOL_IDLE_CLOSED = ".pool.idle_closed";
    private static final String POOL_LIFETIME_CLOSED = ".pool.lifetime_closed";

    private static final String HEALTH_TOTAL = ".health.total";
    private static final String HEALTH_SUCCESS = ".health.success";
    private static final String HEALTH_FAILURE = ".health.failure";

    private static final String QUERY_TOTAL = ".query.total";
    private static final String QUERY_ERRORS = ".query.errors";
    private static final String QUERY_SLOW = ".query.slow";
    private static final String QUERY_MS = ".query.ms";

    private static final String TX_COMMITTED = ".tx.committed";
    private static final String TX_ROLLED_BACK = ".tx.rolled_back";
    private static final String TX_MS = ".tx.ms";

    private static final String CONNECT_ATTEMPT = ".connect.attempt";
    private static final String CONNECT_RETRY = ".connect.retry";
    private static final String CONNECT_SUCCESS = ".connect.success";
    private static final String CONNECT_FAILURE = ".connect.failure";

    private MetricKeys() {
    }

    private static String key(String resource, String suffix) {
        return PREFIX + resource + suffix;
    }

    public static String poolMaxOpen(String resource) {
        return key(resource, POOL_MAX_OPEN);
    }

    public static String poolOpen(String resource) {
        return key(resource, POOL_OPEN);
    }

    public static String poolInUse(String resource) {
        return key(resource, POOL_IN_USE);
    }

    public static String poolIdle(String resource) {
        return key(resource, POOL_IDLE);
    }

    public static String poolMaxIdle(String resource) {
        return key(resource, POOL_MAX_IDLE);
    }

    public static String poolWaitCount(String resource) {
        return key(resource, POOL_WAIT_COUNT);
    }

    public static String poolWaitMs(String resource) {
        return key(resource, POOL_WAIT_MS);
    }

    public static String poolIdleClosed(String resource) {
        return key(resource, POOL_IDLE_CLOSED);
    }

    public static String poolLifetimeClosed(String resource) {
        return key(resource, POOL_LIFETIME_CLOSED);
    }

    public static String healthTotal(String resource) {
        return key(resource, HEALTH_TOTAL);
    }

    public static String healthSuccess(String resource) {
        return key(resource, HEALTH_SUCCESS);
    }

    public static String healthFailure(String resource) {
        return key(resource, HEALTH_FAILURE);
    }

    public static String queryTotal(String resource) {
        return key(resource, QUERY_TOTAL);
    }

    public static String queryErrors(String resource) {
        return key(resource, QUERY_ERRORS);
    }

    public static String querySlow(String resource) {
        return key(resource, QUERY_SLOW);
    }

    public static String queryMs(String resource) {
        return key(resource, QUERY_MS);
    }

    public static String txCommitted(String resource) {
        return key(resource, TX_COMMITTED);
    }

    public static String txRolledBack(String resource) {
        return key(resource, TX_ROLLED_BACK);
    }

    public static String txMs(String resource) {
        return key(resource, TX_MS);
    }

    public static String connectAttempt(String resource) {
        return key(resource, CONNECT_ATTEMPT);
    }

    public static String connectRetry(String resource) {
        return key(resource, CONNECT_RETRY);
    }

    public static String connectSuccess(String resource) {
        return key(resource, CONNECT_SUCCESS);
    }

    public static String connectFailure(String resource) {
        return key(resource, CONNECT_FAILURE);
    }
}
