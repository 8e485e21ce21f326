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

package dev.nishisan.resilience.pool;

import java.time.Duration;
import java.util.Objects;

/**
 * Immutable point-in-time counters of a connection pool.
 *
 * @param maxOpen             configured upper bound of open connections, {@code 0} when unbounded
 * @param open                established connections, in use and idle
 * @param inUse               connections currently checked out
 * @param idle                connections sitting idle in the pool
 * @param maxIdle             configured upper bound of idle connections
 * @param waitCount           cumulative number of borrowers that had to wait
 * @param waitDuration        cumulative time borrowers spent waiting
 * @param idleClosedCount     cumulative connections closed for exceeding the idle limit
 * @param lifetimeClosedCount cumulative connections closed for exceeding their lifetime
 */
public record PoolSnapshot(
        long maxOpen,
        long open,
        long inUse,
        long idle,
        long maxIdle,
        long waitCount,
        Duration waitDuration,
        long idleClosedCount,
        long lifetimeClosedCount) {

    private static final PoolSnapshot EMPTY = new PoolSnapshot(0, 0, 0, 0, 0, 0, Duration.ZERO, 0, 0);

    public PoolSnapshot {
        Objects.requireNonNull(waitDuration, "waitDuration");
        requireNonNegative(maxOpen, "maxOpen");
        requireNonNegative(open, "open");
        requireNonNegative(inUse, "inUse");
        requireNonNegative(idle, "idle");
        requireNonNegative(maxIdle, "maxIdle");
        requireNonNegative(waitCount, "waitCount");
        requireNonNegative(idleClosedCount, "idleClosedCount");
        requireNonNegative(lifetimeClosedCount, "lifetimeClosedCount");
        if (waitDuration.isNegative()) {
            throw new IllegalArgumentException("waitDuration must not be negative");
        }
    }

    /**
     * The snapshot reported by a resource that currently holds no pool.
     *
     * @return an all-zero snapshot
     */
    public static PoolSnapshot empty() {
        return EMPTY;
    }

    /**
     * Shorthand for the common case where only the occupancy counters matter.
     */
    public static PoolSnapshot of(long maxOpen, long open, long inUse, long waitCount, Duration waitDuration) {
        return new PoolSnapshot(maxOpen, open, inUse, Math.max(0, open - inUse), 0,
                waitCount, waitDuration, 0, 0);
    }

    /**
     * @return {@code open / maxOpen}, or {@code 0} when the pool is unbounded
     */
    public double usageRatio() {
        if (maxOpen <= 0) {
            return 0.0;
        }
        return (double) open / (double) maxOpen;
    }

    private static void requireNonNegative(long value, String field) {
        if (value < 0) {
            throw new IllegalArgumentException(field + " must not be negative: " + value);
        }
    }
}
