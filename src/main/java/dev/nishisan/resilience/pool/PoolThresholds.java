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
 * Alert thresholds evaluated by the pool monitor.
 *
 * @param usagePercentage fraction of {@code maxOpen} in use that raises an alert, in {@code (0, 1]}
 * @param waitDuration    cumulative wait time that raises an alert
 * @param waitCount       cumulative wait count that raises an alert
 */
public record PoolThresholds(double usagePercentage, Duration waitDuration, long waitCount) {

    public static final double DEFAULT_USAGE_PERCENTAGE = 0.8;
    public static final Duration DEFAULT_WAIT_DURATION = Duration.ofSeconds(5);
    public static final long DEFAULT_WAIT_COUNT = 10;

    public PoolThresholds {
        Objects.requireNonNull(waitDuration, "waitDuration");
        if (!(usagePercentage > 0.0 && usagePercentage <= 1.0)) {
            throw new IllegalArgumentException("usagePercentage must be in (0, 1]: " + usagePercentage);
        }
        if (waitDuration.isNegative()) {
            throw new IllegalArgumentException("waitDuration must not be negative");
        }
        if (waitCount < 0) {
            throw new IllegalArgumentException("waitCount must not be negative: " + waitCount);
        }
    }

    public static PoolThresholds defaults() {
        return new PoolThresholds(DEFAULT_USAGE_PERCENTAGE, DEFAULT_WAIT_DURATION, DEFAULT_WAIT_COUNT);
    }
}
