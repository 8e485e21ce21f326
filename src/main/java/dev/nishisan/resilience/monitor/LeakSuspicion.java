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

package dev.nishisan.resilience.monitor;

import dev.nishisan.resilience.pool.PoolSnapshot;

import java.time.Instant;
import java.util.Objects;

/**
 * Advisory finding of a {@link LeakDetector}.
 *
 * @param resourceName name of the inspected resource
 * @param kind         which heuristic fired
 * @param message      human-readable description
 * @param snapshot     the counters the heuristic looked at
 * @param timestamp    when the suspicion was raised
 */
public record LeakSuspicion(
        String resourceName,
        Kind kind,
        String message,
        PoolSnapshot snapshot,
        Instant timestamp) {

    public enum Kind {
        /** Every open connection is checked out while the pool is near its limit. */
        SATURATION,
        /** Borrowers waited longer than the configured threshold. */
        LONG_WAIT
    }

    public LeakSuspicion {
        Objects.requireNonNull(resourceName, "resourceName");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(snapshot, "snapshot");
        Objects.requireNonNull(timestamp, "timestamp");
    }
}
