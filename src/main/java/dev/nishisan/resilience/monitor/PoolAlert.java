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
import java.util.List;
import java.util.Objects;

/**
 * Alert raised by a {@link PoolMonitor}.
 *
 * @param resourceName name of the monitored resource
 * @param severity     alert severity
 * @param reasons      the conditions that fired, e.g. {@code "high pool usage"}
 * @param snapshot     the counters that triggered the alert
 * @param timestamp    when the alert was raised
 */
public record PoolAlert(
        String resourceName,
        AlertSeverity severity,
        List<String> reasons,
        PoolSnapshot snapshot,
        Instant timestamp) {

    public PoolAlert {
        Objects.requireNonNull(resourceName, "resourceName");
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(snapshot, "snapshot");
        Objects.requireNonNull(timestamp, "timestamp");
        reasons = List.copyOf(reasons);
    }

    /**
     * @return a one-line description for log output
     */
    public String describe() {
        return "Connection pool alert [" + severity.name().toLowerCase() + "] for " + resourceName + ": " + reasons
                + " (Open=" + snapshot.open() + "/" + snapshot.maxOpen()
                + ", InUse=" + snapshot.inUse()
                + ", Idle=" + snapshot.idle()
                + ", WaitCount=" + snapshot.waitCount()
                + ", WaitDuration=" + snapshot.waitDuration() + ")";
    }
}
