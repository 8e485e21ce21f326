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

package dev.nishisan.resilience.capability;

/**
 * A resource whose liveness can be probed.
 */
public interface HealthCheckable {

    /**
     * Probes the resource.
     *
     * @throws ResourceException when the resource is not usable
     */
    void checkHealth() throws ResourceException;

    /**
     * Probes the resource with a caller supplied payload, for example a
     * validation query. The payload is opaque to the health checker; the
     * default implementation ignores it.
     *
     * @param probe the probe payload, never {@code null}
     * @throws ResourceException when the resource is not usable
     */
    default void checkHealth(String probe) throws ResourceException {
        checkHealth();
    }

    /**
     * @return display name used in log lines and metric keys
     */
    String name();
}
