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
 * Signals that a supervised resource could not complete a liveness probe,
 * a reconnection or an initial connect.
 */
public class ResourceException extends Exception {

    private final String resourceName;

    public ResourceException(String message) {
        this(null, message, null);
    }

    public ResourceException(String message, Throwable cause) {
        this(null, message, cause);
    }

    public ResourceException(String resourceName, String message, Throwable cause) {
        super(message, cause);
        this.resourceName = resourceName;
    }

    /**
     * @return the name of the resource that failed, or {@code null} when the
     * thrower did not know it
     */
    public String getResourceName() {
        return resourceName;
    }
}
