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

package dev.nishisan.resilience.stats.dto;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Last-write-wins gauge.
 */
public class SimpleValueDTO {
    private final String name;
    private final AtomicLong value;
    private volatile Instant lastUpdated = Instant.now();

    public SimpleValueDTO(String name, long value) {
        this.name = name;
        this.value = new AtomicLong(value);
    }

    public String getName() {
        return name;
    }

    public long getValue() {
        return this.value.get();
    }

    public void setValue(long value) {
        this.value.set(value);
        this.lastUpdated = Instant.now();
    }

    public Instant getLastUpdated() {
        return lastUpdated;
    }

    @Override
    public String toString() {
        return String.valueOf(value.get());
    }
}
