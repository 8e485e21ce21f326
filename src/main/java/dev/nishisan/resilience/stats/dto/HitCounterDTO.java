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
 * Monotonic counter with a per-second rate refreshed by {@link #calc()}.
 */
public class HitCounterDTO {
    private final String name;
    private final AtomicLong currentValue = new AtomicLong(0L);
    private volatile long lastCalcMs;
    private volatile long lastCalcValue;
    private volatile double currentRate;
    private volatile Instant lastUpdated = Instant.now();

    public HitCounterDTO(String name) {
        this.name = name;
        this.lastCalcMs = System.currentTimeMillis();
    }

    public long increment() {
        return increment(1L);
    }

    public long increment(long delta) {
        long value = this.currentValue.addAndGet(delta);
        this.lastUpdated = Instant.now();
        return value;
    }

    /**
     * Recomputes the rate from the delta since the previous call.
     *
     * @return hits per second since the previous calculation
     */
    public synchronized double calc() {
        long now = System.currentTimeMillis();
        long elapsedMs = now - this.lastCalcMs;
        long value = this.currentValue.get();
        if (elapsedMs > 0) {
            this.currentRate = (value - this.lastCalcValue) / (elapsedMs / 1000.0);
        }
        this.lastCalcValue = value;
        this.lastCalcMs = now;
        return this.currentRate;
    }

    public String getName() {
        return name;
    }

    public long getValue() {
        return this.currentValue.get();
    }

    public double getRate() {
        return this.currentRate;
    }

    public Instant getLastUpdated() {
        return lastUpdated;
    }
}
