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

package dev.nishisan.resilience.stats;

import dev.nishisan.resilience.stats.dto.HitCounterDTO;
import dev.nishisan.resilience.stats.dto.SimpleValueDTO;
import dev.nishisan.resilience.stats.list.FixedSizeList;

/**
 * Callbacks fired by {@link StatsRegistry} as metrics are created and updated.
 * Every method has an empty default so listeners override only what they need.
 * Callbacks run on the thread that recorded the observation and must return quickly.
 */
public interface IStatsListener {

    /**
     * Called once when an average counter receives its first sample.
     *
     * @param list the rolling window backing the counter
     */
    default void onAverageCounterCreated(FixedSizeList<Long> list) {
    }

    /**
     * Called when a gauge is first set.
     *
     * @param value the gauge
     */
    default void onCurrentValueCounterCreated(SimpleValueDTO value) {
    }

    /**
     * Called on every subsequent update of a gauge.
     *
     * @param value the gauge holding its new value
     */
    default void onCurrentValueCounterUpdated(SimpleValueDTO value) {
    }

    /**
     * Called once when a hit counter is created by its first hit.
     *
     * @param metric the counter
     */
    default void onHitCounterCreated(HitCounterDTO metric) {
    }

    /**
     * Called on every subsequent hit.
     *
     * @param metric the counter holding its new value
     */
    default void onHitCounterIncremented(HitCounterDTO metric) {
    }
}
