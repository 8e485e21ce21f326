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

package dev.nishisan.resilience.stats.list;

import java.util.ArrayDeque;
import java.util.List;

/**
 * Rolling window of numeric samples; the oldest sample is evicted once the
 * window is full. All methods are synchronized on the list.
 */
public class FixedSizeList<E extends Number> {
    private final ArrayDeque<E> samples;
    private final int capacity;
    private final String name;
    private E lastAddedElement;

    public FixedSizeList(String name, int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Capacity must be positive.");
        }
        this.capacity = capacity;
        this.name = name;
        this.samples = new ArrayDeque<>(capacity);
    }

    public synchronized void add(E element) {
        if (element == null) {
            return;
        }
        if (samples.size() == capacity) {
            samples.pollFirst();
        }
        samples.addLast(element);
        this.lastAddedElement = element;
    }

    public synchronized int size() {
        return samples.size();
    }

    public synchronized double getAverage() {
        return samples.stream()
                .mapToDouble(Number::doubleValue)
                .average()
                .orElse(0.0);
    }

    public synchronized List<E> snapshot() {
        return List.copyOf(samples);
    }

    public synchronized E getLastAddedElement() {
        return lastAddedElement;
    }

    public String getName() {
        return name;
    }

    public int getCapacity() {
        return capacity;
    }
}
