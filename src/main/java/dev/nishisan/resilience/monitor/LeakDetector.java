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

import dev.nishisan.resilience.capability.Monitorable;
import dev.nishisan.resilience.pool.PoolSnapshot;
import dev.nishisan.resilience.supervisor.AbstractSupervisor;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Flags probable connection leaks from pool counters alone.
 * <p>
 * Two independent heuristics run while any connection is checked out:
 * saturation (usage at or above {@value #SATURATION_USAGE} with every open
 * connection in use) and long waits (cumulative wait time above the
 * threshold). Both are advisory: the detector logs and notifies listeners but
 * never acts on the pool. A fully used pool at legitimate peak load trips the
 * saturation heuristic too.
 */
public final class LeakDetector extends AbstractSupervisor {

    private static final Logger LOGGER = Logger.getLogger(LeakDetector.class.getName());

    /** The detector polls on a fixed period. */
    public static final Duration INTERVAL = Duration.ofSeconds(30);
    public static final Duration DEFAULT_WAIT_THRESHOLD = Duration.ofSeconds(300);
    public static final double SATURATION_USAGE = 0.9;

    private final Monitorable target;
    private final Duration waitThreshold;
    private final Clock clock;
    private final List<LeakSuspicionListener> listeners = new CopyOnWriteArrayList<>();

    public LeakDetector(Monitorable target) {
        this(target, DEFAULT_WAIT_THRESHOLD);
    }

    /**
     * @param target        the resource to inspect
     * @param waitThreshold cumulative wait time above which a long-wait suspicion is raised
     */
    public LeakDetector(Monitorable target, Duration waitThreshold) {
        this(target, waitThreshold, Clock.systemUTC());
    }

    LeakDetector(Monitorable target, Duration waitThreshold, Clock clock) {
        super("leak-detector", Objects.requireNonNull(target, "target").name(), INTERVAL);
        this.target = target;
        this.waitThreshold = Objects.requireNonNull(waitThreshold, "waitThreshold");
        if (waitThreshold.isNegative()) {
            throw new IllegalArgumentException("waitThreshold must not be negative");
        }
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public void addListener(LeakSuspicionListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeListener(LeakSuspicionListener listener) {
        listeners.remove(listener);
    }

    @Override
    protected void tick() {
        detect();
    }

    /**
     * Runs both heuristics against a fresh snapshot.
     *
     * @return the suspicions raised by this cycle, possibly empty
     */
    List<LeakSuspicion> detect() {
        PoolSnapshot stats = target.getStats();
        if (stats == null || stats.inUse() <= 0) {
            return List.of();
        }
        List<LeakSuspicion> found = new ArrayList<>(2);
        Instant now = clock.instant();

        if (stats.maxOpen() > 0
                && stats.usageRatio() >= SATURATION_USAGE
                && stats.inUse() == stats.open()) {
            found.add(new LeakSuspicion(target.name(), LeakSuspicion.Kind.SATURATION,
                    "Potential connection leak detected for " + target.name() + ": all connections ("
                            + stats.open() + "/" + stats.maxOpen() + ") are in use",
                    stats, now));
        }

        if (stats.waitDuration().compareTo(waitThreshold) > 0) {
            found.add(new LeakSuspicion(target.name(), LeakSuspicion.Kind.LONG_WAIT,
                    "Long connection wait detected for " + target.name() + ": " + stats.waitDuration()
                            + " (threshold: " + waitThreshold + "). Possible connection leak.",
                    stats, now));
        }

        for (LeakSuspicion suspicion : found) {
            LOGGER.warning(suspicion::message);
            for (LeakSuspicionListener listener : listeners) {
                try {
                    listener.onSuspicion(suspicion);
                } catch (Throwable t) {
                    LOGGER.log(Level.WARNING, "Leak suspicion listener threw exception", t);
                }
            }
        }
        return found;
    }

    public Duration waitThreshold() {
        return waitThreshold;
    }
}
