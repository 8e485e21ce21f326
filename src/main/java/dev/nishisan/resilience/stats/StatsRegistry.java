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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * In-process registry of hit counters, current values and rolling averages.
 * <p>
 * A registry is an explicit value: each plugin constructs its own and hands it
 * to whatever records into it, so there is no process-wide metric state and
 * tests stay hermetic. The constructor starts no thread; periodic rate
 * calculation and reporting run only when {@link #startReporting} is called
 * with a caller owned scheduler.
 */
public class StatsRegistry implements Closeable {

    private static final Logger logger = LoggerFactory.getLogger(StatsRegistry.class);
    /** Samples kept per average counter. */
    public static final int AVERAGE_WINDOW = 10;

    private final ConcurrentMap<String, HitCounterDTO> counters = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, SimpleValueDTO> values = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, FixedSizeList<Long>> averages = new ConcurrentHashMap<>();
    private final List<IStatsListener> listeners = new CopyOnWriteArrayList<>();
    private volatile ScheduledFuture<?> reportTask;

    /**
     * Increments the named hit counter by one, creating it on first use.
     *
     * @param counter the counter name
     */
    public void notifyHitCounter(String counter) {
        notifyHitCounter(counter, 1L);
    }

    /**
     * Increments the named hit counter by {@code delta}, creating it on first use.
     * Listeners see {@code onHitCounterCreated} for the first hit and
     * {@code onHitCounterIncremented} afterwards.
     *
     * @param counter the counter name
     * @param delta   amount to add
     */
    public void notifyHitCounter(String counter, long delta) {
        Objects.requireNonNull(counter, "counter");
        boolean[] created = new boolean[1];
        HitCounterDTO metric = counters.computeIfAbsent(counter, name -> {
            created[0] = true;
            return new HitCounterDTO(name);
        });
        metric.increment(delta);
        if (created[0]) {
            listeners.forEach(l -> l.onHitCounterCreated(metric));
        } else {
            listeners.forEach(l -> l.onHitCounterIncremented(metric));
        }
    }

    /**
     * Sets the named gauge, creating it on first use.
     *
     * @param name  the gauge name
     * @param value the new value
     */
    public void notifyCurrentValue(String name, long value) {
        Objects.requireNonNull(name, "name");
        boolean[] created = new boolean[1];
        SimpleValueDTO dto = values.computeIfAbsent(name, n -> {
            created[0] = true;
            return new SimpleValueDTO(n, value);
        });
        if (created[0]) {
            listeners.forEach(l -> l.onCurrentValueCounterCreated(dto));
        } else {
            dto.setValue(value);
            listeners.forEach(l -> l.onCurrentValueCounterUpdated(dto));
        }
    }

    /**
     * Adds a sample to the named rolling average, creating it on first use.
     *
     * @param name  the average name
     * @param value the sample
     */
    public void notifyAverageCounter(String name, long value) {
        Objects.requireNonNull(name, "name");
        boolean[] created = new boolean[1];
        FixedSizeList<Long> list = averages.computeIfAbsent(name, n -> {
            created[0] = true;
            return new FixedSizeList<>(n, AVERAGE_WINDOW);
        });
        list.add(value);
        if (created[0]) {
            listeners.forEach(l -> l.onAverageCounterCreated(list));
        }
    }

    /**
     * Returns the value of a hit counter.
     *
     * @param counterName the counter name
     * @return the counter value, or {@code -1} if no such counter exists
     */
    public long getCounterValue(String counterName) {
        HitCounterDTO metric = counters.get(counterName);
        if (metric == null) {
            logger.warn("Counter:[{}] Not Found", counterName);
            return -1L;
        }
        return metric.getValue();
    }

    /**
     * Same as {@link #getCounterValue(String)} but silent when the counter is
     * missing.
     *
     * @param counterName the counter name
     * @return the counter value, or {@code null}
     */
    public Long getCounterValueOrNull(String counterName) {
        HitCounterDTO metric = counters.get(counterName);
        return metric == null ? null : metric.getValue();
    }

    /**
     * @param counterName the counter name
     * @return the rate computed by the last {@link #calcStats(boolean)}, or {@code -1}
     */
    public double getCounterRate(String counterName) {
        HitCounterDTO metric = counters.get(counterName);
        if (metric == null) {
            logger.warn("Counter:[{}] Not Found", counterName);
            return -1D;
        }
        return metric.getRate();
    }

    /**
     * @param name the gauge name
     * @return the gauge value, or {@code null} if it was never set
     */
    public Long getCurrentValueOrNull(String name) {
        SimpleValueDTO dto = values.get(name);
        return dto == null ? null : dto.getValue();
    }

    /**
     * @param name the average name
     * @return the mean of the retained samples, or {@code -1} if the average does not exist
     */
    public double getAverage(String name) {
        FixedSizeList<Long> samples = averages.get(name);
        if (samples == null) {
            logger.warn("Average:[{}] Not Found", name);
            return -1D;
        }
        return samples.getAverage();
    }

    public Double getAverageOrNull(String name) {
        FixedSizeList<Long> samples = averages.get(name);
        return samples == null ? null : samples.getAverage();
    }

    /**
     * Recomputes counter rates and, when {@code print} is set, logs every
     * metric at DEBUG level.
     *
     * @param print whether to log the computed values
     */
    public void calcStats(boolean print) {
        counters.values().forEach(HitCounterDTO::calc);
        if (!print || !logger.isDebugEnabled()) {
            return;
        }
        if (counters.isEmpty() && values.isEmpty() && averages.isEmpty()) {
            logger.debug("Empty Stats Received");
            return;
        }
        logger.debug(" ---------------------------------------------------------------------------------------------");
        counters.entrySet().stream().sorted(Map.Entry.comparingByKey()).forEach(entry ->
                logger.debug(String.format("  Stats:  [%-35s]:=[%10.3f]/s Current Value:(%11d)",
                        entry.getKey(), entry.getValue().getRate(), entry.getValue().getValue())));
        values.entrySet().stream().sorted(Map.Entry.comparingByKey()).forEach(entry ->
                logger.debug(String.format("  Value:  [%-35s]:=[%10d]", entry.getKey(), entry.getValue().getValue())));
        averages.entrySet().stream().sorted(Map.Entry.comparingByKey()).forEach(entry ->
                logger.debug(String.format("  Average: [%-34s]:=[%10.3f]", entry.getKey(), entry.getValue().getAverage())));
    }

    /**
     * Schedules {@link #calcStats(boolean)} with printing enabled. Calling it
     * again while reporting is active has no effect.
     *
     * @param scheduler scheduler owned by the caller
     * @param interval  reporting period
     */
    public synchronized void startReporting(ScheduledExecutorService scheduler, Duration interval) {
        Objects.requireNonNull(scheduler, "scheduler");
        Objects.requireNonNull(interval, "interval");
        if (reportTask != null) {
            return;
        }
        long periodMs = Math.max(1000L, interval.toMillis());
        reportTask = scheduler.scheduleAtFixedRate(() -> {
            try {
                calcStats(true);
            } catch (RuntimeException ex) {
                logger.warn("Stats calculation failed", ex);
            }
        }, periodMs, periodMs, TimeUnit.MILLISECONDS);
    }

    public void registerListener(IStatsListener listener) {
        Objects.requireNonNull(listener, "listener");
        if (!listeners.contains(listener)) {
            listeners.add(listener);
        }
    }

    public void removeListener(IStatsListener listener) {
        listeners.remove(listener);
    }

    @Override
    public synchronized void close() {
        ScheduledFuture<?> task = reportTask;
        if (task != null) {
            task.cancel(false);
            reportTask = null;
        }
    }
}
