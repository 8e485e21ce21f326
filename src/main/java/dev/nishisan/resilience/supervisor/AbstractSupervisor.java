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

package dev.nishisan.resilience.supervisor;

import java.io.Closeable;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Periodic worker shared by every supervisor.
 * <p>
 * Each instance owns a single-threaded scheduler, so ticks of one supervisor
 * never overlap and a slow tick in one supervisor cannot delay another. Ticks
 * run with a fixed delay: the next tick is scheduled only after the previous
 * one, including any recovery it triggered, has returned.
 * <p>
 * {@link #stop()} is idempotent and race free. It waits at most
 * {@link #STOP_TIMEOUT} for the worker to exit, then interrupts it, logs a
 * warning and returns.
 */
public abstract class AbstractSupervisor implements Closeable {

    private static final Logger LOGGER = Logger.getLogger(AbstractSupervisor.class.getName());

    /** Upper bound on how long {@link #stop()} waits for an in-flight tick. */
    public static final Duration STOP_TIMEOUT = Duration.ofSeconds(5);

    private final String kind;
    private final String targetName;
    private final Duration interval;
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    private volatile ScheduledExecutorService executor;
    private volatile ScheduledFuture<?> task;
    private volatile Thread worker;

    /**
     * @param kind       short label of the supervisor type, used in thread names and log lines
     * @param targetName display name of the supervised resource
     * @param interval   tick period, must be positive
     */
    protected AbstractSupervisor(String kind, String targetName, Duration interval) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.targetName = Objects.requireNonNull(targetName, "targetName");
        this.interval = Objects.requireNonNull(interval, "interval");
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException(kind + " interval must be positive: " + interval);
        }
    }

    /**
     * Starts the worker and returns immediately. Calling it again while
     * running has no effect.
     *
     * @throws IllegalStateException if the supervisor was already stopped
     */
    public void start() {
        if (stopped.get()) {
            throw new IllegalStateException(kind + " for " + targetName + " was stopped and cannot be restarted");
        }
        if (!started.compareAndSet(false, true)) {
            return;
        }
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, kind + "-" + targetName);
            thread.setDaemon(true);
            worker = thread;
            return thread;
        });
        long periodMs = interval.toMillis() > 0 ? interval.toMillis() : 1L;
        // publish only a scheduled executor, so stop() never shuts it down before scheduling
        task = scheduler.scheduleWithFixedDelay(this::runTick, periodMs, periodMs, TimeUnit.MILLISECONDS);
        executor = scheduler;
        if (stopped.get()) {
            // lost a race with stop()
            scheduler.shutdownNow();
            return;
        }
        LOGGER.fine(() -> kind + " started for " + targetName + " (interval " + interval + ")");
    }

    /**
     * Stops the worker. Only the first call has an effect; later calls return
     * immediately.
     */
    public void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        ScheduledExecutorService scheduler = executor;
        if (scheduler == null) {
            return;
        }
        ScheduledFuture<?> current = task;
        if (current != null) {
            current.cancel(false);
        }
        scheduler.shutdown();
        if (Thread.currentThread() == worker) {
            // stop() issued from inside a tick: the tick finishes on its own
            return;
        }
        try {
            if (!scheduler.awaitTermination(STOP_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
                LOGGER.warning(() -> kind + " for " + targetName + " did not stop within " + STOP_TIMEOUT
                        + ", interrupting worker");
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        LOGGER.fine(() -> kind + " stopped for " + targetName);
    }

    @Override
    public void close() {
        stop();
    }

    /**
     * @return {@code true} between a successful {@link #start()} and {@link #stop()}
     */
    public boolean isRunning() {
        return started.get() && !stopped.get();
    }

    public String targetName() {
        return targetName;
    }

    public Duration interval() {
        return interval;
    }

    /**
     * Performs one polling cycle. Runs on the supervisor's own thread.
     */
    protected abstract void tick();

    private void runTick() {
        if (stopped.get()) {
            return;
        }
        try {
            tick();
        } catch (Throwable t) {
            LOGGER.log(Level.SEVERE, "Unexpected error in " + kind + " for " + targetName, t);
        }
    }
}
