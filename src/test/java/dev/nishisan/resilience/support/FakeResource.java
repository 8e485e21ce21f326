package dev.nishisan.resilience.support;

import dev.nishisan.resilience.capability.ResourceException;
import dev.nishisan.resilience.capability.SupervisedResource;
import dev.nishisan.resilience.pool.PoolSnapshot;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Scriptable resource used across the supervisor tests.
 */
public class FakeResource implements SupervisedResource {

    private final String name;
    private final AtomicBoolean connected = new AtomicBoolean(true);
    private final AtomicBoolean healthy = new AtomicBoolean(true);
    private final AtomicBoolean reconnectSucceeds = new AtomicBoolean(true);
    private final Deque<Boolean> scriptedReconnects = new ArrayDeque<>();
    private final AtomicReference<PoolSnapshot> snapshot = new AtomicReference<>(PoolSnapshot.empty());
    private final AtomicReference<String> lastProbe = new AtomicReference<>();

    public final AtomicInteger healthChecks = new AtomicInteger();
    public final AtomicInteger reconnectCalls = new AtomicInteger();

    public FakeResource(String name) {
        this.name = name;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public void checkHealth() throws ResourceException {
        healthChecks.incrementAndGet();
        if (!healthy.get()) {
            throw new ResourceException(name, "ping failed", null);
        }
    }

    @Override
    public void checkHealth(String probe) throws ResourceException {
        lastProbe.set(probe);
        checkHealth();
    }

    @Override
    public void reconnect() throws ResourceException {
        reconnectCalls.incrementAndGet();
        Boolean outcome;
        synchronized (scriptedReconnects) {
            outcome = scriptedReconnects.pollFirst();
        }
        boolean ok = outcome != null ? outcome : reconnectSucceeds.get();
        if (!ok) {
            throw new ResourceException(name, "connection refused", null);
        }
        connected.set(true);
        healthy.set(true);
    }

    @Override
    public boolean isConnected() {
        return connected.get();
    }

    @Override
    public PoolSnapshot getStats() {
        return snapshot.get();
    }

    public FakeResource connected(boolean value) {
        connected.set(value);
        return this;
    }

    public FakeResource healthy(boolean value) {
        healthy.set(value);
        return this;
    }

    public FakeResource reconnectSucceeds(boolean value) {
        reconnectSucceeds.set(value);
        return this;
    }

    /**
     * Queues outcomes for the next reconnect calls; afterwards the
     * {@link #reconnectSucceeds(boolean)} default applies.
     */
    public FakeResource scriptReconnects(Boolean... outcomes) {
        synchronized (scriptedReconnects) {
            for (Boolean outcome : outcomes) {
                scriptedReconnects.addLast(outcome);
            }
        }
        return this;
    }

    public FakeResource stats(PoolSnapshot value) {
        snapshot.set(value);
        return this;
    }

    public String lastProbe() {
        return lastProbe.get();
    }
}
