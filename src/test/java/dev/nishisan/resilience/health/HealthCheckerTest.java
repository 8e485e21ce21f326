package dev.nishisan.resilience.health;

import dev.nishisan.resilience.capability.HealthCheckable;
import dev.nishisan.resilience.capability.ResourceException;
import dev.nishisan.resilience.metrics.MetricsRecorder;
import dev.nishisan.resilience.pool.PoolSnapshot;
import dev.nishisan.resilience.capability.SupervisedResource;
import dev.nishisan.resilience.support.FakeResource;
import dev.nishisan.resilience.support.MutableClock;
import dev.nishisan.resilience.support.RecordingMetricsRecorder;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

class HealthCheckerTest {

    private static final Duration INTERVAL = Duration.ofSeconds(60);

    private HealthChecker checker(HealthCheckable target) {
        return new HealthChecker(target, INTERVAL);
    }

    @Test
    void startsHealthyWithNoFailures() {
        HealthChecker checker = checker(new FakeResource("db"));
        assertTrue(checker.isHealthy());
        assertEquals(0, checker.consecutiveFailures());
        assertNull(checker.status().lastCheckTime());
    }

    @Test
    void failuresExtendTheStreakAndSuccessResetsIt() {
        FakeResource db = new FakeResource("db").healthy(false);
        HealthChecker checker = checker(db);

        checker.check();
        checker.check();
        assertFalse(checker.isHealthy());
        assertEquals(2, checker.consecutiveFailures());
        assertEquals(0, db.reconnectCalls.get());

        db.healthy(true);
        checker.check();
        assertTrue(checker.isHealthy());
        assertEquals(0, checker.consecutiveFailures());
    }

    @Test
    void successfulRecoveryAtThresholdResetsState() {
        FakeResource db = new FakeResource("db").healthy(false).reconnectSucceeds(true);
        HealthChecker checker = checker(db);

        checker.check();
        checker.check();
        assertEquals(0, db.reconnectCalls.get());
        checker.check();

        assertEquals(1, db.reconnectCalls.get());
        assertTrue(checker.isHealthy());
        assertEquals(0, checker.consecutiveFailures());
    }

    @Test
    void failedRecoveryKeepsStreakAndRetriesOnNextMultiple() {
        FakeResource db = new FakeResource("db").healthy(false).reconnectSucceeds(false);
        HealthChecker checker = checker(db);

        for (int i = 0; i < 3; i++) {
            checker.check();
        }
        assertEquals(1, db.reconnectCalls.get());
        assertEquals(3, checker.consecutiveFailures());
        assertFalse(checker.isHealthy());

        checker.check();
        checker.check();
        assertEquals(1, db.reconnectCalls.get());
        assertEquals(5, checker.consecutiveFailures());

        checker.check();
        assertEquals(2, db.reconnectCalls.get());
        assertEquals(6, checker.consecutiveFailures());
    }

    @Test
    void nonRecoverableTargetIsOnlyProbed() {
        AtomicInteger probes = new AtomicInteger();
        HealthCheckable probeOnly = new HealthCheckable() {
            @Override
            public void checkHealth() throws ResourceException {
                probes.incrementAndGet();
                throw new ResourceException("down");
            }

            @Override
            public String name() {
                return "cache";
            }
        };
        HealthChecker checker = checker(probeOnly);

        for (int i = 0; i < 6; i++) {
            checker.check();
        }
        assertEquals(6, probes.get());
        assertEquals(6, checker.consecutiveFailures());
        assertFalse(checker.isHealthy());
    }

    @Test
    void runtimeExceptionFromProbeCountsAsFailure() {
        HealthCheckable broken = new HealthCheckable() {
            @Override
            public void checkHealth() {
                throw new IllegalStateException("driver bug");
            }

            @Override
            public String name() {
                return "broken";
            }
        };
        HealthChecker checker = checker(broken);
        checker.check();
        assertFalse(checker.isHealthy());
        assertEquals(1, checker.consecutiveFailures());
    }

    @Test
    void probePayloadIsPassedToTarget() {
        FakeResource db = new FakeResource("db");
        HealthChecker checker = new HealthChecker(db, INTERVAL, "SELECT 1");
        checker.check();
        assertEquals("SELECT 1", db.lastProbe());
        assertEquals(1, db.healthChecks.get());
    }

    @Test
    void blankProbeUsesPlainCheck() {
        FakeResource db = new FakeResource("db");
        HealthChecker checker = new HealthChecker(db, INTERVAL, "  ");
        checker.check();
        assertNull(db.lastProbe());
        assertEquals(1, db.healthChecks.get());
    }

    @Test
    void outcomesAreRecordedAndTimestamped() {
        FakeResource db = new FakeResource("db");
        RecordingMetricsRecorder recorder = new RecordingMetricsRecorder();
        MutableClock clock = new MutableClock(Instant.parse("2025-01-01T00:00:00Z"));
        HealthChecker checker = new HealthChecker(db, INTERVAL, null, 3, recorder, clock);

        checker.check();
        db.healthy(false);
        clock.advance(Duration.ofSeconds(30));
        checker.check();

        assertEquals(1, recorder.healthSuccess.get());
        assertEquals(1, recorder.healthFailure.get());
        HealthStatus status = checker.status();
        assertEquals(Instant.parse("2025-01-01T00:00:30Z"), status.lastCheckTime());
        assertFalse(status.healthy());
        assertEquals(1, status.consecutiveFailures());
    }

    @Test
    void customThresholdTriggersEarlierRecovery() {
        FakeResource db = new FakeResource("db").healthy(false).reconnectSucceeds(false);
        HealthChecker checker = new HealthChecker(db, INTERVAL, null, 1, MetricsRecorder.noOp());
        checker.check();
        checker.check();
        assertEquals(2, db.reconnectCalls.get());
    }

    @Test
    void rejectsInvalidArguments() {
        assertThrows(NullPointerException.class, () -> new HealthChecker(null, INTERVAL));
        FakeResource db = new FakeResource("db");
        assertThrows(IllegalArgumentException.class, () -> new HealthChecker(db, Duration.ZERO));
        assertThrows(IllegalArgumentException.class,
                () -> new HealthChecker(db, INTERVAL, null, 0, MetricsRecorder.noOp()));
    }

    @Test
    @Timeout(10)
    void isHealthyDoesNotWaitForSlowReconnect() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        SupervisedResource slow = new FakeResource("slow") {
            @Override
            public void reconnect() throws ResourceException {
                entered.countDown();
                try {
                    release.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                throw new ResourceException("still down");
            }
        }.healthy(false);
        HealthChecker checker = new HealthChecker(slow, INTERVAL, null, 1, MetricsRecorder.noOp());

        Thread worker = new Thread(checker::check);
        worker.start();
        assertTrue(entered.await(5, TimeUnit.SECONDS));

        assertFalse(checker.isHealthy());
        assertEquals(1, checker.consecutiveFailures());

        release.countDown();
        worker.join();
    }

    @Test
    @Timeout(10)
    void scheduledChecksRunUntilStopped() {
        FakeResource db = new FakeResource("db").stats(PoolSnapshot.empty());
        HealthChecker checker = new HealthChecker(db, Duration.ofMillis(20));
        checker.start();
        try {
            await().atMost(Duration.ofSeconds(5)).until(() -> db.healthChecks.get() >= 3);
            assertTrue(checker.isRunning());
        } finally {
            checker.stop();
        }
        assertFalse(checker.isRunning());
    }
}
