package dev.nishisan.resilience.supervisor;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

class AbstractSupervisorTest {

    private static class CountingSupervisor extends AbstractSupervisor {
        final AtomicInteger ticks = new AtomicInteger();
        final AtomicInteger concurrent = new AtomicInteger();
        final AtomicInteger maxConcurrent = new AtomicInteger();
        volatile Runnable onTick = () -> { };

        CountingSupervisor(Duration interval) {
            super("counting", "test-resource", interval);
        }

        @Override
        protected void tick() {
            int now = concurrent.incrementAndGet();
            maxConcurrent.accumulateAndGet(now, Math::max);
            try {
                ticks.incrementAndGet();
                onTick.run();
            } finally {
                concurrent.decrementAndGet();
            }
        }
    }

    @Test
    @Timeout(10)
    void ticksSequentiallyUntilStopped() {
        CountingSupervisor supervisor = new CountingSupervisor(Duration.ofMillis(10));
        supervisor.onTick = () -> {
            try {
                Thread.sleep(5);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        };
        supervisor.start();
        await().atMost(Duration.ofSeconds(5)).until(() -> supervisor.ticks.get() >= 5);
        supervisor.stop();

        int afterStop = supervisor.ticks.get();
        assertEquals(1, supervisor.maxConcurrent.get());
        assertFalse(supervisor.isRunning());
        await().during(Duration.ofMillis(100)).atMost(Duration.ofSeconds(1))
                .until(() -> supervisor.ticks.get() == afterStop);
    }

    @Test
    void stopIsIdempotent() {
        CountingSupervisor supervisor = new CountingSupervisor(Duration.ofMillis(50));
        supervisor.start();
        supervisor.stop();
        assertDoesNotThrow(supervisor::stop);
        assertDoesNotThrow(supervisor::close);
    }

    @Test
    void stopBeforeStartIsHarmless() {
        CountingSupervisor supervisor = new CountingSupervisor(Duration.ofMillis(50));
        assertDoesNotThrow(supervisor::stop);
        assertFalse(supervisor.isRunning());
        assertEquals(0, supervisor.ticks.get());
    }

    @Test
    void cannotRestartAfterStop() {
        CountingSupervisor supervisor = new CountingSupervisor(Duration.ofMillis(50));
        supervisor.start();
        supervisor.stop();
        assertThrows(IllegalStateException.class, supervisor::start);
    }

    @Test
    void secondStartIsNoOp() {
        CountingSupervisor supervisor = new CountingSupervisor(Duration.ofSeconds(60));
        supervisor.start();
        try {
            assertDoesNotThrow(supervisor::start);
            assertTrue(supervisor.isRunning());
        } finally {
            supervisor.stop();
        }
    }

    @Test
    @Timeout(10)
    void failingTickDoesNotKillTheWorker() {
        CountingSupervisor supervisor = new CountingSupervisor(Duration.ofMillis(10));
        supervisor.onTick = () -> {
            throw new IllegalStateException("tick failure");
        };
        supervisor.start();
        try {
            await().atMost(Duration.ofSeconds(5)).until(() -> supervisor.ticks.get() >= 3);
        } finally {
            supervisor.stop();
        }
    }

    @Test
    @Timeout(10)
    void stopFromInsideTickReturns() throws Exception {
        CountingSupervisor supervisor = new CountingSupervisor(Duration.ofMillis(10));
        CountDownLatch stoppedInside = new CountDownLatch(1);
        supervisor.onTick = () -> {
            supervisor.stop();
            stoppedInside.countDown();
        };
        supervisor.start();
        assertTrue(stoppedInside.await(5, TimeUnit.SECONDS));
        assertFalse(supervisor.isRunning());
    }

    @Test
    @Timeout(30)
    void concurrentStartAndStopLeaveNothingRunning() throws Exception {
        for (int i = 0; i < 200; i++) {
            CountingSupervisor supervisor = new CountingSupervisor(Duration.ofMillis(1));
            CountDownLatch go = new CountDownLatch(1);
            AtomicReference<Throwable> startFailure = new AtomicReference<>();
            Thread starter = new Thread(() -> {
                try {
                    go.await();
                    supervisor.start();
                } catch (IllegalStateException e) {
                    // stop() won the race
                } catch (Throwable t) {
                    startFailure.set(t);
                }
            });
            Thread stopper = new Thread(() -> {
                try {
                    go.await();
                    supervisor.stop();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });
            starter.start();
            stopper.start();
            go.countDown();
            starter.join();
            stopper.join();

            assertNull(startFailure.get(), () -> "start() failed: " + startFailure.get());
            assertFalse(supervisor.isRunning());
        }
        await().atMost(Duration.ofSeconds(10)).until(() -> Thread.getAllStackTraces().keySet().stream()
                .noneMatch(t -> t.isAlive() && t.getName().equals("counting-test-resource")));
    }

    @Test
    void workerThreadIsNamedAfterKindAndTarget() throws Exception {
        AtomicReference<String> threadName = new AtomicReference<>();
        CountDownLatch ticked = new CountDownLatch(1);
        CountingSupervisor supervisor = new CountingSupervisor(Duration.ofMillis(10));
        supervisor.onTick = () -> {
            threadName.set(Thread.currentThread().getName());
            ticked.countDown();
        };
        supervisor.start();
        try {
            assertTrue(ticked.await(5, TimeUnit.SECONDS));
        } finally {
            supervisor.stop();
        }
        assertEquals("counting-test-resource", threadName.get());
    }

    @Test
    void rejectsNonPositiveInterval() {
        assertThrows(IllegalArgumentException.class, () -> new CountingSupervisor(Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> new CountingSupervisor(Duration.ofSeconds(-1)));
        assertThrows(NullPointerException.class, () -> new CountingSupervisor(null));
    }
}
