package dev.nishisan.resilience.reconnect;

import dev.nishisan.resilience.capability.ResourceException;
import dev.nishisan.resilience.support.RecordingMetricsRecorder;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ConnectRetrierTest {

    private final List<Duration> sleeps = new ArrayList<>();
    private final RecordingMetricsRecorder recorder = new RecordingMetricsRecorder();

    private ConnectRetrier retrier(RetryPolicy policy) {
        return new ConnectRetrier("db", policy, recorder, sleeps::add);
    }

    @Test
    void firstAttemptSuccessDoesNotSleep() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        retrier(RetryPolicy.defaults()).connect(calls::incrementAndGet);

        assertEquals(1, calls.get());
        assertTrue(sleeps.isEmpty());
        assertEquals(1, recorder.connectAttempts.get());
        assertEquals(0, recorder.connectRetries.get());
        assertEquals(1, recorder.connectSuccesses.get());
    }

    @Test
    void retriesWithBackoffUntilSuccess() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        retrier(new RetryPolicy(5, Duration.ofMillis(100), Duration.ofSeconds(1), 2.0)).connect(() -> {
            if (calls.incrementAndGet() < 3) {
                throw new ResourceException("refused");
            }
        });

        assertEquals(3, calls.get());
        assertEquals(List.of(Duration.ofMillis(100), Duration.ofMillis(200)), sleeps);
        assertEquals(3, recorder.connectAttempts.get());
        assertEquals(2, recorder.connectRetries.get());
        assertEquals(2, recorder.connectFailures.get());
        assertEquals(1, recorder.connectSuccesses.get());
    }

    @Test
    void exhaustionThrowsLastFailureWithEarlierOnesSuppressed() {
        AtomicInteger calls = new AtomicInteger();
        ResourceException ex = assertThrows(ResourceException.class,
                () -> retrier(RetryPolicy.defaults()).connect(() -> {
                    throw new ResourceException("refused #" + calls.incrementAndGet());
                }));

        assertEquals(3, calls.get());
        assertEquals("db", ex.getResourceName());
        assertEquals("refused #3", ex.getCause().getMessage());
        assertEquals(2, ex.getSuppressed().length);
        assertEquals(List.of(Duration.ofSeconds(1), Duration.ofSeconds(2)), sleeps);
        assertEquals(3, recorder.connectFailures.get());
    }

    @Test
    void runtimeFailuresAreRetriedToo() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        retrier(RetryPolicy.defaults()).connect(() -> {
            if (calls.incrementAndGet() == 1) {
                throw new IllegalStateException("socket reset");
            }
        });
        assertEquals(2, calls.get());
    }

    @Test
    void noRetryPolicyMakesSingleAttempt() {
        AtomicInteger calls = new AtomicInteger();
        assertThrows(ResourceException.class, () -> retrier(RetryPolicy.noRetry()).connect(() -> {
            calls.incrementAndGet();
            throw new ResourceException("refused");
        }));
        assertEquals(1, calls.get());
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void interruptDuringBackoffAbortsAndRestoresFlag() {
        ConnectRetrier interrupted = new ConnectRetrier("db", RetryPolicy.defaults(), recorder, d -> {
            throw new InterruptedException();
        });
        AtomicInteger calls = new AtomicInteger();
        try {
            ResourceException ex = assertThrows(ResourceException.class, () -> interrupted.connect(() -> {
                calls.incrementAndGet();
                throw new ResourceException("refused");
            }));
            assertInstanceOf(InterruptedException.class, ex.getCause());
            assertEquals(1, ex.getSuppressed().length);
            assertEquals(1, calls.get());
            assertTrue(Thread.currentThread().isInterrupted());
        } finally {
            Thread.interrupted();
        }
    }
}
