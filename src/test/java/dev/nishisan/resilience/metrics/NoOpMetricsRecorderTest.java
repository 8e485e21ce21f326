package dev.nishisan.resilience.metrics;

import dev.nishisan.resilience.pool.PoolSnapshot;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class NoOpMetricsRecorderTest {

    @Test
    void noOpIsASharedInstance() {
        assertSame(MetricsRecorder.noOp(), MetricsRecorder.noOp());
    }

    @Test
    void acceptsEveryCallIncludingNulls() {
        MetricsRecorder recorder = MetricsRecorder.noOp();
        assertDoesNotThrow(() -> {
            recorder.recordPoolStats(PoolSnapshot.empty());
            recorder.recordPoolStats(null);
            recorder.recordHealthCheck(false);
            recorder.recordQuery(Duration.ofMillis(5), new RuntimeException(), null);
            recorder.recordTx(Duration.ZERO, true);
            recorder.incConnectAttempt();
            recorder.incConnectRetry();
            recorder.incConnectSuccess();
            recorder.incConnectFailure();
        });
    }
}
