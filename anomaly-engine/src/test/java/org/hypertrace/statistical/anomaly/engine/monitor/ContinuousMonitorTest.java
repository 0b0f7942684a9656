package org.hypertrace.statistical.anomaly.engine.monitor;

import static org.mockito.Mockito.after;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.hypertrace.statistical.anomaly.engine.AnomalyDetectionEngine;
import org.hypertrace.statistical.anomaly.engine.EngineConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

class ContinuousMonitorTest {
  private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
  private final AnomalyDetectionEngine engine = mock(AnomalyDetectionEngine.class);
  private final EngineConfig engineConfig =
      EngineConfig.builder()
          .pollInterval(Duration.ofMillis(200))
          .errorBackoffInterval(Duration.ofSeconds(1))
          .build();
  private ContinuousMonitor monitor;

  @AfterEach
  void tearDown() throws Exception {
    if (monitor != null) {
      monitor.stop();
    }
  }

  @Test
  void testRunsCycleEveryPollInterval() throws Exception {
    when(engine.runCycle()).thenReturn(List.of());

    monitor = ContinuousMonitor.start(engine, engineConfig, meterRegistry);

    Assertions.assertTrue(monitor.isRunning());
    verify(engine, timeout(2_000).atLeast(3)).runCycle();
  }

  @Test
  void testFailedCycleBacksOffAndLoopSurvives() throws Exception {
    when(engine.runCycle())
        .thenThrow(new IllegalStateException("source exploded"))
        .thenReturn(List.of());

    monitor = ContinuousMonitor.start(engine, engineConfig, meterRegistry);

    // the 200ms cadence is suspended while backing off
    verify(engine, after(700).times(1)).runCycle();
    verify(engine, timeout(2_000).atLeast(3)).runCycle();
    Assertions.assertEquals(
        1.0, meterRegistry.get(MonitoringJobConstants.CYCLE_ERROR_COUNTER).counter().count());
  }

  @Test
  void testStopWaitsForRunningCycle() throws Exception {
    CountDownLatch cycleStarted = new CountDownLatch(1);
    AtomicBoolean cycleCompleted = new AtomicBoolean();
    when(engine.runCycle())
        .thenAnswer(
            invocation -> {
              cycleStarted.countDown();
              Thread.sleep(500);
              cycleCompleted.set(true);
              return List.of();
            });

    monitor = ContinuousMonitor.start(engine, engineConfig, meterRegistry);
    Assertions.assertTrue(cycleStarted.await(2, TimeUnit.SECONDS));

    monitor.stop();

    Assertions.assertTrue(cycleCompleted.get());
    Assertions.assertFalse(monitor.isRunning());
    Mockito.clearInvocations(engine);
    verify(engine, after(500).never()).runCycle();
  }

  @Test
  void testStopIsIdempotent() throws Exception {
    when(engine.runCycle()).thenReturn(List.of());
    monitor = ContinuousMonitor.start(engine, engineConfig, meterRegistry);

    monitor.stop();
    monitor.stop();

    Assertions.assertFalse(monitor.isRunning());
  }
}
