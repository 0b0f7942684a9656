package org.hypertrace.statistical.anomaly.detector;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import org.hypertrace.statistical.anomaly.datamodel.AnomalyResult;
import org.hypertrace.statistical.anomaly.datamodel.DetectorKind;
import org.hypertrace.statistical.anomaly.datamodel.DetectorSnapshot;
import org.hypertrace.statistical.anomaly.datamodel.DetectorState;
import org.hypertrace.statistical.anomaly.datamodel.Severity;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class EwmaDetectorTest {
  private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");
  private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);

  @Test
  void testFirstValueOnlyInitializes() {
    EwmaDetector detector = new EwmaDetector("error_rate", 0.3, 2.0, clock);
    Assertions.assertEquals(DetectorState.COLD_START, detector.snapshot().getState());

    Assertions.assertTrue(detector.update(42.0).isEmpty());

    DetectorSnapshot snapshot = detector.snapshot();
    Assertions.assertEquals(DetectorState.ACTIVE, snapshot.getState());
    Assertions.assertEquals(DetectorKind.EWMA, snapshot.getKind());
    Assertions.assertEquals(1, snapshot.getSampleCount());
    Assertions.assertEquals(42.0, snapshot.getEstimates().get("ewma"));
    Assertions.assertEquals(0.0, snapshot.getEstimates().get("variance"));
  }

  @Test
  void testConstantInputNeverProducesAScore() {
    EwmaDetector detector = new EwmaDetector("cpu_usage", 0.2, 0.5, clock);
    for (int i = 0; i < 200; i++) {
      Assertions.assertTrue(detector.update(1.7).isEmpty());
    }
    DetectorSnapshot snapshot = detector.snapshot();
    double variance = snapshot.getEstimates().get("variance");
    Assertions.assertTrue(Double.isFinite(variance));
    Assertions.assertEquals(0.0, variance, 1e-12);
    Assertions.assertEquals(1.7, snapshot.getEstimates().get("ewma"), 1e-9);
  }

  @Test
  void testSpikeAfterFlatBaseline() {
    EwmaDetector detector = new EwmaDetector("error_rate", 0.3, 1.0, clock);
    for (int i = 0; i < 10; i++) {
      Assertions.assertTrue(detector.update(0.01).isEmpty());
    }

    Optional<AnomalyResult> result = detector.update(0.5);

    Assertions.assertTrue(result.isPresent());
    AnomalyResult anomaly = result.get();
    Assertions.assertTrue(anomaly.isAnomaly());
    Assertions.assertEquals("error_rate", anomaly.getMetricName());
    Assertions.assertEquals(0.5, anomaly.getCurrentValue());
    // ewma = 0.3 * 0.5 + 0.7 * 0.01
    Assertions.assertEquals(0.157, anomaly.getBaselineValue(), 1e-9);
    // (1 - alpha) / sqrt(alpha)
    Assertions.assertEquals(0.7 / Math.sqrt(0.3), anomaly.getAnomalyScore(), 1e-6);
    Assertions.assertEquals(anomaly.getAnomalyScore(), anomaly.getDeviationFactor());
    Assertions.assertEquals(Severity.LOW, anomaly.getSeverity());
    Assertions.assertEquals(NOW, anomaly.getTimestamp());
    Assertions.assertEquals(0.3, anomaly.getContext().get("alpha"));
    Assertions.assertEquals(1.0, anomaly.getContext().get("threshold"));
    Assertions.assertEquals(11, anomaly.getContext().get("data_points"));
    Assertions.assertTrue(anomaly.getContext().containsKey("std_dev"));
  }

  @Test
  void testSmallStepAroundLargeLevelStillScores() {
    EwmaDetector detector = new EwmaDetector("bytes_sent", 0.3, 1.0, clock);
    for (int i = 0; i < 10; i++) {
      Assertions.assertTrue(detector.update(1e10).isEmpty());
    }

    Optional<AnomalyResult> result = detector.update(1e10 + 1);

    Assertions.assertTrue(result.isPresent());
    Assertions.assertEquals(0.7 / Math.sqrt(0.3), result.get().getAnomalyScore(), 1e-4);
  }

  @Test
  void testScoreIsBoundedBelowDefaultThreshold() {
    // with alpha 0.3 no single step can score above (1 - 0.3) / sqrt(0.3), about 1.28
    EwmaDetector detector = new EwmaDetector("error_rate", 0.3, 2.0, clock);
    for (int i = 0; i < 20; i++) {
      detector.update(100.0);
    }
    Assertions.assertTrue(detector.update(200.0).isEmpty());
    Assertions.assertTrue(detector.update(10_000.0).isEmpty());
  }

  @Test
  void testScoreDecaysAfterReturningToBaseline() {
    EwmaDetector detector = new EwmaDetector("error_rate", 0.3, 1.0, clock);
    for (int i = 0; i < 10; i++) {
      detector.update(0.01);
    }
    Assertions.assertTrue(detector.update(0.5).isPresent());

    for (int i = 0; i < 30; i++) {
      Assertions.assertTrue(detector.update(0.01).isEmpty(), "step " + i);
    }
    double ewma = detector.snapshot().getEstimates().get("ewma");
    Assertions.assertEquals(0.01, ewma, 1e-3);

    // variance has lapsed, so a second spike qualifies again
    Assertions.assertTrue(detector.update(0.5).isPresent());
  }

  @Test
  void testDiagnosticBufferIsBounded() {
    EwmaDetector detector = new EwmaDetector("memory_usage", 0.2, 2.5, clock);
    for (int i = 0; i < 250; i++) {
      detector.update(i % 7);
    }
    Assertions.assertEquals(
        EwmaDetector.DIAGNOSTIC_BUFFER_CAPACITY, detector.snapshot().getSampleCount());
    Assertions.assertEquals(4.0, detector.snapshot().getLatestValue());
  }

  @Test
  void testRejectsInvalidParameters() {
    Assertions.assertThrows(IllegalArgumentException.class, () -> new EwmaDetector("m", 0, 2.0));
    Assertions.assertThrows(IllegalArgumentException.class, () -> new EwmaDetector("m", 1, 2.0));
    Assertions.assertThrows(
        IllegalArgumentException.class, () -> new EwmaDetector("m", 0.3, -1.0));
    Assertions.assertThrows(
        IllegalArgumentException.class,
        () -> new EwmaDetector("m", 0.3, 2.0).update(Double.NaN));
  }

  @ParameterizedTest
  @CsvSource({"4.0, CRITICAL", "3.2, HIGH", "2.5, MEDIUM", "2.1, LOW"})
  void testSeverityBands(double score, Severity expected) {
    Assertions.assertEquals(expected, EwmaDetector.determineSeverity(score));
  }
}
