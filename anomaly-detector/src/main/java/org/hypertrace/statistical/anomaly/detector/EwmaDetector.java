package org.hypertrace.statistical.anomaly.detector;

import com.google.common.base.Preconditions;
import com.google.common.collect.EvictingQueue;
import java.time.Clock;
import java.util.Optional;
import org.hypertrace.statistical.anomaly.datamodel.AnomalyResult;
import org.hypertrace.statistical.anomaly.datamodel.DetectorKind;
import org.hypertrace.statistical.anomaly.datamodel.DetectorSnapshot;
import org.hypertrace.statistical.anomaly.datamodel.DetectorState;
import org.hypertrace.statistical.anomaly.datamodel.Severity;

/**
 * Exponentially weighted moving average detector. Tracks a running mean and variance and flags
 * samples whose distance to the mean exceeds {@code threshold} standard deviations. Suited to
 * gradual drifts such as error rates or resource usage.
 *
 * <p>Note the score is taken after the sample was folded into the estimates, which bounds it by
 * {@code (1 - alpha) / sqrt(alpha)}.
 */
public class EwmaDetector implements Detector {
  static final double DEFAULT_ALPHA = 0.3;
  static final double DEFAULT_THRESHOLD = 2.0;
  static final int DIAGNOSTIC_BUFFER_CAPACITY = 100;

  private final String metricName;
  private final double alpha;
  private final double threshold;
  private final Clock clock;
  private final EvictingQueue<Double> dataPoints = EvictingQueue.create(DIAGNOSTIC_BUFFER_CAPACITY);

  private boolean initialized;
  private double ewma;
  private double variance;
  private volatile DetectorSnapshot snapshot;

  public EwmaDetector(String metricName, double alpha, double threshold) {
    this(metricName, alpha, threshold, Clock.systemUTC());
  }

  public EwmaDetector(String metricName, double alpha, double threshold, Clock clock) {
    Preconditions.checkArgument(alpha > 0 && alpha < 1, "alpha must be in (0, 1): %s", alpha);
    Preconditions.checkArgument(threshold > 0, "threshold must be positive: %s", threshold);
    this.metricName = metricName;
    this.alpha = alpha;
    this.threshold = threshold;
    this.clock = clock;
    this.snapshot = buildSnapshot(null);
  }

  @Override
  public Optional<AnomalyResult> update(double value) {
    Preconditions.checkArgument(Double.isFinite(value), "value must be finite: %s", value);
    dataPoints.add(value);

    if (!initialized) {
      ewma = value;
      variance = 0.0;
      initialized = true;
      snapshot = buildSnapshot(value);
      return Optional.empty();
    }

    double previous = ewma;
    // same as alpha * value + (1 - alpha) * previous, but exact when value == previous
    ewma = previous + alpha * (value - previous);
    variance = alpha * Math.pow(value - previous, 2) + (1 - alpha) * variance;

    double stdDev = Math.sqrt(variance);
    double anomalyScore = variance > 0 ? Math.abs(value - ewma) / stdDev : 0.0;
    snapshot = buildSnapshot(value);

    if (anomalyScore <= threshold) {
      return Optional.empty();
    }

    return Optional.of(
        AnomalyResult.builder()
            .metricName(metricName)
            .currentValue(value)
            .baselineValue(ewma)
            .deviationFactor(anomalyScore)
            .anomalyScore(anomalyScore)
            .anomaly(true)
            .severity(determineSeverity(anomalyScore))
            .timestamp(clock.instant())
            .contextEntry("alpha", alpha)
            .contextEntry("threshold", threshold)
            .contextEntry("std_dev", stdDev)
            .contextEntry("data_points", dataPoints.size())
            .build());
  }

  @Override
  public DetectorKind getKind() {
    return DetectorKind.EWMA;
  }

  @Override
  public DetectorSnapshot snapshot() {
    return snapshot;
  }

  static Severity determineSeverity(double score) {
    if (score >= 4.0) {
      return Severity.CRITICAL;
    } else if (score >= 3.0) {
      return Severity.HIGH;
    } else if (score >= 2.5) {
      return Severity.MEDIUM;
    }
    return Severity.LOW;
  }

  private DetectorSnapshot buildSnapshot(Double latestValue) {
    DetectorSnapshot.DetectorSnapshotBuilder builder =
        DetectorSnapshot.builder()
            .metricName(metricName)
            .kind(DetectorKind.EWMA)
            .state(initialized ? DetectorState.ACTIVE : DetectorState.COLD_START)
            .sampleCount(dataPoints.size())
            .latestValue(latestValue);
    if (initialized) {
      builder.estimate("ewma", ewma).estimate("variance", variance);
    }
    return builder.build();
  }
}
