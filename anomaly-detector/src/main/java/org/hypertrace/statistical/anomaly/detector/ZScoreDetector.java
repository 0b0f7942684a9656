package org.hypertrace.statistical.anomaly.detector;

import com.google.common.base.Preconditions;
import com.google.common.collect.EvictingQueue;
import java.time.Clock;
import java.util.Optional;
import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.hypertrace.statistical.anomaly.datamodel.AnomalyResult;
import org.hypertrace.statistical.anomaly.datamodel.DetectorKind;
import org.hypertrace.statistical.anomaly.datamodel.DetectorSnapshot;
import org.hypertrace.statistical.anomaly.datamodel.DetectorState;
import org.hypertrace.statistical.anomaly.datamodel.Severity;

/**
 * Sliding window z-score detector, good at sudden spikes and drops. Each sample is scored
 * against the window of samples that preceded it and then enters the window, so the earliest
 * update that can be flagged is the 11th: it is the first one scored against 10 prior samples.
 */
public class ZScoreDetector implements Detector {
  static final int DEFAULT_WINDOW_SIZE = 50;
  static final double DEFAULT_THRESHOLD = 2.5;
  static final int MIN_SAMPLES = 10;

  private final String metricName;
  private final int windowSize;
  private final double threshold;
  private final Clock clock;
  private final EvictingQueue<Double> window;
  private final Mean mean = new Mean();
  // bias corrected, n - 1 denominator
  private final StandardDeviation standardDeviation = new StandardDeviation();

  private volatile DetectorSnapshot snapshot;

  public ZScoreDetector(String metricName, int windowSize, double threshold) {
    this(metricName, windowSize, threshold, Clock.systemUTC());
  }

  public ZScoreDetector(String metricName, int windowSize, double threshold, Clock clock) {
    Preconditions.checkArgument(
        windowSize >= MIN_SAMPLES, "windowSize must be at least %s: %s", MIN_SAMPLES, windowSize);
    Preconditions.checkArgument(threshold > 0, "threshold must be positive: %s", threshold);
    this.metricName = metricName;
    this.windowSize = windowSize;
    this.threshold = threshold;
    this.clock = clock;
    this.window = EvictingQueue.create(windowSize);
    this.snapshot = buildSnapshot(null);
  }

  @Override
  public Optional<AnomalyResult> update(double value) {
    Preconditions.checkArgument(Double.isFinite(value), "value must be finite: %s", value);
    Optional<AnomalyResult> result = score(value);
    window.add(value);
    snapshot = buildSnapshot(value);
    return result;
  }

  private Optional<AnomalyResult> score(double value) {
    if (window.size() < MIN_SAMPLES) {
      return Optional.empty();
    }

    double[] history = DetectorUtil.toArray(window);
    double windowMean = mean.evaluate(history);
    double windowStdDev = standardDeviation.evaluate(history, windowMean);

    // a flat history gives no basis to judge a deviation, min == max also covers rounding residue
    if (windowStdDev == 0 || StatUtils.max(history) == StatUtils.min(history)) {
      return Optional.empty();
    }

    double zScore = Math.abs(value - windowMean) / windowStdDev;
    if (zScore <= threshold) {
      return Optional.empty();
    }

    return Optional.of(
        AnomalyResult.builder()
            .metricName(metricName)
            .currentValue(value)
            .baselineValue(windowMean)
            .deviationFactor(zScore)
            .anomalyScore(zScore)
            .anomaly(true)
            .severity(determineSeverity(zScore))
            .timestamp(clock.instant())
            .contextEntry("window_size", history.length)
            .contextEntry("threshold", threshold)
            .contextEntry("mean", windowMean)
            .contextEntry("std_dev", windowStdDev)
            .build());
  }

  @Override
  public DetectorKind getKind() {
    return DetectorKind.ZSCORE;
  }

  @Override
  public DetectorSnapshot snapshot() {
    return snapshot;
  }

  int getWindowSize() {
    return windowSize;
  }

  static Severity determineSeverity(double zScore) {
    if (zScore >= 4.0) {
      return Severity.CRITICAL;
    } else if (zScore >= 3.5) {
      return Severity.HIGH;
    } else if (zScore >= 3.0) {
      return Severity.MEDIUM;
    }
    return Severity.LOW;
  }

  private DetectorSnapshot buildSnapshot(Double latestValue) {
    DetectorSnapshot.DetectorSnapshotBuilder builder =
        DetectorSnapshot.builder()
            .metricName(metricName)
            .kind(DetectorKind.ZSCORE)
            .state(state())
            .sampleCount(window.size())
            .latestValue(latestValue);
    if (!window.isEmpty()) {
      double[] values = DetectorUtil.toArray(window);
      double windowMean = mean.evaluate(values);
      builder.estimate("mean", windowMean);
      if (values.length > 1) {
        builder.estimate("std_dev", standardDeviation.evaluate(values, windowMean));
      }
    }
    return builder.build();
  }

  private DetectorState state() {
    if (window.isEmpty()) {
      return DetectorState.COLD_START;
    }
    return window.size() < MIN_SAMPLES ? DetectorState.WARMING : DetectorState.ACTIVE;
  }
}
