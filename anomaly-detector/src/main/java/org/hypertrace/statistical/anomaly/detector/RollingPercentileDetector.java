package org.hypertrace.statistical.anomaly.detector;

import com.google.common.base.Preconditions;
import com.google.common.collect.EvictingQueue;
import java.time.Clock;
import java.util.Optional;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.apache.commons.math3.stat.descriptive.rank.Percentile.EstimationType;
import org.hypertrace.statistical.anomaly.datamodel.AnomalyResult;
import org.hypertrace.statistical.anomaly.datamodel.DetectorKind;
import org.hypertrace.statistical.anomaly.datamodel.DetectorSnapshot;
import org.hypertrace.statistical.anomaly.datamodel.DetectorState;
import org.hypertrace.statistical.anomaly.datamodel.Severity;

/**
 * Compares the current percentile of a rolling window (p95 by default) against the mean of the
 * percentiles computed on earlier samples. Targets tail latency and distribution shifts.
 */
public class RollingPercentileDetector implements Detector {
  static final int DEFAULT_WINDOW_SIZE = 100;
  static final double DEFAULT_PERCENTILE = 95.0;
  static final double DEFAULT_THRESHOLD_MULTIPLIER = 2.0;
  static final int DEFAULT_HISTORY_SIZE = 50;
  static final int MIN_WINDOW_SAMPLES = 20;
  static final int MIN_HISTORY_SAMPLES = 10;

  private final String metricName;
  private final double percentile;
  private final double thresholdMultiplier;
  private final Clock clock;
  private final EvictingQueue<Double> values;
  private final EvictingQueue<Double> historicalPercentiles;
  // R-7, linear interpolation between closest ranks
  private final Percentile percentileEstimator =
      new Percentile().withEstimationType(EstimationType.R_7);
  private final Mean mean = new Mean();

  private volatile DetectorSnapshot snapshot;

  public RollingPercentileDetector(
      String metricName, int windowSize, double percentile, double thresholdMultiplier) {
    this(
        metricName,
        windowSize,
        percentile,
        thresholdMultiplier,
        DEFAULT_HISTORY_SIZE,
        Clock.systemUTC());
  }

  public RollingPercentileDetector(
      String metricName,
      int windowSize,
      double percentile,
      double thresholdMultiplier,
      int historySize,
      Clock clock) {
    Preconditions.checkArgument(
        windowSize >= MIN_WINDOW_SAMPLES,
        "windowSize must be at least %s: %s",
        MIN_WINDOW_SAMPLES,
        windowSize);
    Preconditions.checkArgument(
        percentile > 0 && percentile <= 100, "percentile must be in (0, 100]: %s", percentile);
    Preconditions.checkArgument(
        thresholdMultiplier > 0, "thresholdMultiplier must be positive: %s", thresholdMultiplier);
    Preconditions.checkArgument(
        historySize >= MIN_HISTORY_SAMPLES,
        "historySize must be at least %s: %s",
        MIN_HISTORY_SAMPLES,
        historySize);
    this.metricName = metricName;
    this.percentile = percentile;
    this.thresholdMultiplier = thresholdMultiplier;
    this.clock = clock;
    this.values = EvictingQueue.create(windowSize);
    this.historicalPercentiles = EvictingQueue.create(historySize);
    this.snapshot = buildSnapshot(null, null);
  }

  @Override
  public Optional<AnomalyResult> update(double value) {
    Preconditions.checkArgument(Double.isFinite(value), "value must be finite: %s", value);
    values.add(value);

    if (values.size() < MIN_WINDOW_SAMPLES) {
      snapshot = buildSnapshot(value, null);
      return Optional.empty();
    }

    double currentPercentile = percentileEstimator.evaluate(DetectorUtil.toArray(values), percentile);
    historicalPercentiles.add(currentPercentile);
    snapshot = buildSnapshot(value, currentPercentile);

    if (historicalPercentiles.size() < MIN_HISTORY_SAMPLES) {
      return Optional.empty();
    }

    double historicalMean = mean.evaluate(DetectorUtil.toArray(historicalPercentiles));
    // a ratio against a non positive baseline carries no meaning
    if (historicalMean <= 0) {
      return Optional.empty();
    }

    double threshold = historicalMean * thresholdMultiplier;
    if (currentPercentile <= threshold) {
      return Optional.empty();
    }

    double ratio = currentPercentile / historicalMean;
    return Optional.of(
        AnomalyResult.builder()
            .metricName(metricName)
            .currentValue(currentPercentile)
            .baselineValue(historicalMean)
            .deviationFactor(ratio)
            .anomalyScore(ratio)
            .anomaly(true)
            .severity(determineSeverity(ratio))
            .timestamp(clock.instant())
            .contextEntry("percentile", percentile)
            .contextEntry("threshold_multiplier", thresholdMultiplier)
            .contextEntry("window_size", values.size())
            .contextEntry("historical_samples", historicalPercentiles.size())
            .contextEntry("threshold", threshold)
            .build());
  }

  @Override
  public DetectorKind getKind() {
    return DetectorKind.ROLLING_PERCENTILE;
  }

  @Override
  public DetectorSnapshot snapshot() {
    return snapshot;
  }

  static Severity determineSeverity(double ratio) {
    if (ratio >= 5.0) {
      return Severity.CRITICAL;
    } else if (ratio >= 3.0) {
      return Severity.HIGH;
    } else if (ratio >= 2.5) {
      return Severity.MEDIUM;
    }
    return Severity.LOW;
  }

  private DetectorSnapshot buildSnapshot(Double latestValue, Double currentPercentile) {
    DetectorSnapshot.DetectorSnapshotBuilder builder =
        DetectorSnapshot.builder()
            .metricName(metricName)
            .kind(DetectorKind.ROLLING_PERCENTILE)
            .state(state())
            .sampleCount(values.size())
            .latestValue(latestValue)
            .estimate("historical_samples", (double) historicalPercentiles.size());
    if (currentPercentile != null) {
      builder.estimate("current_percentile", currentPercentile);
    }
    if (!historicalPercentiles.isEmpty()) {
      builder.estimate(
          "historical_mean", mean.evaluate(DetectorUtil.toArray(historicalPercentiles)));
    }
    return builder.build();
  }

  private DetectorState state() {
    if (values.isEmpty()) {
      return DetectorState.COLD_START;
    }
    return historicalPercentiles.size() < MIN_HISTORY_SAMPLES
        ? DetectorState.WARMING
        : DetectorState.ACTIVE;
  }
}
