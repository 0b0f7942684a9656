package org.hypertrace.statistical.anomaly.datamodel;

import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

/**
 * Outcome of a detector update that flagged a metric value. Instances are created by the
 * detectors only and never change once returned.
 */
@Builder
@Getter
@ToString
public class AnomalyResult {
  private final String metricName;
  private final double currentValue;
  private final double baselineValue;
  private final double deviationFactor;
  private final double anomalyScore;
  private final boolean anomaly;
  private final Severity severity;
  private final Instant timestamp;

  // detector specific diagnostics, insertion ordered
  @Singular("contextEntry")
  private final Map<String, Object> context;
}
