package org.hypertrace.statistical.anomaly.datamodel;

import java.util.Map;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

@Builder
@Getter
@ToString
public class DetectorSnapshot {
  private final String metricName;
  private final DetectorKind kind;
  private final DetectorState state;
  private final int sampleCount;
  // null until the first sample arrives
  private final Double latestValue;

  @Singular("estimate")
  private final Map<String, Double> estimates;
}
