package org.hypertrace.statistical.anomaly.datamodel;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/** A monitored metric: which detector watches it and how its value is queried. */
@Builder
@Getter
@ToString
public class MetricDefinition {
  private final String metricName;
  // raw type as configured, resolved by the detector factory
  private final String detectorType;
  @Builder.Default private final Config detectorParams = ConfigFactory.empty();
  private final String query;
}
