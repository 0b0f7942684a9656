package org.hypertrace.statistical.anomaly.datamodel.definition.source;

import com.typesafe.config.Config;
import java.util.List;
import java.util.stream.Collectors;
import org.hypertrace.statistical.anomaly.datamodel.MetricDefinition;

/** Metric definitions declared inline in the application config. */
public class ConfigMetricDefinitionSource implements MetricDefinitionSource {
  private static final String METRICS_CONFIG = "metrics";
  private final Config sourceConfig;

  public ConfigMetricDefinitionSource(Config sourceConfig) {
    this.sourceConfig = sourceConfig;
  }

  @Override
  public List<MetricDefinition> getAllMetricDefinitions() {
    if (!sourceConfig.hasPath(METRICS_CONFIG)) {
      return List.of();
    }
    return sourceConfig.getConfigList(METRICS_CONFIG).stream()
        .map(MetricDefinitionReader::fromConfig)
        .collect(Collectors.toUnmodifiableList());
  }
}
