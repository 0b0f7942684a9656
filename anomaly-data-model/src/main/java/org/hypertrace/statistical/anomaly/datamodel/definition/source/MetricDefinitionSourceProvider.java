package org.hypertrace.statistical.anomaly.datamodel.definition.source;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.hypertrace.statistical.anomaly.datamodel.ConfigurationException;

public class MetricDefinitionSourceProvider {
  private static final String SOURCE_TYPE = "type";
  private static final String SOURCE_TYPE_FS = "fs";
  private static final String SOURCE_TYPE_CONFIG = "config";

  private MetricDefinitionSourceProvider() {}

  public static MetricDefinitionSource getProvider(Config sourceConfig) {
    if (!sourceConfig.hasPath(SOURCE_TYPE)) {
      throw new ConfigurationException("Metric definition source is missing its type");
    }
    String sourceType = sourceConfig.getString(SOURCE_TYPE);
    switch (sourceType) {
      case SOURCE_TYPE_FS:
        return new FSMetricDefinitionSource(sourceConfig.getConfig(SOURCE_TYPE_FS));
      case SOURCE_TYPE_CONFIG:
        return new ConfigMetricDefinitionSource(
            sourceConfig.hasPath(SOURCE_TYPE_CONFIG)
                ? sourceConfig.getConfig(SOURCE_TYPE_CONFIG)
                : ConfigFactory.empty());
      default:
        throw new ConfigurationException(
            String.format("Invalid metric definition source type:%s", sourceType));
    }
  }
}
