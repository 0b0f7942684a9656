package org.hypertrace.statistical.anomaly.datamodel.definition.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.hypertrace.statistical.anomaly.datamodel.ConfigurationException;
import org.hypertrace.statistical.anomaly.datamodel.MetricDefinition;

/** Field names and conversions shared by the definition sources. */
class MetricDefinitionReader {
  static final String METRIC_NAME = "metricName";
  static final String DETECTOR = "detector";
  static final String PARAMS = "params";
  static final String QUERY = "query";

  private MetricDefinitionReader() {}

  static MetricDefinition fromConfig(Config definition) {
    try {
      return MetricDefinition.builder()
          .metricName(definition.getString(METRIC_NAME))
          .detectorType(definition.getString(DETECTOR))
          .detectorParams(
              definition.hasPath(PARAMS) ? definition.getConfig(PARAMS) : ConfigFactory.empty())
          .query(definition.hasPath(QUERY) ? definition.getString(QUERY) : "")
          .build();
    } catch (ConfigException e) {
      throw new ConfigurationException("Invalid metric definition: " + definition.root(), e);
    }
  }

  static MetricDefinition fromJson(JsonNode definition) {
    if (!definition.hasNonNull(METRIC_NAME) || !definition.hasNonNull(DETECTOR)) {
      throw new ConfigurationException(
          String.format(
              "Metric definition must carry '%s' and '%s': %s",
              METRIC_NAME, DETECTOR, definition));
    }
    JsonNode params = definition.get(PARAMS);
    if (params != null && !params.isNull() && !params.isObject()) {
      throw new ConfigurationException(
          String.format("'%s' of a metric definition must be an object: %s", PARAMS, definition));
    }
    return MetricDefinition.builder()
        .metricName(definition.get(METRIC_NAME).asText())
        .detectorType(definition.get(DETECTOR).asText())
        .detectorParams(
            params == null || params.isNull()
                ? ConfigFactory.empty()
                : ConfigFactory.parseString(params.toString()))
        .query(definition.hasNonNull(QUERY) ? definition.get(QUERY).asText() : "")
        .build();
  }
}
