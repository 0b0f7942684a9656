package org.hypertrace.statistical.anomaly.datamodel.definition.source;

import java.io.IOException;
import java.util.List;
import org.hypertrace.statistical.anomaly.datamodel.MetricDefinition;

public interface MetricDefinitionSource {
  List<MetricDefinition> getAllMetricDefinitions() throws IOException;
}
