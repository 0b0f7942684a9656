package org.hypertrace.statistical.anomaly.datamodel.source;

import java.io.IOException;
import java.util.Optional;

/** Supplies the latest value of a metric query, e.g. from a Prometheus server. */
public interface MetricSource {

  /**
   * @return the current value, or empty when the source has no sample for the query
   * @throws IOException when the source could not be reached
   */
  Optional<Double> fetchValue(String query) throws IOException;
}
