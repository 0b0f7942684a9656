package org.hypertrace.statistical.anomaly.datamodel.sink;

import org.hypertrace.statistical.anomaly.datamodel.AnomalyResult;

public interface AlertSink {

  /** @return true if the alert was accepted for delivery */
  boolean send(AnomalyResult anomalyResult);
}
