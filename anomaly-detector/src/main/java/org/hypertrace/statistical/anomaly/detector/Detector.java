package org.hypertrace.statistical.anomaly.detector;

import java.util.Optional;
import org.hypertrace.statistical.anomaly.datamodel.AnomalyResult;
import org.hypertrace.statistical.anomaly.datamodel.DetectorKind;
import org.hypertrace.statistical.anomaly.datamodel.DetectorSnapshot;

/**
 * Online estimator watching a single metric. Implementations are not thread safe for {@link
 * #update}: a detector has one owner feeding it samples in order. {@link #snapshot()} may be
 * called from any thread.
 */
public interface Detector {

  /**
   * Feeds the next sample of the metric.
   *
   * @return the anomaly raised by this sample, or empty while warming up or when the sample is
   *     within the expected range
   */
  Optional<AnomalyResult> update(double value);

  DetectorKind getKind();

  /** Latest published state, never blocks {@link #update}. */
  DetectorSnapshot snapshot();
}
