package org.hypertrace.statistical.anomaly.detector;

import java.util.Collection;

class DetectorUtil {
  private DetectorUtil() {}

  static double[] toArray(Collection<Double> values) {
    return values.stream().mapToDouble(Double::doubleValue).toArray();
  }
}
