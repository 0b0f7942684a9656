package org.hypertrace.statistical.anomaly.datamodel;

import java.util.Arrays;
import java.util.Optional;

public enum DetectorKind {
  EWMA("ewma"),
  ZSCORE("zscore"),
  ROLLING_PERCENTILE("rolling_percentile");

  private final String value;

  DetectorKind(String value) {
    this.value = value;
  }

  public String getValue() {
    return value;
  }

  /** Resolves a configured detector type, ignoring case and surrounding whitespace. */
  public static Optional<DetectorKind> fromValue(String detectorType) {
    if (detectorType == null) {
      return Optional.empty();
    }
    String normalized = detectorType.trim();
    return Arrays.stream(values()).filter(kind -> kind.value.equalsIgnoreCase(normalized)).findFirst();
  }
}
