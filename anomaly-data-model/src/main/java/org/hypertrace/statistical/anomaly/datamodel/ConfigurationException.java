package org.hypertrace.statistical.anomaly.datamodel;

/** Raised while building detectors or reading metric definitions. Fatal at startup. */
public class ConfigurationException extends RuntimeException {

  public ConfigurationException(String message) {
    super(message);
  }

  public ConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
