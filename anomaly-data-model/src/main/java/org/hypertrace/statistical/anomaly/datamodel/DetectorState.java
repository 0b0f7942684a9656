package org.hypertrace.statistical.anomaly.datamodel;

/**
 * Lifecycle of a metric's detector. A detector moves from {@link #COLD_START} to {@link
 * #WARMING} on its first sample and to {@link #ACTIVE} once its minimum sample requirement is
 * met. There is no terminal state.
 */
public enum DetectorState {
  COLD_START,
  WARMING,
  ACTIVE
}
