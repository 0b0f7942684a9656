package org.hypertrace.statistical.anomaly.engine.monitor;

public class MonitoringJobConstants {
  public static final String JOB_DATA_MAP_ENGINE = "engine";
  public static final String JOB_DATA_MAP_POLL_INTERVAL = "pollInterval";
  public static final String JOB_DATA_MAP_ERROR_BACKOFF_INTERVAL = "errorBackoffInterval";
  public static final String JOB_DATA_MAP_CYCLE_ERROR_COUNTER = "cycleErrorCounter";

  public static final String JOB_NAME = "anomaly-monitoring";
  public static final String JOB_GROUP = "anomaly";
  public static final String JOB_TRIGGER_NAME = "anomaly-monitoring-trigger";

  public static final String CYCLE_ERROR_COUNTER = "anomaly.engine.cycle.errors";

  private MonitoringJobConstants() {}
}
