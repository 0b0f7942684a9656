package org.hypertrace.statistical.anomaly.engine.monitor;

import org.hypertrace.statistical.anomaly.engine.EngineConfig;
import org.quartz.Scheduler;
import org.quartz.SchedulerException;

public interface JobManager {
  void initJob(EngineConfig engineConfig);

  void startJob(Scheduler scheduler) throws SchedulerException;

  void stopJob(Scheduler scheduler) throws SchedulerException;
}
