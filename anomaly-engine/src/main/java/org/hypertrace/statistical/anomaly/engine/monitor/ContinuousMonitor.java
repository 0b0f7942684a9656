package org.hypertrace.statistical.anomaly.engine.monitor;

import io.micrometer.core.instrument.MeterRegistry;
import java.util.Properties;
import java.util.UUID;
import org.hypertrace.statistical.anomaly.engine.AnomalyDetectionEngine;
import org.hypertrace.statistical.anomaly.engine.EngineConfig;
import org.quartz.Scheduler;
import org.quartz.SchedulerException;
import org.quartz.impl.StdSchedulerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Handle on a running monitoring loop. {@link #stop()} is its only cancellation signal. */
public class ContinuousMonitor implements AutoCloseable {
  private static final Logger LOGGER = LoggerFactory.getLogger(ContinuousMonitor.class);

  private final Scheduler scheduler;
  private final JobManager jobManager;

  ContinuousMonitor(Scheduler scheduler, JobManager jobManager) {
    this.scheduler = scheduler;
    this.jobManager = jobManager;
  }

  public static ContinuousMonitor start(
      AnomalyDetectionEngine engine, EngineConfig engineConfig, MeterRegistry meterRegistry)
      throws SchedulerException {
    Scheduler scheduler = new StdSchedulerFactory(schedulerProperties()).getScheduler();
    JobManager jobManager = new MonitoringJobManager(engine, meterRegistry);
    jobManager.initJob(engineConfig);
    jobManager.startJob(scheduler);
    scheduler.start();
    LOGGER.info(
        "Continuous monitoring started, polling every {}", engineConfig.getPollInterval());
    return new ContinuousMonitor(scheduler, jobManager);
  }

  /** Removes the job and waits for a cycle in flight to complete. */
  public void stop() throws SchedulerException {
    if (scheduler.isShutdown()) {
      return;
    }
    jobManager.stopJob(scheduler);
    scheduler.shutdown(true);
    LOGGER.info("Continuous monitoring stopped");
  }

  public boolean isRunning() throws SchedulerException {
    return scheduler.isStarted() && !scheduler.isShutdown();
  }

  @Override
  public void close() throws SchedulerException {
    stop();
  }

  private static Properties schedulerProperties() {
    Properties properties = new Properties();
    // schedulers are looked up by name, every monitor gets its own
    properties.setProperty(
        StdSchedulerFactory.PROP_SCHED_INSTANCE_NAME, "anomaly-monitor-" + UUID.randomUUID());
    properties.setProperty(
        StdSchedulerFactory.PROP_THREAD_POOL_CLASS, "org.quartz.simpl.SimpleThreadPool");
    properties.setProperty("org.quartz.threadPool.threadCount", "1");
    properties.setProperty(
        StdSchedulerFactory.PROP_JOB_STORE_CLASS, "org.quartz.simpl.RAMJobStore");
    return properties;
  }
}
