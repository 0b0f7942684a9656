package org.hypertrace.statistical.anomaly.engine.monitor;

import static org.hypertrace.statistical.anomaly.engine.monitor.MonitoringJobConstants.CYCLE_ERROR_COUNTER;
import static org.hypertrace.statistical.anomaly.engine.monitor.MonitoringJobConstants.JOB_DATA_MAP_CYCLE_ERROR_COUNTER;
import static org.hypertrace.statistical.anomaly.engine.monitor.MonitoringJobConstants.JOB_DATA_MAP_ENGINE;
import static org.hypertrace.statistical.anomaly.engine.monitor.MonitoringJobConstants.JOB_DATA_MAP_ERROR_BACKOFF_INTERVAL;
import static org.hypertrace.statistical.anomaly.engine.monitor.MonitoringJobConstants.JOB_DATA_MAP_POLL_INTERVAL;
import static org.hypertrace.statistical.anomaly.engine.monitor.MonitoringJobConstants.JOB_GROUP;
import static org.hypertrace.statistical.anomaly.engine.monitor.MonitoringJobConstants.JOB_NAME;
import static org.hypertrace.statistical.anomaly.engine.monitor.MonitoringJobConstants.JOB_TRIGGER_NAME;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.hypertrace.statistical.anomaly.engine.AnomalyDetectionEngine;
import org.hypertrace.statistical.anomaly.engine.EngineConfig;
import org.quartz.JobBuilder;
import org.quartz.JobDataMap;
import org.quartz.JobDetail;
import org.quartz.JobKey;
import org.quartz.Scheduler;
import org.quartz.SchedulerException;
import org.quartz.SimpleScheduleBuilder;
import org.quartz.Trigger;
import org.quartz.TriggerBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Schedules {@link MonitoringJob} to run an engine cycle every poll interval. */
public class MonitoringJobManager implements JobManager {
  private static final Logger LOGGER = LoggerFactory.getLogger(MonitoringJobManager.class);

  private final AnomalyDetectionEngine engine;
  private final MeterRegistry meterRegistry;

  private JobKey jobKey;
  private JobDetail jobDetail;
  private Trigger jobTrigger;

  public MonitoringJobManager(AnomalyDetectionEngine engine, MeterRegistry meterRegistry) {
    this.engine = engine;
    this.meterRegistry = meterRegistry;
  }

  @Override
  public void initJob(EngineConfig engineConfig) {
    jobKey = JobKey.jobKey(JOB_NAME, JOB_GROUP);

    JobDataMap jobDataMap = new JobDataMap();
    jobDataMap.put(JOB_DATA_MAP_ENGINE, engine);
    jobDataMap.put(JOB_DATA_MAP_POLL_INTERVAL, engineConfig.getPollInterval());
    jobDataMap.put(JOB_DATA_MAP_ERROR_BACKOFF_INTERVAL, engineConfig.getErrorBackoffInterval());
    jobDataMap.put(
        JOB_DATA_MAP_CYCLE_ERROR_COUNTER,
        Counter.builder(CYCLE_ERROR_COUNTER).register(meterRegistry));

    jobDetail =
        JobBuilder.newJob(MonitoringJob.class).withIdentity(jobKey).usingJobData(jobDataMap).build();

    jobTrigger =
        TriggerBuilder.newTrigger()
            .withIdentity(JOB_TRIGGER_NAME, JOB_GROUP)
            .withSchedule(
                SimpleScheduleBuilder.simpleSchedule()
                    .withIntervalInMilliseconds(engineConfig.getPollInterval().toMillis())
                    .repeatForever())
            .startNow()
            .build();
  }

  @Override
  public void startJob(Scheduler scheduler) throws SchedulerException {
    LOGGER.info("Schedule a job:{} with Trigger:{}", jobKey, jobTrigger);
    scheduler.scheduleJob(jobDetail, jobTrigger);
  }

  @Override
  public void stopJob(Scheduler scheduler) throws SchedulerException {
    if (scheduler.checkExists(jobKey)) {
      scheduler.deleteJob(jobKey);
    }
  }
}
