package org.hypertrace.statistical.anomaly.engine.monitor;

import static org.hypertrace.statistical.anomaly.engine.monitor.MonitoringJobConstants.JOB_DATA_MAP_CYCLE_ERROR_COUNTER;
import static org.hypertrace.statistical.anomaly.engine.monitor.MonitoringJobConstants.JOB_DATA_MAP_ENGINE;
import static org.hypertrace.statistical.anomaly.engine.monitor.MonitoringJobConstants.JOB_DATA_MAP_ERROR_BACKOFF_INTERVAL;
import static org.hypertrace.statistical.anomaly.engine.monitor.MonitoringJobConstants.JOB_DATA_MAP_POLL_INTERVAL;

import io.micrometer.core.instrument.Counter;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import org.hypertrace.statistical.anomaly.engine.AnomalyDetectionEngine;
import org.quartz.DisallowConcurrentExecution;
import org.quartz.Job;
import org.quartz.JobDataMap;
import org.quartz.JobDetail;
import org.quartz.JobExecutionContext;
import org.quartz.JobExecutionException;
import org.quartz.SchedulerException;
import org.quartz.SimpleScheduleBuilder;
import org.quartz.Trigger;
import org.quartz.TriggerBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One engine cycle per firing. A failed cycle pushes the next firing out by the error backoff,
 * after which the regular poll interval resumes.
 */
@DisallowConcurrentExecution
public class MonitoringJob implements Job {
  private static final Logger LOGGER = LoggerFactory.getLogger(MonitoringJob.class);

  public void execute(JobExecutionContext jobExecutionContext) throws JobExecutionException {
    JobDetail jobDetail = jobExecutionContext.getJobDetail();
    LOGGER.debug("Starting anomaly monitoring cycle: {}", jobDetail.getKey());

    JobDataMap jobDataMap = jobDetail.getJobDataMap();
    AnomalyDetectionEngine engine = (AnomalyDetectionEngine) jobDataMap.get(JOB_DATA_MAP_ENGINE);

    try {
      engine.runCycle();
    } catch (Exception e) {
      Duration errorBackoff = (Duration) jobDataMap.get(JOB_DATA_MAP_ERROR_BACKOFF_INTERVAL);
      LOGGER.error("Anomaly monitoring cycle failed, retrying in {}", errorBackoff, e);
      ((Counter) jobDataMap.get(JOB_DATA_MAP_CYCLE_ERROR_COUNTER)).increment();
      backOff(
          jobExecutionContext,
          errorBackoff,
          (Duration) jobDataMap.get(JOB_DATA_MAP_POLL_INTERVAL));
    }
    LOGGER.debug("Anomaly monitoring cycle finished");
  }

  private void backOff(
      JobExecutionContext jobExecutionContext, Duration errorBackoff, Duration pollInterval)
      throws JobExecutionException {
    Trigger trigger = jobExecutionContext.getTrigger();
    Trigger backoffTrigger =
        TriggerBuilder.newTrigger()
            .withIdentity(trigger.getKey())
            .forJob(jobExecutionContext.getJobDetail())
            .startAt(Date.from(Instant.now().plus(errorBackoff)))
            .withSchedule(
                SimpleScheduleBuilder.simpleSchedule()
                    .withIntervalInMilliseconds(pollInterval.toMillis())
                    .repeatForever())
            .build();
    try {
      jobExecutionContext.getScheduler().rescheduleJob(trigger.getKey(), backoffTrigger);
    } catch (SchedulerException e) {
      throw new JobExecutionException("Failed to reschedule monitoring after an error", e);
    }
  }
}
