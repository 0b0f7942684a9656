package org.hypertrace.statistical.anomaly.engine;

import com.typesafe.config.Config;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.time.Clock;
import java.util.List;
import org.hypertrace.statistical.anomaly.datamodel.MetricDefinition;
import org.hypertrace.statistical.anomaly.datamodel.definition.source.MetricDefinitionSourceProvider;
import org.hypertrace.statistical.anomaly.datamodel.sink.AlertSink;
import org.hypertrace.statistical.anomaly.datamodel.source.MetricSource;
import org.hypertrace.statistical.anomaly.engine.monitor.ContinuousMonitor;
import org.quartz.SchedulerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wires the engine from application config and owns its lifecycle. The metric source and the
 * alert sink are supplied by the embedding application.
 */
public class AnomalyMonitoringService {
  private static final Logger LOGGER = LoggerFactory.getLogger(AnomalyMonitoringService.class);

  private final Config appConfig;
  private final MetricSource metricSource;
  private final AlertSink alertSink;
  private final MeterRegistry meterRegistry;
  private final Clock clock;

  private AnomalyDetectionEngine engine;
  private ContinuousMonitor monitor;

  public AnomalyMonitoringService(
      Config appConfig, MetricSource metricSource, AlertSink alertSink, MeterRegistry meterRegistry) {
    this(appConfig, metricSource, alertSink, meterRegistry, Clock.systemUTC());
  }

  public AnomalyMonitoringService(
      Config appConfig,
      MetricSource metricSource,
      AlertSink alertSink,
      MeterRegistry meterRegistry,
      Clock clock) {
    this.appConfig = appConfig;
    this.metricSource = metricSource;
    this.alertSink = alertSink;
    this.meterRegistry = meterRegistry;
    this.clock = clock;
  }

  /** Loads the metric definitions, builds the engine and starts polling. */
  public synchronized void start() throws IOException, SchedulerException {
    if (engine != null) {
      throw new IllegalStateException("Anomaly monitoring service already started");
    }
    EngineConfig engineConfig = EngineConfig.from(appConfig);
    List<MetricDefinition> definitions =
        MetricDefinitionSourceProvider.getProvider(engineConfig.getMetricDefinitionSource())
            .getAllMetricDefinitions();
    LOGGER.info("Loaded {} metric definitions", definitions.size());

    engine =
        new AnomalyDetectionEngine(
            definitions, metricSource, alertSink, engineConfig, meterRegistry, clock);
    try {
      monitor = engine.runContinuousMonitoring();
    } catch (SchedulerException e) {
      engine.close();
      engine = null;
      throw e;
    }
  }

  public synchronized void stop() throws SchedulerException {
    if (engine == null) {
      return;
    }
    try {
      monitor.stop();
    } finally {
      engine.close();
      engine = null;
      monitor = null;
    }
  }

  public synchronized AnomalyDetectionEngine getEngine() {
    return engine;
  }
}
