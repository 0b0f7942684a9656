package org.hypertrace.statistical.anomaly.engine;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.apache.commons.lang3.tuple.Pair;
import org.hypertrace.statistical.anomaly.datamodel.AnomalyResult;
import org.hypertrace.statistical.anomaly.datamodel.ConfigurationException;
import org.hypertrace.statistical.anomaly.datamodel.DetectorSnapshot;
import org.hypertrace.statistical.anomaly.datamodel.MetricDefinition;
import org.hypertrace.statistical.anomaly.datamodel.Severity;
import org.hypertrace.statistical.anomaly.datamodel.sink.AlertSink;
import org.hypertrace.statistical.anomaly.datamodel.source.MetricSource;
import org.hypertrace.statistical.anomaly.detector.Detector;
import org.hypertrace.statistical.anomaly.detector.DetectorFactory;
import org.hypertrace.statistical.anomaly.engine.monitor.ContinuousMonitor;
import org.quartz.SchedulerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Polls every configured metric, feeds the value to that metric's detector and hands the
 * anomalies that are not suppressed to the alert sink.
 *
 * <p>A cycle is expected to be driven by one caller at a time, either directly through {@link
 * #runCycle()} or by the scheduled job started with {@link #runContinuousMonitoring()}. Metric
 * values are fetched in parallel but detectors are updated on the calling thread, in definition
 * order.
 *
 * <p>Fetches are handed straight to a thread and never wait in a queue, so each fetch timeout
 * runs from the moment that fetch starts. A metric whose previous fetch is still running is
 * skipped for the cycle instead of being submitted again.
 */
public class AnomalyDetectionEngine implements AutoCloseable {
  private static final Logger LOGGER = LoggerFactory.getLogger(AnomalyDetectionEngine.class);

  static final String ANOMALIES_DETECTED_COUNTER = "anomaly.engine.anomalies.detected";
  static final String ANOMALIES_SUPPRESSED_COUNTER = "anomaly.engine.anomalies.suppressed";
  static final String FETCH_FAILURE_COUNTER = "anomaly.engine.fetch.failures";
  static final String SINK_FAILURE_COUNTER = "anomaly.engine.sink.failures";
  static final String CYCLE_LATENCY_TIMER = "anomaly.engine.cycle.latency";
  static final String METRIC_TAG = "metric";
  static final String SEVERITY_TAG = "severity";

  private final Map<String, MetricDefinition> metricDefinitions;
  private final Map<String, Detector> detectors;
  private final MetricSource metricSource;
  private final AlertSink alertSink;
  private final EngineConfig engineConfig;
  private final MeterRegistry meterRegistry;
  private final SuppressionCache suppressionCache;
  private final ExecutorService fetchExecutor;
  private final ExecutorService sinkExecutor;
  private final Set<String> runningFetches = ConcurrentHashMap.newKeySet();

  private final ConcurrentMap<Pair<String, Severity>, Counter> anomaliesDetectedCounter =
      new ConcurrentHashMap<>();
  private final ConcurrentMap<Pair<String, Severity>, Counter> anomaliesSuppressedCounter =
      new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> fetchFailureCounter = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> sinkFailureCounter = new ConcurrentHashMap<>();
  private final Timer cycleTimer;

  /**
   * Builds one detector per definition.
   *
   * @throws ConfigurationException if a definition names an unknown detector, carries invalid
   *     parameters or reuses a metric name
   */
  public AnomalyDetectionEngine(
      List<MetricDefinition> definitions,
      MetricSource metricSource,
      AlertSink alertSink,
      EngineConfig engineConfig,
      MeterRegistry meterRegistry,
      Clock clock) {
    this.metricSource = metricSource;
    this.alertSink = alertSink;
    this.engineConfig = engineConfig;
    this.meterRegistry = meterRegistry;
    this.suppressionCache =
        new SuppressionCache(
            engineConfig.getCriticalSuppression(), engineConfig.getDefaultSuppression(), clock);

    DetectorFactory detectorFactory = new DetectorFactory(clock);
    Map<String, MetricDefinition> definitionsByName = new LinkedHashMap<>();
    Map<String, Detector> detectorsByName = new LinkedHashMap<>();
    for (MetricDefinition definition : definitions) {
      String metricName = definition.getMetricName();
      if (definitionsByName.containsKey(metricName)) {
        throw new ConfigurationException(
            String.format("Metric [%s] is defined more than once", metricName));
      }
      definitionsByName.put(metricName, definition);
      detectorsByName.put(metricName, detectorFactory.create(definition));
    }
    this.metricDefinitions = Collections.unmodifiableMap(definitionsByName);
    this.detectors = Collections.unmodifiableMap(detectorsByName);

    // at most one fetch per metric is in flight, the extra threads cover handover between cycles
    this.fetchExecutor =
        newHandOffExecutor(
            engineConfig.getFetchThreads(),
            Math.max(1, engineConfig.getFetchThreads() + detectors.size()),
            "anomaly-engine-fetch-%d");
    this.sinkExecutor =
        newHandOffExecutor(
            0, Math.max(1, engineConfig.getFetchThreads()), "anomaly-engine-sink-%d");
    this.cycleTimer = Timer.builder(CYCLE_LATENCY_TIMER).register(meterRegistry);

    LOGGER.info(
        "Anomaly detection engine created for metrics {} with config {}",
        detectors.keySet(),
        engineConfig);
  }

  /**
   * Runs one detection pass over every configured metric.
   *
   * @return the anomalies that passed suppression, in definition order
   */
  public List<AnomalyResult> checkAnomalies() {
    Map<String, Pair<Future<Optional<Double>>, Long>> fetches = new LinkedHashMap<>();
    metricDefinitions.forEach(
        (metricName, definition) ->
            startFetch(metricName, definition)
                .ifPresent(
                    fetch ->
                        fetches.put(
                            metricName,
                            Pair.of(
                                fetch,
                                System.nanoTime() + engineConfig.getFetchTimeout().toNanos()))));

    List<AnomalyResult> anomalies = new ArrayList<>();
    for (Map.Entry<String, Pair<Future<Optional<Double>>, Long>> fetch : fetches.entrySet()) {
      String metricName = fetch.getKey();
      Optional<Double> value =
          awaitValue(metricName, fetch.getValue().getLeft(), fetch.getValue().getRight());
      if (value.isEmpty()) {
        continue;
      }

      Optional<AnomalyResult> result = detectors.get(metricName).update(value.get());
      if (result.isEmpty() || !result.get().isAnomaly()) {
        continue;
      }

      AnomalyResult anomaly = result.get();
      Pair<String, Severity> key = Pair.of(metricName, anomaly.getSeverity());
      if (suppressionCache.tryAcquire(metricName, anomaly.getSeverity())) {
        LOGGER.info(
            "Anomaly in {}: severity {}, score {}",
            metricName,
            anomaly.getSeverity().getValue(),
            anomaly.getAnomalyScore());
        anomaliesDetectedCounter
            .computeIfAbsent(key, k -> registerCounter(ANOMALIES_DETECTED_COUNTER, k))
            .increment();
        anomalies.add(anomaly);
      } else {
        LOGGER.debug(
            "Suppressed {} anomaly in {}, an alert was raised recently",
            anomaly.getSeverity().getValue(),
            metricName);
        anomaliesSuppressedCounter
            .computeIfAbsent(key, k -> registerCounter(ANOMALIES_SUPPRESSED_COUNTER, k))
            .increment();
      }
    }
    return anomalies;
  }

  /**
   * Hands each anomaly to the alert sink. Failed deliveries are logged and not retried.
   *
   * @return the number of anomalies the sink accepted
   */
  public int dispatch(List<AnomalyResult> anomalies) {
    int delivered = 0;
    for (AnomalyResult anomaly : anomalies) {
      String metricName = anomaly.getMetricName();
      Future<Boolean> sent;
      try {
        sent = sinkExecutor.submit(() -> alertSink.send(anomaly));
      } catch (RejectedExecutionException e) {
        LOGGER.error("No sink thread available for metric {}, earlier sends are stuck", metricName);
        incrementSinkFailure(metricName);
        continue;
      }
      try {
        if (sent.get(engineConfig.getSinkTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
          delivered++;
          continue;
        }
        LOGGER.error("Alert sink rejected anomaly for metric {}", metricName);
      } catch (TimeoutException e) {
        sent.cancel(true);
        LOGGER.error(
            "Alert sink timed out after {} for metric {}", engineConfig.getSinkTimeout(), metricName);
      } catch (ExecutionException e) {
        LOGGER.error("Alert sink failed for metric {}", metricName, e.getCause());
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        LOGGER.warn("Interrupted while dispatching anomaly for metric {}", metricName);
        incrementSinkFailure(metricName);
        break;
      }
      incrementSinkFailure(metricName);
    }
    return delivered;
  }

  /** One poll tick: detect, then dispatch. */
  public List<AnomalyResult> runCycle() {
    Instant startTime = Instant.now();
    try {
      List<AnomalyResult> anomalies = checkAnomalies();
      if (!anomalies.isEmpty()) {
        int delivered = dispatch(anomalies);
        LOGGER.debug("Delivered {} of {} anomalies", delivered, anomalies.size());
      }
      return anomalies;
    } finally {
      cycleTimer.record(Duration.between(startTime, Instant.now()));
    }
  }

  /**
   * Starts polling every {@code pollInterval} in the background. The returned handle stops the
   * loop.
   */
  public ContinuousMonitor runContinuousMonitoring() throws SchedulerException {
    return ContinuousMonitor.start(this, engineConfig, meterRegistry);
  }

  /** Current view of every detector, keyed by metric name in definition order. */
  public Map<String, DetectorSnapshot> getDetectorStats() {
    Map<String, DetectorSnapshot> stats = new LinkedHashMap<>();
    detectors.forEach((metricName, detector) -> stats.put(metricName, detector.snapshot()));
    return Collections.unmodifiableMap(stats);
  }

  @VisibleForTesting
  SuppressionCache getSuppressionCache() {
    return suppressionCache;
  }

  @Override
  public void close() {
    fetchExecutor.shutdownNow();
    sinkExecutor.shutdownNow();
  }

  private Optional<Future<Optional<Double>>> startFetch(
      String metricName, MetricDefinition definition) {
    if (!runningFetches.add(metricName)) {
      LOGGER.warn("Previous fetch of metric {} is still running, skipping this cycle", metricName);
      incrementFetchFailure(metricName);
      return Optional.empty();
    }

    FutureTask<Optional<Double>> fetch =
        new FutureTask<>(() -> metricSource.fetchValue(definition.getQuery()));
    try {
      // the wrapper runs even when the fetch was cancelled before it started
      fetchExecutor.execute(
          () -> {
            try {
              fetch.run();
            } finally {
              runningFetches.remove(metricName);
            }
          });
      return Optional.of(fetch);
    } catch (RejectedExecutionException e) {
      runningFetches.remove(metricName);
      LOGGER.warn("No fetch thread available for metric {}", metricName);
      incrementFetchFailure(metricName);
      return Optional.empty();
    }
  }

  private Optional<Double> awaitValue(
      String metricName, Future<Optional<Double>> fetch, long deadlineNanos) {
    try {
      long remainingNanos = Math.max(0, deadlineNanos - System.nanoTime());
      Optional<Double> value = fetch.get(remainingNanos, TimeUnit.NANOSECONDS);
      if (value == null || value.isEmpty()) {
        LOGGER.debug("No value available for metric {}, skipping", metricName);
        incrementFetchFailure(metricName);
        return Optional.empty();
      }
      if (!Double.isFinite(value.get())) {
        LOGGER.warn("Ignoring non finite value {} for metric {}", value.get(), metricName);
        incrementFetchFailure(metricName);
        return Optional.empty();
      }
      return value;
    } catch (TimeoutException e) {
      fetch.cancel(true);
      LOGGER.warn(
          "Fetching metric {} timed out after {}", metricName, engineConfig.getFetchTimeout());
    } catch (ExecutionException e) {
      LOGGER.warn("Failed to fetch metric {}", metricName, e.getCause());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      fetch.cancel(true);
      LOGGER.warn("Interrupted while fetching metric {}", metricName);
    }
    incrementFetchFailure(metricName);
    return Optional.empty();
  }

  private void incrementFetchFailure(String metricName) {
    fetchFailureCounter
        .computeIfAbsent(
            metricName,
            k -> Counter.builder(FETCH_FAILURE_COUNTER).tag(METRIC_TAG, k).register(meterRegistry))
        .increment();
  }

  private void incrementSinkFailure(String metricName) {
    sinkFailureCounter
        .computeIfAbsent(
            metricName,
            k -> Counter.builder(SINK_FAILURE_COUNTER).tag(METRIC_TAG, k).register(meterRegistry))
        .increment();
  }

  private static ExecutorService newHandOffExecutor(
      int coreThreads, int maxThreads, String nameFormat) {
    return new ThreadPoolExecutor(
        coreThreads,
        maxThreads,
        60,
        TimeUnit.SECONDS,
        new SynchronousQueue<>(),
        new ThreadFactoryBuilder().setNameFormat(nameFormat).setDaemon(true).build());
  }

  private Counter registerCounter(String name, Pair<String, Severity> key) {
    return Counter.builder(name)
        .tag(METRIC_TAG, key.getLeft())
        .tag(SEVERITY_TAG, key.getRight().getValue())
        .register(meterRegistry);
  }
}
