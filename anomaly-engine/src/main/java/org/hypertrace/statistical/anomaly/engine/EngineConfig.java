package org.hypertrace.statistical.anomaly.engine;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import java.time.Duration;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/** Timing and sizing knobs of the engine, read from the {@code anomaly.engine} config block. */
@Builder
@Getter
@ToString
public class EngineConfig {
  static final String ENGINE_CONFIG = "anomaly.engine";
  static final String POLL_INTERVAL_CONFIG = "monitoring.pollInterval";
  static final String ERROR_BACKOFF_INTERVAL_CONFIG = "monitoring.errorBackoffInterval";
  static final String CRITICAL_SUPPRESSION_CONFIG = "suppression.criticalDuration";
  static final String DEFAULT_SUPPRESSION_CONFIG = "suppression.defaultDuration";
  static final String FETCH_TIMEOUT_CONFIG = "fetch.timeout";
  static final String FETCH_THREADS_CONFIG = "fetch.threads";
  static final String SINK_TIMEOUT_CONFIG = "sink.timeout";
  static final String METRIC_DEFINITION_SOURCE_CONFIG = "metricDefinitionSource";

  static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(30);
  static final Duration DEFAULT_ERROR_BACKOFF_INTERVAL = Duration.ofSeconds(60);
  static final Duration DEFAULT_CRITICAL_SUPPRESSION = Duration.ofMinutes(10);
  static final Duration DEFAULT_SUPPRESSION = Duration.ofMinutes(5);
  static final Duration DEFAULT_FETCH_TIMEOUT = Duration.ofSeconds(10);
  static final int DEFAULT_FETCH_THREADS = 4;
  static final Duration DEFAULT_SINK_TIMEOUT = Duration.ofSeconds(10);

  @Builder.Default private final Duration pollInterval = DEFAULT_POLL_INTERVAL;
  @Builder.Default private final Duration errorBackoffInterval = DEFAULT_ERROR_BACKOFF_INTERVAL;
  @Builder.Default private final Duration criticalSuppression = DEFAULT_CRITICAL_SUPPRESSION;
  @Builder.Default private final Duration defaultSuppression = DEFAULT_SUPPRESSION;
  @Builder.Default private final Duration fetchTimeout = DEFAULT_FETCH_TIMEOUT;
  @Builder.Default private final int fetchThreads = DEFAULT_FETCH_THREADS;
  @Builder.Default private final Duration sinkTimeout = DEFAULT_SINK_TIMEOUT;

  @ToString.Exclude @Builder.Default
  private final Config metricDefinitionSource = ConfigFactory.empty();

  /** Reads the {@code anomaly.engine} block of the application config; absent keys default. */
  public static EngineConfig from(Config appConfig) {
    Config engineConfig =
        appConfig.hasPath(ENGINE_CONFIG) ? appConfig.getConfig(ENGINE_CONFIG) : ConfigFactory.empty();
    return EngineConfig.builder()
        .pollInterval(getDuration(engineConfig, POLL_INTERVAL_CONFIG, DEFAULT_POLL_INTERVAL))
        .errorBackoffInterval(
            getDuration(
                engineConfig, ERROR_BACKOFF_INTERVAL_CONFIG, DEFAULT_ERROR_BACKOFF_INTERVAL))
        .criticalSuppression(
            getDuration(engineConfig, CRITICAL_SUPPRESSION_CONFIG, DEFAULT_CRITICAL_SUPPRESSION))
        .defaultSuppression(
            getDuration(engineConfig, DEFAULT_SUPPRESSION_CONFIG, DEFAULT_SUPPRESSION))
        .fetchTimeout(getDuration(engineConfig, FETCH_TIMEOUT_CONFIG, DEFAULT_FETCH_TIMEOUT))
        .fetchThreads(
            engineConfig.hasPath(FETCH_THREADS_CONFIG)
                ? engineConfig.getInt(FETCH_THREADS_CONFIG)
                : DEFAULT_FETCH_THREADS)
        .sinkTimeout(getDuration(engineConfig, SINK_TIMEOUT_CONFIG, DEFAULT_SINK_TIMEOUT))
        .metricDefinitionSource(
            engineConfig.hasPath(METRIC_DEFINITION_SOURCE_CONFIG)
                ? engineConfig.getConfig(METRIC_DEFINITION_SOURCE_CONFIG)
                : ConfigFactory.empty())
        .build();
  }

  private static Duration getDuration(Config config, String path, Duration defaultValue) {
    return config.hasPath(path) ? config.getDuration(path) : defaultValue;
  }
}
