package org.hypertrace.statistical.anomaly.detector;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigRenderOptions;
import java.time.Clock;
import org.hypertrace.statistical.anomaly.datamodel.ConfigurationException;
import org.hypertrace.statistical.anomaly.datamodel.DetectorKind;
import org.hypertrace.statistical.anomaly.datamodel.MetricDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Builds the detector a {@link MetricDefinition} asks for. */
public class DetectorFactory {
  private static final Logger LOGGER = LoggerFactory.getLogger(DetectorFactory.class);

  static final String ALPHA_CONFIG = "alpha";
  static final String THRESHOLD_CONFIG = "threshold";
  static final String WINDOW_SIZE_CONFIG = "windowSize";
  static final String PERCENTILE_CONFIG = "percentile";
  static final String THRESHOLD_MULTIPLIER_CONFIG = "thresholdMultiplier";
  static final String HISTORY_SIZE_CONFIG = "historySize";

  private final Clock clock;

  public DetectorFactory() {
    this(Clock.systemUTC());
  }

  public DetectorFactory(Clock clock) {
    this.clock = clock;
  }

  /**
   * @throws ConfigurationException on an unknown detector type or a parameter that is missing a
   *     valid value
   */
  public Detector create(MetricDefinition metricDefinition) {
    String metricName = metricDefinition.getMetricName();
    DetectorKind kind =
        DetectorKind.fromValue(metricDefinition.getDetectorType())
            .orElseThrow(
                () ->
                    new ConfigurationException(
                        String.format(
                            "Unknown detector type [%s] for metric [%s]",
                            metricDefinition.getDetectorType(), metricName)));
    Config params = metricDefinition.getDetectorParams();

    try {
      Detector detector;
      switch (kind) {
        case EWMA:
          detector =
              new EwmaDetector(
                  metricName,
                  getDouble(params, ALPHA_CONFIG, EwmaDetector.DEFAULT_ALPHA),
                  getDouble(params, THRESHOLD_CONFIG, EwmaDetector.DEFAULT_THRESHOLD),
                  clock);
          break;
        case ZSCORE:
          detector =
              new ZScoreDetector(
                  metricName,
                  getInt(params, WINDOW_SIZE_CONFIG, ZScoreDetector.DEFAULT_WINDOW_SIZE),
                  getDouble(params, THRESHOLD_CONFIG, ZScoreDetector.DEFAULT_THRESHOLD),
                  clock);
          break;
        case ROLLING_PERCENTILE:
          detector =
              new RollingPercentileDetector(
                  metricName,
                  getInt(params, WINDOW_SIZE_CONFIG, RollingPercentileDetector.DEFAULT_WINDOW_SIZE),
                  getDouble(
                      params, PERCENTILE_CONFIG, RollingPercentileDetector.DEFAULT_PERCENTILE),
                  getDouble(
                      params,
                      THRESHOLD_MULTIPLIER_CONFIG,
                      RollingPercentileDetector.DEFAULT_THRESHOLD_MULTIPLIER),
                  getInt(
                      params, HISTORY_SIZE_CONFIG, RollingPercentileDetector.DEFAULT_HISTORY_SIZE),
                  clock);
          break;
        default:
          throw new ConfigurationException("Unsupported detector kind: " + kind);
      }
      LOGGER.info(
          "Created {} detector for metric {} with params {}",
          kind.getValue(),
          metricName,
          params.root().render(ConfigRenderOptions.concise()));
      return detector;
    } catch (ConfigException | IllegalArgumentException e) {
      throw new ConfigurationException(
          String.format("Invalid %s parameters for metric [%s]", kind.getValue(), metricName), e);
    }
  }

  private static double getDouble(Config params, String path, double defaultValue) {
    return params.hasPath(path) ? params.getDouble(path) : defaultValue;
  }

  private static int getInt(Config params, String path, int defaultValue) {
    return params.hasPath(path) ? params.getInt(path) : defaultValue;
  }
}
