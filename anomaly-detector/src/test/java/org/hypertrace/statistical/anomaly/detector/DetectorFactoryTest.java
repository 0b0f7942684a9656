package org.hypertrace.statistical.anomaly.detector;

import com.typesafe.config.ConfigFactory;
import java.util.Map;
import org.hypertrace.statistical.anomaly.datamodel.ConfigurationException;
import org.hypertrace.statistical.anomaly.datamodel.DetectorKind;
import org.hypertrace.statistical.anomaly.datamodel.MetricDefinition;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class DetectorFactoryTest {
  private final DetectorFactory detectorFactory = new DetectorFactory();

  @Test
  void testCreatesEachKind() {
    Assertions.assertTrue(
        detectorFactory.create(definition("error_rate", "ewma", Map.of())) instanceof EwmaDetector);
    Assertions.assertTrue(
        detectorFactory.create(definition("request_rate", "ZSCORE", Map.of()))
            instanceof ZScoreDetector);
    Detector detector =
        detectorFactory.create(definition("response_time", "rolling_percentile", Map.of()));
    Assertions.assertEquals(DetectorKind.ROLLING_PERCENTILE, detector.getKind());
    Assertions.assertEquals("response_time", detector.snapshot().getMetricName());
  }

  @Test
  void testReadsConfiguredParams() {
    ZScoreDetector detector =
        (ZScoreDetector)
            detectorFactory.create(
                definition("request_rate", "zscore", Map.of("windowSize", 20, "threshold", 3.0)));
    Assertions.assertEquals(20, detector.getWindowSize());

    ZScoreDetector defaults =
        (ZScoreDetector) detectorFactory.create(definition("request_rate", "zscore", Map.of()));
    Assertions.assertEquals(ZScoreDetector.DEFAULT_WINDOW_SIZE, defaults.getWindowSize());
  }

  @Test
  void testUnknownTypeFails() {
    ConfigurationException exception =
        Assertions.assertThrows(
            ConfigurationException.class,
            () -> detectorFactory.create(definition("cpu_usage", "isolation_forest", Map.of())));
    Assertions.assertTrue(exception.getMessage().contains("isolation_forest"));
    Assertions.assertTrue(exception.getMessage().contains("cpu_usage"));
  }

  @Test
  void testMissingTypeFails() {
    Assertions.assertThrows(
        ConfigurationException.class,
        () -> detectorFactory.create(MetricDefinition.builder().metricName("cpu_usage").build()));
  }

  @ParameterizedTest
  @ValueSource(
      strings = {
        "ewma:alpha=0",
        "ewma:alpha=1.5",
        "ewma:threshold=-2",
        "ewma:alpha=fast",
        "zscore:windowSize=0",
        "zscore:threshold=0",
        "rolling_percentile:percentile=0",
        "rolling_percentile:percentile=150",
        "rolling_percentile:windowSize=-1",
        "rolling_percentile:thresholdMultiplier=0"
      })
  void testInvalidParamsFail(String invalidParam) {
    String[] typeAndParam = invalidParam.split(":");
    String[] keyAndValue = typeAndParam[1].split("=");
    MetricDefinition metricDefinition =
        MetricDefinition.builder()
            .metricName("m")
            .detectorType(typeAndParam[0])
            .detectorParams(ConfigFactory.parseString(keyAndValue[0] + " = " + keyAndValue[1]))
            .build();

    ConfigurationException exception =
        Assertions.assertThrows(
            ConfigurationException.class, () -> detectorFactory.create(metricDefinition));
    Assertions.assertNotNull(exception.getCause());
  }

  private static MetricDefinition definition(
      String metricName, String detectorType, Map<String, Object> params) {
    return MetricDefinition.builder()
        .metricName(metricName)
        .detectorType(detectorType)
        .detectorParams(ConfigFactory.parseMap(params))
        .build();
  }
}
