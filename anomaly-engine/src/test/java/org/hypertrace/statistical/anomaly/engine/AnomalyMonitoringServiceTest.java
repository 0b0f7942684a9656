package org.hypertrace.statistical.anomaly.engine;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.Optional;
import org.hypertrace.statistical.anomaly.datamodel.ConfigurationException;
import org.hypertrace.statistical.anomaly.datamodel.source.MetricSource;
import org.hypertrace.statistical.anomaly.engine.sink.LoggingAlertSink;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class AnomalyMonitoringServiceTest {

  @Test
  void testStartPollsConfiguredMetricsUntilStopped() throws Exception {
    MetricSource metricSource = mock(MetricSource.class);
    when(metricSource.fetchValue(anyString())).thenReturn(Optional.of(0.25));
    Config appConfig =
        ConfigFactory.parseString("anomaly.engine.monitoring.pollInterval = 100ms")
            .withFallback(ConfigFactory.load());
    AnomalyMonitoringService service =
        new AnomalyMonitoringService(
            appConfig, metricSource, new LoggingAlertSink(), new SimpleMeterRegistry());

    service.start();
    try {
      verify(metricSource, timeout(2_000).atLeast(2))
          .fetchValue("sum(rate(http_requests_total[5m]))");
      Assertions.assertEquals(5, service.getEngine().getDetectorStats().size());
      Assertions.assertThrows(IllegalStateException.class, service::start);
    } finally {
      service.stop();
    }
    Assertions.assertNull(service.getEngine());
  }

  @Test
  void testInvalidDefinitionAbortsStart() {
    Config appConfig =
        ConfigFactory.parseString(
            "anomaly.engine.metricDefinitionSource {\n"
                + "  type = config\n"
                + "  config.metrics = [ { metricName = error_rate, detector = arima } ]\n"
                + "}");
    AnomalyMonitoringService service =
        new AnomalyMonitoringService(
            appConfig, mock(MetricSource.class), new LoggingAlertSink(), new SimpleMeterRegistry());

    Assertions.assertThrows(ConfigurationException.class, service::start);
    Assertions.assertNull(service.getEngine());
  }
}
