package org.hypertrace.statistical.anomaly.engine.sink;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Instant;
import org.hypertrace.statistical.anomaly.datamodel.AnomalyResult;
import org.hypertrace.statistical.anomaly.datamodel.Severity;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class LoggingAlertSinkTest {
  private final AnomalyResult anomalyResult =
      AnomalyResult.builder()
          .metricName("response_time")
          .currentValue(1.23456)
          .baselineValue(0.4)
          .deviationFactor(3.0864)
          .anomalyScore(3.0864)
          .anomaly(true)
          .severity(Severity.HIGH)
          .timestamp(Instant.parse("2024-03-01T10:00:00Z"))
          .contextEntry("percentile", 95.0)
          .contextEntry("historical_samples", 12)
          .build();

  @Test
  void testSummaryLine() {
    Assertions.assertEquals(
        "Anomaly detected in response_time: current=1.235, baseline=0.400, deviation=3.09x",
        LoggingAlertSink.summarize(anomalyResult));
  }

  @Test
  void testJsonCarriesEveryField() throws Exception {
    JsonNode json = new ObjectMapper().readTree(LoggingAlertSink.toJson(anomalyResult));

    Assertions.assertEquals("response_time", json.get("metricName").asText());
    Assertions.assertEquals(1.23456, json.get("currentValue").asDouble());
    Assertions.assertTrue(json.get("anomaly").asBoolean());
    Assertions.assertEquals("HIGH", json.get("severity").asText());
    Assertions.assertEquals("2024-03-01T10:00:00Z", json.get("timestamp").asText());
    Assertions.assertEquals(95.0, json.get("context").get("percentile").asDouble());
    Assertions.assertEquals(12, json.get("context").get("historical_samples").asInt());
  }

  @Test
  void testSendAlwaysSucceeds() {
    Assertions.assertTrue(new LoggingAlertSink().send(anomalyResult));
  }
}
