package org.hypertrace.statistical.anomaly.engine.sink;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.google.common.annotations.VisibleForTesting;
import java.util.Locale;
import org.hypertrace.statistical.anomaly.datamodel.AnomalyResult;
import org.hypertrace.statistical.anomaly.datamodel.sink.AlertSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Writes every anomaly to the log at WARN, as a summary line followed by its JSON form. */
public class LoggingAlertSink implements AlertSink {
  private static final Logger LOGGER = LoggerFactory.getLogger(LoggingAlertSink.class);
  private static final ObjectMapper OBJECT_MAPPER =
      new ObjectMapper()
          .registerModule(new JavaTimeModule())
          .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

  @Override
  public boolean send(AnomalyResult anomalyResult) {
    String summary = summarize(anomalyResult);
    try {
      LOGGER.warn("{} {}", summary, toJson(anomalyResult));
    } catch (JsonProcessingException e) {
      LOGGER.warn(summary);
      LOGGER.error("Failed to serialize anomaly for metric {}", anomalyResult.getMetricName(), e);
    }
    return true;
  }

  @VisibleForTesting
  static String summarize(AnomalyResult anomalyResult) {
    return String.format(
        Locale.ROOT,
        "Anomaly detected in %s: current=%.3f, baseline=%.3f, deviation=%.2fx",
        anomalyResult.getMetricName(),
        anomalyResult.getCurrentValue(),
        anomalyResult.getBaselineValue(),
        anomalyResult.getDeviationFactor());
  }

  @VisibleForTesting
  static String toJson(AnomalyResult anomalyResult) throws JsonProcessingException {
    return OBJECT_MAPPER.writeValueAsString(anomalyResult);
  }
}
