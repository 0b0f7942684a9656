package org.hypertrace.statistical.anomaly.engine;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import org.apache.commons.lang3.tuple.Pair;
import org.hypertrace.statistical.anomaly.datamodel.Severity;

/**
 * Remembers which (metric, severity) pairs alerted recently. Critical anomalies are held back
 * for longer than the other severities. Entries are superseded or left to lapse, never removed.
 */
public class SuppressionCache {
  private final Duration criticalDuration;
  private final Duration defaultDuration;
  private final Clock clock;
  private final Map<Pair<String, Severity>, Instant> expiries = new HashMap<>();

  public SuppressionCache(Duration criticalDuration, Duration defaultDuration, Clock clock) {
    this.criticalDuration = criticalDuration;
    this.defaultDuration = defaultDuration;
    this.clock = clock;
  }

  /**
   * Claims the alert slot for the key.
   *
   * @return false if an alert for the same metric and severity is still suppressed, otherwise
   *     true after starting a new suppression window
   */
  public synchronized boolean tryAcquire(String metricName, Severity severity) {
    Pair<String, Severity> key = Pair.of(metricName, severity);
    Instant now = clock.instant();
    Instant expiry = expiries.get(key);
    if (expiry != null && now.isBefore(expiry)) {
      return false;
    }
    expiries.put(key, now.plus(durationFor(severity)));
    return true;
  }

  public synchronized boolean isSuppressed(String metricName, Severity severity) {
    Instant expiry = expiries.get(Pair.of(metricName, severity));
    return expiry != null && clock.instant().isBefore(expiry);
  }

  Duration durationFor(Severity severity) {
    return severity == Severity.CRITICAL ? criticalDuration : defaultDuration;
  }
}
