package com.vitals.analytics.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.vitals.analytics.model.MetricType;
import com.vitals.analytics.model.Timestamps;
import java.time.DateTimeException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * Reads historical samples of one metric from the patient-data service.
 * A failed fetch yields an empty list so the caller can carry on with other metrics.
 */
@Component
public class TelemetryHistoryClient {

  private static final Logger log = LoggerFactory.getLogger(TelemetryHistoryClient.class);
  static final String HISTORY_PATH = "/{id}/history?start_time={start}&end_time={end}&metric_type={metric}";

  private final RestTemplate telemetry;

  public TelemetryHistoryClient(@Qualifier("telemetryRestTemplate") RestTemplate telemetry) {
    this.telemetry = telemetry;
  }

  public List<HistoryPoint> fetch(UUID patientId, MetricType metric, Instant start, Instant end) {
    RawPoint[] body;
    try {
      body = telemetry.getForObject(HISTORY_PATH, RawPoint[].class,
          patientId, start.toString(), end.toString(), metric.wireName());
    } catch (RestClientException e) {
      log.warn("History fetch failed patient={} metric={}: {}", patientId, metric, e.getMessage());
      return List.of();
    }
    if (body == null) return List.of();

    List<HistoryPoint> out = new ArrayList<>(body.length);
    for (RawPoint p : body) {
      if (p == null || p.value() == null || p.timestamp() == null) continue;
      try {
        out.add(new HistoryPoint(Timestamps.parse(p.timestamp()), p.value()));
      } catch (DateTimeException e) {
        log.warn("Skipping history point with bad timestamp '{}' patient={} metric={}",
            p.timestamp(), patientId, metric);
      }
    }
    return out;
  }

  public record HistoryPoint(Instant timestamp, double value) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record RawPoint(String timestamp, Double value) {}
}
