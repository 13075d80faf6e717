package com.vitals.analytics.client;

import com.vitals.analytics.model.AnomalyEvent;
import com.vitals.analytics.service.AlertDispatcher;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * Forwards anomalies to the alerting service over HTTP. One attempt, bounded by the
 * alerts client timeout; any failure is logged and the notification is dropped.
 */
@Component
public class HttpAlertDispatcher implements AlertDispatcher {

  private static final Logger log = LoggerFactory.getLogger(HttpAlertDispatcher.class);
  static final String SEND_PATH = "/notifications/send";

  private final RestTemplate alerts;
  private final Counter dispatched;
  private final Counter failed;

  public HttpAlertDispatcher(@Qualifier("alertsRestTemplate") RestTemplate alerts, MeterRegistry metrics) {
    this.alerts = alerts;
    this.dispatched = metrics.counter("vitals_alerts_dispatched_total");
    this.failed = metrics.counter("vitals_alerts_failed_total");
  }

  @Override
  public void dispatch(AnomalyEvent anomaly) {
    AlertNotification body = new AlertNotification(
        anomaly.getPatientId(),
        "Anomaly Detected: " + anomaly.getDescription(),
        anomaly.getSeverity()
    );
    try {
      ResponseEntity<Void> resp = alerts.postForEntity(SEND_PATH, body, Void.class);
      if (!resp.getStatusCode().is2xxSuccessful()) {
        failed.increment();
        log.error("Alert service answered {} for anomaly id={} patient={}; alert dropped",
            resp.getStatusCode().value(), anomaly.getId(), anomaly.getPatientId());
        return;
      }
      dispatched.increment();
      log.debug("Alert sent for anomaly id={} patient={}", anomaly.getId(), anomaly.getPatientId());
    } catch (RestClientException e) {
      failed.increment();
      log.error("Failed to trigger alert service for anomaly id={} patient={}: {}",
          anomaly.getId(), anomaly.getPatientId(), e.getMessage());
    }
  }
}
