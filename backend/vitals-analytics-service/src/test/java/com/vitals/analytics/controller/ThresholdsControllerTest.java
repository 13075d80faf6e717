package com.vitals.analytics.controller;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.vitals.analytics.client.PatientDirectoryClient;
import com.vitals.analytics.client.PatientNotFoundException;
import com.vitals.analytics.client.UpstreamServiceException;
import com.vitals.analytics.client.UpstreamUnavailableException;
import com.vitals.analytics.model.MetricType;
import com.vitals.analytics.model.Threshold;
import com.vitals.analytics.service.InvalidThresholdException;
import com.vitals.analytics.service.ThresholdRegistry;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(ThresholdsController.class)
class ThresholdsControllerTest {

  private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

  @Autowired
  private MockMvc mvc;

  @MockBean
  private ThresholdRegistry registry;

  @MockBean
  private PatientDirectoryClient patients;

  private final UUID patient = UUID.randomUUID();

  private Threshold stored(MetricType metric, Double min, Double max) {
    Threshold th = new Threshold(patient, metric, min, max, NOW);
    ReflectionTestUtils.setField(th, "id", 11L);
    return th;
  }

  @Test
  @DisplayName("POST /thresholds stores and returns the threshold in snake_case")
  void upsert() throws Exception {
    when(registry.upsert(patient, MetricType.HEART_RATE, 60.0, 100.0))
        .thenReturn(stored(MetricType.HEART_RATE, 60.0, 100.0));

    mvc.perform(post("/thresholds")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"patient_id\":\"" + patient + "\",\"metric\":\"heart_rate\","
                + "\"min_value\":60,\"max_value\":100}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.id").value(11))
        .andExpect(jsonPath("$.patient_id").value(patient.toString()))
        .andExpect(jsonPath("$.metric").value("heart_rate"))
        .andExpect(jsonPath("$.min_value").value(60.0))
        .andExpect(jsonPath("$.max_value").value(100.0))
        .andExpect(jsonPath("$.updated_at").value("2024-05-01T12:00:00Z"))
        .andExpect(header().exists("X-Request-ID"));

    verify(patients).ensureExists(patient);
  }

  @Test
  @DisplayName("POST /thresholds without a metric is a 400 problem")
  void missingMetric() throws Exception {
    mvc.perform(post("/thresholds")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"patient_id\":\"" + patient + "\",\"max_value\":100}"))
        .andExpect(status().isBadRequest())
        .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_PROBLEM_JSON))
        .andExpect(jsonPath("$.status").value(400));

    verifyNoInteractions(registry);
  }

  @Test
  @DisplayName("POST /thresholds with an unknown metric is a 400")
  void unknownMetric() throws Exception {
    mvc.perform(post("/thresholds")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"patient_id\":\"" + patient + "\",\"metric\":\"mood\",\"max_value\":1}"))
        .andExpect(status().isBadRequest());
  }

  @Test
  @DisplayName("POST /thresholds with min above max is a 400")
  void invalidBounds() throws Exception {
    when(registry.upsert(eq(patient), eq(MetricType.SPO2), any(), any()))
        .thenThrow(new InvalidThresholdException("min_value 99.0 is greater than max_value 90.0"));

    mvc.perform(post("/thresholds")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"patient_id\":\"" + patient + "\",\"metric\":\"spo2\",\"min_value\":99,\"max_value\":90}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.detail").value("min_value 99.0 is greater than max_value 90.0"));
  }

  @Test
  @DisplayName("Unknown patient is a 404 and nothing is written")
  void unknownPatient() throws Exception {
    doThrow(new PatientNotFoundException(patient)).when(patients).ensureExists(patient);

    mvc.perform(post("/thresholds")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"patient_id\":\"" + patient + "\",\"metric\":\"heart_rate\",\"max_value\":100}"))
        .andExpect(status().isNotFound());

    verifyNoInteractions(registry);
  }

  @Test
  @DisplayName("Identity service down is a 503, identity service error is a 502")
  void upstreamFailures() throws Exception {
    doThrow(new UpstreamUnavailableException("User service unavailable", null))
        .when(patients).ensureExists(patient);
    mvc.perform(get("/thresholds/{id}", patient)).andExpect(status().isServiceUnavailable());

    UUID other = UUID.randomUUID();
    doThrow(new UpstreamServiceException("User service error: 500", null)).when(patients).ensureExists(other);
    mvc.perform(get("/thresholds/{id}", other)).andExpect(status().isBadGateway());
  }

  @Test
  @DisplayName("GET /thresholds/{patient} lists all thresholds")
  void list() throws Exception {
    when(registry.listForPatient(patient)).thenReturn(List.of(
        stored(MetricType.HEART_RATE, 60.0, 100.0),
        stored(MetricType.TEMPERATURE, null, 38.0)));

    mvc.perform(get("/thresholds/{id}", patient))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.length()").value(2))
        .andExpect(jsonPath("$[1].metric").value("temperature"))
        .andExpect(jsonPath("$[1].min_value").doesNotExist());
  }

  @Test
  @DisplayName("GET /thresholds/{patient}/{metric} returns one threshold or 404")
  void single() throws Exception {
    when(registry.find(patient, MetricType.HEART_RATE)).thenReturn(Optional.of(stored(MetricType.HEART_RATE, 60.0, 100.0)));
    when(registry.find(patient, MetricType.GLUCOSE)).thenReturn(Optional.empty());

    mvc.perform(get("/thresholds/{id}/heart_rate", patient))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.max_value").value(100.0));
    mvc.perform(get("/thresholds/{id}/glucose", patient))
        .andExpect(status().isNotFound());
    mvc.perform(get("/thresholds/{id}/mood", patient))
        .andExpect(status().isBadRequest());
  }

  @Test
  @DisplayName("A malformed patient id in the path is a 400")
  void badPatientId() throws Exception {
    mvc.perform(get("/thresholds/not-a-uuid")).andExpect(status().isBadRequest());
  }
}
