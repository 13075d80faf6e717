package com.vitals.analytics.client;

import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

/**
 * Existence check against the identity service. Used by the administrative API only;
 * the live evaluation loop never calls it.
 */
@Component
public class PatientDirectoryClient {

  private static final Logger log = LoggerFactory.getLogger(PatientDirectoryClient.class);

  private final RestTemplate patients;

  public PatientDirectoryClient(@Qualifier("patientsRestTemplate") RestTemplate patients) {
    this.patients = patients;
  }

  /**
   * @throws PatientNotFoundException     if the identity service answers 404
   * @throws UpstreamServiceException     on any other error status
   * @throws UpstreamUnavailableException if the identity service cannot be reached
   */
  public void ensureExists(UUID patientId) {
    try {
      patients.getForEntity("/{id}", Void.class, patientId);
    } catch (HttpClientErrorException.NotFound e) {
      throw new PatientNotFoundException(patientId);
    } catch (HttpStatusCodeException e) {
      log.warn("User service answered {} for patient={}", e.getStatusCode().value(), patientId);
      throw new UpstreamServiceException("User service error: " + e.getStatusCode().value(), e);
    } catch (ResourceAccessException e) {
      log.warn("User service unavailable checking patient={}: {}", patientId, e.getMessage());
      throw new UpstreamUnavailableException("User service unavailable: " + e.getMessage(), e);
    }
  }
}
