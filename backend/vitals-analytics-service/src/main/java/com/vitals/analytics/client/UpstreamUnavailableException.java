package com.vitals.analytics.client;

/** A collaborator could not be reached or did not answer in time. */
public class UpstreamUnavailableException extends RuntimeException {
  public UpstreamUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
