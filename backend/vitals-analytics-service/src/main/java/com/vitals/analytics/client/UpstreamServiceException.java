package com.vitals.analytics.client;

/** A collaborator answered, but with an unexpected error status. */
public class UpstreamServiceException extends RuntimeException {
  public UpstreamServiceException(String message, Throwable cause) {
    super(message, cause);
  }
}
