package com.vitals.analytics.service;

public class InvalidThresholdException extends RuntimeException {
  public InvalidThresholdException(String message) {
    super(message);
  }
}
