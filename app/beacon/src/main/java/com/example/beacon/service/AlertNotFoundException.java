package com.example.beacon.service;

import java.util.UUID;

public class AlertNotFoundException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public AlertNotFoundException(UUID alertId) {
    super("alert not found: " + alertId);
  }
}
