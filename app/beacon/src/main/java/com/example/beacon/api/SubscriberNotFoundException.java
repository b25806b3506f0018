package com.example.beacon.api;

public class SubscriberNotFoundException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public SubscriberNotFoundException(String subscriberId) {
    super("subscriber not found: " + subscriberId);
  }
}
