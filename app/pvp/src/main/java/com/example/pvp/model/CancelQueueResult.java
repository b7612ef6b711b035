package com.example.pvp.model;

public enum CancelQueueResult {
  CANCELLED("cancelled"),
  NOT_QUEUED("not_queued");

  private final String value;

  CancelQueueResult(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }
}
