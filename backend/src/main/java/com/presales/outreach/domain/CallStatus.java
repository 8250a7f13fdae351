package com.presales.outreach.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum CallStatus {
  PENDING,
  INITIATED,
  ANSWERED,
  MISSED,
  FAILED,
  COMPLETED,
  CALLBACK_SCHEDULED,
  CALLBACK_INITIATED,
  CALLBACK_FAILED;

  @JsonValue
  public String wire() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static CallStatus fromWire(String value) {
    if (value == null || value.isBlank()) {
      return PENDING;
    }
    return CallStatus.valueOf(value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
  }
}
