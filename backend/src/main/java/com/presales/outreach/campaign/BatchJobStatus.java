package com.presales.outreach.campaign;

import java.util.Locale;

public enum BatchJobStatus {
  RUNNING, COMPLETED, FAILED, CANCELLED;

  public String wire() {
    return name().toLowerCase(Locale.ROOT);
  }
}
