package com.presales.outreach.retry;

import java.time.Duration;

public enum IntervalUnit {
  MINUTES(60_000L),
  HOURS(3_600_000L);

  private final long millisPerUnit;

  IntervalUnit(long millisPerUnit) {
    this.millisPerUnit = millisPerUnit;
  }

  public Duration toDuration(double amount) {
    return Duration.ofMillis(Math.round(amount * millisPerUnit));
  }
}
