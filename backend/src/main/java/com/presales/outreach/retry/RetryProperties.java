package com.presales.outreach.retry;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "app.retry")
public class RetryProperties {
  private int maxRetries = 3;
  private List<Double> intervals = new ArrayList<>(List.of(0.5, 24.0));
  private IntervalUnit unit = IntervalUnit.HOURS;

  public int getMaxRetries() {
    return maxRetries;
  }

  public void setMaxRetries(int maxRetries) {
    this.maxRetries = Math.max(0, maxRetries);
  }

  public List<Double> getIntervals() {
    return intervals;
  }

  public void setIntervals(List<Double> intervals) {
    if (intervals == null || intervals.isEmpty()) {
      throw new IllegalArgumentException("app.retry.intervals must contain at least one value");
    }
    for (Double interval : intervals) {
      if (interval == null || interval < 0) {
        throw new IllegalArgumentException("app.retry.intervals must not contain negative values");
      }
    }
    this.intervals = new ArrayList<>(intervals);
  }

  public IntervalUnit getUnit() {
    return unit;
  }

  public void setUnit(IntervalUnit unit) {
    this.unit = unit == null ? IntervalUnit.HOURS : unit;
  }
}
