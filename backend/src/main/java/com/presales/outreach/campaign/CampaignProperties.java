package com.presales.outreach.campaign;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "app.campaign")
public class CampaignProperties {
  private int defaultParallelCalls = 5;
  private int maxParallelCalls = 10;
  private int defaultIntervalSeconds = 240;
  private int callTimeoutSeconds = 30;
  /** Finished jobs kept for status lookups; older ones are dropped when a new job starts. */
  private int retainedJobs = 20;

  public int getDefaultParallelCalls() {
    return defaultParallelCalls;
  }

  public void setDefaultParallelCalls(int defaultParallelCalls) {
    this.defaultParallelCalls = defaultParallelCalls;
  }

  public int getMaxParallelCalls() {
    return maxParallelCalls;
  }

  public void setMaxParallelCalls(int maxParallelCalls) {
    this.maxParallelCalls = maxParallelCalls;
  }

  public int getDefaultIntervalSeconds() {
    return defaultIntervalSeconds;
  }

  public void setDefaultIntervalSeconds(int defaultIntervalSeconds) {
    this.defaultIntervalSeconds = defaultIntervalSeconds;
  }

  public int getCallTimeoutSeconds() {
    return callTimeoutSeconds;
  }

  public void setCallTimeoutSeconds(int callTimeoutSeconds) {
    this.callTimeoutSeconds = callTimeoutSeconds;
  }

  public int getRetainedJobs() {
    return retainedJobs;
  }

  public void setRetainedJobs(int retainedJobs) {
    this.retainedJobs = retainedJobs;
  }
}
