package com.presales.outreach.retry;

import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Decides whether a missed lead may be retried and when. The interval ladder is indexed by the
 * retry count before the increment; counts past the end of the ladder reuse its last step.
 */
@Component
public class RetryPolicy {
  private final RetryProperties properties;
  private final Clock clock;

  public RetryPolicy(RetryProperties properties, Clock clock) {
    this.properties = properties;
    this.clock = clock;
  }

  public boolean canRetry(int retryCount) {
    return retryCount < properties.getMaxRetries();
  }

  public Optional<OffsetDateTime> nextRetryAt(int retryCount) {
    if (retryCount >= properties.getMaxRetries() - 1) {
      return Optional.empty();
    }
    List<Double> ladder = properties.getIntervals();
    int index = Math.min(Math.max(retryCount, 0), ladder.size() - 1);
    Duration wait = properties.getUnit().toDuration(ladder.get(index));
    return Optional.of(OffsetDateTime.now(clock).plus(wait));
  }

  public boolean shouldTriggerFallback(int retryCount) {
    return retryCount >= properties.getMaxRetries();
  }

  public int maxRetries() {
    return properties.getMaxRetries();
  }

  public List<Double> intervals() {
    return List.copyOf(properties.getIntervals());
  }

  public IntervalUnit unit() {
    return properties.getUnit();
  }
}
