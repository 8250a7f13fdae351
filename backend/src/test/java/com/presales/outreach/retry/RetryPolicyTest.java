package com.presales.outreach.retry;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RetryPolicyTest {
  private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-10T06:30:00Z"), ZoneId.of("Asia/Kolkata"));

  private RetryPolicy policy(int maxRetries, IntervalUnit unit, Double... intervals) {
    RetryProperties properties = new RetryProperties();
    properties.setMaxRetries(maxRetries);
    properties.setUnit(unit);
    properties.setIntervals(List.of(intervals));
    return new RetryPolicy(properties, CLOCK);
  }

  @Test
  void canRetryStopsAtMaxRetries() {
    RetryPolicy policy = policy(3, IntervalUnit.HOURS, 0.5, 24.0);

    assertTrue(policy.canRetry(0));
    assertTrue(policy.canRetry(2));
    assertFalse(policy.canRetry(3));
    assertFalse(policy.canRetry(4));
  }

  @Test
  void fallbackTriggersOnceCountReachesMax() {
    RetryPolicy policy = policy(3, IntervalUnit.HOURS, 0.5, 24.0);

    assertFalse(policy.shouldTriggerFallback(2));
    assertTrue(policy.shouldTriggerFallback(3));
  }

  @Test
  void nextRetryFollowsLadderAndStopsBeforeLastAttempt() {
    RetryPolicy policy = policy(2, IntervalUnit.MINUTES, 30.0, 1440.0);
    OffsetDateTime now = OffsetDateTime.now(CLOCK);

    assertEquals(now.plus(Duration.ofMinutes(30)), policy.nextRetryAt(0).orElseThrow());
    assertTrue(policy.nextRetryAt(1).isEmpty());
  }

  @Test
  void countsPastLadderReuseLastStep() {
    RetryPolicy policy = policy(5, IntervalUnit.HOURS, 0.5, 24.0);
    OffsetDateTime now = OffsetDateTime.now(CLOCK);

    assertEquals(now.plusMinutes(30), policy.nextRetryAt(0).orElseThrow());
    assertEquals(now.plusHours(24), policy.nextRetryAt(1).orElseThrow());
    assertEquals(now.plusHours(24), policy.nextRetryAt(3).orElseThrow());
    assertTrue(policy.nextRetryAt(4).isEmpty());
  }

  @Test
  void rejectsEmptyLadder() {
    RetryProperties properties = new RetryProperties();
    assertThrows(IllegalArgumentException.class, () -> properties.setIntervals(List.of()));
  }
}
