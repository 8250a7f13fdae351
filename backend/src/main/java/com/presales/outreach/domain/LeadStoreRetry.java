package com.presales.outreach.domain;

import com.presales.outreach.common.OutreachException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;

/**
 * Bounded exponential backoff around lead writes. A missing lead is not transient and is rethrown at once.
 */
@Component
public class LeadStoreRetry {
  private static final Logger log = LoggerFactory.getLogger(LeadStoreRetry.class);

  private final int maxAttempts;
  private final long initialBackoffMs;

  public LeadStoreRetry(
      @Value("${app.store.write-attempts:4}") int maxAttempts,
      @Value("${app.store.backoff-initial-ms:500}") long initialBackoffMs
  ) {
    this.maxAttempts = Math.max(1, maxAttempts);
    this.initialBackoffMs = Math.max(0, initialBackoffMs);
  }

  public void run(String operation, String leadId, Runnable write) {
    long backoff = initialBackoffMs;
    for (int attempt = 1; ; attempt++) {
      try {
        write.run();
        return;
      } catch (OutreachException ex) {
        if (ex.status() == HttpStatus.NOT_FOUND || attempt >= maxAttempts) {
          throw ex;
        }
        log.warn("Lead write failed op={} leadId={} attempt={}/{} code={}", operation, leadId, attempt, maxAttempts, ex.code());
      } catch (RuntimeException ex) {
        if (attempt >= maxAttempts) {
          log.error("Lead write gave up op={} leadId={} attempts={} error={}", operation, leadId, attempt, ex.getMessage());
          throw ex;
        }
        log.warn("Lead write failed op={} leadId={} attempt={}/{} error={}", operation, leadId, attempt, maxAttempts, ex.getMessage());
      }
      sleepQuietly(backoff);
      backoff *= 2;
    }
  }

  private void sleepQuietly(long millis) {
    if (millis <= 0) {
      return;
    }
    try {
      Thread.sleep(millis);
    } catch (InterruptedException ignored) {
      Thread.currentThread().interrupt();
    }
  }
}
