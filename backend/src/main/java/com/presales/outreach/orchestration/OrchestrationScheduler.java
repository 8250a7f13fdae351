package com.presales.outreach.orchestration;

import com.presales.outreach.domain.CallStatus;
import com.presales.outreach.domain.Lead;
import com.presales.outreach.domain.LeadQuery;
import com.presales.outreach.domain.LeadStore;
import com.presales.outreach.retry.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Periodic sweep that calls new leads and retries missed ones once their next attempt is due. Runs
 * never overlap: a tick that finds the previous sweep still working is skipped.
 */
@Component
public class OrchestrationScheduler {
  private static final Logger log = LoggerFactory.getLogger(OrchestrationScheduler.class);

  private final LeadStore leadStore;
  private final CallPlacementService placementService;
  private final RetryPolicy retryPolicy;
  private final Clock clock;
  private final boolean includeNewLeads;
  private final long pauseBetweenCallsMs;
  private final AtomicBoolean running = new AtomicBoolean(false);

  public OrchestrationScheduler(
      LeadStore leadStore,
      CallPlacementService placementService,
      RetryPolicy retryPolicy,
      Clock clock,
      @Value("${app.scheduler.include-new-leads:true}") boolean includeNewLeads,
      @Value("${app.scheduler.pause-between-calls-ms:1000}") long pauseBetweenCallsMs
  ) {
    this.leadStore = leadStore;
    this.placementService = placementService;
    this.retryPolicy = retryPolicy;
    this.clock = clock;
    this.includeNewLeads = includeNewLeads;
    this.pauseBetweenCallsMs = pauseBetweenCallsMs;
  }

  @Scheduled(
      initialDelayString = "${app.scheduler.orchestrator-initial-delay-seconds:0}",
      fixedDelayString = "${app.scheduler.orchestrator-interval-seconds:60}",
      timeUnit = TimeUnit.SECONDS)
  public void scheduledSweep() {
    try {
      runSweep();
    } catch (RuntimeException ex) {
      log.error("Orchestrator sweep failed", ex);
    }
  }

  public SweepResult runSweep() {
    if (!running.compareAndSet(false, true)) {
      log.info("Orchestrator sweep skipped, previous run still active");
      return SweepResult.skippedRun();
    }
    try {
      List<Lead> due = dueLeads(OffsetDateTime.now(clock));
      int placed = 0;
      List<String> errors = new ArrayList<>();
      for (int i = 0; i < due.size(); i++) {
        Lead lead = due.get(i);
        try {
          PlacementResult result = placementService.place(lead, CallStatus.INITIATED);
          if (result.callPlaced()) {
            placed++;
          } else {
            errors.add(lead.id() + ": " + result.error());
          }
        } catch (RuntimeException ex) {
          errors.add(lead.id() + ": " + ex.getMessage());
          log.error("Orchestrator call failed leadId={} error={}", lead.id(), ex.getMessage());
        }
        if (i < due.size() - 1) {
          sleepQuietly(pauseBetweenCallsMs);
        }
      }
      if (!due.isEmpty()) {
        log.info("Orchestrator sweep done due={} placed={} failed={}", due.size(), placed, errors.size());
      }
      return new SweepResult(false, due.size(), placed, errors.size(), errors);
    } finally {
      running.set(false);
    }
  }

  List<Lead> dueLeads(OffsetDateTime now) {
    List<Lead> due = new ArrayList<>();
    if (includeNewLeads) {
      due.addAll(leadStore.list(LeadQuery.byStatus(CallStatus.PENDING)));
    }
    for (Lead lead : leadStore.list(LeadQuery.byStatus(CallStatus.MISSED, CallStatus.FAILED))) {
      if (retryPolicy.canRetry(lead.retryCount())
          && lead.nextRetryAt() != null
          && !lead.nextRetryAt().isAfter(now)) {
        due.add(lead);
      }
    }
    return due;
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
