package com.presales.outreach.orchestration;

import com.presales.outreach.domain.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;

/**
 * One-shot callback calls keyed by lead. Rescheduling a lead replaces its pending trigger, and
 * triggers lost on restart are rebuilt from leads still marked {@code callback_scheduled}.
 */
@Component
public class CallbackScheduler {
  private static final Logger log = LoggerFactory.getLogger(CallbackScheduler.class);

  private final TaskScheduler taskScheduler;
  private final LeadStore leadStore;
  private final LeadStoreRetry storeRetry;
  private final CallPlacementService placementService;
  private final Clock clock;
  private final Map<String, ScheduledFuture<?>> pending = new ConcurrentHashMap<>();

  public CallbackScheduler(
      TaskScheduler taskScheduler,
      LeadStore leadStore,
      LeadStoreRetry storeRetry,
      CallPlacementService placementService,
      Clock clock
  ) {
    this.taskScheduler = taskScheduler;
    this.leadStore = leadStore;
    this.storeRetry = storeRetry;
    this.placementService = placementService;
    this.clock = clock;
  }

  public void schedule(String leadId, OffsetDateTime at) {
    ScheduledFuture<?> future = taskScheduler.schedule(() -> fire(leadId), at.toInstant());
    ScheduledFuture<?> previous = pending.put(leadId, future);
    if (previous != null) {
      previous.cancel(false);
    }
    log.info("Callback scheduled leadId={} at={}", leadId, at);
  }

  public boolean cancel(String leadId) {
    ScheduledFuture<?> future = pending.remove(leadId);
    return future != null && future.cancel(false);
  }

  public boolean isPending(String leadId) {
    return pending.containsKey(leadId);
  }

  @EventListener(ApplicationReadyEvent.class)
  public void restorePending() {
    OffsetDateTime now = OffsetDateTime.now(clock);
    int restored = 0;
    for (Lead lead : leadStore.list(LeadQuery.byStatus(CallStatus.CALLBACK_SCHEDULED))) {
      OffsetDateTime at = lead.callbackRequestedAt() == null || lead.callbackRequestedAt().isBefore(now)
          ? now
          : lead.callbackRequestedAt();
      schedule(lead.id(), at);
      restored++;
    }
    if (restored > 0) {
      log.info("Restored pending callbacks count={}", restored);
    }
  }

  void fire(String leadId) {
    pending.remove(leadId);
    Optional<Lead> lead = leadStore.findById(leadId);
    if (lead.isEmpty()) {
      log.warn("Callback skipped, lead not found leadId={}", leadId);
      return;
    }
    if (lead.get().callStatus() != CallStatus.CALLBACK_SCHEDULED) {
      log.info("Callback skipped leadId={} status={}", leadId, lead.get().callStatus());
      return;
    }

    PlacementResult result;
    try {
      result = placementService.place(lead.get(), CallStatus.CALLBACK_INITIATED);
    } catch (RuntimeException ex) {
      result = PlacementResult.failed(ex.getMessage());
    }
    if (result.callPlaced()) {
      log.info("Callback call placed leadId={} callId={}", leadId, result.callId());
      return;
    }

    Map<String, Object> fields = new LinkedHashMap<>();
    fields.put(LeadFields.CALL_STATUS, CallStatus.CALLBACK_FAILED);
    fields.put(LeadFields.LAST_TERMINAL_REASON, result.error());
    try {
      storeRetry.run("callback-failed", leadId, () -> leadStore.updateFields(leadId, fields));
    } catch (RuntimeException ex) {
      log.error("Callback failure not recorded leadId={} error={}", leadId, ex.getMessage());
    }
    log.warn("Callback call failed leadId={} error={}", leadId, result.error());
  }
}
