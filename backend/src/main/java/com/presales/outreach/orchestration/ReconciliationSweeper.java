package com.presales.outreach.orchestration;

import com.presales.outreach.domain.*;
import com.presales.outreach.engine.CallStatusStateMachine;
import com.presales.outreach.engine.EndedReasonClassifier;
import com.presales.outreach.voice.CallStatusSnapshot;
import com.presales.outreach.voice.VoiceGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Catches calls whose webhook never arrived by asking the provider directly for every lead still
 * marked as initiated.
 */
@Component
public class ReconciliationSweeper {
  private static final Logger log = LoggerFactory.getLogger(ReconciliationSweeper.class);

  private final LeadStore leadStore;
  private final LeadStoreRetry storeRetry;
  private final VoiceGateway voiceGateway;
  private final EndedReasonClassifier classifier;
  private final CallStatusStateMachine stateMachine;
  private final AtomicBoolean running = new AtomicBoolean(false);

  public ReconciliationSweeper(
      LeadStore leadStore,
      LeadStoreRetry storeRetry,
      VoiceGateway voiceGateway,
      EndedReasonClassifier classifier,
      CallStatusStateMachine stateMachine
  ) {
    this.leadStore = leadStore;
    this.storeRetry = storeRetry;
    this.voiceGateway = voiceGateway;
    this.classifier = classifier;
    this.stateMachine = stateMachine;
  }

  @Scheduled(
      initialDelayString = "${app.scheduler.reconciliation-interval-seconds:300}",
      fixedDelayString = "${app.scheduler.reconciliation-interval-seconds:300}",
      timeUnit = TimeUnit.SECONDS)
  public void scheduledReconcile() {
    try {
      reconcile();
    } catch (RuntimeException ex) {
      log.error("Reconciliation sweep failed", ex);
    }
  }

  public ReconciliationResult reconcile() {
    if (!running.compareAndSet(false, true)) {
      log.info("Reconciliation skipped, previous run still active");
      return new ReconciliationResult(true, 0, 0, 0, 0);
    }
    try {
      int checked = 0;
      int completed = 0;
      int missed = 0;
      int errors = 0;
      for (Lead lead : leadStore.list(LeadQuery.byStatus(CallStatus.INITIATED, CallStatus.CALLBACK_INITIATED))) {
        if (!StringUtils.hasText(lead.externalCallId())) {
          continue;
        }
        checked++;
        try {
          Correction correction = correct(lead);
          if (correction == Correction.COMPLETED) {
            completed++;
          } else if (correction == Correction.MISSED) {
            missed++;
          }
        } catch (RuntimeException ex) {
          errors++;
          log.warn("Reconciliation failed leadId={} callId={} error={}", lead.id(), lead.externalCallId(), ex.getMessage());
        }
      }
      if (checked > 0) {
        log.info("Reconciliation done checked={} completed={} missed={} errors={}", checked, completed, missed, errors);
      }
      return new ReconciliationResult(false, checked, completed, missed, errors);
    } finally {
      running.set(false);
    }
  }

  private Correction correct(Lead lead) {
    Optional<CallStatusSnapshot> snapshot = voiceGateway.getStatus(lead.externalCallId());
    if (snapshot.isEmpty()) {
      return Correction.NONE;
    }
    String status = snapshot.get().status().toLowerCase(Locale.ROOT);
    String reason = snapshot.get().endedReason();

    boolean missedStatus = status.equals("failed") || status.equals("busy") || status.equals("no-answer");
    boolean endedStatus = status.equals("ended") || status.equals("completed");
    if (!missedStatus && !endedStatus) {
      return Correction.NONE;
    }
    if (missedStatus || classifier.classify(reason, true).routesToMissedPath()) {
      log.info("Reconciled as missed leadId={} providerStatus={} endedReason={}", lead.id(), status, reason);
      stateMachine.onMissedCall(lead.id(), StringUtils.hasText(reason) ? reason : status);
      return Correction.MISSED;
    }

    Map<String, Object> fields = new LinkedHashMap<>();
    fields.put(LeadFields.CALL_STATUS, CallStatus.COMPLETED);
    fields.put(LeadFields.NEXT_RETRY_AT, null);
    fields.put(LeadFields.LAST_TERMINAL_REASON, reason);
    storeRetry.run("reconcile-completed", lead.id(), () -> leadStore.updateFields(lead.id(), fields));
    log.info("Reconciled as completed leadId={} endedReason={}", lead.id(), reason);
    return Correction.COMPLETED;
  }

  private enum Correction { NONE, COMPLETED, MISSED }

  public record ReconciliationResult(boolean skipped, int checked, int completed, int missed, int errors) {
  }
}
