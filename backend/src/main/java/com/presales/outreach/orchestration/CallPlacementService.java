package com.presales.outreach.orchestration;

import com.presales.outreach.domain.*;
import com.presales.outreach.voice.CallInitiationResult;
import com.presales.outreach.voice.VapiProperties;
import com.presales.outreach.voice.VoiceGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Places one outbound call and records it on the lead. A rejected call leaves the lead untouched so
 * it stays eligible for the next sweep.
 */
@Service
public class CallPlacementService {
  private static final Logger log = LoggerFactory.getLogger(CallPlacementService.class);

  private final VoiceGateway voiceGateway;
  private final VapiProperties vapiProperties;
  private final LeadStore leadStore;
  private final LeadStoreRetry storeRetry;
  private final ConversationLog conversationLog;
  private final Clock clock;

  public CallPlacementService(
      VoiceGateway voiceGateway,
      VapiProperties vapiProperties,
      LeadStore leadStore,
      LeadStoreRetry storeRetry,
      ConversationLog conversationLog,
      Clock clock
  ) {
    this.voiceGateway = voiceGateway;
    this.vapiProperties = vapiProperties;
    this.leadStore = leadStore;
    this.storeRetry = storeRetry;
    this.conversationLog = conversationLog;
    this.clock = clock;
  }

  public PlacementResult place(Lead lead, CallStatus statusOnSuccess) {
    if (!lead.hasPhone()) {
      log.warn("Call not placed, lead has no phone leadId={}", lead.id());
      return PlacementResult.missingPhone();
    }

    CallInitiationResult initiation = voiceGateway.initiate(lead, vapiProperties.getAssistantId(), vapiProperties.getPhoneNumberId());
    if (!initiation.success()) {
      log.warn("Call initiation failed leadId={} status={} error={}", lead.id(), lead.callStatus(), initiation.error());
      return PlacementResult.failed(initiation.error());
    }

    OffsetDateTime placedAt = OffsetDateTime.now(clock);
    Map<String, Object> fields = new LinkedHashMap<>();
    fields.put(LeadFields.CALL_STATUS, statusOnSuccess);
    fields.put(LeadFields.EXTERNAL_CALL_ID, initiation.callId());
    fields.put(LeadFields.LAST_CALL_AT, placedAt);
    try {
      storeRetry.run("record-call", lead.id(), () -> leadStore.updateFields(lead.id(), fields));
    } catch (RuntimeException ex) {
      log.error("Call placed but not recorded leadId={} callId={} error={}", lead.id(), initiation.callId(), ex.getMessage());
      return PlacementResult.placedUnrecorded(initiation.callId(), placedAt, ex.getMessage());
    }

    conversationLog.record(lead.id(), Channel.CALL, Direction.OUTBOUND, "Outbound call",
        "Call attempt " + (lead.retryCount() + 1), statusOnSuccess.wire(), initiation.callId());
    log.info("Call placed leadId={} callId={} status={}", lead.id(), initiation.callId(), statusOnSuccess);
    return PlacementResult.placed(initiation.callId(), placedAt);
  }
}
