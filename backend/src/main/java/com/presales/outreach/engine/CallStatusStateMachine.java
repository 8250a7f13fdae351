package com.presales.outreach.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.presales.outreach.domain.*;
import com.presales.outreach.orchestration.CallbackScheduler;
import com.presales.outreach.retry.RetryPolicy;
import com.presales.outreach.voice.VoiceGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.util.*;

/**
 * Applies provider call events to leads. Every event re-reads the lead first, so replays see the sent
 * flags written by the previous delivery.
 */
@Service
public class CallStatusStateMachine {
  private static final Logger log = LoggerFactory.getLogger(CallStatusStateMachine.class);

  /** The call behind these states is over; late status events only update the terminal reason. */
  private static final Set<CallStatus> SETTLED = EnumSet.of(
      CallStatus.COMPLETED, CallStatus.CALLBACK_SCHEDULED, CallStatus.CALLBACK_FAILED);

  private final LeadStore leadStore;
  private final LeadStoreRetry storeRetry;
  private final RetryPolicy retryPolicy;
  private final EndedReasonClassifier classifier;
  private final FallbackSequencer fallbackSequencer;
  private final CallbackIntentDetector intentDetector;
  private final CallbackTimeParser timeParser;
  private final CallbackScheduler callbackScheduler;
  private final VoiceGateway voiceGateway;
  private final ConversationLog conversationLog;
  private final ObjectMapper mapper;
  private final Clock clock;

  public CallStatusStateMachine(
      LeadStore leadStore,
      LeadStoreRetry storeRetry,
      RetryPolicy retryPolicy,
      EndedReasonClassifier classifier,
      FallbackSequencer fallbackSequencer,
      CallbackIntentDetector intentDetector,
      CallbackTimeParser timeParser,
      CallbackScheduler callbackScheduler,
      VoiceGateway voiceGateway,
      ConversationLog conversationLog,
      ObjectMapper mapper,
      Clock clock
  ) {
    this.leadStore = leadStore;
    this.storeRetry = storeRetry;
    this.retryPolicy = retryPolicy;
    this.classifier = classifier;
    this.fallbackSequencer = fallbackSequencer;
    this.intentDetector = intentDetector;
    this.timeParser = timeParser;
    this.callbackScheduler = callbackScheduler;
    this.voiceGateway = voiceGateway;
    this.conversationLog = conversationLog;
    this.mapper = mapper;
    this.clock = clock;
  }

  public EventOutcome handle(CallEvent event) {
    if (!StringUtils.hasText(event.leadId())) {
      log.warn("Call event without lead id type={} callId={}", event.type(), event.callId());
      return EventOutcome.ignored("NO_LEAD_ID");
    }
    Optional<Lead> lead = leadStore.findById(event.leadId());
    if (lead.isEmpty()) {
      log.warn("Call event for unknown lead leadId={} type={}", event.leadId(), event.type());
      return EventOutcome.ignored("UNKNOWN_LEAD");
    }

    if (event.type() == CallEvent.Type.STATUS_UPDATE) {
      return onStatusUpdate(lead.get(), event);
    }
    if (event.type() == CallEvent.Type.END_OF_CALL_REPORT) {
      return onEndOfCallReport(lead.get(), event);
    }
    log.debug("Call event type not handled leadId={}", event.leadId());
    return EventOutcome.ignored("UNHANDLED_EVENT_TYPE");
  }

  private EventOutcome onStatusUpdate(Lead lead, CallEvent event) {
    String status = Objects.toString(event.status(), "");
    log.info("Call status update leadId={} status={} endedReason={} answered={}", lead.id(), status, event.endedReason(), event.answered());
    if (SETTLED.contains(lead.callStatus())) {
      return onSettledLead(lead, event.endedReason());
    }
    switch (status) {
      case "answered", "in-progress" -> {
        write("call-answered", lead.id(), Map.of(LeadFields.CALL_STATUS, CallStatus.ANSWERED));
        return EventOutcome.updated("ANSWERED", CallStatus.ANSWERED);
      }
      case "missed", "failed", "no-answer", "busy" -> {
        return onMissedCall(lead.id(), StringUtils.hasText(event.endedReason()) ? event.endedReason() : status);
      }
      case "ended" -> {
        EndedReasonClassifier.EndedCallClass callClass = classifier.classify(event.endedReason(), event.answered());
        if (callClass.routesToMissedPath()) {
          return onMissedCall(lead.id(), event.endedReason());
        }
        return onCompletedCall(lead, event.endedReason());
      }
      default -> {
        return EventOutcome.ignored("STATUS_NOT_TRACKED");
      }
    }
  }

  /**
   * One write per missed call: status, counter and next attempt together. Reaching the retry ceiling
   * triggers the fallback once, on the event that reached it.
   */
  public EventOutcome onMissedCall(String leadId, String reason) {
    Lead current = leadStore.findById(leadId).orElse(null);
    if (current == null) {
      return EventOutcome.ignored("UNKNOWN_LEAD");
    }
    if (SETTLED.contains(current.callStatus())) {
      return onSettledLead(current, reason);
    }
    fallbackSequencer.sendMissedCallEmail(leadId);

    Map<String, Object> fields = new LinkedHashMap<>();
    fields.put(LeadFields.CALL_STATUS, CallStatus.MISSED);
    if (StringUtils.hasText(reason)) {
      fields.put(LeadFields.LAST_TERMINAL_REASON, reason);
    }

    int count = current.retryCount();
    if (!retryPolicy.canRetry(count)) {
      fields.put(LeadFields.NEXT_RETRY_AT, null);
      write("missed-exhausted", leadId, fields);
      log.info("Missed call with retries exhausted leadId={} retryCount={}", leadId, count);
      fallbackSequencer.onRetriesExhausted(leadId);
      return EventOutcome.updated("RETRIES_EXHAUSTED", CallStatus.MISSED);
    }

    int nextCount = count + 1;
    OffsetDateTime nextRetryAt = retryPolicy.nextRetryAt(count).orElse(null);
    fields.put(LeadFields.RETRY_COUNT, nextCount);
    fields.put(LeadFields.NEXT_RETRY_AT, nextRetryAt);
    write("missed-retry", leadId, fields);

    if (retryPolicy.shouldTriggerFallback(nextCount)) {
      log.info("Retry ceiling reached leadId={} retryCount={}", leadId, nextCount);
      fallbackSequencer.onRetriesExhausted(leadId);
      return EventOutcome.updated("RETRIES_EXHAUSTED", CallStatus.MISSED);
    }
    log.info("Retry scheduled leadId={} retryCount={} nextRetryAt={}", leadId, nextCount, nextRetryAt);
    return EventOutcome.updated("RETRY_SCHEDULED", CallStatus.MISSED);
  }

  private EventOutcome onSettledLead(Lead lead, String reason) {
    if (StringUtils.hasText(reason) && !reason.equals(lead.lastTerminalReason())) {
      write("call-ended", lead.id(), Map.of(LeadFields.LAST_TERMINAL_REASON, reason));
    }
    log.info("Late call event on settled lead leadId={} status={} endedReason={}", lead.id(), lead.callStatus(), reason);
    return new EventOutcome(true, "STATUS_SETTLED", lead.callStatus(), null);
  }

  private EventOutcome onCompletedCall(Lead lead, String reason) {
    Map<String, Object> fields = new LinkedHashMap<>();
    fields.put(LeadFields.LAST_TERMINAL_REASON, reason);
    fields.put(LeadFields.CALL_STATUS, CallStatus.COMPLETED);
    fields.put(LeadFields.NEXT_RETRY_AT, null);
    write("call-completed", lead.id(), fields);
    return EventOutcome.updated("COMPLETED", CallStatus.COMPLETED);
  }

  private EventOutcome onEndOfCallReport(Lead lead, CallEvent event) {
    Map<String, Object> fields = new LinkedHashMap<>();
    fields.put(LeadFields.SUMMARY, event.summary());
    fields.put(LeadFields.QUALIFICATION, event.qualification());
    fields.put(LeadFields.STRUCTURED_FIELDS, toJson(event.structuredData()));
    flatten(event.structuredData()).forEach(fields::put);
    if (event.durationSeconds() != null) {
      fields.put(LeadFields.CALL_DURATION_SECONDS, event.durationSeconds());
    }
    if (StringUtils.hasText(event.recordingUrl())) {
      fields.put(LeadFields.RECORDING_URL, event.recordingUrl());
    }
    if (StringUtils.hasText(event.callId())) {
      fields.put(LeadFields.EXTERNAL_CALL_ID, event.callId());
    }
    if (StringUtils.hasText(event.transcript())) {
      fields.put(LeadFields.TRANSCRIPT, event.transcript());
    }
    fields.put(LeadFields.CALL_STATUS, CallStatus.COMPLETED);
    fields.put(LeadFields.NEXT_RETRY_AT, null);
    write("call-report", lead.id(), fields);
    conversationLog.record(lead.id(), Channel.CALL, Direction.INBOUND, "Call summary",
        Objects.toString(event.summary(), ""), "completed", event.callId());
    log.info("Call report stored leadId={} callId={} qualification={}", lead.id(), event.callId(), event.qualification());

    if (!StringUtils.hasText(event.transcript()) && StringUtils.hasText(event.callId())) {
      fetchTranscript(lead.id(), event.callId());
    }

    CallStatus finalStatus = CallStatus.COMPLETED;
    Optional<String> callbackText = intentDetector.detect(event.summary(), event.structuredData());
    if (callbackText.isPresent()) {
      OffsetDateTime at = timeParser.parse(callbackText.get(), ZonedDateTime.now(clock)).toOffsetDateTime();
      write("callback-requested", lead.id(), Map.of(
          LeadFields.CALL_STATUS, CallStatus.CALLBACK_SCHEDULED,
          LeadFields.CALLBACK_REQUESTED_AT, at));
      callbackScheduler.schedule(lead.id(), at);
      finalStatus = CallStatus.CALLBACK_SCHEDULED;
      log.info("Callback requested leadId={} at={}", lead.id(), at);
    }

    fallbackSequencer.sendPostCallFollowUp(lead.id());
    return EventOutcome.updated("REPORT_STORED", finalStatus);
  }

  private void fetchTranscript(String leadId, String callId) {
    try {
      voiceGateway.getTranscript(callId)
          .ifPresent(text -> write("call-transcript", leadId, Map.of(LeadFields.TRANSCRIPT, text)));
    } catch (RuntimeException ex) {
      log.warn("Transcript not stored leadId={} callId={} error={}", leadId, callId, ex.getMessage());
    }
  }

  /** Scalar analysis fields become lead columns; names that clash with core columns get a prefix. */
  static Map<String, Object> flatten(Map<String, Object> structured) {
    Map<String, Object> flattened = new LinkedHashMap<>();
    structured.forEach((key, value) -> {
      if (value == null || value instanceof Map || value instanceof Collection) {
        return;
      }
      String column = key.trim().toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "_").replaceAll("^_|_$", "");
      if (column.isEmpty()) {
        return;
      }
      if (LeadFields.CORE.contains(column)) {
        column = "analysis_" + column;
      }
      flattened.put(column, value.toString());
    });
    return flattened;
  }

  private String toJson(Map<String, Object> structured) {
    if (structured.isEmpty()) {
      return null;
    }
    try {
      return mapper.writeValueAsString(structured);
    } catch (JsonProcessingException ex) {
      log.warn("Structured analysis not serializable: {}", ex.getMessage());
      return structured.toString();
    }
  }

  private void write(String operation, String leadId, Map<String, Object> fields) {
    storeRetry.run(operation, leadId, () -> leadStore.updateFields(leadId, fields));
  }
}
