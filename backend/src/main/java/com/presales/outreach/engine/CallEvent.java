package com.presales.outreach.engine;

import java.util.Map;

/**
 * Provider webhook reduced to what the engine acts on. {@code answeredAt} is non-blank once the callee
 * picked up.
 */
public record CallEvent(
    Type type,
    String leadId,
    String callId,
    String status,
    String endedReason,
    String answeredAt,
    String summary,
    String qualification,
    Map<String, Object> structuredData,
    Integer durationSeconds,
    String recordingUrl,
    String transcript
) {
  public enum Type { STATUS_UPDATE, END_OF_CALL_REPORT, OTHER }

  public CallEvent {
    structuredData = structuredData == null ? Map.of() : structuredData;
  }

  public boolean answered() {
    return answeredAt != null && !answeredAt.isBlank();
  }

  public static CallEvent statusUpdate(String leadId, String status, String endedReason, String answeredAt) {
    return new CallEvent(Type.STATUS_UPDATE, leadId, null, status, endedReason, answeredAt, null, null, Map.of(), null, null, null);
  }

  public static CallEvent report(String leadId, String callId, String summary, String qualification, Map<String, Object> structuredData) {
    return new CallEvent(Type.END_OF_CALL_REPORT, leadId, callId, null, null, null, summary, qualification, structuredData, null, null, null);
  }
}
