package com.presales.outreach.engine;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Reads Vapi server messages. The call object is taken from the top level when present and from
 * {@code message.call} otherwise; the lead id travels in the call metadata set at initiation.
 */
@Component
public class CallEventParser {
  private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};

  private final ObjectMapper mapper;

  public CallEventParser(ObjectMapper mapper) {
    this.mapper = mapper;
  }

  public CallEvent parse(JsonNode payload) {
    JsonNode message = payload.path("message");
    JsonNode call = payload.path("call");
    if (!call.isObject() || call.isEmpty()) {
      call = message.path("call");
    }
    JsonNode metadata = call.path("metadata");
    String leadId = firstText(metadata, "lead_uuid", "lead_id");
    String callId = text(call, "id");
    String type = text(message, "type").toLowerCase(Locale.ROOT);

    if ("status-update".equals(type)) {
      String answeredAt = firstText(call, "answeredAt", "connectedAt");
      if (!StringUtils.hasText(answeredAt)) {
        answeredAt = firstText(message, "answeredAt", "connectedAt");
      }
      String endedReason = firstText(message, "endedReason", "ended_reason");
      if (!StringUtils.hasText(endedReason)) {
        endedReason = text(call, "endedReason");
      }
      return new CallEvent(CallEvent.Type.STATUS_UPDATE, leadId, callId,
          text(message, "status").toLowerCase(Locale.ROOT),
          endedReason,
          answeredAt, null, null, Map.of(), null, null, null);
    }

    if ("end-of-call-report".equals(type)) {
      JsonNode analysis = message.path("analysis");
      JsonNode artifact = message.path("artifact");
      Map<String, Object> structured = analysis.path("structuredData").isObject()
          ? mapper.convertValue(analysis.path("structuredData"), MAP_TYPE)
          : Map.of();
      JsonNode duration = message.path("durationSeconds");
      return new CallEvent(CallEvent.Type.END_OF_CALL_REPORT, leadId, callId,
          null,
          text(message, "endedReason"),
          null,
          text(analysis, "summary"),
          text(analysis, "successEvaluation"),
          structured,
          duration.isNumber() ? (int) Math.round(duration.asDouble()) : null,
          firstNonBlank(text(message, "recordingUrl"), text(artifact, "recordingUrl")),
          firstNonBlank(text(message, "transcript"), text(artifact, "transcript")));
    }

    return new CallEvent(CallEvent.Type.OTHER, leadId, callId, null, null, null, null, null, Map.of(), null, null, null);
  }

  private static String firstText(JsonNode node, String... fields) {
    for (String field : fields) {
      String value = text(node, field);
      if (StringUtils.hasText(value)) {
        return value;
      }
    }
    return "";
  }

  private static String firstNonBlank(String first, String second) {
    return StringUtils.hasText(first) ? first : second;
  }

  private static String text(JsonNode node, String field) {
    JsonNode value = node.path(field);
    if (value.isMissingNode() || value.isNull()) {
      return "";
    }
    return value.isValueNode() ? value.asText("") : value.toString();
  }
}
