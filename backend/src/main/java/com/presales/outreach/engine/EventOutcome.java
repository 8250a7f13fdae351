package com.presales.outreach.engine;

import com.presales.outreach.domain.CallStatus;

import java.util.LinkedHashMap;
import java.util.Map;

public record EventOutcome(boolean handled, String action, CallStatus status, String reason) {
  public static EventOutcome updated(String action, CallStatus status) {
    return new EventOutcome(true, action, status, null);
  }

  public static EventOutcome ignored(String reason) {
    return new EventOutcome(false, "IGNORED", null, reason);
  }

  public Map<String, Object> toBody() {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("ok", true);
    body.put("handled", handled);
    body.put("action", action);
    if (status != null) {
      body.put("callStatus", status.wire());
    }
    if (reason != null) {
      body.put("reason", reason);
    }
    return body;
  }
}
