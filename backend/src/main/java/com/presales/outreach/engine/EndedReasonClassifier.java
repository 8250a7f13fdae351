package com.presales.outreach.engine;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

@Component
public class EndedReasonClassifier {

  public enum EndedCallClass {
    /** Never picked up. */
    NOT_CONNECTED,
    MISSED_LIKE,
    FAILED_LIKE,
    COMPLETED;

    public boolean routesToMissedPath() {
      return this != COMPLETED;
    }
  }

  private final CallEventProperties properties;

  public EndedReasonClassifier(CallEventProperties properties) {
    this.properties = properties;
  }

  /** Missed keywords are checked before failed ones, so "busy-error" counts as missed. */
  public EndedCallClass classify(String endedReason, boolean answered) {
    if (!answered) {
      return EndedCallClass.NOT_CONNECTED;
    }
    String reason = endedReason == null ? "" : endedReason.toLowerCase(Locale.ROOT);
    if (containsAny(reason, properties.getMissedReasonKeywords())) {
      return EndedCallClass.MISSED_LIKE;
    }
    if (containsAny(reason, properties.getFailedReasonKeywords())) {
      return EndedCallClass.FAILED_LIKE;
    }
    return EndedCallClass.COMPLETED;
  }

  private static boolean containsAny(String reason, List<String> keywords) {
    if (reason.isEmpty()) {
      return false;
    }
    for (String keyword : keywords) {
      if (!keyword.isBlank() && reason.contains(keyword.toLowerCase(Locale.ROOT))) {
        return true;
      }
    }
    return false;
  }
}
