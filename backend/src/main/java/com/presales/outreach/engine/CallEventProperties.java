package com.presales.outreach.engine;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "app.events")
public class CallEventProperties {
  private List<String> missedReasonKeywords = new ArrayList<>(List.of(
      "no-answer", "noanswer", "did-not-answer", "voicemail", "rejected", "busy", "timeout", "cancelled", "canceled", "unavailable", "486", "487", "480"));
  private List<String> failedReasonKeywords = new ArrayList<>(List.of(
      "failed", "error", "providerfault", "server-error", "503", "500"));
  private List<String> callbackKeywords = new ArrayList<>(List.of(
      "call back", "call me back", "callback", "call later", "call me later", "call tomorrow", "call again", "reach me later"));

  public List<String> getMissedReasonKeywords() {
    return missedReasonKeywords;
  }

  public void setMissedReasonKeywords(List<String> missedReasonKeywords) {
    this.missedReasonKeywords = missedReasonKeywords == null ? new ArrayList<>() : new ArrayList<>(missedReasonKeywords);
  }

  public List<String> getFailedReasonKeywords() {
    return failedReasonKeywords;
  }

  public void setFailedReasonKeywords(List<String> failedReasonKeywords) {
    this.failedReasonKeywords = failedReasonKeywords == null ? new ArrayList<>() : new ArrayList<>(failedReasonKeywords);
  }

  public List<String> getCallbackKeywords() {
    return callbackKeywords;
  }

  public void setCallbackKeywords(List<String> callbackKeywords) {
    this.callbackKeywords = callbackKeywords == null ? new ArrayList<>() : new ArrayList<>(callbackKeywords);
  }
}
