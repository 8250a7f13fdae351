package com.presales.outreach.voice;

public record CallInitiationResult(boolean success, String callId, String error) {
  public static CallInitiationResult success(String callId) {
    return new CallInitiationResult(true, callId, null);
  }

  public static CallInitiationResult failure(String error) {
    return new CallInitiationResult(false, null, error);
  }
}
