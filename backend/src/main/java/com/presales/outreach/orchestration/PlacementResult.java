package com.presales.outreach.orchestration;

import java.time.OffsetDateTime;

public record PlacementResult(Outcome outcome, String callId, OffsetDateTime placedAt, String error) {
  public enum Outcome {
    PLACED,
    /** Provider accepted the call but the lead row could not be updated. */
    PLACED_UNRECORDED,
    MISSING_PHONE,
    FAILED
  }

  public static PlacementResult placed(String callId, OffsetDateTime placedAt) {
    return new PlacementResult(Outcome.PLACED, callId, placedAt, null);
  }

  public static PlacementResult placedUnrecorded(String callId, OffsetDateTime placedAt, String error) {
    return new PlacementResult(Outcome.PLACED_UNRECORDED, callId, placedAt, error);
  }

  public static PlacementResult missingPhone() {
    return new PlacementResult(Outcome.MISSING_PHONE, null, null, "Lead has no phone number");
  }

  public static PlacementResult failed(String error) {
    return new PlacementResult(Outcome.FAILED, null, null, error);
  }

  public boolean callPlaced() {
    return outcome == Outcome.PLACED || outcome == Outcome.PLACED_UNRECORDED;
  }
}
