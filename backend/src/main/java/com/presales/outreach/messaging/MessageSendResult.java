package com.presales.outreach.messaging;

public record MessageSendResult(boolean success, boolean dryRun, String messageId, String error) {
  public static MessageSendResult sent(String messageId) {
    return new MessageSendResult(true, false, messageId, null);
  }

  public static MessageSendResult dryRun(String messageId) {
    return new MessageSendResult(true, true, messageId, null);
  }

  public static MessageSendResult failed(String error) {
    return new MessageSendResult(false, false, null, error);
  }

  public String deliveryStatus() {
    if (!success) {
      return "failed";
    }
    return dryRun ? "dry_run" : "sent";
  }
}
