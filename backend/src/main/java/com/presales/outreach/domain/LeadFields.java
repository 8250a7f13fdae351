package com.presales.outreach.domain;

import java.util.Set;

/** Column names accepted by {@link LeadStore#updateFields}. Anything else lands in the lead's attributes. */
public final class LeadFields {
  public static final String PHONE = "phone";
  public static final String WHATSAPP_PHONE = "whatsapp_phone";
  public static final String EMAIL = "email";
  public static final String DISPLAY_NAME = "display_name";
  public static final String PARTNER_TAG = "partner_tag";
  public static final String CALL_STATUS = "call_status";
  public static final String RETRY_COUNT = "retry_count";
  public static final String NEXT_RETRY_AT = "next_retry_at";
  public static final String WHATSAPP_SENT = "whatsapp_sent";
  public static final String EMAIL_SENT = "email_sent";
  public static final String FOLLOW_UP_SENT = "follow_up_sent";
  public static final String EXTERNAL_CALL_ID = "external_call_id";
  public static final String SUMMARY = "summary";
  public static final String QUALIFICATION = "qualification";
  public static final String STRUCTURED_FIELDS = "structured_fields";
  public static final String TRANSCRIPT = "transcript";
  public static final String LAST_CALL_AT = "last_call_at";
  public static final String LAST_TERMINAL_REASON = "last_terminal_reason";
  public static final String CALLBACK_REQUESTED_AT = "callback_requested_at";

  // Stored as attributes, created on first write.
  public static final String RECORDING_URL = "recording_url";
  public static final String CALL_DURATION_SECONDS = "call_duration_seconds";

  public static final Set<String> CORE = Set.of(
      PHONE, WHATSAPP_PHONE, EMAIL, DISPLAY_NAME, PARTNER_TAG, CALL_STATUS, RETRY_COUNT, NEXT_RETRY_AT,
      WHATSAPP_SENT, EMAIL_SENT, FOLLOW_UP_SENT, EXTERNAL_CALL_ID, SUMMARY, QUALIFICATION, STRUCTURED_FIELDS,
      TRANSCRIPT, LAST_CALL_AT, LAST_TERMINAL_REASON, CALLBACK_REQUESTED_AT);

  private LeadFields() {
  }
}
