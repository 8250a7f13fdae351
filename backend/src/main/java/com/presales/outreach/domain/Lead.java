package com.presales.outreach.domain;

import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;

public record Lead(
    String id,
    String phone,
    String whatsappPhone,
    String email,
    String displayName,
    String partnerTag,
    CallStatus callStatus,
    int retryCount,
    OffsetDateTime nextRetryAt,
    boolean whatsappSent,
    boolean emailSent,
    boolean followUpSent,
    String externalCallId,
    String summary,
    String qualification,
    String structuredFields,
    String transcript,
    OffsetDateTime lastCallAt,
    String lastTerminalReason,
    OffsetDateTime callbackRequestedAt,
    OffsetDateTime createdAt,
    Map<String, String> attributes
) {
  public Lead {
    callStatus = callStatus == null ? CallStatus.PENDING : callStatus;
    attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
  }

  public static Lead newLead(String phone, String whatsappPhone, String email, String displayName, String partnerTag,
                             OffsetDateTime createdAt) {
    return new Lead(UUID.randomUUID().toString(), phone, whatsappPhone, email, displayName, partnerTag,
        CallStatus.PENDING, 0, null, false, false, false, null, null, null, null, null, null, null, null,
        createdAt, Map.of());
  }

  public boolean hasPhone() {
    return phone != null && !phone.isBlank();
  }

  public boolean hasEmail() {
    return email != null && !email.isBlank();
  }

  /** WhatsApp number when set, the call number otherwise. */
  public String messagingPhone() {
    return whatsappPhone != null && !whatsappPhone.isBlank() ? whatsappPhone : phone;
  }

  public String firstName() {
    if (displayName == null || displayName.isBlank()) {
      return "there";
    }
    return displayName.trim().split("\\s+")[0];
  }
}
