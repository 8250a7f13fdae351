package com.presales.outreach.engine;

import com.presales.outreach.domain.*;
import com.presales.outreach.messaging.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Sends the non-call messages of the outreach sequence. Each channel is guarded by a sent flag on the
 * lead: send first, then set the flag, so a failed send is retried on the next trigger and a delivered
 * one is never repeated.
 */
@Service
public class FallbackSequencer {
  private static final Logger log = LoggerFactory.getLogger(FallbackSequencer.class);
  static final String LEAD_HEADER = "X-Lead-UUID";

  private final LeadStore leadStore;
  private final LeadStoreRetry storeRetry;
  private final WhatsAppGateway whatsApp;
  private final EmailGateway email;
  private final WhatsAppProperties whatsAppProperties;
  private final EmailProperties emailProperties;
  private final ConversationLog conversationLog;

  public FallbackSequencer(
      LeadStore leadStore,
      LeadStoreRetry storeRetry,
      WhatsAppGateway whatsApp,
      EmailGateway email,
      WhatsAppProperties whatsAppProperties,
      EmailProperties emailProperties,
      ConversationLog conversationLog
  ) {
    this.leadStore = leadStore;
    this.storeRetry = storeRetry;
    this.whatsApp = whatsApp;
    this.email = email;
    this.whatsAppProperties = whatsAppProperties;
    this.emailProperties = emailProperties;
    this.conversationLog = conversationLog;
  }

  /** Retries are exhausted: WhatsApp template first, then email. */
  public FallbackResult onRetriesExhausted(String leadId) {
    Optional<Lead> lead = leadStore.findById(leadId);
    if (lead.isEmpty()) {
      log.warn("Fallback skipped, lead not found leadId={}", leadId);
      return new FallbackResult(false, false);
    }
    boolean whatsAppSent = sendWhatsAppFallback(lead.get());
    boolean emailSent = leadStore.findById(leadId)
        .map(current -> sendEmail(current, emailProperties.getFallbackSubject(), emailProperties.getFallbackBody(),
            LeadFields.EMAIL_SENT, current.emailSent()))
        .orElse(false);
    log.info("Fallback sequence finished leadId={} whatsappSent={} emailSent={}", leadId, whatsAppSent, emailSent);
    return new FallbackResult(whatsAppSent, emailSent);
  }

  /** First touch after a missed call. Shares the email flag with the exhaustion fallback. */
  public boolean sendMissedCallEmail(String leadId) {
    if (!emailProperties.isMissedCallEnabled()) {
      return false;
    }
    return leadStore.findById(leadId)
        .map(lead -> sendEmail(lead, emailProperties.getMissedCallSubject(), emailProperties.getMissedCallBody(),
            LeadFields.EMAIL_SENT, lead.emailSent()))
        .orElse(false);
  }

  /** Thank-you email after a completed conversation. */
  public boolean sendPostCallFollowUp(String leadId) {
    if (!emailProperties.isFollowUpEnabled()) {
      return false;
    }
    return leadStore.findById(leadId)
        .map(lead -> sendEmail(lead, emailProperties.getFollowUpSubject(), emailProperties.getFollowUpBody(),
            LeadFields.FOLLOW_UP_SENT, lead.followUpSent()))
        .orElse(false);
  }

  private boolean sendWhatsAppFallback(Lead lead) {
    if (!whatsAppProperties.isFallbackEnabled() || lead.whatsappSent()) {
      return false;
    }
    String to = lead.messagingPhone();
    if (to == null || to.isBlank()) {
      log.info("WhatsApp fallback skipped, no number leadId={}", lead.id());
      return false;
    }
    MessageSendResult result = whatsApp.sendTemplate(to, whatsAppProperties.getFallbackTemplate(),
        whatsAppProperties.getLanguageCode(), List.of(lead.firstName()));
    conversationLog.record(lead.id(), Channel.WHATSAPP, Direction.OUTBOUND, whatsAppProperties.getFallbackTemplate(),
        result.success() ? "Template " + whatsAppProperties.getFallbackTemplate() : result.error(),
        result.deliveryStatus(), result.messageId());
    if (!result.success()) {
      log.warn("WhatsApp fallback failed leadId={} error={}", lead.id(), result.error());
      return false;
    }
    markSent(lead.id(), LeadFields.WHATSAPP_SENT);
    return true;
  }

  private boolean sendEmail(Lead lead, String subjectTemplate, String bodyTemplate, String flag, boolean alreadySent) {
    if (alreadySent) {
      log.debug("Email skipped, already sent leadId={} flag={}", lead.id(), flag);
      return false;
    }
    if (!lead.hasEmail()) {
      log.info("Email skipped, no address leadId={} flag={}", lead.id(), flag);
      return false;
    }
    String subject = subjectTemplate + " [Lead:" + lead.id() + "]";
    String body = render(bodyTemplate, lead);
    Map<String, String> headers = new LinkedHashMap<>();
    headers.put(LEAD_HEADER, lead.id());
    MessageSendResult result = email.send(lead.email(), subject, body, headers);
    conversationLog.record(lead.id(), Channel.EMAIL, Direction.OUTBOUND, subject,
        result.success() ? body : result.error(), result.deliveryStatus(), result.messageId());
    if (!result.success()) {
      log.warn("Email failed leadId={} flag={} error={}", lead.id(), flag, result.error());
      return false;
    }
    markSent(lead.id(), flag);
    return true;
  }

  private void markSent(String leadId, String flag) {
    try {
      storeRetry.run("mark-" + flag, leadId, () -> leadStore.updateFields(leadId, Map.of(flag, true)));
    } catch (RuntimeException ex) {
      log.error("Message delivered but flag not persisted leadId={} flag={} error={}", leadId, flag, ex.getMessage());
    }
  }

  private static String render(String template, Lead lead) {
    return Objects.toString(template, "")
        .replace("{name}", lead.firstName())
        .replace("{summary}", Objects.toString(lead.summary(), ""));
  }

  public record FallbackResult(boolean whatsAppSent, boolean emailSent) {
  }
}
