package com.presales.outreach.voice;

import com.presales.outreach.messaging.EmailProperties;
import com.presales.outreach.messaging.WhatsAppProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

@Component
public class VapiStartupValidator {
  private static final Logger log = LoggerFactory.getLogger(VapiStartupValidator.class);
  private final VapiProperties vapiProperties;
  private final WhatsAppProperties whatsAppProperties;
  private final EmailProperties emailProperties;

  public VapiStartupValidator(VapiProperties vapiProperties, WhatsAppProperties whatsAppProperties, EmailProperties emailProperties) {
    this.vapiProperties = vapiProperties;
    this.whatsAppProperties = whatsAppProperties;
    this.emailProperties = emailProperties;
  }

  @EventListener(ApplicationReadyEvent.class)
  public void validateOnReady() {
    if (!vapiProperties.isConfigured()) {
      log.warn("Vapi configuration incomplete: api-key, assistant-id and phone-number-id are required. Calls will fail until set.");
    }
    if (!StringUtils.hasText(vapiProperties.getWebhookSecret())) {
      log.warn("app.vapi.webhook-secret is empty; webhook requests are accepted without a shared secret.");
    }
    if (whatsAppProperties.isFallbackEnabled() && !whatsAppProperties.isDryRun() && !whatsAppProperties.isConfigured()) {
      log.warn("WhatsApp fallback enabled but access token or phone number id is missing.");
    }
    if (emailProperties.isDryRun()) {
      log.info("Email delivery is in dry-run mode; messages are logged and not sent.");
    }
  }
}
