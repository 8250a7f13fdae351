package com.presales.outreach.messaging;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

@Component
@ConfigurationProperties(prefix = "app.whatsapp")
public class WhatsAppProperties {
  private String apiBaseUrl = "https://graph.facebook.com/v20.0";
  private String accessToken;
  private String phoneNumberId;
  private boolean fallbackEnabled = true;
  private String fallbackTemplate = "missed_call_followup";
  private String languageCode = "en";
  private boolean dryRun;

  public boolean isConfigured() {
    return StringUtils.hasText(accessToken) && StringUtils.hasText(phoneNumberId);
  }

  public String getApiBaseUrl() {
    return apiBaseUrl;
  }

  public void setApiBaseUrl(String apiBaseUrl) {
    this.apiBaseUrl = apiBaseUrl;
  }

  public String getAccessToken() {
    return accessToken;
  }

  public void setAccessToken(String accessToken) {
    this.accessToken = accessToken;
  }

  public String getPhoneNumberId() {
    return phoneNumberId;
  }

  public void setPhoneNumberId(String phoneNumberId) {
    this.phoneNumberId = phoneNumberId;
  }

  public boolean isFallbackEnabled() {
    return fallbackEnabled;
  }

  public void setFallbackEnabled(boolean fallbackEnabled) {
    this.fallbackEnabled = fallbackEnabled;
  }

  public String getFallbackTemplate() {
    return fallbackTemplate;
  }

  public void setFallbackTemplate(String fallbackTemplate) {
    this.fallbackTemplate = fallbackTemplate;
  }

  public String getLanguageCode() {
    return languageCode;
  }

  public void setLanguageCode(String languageCode) {
    this.languageCode = languageCode;
  }

  public boolean isDryRun() {
    return dryRun;
  }

  public void setDryRun(boolean dryRun) {
    this.dryRun = dryRun;
  }
}
