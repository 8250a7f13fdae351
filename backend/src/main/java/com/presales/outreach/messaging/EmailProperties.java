package com.presales.outreach.messaging;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/** Sender identity plus the three email templates. {@code {name}} and {@code {summary}} are substituted. */
@Component
@ConfigurationProperties(prefix = "app.email")
public class EmailProperties {
  private String from = "outreach@localhost";
  private String replyTo;
  private boolean dryRun = true;
  private boolean missedCallEnabled = true;
  private String missedCallSubject = "Missed Call Follow-Up Email";
  private String missedCallBody = "Hi {name},\n\nWe tried reaching you by phone but could not get through. "
      + "We will try again shortly, or simply reply to this email with a time that suits you.\n\nThanks!";
  private String fallbackSubject = "Sorry we missed you";
  private String fallbackBody = "Hi {name},\n\nWe tried calling you a few times without luck. "
      + "Reply to this email whenever you are free and we will set up a call.\n\nThanks!";
  private boolean followUpEnabled = true;
  private String followUpSubject = "Thanks for speaking with us";
  private String followUpBody = "Hi {name},\n\nThanks for taking our call. Here is a short recap:\n\n{summary}\n\n"
      + "Reply to this email if anything needs correcting.";

  public String getFrom() {
    return from;
  }

  public void setFrom(String from) {
    this.from = from;
  }

  public String getReplyTo() {
    return replyTo;
  }

  public void setReplyTo(String replyTo) {
    this.replyTo = replyTo;
  }

  public boolean isDryRun() {
    return dryRun;
  }

  public void setDryRun(boolean dryRun) {
    this.dryRun = dryRun;
  }

  public boolean isMissedCallEnabled() {
    return missedCallEnabled;
  }

  public void setMissedCallEnabled(boolean missedCallEnabled) {
    this.missedCallEnabled = missedCallEnabled;
  }

  public String getMissedCallSubject() {
    return missedCallSubject;
  }

  public void setMissedCallSubject(String missedCallSubject) {
    this.missedCallSubject = missedCallSubject;
  }

  public String getMissedCallBody() {
    return missedCallBody;
  }

  public void setMissedCallBody(String missedCallBody) {
    this.missedCallBody = missedCallBody;
  }

  public String getFallbackSubject() {
    return fallbackSubject;
  }

  public void setFallbackSubject(String fallbackSubject) {
    this.fallbackSubject = fallbackSubject;
  }

  public String getFallbackBody() {
    return fallbackBody;
  }

  public void setFallbackBody(String fallbackBody) {
    this.fallbackBody = fallbackBody;
  }

  public boolean isFollowUpEnabled() {
    return followUpEnabled;
  }

  public void setFollowUpEnabled(boolean followUpEnabled) {
    this.followUpEnabled = followUpEnabled;
  }

  public String getFollowUpSubject() {
    return followUpSubject;
  }

  public void setFollowUpSubject(String followUpSubject) {
    this.followUpSubject = followUpSubject;
  }

  public String getFollowUpBody() {
    return followUpBody;
  }

  public void setFollowUpBody(String followUpBody) {
    this.followUpBody = followUpBody;
  }
}
