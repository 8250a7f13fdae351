package com.presales.outreach.messaging;

import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.mail.MailException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.Map;
import java.util.UUID;

@Component
public class SmtpEmailClient implements EmailGateway {
  private static final Logger log = LoggerFactory.getLogger(SmtpEmailClient.class);

  private final ObjectProvider<JavaMailSender> mailSender;
  private final EmailProperties properties;

  public SmtpEmailClient(ObjectProvider<JavaMailSender> mailSender, EmailProperties properties) {
    this.mailSender = mailSender;
    this.properties = properties;
  }

  @Override
  public MessageSendResult send(String to, String subject, String body, Map<String, String> headers) {
    if (!StringUtils.hasText(to)) {
      return MessageSendResult.failed("EMAIL_RECIPIENT_MISSING: lead has no email address");
    }
    if (properties.isDryRun()) {
      log.info("Email dry-run to={} subject={} headers={}", to, subject, headers);
      return MessageSendResult.dryRun("dry-run-" + UUID.randomUUID());
    }
    JavaMailSender sender = mailSender.getIfAvailable();
    if (sender == null) {
      return MessageSendResult.failed("EMAIL_CONFIG_MISSING: spring.mail.host is not configured");
    }

    try {
      MimeMessage message = sender.createMimeMessage();
      MimeMessageHelper helper = new MimeMessageHelper(message, false, "UTF-8");
      helper.setFrom(properties.getFrom());
      helper.setTo(to);
      helper.setSubject(subject);
      helper.setText(body, false);
      if (StringUtils.hasText(properties.getReplyTo())) {
        helper.setReplyTo(properties.getReplyTo());
      }
      for (Map.Entry<String, String> header : headers.entrySet()) {
        message.setHeader(header.getKey(), header.getValue());
      }
      sender.send(message);
      String messageId = message.getMessageID();
      log.info("Email sent to={} subject={} messageId={}", to, subject, messageId);
      return MessageSendResult.sent(messageId);
    } catch (MailException | MessagingException ex) {
      log.warn("Email send failed to={} subject={} error={}", to, subject, ex.getMessage());
      return MessageSendResult.failed("EMAIL_SEND_FAILED: " + ex.getMessage());
    }
  }
}
