package com.presales.outreach.messaging;

import jakarta.mail.Session;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeMessage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.mail.MailSendException;
import org.springframework.mail.javamail.JavaMailSender;

import java.util.Map;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class SmtpEmailClientTest {
  private JavaMailSender sender;
  private ObjectProvider<JavaMailSender> provider;
  private EmailProperties properties;
  private MimeMessage message;

  @BeforeEach
  @SuppressWarnings("unchecked")
  void setUp() {
    sender = mock(JavaMailSender.class);
    provider = mock(ObjectProvider.class);
    message = new MimeMessage(Session.getInstance(new Properties()));
    when(sender.createMimeMessage()).thenReturn(message);
    properties = new EmailProperties();
    properties.setFrom("presales@example.com");
    properties.setDryRun(false);
  }

  @Test
  void sendsTaggedMessage() throws Exception {
    when(provider.getIfAvailable()).thenReturn(sender);
    properties.setReplyTo("team@example.com");

    MessageSendResult result = new SmtpEmailClient(provider, properties)
        .send("asha@example.com", "Sorry we missed you [Lead:L1]", "Hi Asha", Map.of("X-Lead-UUID", "L1"));

    assertTrue(result.success());
    assertFalse(result.dryRun());
    verify(sender).send(message);
    assertEquals("Sorry we missed you [Lead:L1]", message.getSubject());
    assertEquals("L1", message.getHeader("X-Lead-UUID", null));
    assertEquals(new InternetAddress("presales@example.com"), message.getFrom()[0]);
    assertEquals(new InternetAddress("team@example.com"), message.getReplyTo()[0]);
  }

  @Test
  void dryRunSkipsSender() {
    properties.setDryRun(true);

    MessageSendResult result = new SmtpEmailClient(provider, properties)
        .send("asha@example.com", "Subject", "Body", Map.of());

    assertTrue(result.dryRun());
    assertTrue(result.messageId().startsWith("dry-run-"));
    verifyNoInteractions(provider);
  }

  @Test
  void missingSenderIsConfigFailure() {
    when(provider.getIfAvailable()).thenReturn(null);

    MessageSendResult result = new SmtpEmailClient(provider, properties)
        .send("asha@example.com", "Subject", "Body", Map.of());

    assertFalse(result.success());
    assertTrue(result.error().startsWith("EMAIL_CONFIG_MISSING"));
  }

  @Test
  void smtpFailureIsReported() {
    when(provider.getIfAvailable()).thenReturn(sender);
    doThrow(new MailSendException("535 authentication failed")).when(sender).send(any(MimeMessage.class));

    MessageSendResult result = new SmtpEmailClient(provider, properties)
        .send("asha@example.com", "Subject", "Body", Map.of());

    assertFalse(result.success());
    assertEquals("EMAIL_SEND_FAILED: 535 authentication failed", result.error());
  }
}
