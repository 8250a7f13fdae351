package com.presales.outreach.messaging;

import com.presales.outreach.domain.*;
import jakarta.mail.Session;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeBodyPart;
import jakarta.mail.internet.MimeMessage;
import jakarta.mail.internet.MimeMultipart;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Optional;
import java.util.Properties;

import static com.presales.outreach.domain.InMemoryLeadStore.lead;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class EmailReplyPollerTest {
  private InMemoryLeadStore store;
  private ConversationLog conversationLog;
  private EmailInboundProperties properties;
  private EmailReplyPoller poller;

  @BeforeEach
  void setUp() {
    store = new InMemoryLeadStore();
    store.put(lead("L1", CallStatus.MISSED, 1));
    store.put(lead("L2", CallStatus.MISSED, 1));
    store.put(lead("L3", CallStatus.COMPLETED, 0));
    conversationLog = mock(ConversationLog.class);
    properties = new EmailInboundProperties();
    poller = new EmailReplyPoller(properties, store, conversationLog);
  }

  private static MimeMessage reply(String from, String subject, String leadHeader, String body) throws Exception {
    MimeMessage message = new MimeMessage(Session.getInstance(new Properties()));
    message.setFrom(new InternetAddress(from));
    message.setSubject(subject);
    message.setText(body, "UTF-8");
    message.saveChanges();
    message.setHeader("Message-ID", "<reply-1@mail.example.com>");
    message.setHeader("In-Reply-To", "<outreach-1@outreach.example.com>");
    if (leadHeader != null) {
      message.setHeader(EmailReplyPoller.LEAD_HEADER, leadHeader);
    }
    return message;
  }

  @Test
  void headerWinsOverSubjectTag() throws Exception {
    String subject = "Re: Missed Call Follow-Up Email [Lead:L2]";

    Optional<String> leadId = poller.process(reply("someone@else.org", subject, "L1", "Friday 4pm works"));

    assertEquals(Optional.of("L1"), leadId);
    verify(conversationLog).record("L1", Channel.EMAIL, Direction.INBOUND, subject, "Friday 4pm works",
        "received", "<reply-1@mail.example.com>");
  }

  @Test
  void subjectTagUsedWhenHeaderIsUnknown() throws Exception {
    Optional<String> leadId = poller.process(reply("someone@else.org", "Re: Sorry we missed you [Lead:L2]", "ghost", "Call me"));

    assertEquals(Optional.of("L2"), leadId);
  }

  @Test
  void senderAddressIsLastResort() throws Exception {
    Optional<String> leadId = poller.process(reply("Asha Rao <L3@Example.com>", "Re: Thanks [Lead:deleted-lead]", null, "ok"));

    assertEquals(Optional.of("L3"), leadId);
    verify(conversationLog).record(eq("L3"), eq(Channel.EMAIL), eq(Direction.INBOUND), anyString(), eq("ok"),
        eq("received"), anyString());
  }

  @Test
  void plainTextPartIsRecordedFromMultipartReply() throws Exception {
    MimeMessage message = reply("L1@example.com", "Re: Thanks [Lead:L1]", null, "placeholder");
    MimeBodyPart text = new MimeBodyPart();
    text.setText("Plain answer", "UTF-8");
    MimeBodyPart html = new MimeBodyPart();
    html.setContent("<p>Plain answer</p>", "text/html; charset=UTF-8");
    message.setContent(new MimeMultipart("alternative", text, html));
    message.saveChanges();

    poller.process(message);

    verify(conversationLog).record(eq("L1"), eq(Channel.EMAIL), eq(Direction.INBOUND), anyString(), eq("Plain answer"),
        eq("received"), any());
  }

  @Test
  void nonReplyAndUntaggedMailIsIgnored() throws Exception {
    MimeMessage fresh = new MimeMessage(Session.getInstance(new Properties()));
    fresh.setFrom(new InternetAddress("L1@example.com"));
    fresh.setSubject("Hello [Lead:L1]");
    fresh.setText("new thread");
    MimeMessage untagged = reply("L1@example.com", "Re: hello", null, "no tag");

    assertTrue(poller.process(fresh).isEmpty());
    assertTrue(poller.process(untagged).isEmpty());
    verifyNoInteractions(conversationLog);
  }

  @Test
  void unmappedReplyIsNotRecorded() throws Exception {
    Optional<String> leadId = poller.process(reply("stranger@else.org", "Re: hi [Lead:nobody]", "ghost", "who?"));

    assertTrue(leadId.isEmpty());
    verifyNoInteractions(conversationLog);
  }

  @Test
  void pollWithoutMailboxSettingsIsSkipped() throws Exception {
    properties.setEnabled(true);

    assertEquals(-1, poller.pollOnce());
    verifyNoInteractions(conversationLog);
  }
}
