package com.presales.outreach.messaging;

import com.presales.outreach.domain.*;
import jakarta.mail.*;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.search.FlagTerm;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.util.Optional;
import java.util.Properties;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads unseen replies from the outreach mailbox and records each one that maps to a lead as an inbound
 * email conversation entry. Replies are matched by the {@code X-Lead-UUID} header, then the
 * {@code [Lead:<id>]} subject tag, then the sender address.
 */
@Component
public class EmailReplyPoller {
  private static final Logger log = LoggerFactory.getLogger(EmailReplyPoller.class);
  static final String LEAD_HEADER = "X-Lead-UUID";
  private static final Pattern LEAD_TAG = Pattern.compile("\\[Lead:\\s*([^\\]]+?)\\s*]");

  private final EmailInboundProperties properties;
  private final LeadStore leadStore;
  private final ConversationLog conversationLog;
  private final AtomicBoolean running = new AtomicBoolean(false);

  public EmailReplyPoller(EmailInboundProperties properties, LeadStore leadStore, ConversationLog conversationLog) {
    this.properties = properties;
    this.leadStore = leadStore;
    this.conversationLog = conversationLog;
  }

  @Scheduled(
      initialDelayString = "${app.email.imap.poll-interval-seconds:120}",
      fixedDelayString = "${app.email.imap.poll-interval-seconds:120}",
      timeUnit = TimeUnit.SECONDS)
  public void scheduledPoll() {
    if (!properties.isEnabled()) {
      return;
    }
    try {
      pollOnce();
    } catch (MessagingException | RuntimeException ex) {
      log.error("Email reply poll failed host={} folder={}", properties.getHost(), properties.getFolder(), ex);
    }
  }

  /** Returns the number of replies recorded, or -1 when the mailbox is not configured or a poll is active. */
  public int pollOnce() throws MessagingException {
    if (!StringUtils.hasText(properties.getHost()) || !StringUtils.hasText(properties.getUsername())
        || !StringUtils.hasText(properties.getPassword())) {
      log.warn("Email reply poll skipped, IMAP host or credentials not configured");
      return -1;
    }
    if (!running.compareAndSet(false, true)) {
      log.info("Email reply poll skipped, previous run still active");
      return -1;
    }
    try {
      Session session = Session.getInstance(new Properties());
      Store store = session.getStore(properties.getProtocol());
      store.connect(properties.getHost(), properties.getPort(), properties.getUsername(), properties.getPassword());
      try {
        Folder folder = store.getFolder(properties.getFolder());
        folder.open(Folder.READ_WRITE);
        try {
          Message[] unseen = folder.search(new FlagTerm(new Flags(Flags.Flag.SEEN), false));
          log.info("Email reply poll host={} folder={} unseen={}", properties.getHost(), properties.getFolder(), unseen.length);
          int recorded = 0;
          for (Message message : unseen) {
            try {
              if (process(message).isPresent()) {
                recorded++;
              }
              message.setFlag(Flags.Flag.SEEN, true);
            } catch (MessagingException | IOException | RuntimeException ex) {
              log.warn("Email reply not processed messageNumber={} error={}", message.getMessageNumber(), ex.getMessage());
            }
          }
          return recorded;
        } finally {
          folder.close(false);
        }
      } finally {
        store.close();
      }
    } finally {
      running.set(false);
    }
  }

  /** Records the reply against its lead; returns the lead id, or empty when the message is not a lead reply. */
  Optional<String> process(Message message) throws MessagingException, IOException {
    String subject = Optional.ofNullable(message.getSubject()).orElse("");
    String headerLeadId = firstHeader(message, LEAD_HEADER);
    String sender = senderAddress(message);
    if (firstHeader(message, "In-Reply-To") == null && firstHeader(message, "References") == null) {
      log.info("Email skipped, not a reply from={} subject={}", sender, subject);
      return Optional.empty();
    }
    if (headerLeadId == null && !LEAD_TAG.matcher(subject).find()) {
      log.info("Email skipped, no lead header or tag from={} subject={}", sender, subject);
      return Optional.empty();
    }

    Optional<Lead> lead = matchLead(headerLeadId, subject, sender);
    if (lead.isEmpty()) {
      log.warn("Email reply not mapped to a lead from={} subject={} headerLeadId={}", sender, subject, headerLeadId);
      return Optional.empty();
    }
    String leadId = lead.get().id();
    String body = Optional.ofNullable(plainText(message)).map(String::trim).orElse("");
    conversationLog.record(leadId, Channel.EMAIL, Direction.INBOUND, subject, body, "received",
        firstHeader(message, "Message-ID"));
    log.info("Email reply recorded leadId={} from={} subject={}", leadId, sender, subject);
    return Optional.of(leadId);
  }

  Optional<Lead> matchLead(String headerLeadId, String subject, String sender) {
    if (StringUtils.hasText(headerLeadId)) {
      Optional<Lead> byHeader = leadStore.findById(headerLeadId.trim());
      if (byHeader.isPresent()) {
        return byHeader;
      }
    }
    if (subject != null) {
      Matcher tag = LEAD_TAG.matcher(subject);
      while (tag.find()) {
        Optional<Lead> byTag = leadStore.findById(tag.group(1));
        if (byTag.isPresent()) {
          return byTag;
        }
      }
    }
    if (StringUtils.hasText(sender)) {
      return leadStore.list(LeadQuery.all()).stream()
          .filter(lead -> sender.equalsIgnoreCase(lead.email()))
          .findFirst();
    }
    return Optional.empty();
  }

  private static String firstHeader(Message message, String name) throws MessagingException {
    String[] values = message.getHeader(name);
    if (values == null || values.length == 0 || !StringUtils.hasText(values[0])) {
      return null;
    }
    return values[0].trim();
  }

  private static String senderAddress(Message message) throws MessagingException {
    Address[] from = message.getFrom();
    if (from == null || from.length == 0) {
      return null;
    }
    return from[0] instanceof InternetAddress address ? address.getAddress() : from[0].toString();
  }

  private static String plainText(Part part) throws MessagingException, IOException {
    if (part.isMimeType("text/plain") && !Part.ATTACHMENT.equalsIgnoreCase(part.getDisposition())) {
      return String.valueOf(part.getContent());
    }
    if (part.isMimeType("multipart/*")) {
      Multipart multipart = (Multipart) part.getContent();
      for (int i = 0; i < multipart.getCount(); i++) {
        String text = plainText(multipart.getBodyPart(i));
        if (text != null) {
          return text;
        }
      }
    }
    return null;
  }
}
