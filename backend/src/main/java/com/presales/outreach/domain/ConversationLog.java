package com.presales.outreach.domain;

import com.presales.outreach.domain.Entities.ConversationEntryEntity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;

/** Append-only history of every call and message exchanged with a lead. */
@Service
public class ConversationLog {
  private static final Logger log = LoggerFactory.getLogger(ConversationLog.class);

  private final ConversationRepository repository;
  private final Clock clock;

  public ConversationLog(ConversationRepository repository, Clock clock) {
    this.repository = repository;
    this.clock = clock;
  }

  /** Failures are logged and not rethrown; the outreach step being recorded has already happened. */
  public void record(String leadId, Channel channel, Direction direction, String subject, String content,
                     String status, String externalId) {
    ConversationEntryEntity entry = new ConversationEntryEntity();
    entry.leadUuid = leadId;
    entry.channel = channel;
    entry.direction = direction;
    entry.subject = subject;
    entry.content = content;
    entry.status = status;
    entry.externalId = externalId;
    entry.createdAt = OffsetDateTime.now(clock);
    try {
      repository.save(entry);
    } catch (RuntimeException ex) {
      log.error("Conversation entry not recorded leadId={} channel={} status={} error={}",
          leadId, channel, status, ex.getMessage());
    }
  }

  @Transactional(readOnly = true)
  public List<ConversationEntry> history(String leadId) {
    return repository.findByLeadUuidOrderByCreatedAtAscIdAsc(leadId).stream()
        .map(e -> new ConversationEntry(e.id, e.leadUuid, e.channel, e.direction, e.subject, e.content,
            e.status, e.externalId, e.createdAt))
        .toList();
  }

  @Transactional
  public void purge(String leadId) {
    repository.deleteByLeadUuid(leadId);
  }
}
