package com.presales.outreach.domain;

import com.presales.outreach.common.OutreachException;
import com.presales.outreach.domain.Entities.LeadEntity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Relational lead store. Lead ids resolve to row ids through an in-memory map, and filtered reads are
 * cached briefly so that a store hiccup during a sweep serves the last good snapshot.
 */
@Service
public class JpaLeadStore implements LeadStore {
  private static final Logger log = LoggerFactory.getLogger(JpaLeadStore.class);

  private final LeadRepository repository;
  private final Clock clock;
  private final long readCacheTtlMillis;
  private final Map<String, Long> rowIds = new ConcurrentHashMap<>();
  private final Map<LeadQuery, CachedRead> reads = new ConcurrentHashMap<>();
  /** Bumped by every write; a read that overlapped a write does not populate the cache. */
  private final AtomicLong cacheGeneration = new AtomicLong();

  public JpaLeadStore(
      LeadRepository repository,
      Clock clock,
      @Value("${app.store.read-cache-ttl-ms:5000}") long readCacheTtlMillis
  ) {
    this.repository = repository;
    this.clock = clock;
    this.readCacheTtlMillis = readCacheTtlMillis;
  }

  @Override
  @Transactional(readOnly = true)
  public List<Lead> list(LeadQuery query) {
    long now = clock.millis();
    long generation = cacheGeneration.get();
    CachedRead cached = reads.get(query);
    if (cached != null && now < cached.expiresAt()) {
      return cached.leads();
    }
    try {
      List<LeadEntity> rows = query.matchesAll()
          ? repository.findAllByOrderByIdAsc()
          : repository.findByCallStatusInOrderByIdAsc(query.statuses());
      List<Lead> leads = new ArrayList<>(rows.size());
      for (LeadEntity row : rows) {
        rowIds.put(row.leadUuid, row.id);
        leads.add(toLead(row));
      }
      List<Lead> snapshot = List.copyOf(leads);
      if (cacheGeneration.get() == generation) {
        reads.put(query, new CachedRead(snapshot, now + readCacheTtlMillis));
      }
      return snapshot;
    } catch (RuntimeException ex) {
      if (cached != null) {
        log.warn("Lead store read failed, serving cached snapshot query={} ageMs={} error={}",
            query, now - (cached.expiresAt() - readCacheTtlMillis), ex.getMessage());
        return cached.leads();
      }
      throw new OutreachException(HttpStatus.SERVICE_UNAVAILABLE, "LEAD_STORE_UNAVAILABLE",
          "Lead store read failed: " + ex.getMessage());
    }
  }

  @Override
  @Transactional(readOnly = true)
  public Optional<Lead> findById(String leadId) {
    return loadRow(leadId).map(this::toLead);
  }

  @Override
  @Transactional
  public void updateFields(String leadId, Map<String, Object> fields) {
    LeadEntity row = loadRow(leadId).orElseThrow(() -> notFound(leadId));
    fields.forEach((name, value) -> apply(row, name, value));
    row.updatedAt = OffsetDateTime.now(clock);
    repository.save(row);
    invalidateReads();
  }

  @Override
  @Transactional
  public Lead append(Lead lead) {
    if (repository.findRowIdByLeadUuid(lead.id()).isPresent()) {
      throw new IllegalStateException("Lead already exists: " + lead.id());
    }
    LeadEntity row = new LeadEntity();
    row.leadUuid = lead.id();
    row.phone = lead.phone();
    row.whatsappPhone = lead.whatsappPhone();
    row.email = lead.email();
    row.displayName = lead.displayName();
    row.partnerTag = lead.partnerTag();
    row.callStatus = lead.callStatus();
    row.retryCount = lead.retryCount();
    row.nextRetryAt = lead.nextRetryAt();
    row.createdAt = lead.createdAt() == null ? OffsetDateTime.now(clock) : lead.createdAt();
    row.attributes.putAll(lead.attributes());
    LeadEntity saved = repository.save(row);
    rowIds.put(saved.leadUuid, saved.id);
    invalidateReads();
    return toLead(saved);
  }

  @Override
  @Transactional
  public boolean delete(String leadId) {
    Optional<LeadEntity> row = loadRow(leadId);
    if (row.isEmpty()) {
      return false;
    }
    repository.delete(row.get());
    rowIds.remove(leadId);
    invalidateReads();
    return true;
  }

  private void invalidateReads() {
    cacheGeneration.incrementAndGet();
    reads.clear();
  }

  private Optional<LeadEntity> loadRow(String leadId) {
    if (leadId == null || leadId.isBlank()) {
      return Optional.empty();
    }
    Long rowId = rowIds.get(leadId);
    if (rowId != null) {
      Optional<LeadEntity> row = repository.findById(rowId);
      if (row.isPresent() && leadId.equals(row.get().leadUuid)) {
        return row;
      }
      rowIds.remove(leadId);
    }
    Optional<LeadEntity> row = repository.findByLeadUuid(leadId);
    row.ifPresent(found -> rowIds.put(found.leadUuid, found.id));
    return row;
  }

  private void apply(LeadEntity row, String name, Object value) {
    switch (name) {
      case LeadFields.PHONE -> row.phone = asString(value);
      case LeadFields.WHATSAPP_PHONE -> row.whatsappPhone = asString(value);
      case LeadFields.EMAIL -> row.email = asString(value);
      case LeadFields.DISPLAY_NAME -> row.displayName = asString(value);
      case LeadFields.PARTNER_TAG -> row.partnerTag = asString(value);
      case LeadFields.CALL_STATUS -> row.callStatus = value instanceof CallStatus status ? status : CallStatus.fromWire(asString(value));
      case LeadFields.RETRY_COUNT -> row.retryCount = value == null ? 0 : Integer.parseInt(value.toString());
      case LeadFields.NEXT_RETRY_AT -> row.nextRetryAt = asTimestamp(value);
      case LeadFields.WHATSAPP_SENT -> row.whatsappSent = asFlag(value);
      case LeadFields.EMAIL_SENT -> row.emailSent = asFlag(value);
      case LeadFields.FOLLOW_UP_SENT -> row.followUpSent = asFlag(value);
      case LeadFields.EXTERNAL_CALL_ID -> row.externalCallId = asString(value);
      case LeadFields.SUMMARY -> row.summary = asString(value);
      case LeadFields.QUALIFICATION -> row.qualification = asString(value);
      case LeadFields.STRUCTURED_FIELDS -> row.structuredFields = asString(value);
      case LeadFields.TRANSCRIPT -> row.transcript = asString(value);
      case LeadFields.LAST_CALL_AT -> row.lastCallAt = asTimestamp(value);
      case LeadFields.LAST_TERMINAL_REASON -> row.lastTerminalReason = asString(value);
      case LeadFields.CALLBACK_REQUESTED_AT -> row.callbackRequestedAt = asTimestamp(value);
      default -> {
        if (value == null) {
          row.attributes.remove(name);
        } else {
          row.attributes.put(name, value.toString());
        }
      }
    }
  }

  private Lead toLead(LeadEntity row) {
    return new Lead(row.leadUuid, row.phone, row.whatsappPhone, row.email, row.displayName, row.partnerTag,
        row.callStatus, row.retryCount, row.nextRetryAt, row.whatsappSent, row.emailSent, row.followUpSent,
        row.externalCallId, row.summary, row.qualification, row.structuredFields, row.transcript, row.lastCallAt,
        row.lastTerminalReason, row.callbackRequestedAt, row.createdAt, new LinkedHashMap<>(row.attributes));
  }

  private static String asString(Object value) {
    return value == null ? null : value.toString();
  }

  private static boolean asFlag(Object value) {
    return value instanceof Boolean flag ? flag : Boolean.parseBoolean(Objects.toString(value, "false"));
  }

  private static OffsetDateTime asTimestamp(Object value) {
    if (value == null) {
      return null;
    }
    if (value instanceof OffsetDateTime timestamp) {
      return timestamp;
    }
    return OffsetDateTime.parse(value.toString());
  }

  private static OutreachException notFound(String leadId) {
    return new OutreachException(HttpStatus.NOT_FOUND, "LEAD_NOT_FOUND", "Lead not found: " + leadId);
  }

  private record CachedRead(List<Lead> leads, long expiresAt) {
  }
}
