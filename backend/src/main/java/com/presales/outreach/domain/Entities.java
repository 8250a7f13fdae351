package com.presales.outreach.domain;

import jakarta.persistence.*;

import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

public class Entities {

  @Entity @Table(name="leads")
  public static class LeadEntity {
    @Id @GeneratedValue(strategy=GenerationType.IDENTITY) public Long id;
    @Column(nullable=false, unique=true) public String leadUuid;
    public String phone;
    public String whatsappPhone;
    public String email;
    public String displayName;
    public String partnerTag;
    @Enumerated(EnumType.STRING) @Column(nullable=false) public CallStatus callStatus = CallStatus.PENDING;
    public int retryCount;
    public OffsetDateTime nextRetryAt;
    public boolean whatsappSent;
    public boolean emailSent;
    public boolean followUpSent;
    public String externalCallId;
    @Column(columnDefinition="text") public String summary;
    public String qualification;
    @Column(columnDefinition="text") public String structuredFields;
    @Column(columnDefinition="text") public String transcript;
    public OffsetDateTime lastCallAt;
    public String lastTerminalReason;
    public OffsetDateTime callbackRequestedAt;
    public OffsetDateTime createdAt = OffsetDateTime.now();
    public OffsetDateTime updatedAt;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name="lead_attributes", joinColumns=@JoinColumn(name="lead_id"))
    @MapKeyColumn(name="attr_name")
    @Column(name="attr_value", columnDefinition="text")
    public Map<String, String> attributes = new LinkedHashMap<>();
  }

  @Entity @Table(name="conversation_entries")
  public static class ConversationEntryEntity {
    @Id @GeneratedValue(strategy=GenerationType.IDENTITY) public Long id;
    @Column(nullable=false) public String leadUuid;
    @Enumerated(EnumType.STRING) @Column(nullable=false) public Channel channel;
    @Enumerated(EnumType.STRING) @Column(nullable=false) public Direction direction;
    public String subject;
    @Column(columnDefinition="text") public String content;
    public String status;
    public String externalId;
    public OffsetDateTime createdAt = OffsetDateTime.now();
  }
}
