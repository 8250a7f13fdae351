package com.presales.outreach.domain;

import java.time.OffsetDateTime;

public record ConversationEntry(
    Long id,
    String leadId,
    Channel channel,
    Direction direction,
    String subject,
    String content,
    String status,
    String externalId,
    OffsetDateTime createdAt
) {
}
