package com.presales.outreach.domain;

import com.presales.outreach.domain.Entities.ConversationEntryEntity;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface ConversationRepository extends JpaRepository<ConversationEntryEntity, Long> {
  List<ConversationEntryEntity> findByLeadUuidOrderByCreatedAtAscIdAsc(String leadUuid);

  long countByLeadUuidAndChannel(String leadUuid, Channel channel);

  void deleteByLeadUuid(String leadUuid);
}
