package com.presales.outreach.domain;

import com.presales.outreach.domain.Entities.LeadEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface LeadRepository extends JpaRepository<LeadEntity, Long> {
  Optional<LeadEntity> findByLeadUuid(String leadUuid);

  List<LeadEntity> findByCallStatusInOrderByIdAsc(Collection<CallStatus> statuses);

  List<LeadEntity> findAllByOrderByIdAsc();

  @Query("select l.id from Entities$LeadEntity l where l.leadUuid = :leadUuid")
  Optional<Long> findRowIdByLeadUuid(@Param("leadUuid") String leadUuid);
}
