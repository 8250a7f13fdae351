package com.presales.outreach.domain;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Lead storage seen by the engine. {@code updateFields} applies a partial update keyed by the names in
 * {@link LeadFields}; a {@code null} value clears the field and unknown names are added on the fly.
 */
public interface LeadStore {
  List<Lead> list(LeadQuery query);

  Optional<Lead> findById(String leadId);

  void updateFields(String leadId, Map<String, Object> fields);

  Lead append(Lead lead);

  boolean delete(String leadId);
}
