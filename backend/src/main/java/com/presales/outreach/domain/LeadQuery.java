package com.presales.outreach.domain;

import java.util.EnumSet;
import java.util.Set;

/** Status filter for {@link LeadStore#list}. An empty set matches every lead. */
public record LeadQuery(Set<CallStatus> statuses) {
  public LeadQuery {
    statuses = statuses == null || statuses.isEmpty() ? Set.of() : Set.copyOf(EnumSet.copyOf(statuses));
  }

  public static LeadQuery all() {
    return new LeadQuery(Set.of());
  }

  public static LeadQuery byStatus(CallStatus first, CallStatus... rest) {
    return new LeadQuery(EnumSet.of(first, rest));
  }

  public boolean matchesAll() {
    return statuses.isEmpty();
  }
}
