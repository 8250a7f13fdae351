package com.presales.outreach.orchestration;

import java.util.List;

/** Outcome of one orchestrator sweep. {@code errors} holds one "leadId: reason" line per failed lead. */
public record SweepResult(boolean skipped, int examined, int placed, int failed, List<String> errors) {
  public SweepResult {
    errors = errors == null ? List.of() : List.copyOf(errors);
  }

  public static SweepResult skippedRun() {
    return new SweepResult(true, 0, 0, 0, List.of());
  }
}
