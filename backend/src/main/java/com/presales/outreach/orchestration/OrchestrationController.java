package com.presales.outreach.orchestration;

import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/orchestration")
public class OrchestrationController {
  private final OrchestrationScheduler orchestrationScheduler;
  private final ReconciliationSweeper reconciliationSweeper;

  public OrchestrationController(OrchestrationScheduler orchestrationScheduler, ReconciliationSweeper reconciliationSweeper) {
    this.orchestrationScheduler = orchestrationScheduler;
    this.reconciliationSweeper = reconciliationSweeper;
  }

  @PostMapping("/sweep")
  Map<String, Object> sweep() {
    SweepResult result = orchestrationScheduler.runSweep();
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("ok", true);
    body.put("skipped", result.skipped());
    body.put("due", result.examined());
    body.put("placed", result.placed());
    body.put("failed", result.failed());
    body.put("errors", result.errors());
    return body;
  }

  @PostMapping("/reconcile")
  Map<String, Object> reconcile() {
    ReconciliationSweeper.ReconciliationResult result = reconciliationSweeper.reconcile();
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("ok", true);
    body.put("skipped", result.skipped());
    body.put("checked", result.checked());
    body.put("completed", result.completed());
    body.put("missed", result.missed());
    body.put("errors", result.errors());
    return body;
  }
}
