package com.presales.outreach.campaign;

import com.presales.outreach.common.OutreachException;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@RestController
@RequestMapping("/api/campaigns/batch")
public class CampaignController {
  private final BatchCampaignWorker worker;

  public CampaignController(BatchCampaignWorker worker) {
    this.worker = worker;
  }

  @PostMapping
  public ResponseEntity<Map<String, Object>> start(@Valid @RequestBody StartBatchReq req) {
    BatchJobSnapshot job = worker.start(req.leadIds(), req.parallelCalls(), req.intervalSeconds());
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("ok", true);
    body.put("jobId", job.jobId());
    body.put("job", job);
    return ResponseEntity.status(HttpStatus.ACCEPTED).body(body);
  }

  @GetMapping("/active")
  public Map<String, Object> active() {
    Optional<BatchJobSnapshot> job = worker.activeStatus();
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("ok", true);
    body.put("active", job.isPresent());
    job.ifPresent(snapshot -> body.put("job", snapshot));
    return body;
  }

  @GetMapping("/{jobId}")
  public Map<String, Object> status(@PathVariable String jobId) {
    BatchJobSnapshot job = worker.status(jobId)
        .orElseThrow(() -> new OutreachException(HttpStatus.NOT_FOUND, "CAMPAIGN_NOT_FOUND", "Unknown campaign job: " + jobId));
    return Map.of("ok", true, "job", job);
  }

  @PostMapping("/{jobId}/cancel")
  public Map<String, Object> cancel(@PathVariable String jobId) {
    return Map.of("ok", true, "jobId", jobId, "cancelled", worker.cancel(jobId));
  }

  public record StartBatchReq(@NotEmpty List<String> leadIds, @Min(1) Integer parallelCalls, @Min(0) Integer intervalSeconds) {}
}
