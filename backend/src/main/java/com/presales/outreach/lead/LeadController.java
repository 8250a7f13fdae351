package com.presales.outreach.lead;

import com.presales.outreach.common.OutreachException;
import com.presales.outreach.domain.*;
import com.presales.outreach.orchestration.CallPlacementService;
import com.presales.outreach.orchestration.PlacementResult;
import com.presales.outreach.retry.RetryPolicy;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.*;

@RestController
@RequestMapping("/api")
public class LeadController {
  private static final Set<CallStatus> MANUALLY_CALLABLE = EnumSet.of(CallStatus.PENDING, CallStatus.MISSED, CallStatus.FAILED);

  private final LeadStore leadStore;
  private final ConversationLog conversationLog;
  private final CallPlacementService placementService;
  private final RetryPolicy retryPolicy;
  private final Clock clock;

  public LeadController(LeadStore leadStore, ConversationLog conversationLog, CallPlacementService placementService,
                        RetryPolicy retryPolicy, Clock clock) {
    this.leadStore = leadStore;
    this.conversationLog = conversationLog;
    this.placementService = placementService;
    this.retryPolicy = retryPolicy;
    this.clock = clock;
  }

  @PostMapping("/leads")
  public ResponseEntity<Map<String, Object>> create(@Valid @RequestBody CreateLeadReq req) {
    Lead lead = leadStore.append(Lead.newLead(req.phone().trim(), req.whatsappPhone(), req.email(), req.displayName(),
        req.partnerTag(), OffsetDateTime.now(clock)));
    return ResponseEntity.status(HttpStatus.CREATED).body(Map.of("ok", true, "leadId", lead.id(), "lead", lead));
  }

  @GetMapping("/leads")
  public Map<String, Object> list(@RequestParam(required = false) List<String> status) {
    LeadQuery query = status == null || status.isEmpty()
        ? LeadQuery.all()
        : new LeadQuery(parseStatuses(status));
    List<Lead> leads = leadStore.list(query);
    return Map.of("ok", true, "count", leads.size(), "items", leads);
  }

  @GetMapping("/leads/{leadId}")
  public Map<String, Object> get(@PathVariable String leadId) {
    Lead lead = find(leadId);
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("ok", true);
    body.put("lead", lead);
    body.put("conversations", conversationLog.history(leadId));
    return body;
  }

  @DeleteMapping("/leads/{leadId}")
  public Map<String, Object> delete(@PathVariable String leadId) {
    if (!leadStore.delete(leadId)) {
      throw notFound(leadId);
    }
    conversationLog.purge(leadId);
    return Map.of("ok", true, "deleted", leadId);
  }

  @PostMapping("/leads/{leadId}/call")
  public Map<String, Object> call(@PathVariable String leadId) {
    Lead lead = find(leadId);
    if (!MANUALLY_CALLABLE.contains(lead.callStatus())) {
      throw new OutreachException(HttpStatus.BAD_REQUEST, "LEAD_NOT_CALLABLE",
          "Lead cannot be called in status " + lead.callStatus().wire(),
          "Manual calls are allowed for pending, missed and failed leads.",
          Map.of("callStatus", lead.callStatus().wire()));
    }
    PlacementResult result = placementService.place(lead, CallStatus.INITIATED);
    if (result.outcome() == PlacementResult.Outcome.MISSING_PHONE) {
      throw new OutreachException(HttpStatus.UNPROCESSABLE_ENTITY, "LEAD_PHONE_MISSING", "Lead has no phone number");
    }
    if (!result.callPlaced()) {
      throw new OutreachException(HttpStatus.BAD_GATEWAY, "CALL_INITIATION_FAILED",
          "Call could not be placed", null, Map.of("error", Objects.toString(result.error(), "")));
    }
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("ok", true);
    body.put("leadId", leadId);
    body.put("callId", result.callId());
    body.put("recorded", result.outcome() == PlacementResult.Outcome.PLACED);
    return body;
  }

  @GetMapping("/retry-config")
  public Map<String, Object> retryConfig() {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("ok", true);
    body.put("maxRetries", retryPolicy.maxRetries());
    body.put("intervals", retryPolicy.intervals());
    body.put("unit", retryPolicy.unit().name().toLowerCase(Locale.ROOT));
    return body;
  }

  private Lead find(String leadId) {
    return leadStore.findById(leadId).orElseThrow(() -> notFound(leadId));
  }

  private static OutreachException notFound(String leadId) {
    return new OutreachException(HttpStatus.NOT_FOUND, "LEAD_NOT_FOUND", "Lead not found: " + leadId);
  }

  private static Set<CallStatus> parseStatuses(List<String> values) {
    Set<CallStatus> statuses = EnumSet.noneOf(CallStatus.class);
    for (String value : values) {
      try {
        statuses.add(CallStatus.fromWire(value));
      } catch (IllegalArgumentException ex) {
        throw new OutreachException(HttpStatus.BAD_REQUEST, "UNKNOWN_CALL_STATUS", "Unknown call status: " + value);
      }
    }
    return statuses;
  }

  public record CreateLeadReq(@NotBlank String phone, String whatsappPhone, @Email String email, String displayName, String partnerTag) {}
}
