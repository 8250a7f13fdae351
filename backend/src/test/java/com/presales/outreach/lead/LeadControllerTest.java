package com.presales.outreach.lead;

import com.presales.outreach.domain.*;
import com.presales.outreach.orchestration.CallPlacementService;
import com.presales.outreach.orchestration.PlacementResult;
import com.presales.outreach.retry.RetryPolicy;
import com.presales.outreach.retry.RetryProperties;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Bean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static com.presales.outreach.domain.InMemoryLeadStore.lead;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = LeadController.class)
@AutoConfigureMockMvc(addFilters = false)
class LeadControllerTest {
  private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-10T06:30:00Z"), ZoneId.of("Asia/Kolkata"));

  @TestConfiguration
  static class ClockConfig {
    @Bean
    Clock clock() {
      return CLOCK;
    }

    @Bean
    RetryPolicy retryPolicy() {
      return new RetryPolicy(new RetryProperties(), CLOCK);
    }
  }

  @Autowired
  private MockMvc mockMvc;

  @MockBean
  private LeadStore leadStore;

  @MockBean
  private ConversationLog conversationLog;

  @MockBean
  private CallPlacementService placementService;

  @Test
  void createReturnsNewPendingLead() throws Exception {
    when(leadStore.append(any())).thenAnswer(invocation -> invocation.getArgument(0));

    mockMvc.perform(post("/api/leads")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"phone\":\" +919800000001 \",\"email\":\"asha@example.com\",\"displayName\":\"Asha Rao\"}"))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.ok").value(true))
        .andExpect(jsonPath("$.lead.phone").value("+919800000001"))
        .andExpect(jsonPath("$.lead.callStatus").value("pending"))
        .andExpect(jsonPath("$.lead.retryCount").value(0));
  }

  @Test
  void createRequiresPhone() throws Exception {
    mockMvc.perform(post("/api/leads")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"email\":\"asha@example.com\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));
    verifyNoInteractions(leadStore);
  }

  @Test
  void listFiltersByStatus() throws Exception {
    when(leadStore.list(new LeadQuery(Set.of(CallStatus.MISSED))))
        .thenReturn(List.of(lead("L1", CallStatus.MISSED, 1)));

    mockMvc.perform(get("/api/leads").param("status", "missed"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.count").value(1))
        .andExpect(jsonPath("$.items[0].id").value("L1"));
  }

  @Test
  void unknownStatusFilterIsRejected() throws Exception {
    mockMvc.perform(get("/api/leads").param("status", "sleeping"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("UNKNOWN_CALL_STATUS"));
  }

  @Test
  void detailIncludesConversations() throws Exception {
    when(leadStore.findById("L1")).thenReturn(Optional.of(lead("L1", CallStatus.COMPLETED, 0)));
    when(conversationLog.history("L1")).thenReturn(List.of(new ConversationEntry(
        1L, "L1", Channel.EMAIL, Direction.OUTBOUND, "Sorry we missed you", "Hi Asha", "sent", "msg-1",
        OffsetDateTime.now(CLOCK))));

    mockMvc.perform(get("/api/leads/L1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.lead.callStatus").value("completed"))
        .andExpect(jsonPath("$.conversations[0].channel").value("EMAIL"));
  }

  @Test
  void missingLeadIs404() throws Exception {
    when(leadStore.findById("nope")).thenReturn(Optional.empty());

    mockMvc.perform(get("/api/leads/nope"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.ok").value(false))
        .andExpect(jsonPath("$.code").value("LEAD_NOT_FOUND"));
  }

  @Test
  void deletePurgesConversations() throws Exception {
    when(leadStore.delete("L1")).thenReturn(true);

    mockMvc.perform(delete("/api/leads/L1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.deleted").value("L1"));
    verify(conversationLog).purge("L1");
  }

  @Test
  void manualCallPlacesCall() throws Exception {
    Lead lead = lead("L1", CallStatus.MISSED, 1);
    when(leadStore.findById("L1")).thenReturn(Optional.of(lead));
    when(placementService.place(lead, CallStatus.INITIATED))
        .thenReturn(PlacementResult.placed("call-1", OffsetDateTime.now(CLOCK)));

    mockMvc.perform(post("/api/leads/L1/call"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.callId").value("call-1"))
        .andExpect(jsonPath("$.recorded").value(true));
  }

  @Test
  void manualCallRejectsCompletedLead() throws Exception {
    when(leadStore.findById("L1")).thenReturn(Optional.of(lead("L1", CallStatus.COMPLETED, 0)));

    mockMvc.perform(post("/api/leads/L1/call"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("LEAD_NOT_CALLABLE"))
        .andExpect(jsonPath("$.details.callStatus").value("completed"));
    verifyNoInteractions(placementService);
  }

  @Test
  void manualCallReportsProviderFailure() throws Exception {
    when(leadStore.findById("L1")).thenReturn(Optional.of(lead("L1", CallStatus.PENDING, 0)));
    when(placementService.place(any(), eq(CallStatus.INITIATED))).thenReturn(PlacementResult.failed("HTTP 401: bad key"));

    mockMvc.perform(post("/api/leads/L1/call"))
        .andExpect(status().isBadGateway())
        .andExpect(jsonPath("$.code").value("CALL_INITIATION_FAILED"))
        .andExpect(jsonPath("$.details.error").value("HTTP 401: bad key"));
  }

  @Test
  void retryConfigExposesLadder() throws Exception {
    mockMvc.perform(get("/api/retry-config"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.maxRetries").value(3))
        .andExpect(jsonPath("$.intervals[0]").value(0.5))
        .andExpect(jsonPath("$.intervals[1]").value(24.0))
        .andExpect(jsonPath("$.unit").value("hours"));
  }
}
