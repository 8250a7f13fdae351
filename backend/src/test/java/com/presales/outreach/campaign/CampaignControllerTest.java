package com.presales.outreach.campaign;

import com.presales.outreach.common.OutreachException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = CampaignController.class)
@AutoConfigureMockMvc(addFilters = false)
class CampaignControllerTest {

  @Autowired
  private MockMvc mockMvc;

  @MockBean
  private BatchCampaignWorker worker;

  private static BatchJobSnapshot running(String jobId) {
    return new BatchJobSnapshot(jobId, "running", 12, 5, 240, 3, 1, List.of("L01", "L02"), 2, 0, 0, 0, List.of(),
        OffsetDateTime.parse("2026-03-10T12:00:00+05:30"), null, null);
  }

  @Test
  void startReturnsAcceptedJob() throws Exception {
    when(worker.start(List.of("L01", "L02"), 2, 0)).thenReturn(running("job-1"));

    mockMvc.perform(post("/api/campaigns/batch")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"leadIds\":[\"L01\",\"L02\"],\"parallelCalls\":2,\"intervalSeconds\":0}"))
        .andExpect(status().isAccepted())
        .andExpect(jsonPath("$.jobId").value("job-1"))
        .andExpect(jsonPath("$.job.status").value("running"))
        .andExpect(jsonPath("$.job.totalBatches").value(3));
  }

  @Test
  void emptyLeadListFailsValidation() throws Exception {
    mockMvc.perform(post("/api/campaigns/batch")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"leadIds\":[]}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));
    verifyNoInteractions(worker);
  }

  @Test
  void workerRejectionIsReported() throws Exception {
    when(worker.start(any(), eq(50), any())).thenThrow(new OutreachException(HttpStatus.BAD_REQUEST,
        "CAMPAIGN_PARALLEL_OUT_OF_RANGE", "parallelCalls must be between 1 and 10"));

    mockMvc.perform(post("/api/campaigns/batch")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"leadIds\":[\"L01\"],\"parallelCalls\":50}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("CAMPAIGN_PARALLEL_OUT_OF_RANGE"));
  }

  @Test
  void activeWithoutJob() throws Exception {
    when(worker.activeStatus()).thenReturn(Optional.empty());

    mockMvc.perform(get("/api/campaigns/batch/active"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.active").value(false))
        .andExpect(jsonPath("$.job").doesNotExist());
  }

  @Test
  void statusOfUnknownJobIs404() throws Exception {
    when(worker.status("missing")).thenReturn(Optional.empty());

    mockMvc.perform(get("/api/campaigns/batch/missing"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value("CAMPAIGN_NOT_FOUND"));
  }

  @Test
  void cancelReportsWhetherJobWasRunning() throws Exception {
    when(worker.cancel("job-1")).thenReturn(true);

    mockMvc.perform(post("/api/campaigns/batch/job-1/cancel"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.cancelled").value(true));
  }
}
