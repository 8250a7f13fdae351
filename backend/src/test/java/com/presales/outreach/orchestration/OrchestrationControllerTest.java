package com.presales.outreach.orchestration;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = OrchestrationController.class)
@AutoConfigureMockMvc(addFilters = false)
class OrchestrationControllerTest {

  @Autowired
  private MockMvc mockMvc;

  @MockBean
  private OrchestrationScheduler orchestrationScheduler;

  @MockBean
  private ReconciliationSweeper reconciliationSweeper;

  @Test
  void sweepReportsCountsAndErrors() throws Exception {
    when(orchestrationScheduler.runSweep()).thenReturn(new SweepResult(false, 3, 2, 1, List.of("L3: HTTP 500")));

    mockMvc.perform(post("/api/orchestration/sweep"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.due").value(3))
        .andExpect(jsonPath("$.placed").value(2))
        .andExpect(jsonPath("$.errors[0]").value("L3: HTTP 500"));
  }

  @Test
  void reconcileReportsSkippedRun() throws Exception {
    when(reconciliationSweeper.reconcile()).thenReturn(new ReconciliationSweeper.ReconciliationResult(true, 0, 0, 0, 0));

    mockMvc.perform(post("/api/orchestration/reconcile"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.skipped").value(true));
  }
}
