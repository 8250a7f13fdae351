package com.presales.outreach.campaign;

import com.presales.outreach.common.OutreachException;
import com.presales.outreach.domain.CallStatus;
import com.presales.outreach.domain.InMemoryLeadStore;
import com.presales.outreach.orchestration.CallPlacementService;
import com.presales.outreach.orchestration.PlacementResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

import static com.presales.outreach.domain.InMemoryLeadStore.lead;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class BatchCampaignWorkerTest {
  private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-10T06:30:00Z"), ZoneId.of("Asia/Kolkata"));

  private InMemoryLeadStore store;
  private CallPlacementService placement;
  private CampaignProperties properties;
  private BatchCampaignWorker worker;

  @BeforeEach
  void setUp() {
    store = new InMemoryLeadStore();
    placement = mock(CallPlacementService.class);
    properties = new CampaignProperties();
    properties.setCallTimeoutSeconds(5);
    worker = new BatchCampaignWorker(store, placement, properties, CLOCK);
  }

  @AfterEach
  void tearDown() {
    worker.shutdown();
  }

  private List<String> seed(int count) {
    List<String> ids = new ArrayList<>();
    for (int i = 1; i <= count; i++) {
      String id = String.format("L%02d", i);
      store.put(lead(id, CallStatus.PENDING, 0));
      ids.add(id);
    }
    return ids;
  }

  private BatchJob job(List<String> leadIds, int parallelCalls, int intervalSeconds) {
    return new BatchJob("job-1", leadIds, parallelCalls, intervalSeconds, OffsetDateTime.now(CLOCK));
  }

  @Test
  void twelveLeadsRunAsThreeBatchesOfFive() {
    BatchJob job = job(seed(12), 5, 0);
    Map<Integer, AtomicInteger> callsPerBatch = new ConcurrentHashMap<>();
    when(placement.place(any(), any())).thenAnswer(invocation -> {
      callsPerBatch.computeIfAbsent(job.snapshot().currentBatch(), b -> new AtomicInteger()).incrementAndGet();
      return PlacementResult.placed("call", OffsetDateTime.now(CLOCK));
    });

    worker.run(job);

    BatchJobSnapshot snapshot = job.snapshot();
    assertEquals("completed", snapshot.status());
    assertEquals(3, snapshot.totalBatches());
    assertEquals(5, callsPerBatch.get(1).get());
    assertEquals(5, callsPerBatch.get(2).get());
    assertEquals(2, callsPerBatch.get(3).get());
    assertEquals(12, snapshot.initiated());
    assertEquals(12, snapshot.succeeded());
    assertEquals(100, snapshot.progressPercent());
    assertNotNull(snapshot.completedAt());
  }

  @Test
  void failuresAndMissingLeadsAreCounted() {
    List<String> ids = new ArrayList<>(seed(2));
    ids.add("ghost");
    when(placement.place(argThat(l -> l != null && l.id().equals("L01")), any()))
        .thenReturn(PlacementResult.placed("call-1", OffsetDateTime.now(CLOCK)));
    when(placement.place(argThat(l -> l != null && l.id().equals("L02")), any()))
        .thenReturn(PlacementResult.failed("HTTP 400: bad number"));
    BatchJob job = job(ids, 3, 0);

    worker.run(job);

    BatchJobSnapshot snapshot = job.snapshot();
    assertEquals(2, snapshot.initiated());
    assertEquals(1, snapshot.succeeded());
    assertEquals(2, snapshot.failed());
    assertTrue(snapshot.errors().contains("L02: HTTP 400: bad number"));
    assertTrue(snapshot.errors().contains("ghost: lead not found"));
  }

  @Test
  void unrecordedPlacementCountsAsSuccessWithError() {
    BatchJob job = job(seed(1), 1, 0);
    when(placement.place(any(), any()))
        .thenReturn(PlacementResult.placedUnrecorded("call-1", OffsetDateTime.now(CLOCK), "store down"));

    worker.run(job);

    BatchJobSnapshot snapshot = job.snapshot();
    assertEquals(1, snapshot.succeeded());
    assertEquals(0, snapshot.failed());
    assertEquals(List.of("L01: call placed, lead not updated: store down"), snapshot.errors());
  }

  @Test
  void hungCallIsFailedAtDeadline() {
    properties.setCallTimeoutSeconds(1);
    BatchJob job = job(seed(1), 1, 0);
    when(placement.place(any(), any())).thenAnswer(invocation -> {
      Thread.sleep(10_000);
      return PlacementResult.placed("late", OffsetDateTime.now(CLOCK));
    });

    worker.run(job);

    BatchJobSnapshot snapshot = job.snapshot();
    assertEquals(1, snapshot.failed());
    assertEquals(0, snapshot.succeeded());
    assertEquals(List.of("L01: call timed out after 1s"), snapshot.errors());
  }

  @Test
  void cancelDuringPacingStopsBeforeNextBatch() throws Exception {
    when(placement.place(any(), any())).thenReturn(PlacementResult.placed("call", OffsetDateTime.now(CLOCK)));

    BatchJobSnapshot started = worker.start(seed(12), 5, 60);
    waitFor(() -> worker.status(started.jobId()).orElseThrow().nextBatchAt() != null);

    assertTrue(worker.cancel(started.jobId()));
    waitFor(() -> worker.activeStatus().isEmpty());

    BatchJobSnapshot snapshot = worker.status(started.jobId()).orElseThrow();
    assertEquals("cancelled", snapshot.status());
    assertEquals(5, snapshot.succeeded());
    assertNull(snapshot.nextBatchAt());
    verify(placement, times(5)).place(any(), any());
    assertFalse(worker.cancel(started.jobId()));
  }

  @Test
  void newJobCancelsRunningOne() throws Exception {
    when(placement.place(any(), any())).thenReturn(PlacementResult.placed("call", OffsetDateTime.now(CLOCK)));
    List<String> ids = seed(4);

    BatchJobSnapshot first = worker.start(ids, 2, 60);
    waitFor(() -> worker.status(first.jobId()).orElseThrow().nextBatchAt() != null);
    BatchJobSnapshot second = worker.start(ids.subList(0, 1), 1, 0);

    assertEquals("cancelled", worker.status(first.jobId()).orElseThrow().status());
    waitFor(() -> "completed".equals(worker.status(second.jobId()).orElseThrow().status()));
  }

  @Test
  void startingJobDropsOldestFinishedJobs() throws Exception {
    properties.setRetainedJobs(2);
    when(placement.place(any(), any())).thenReturn(PlacementResult.placed("call", OffsetDateTime.now(CLOCK)));
    List<String> ids = seed(1);

    List<String> finished = new ArrayList<>();
    for (int i = 0; i < 3; i++) {
      BatchJobSnapshot done = worker.start(ids, 1, 0);
      waitFor(() -> "completed".equals(worker.status(done.jobId()).orElseThrow().status()));
      finished.add(done.jobId());
    }
    BatchJobSnapshot active = worker.start(ids, 1, 0);

    assertTrue(worker.status(finished.get(0)).isEmpty());
    assertTrue(worker.status(finished.get(1)).isPresent());
    assertTrue(worker.status(finished.get(2)).isPresent());
    assertTrue(worker.status(active.jobId()).isPresent());
    waitFor(() -> "completed".equals(worker.status(active.jobId()).orElseThrow().status()));
  }

  @Test
  void rejectsInvalidRequests() {
    OutreachException empty = assertThrows(OutreachException.class, () -> worker.start(List.of(" "), null, null));
    assertEquals("CAMPAIGN_EMPTY", empty.code());

    OutreachException wide = assertThrows(OutreachException.class, () -> worker.start(List.of("L01"), 11, null));
    assertEquals("CAMPAIGN_PARALLEL_OUT_OF_RANGE", wide.code());

    OutreachException interval = assertThrows(OutreachException.class, () -> worker.start(List.of("L01"), 1, -1));
    assertEquals("CAMPAIGN_INTERVAL_INVALID", interval.code());
  }

  private static void waitFor(BooleanSupplier condition) throws InterruptedException {
    long deadline = System.currentTimeMillis() + 5000;
    while (!condition.getAsBoolean()) {
      if (System.currentTimeMillis() > deadline) {
        fail("condition not met within 5s");
      }
      Thread.sleep(20);
    }
  }
}
