package com.presales.outreach.orchestration;

import com.presales.outreach.domain.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.util.Map;
import java.util.concurrent.ScheduledFuture;

import static com.presales.outreach.domain.InMemoryLeadStore.lead;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class CallbackSchedulerTest {
  private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-10T06:30:00Z"), ZoneId.of("Asia/Kolkata"));

  private InMemoryLeadStore store;
  private TaskScheduler taskScheduler;
  private CallPlacementService placement;
  private CallbackScheduler scheduler;

  @BeforeEach
  void setUp() {
    store = new InMemoryLeadStore();
    taskScheduler = mock(TaskScheduler.class);
    placement = mock(CallPlacementService.class);
    doReturn(mock(ScheduledFuture.class)).when(taskScheduler).schedule(any(Runnable.class), any(Instant.class));
    scheduler = new CallbackScheduler(taskScheduler, store, new LeadStoreRetry(2, 0), placement, CLOCK);
  }

  @Test
  void rescheduleReplacesPendingTrigger() {
    ScheduledFuture<?> first = mock(ScheduledFuture.class);
    ScheduledFuture<?> second = mock(ScheduledFuture.class);
    doReturn(first).doReturn(second).when(taskScheduler).schedule(any(Runnable.class), any(Instant.class));
    OffsetDateTime at = OffsetDateTime.now(CLOCK).plusHours(2);

    scheduler.schedule("L1", at);
    scheduler.schedule("L1", at.plusHours(1));

    verify(first).cancel(false);
    verify(taskScheduler).schedule(any(Runnable.class), eq(at.toInstant()));
    assertTrue(scheduler.isPending("L1"));
  }

  @Test
  void firePlacesCallbackCall() {
    Lead lead = store.put(lead("L1", CallStatus.CALLBACK_SCHEDULED, 0));
    when(placement.place(lead, CallStatus.CALLBACK_INITIATED)).thenReturn(PlacementResult.placed("call-9", OffsetDateTime.now(CLOCK)));

    scheduler.fire("L1");

    verify(placement).place(lead, CallStatus.CALLBACK_INITIATED);
    assertTrue(store.writes().isEmpty());
  }

  @Test
  void failedCallbackIsMarked() {
    store.put(lead("L1", CallStatus.CALLBACK_SCHEDULED, 0));
    when(placement.place(any(), any())).thenReturn(PlacementResult.failed("HTTP 500"));

    scheduler.fire("L1");

    assertEquals(CallStatus.CALLBACK_FAILED, store.get("L1").callStatus());
    assertEquals("HTTP 500", store.get("L1").lastTerminalReason());
  }

  @Test
  void leadThatMovedOnIsNotCalled() {
    store.put(lead("L1", CallStatus.COMPLETED, 0));

    scheduler.fire("L1");

    verifyNoInteractions(placement);
  }

  @Test
  void restoreReschedulesOverdueCallbacksForNow() {
    store.put(lead("L1", CallStatus.CALLBACK_SCHEDULED, 0));
    store.updateFields("L1", Map.of(LeadFields.CALLBACK_REQUESTED_AT, OffsetDateTime.now(CLOCK).minusHours(3)));
    store.put(lead("L2", CallStatus.CALLBACK_SCHEDULED, 0));
    OffsetDateTime later = OffsetDateTime.now(CLOCK).plusHours(5);
    store.updateFields("L2", Map.of(LeadFields.CALLBACK_REQUESTED_AT, later));

    scheduler.restorePending();

    verify(taskScheduler).schedule(any(Runnable.class), eq(Instant.now(CLOCK)));
    verify(taskScheduler).schedule(any(Runnable.class), eq(later.toInstant()));
  }
}
