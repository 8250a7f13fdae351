package com.presales.outreach.campaign;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Live state of one batch campaign. Counters only grow and are changed under the job lock; readers
 * take a {@link #snapshot()}.
 */
final class BatchJob {
  private static final int ERRORS_KEPT = 50;
  private static final int ERRORS_SHOWN = 10;

  private final String jobId;
  private final List<String> leadIds;
  private final int parallelCalls;
  private final int intervalSeconds;
  private final OffsetDateTime startedAt;
  private final AtomicBoolean cancelled = new AtomicBoolean(false);
  private final CountDownLatch cancelSignal = new CountDownLatch(1);
  private final Object lock = new Object();

  private BatchJobStatus status = BatchJobStatus.RUNNING;
  private int currentBatch;
  private List<String> currentBatchLeads = List.of();
  private int initiated;
  private int succeeded;
  private int failed;
  private final Deque<String> errors = new ArrayDeque<>();
  private OffsetDateTime completedAt;
  private OffsetDateTime nextBatchAt;

  BatchJob(String jobId, List<String> leadIds, int parallelCalls, int intervalSeconds, OffsetDateTime startedAt) {
    this.jobId = jobId;
    this.leadIds = List.copyOf(leadIds);
    this.parallelCalls = parallelCalls;
    this.intervalSeconds = intervalSeconds;
    this.startedAt = startedAt;
  }

  String jobId() {
    return jobId;
  }

  List<String> leadIds() {
    return leadIds;
  }

  int parallelCalls() {
    return parallelCalls;
  }

  int intervalSeconds() {
    return intervalSeconds;
  }

  int totalBatches() {
    return (leadIds.size() + parallelCalls - 1) / parallelCalls;
  }

  boolean isCancelled() {
    return cancelled.get();
  }

  boolean isFinished() {
    synchronized (lock) {
      return status != BatchJobStatus.RUNNING;
    }
  }

  /** Only a running job can be cancelled. Wakes the worker if it is waiting between batches. */
  boolean cancel(OffsetDateTime now) {
    synchronized (lock) {
      if (status != BatchJobStatus.RUNNING) {
        return false;
      }
      status = BatchJobStatus.CANCELLED;
      completedAt = now;
      nextBatchAt = null;
    }
    cancelled.set(true);
    cancelSignal.countDown();
    return true;
  }

  /** Returns true when the wait was cut short by cancellation. */
  boolean awaitPacing(Duration pause) throws InterruptedException {
    return cancelSignal.await(pause.toMillis(), TimeUnit.MILLISECONDS);
  }

  void beginBatch(int batchNumber, List<String> batchLeads) {
    synchronized (lock) {
      currentBatch = batchNumber;
      currentBatchLeads = List.copyOf(batchLeads);
      nextBatchAt = null;
    }
  }

  void pacingUntil(OffsetDateTime at) {
    synchronized (lock) {
      if (status == BatchJobStatus.RUNNING) {
        nextBatchAt = at;
      }
    }
  }

  void recordInitiated() {
    synchronized (lock) {
      initiated++;
    }
  }

  void recordSuccess() {
    synchronized (lock) {
      succeeded++;
    }
  }

  void recordFailure(String leadId, String error) {
    synchronized (lock) {
      failed++;
      addError(leadId, error);
    }
  }

  /** Call went out but the lead row was not updated; it still counts as a success. */
  void recordBookkeepingError(String leadId, String error) {
    synchronized (lock) {
      addError(leadId, error);
    }
  }

  void finish(OffsetDateTime now) {
    synchronized (lock) {
      if (status == BatchJobStatus.RUNNING) {
        status = BatchJobStatus.COMPLETED;
        completedAt = now;
        nextBatchAt = null;
        currentBatchLeads = List.of();
      }
    }
  }

  void fail(String error, OffsetDateTime now) {
    synchronized (lock) {
      if (status == BatchJobStatus.RUNNING) {
        status = BatchJobStatus.FAILED;
        completedAt = now;
        nextBatchAt = null;
      }
      addError("job", error);
    }
  }

  BatchJobSnapshot snapshot() {
    synchronized (lock) {
      int done = succeeded + failed;
      int percent = leadIds.isEmpty() ? 100 : Math.min(100, done * 100 / leadIds.size());
      List<String> recent = new ArrayList<>(errors);
      if (recent.size() > ERRORS_SHOWN) {
        recent = recent.subList(recent.size() - ERRORS_SHOWN, recent.size());
      }
      return new BatchJobSnapshot(jobId, status.wire(), leadIds.size(), parallelCalls, intervalSeconds,
          totalBatches(), currentBatch, currentBatchLeads, initiated, succeeded, failed, percent,
          List.copyOf(recent), startedAt, completedAt, nextBatchAt);
    }
  }

  private void addError(String leadId, String error) {
    errors.addLast(leadId + ": " + error);
    while (errors.size() > ERRORS_KEPT) {
      errors.removeFirst();
    }
  }
}
