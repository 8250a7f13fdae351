package com.presales.outreach.campaign;

import com.presales.outreach.common.OutreachException;
import com.presales.outreach.domain.CallStatus;
import com.presales.outreach.domain.Lead;
import com.presales.outreach.domain.LeadStore;
import com.presales.outreach.orchestration.CallPlacementService;
import com.presales.outreach.orchestration.PlacementResult;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs caller-chosen leads as paced batches of parallel calls. Each batch is joined against a per-call
 * deadline before the pacing wait, and only one job is active at a time: starting a job cancels the
 * previous one at its next batch or call boundary.
 */
@Service
public class BatchCampaignWorker {
  private static final Logger log = LoggerFactory.getLogger(BatchCampaignWorker.class);

  private final LeadStore leadStore;
  private final CallPlacementService placementService;
  private final CampaignProperties properties;
  private final Clock clock;
  private final Map<String, BatchJob> jobs = new ConcurrentHashMap<>();
  private final ExecutorService jobRunner = Executors.newCachedThreadPool(new CustomizableThreadFactory("campaign-job-"));
  private final Object activeLock = new Object();
  private final Deque<String> jobOrder = new ArrayDeque<>();
  private String activeJobId;

  public BatchCampaignWorker(LeadStore leadStore, CallPlacementService placementService, CampaignProperties properties, Clock clock) {
    this.leadStore = leadStore;
    this.placementService = placementService;
    this.properties = properties;
    this.clock = clock;
  }

  public BatchJobSnapshot start(List<String> leadIds, Integer parallelCalls, Integer intervalSeconds) {
    List<String> targets = leadIds == null ? List.of() : leadIds.stream().filter(Objects::nonNull).map(String::trim).filter(id -> !id.isEmpty()).toList();
    if (targets.isEmpty()) {
      throw new OutreachException(HttpStatus.BAD_REQUEST, "CAMPAIGN_EMPTY", "At least one lead id is required");
    }
    int width = parallelCalls == null ? properties.getDefaultParallelCalls() : parallelCalls;
    if (width < 1 || width > properties.getMaxParallelCalls()) {
      throw new OutreachException(HttpStatus.BAD_REQUEST, "CAMPAIGN_PARALLEL_OUT_OF_RANGE",
          "parallelCalls must be between 1 and " + properties.getMaxParallelCalls());
    }
    int interval = intervalSeconds == null ? properties.getDefaultIntervalSeconds() : intervalSeconds;
    if (interval < 0) {
      throw new OutreachException(HttpStatus.BAD_REQUEST, "CAMPAIGN_INTERVAL_INVALID", "intervalSeconds must not be negative");
    }

    BatchJob job = new BatchJob(UUID.randomUUID().toString(), targets, width, interval, OffsetDateTime.now(clock));
    synchronized (activeLock) {
      BatchJob previous = activeJobId == null ? null : jobs.get(activeJobId);
      if (previous != null && previous.cancel(OffsetDateTime.now(clock))) {
        log.info("Campaign cancelled by newer job jobId={} replacedBy={}", previous.jobId(), job.jobId());
      }
      jobs.put(job.jobId(), job);
      jobOrder.addLast(job.jobId());
      activeJobId = job.jobId();
      evictFinishedJobs();
    }
    log.info("Campaign started jobId={} leads={} parallelCalls={} intervalSeconds={} batches={}",
        job.jobId(), targets.size(), width, interval, job.totalBatches());
    jobRunner.submit(() -> run(job));
    return job.snapshot();
  }

  public Optional<BatchJobSnapshot> status(String jobId) {
    return Optional.ofNullable(jobs.get(jobId)).map(BatchJob::snapshot);
  }

  public Optional<BatchJobSnapshot> activeStatus() {
    synchronized (activeLock) {
      return activeJobId == null ? Optional.empty() : status(activeJobId);
    }
  }

  public boolean cancel(String jobId) {
    BatchJob job = jobs.get(jobId);
    if (job == null) {
      return false;
    }
    boolean cancelled = job.cancel(OffsetDateTime.now(clock));
    if (cancelled) {
      log.info("Campaign cancel requested jobId={}", jobId);
    }
    return cancelled;
  }

  /** Newest first; running jobs are never dropped. Caller holds {@code activeLock}. */
  private void evictFinishedJobs() {
    int kept = 0;
    for (Iterator<String> it = jobOrder.descendingIterator(); it.hasNext(); ) {
      String jobId = it.next();
      BatchJob job = jobs.get(jobId);
      if (job == null) {
        it.remove();
      } else if (job.isFinished() && ++kept > properties.getRetainedJobs()) {
        it.remove();
        jobs.remove(jobId);
        log.debug("Campaign evicted jobId={} status={}", jobId, job.snapshot().status());
      }
    }
  }

  void run(BatchJob job) {
    ExecutorService callPool = Executors.newFixedThreadPool(job.parallelCalls(), new CustomizableThreadFactory("campaign-call-"));
    try {
      List<String> leadIds = job.leadIds();
      int batches = job.totalBatches();
      for (int batch = 0; batch < batches; batch++) {
        if (job.isCancelled()) {
          break;
        }
        List<String> batchLeads = leadIds.subList(batch * job.parallelCalls(), Math.min(leadIds.size(), (batch + 1) * job.parallelCalls()));
        job.beginBatch(batch + 1, batchLeads);
        runBatch(job, batchLeads, callPool);
        log.info("Campaign batch done jobId={} batch={}/{} progress={}", job.jobId(), batch + 1, batches, job.snapshot().progressPercent());

        if (batch < batches - 1 && !job.isCancelled() && job.intervalSeconds() > 0) {
          Duration pause = Duration.ofSeconds(job.intervalSeconds());
          job.pacingUntil(OffsetDateTime.now(clock).plus(pause));
          if (job.awaitPacing(pause)) {
            break;
          }
        }
      }
      job.finish(OffsetDateTime.now(clock));
      log.info("Campaign finished jobId={} status={}", job.jobId(), job.snapshot().status());
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      job.fail("interrupted", OffsetDateTime.now(clock));
    } catch (RuntimeException ex) {
      log.error("Campaign aborted jobId={}", job.jobId(), ex);
      job.fail(Objects.toString(ex.getMessage(), ex.getClass().getSimpleName()), OffsetDateTime.now(clock));
    } finally {
      callPool.shutdownNow();
      synchronized (activeLock) {
        if (job.jobId().equals(activeJobId)) {
          activeJobId = null;
        }
      }
    }
  }

  private void runBatch(BatchJob job, List<String> batchLeads, ExecutorService callPool) throws InterruptedException {
    Map<CallSlot, Future<?>> inFlight = new LinkedHashMap<>();
    for (String leadId : batchLeads) {
      if (job.isCancelled()) {
        break;
      }
      CallSlot slot = new CallSlot(leadId);
      inFlight.put(slot, callPool.submit(() -> callLead(job, slot)));
    }

    long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(properties.getCallTimeoutSeconds());
    for (Map.Entry<CallSlot, Future<?>> entry : inFlight.entrySet()) {
      CallSlot slot = entry.getKey();
      try {
        entry.getValue().get(Math.max(0, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
      } catch (TimeoutException ex) {
        entry.getValue().cancel(true);
        if (slot.settle()) {
          job.recordFailure(slot.leadId(), "call timed out after " + properties.getCallTimeoutSeconds() + "s");
        }
      } catch (ExecutionException ex) {
        if (slot.settle()) {
          Throwable cause = ex.getCause() == null ? ex : ex.getCause();
          job.recordFailure(slot.leadId(), Objects.toString(cause.getMessage(), cause.getClass().getSimpleName()));
        }
      }
    }
  }

  private void callLead(BatchJob job, CallSlot slot) {
    if (job.isCancelled()) {
      slot.settle();
      return;
    }
    try {
      Optional<Lead> lead = leadStore.findById(slot.leadId());
      if (lead.isEmpty()) {
        if (slot.settle()) {
          job.recordFailure(slot.leadId(), "lead not found");
        }
        return;
      }
      job.recordInitiated();
      PlacementResult result = placementService.place(lead.get(), CallStatus.INITIATED);
      if (!slot.settle()) {
        return;
      }
      switch (result.outcome()) {
        case PLACED -> job.recordSuccess();
        case PLACED_UNRECORDED -> {
          job.recordSuccess();
          job.recordBookkeepingError(slot.leadId(), "call placed, lead not updated: " + result.error());
        }
        default -> job.recordFailure(slot.leadId(), result.error());
      }
    } catch (RuntimeException ex) {
      log.warn("Campaign call failed jobId={} leadId={} error={}", job.jobId(), slot.leadId(), ex.getMessage());
      if (slot.settle()) {
        job.recordFailure(slot.leadId(), Objects.toString(ex.getMessage(), ex.getClass().getSimpleName()));
      }
    }
  }

  @PreDestroy
  void shutdown() {
    jobs.values().forEach(job -> job.cancel(OffsetDateTime.now(clock)));
    jobRunner.shutdownNow();
  }

  /** Whichever of the call or its timeout settles first gets to count it. */
  private static final class CallSlot {
    private final String leadId;
    private final AtomicBoolean settled = new AtomicBoolean(false);

    private CallSlot(String leadId) {
      this.leadId = leadId;
    }

    String leadId() {
      return leadId;
    }

    boolean settle() {
      return settled.compareAndSet(false, true);
    }
  }
}
