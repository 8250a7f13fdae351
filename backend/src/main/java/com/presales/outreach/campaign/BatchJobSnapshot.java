package com.presales.outreach.campaign;

import java.time.OffsetDateTime;
import java.util.List;

public record BatchJobSnapshot(
    String jobId,
    String status,
    int totalLeads,
    int parallelCalls,
    int intervalSeconds,
    int totalBatches,
    int currentBatch,
    List<String> currentBatchLeads,
    int initiated,
    int succeeded,
    int failed,
    int progressPercent,
    List<String> errors,
    OffsetDateTime startedAt,
    OffsetDateTime completedAt,
    OffsetDateTime nextBatchAt
) {
}
