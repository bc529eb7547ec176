package com.retail.storeintel.dto;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;

@Value
@Builder
public class JobStatus {
    String jobName;
    String state;
    Duration cadence;
    Instant lastStartedAt;
    Instant lastFinishedAt;
    String lastOutcome;
    long runCount;
    long failureCount;
    long skipCount;
}
