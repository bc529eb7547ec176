package com.retail.storeintel.controller;

import com.retail.storeintel.dto.JobStatus;
import com.retail.storeintel.scheduler.JobOutcome;
import com.retail.storeintel.scheduler.RefreshScheduler;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/admin")
@RequiredArgsConstructor
@Tag(name = "Admin", description = "Refresh job monitoring and manual triggers")
public class AdminController {

    private final RefreshScheduler scheduler;

    @GetMapping("/jobs")
    @Operation(summary = "Job table: state, cadence, last run and counters")
    public ResponseEntity<List<JobStatus>> getJobs() {
        return ResponseEntity.ok(scheduler.jobStatuses());
    }

    @PostMapping("/jobs/{jobName}/run")
    @Operation(summary = "Run a job now",
            description = "Blocks until the run finishes; returns SKIPPED if the job is already running")
    public ResponseEntity<Map<String, String>> runJob(@PathVariable String jobName) {
        log.info("ADMIN: Manual trigger for {}", jobName);
        JobOutcome outcome = scheduler.runNow(jobName);
        return ResponseEntity.ok(Map.of("job", jobName, "outcome", outcome.name()));
    }
}
