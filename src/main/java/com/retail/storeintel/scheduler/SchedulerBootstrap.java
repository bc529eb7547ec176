package com.retail.storeintel.scheduler;

import com.retail.storeintel.config.SchedulerProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Starts the refresh loop once the application is ready and, if configured,
 * runs every job once in dependency order: weather and proximity before trends
 * and insights.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "store-intel.scheduler", name = "enabled", havingValue = "true", matchIfMissing = true)
public class SchedulerBootstrap {

    private static final List<String> STARTUP_ORDER = List.of(
            WeatherRefreshJob.NAME, ProximityRecomputeJob.NAME, TrendInsightJob.NAME);

    private final RefreshScheduler scheduler;
    private final SchedulerProperties properties;

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        scheduler.start();

        if (!properties.isRunOnStartup()) {
            log.info("SCHEDULER: Startup run disabled, first runs follow the configured cadences");
            return;
        }
        for (String jobName : STARTUP_ORDER) {
            JobOutcome outcome = scheduler.runNow(jobName);
            log.info("SCHEDULER: Startup run of {} -> {}", jobName, outcome);
        }
    }
}
