package com.retail.storeintel.scheduler;

import com.retail.storeintel.config.AnalyticsProperties;
import com.retail.storeintel.config.SchedulerProperties;
import com.retail.storeintel.dto.InsightRecord;
import com.retail.storeintel.dto.TrendSummary;
import com.retail.storeintel.dto.WeatherImpact;
import com.retail.storeintel.entity.Store;
import com.retail.storeintel.service.*;
import com.retail.storeintel.service.weather.WeatherSnapshotCache;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Recomputes trends and weather impact, publishes them, then rebuilds insights
 * for every store from one captured set of generations.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TrendInsightJob implements RefreshJob {

    public static final String NAME = "trend-insight-recompute";

    private final StoreRegistryService storeRegistry;
    private final TrendAnalyzer trendAnalyzer;
    private final WeatherImpactAnalyzer weatherImpactAnalyzer;
    private final WeatherSnapshotCache weatherCache;
    private final InsightAggregator insightAggregator;
    private final SnapshotStore snapshotStore;
    private final PerStoreRunner perStoreRunner;
    private final AnalyticsProperties analyticsProperties;
    private final SchedulerProperties properties;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Duration cadence() {
        return properties.getTrendCadence();
    }

    @Override
    public void run(JobContext context) {
        List<Store> stores = storeRegistry.findOwnStores();
        int windowDays = analyticsProperties.getTrend().getWindowDays();
        log.info("TREND: Recomputing {} stores over {} days", stores.size(), windowDays);

        Map<String, TrendSummary> trends = perStoreRunner.forEachStore(NAME, stores,
                store -> trendAnalyzer.computeTrend(store.getId(), windowDays), context);
        Map<String, WeatherImpact> impacts = perStoreRunner.forEachStore(NAME, stores,
                store -> weatherImpactAnalyzer.analyze(store.getId(), weatherCache.history(store.getId())).orElse(null),
                context);
        if (context.isStopRequested()) {
            log.info("TREND: Stop requested, discarding partial recompute");
            return;
        }
        snapshotStore.publishTrends(trends, impacts);

        AggregationInputs inputs = snapshotStore.captureInputs();
        Map<String, List<InsightRecord>> insights = perStoreRunner.forEachStore(NAME, stores,
                store -> insightAggregator.aggregate(store.getId(), inputs), context);
        if (context.isStopRequested()) {
            log.info("INSIGHTS: Stop requested, discarding partial aggregation");
            return;
        }
        snapshotStore.publishInsights(insights);
        log.info("INSIGHTS: Aggregated {} insights for {} stores",
                insights.values().stream().mapToInt(List::size).sum(), insights.size());
    }
}
