package com.retail.storeintel.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Tunable cut-offs for trend analysis and insight classification.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "store-intel.analytics")
public class AnalyticsProperties {

    private Trend trend = new Trend();
    private Insight insight = new Insight();

    @Data
    public static class Trend {
        private int windowDays = 30;
        private double reorderThresholdDays = 7;
        private double criticalCoverDays = 3;
        private double targetCoverDays = 14;
    }

    @Data
    public static class Insight {
        private double salesDeclineThresholdPct = 10;
        private double salesCriticalDeclinePct = 25;
        private double salesGrowthHighlightPct = 15;
        private double weatherVarianceBandPct = 15;
        private int highDensityCompetitorCount = 5;
        private double closeCompetitorKm = 2.0;

        private double completenessWeight = 0.6;
        private double recencyWeight = 0.4;
        private double fallbackWeatherQuality = 0.6;
        private double lowConfidenceTrendQuality = 0.7;

        private Duration weatherMaxAge = Duration.ofHours(6);
        private Duration proximityMaxAge = Duration.ofHours(48);
        private Duration trendMaxAge = Duration.ofHours(48);
    }
}
