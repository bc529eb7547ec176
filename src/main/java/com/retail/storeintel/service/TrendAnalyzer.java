package com.retail.storeintel.service;

import com.retail.storeintel.config.AnalyticsProperties;
import com.retail.storeintel.dto.InsightPriority;
import com.retail.storeintel.dto.PeakBucket;
import com.retail.storeintel.dto.ReorderRecommendation;
import com.retail.storeintel.dto.TransactionRecord;
import com.retail.storeintel.dto.TrendSummary;
import com.retail.storeintel.entity.DayPeriod;
import com.retail.storeintel.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.*;

/**
 * Sales growth, peak trading bucket and reorder signals for one store.
 *
 * <p>The current window is the {@code windowDays} days ending today (inclusive);
 * the prior window is the {@code windowDays} days immediately before it.
 */
@Slf4j
@Service
public class TrendAnalyzer {

    private static final Comparator<TransactionRecord> CHRONOLOGICAL =
            Comparator.comparing(TransactionRecord::date)
                    .thenComparing(TransactionRecord::period);

    private final TransactionSource transactionSource;
    private final AnalyticsProperties properties;
    private final Clock clock;

    public TrendAnalyzer(TransactionSource transactionSource, AnalyticsProperties properties, Clock clock) {
        this.transactionSource = transactionSource;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * @throws ValidationException if {@code windowDays} is not positive
     * @throws com.retail.storeintel.exception.ProviderUnavailableException if the feed cannot be read
     */
    public TrendSummary computeTrend(String storeId, int windowDays) {
        if (windowDays <= 0) {
            throw new ValidationException("Window must be a positive number of days, got " + windowDays);
        }
        LocalDate asOf = LocalDate.now(clock);
        LocalDate currentStart = asOf.minusDays(windowDays - 1L);
        LocalDate priorStart = currentStart.minusDays(windowDays);

        List<TransactionRecord> series = new ArrayList<>(transactionSource.fetchSeries(storeId, priorStart, asOf));
        series.sort(CHRONOLOGICAL);

        List<TransactionRecord> current = new ArrayList<>();
        List<TransactionRecord> prior = new ArrayList<>();
        for (TransactionRecord record : series) {
            if (record.date().isBefore(priorStart) || record.date().isAfter(asOf)) {
                continue;
            }
            if (record.date().isBefore(currentStart)) {
                prior.add(record);
            } else {
                current.add(record);
            }
        }

        double currentTotal = total(current);
        double priorTotal = total(prior);
        Map<String, Double> currentByCategory = totalsByCategory(current);
        Map<String, Double> priorByCategory = totalsByCategory(prior);

        SortedMap<String, Double> categoryGrowth = new TreeMap<>();
        Set<String> categories = new TreeSet<>(currentByCategory.keySet());
        categories.addAll(priorByCategory.keySet());
        for (String category : categories) {
            categoryGrowth.put(category, growthRate(
                    currentByCategory.getOrDefault(category, 0.0),
                    priorByCategory.getOrDefault(category, 0.0)));
        }

        int historyDays = (int) series.stream().map(TransactionRecord::date).distinct().count();
        boolean lowConfidence = historyDays < 2 * windowDays;
        if (lowConfidence) {
            log.debug("TREND: {} has {} days of history for a {}-day window, marking low confidence",
                    storeId, historyDays, windowDays);
        }

        TrendSummary summary = TrendSummary.builder()
                .storeId(storeId)
                .windowDays(windowDays)
                .asOf(asOf)
                .totalValue(currentTotal)
                .priorTotalValue(priorTotal)
                .growthRatePct(growthRate(currentTotal, priorTotal))
                .peakPeriod(peakBucket(current))
                .categoryGrowth(categoryGrowth)
                .reorderRecommendations(reorderSignals(series, currentByCategory, windowDays))
                .lowConfidence(lowConfidence)
                .historyDays(historyDays)
                .computedAt(clock.instant())
                .build();

        log.info("TREND: {} growth={}% peak={} reorders={}", storeId,
                String.format(Locale.ROOT, "%.2f", summary.getGrowthRatePct()),
                summary.getPeakPeriod(), summary.getReorderRecommendations().size());
        return summary;
    }

    /**
     * 0 when the prior value is 0, so an empty prior window never divides by zero.
     */
    static double growthRate(double current, double prior) {
        if (prior == 0) {
            return 0.0;
        }
        return (current - prior) / prior * 100.0;
    }

    /**
     * (day-of-week, period) with the highest mean value per occurrence. On a tie the
     * bucket seen first in chronological order wins. Expects {@code current} sorted.
     */
    private PeakBucket peakBucket(List<TransactionRecord> current) {
        Map<BucketStats.Key, BucketStats> buckets = new LinkedHashMap<>();
        for (TransactionRecord record : current) {
            BucketStats.Key key = new BucketStats.Key(record.date().getDayOfWeek(), record.period());
            buckets.computeIfAbsent(key, k -> new BucketStats()).add(record);
        }

        PeakBucket peak = null;
        for (Map.Entry<BucketStats.Key, BucketStats> entry : buckets.entrySet()) {
            double mean = entry.getValue().mean();
            if (peak == null || mean > peak.meanValue()) {
                peak = new PeakBucket(entry.getKey().dayOfWeek(), entry.getKey().period(), mean);
            }
        }
        return peak;
    }

    private List<ReorderRecommendation> reorderSignals(List<TransactionRecord> series,
                                                       Map<String, Double> currentByCategory,
                                                       int windowDays) {
        AnalyticsProperties.Trend config = properties.getTrend();

        // latest reported stock per category; series is chronological so later rows overwrite
        Map<String, Integer> latestStock = new TreeMap<>();
        for (TransactionRecord record : series) {
            if (record.stockLevel() != null) {
                latestStock.put(record.category(), record.stockLevel());
            }
        }

        List<ReorderRecommendation> recommendations = new ArrayList<>();
        for (Map.Entry<String, Integer> entry : latestStock.entrySet()) {
            double averageDaily = currentByCategory.getOrDefault(entry.getKey(), 0.0) / windowDays;
            if (averageDaily <= 0) {
                continue;
            }
            int stock = entry.getValue();
            double daysOfCover = stock / averageDaily;
            if (daysOfCover >= config.getReorderThresholdDays()) {
                continue;
            }
            int quantity = (int) Math.max(0, Math.ceil(config.getTargetCoverDays() * averageDaily - stock));
            InsightPriority urgency = daysOfCover < config.getCriticalCoverDays()
                    ? InsightPriority.CRITICAL
                    : InsightPriority.HIGH;
            recommendations.add(new ReorderRecommendation(entry.getKey(), stock, averageDaily,
                    daysOfCover, quantity, urgency));
        }
        recommendations.sort(Comparator.comparingDouble(ReorderRecommendation::daysOfCover)
                .thenComparing(ReorderRecommendation::category));
        return recommendations;
    }

    private static double total(List<TransactionRecord> records) {
        return records.stream().mapToDouble(TransactionRecord::value).sum();
    }

    private static Map<String, Double> totalsByCategory(List<TransactionRecord> records) {
        Map<String, Double> totals = new TreeMap<>();
        for (TransactionRecord record : records) {
            totals.merge(record.category(), record.value(), Double::sum);
        }
        return totals;
    }

    private static final class BucketStats {

        record Key(DayOfWeek dayOfWeek, DayPeriod period) {}

        private double sum;
        private final Set<LocalDate> dates = new HashSet<>();

        void add(TransactionRecord record) {
            sum += record.value();
            dates.add(record.date());
        }

        double mean() {
            return dates.isEmpty() ? 0.0 : sum / dates.size();
        }
    }
}
