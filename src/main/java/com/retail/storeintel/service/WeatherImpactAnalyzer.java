package com.retail.storeintel.service;

import com.retail.storeintel.dto.TransactionRecord;
import com.retail.storeintel.dto.WeatherImpact;
import com.retail.storeintel.dto.WeatherSnapshot;
import com.retail.storeintel.dto.WeatherSnapshot.BucketKey;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Compares sales in (date, period) buckets that had the latest weather condition
 * with sales across every bucket that has a provider reading. Fallback readings
 * are ignored; they say nothing about the weather customers actually saw.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WeatherImpactAnalyzer {

    private final TransactionSource transactionSource;

    public Optional<WeatherImpact> analyze(String storeId, List<WeatherSnapshot> weatherHistory) {
        List<WeatherSnapshot> observed = weatherHistory.stream()
                .filter(snapshot -> !snapshot.isFallback())
                .sorted(Comparator.comparing(WeatherSnapshot::bucket))
                .collect(Collectors.toList());
        if (observed.isEmpty()) {
            return Optional.empty();
        }

        WeatherSnapshot latest = observed.get(observed.size() - 1);
        List<TransactionRecord> series = transactionSource.fetchSeries(storeId, observed.get(0).date(), latest.date());
        return analyze(storeId, latest.condition(), observed, series);
    }

    Optional<WeatherImpact> analyze(String storeId, String condition,
                                    List<WeatherSnapshot> observed, List<TransactionRecord> series) {
        Map<BucketKey, Double> salesByBucket = new HashMap<>();
        for (TransactionRecord record : series) {
            salesByBucket.merge(new BucketKey(record.date(), record.period()), record.value(), Double::sum);
        }

        double overallSum = 0;
        int overallCount = 0;
        double conditionSum = 0;
        int conditionCount = 0;
        for (WeatherSnapshot snapshot : observed) {
            Double sales = salesByBucket.get(snapshot.bucket());
            if (sales == null) {
                continue;
            }
            overallSum += sales;
            overallCount++;
            if (condition != null && condition.equalsIgnoreCase(snapshot.condition())) {
                conditionSum += sales;
                conditionCount++;
            }
        }

        if (conditionCount == 0 || overallSum == 0) {
            return Optional.empty();
        }
        double overallMean = overallSum / overallCount;
        double conditionMean = conditionSum / conditionCount;
        double variancePct = (conditionMean - overallMean) / overallMean * 100.0;

        log.debug("WEATHER IMPACT: {} condition={} variance={}% over {} buckets",
                storeId, condition, variancePct, conditionCount);
        return Optional.of(new WeatherImpact(storeId, condition, conditionMean, overallMean, variancePct, conditionCount));
    }
}
