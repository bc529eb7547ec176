package com.retail.storeintel.dto;

import com.retail.storeintel.entity.DayPeriod;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Weather for one store, date and day period. Immutable; at most one per
 * (storeId, date, period) is kept in the cache history.
 */
public record WeatherSnapshot(
        String storeId,
        LocalDate date,
        DayPeriod period,
        Measurement temperatureC,
        String condition,
        Measurement humidity,
        Measurement windSpeed,
        DataOrigin origin,
        Instant fetchedAt
) {

    public boolean isFallback() {
        return origin == DataOrigin.FALLBACK;
    }

    public BucketKey bucket() {
        return new BucketKey(date, period);
    }

    /**
     * A trading date and period. NIGHT of date D runs from D 22:00 to D+1 06:00,
     * so buckets order the same way as the hours they cover.
     */
    public record BucketKey(LocalDate date, DayPeriod period) implements Comparable<BucketKey> {

        public static BucketKey of(LocalDateTime localTime) {
            DayPeriod period = DayPeriod.fromTime(localTime.toLocalTime());
            LocalDate date = localTime.getHour() < DayPeriod.MORNING.getStartHour()
                    ? localTime.toLocalDate().minusDays(1)
                    : localTime.toLocalDate();
            return new BucketKey(date, period);
        }

        @Override
        public int compareTo(BucketKey other) {
            int byDate = date.compareTo(other.date);
            return byDate != 0 ? byDate : period.compareTo(other.period);
        }
    }
}
