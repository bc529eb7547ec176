package com.retail.storeintel.service;

import com.retail.storeintel.dto.ProximityGeneration;
import com.retail.storeintel.dto.TrendGeneration;
import com.retail.storeintel.dto.WeatherGeneration;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * The generations an insight pass reads from. Any of them may be null before
 * its first publish.
 */
public record AggregationInputs(
        ProximityGeneration proximity,
        WeatherGeneration weather,
        TrendGeneration trends
) {

    /**
     * Newest publish time among the captured generations. Snapshot ages are
     * measured against this, so the same inputs always score the same.
     */
    public Optional<Instant> referenceTime() {
        return Stream.of(
                        proximity != null ? proximity.publishedAt() : null,
                        weather != null ? weather.publishedAt() : null,
                        trends != null ? trends.publishedAt() : null)
                .filter(Objects::nonNull)
                .max(Instant::compareTo);
    }
}
