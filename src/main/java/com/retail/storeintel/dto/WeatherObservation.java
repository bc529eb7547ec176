package com.retail.storeintel.dto;

import java.time.LocalDateTime;

/**
 * Raw reading returned by a weather provider. Humidity and wind may be null
 * when the provider omits them.
 */
public record WeatherObservation(
        LocalDateTime observedAt,
        double temperatureC,
        String condition,
        Double humidity,
        Double windSpeed
) {}
