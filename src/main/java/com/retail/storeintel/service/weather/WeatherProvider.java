package com.retail.storeintel.service.weather;

import com.retail.storeintel.dto.WeatherObservation;
import com.retail.storeintel.exception.ProviderUnavailableException;

import java.util.List;

/**
 * Source of live weather readings for a coordinate.
 */
public interface WeatherProvider {

    /**
     * @throws ProviderUnavailableException on timeout, transport or parse failure
     */
    WeatherObservation getCurrent(double latitude, double longitude);

    /**
     * Forecast readings in chronological order, covering up to {@code days} days.
     *
     * @throws ProviderUnavailableException on timeout, transport or parse failure
     */
    List<WeatherObservation> getForecast(double latitude, double longitude, int days);

    String name();
}
