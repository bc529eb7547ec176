package com.retail.storeintel.service.weather;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.retail.storeintel.config.WeatherProperties;
import com.retail.storeintel.dto.WeatherObservation;
import com.retail.storeintel.exception.ProviderUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestTemplate;

import java.time.*;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * OpenWeatherMap client for current conditions and the 3-hourly forecast.
 * Temperatures are requested in metric units; wind speed is converted from m/s to km/h.
 */
@Slf4j
@Service
public class OpenWeatherMapProvider implements WeatherProvider {

    private static final String PROVIDER_NAME = "openweathermap";
    private static final int READINGS_PER_DAY = 8;

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final WeatherProperties properties;
    private final Clock clock;

    public OpenWeatherMapProvider(@Qualifier("weatherRestTemplate") RestTemplate restTemplate,
                                  ObjectMapper objectMapper,
                                  WeatherProperties properties,
                                  Clock clock) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public WeatherObservation getCurrent(double latitude, double longitude) {
        String url = buildUrl("weather", latitude, longitude);
        log.debug("WEATHER API CALL: current lat={}, lon={}", latitude, longitude);

        JsonNode root = fetch(url);
        return parseReading(root, LocalDateTime.now(clock));
    }

    @Override
    public List<WeatherObservation> getForecast(double latitude, double longitude, int days) {
        String url = buildUrl("forecast", latitude, longitude) + "&cnt=" + (days * READINGS_PER_DAY);
        log.debug("WEATHER API CALL: forecast lat={}, lon={}, days={}", latitude, longitude, days);

        JsonNode list = fetch(url).path("list");
        if (!list.isArray()) {
            throw new ProviderUnavailableException(PROVIDER_NAME, "Forecast response has no list");
        }

        ZoneId zone = clock.getZone();
        List<WeatherObservation> readings = new ArrayList<>();
        for (JsonNode item : list) {
            LocalDateTime at = LocalDateTime.ofInstant(Instant.ofEpochSecond(item.path("dt").asLong()), zone);
            readings.add(parseReading(item, at));
        }
        log.info("WEATHER FORECAST: Fetched {} readings for lat={}, lon={}", readings.size(), latitude, longitude);
        return readings;
    }

    @Override
    public String name() {
        return PROVIDER_NAME;
    }

    private JsonNode fetch(String url) {
        try {
            String response = restTemplate.getForObject(url, String.class);
            if (response == null || response.isBlank()) {
                throw new ProviderUnavailableException(PROVIDER_NAME, "Empty response");
            }
            return objectMapper.readTree(response);
        } catch (ProviderUnavailableException e) {
            throw e;
        } catch (Exception e) {
            throw new ProviderUnavailableException(PROVIDER_NAME, e.getMessage(), e);
        }
    }

    private WeatherObservation parseReading(JsonNode node, LocalDateTime observedAt) {
        JsonNode main = node.path("main");
        if (!main.has("temp")) {
            throw new ProviderUnavailableException(PROVIDER_NAME, "Reading has no temperature");
        }
        double temperature = main.path("temp").asDouble();
        Double humidity = main.has("humidity") ? main.path("humidity").asDouble() : null;

        JsonNode weather = node.path("weather");
        String condition = weather.isArray() && weather.size() > 0
                ? weather.get(0).path("main").asText("Unknown")
                : "Unknown";

        JsonNode wind = node.path("wind");
        Double windKmh = wind.has("speed") ? wind.path("speed").asDouble() * 3.6 : null;

        return new WeatherObservation(observedAt, temperature, condition, humidity, windKmh);
    }

    private String buildUrl(String endpoint, double latitude, double longitude) {
        String apiKey = properties.getApiKey();
        if (apiKey == null || apiKey.isBlank()) {
            throw new ProviderUnavailableException(PROVIDER_NAME, "API key not configured");
        }
        return String.format(Locale.ROOT, "%s/%s?lat=%.4f&lon=%.4f&appid=%s&units=metric",
                properties.getBaseUrl(), endpoint, latitude, longitude, apiKey);
    }
}
