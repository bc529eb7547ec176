package com.retail.storeintel.service.weather;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.retail.storeintel.config.WeatherProperties;
import com.retail.storeintel.dto.WeatherObservation;
import com.retail.storeintel.exception.ProviderUnavailableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class OpenWeatherMapProviderTest {

    private static final String CURRENT_JSON = """
            {
              "weather": [{"main": "Rain", "description": "light rain"}],
              "main": {"temp": 27.4, "humidity": 88},
              "wind": {"speed": 2.5}
            }
            """;

    private static final String FORECAST_JSON = """
            {
              "list": [
                {"dt": 1719738000, "main": {"temp": 30.1, "humidity": 60}, "weather": [{"main": "Clouds"}], "wind": {"speed": 1.0}},
                {"dt": 1719748800, "main": {"temp": 33.0}, "weather": [{"main": "Clear"}]}
              ]
            }
            """;

    private RestTemplate restTemplate;
    private MockRestServiceServer server;
    private WeatherProperties properties;
    private OpenWeatherMapProvider provider;

    @BeforeEach
    void setUp() {
        restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        properties = new WeatherProperties();
        properties.setApiKey("test-key");
        Clock clock = Clock.fixed(Instant.parse("2024-06-30T09:00:00Z"), ZoneOffset.UTC);
        provider = new OpenWeatherMapProvider(restTemplate, new ObjectMapper(), properties, clock);
    }

    @Test
    void testParsesCurrentWeather() {
        server.expect(requestTo(startsWith("https://api.openweathermap.org/data/2.5/weather?lat=26.8467&lon=80.9462")))
                .andRespond(withSuccess(CURRENT_JSON, MediaType.APPLICATION_JSON));

        WeatherObservation observation = provider.getCurrent(26.8467, 80.9462);

        assertEquals(27.4, observation.temperatureC(), 1e-9);
        assertEquals("Rain", observation.condition());
        assertEquals(88.0, observation.humidity(), 1e-9);
        // 2.5 m/s in km/h
        assertEquals(9.0, observation.windSpeed(), 1e-9);
        assertEquals(LocalDateTime.of(2024, 6, 30, 9, 0), observation.observedAt());
        server.verify();
    }

    @Test
    void testParsesForecastAndKeepsMissingFieldsNull() {
        server.expect(requestTo(containsString("/forecast?")))
                .andExpect(requestTo(containsString("cnt=16")))
                .andRespond(withSuccess(FORECAST_JSON, MediaType.APPLICATION_JSON));

        List<WeatherObservation> readings = provider.getForecast(26.8467, 80.9462, 2);

        assertEquals(2, readings.size());
        assertEquals("Clouds", readings.get(0).condition());
        assertEquals(LocalDateTime.of(2024, 6, 30, 9, 0), readings.get(0).observedAt());
        assertNull(readings.get(1).humidity());
        assertNull(readings.get(1).windSpeed());
    }

    @Test
    void testServerErrorIsProviderUnavailable() {
        server.expect(requestTo(containsString("/weather?"))).andRespond(withServerError());

        assertThrows(ProviderUnavailableException.class, () -> provider.getCurrent(26.8, 80.9));
    }

    @Test
    void testMissingApiKeyIsProviderUnavailable() {
        properties.setApiKey("");

        ProviderUnavailableException e = assertThrows(ProviderUnavailableException.class,
                () -> provider.getCurrent(26.8, 80.9));
        assertEquals("openweathermap", e.getProvider());
    }
}
