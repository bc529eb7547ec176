package com.retail.storeintel.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Data
@Configuration
@ConfigurationProperties(prefix = "store-intel.weather")
public class WeatherProperties {
    private String apiKey;
    private String baseUrl = "https://api.openweathermap.org/data/2.5";
    private Duration timeout = Duration.ofSeconds(10);
    private Duration ttl = Duration.ofHours(3);
    private Duration retryBackoff = Duration.ofMillis(500);
    private int retentionDays = 30;
    private int forecastDays = 5;
}
