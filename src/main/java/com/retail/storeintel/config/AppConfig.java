package com.retail.storeintel.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;

/**
 * Shared infrastructure beans.
 * The weather provider's RestTemplate carries the configured timeout so a slow
 * provider surfaces as a failure instead of blocking a refresh indefinitely.
 */
@Configuration
public class AppConfig {

    @Bean
    public RestTemplate weatherRestTemplate(RestTemplateBuilder builder, WeatherProperties properties) {
        return builder
                .setConnectTimeout(properties.getTimeout())
                .setReadTimeout(properties.getTimeout())
                .build();
    }

    @Bean
    public Clock clock(GeoProperties geoProperties) {
        return Clock.system(geoProperties.zoneId());
    }
}
