package com.retail.storeintel.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Data
@Configuration
@ConfigurationProperties(prefix = "store-intel.scheduler")
public class SchedulerProperties {
    private boolean enabled = true;
    private boolean runOnStartup = true;
    private Duration tickInterval = Duration.ofSeconds(60);
    private Duration weatherCadence = Duration.ofHours(3);
    private Duration proximityCadence = Duration.ofHours(24);
    private Duration trendCadence = Duration.ofHours(24);
    private int workerPoolSize = 4; // bounded to respect the weather provider's rate limits
    private Duration stopTimeout = Duration.ofSeconds(30);
}
