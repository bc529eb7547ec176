package com.retail.storeintel.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.ZoneId;

/**
 * Country bounding box for store coordinates and the radius used by the
 * daily proximity recompute. Defaults cover India.
 * {@code zone} is the stores' local time zone; day periods and trading dates use it.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "store-intel.geo")
public class GeoProperties {
    private double minLatitude = 8.4;
    private double maxLatitude = 37.6;
    private double minLongitude = 68.7;
    private double maxLongitude = 97.25;
    private double analysisRadiusKm = 10.0;
    private String zone = "Asia/Kolkata";

    public ZoneId zoneId() {
        return ZoneId.of(zone);
    }

    public boolean contains(double latitude, double longitude) {
        return latitude >= minLatitude && latitude <= maxLatitude
                && longitude >= minLongitude && longitude <= maxLongitude;
    }
}
