package com.retail.storeintel.entity;

import jakarta.persistence.*;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Persisted weather observation for a store and day period.
 * Only provider-sourced observations are stored; they feed the seasonal
 * averages used when the provider is unavailable.
 */
@Entity
@Table(name = "store_weather_data",
       uniqueConstraints = @UniqueConstraint(columnNames = {"storeId", "observedDate", "period"}),
       indexes = {
           @Index(name = "idx_weather_store_month_period", columnList = "storeId,observedMonth,period")
       })
public class StoreWeatherData {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 50)
    private String storeId;

    @Column(nullable = false)
    private LocalDate observedDate;

    @Column(nullable = false)
    private Integer observedMonth; // 1-12, denormalised for seasonal lookups

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private DayPeriod period;

    @Column
    private Double temperatureC;

    @Column(length = 50)
    private String weatherCondition;

    @Column
    private Double humidity; // percent

    @Column
    private Double windSpeed; // km/h

    @Column(nullable = false)
    private LocalDateTime lastUpdated;

    @Column(length = 50)
    private String source = "openweathermap";

    public StoreWeatherData() {
        this.lastUpdated = LocalDateTime.now();
    }

    public StoreWeatherData(String storeId, LocalDate observedDate, DayPeriod period) {
        this.storeId = storeId;
        this.observedDate = observedDate;
        this.observedMonth = observedDate.getMonthValue();
        this.period = period;
        this.lastUpdated = LocalDateTime.now();
    }

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public String getStoreId() {
        return storeId;
    }

    public void setStoreId(String storeId) {
        this.storeId = storeId;
    }

    public LocalDate getObservedDate() {
        return observedDate;
    }

    public void setObservedDate(LocalDate observedDate) {
        this.observedDate = observedDate;
        this.observedMonth = observedDate != null ? observedDate.getMonthValue() : null;
    }

    public Integer getObservedMonth() {
        return observedMonth;
    }

    public DayPeriod getPeriod() {
        return period;
    }

    public void setPeriod(DayPeriod period) {
        this.period = period;
    }

    public Double getTemperatureC() {
        return temperatureC;
    }

    public void setTemperatureC(Double temperatureC) {
        this.temperatureC = temperatureC;
    }

    public String getWeatherCondition() {
        return weatherCondition;
    }

    public void setWeatherCondition(String weatherCondition) {
        this.weatherCondition = weatherCondition;
    }

    public Double getHumidity() {
        return humidity;
    }

    public void setHumidity(Double humidity) {
        this.humidity = humidity;
    }

    public Double getWindSpeed() {
        return windSpeed;
    }

    public void setWindSpeed(Double windSpeed) {
        this.windSpeed = windSpeed;
    }

    public LocalDateTime getLastUpdated() {
        return lastUpdated;
    }

    public void setLastUpdated(LocalDateTime lastUpdated) {
        this.lastUpdated = lastUpdated;
    }

    public String getSource() {
        return source;
    }

    public void setSource(String source) {
        this.source = source;
    }
}
