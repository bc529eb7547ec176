package com.retail.storeintel.service;

import com.retail.storeintel.dto.*;
import com.retail.storeintel.entity.DayPeriod;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class WeatherImpactAnalyzerTest {

    private static final String STORE = "VM_PAT_001";
    private static final LocalDate DAY = LocalDate.of(2024, 7, 1);

    private TransactionSource source;
    private WeatherImpactAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        source = mock(TransactionSource.class);
        analyzer = new WeatherImpactAnalyzer(source);
    }

    @Test
    void testRainyBucketsBelowAverage() {
        List<WeatherSnapshot> history = List.of(
                snapshot(DAY, DayPeriod.MORNING, "Clear", DataOrigin.PROVIDER),
                snapshot(DAY, DayPeriod.AFTERNOON, "Rain", DataOrigin.PROVIDER),
                snapshot(DAY.plusDays(1), DayPeriod.MORNING, "Clear", DataOrigin.PROVIDER),
                snapshot(DAY.plusDays(1), DayPeriod.AFTERNOON, "Rain", DataOrigin.PROVIDER));
        when(source.fetchSeries(STORE, DAY, DAY.plusDays(1))).thenReturn(List.of(
                sale(DAY, DayPeriod.MORNING, 120),
                sale(DAY, DayPeriod.AFTERNOON, 60),
                sale(DAY.plusDays(1), DayPeriod.MORNING, 140),
                sale(DAY.plusDays(1), DayPeriod.AFTERNOON, 80)));

        WeatherImpact impact = analyzer.analyze(STORE, history).orElseThrow();

        assertEquals("Rain", impact.condition());
        assertEquals(70.0, impact.conditionMean(), 1e-9);
        assertEquals(100.0, impact.overallMean(), 1e-9);
        assertEquals(-30.0, impact.variancePct(), 1e-9);
        assertEquals(2, impact.sampleBuckets());
    }

    @Test
    void testFallbackReadingsAreIgnored() {
        List<WeatherSnapshot> history = List.of(snapshot(DAY, DayPeriod.MORNING, "Clear", DataOrigin.FALLBACK));

        Optional<WeatherImpact> impact = analyzer.analyze(STORE, history);

        assertTrue(impact.isEmpty());
        verifyNoInteractions(source);
    }

    @Test
    void testNoSalesGivesNoImpact() {
        when(source.fetchSeries(STORE, DAY, DAY)).thenReturn(List.of());

        Optional<WeatherImpact> impact = analyzer.analyze(STORE,
                List.of(snapshot(DAY, DayPeriod.MORNING, "Clear", DataOrigin.PROVIDER)));

        assertTrue(impact.isEmpty());
    }

    private static WeatherSnapshot snapshot(LocalDate date, DayPeriod period, String condition, DataOrigin origin) {
        Measurement temperature = origin == DataOrigin.FALLBACK ? Measurement.fallback(28) : Measurement.present(28);
        return new WeatherSnapshot(STORE, date, period, temperature, condition,
                Measurement.absent(), Measurement.absent(), origin, Instant.parse("2024-07-02T00:00:00Z"));
    }

    private static TransactionRecord sale(LocalDate date, DayPeriod period, double value) {
        return new TransactionRecord(date, period, "Apparel", value, null);
    }
}
