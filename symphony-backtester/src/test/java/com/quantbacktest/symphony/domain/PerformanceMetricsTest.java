package com.quantbacktest.symphony.domain;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.OptionalDouble;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for PerformanceMetrics calculations.
 */
class PerformanceMetricsTest {

    @Test
    void testCalculateTotalReturn_WithProfit() {
        double totalReturn = PerformanceMetrics.calculateTotalReturn(Arrays.asList(10_000.0, 11_000.0, 12_000.0));

        assertEquals(0.20, totalReturn, 1e-12);
    }

    @Test
    void testCalculateTotalReturn_WithLoss() {
        double totalReturn = PerformanceMetrics.calculateTotalReturn(Arrays.asList(10_000.0, 8_000.0));

        assertEquals(-0.20, totalReturn, 1e-12);
    }

    @Test
    void testCalculateTotalReturn_SingleValue() {
        assertEquals(0.0, PerformanceMetrics.calculateTotalReturn(Collections.singletonList(10_000.0)));
        assertEquals(0.0, PerformanceMetrics.calculateTotalReturn(Collections.emptyList()));
    }

    @Test
    void testCalculateDailyReturns_SkipsNonPositiveBase() {
        List<Double> returns = PerformanceMetrics.calculateDailyReturns(Arrays.asList(100.0, 110.0, 0.0, 50.0));

        assertEquals(2, returns.size());
        assertEquals(0.10, returns.get(0), 1e-12);
        assertEquals(-1.0, returns.get(1), 1e-12);
    }

    @Test
    void testCalculateSharpeRatio_UsesSampleStdev() {
        // Arrange - daily returns of exactly 1% and 2%
        List<Double> values = Arrays.asList(100.0, 101.0, 101.0 * 1.02);
        double expected = 0.015 / Math.sqrt(0.00005) * Math.sqrt(252);

        // Act
        OptionalDouble sharpe = PerformanceMetrics.calculateSharpeRatio(values);

        // Assert
        assertTrue(sharpe.isPresent());
        assertEquals(expected, sharpe.getAsDouble(), 1e-6);
    }

    @Test
    void testCalculateSharpeRatio_ConstantSeriesIsUndefined() {
        List<Double> values = Collections.nCopies(30, 100_000.0);

        assertTrue(PerformanceMetrics.calculateSharpeRatio(values).isEmpty(),
                "Zero variance should leave Sharpe undefined rather than infinite");
    }

    @Test
    void testCalculateSharpeRatio_TooFewValues() {
        assertTrue(PerformanceMetrics.calculateSharpeRatio(Arrays.asList(100.0, 105.0)).isEmpty());
        assertTrue(PerformanceMetrics.calculateSharpeRatio(Collections.singletonList(100.0)).isEmpty());
    }

    @Test
    void testCalculateSharpeRatio_NegativeForLosingSeries() {
        List<Double> values = Arrays.asList(100.0, 98.0, 97.0, 94.0, 93.5);

        OptionalDouble sharpe = PerformanceMetrics.calculateSharpeRatio(values);

        assertTrue(sharpe.isPresent());
        assertTrue(sharpe.getAsDouble() < 0);
    }

    @Test
    void testCalculateVolatility_Annualized() {
        List<Double> values = Arrays.asList(100.0, 101.0, 101.0 * 1.02);

        OptionalDouble volatility = PerformanceMetrics.calculateVolatility(values);

        assertTrue(volatility.isPresent());
        assertEquals(Math.sqrt(0.00005) * Math.sqrt(252), volatility.getAsDouble(), 1e-9);
    }

    @Test
    void testCalculateCagr_OneYearOfValues() {
        // Arrange - 253 daily values span 252 daily returns, growing 10% overall
        List<Double> values = new ArrayList<>(Collections.nCopies(252, 100.0));
        values.add(110.0);

        // Act
        double cagr = PerformanceMetrics.calculateCagr(values);

        // Assert
        assertEquals(0.10, cagr, 1e-9);
    }

    @Test
    void testCalculateCagr_HalfYearAnnualized() {
        // Arrange - 127 values span 126 daily returns
        List<Double> values = new ArrayList<>(Collections.nCopies(126, 100.0));
        values.add(105.0);

        // Act
        double cagr = PerformanceMetrics.calculateCagr(values);

        // Assert
        assertEquals(Math.pow(1.05, 2.0) - 1.0, cagr, 1e-9);
    }

    @Test
    void testCalculateCagr_TotalLoss() {
        assertEquals(-1.0, PerformanceMetrics.calculateCagr(Arrays.asList(100.0, 50.0, 0.0)), 1e-12);
    }

    @Test
    void testCalculateMaxDrawdown_PeakToTrough() {
        List<Double> values = Arrays.asList(100.0, 120.0, 90.0, 130.0, 110.0);

        double maxDrawdown = PerformanceMetrics.calculateMaxDrawdown(values);

        assertEquals(-0.25, maxDrawdown, 1e-12);
    }

    @Test
    void testCalculateMaxDrawdown_MonotonicIncrease() {
        List<Double> values = Arrays.asList(100.0, 101.0, 102.5, 110.0);

        assertEquals(0.0, PerformanceMetrics.calculateMaxDrawdown(values));
    }

    @Test
    void testCalculateMaxDrawdown_EmptySeries() {
        assertEquals(0.0, PerformanceMetrics.calculateMaxDrawdown(Collections.emptyList()));
    }
}
