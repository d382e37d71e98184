package com.quantbacktest.symphony.service;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for BacktestMetricsService.
 */
class BacktestMetricsServiceTest {

    private SimpleMeterRegistry meterRegistry;
    private BacktestMetricsService metricsService;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        metricsService = new BacktestMetricsService(meterRegistry);
    }

    @Test
    void testCounters_Increment() {
        // Act
        metricsService.recordJobSubmitted();
        metricsService.recordJobSubmitted();
        metricsService.recordJobRetried();
        metricsService.recordJobFailed();
        metricsService.recordDaysSkipped(4);

        // Assert
        assertEquals(2.0, meterRegistry.get("backtest.jobs.submitted").counter().count());
        assertEquals(1.0, meterRegistry.get("backtest.jobs.retried").counter().count());
        assertEquals(1.0, meterRegistry.get("backtest.jobs.failed").counter().count());
        assertEquals(4.0, meterRegistry.get("backtest.days.skipped").counter().count());
    }

    @Test
    void testRecordJobCompleted_RecordsExecutionTime() {
        // Act
        metricsService.recordJobCompleted(1500);

        // Assert
        assertEquals(1.0, meterRegistry.get("backtest.jobs.completed").counter().count());
        assertEquals(1L, meterRegistry.get("backtest.execution.time").timer().count());
        assertEquals(1.5, meterRegistry.get("backtest.execution.time").timer().totalTime(TimeUnit.SECONDS), 1e-9);
    }

    @Test
    void testGetMetricsSummary() {
        // Arrange
        metricsService.recordJobSubmitted();
        metricsService.recordDaysSkipped(2);

        // Act
        String summary = metricsService.getMetricsSummary();

        // Assert
        assertTrue(summary.contains("Submitted=1"));
        assertTrue(summary.contains("DaysSkipped=2"));
        assertTrue(summary.contains("Failed=0"));
    }
}
