package com.quantbacktest.symphony.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.util.concurrent.TimeUnit;

/**
 * Micrometer counters and timers for backtest jobs, exposed through Actuator.
 */
@Service
public class BacktestMetricsService {

    private final Counter jobsSubmittedCounter;
    private final Counter jobsCompletedCounter;
    private final Counter jobsFailedCounter;
    private final Counter jobsRetriedCounter;
    private final Counter daysSkippedCounter;
    private final Timer executionTimer;

    public BacktestMetricsService(MeterRegistry meterRegistry) {
        this.jobsSubmittedCounter = Counter.builder("backtest.jobs.submitted")
                .description("Total number of backtest jobs submitted")
                .register(meterRegistry);

        this.jobsCompletedCounter = Counter.builder("backtest.jobs.completed")
                .description("Total number of backtest jobs completed successfully")
                .register(meterRegistry);

        this.jobsFailedCounter = Counter.builder("backtest.jobs.failed")
                .description("Total number of backtest jobs failed permanently")
                .register(meterRegistry);

        this.jobsRetriedCounter = Counter.builder("backtest.jobs.retried")
                .description("Total number of backtest job retry attempts")
                .register(meterRegistry);

        this.daysSkippedCounter = Counter.builder("backtest.days.skipped")
                .description("Simulated days on which the strategy could not be evaluated")
                .register(meterRegistry);

        this.executionTimer = Timer.builder("backtest.execution.time")
                .description("Backtest job execution time")
                .register(meterRegistry);
    }

    public void recordJobSubmitted() {
        jobsSubmittedCounter.increment();
    }

    public void recordJobCompleted(long executionTimeMs) {
        jobsCompletedCounter.increment();
        executionTimer.record(executionTimeMs, TimeUnit.MILLISECONDS);
    }

    public void recordJobFailed() {
        jobsFailedCounter.increment();
    }

    public void recordJobRetried() {
        jobsRetriedCounter.increment();
    }

    public void recordDaysSkipped(int days) {
        daysSkippedCounter.increment(days);
    }

    /**
     * One-line summary for logs.
     */
    public String getMetricsSummary() {
        return String.format("Metrics: Submitted=%d, Completed=%d, Failed=%d, Retried=%d, DaysSkipped=%d, AvgExecTime=%.2fs",
                (long) jobsSubmittedCounter.count(),
                (long) jobsCompletedCounter.count(),
                (long) jobsFailedCounter.count(),
                (long) jobsRetriedCounter.count(),
                (long) daysSkippedCounter.count(),
                executionTimer.mean(TimeUnit.SECONDS));
    }
}
