package com.quantbacktest.symphony.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.quantbacktest.symphony.accuracy.GroundTruth;
import com.quantbacktest.symphony.accuracy.GroundTruthCsvLoader;
import com.quantbacktest.symphony.domain.BacktestEngine;
import com.quantbacktest.symphony.domain.BacktestJob;
import com.quantbacktest.symphony.domain.BacktestResult;
import com.quantbacktest.symphony.domain.JobStatus;
import com.quantbacktest.symphony.engine.StaticAnalyzer;
import com.quantbacktest.symphony.engine.StrategyRequirements;
import com.quantbacktest.symphony.infrastructure.QueueService;
import com.quantbacktest.symphony.repository.BacktestJobRepository;
import com.quantbacktest.symphony.repository.BacktestResultRepository;
import com.quantbacktest.symphony.simulation.SimulationSettings;
import com.quantbacktest.symphony.strategy.Symphony;
import com.quantbacktest.symphony.strategy.parse.StrategyParseException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Runs queued backtest jobs.
 *
 * <p>A job is locked, moved to RUNNING, simulated and stored as COMPLETED. Failures are retried
 * through the queue up to {@value #MAX_RETRY_COUNT} times; a program that fails to parse is
 * failed immediately since retrying cannot fix it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BacktestExecutorImpl implements BacktestExecutor {

    static final int MAX_RETRY_COUNT = 3;
    private static final int MAX_FAILURE_REASON_LENGTH = 1000;

    private final BacktestJobRepository backtestJobRepository;
    private final BacktestResultRepository backtestResultRepository;
    private final QueueService queueService;
    private final StrategyService strategyService;
    private final StaticAnalyzer staticAnalyzer;
    private final MarketDataLoader marketDataLoader;
    private final GroundTruthCsvLoader groundTruthCsvLoader;
    private final BacktestEngine backtestEngine;
    private final ObjectMapper objectMapper;
    private final BacktestMetricsService metricsService;

    @Override
    @Transactional(isolation = Isolation.READ_COMMITTED)
    public void executeBacktest(BacktestJob job) {
        MDC.put("jobId", String.valueOf(job.getId()));
        try {
            executeBacktestInternal(job);
        } finally {
            MDC.remove("jobId");
        }
    }

    private void executeBacktestInternal(BacktestJob job) {
        if (job == null || job.getId() == null) {
            log.error("Invalid job: job or job ID is null");
            return;
        }

        long startTime = System.currentTimeMillis();
        if (job.getRetryCount() == 0) {
            log.info("Started");
        } else {
            log.info("Retry {}", job.getRetryCount());
        }

        try {
            // lock so that two workers dequeuing the same id cannot both run it
            BacktestJob lockedJob = backtestJobRepository.findByIdForUpdate(job.getId())
                    .orElseThrow(() -> new IllegalStateException("Job not found: " + job.getId()));

            if (lockedJob.getStatus() == JobStatus.COMPLETED) {
                log.warn("Already COMPLETED. Skipping execution to prevent duplicate processing.");
                return;
            }
            if (lockedJob.getStatus() == JobStatus.RUNNING) {
                log.warn("Already RUNNING by another worker. Skipping duplicate execution.");
                return;
            }

            lockedJob.setStatus(JobStatus.RUNNING);
            lockedJob.setUpdatedAt(LocalDateTime.now());
            backtestJobRepository.save(lockedJob);
            log.info("Status changed to RUNNING");

            BacktestResult result = performBacktest(lockedJob, startTime);
            backtestResultRepository.save(result);
            log.info("Backtest result saved");

            lockedJob.setStatus(JobStatus.COMPLETED);
            lockedJob.setFailureReason(null);
            lockedJob.setUpdatedAt(LocalDateTime.now());
            backtestJobRepository.save(lockedJob);

            long executionTimeMs = System.currentTimeMillis() - startTime;
            log.info("Status changed to COMPLETED in {} ms", executionTimeMs);
            metricsService.recordJobCompleted(executionTimeMs);

        } catch (OptimisticLockingFailureException e) {
            log.warn("Concurrent modification detected (optimistic lock). Job may have been processed by another worker.");
        } catch (StrategyParseException e) {
            log.error("Program rejected ({}): {}", e.getKind(), e.getMessage());
            failPermanently(job, e);
        } catch (RuntimeException e) {
            log.error("Error during execution: {}", e.getMessage(), e);
            handleFailure(job, e);
        }
    }

    private BacktestResult performBacktest(BacktestJob job, long startTime) {
        log.info("Performing backtest - Strategy: {}, Dialect: {}, Period: {} to {}",
                job.getStrategyName(), job.getDialect(), job.getStartDate(), job.getEndDate());

        Symphony symphony = strategyService.parse(job.getDialect(), readJson(job.getProgramJson()));
        SimulationSettings settings = readSettings(job.getSettingsJson());
        StrategyRequirements requirements = staticAnalyzer.analyze(symphony);

        MarketDataLoader.LoadedMarketData data =
                marketDataLoader.load(requirements, job.getStartDate(), job.getEndDate());
        if (data.getTradingDays().isEmpty()) {
            throw new IllegalStateException("No market data available for the specified period");
        }

        GroundTruth groundTruth = job.getGroundTruthCsv() == null || job.getGroundTruthCsv().isBlank()
                ? GroundTruth.empty()
                : groundTruthCsvLoader.parse(job.getGroundTruthCsv());

        BacktestEngine.BacktestReport report = backtestEngine.runBacktest(BacktestEngine.BacktestConfig.builder()
                .symphony(symphony)
                .marketData(data.getAccessor())
                .tradingDays(data.getTradingDays())
                .settings(settings)
                .groundTruth(groundTruth)
                .build());

        if (!report.getSkippedDays().isEmpty()) {
            log.warn("{} days skipped: {}", report.getSkippedDays().size(), report.getSkipReasons());
            metricsService.recordDaysSkipped(report.getSkippedDays().size());
        }

        BacktestEngine.PerformanceSummary summary = report.getSummary();
        return BacktestResult.builder()
                .job(job)
                .totalReturn(scaled(summary.getTotalReturn()))
                .cagr(scaled(summary.getCagr()))
                .volatility(scaled(summary.getVolatility()))
                .sharpeRatio(summary.getSharpeRatio() == null ? null : scaled(summary.getSharpeRatio()))
                .maxDrawdown(scaled(summary.getMaxDrawdown()))
                .finalValue(scaled(summary.getFinalValue()))
                .totalOrders(summary.getTotalOrders())
                .tradingDays(summary.getTradingDays())
                .skippedDays(report.getSkippedDays().size())
                .accuracyPct(report.getAccuracy() == null ? null : scaled(report.getAccuracy().getAccuracyPct()))
                .executionTimeMs(System.currentTimeMillis() - startTime)
                .resultJson(toResultJson(report))
                .build();
    }

    private String toResultJson(BacktestEngine.BacktestReport report) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("valuations", report.getValuations());
        Map<String, Map<String, Double>> selections = new LinkedHashMap<>();
        report.getDailySelections().forEach((date, target) -> selections.put(date.toString(), target.getWeights()));
        payload.put("dailySelections", selections);
        payload.put("orders", report.getOrders());
        payload.put("skippedDays", report.getSkippedDays());
        payload.put("skipReasons", report.getSkipReasons());
        payload.put("finalCash", report.getFinalState().getCash());
        payload.put("finalHoldings", report.getFinalState().getHoldings());
        payload.put("diagnostics", report.getDiagnostics().countByCategory());
        if (report.getAccuracy() != null) {
            payload.put("accuracy", report.getAccuracy());
        }
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize backtest report", e);
        }
    }

    private JsonNode readJson(String json) {
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored program is not valid JSON", e);
        }
    }

    private SimulationSettings readSettings(String settingsJson) {
        try {
            SimulationSettings settings = objectMapper.readValue(settingsJson, SimulationSettings.class);
            settings.validate();
            return settings;
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored simulation settings are not valid JSON", e);
        }
    }

    private static BigDecimal scaled(double value) {
        return BigDecimal.valueOf(value).setScale(4, RoundingMode.HALF_UP);
    }

    /**
     * Requeue the job for another attempt, or fail it once the retry budget is used up.
     */
    private void handleFailure(BacktestJob job, Exception error) {
        String errorMessage = truncate(error);
        BacktestJob lockedJob = backtestJobRepository.findByIdForUpdate(job.getId()).orElse(job);

        lockedJob.setRetryCount(lockedJob.getRetryCount() + 1);
        lockedJob.setFailureReason(errorMessage);
        lockedJob.setUpdatedAt(LocalDateTime.now());

        if (lockedJob.getRetryCount() < MAX_RETRY_COUNT) {
            log.warn("Failed (attempt {}/{}): {}. Requeuing for retry...",
                    lockedJob.getRetryCount(), MAX_RETRY_COUNT, errorMessage);
            lockedJob.setStatus(JobStatus.QUEUED);
            backtestJobRepository.save(lockedJob);

            try {
                queueService.push(lockedJob.getId());
                log.info("Requeued for retry attempt {}", lockedJob.getRetryCount() + 1);
                metricsService.recordJobRetried();
            } catch (RuntimeException queueEx) {
                log.error("Failed to requeue job: {}", queueEx.getMessage(), queueEx);
                lockedJob.setStatus(JobStatus.FAILED);
                backtestJobRepository.save(lockedJob);
                metricsService.recordJobFailed();
            }
        } else {
            log.error("Failed permanently after {} attempts: {}", lockedJob.getRetryCount(), errorMessage);
            log.error("DEAD LETTER QUEUE: Job marked as FAILED and will not be retried");
            lockedJob.setStatus(JobStatus.FAILED);
            backtestJobRepository.save(lockedJob);
            metricsService.recordJobFailed();
        }
    }

    private void failPermanently(BacktestJob job, Exception error) {
        BacktestJob lockedJob = backtestJobRepository.findByIdForUpdate(job.getId()).orElse(job);
        lockedJob.setRetryCount(lockedJob.getRetryCount() + 1);
        lockedJob.setFailureReason(truncate(error));
        lockedJob.setStatus(JobStatus.FAILED);
        lockedJob.setUpdatedAt(LocalDateTime.now());
        backtestJobRepository.save(lockedJob);
        log.info("Status changed to FAILED");
        metricsService.recordJobFailed();
    }

    private static String truncate(Exception error) {
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        if (message.length() > MAX_FAILURE_REASON_LENGTH) {
            message = message.substring(0, MAX_FAILURE_REASON_LENGTH - 3) + "...";
        }
        return message;
    }
}
