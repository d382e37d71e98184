package com.quantbacktest.symphony.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.quantbacktest.symphony.controller.dto.BacktestJobResponse;
import com.quantbacktest.symphony.controller.dto.BacktestSubmissionRequest;
import com.quantbacktest.symphony.domain.BacktestJob;
import com.quantbacktest.symphony.domain.BacktestResult;
import com.quantbacktest.symphony.domain.JobStatus;
import com.quantbacktest.symphony.infrastructure.QueueService;
import com.quantbacktest.symphony.repository.BacktestJobRepository;
import com.quantbacktest.symphony.repository.BacktestResultRepository;
import com.quantbacktest.symphony.simulation.SimulationSettings;
import com.quantbacktest.symphony.strategy.Symphony;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.LocalDateTime;
import java.util.HexFormat;
import java.util.Optional;

/**
 * Accepts backtest submissions, deduplicates them by request hash and queues new jobs.
 * Programs are parsed at submission so a corrupt program is rejected before it is queued.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BacktestServiceImpl implements BacktestService {

    private final BacktestJobRepository backtestJobRepository;
    private final BacktestResultRepository backtestResultRepository;
    private final QueueService queueService;
    private final StrategyService strategyService;
    private final SimulationSettings defaultSimulationSettings;
    private final BacktestMetricsService metricsService;
    private final ObjectMapper objectMapper;

    @Override
    @Transactional
    public BacktestJobResponse submitBacktest(BacktestSubmissionRequest request) {
        log.info("Received backtest submission: dialect {}, period {} to {}",
                request.getDialect(), request.getStartDate(), request.getEndDate());

        String idempotencyKey = generateIdempotencyKey(request);
        log.debug("Generated idempotency key: {}", idempotencyKey);

        Optional<BacktestJob> existingJob = backtestJobRepository.findByIdempotencyKey(idempotencyKey);
        if (existingJob.isPresent()) {
            BacktestJob job = existingJob.get();
            log.info("Idempotent request detected for job ID: {} with status: {}",
                    job.getId(), job.getStatus());
            return handleExistingJob(job);
        }

        Symphony symphony = strategyService.parse(request.getDialect(), request.getProgram());
        SimulationSettings settings = resolveSettings(request);

        BacktestJob newJob = createBacktestJob(request, symphony, settings, idempotencyKey);
        BacktestJob savedJob = backtestJobRepository.save(newJob);
        log.info("Created backtest job {} for symphony '{}'", savedJob.getId(), symphony.getName());

        queueService.push(savedJob.getId());
        savedJob.setStatus(JobStatus.QUEUED);
        savedJob.setUpdatedAt(LocalDateTime.now());
        backtestJobRepository.save(savedJob);
        metricsService.recordJobSubmitted();

        log.info("Job {} pushed to queue with status QUEUED", savedJob.getId());

        return BacktestJobResponse.builder()
                .jobId(savedJob.getId())
                .strategyName(savedJob.getStrategyName())
                .status(savedJob.getStatus())
                .message("Job queued successfully")
                .isExisting(false)
                .build();
    }

    @Override
    @Transactional(readOnly = true)
    public BacktestJobResponse getBacktest(Long jobId) {
        BacktestJob job = backtestJobRepository.findById(jobId)
                .orElseThrow(() -> new JobNotFoundException(jobId));
        BacktestJobResponse response = describe(job);
        response.setIsExisting(true);
        return response;
    }

    @Override
    @Transactional(readOnly = true)
    public JsonNode getBacktestReport(Long jobId) {
        BacktestJob job = backtestJobRepository.findById(jobId)
                .orElseThrow(() -> new JobNotFoundException(jobId));
        BacktestResult result = backtestResultRepository.findByJobId(job.getId())
                .filter(r -> r.getResultJson() != null)
                .orElseThrow(() -> new ReportNotFoundException(jobId, job.getStatus()));
        try {
            return objectMapper.readTree(result.getResultJson());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored report for job " + jobId + " is not valid JSON", e);
        }
    }

    /**
     * Respond to a duplicate submission according to the job's current status.
     */
    private BacktestJobResponse handleExistingJob(BacktestJob job) {
        BacktestJobResponse response = describe(job);
        response.setIsExisting(true);
        if (job.getStatus() == JobStatus.COMPLETED && response.getTotalReturn() != null) {
            response.setMessage("Job already completed. Returning cached results.");
        }
        return response;
    }

    private BacktestJobResponse describe(BacktestJob job) {
        BacktestJobResponse.BacktestJobResponseBuilder builder = BacktestJobResponse.builder()
                .jobId(job.getId())
                .strategyName(job.getStrategyName())
                .status(job.getStatus())
                .retryCount(job.getRetryCount());

        return switch (job.getStatus()) {
            case COMPLETED -> {
                Optional<BacktestResult> result = backtestResultRepository.findByJobId(job.getId());
                if (result.isEmpty()) {
                    log.warn("Job {} marked COMPLETED but no result found", job.getId());
                    yield builder.message("Job completed but results not found").build();
                }
                BacktestResult r = result.get();
                yield builder
                        .message("Job completed")
                        .totalReturn(r.getTotalReturn())
                        .cagr(r.getCagr())
                        .volatility(r.getVolatility())
                        .sharpeRatio(r.getSharpeRatio())
                        .maxDrawdown(r.getMaxDrawdown())
                        .finalValue(r.getFinalValue())
                        .totalOrders(r.getTotalOrders())
                        .tradingDays(r.getTradingDays())
                        .skippedDays(r.getSkippedDays())
                        .accuracyPct(r.getAccuracyPct())
                        .build();
            }
            case RUNNING -> builder.message("Job is currently being processed").build();
            case QUEUED -> builder.message("Job is queued and waiting for processing").build();
            case FAILED -> builder
                    .message("Job failed after " + job.getRetryCount() + " attempts")
                    .failureReason(job.getFailureReason())
                    .build();
            case SUBMITTED -> builder.message("Job submitted and awaiting queue placement").build();
        };
    }

    private SimulationSettings resolveSettings(BacktestSubmissionRequest request) {
        SimulationSettings settings = defaultSimulationSettings.toBuilder()
                .initialCapital(request.getInitialCapital().doubleValue())
                .transactionCostPct(orDefault(request.getTransactionCostPct(), defaultSimulationSettings.getTransactionCostPct()))
                .slippagePct(orDefault(request.getSlippagePct(), defaultSimulationSettings.getSlippagePct()))
                .minTradeSize(orDefault(request.getMinTradeSize(), defaultSimulationSettings.getMinTradeSize()))
                .rebalanceFrequencyDays(request.getRebalanceFrequencyDays() != null
                        ? request.getRebalanceFrequencyDays()
                        : defaultSimulationSettings.getRebalanceFrequencyDays())
                .build();
        settings.validate();
        return settings;
    }

    private static double orDefault(BigDecimal value, double fallback) {
        return value != null ? value.doubleValue() : fallback;
    }

    /**
     * Generate SHA-256 hash of the request payload for idempotency.
     */
    private String generateIdempotencyKey(BacktestSubmissionRequest request) {
        try {
            String jsonPayload = objectMapper.writeValueAsString(request);
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(jsonPayload.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize request to JSON", e);
            throw new IllegalStateException("Failed to generate idempotency key", e);
        } catch (NoSuchAlgorithmException e) {
            log.error("SHA-256 algorithm not available", e);
            throw new IllegalStateException("Failed to generate idempotency key", e);
        }
    }

    private BacktestJob createBacktestJob(BacktestSubmissionRequest request, Symphony symphony,
                                          SimulationSettings settings, String idempotencyKey) {
        try {
            return BacktestJob.builder()
                    .strategyName(symphony.getName())
                    .dialect(request.getDialect())
                    .programJson(objectMapper.writeValueAsString(request.getProgram()))
                    .startDate(request.getStartDate())
                    .endDate(request.getEndDate())
                    .settingsJson(objectMapper.writeValueAsString(settings))
                    .groundTruthCsv(request.getGroundTruthCsv())
                    .status(JobStatus.SUBMITTED)
                    .idempotencyKey(idempotencyKey)
                    .retryCount(0)
                    .createdAt(LocalDateTime.now())
                    .updatedAt(LocalDateTime.now())
                    .build();
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize job payload to JSON", e);
            throw new IllegalStateException("Failed to create backtest job", e);
        }
    }
}
