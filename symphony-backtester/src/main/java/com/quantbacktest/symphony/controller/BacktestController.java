package com.quantbacktest.symphony.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.quantbacktest.symphony.controller.dto.BacktestJobResponse;
import com.quantbacktest.symphony.controller.dto.BacktestSubmissionRequest;
import com.quantbacktest.symphony.service.BacktestService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST controller for backtest job operations.
 */
@RestController
@RequestMapping("/backtests")
@RequiredArgsConstructor
@Slf4j
public class BacktestController {

    private final BacktestService backtestService;

    /**
     * Submit a new backtest job.
     *
     * @param request the backtest submission request
     * @return the job ID and status
     */
    @PostMapping
    public ResponseEntity<BacktestJobResponse> submitBacktest(
            @Valid @RequestBody BacktestSubmissionRequest request) {

        log.info("POST /backtests - Dialect: {}, Period: {} to {}",
                request.getDialect(), request.getStartDate(), request.getEndDate());

        BacktestJobResponse response = backtestService.submitBacktest(request);

        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    /**
     * Get the status and, once completed, the results of a backtest job.
     */
    @GetMapping("/{jobId}")
    public ResponseEntity<BacktestJobResponse> getBacktest(@PathVariable Long jobId) {
        log.info("GET /backtests/{}", jobId);
        return ResponseEntity.ok(backtestService.getBacktest(jobId));
    }

    /**
     * Get the stored report of a completed job, including the per-day target allocations.
     */
    @GetMapping("/{jobId}/report")
    public ResponseEntity<JsonNode> getBacktestReport(@PathVariable Long jobId) {
        log.info("GET /backtests/{}/report", jobId);
        return ResponseEntity.ok(backtestService.getBacktestReport(jobId));
    }
}
