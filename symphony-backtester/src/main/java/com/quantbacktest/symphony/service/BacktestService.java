package com.quantbacktest.symphony.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.quantbacktest.symphony.controller.dto.BacktestJobResponse;
import com.quantbacktest.symphony.controller.dto.BacktestSubmissionRequest;

/**
 * Service interface for backtest job operations.
 */
public interface BacktestService {

    /**
     * Submit a new backtest job or return the existing job for an identical request.
     *
     * @param request the backtest submission request
     * @return the job ID and status, with results when the job already completed
     */
    BacktestJobResponse submitBacktest(BacktestSubmissionRequest request);

    /**
     * Look up a job and its results.
     *
     * @throws JobNotFoundException if no job has the given ID
     */
    BacktestJobResponse getBacktest(Long jobId);

    /**
     * Full stored report of a completed job: valuations, orders, daily selections and skips.
     *
     * @throws JobNotFoundException if no job has the given ID
     * @throws ReportNotFoundException if the job has no stored result yet
     */
    JsonNode getBacktestReport(Long jobId);
}
