package com.quantbacktest.symphony.service;

import com.quantbacktest.symphony.domain.BacktestJob;

/**
 * Service interface for executing backtest jobs.
 */
public interface BacktestExecutor {

    /**
     * Execute a backtest job: run the simulation, store the result and update the job status.
     *
     * @param job the backtest job to execute
     */
    void executeBacktest(BacktestJob job);
}
