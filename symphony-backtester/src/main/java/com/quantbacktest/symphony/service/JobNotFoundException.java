package com.quantbacktest.symphony.service;

public class JobNotFoundException extends RuntimeException {

    public JobNotFoundException(Long jobId) {
        super("Backtest job not found: " + jobId);
    }
}
