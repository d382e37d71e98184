package com.quantbacktest.symphony.service;

import com.quantbacktest.symphony.domain.JobStatus;

public class ReportNotFoundException extends RuntimeException {

    public ReportNotFoundException(Long jobId, JobStatus status) {
        super("No report for backtest job " + jobId + " (status " + status + ")");
    }
}
