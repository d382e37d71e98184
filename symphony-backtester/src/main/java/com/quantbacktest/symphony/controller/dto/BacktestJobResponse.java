package com.quantbacktest.symphony.controller.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.quantbacktest.symphony.domain.JobStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Job status, plus the result summary once the job has completed.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BacktestJobResponse {

    private Long jobId;
    private String strategyName;
    private JobStatus status;
    private String message;
    private Boolean isExisting;
    private Integer retryCount;
    private String failureReason;

    // Result fields (populated only if status is COMPLETED)
    private BigDecimal totalReturn;
    private BigDecimal cagr;
    private BigDecimal volatility;
    private BigDecimal sharpeRatio;
    private BigDecimal maxDrawdown;
    private BigDecimal finalValue;
    private Integer totalOrders;
    private Integer tradingDays;
    private Integer skippedDays;
    private BigDecimal accuracyPct;
}
