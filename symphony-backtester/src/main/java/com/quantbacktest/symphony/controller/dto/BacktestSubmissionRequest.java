package com.quantbacktest.symphony.controller.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.JsonNode;
import com.quantbacktest.symphony.strategy.parse.ProgramDialect;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Request DTO for submitting a symphony backtest.
 * Unset friction fields fall back to the configured simulation defaults.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BacktestSubmissionRequest {

    @NotNull(message = "Program dialect is required")
    private ProgramDialect dialect;

    /** Nested-array document, Quantmage object, or Lisp source as a string. */
    @NotNull(message = "Program is required")
    private JsonNode program;

    @NotNull(message = "Start date is required")
    @JsonFormat(pattern = "yyyy-MM-dd")
    private LocalDate startDate;

    @NotNull(message = "End date is required")
    @JsonFormat(pattern = "yyyy-MM-dd")
    private LocalDate endDate;

    @NotNull(message = "Initial capital is required")
    @Positive(message = "Initial capital must be positive")
    private BigDecimal initialCapital;

    @PositiveOrZero(message = "Transaction cost must not be negative")
    @DecimalMax(value = "1.0", inclusive = false, message = "Transaction cost must be a fraction below 1")
    private BigDecimal transactionCostPct;

    @PositiveOrZero(message = "Slippage must not be negative")
    @DecimalMax(value = "1.0", inclusive = false, message = "Slippage must be a fraction below 1")
    private BigDecimal slippagePct;

    @PositiveOrZero(message = "Minimum trade size must not be negative")
    private BigDecimal minTradeSize;

    @Positive(message = "Rebalance frequency must be at least one day")
    private Integer rebalanceFrequencyDays;

    /** Optional ground-truth table used for accuracy validation. */
    private String groundTruthCsv;

    /** A JSON {@code null} program arrives as a NullNode, which {@code @NotNull} lets through. */
    @JsonIgnore
    @AssertTrue(message = "Program is required")
    public boolean isProgramPresent() {
        return program == null || !program.isNull();
    }

    @JsonIgnore
    @AssertTrue(message = "End date must not be before start date")
    public boolean isDateRangeValid() {
        return startDate == null || endDate == null || !endDate.isBefore(startDate);
    }
}
