package com.quantbacktest.symphony.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Entity holding the outcome of a completed backtest job.
 * Metrics are fractions rounded to four places; the valuation series, orders and skipped days
 * are stored in {@code resultJson}.
 */
@Entity
@Table(name = "backtest_results", indexes = {
        @Index(name = "idx_job_id", columnList = "job_id")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BacktestResult {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "job_id", nullable = false, foreignKey = @ForeignKey(name = "fk_result_job"))
    private BacktestJob job;

    @Column(name = "total_return", precision = 12, scale = 4)
    private BigDecimal totalReturn;

    @Column(name = "cagr", precision = 12, scale = 4)
    private BigDecimal cagr;

    @Column(name = "volatility", precision = 12, scale = 4)
    private BigDecimal volatility;

    /** Null when there was not enough variance to compute it. */
    @Column(name = "sharpe_ratio", precision = 12, scale = 4)
    private BigDecimal sharpeRatio;

    @Column(name = "max_drawdown", precision = 12, scale = 4)
    private BigDecimal maxDrawdown;

    @Column(name = "final_value", precision = 18, scale = 4)
    private BigDecimal finalValue;

    @Column(name = "total_orders")
    private Integer totalOrders;

    @Column(name = "trading_days")
    private Integer tradingDays;

    @Column(name = "skipped_days")
    private Integer skippedDays;

    /** Percentage of validated days matching ground truth, null when none was supplied. */
    @Column(name = "accuracy_pct", precision = 7, scale = 4)
    private BigDecimal accuracyPct;

    @Column(name = "execution_time_ms")
    private Long executionTimeMs;

    @Column(name = "result_json", columnDefinition = "TEXT")
    private String resultJson;
}
