package com.quantbacktest.symphony.domain;

import com.quantbacktest.symphony.accuracy.AccuracyReport;
import com.quantbacktest.symphony.accuracy.AccuracyValidator;
import com.quantbacktest.symphony.accuracy.GroundTruth;
import com.quantbacktest.symphony.engine.EvaluationErrorKind;
import com.quantbacktest.symphony.engine.EvaluationException;
import com.quantbacktest.symphony.engine.RunDiagnostics;
import com.quantbacktest.symphony.engine.StrategyEvaluator;
import com.quantbacktest.symphony.engine.TargetAllocation;
import com.quantbacktest.symphony.marketdata.MarketDataAccessor;
import com.quantbacktest.symphony.simulation.DailyValuation;
import com.quantbacktest.symphony.simulation.ExecutedOrder;
import com.quantbacktest.symphony.simulation.PortfolioSimulator;
import com.quantbacktest.symphony.simulation.PortfolioState;
import com.quantbacktest.symphony.simulation.SimulationSettings;
import com.quantbacktest.symphony.strategy.Symphony;
import lombok.Builder;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Core backtesting engine: evaluates a symphony on every trading day and feeds the
 * resulting targets to a {@link PortfolioSimulator}.
 *
 * <p>Days are processed strictly in date order. A day whose evaluation fails with missing data or a
 * malformed expression is skipped (valued, not traded); any other failure aborts the run.
 */
@Slf4j
public class BacktestEngine {

    private final StrategyEvaluator evaluator;
    private final AccuracyValidator accuracyValidator;

    public BacktestEngine() {
        this(new StrategyEvaluator(), new AccuracyValidator());
    }

    public BacktestEngine(StrategyEvaluator evaluator, AccuracyValidator accuracyValidator) {
        this.evaluator = evaluator;
        this.accuracyValidator = accuracyValidator;
    }

    /**
     * Run a backtest with the given parameters.
     */
    public BacktestReport runBacktest(BacktestConfig config) {
        List<LocalDate> tradingDays = new ArrayList<>(new TreeSet<>(config.getTradingDays()));
        if (tradingDays.isEmpty()) {
            throw new IllegalStateException("No trading days available for " + config.getSymphony().getName());
        }

        log.info("Starting backtest - Strategy: {}, Trading days: {} ({} to {})",
                config.getSymphony().getName(), tradingDays.size(),
                tradingDays.get(0), tradingDays.get(tradingDays.size() - 1));

        RunDiagnostics diagnostics = new RunDiagnostics();
        PortfolioSimulator simulator = new PortfolioSimulator(config.getSettings(), config.getMarketData(), diagnostics);
        Map<LocalDate, TargetAllocation> dailySelections = new LinkedHashMap<>();
        List<SkippedDay> skippedDays = new ArrayList<>();

        for (LocalDate date : tradingDays) {
            TargetAllocation target;
            try {
                target = evaluator.evaluate(config.getSymphony().getRoot(), date, config.getMarketData(), diagnostics);
            } catch (EvaluationException e) {
                if (!e.isRecoverable()) {
                    throw e;
                }
                log.warn("SKIP {}: could not evaluate strategy ({}): {}", date, e.getKind(), e.getMessage());
                diagnostics.record(date, RunDiagnostics.DAY_SKIPPED, e.getMessage());
                skippedDays.add(new SkippedDay(date, e.getKind(), e.getSymbol(), e.getMessage()));
                simulator.recordSkippedDay(date);
                continue;
            }

            dailySelections.put(date, target);
            simulator.step(date, target);
        }

        List<Double> values = simulator.getValuations().stream()
                .map(DailyValuation::getValue)
                .collect(Collectors.toList());
        PerformanceSummary summary = summarize(config.getSettings(), values, simulator.getOrders().size());

        AccuracyReport accuracy = null;
        GroundTruth groundTruth = config.getGroundTruth();
        if (groundTruth != null && !groundTruth.isEmpty()) {
            accuracy = accuracyValidator.validate(dailySelections, groundTruth);
        }

        Map<EvaluationErrorKind, Integer> skipReasons = new EnumMap<>(EvaluationErrorKind.class);
        skippedDays.forEach(day -> skipReasons.merge(day.getReason(), 1, Integer::sum));

        log.info("Backtest completed - Total Return: {}, CAGR: {}, Volatility: {}, Sharpe: {}, Max DD: {}, " +
                        "Orders: {}, Skipped days: {}",
                summary.getTotalReturn(), summary.getCagr(), summary.getVolatility(),
                summary.getSharpeRatio() == null ? "n/a" : summary.getSharpeRatio(),
                summary.getMaxDrawdown(), summary.getTotalOrders(), skippedDays.size());

        return BacktestReport.builder()
                .strategyName(config.getSymphony().getName())
                .summary(summary)
                .valuations(simulator.getValuations())
                .orders(simulator.getOrders())
                .dailySelections(dailySelections)
                .skippedDays(skippedDays)
                .skipReasons(skipReasons)
                .accuracy(accuracy)
                .diagnostics(diagnostics)
                .finalState(simulator.getState())
                .build();
    }

    private static PerformanceSummary summarize(SimulationSettings settings, List<Double> values, int orderCount) {
        OptionalDouble sharpe = PerformanceMetrics.calculateSharpeRatio(values);
        OptionalDouble volatility = PerformanceMetrics.calculateVolatility(values);
        return PerformanceSummary.builder()
                .initialCapital(settings.getInitialCapital())
                .finalValue(values.isEmpty() ? settings.getInitialCapital() : values.get(values.size() - 1))
                .totalReturn(PerformanceMetrics.calculateTotalReturn(values))
                .cagr(PerformanceMetrics.calculateCagr(values))
                .volatility(volatility.isPresent() ? volatility.getAsDouble() : 0.0)
                .sharpeRatio(sharpe.isPresent() ? sharpe.getAsDouble() : null)
                .maxDrawdown(PerformanceMetrics.calculateMaxDrawdown(values))
                .totalOrders(orderCount)
                .tradingDays(values.size())
                .build();
    }

    /**
     * Configuration for a backtest run.
     */
    @Data
    @Builder
    public static class BacktestConfig {
        private Symphony symphony;
        private MarketDataAccessor marketData;
        private List<LocalDate> tradingDays;
        private SimulationSettings settings;
        /** Optional; accuracy is only reported when present and non-empty. */
        private GroundTruth groundTruth;
    }

    /**
     * Summary metrics of a run.
     */
    @Data
    @Builder
    public static class PerformanceSummary {
        private double initialCapital;
        private double finalValue;
        private double totalReturn;
        private double cagr;
        private double volatility;
        /** Null when the Sharpe ratio is unavailable. */
        private Double sharpeRatio;
        private double maxDrawdown;
        private int totalOrders;
        private int tradingDays;
    }

    /**
     * Result of a backtest run.
     */
    @Data
    @Builder
    public static class BacktestReport {
        private String strategyName;
        private PerformanceSummary summary;
        private List<DailyValuation> valuations;
        private List<ExecutedOrder> orders;
        private Map<LocalDate, TargetAllocation> dailySelections;
        private List<SkippedDay> skippedDays;
        private Map<EvaluationErrorKind, Integer> skipReasons;
        private AccuracyReport accuracy;
        private RunDiagnostics diagnostics;
        private PortfolioState finalState;
    }
}
