package com.quantbacktest.symphony.domain;


import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Calculator for backtest performance metrics over a daily value series.
 * All results are fractions: a total return of 0.05 means +5%.
 */
public final class PerformanceMetrics {

    public static final int TRADING_DAYS_PER_YEAR = 252;

    private static final double MIN_STDEV = 1e-12;

    private PerformanceMetrics() {
    }

    /**
     * Calculate total return as {@code last / first - 1}.
     */
    public static double calculateTotalReturn(List<Double> values) {
        if (values.size() < 2 || values.get(0) <= 0) {
            return 0.0;
        }
        return values.get(values.size() - 1) / values.get(0) - 1.0;
    }

    /**
     * Simple returns between adjacent values. Pairs starting from a non-positive value are skipped.
     */
    public static List<Double> calculateDailyReturns(List<Double> values) {
        List<Double> returns = new ArrayList<>();
        for (int i = 1; i < values.size(); i++) {
            double previous = values.get(i - 1);
            if (previous > 0) {
                returns.add(values.get(i) / previous - 1.0);
            }
        }
        return returns;
    }

    /**
     * Annualized Sharpe ratio with a zero risk-free rate, using the sample standard deviation.
     * Empty when there are fewer than two returns or the returns have no variance.
     */
    public static OptionalDouble calculateSharpeRatio(List<Double> values) {
        List<Double> returns = calculateDailyReturns(values);
        OptionalDouble stdev = sampleStdev(returns);
        if (stdev.isEmpty() || stdev.getAsDouble() < MIN_STDEV) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(mean(returns) / stdev.getAsDouble() * Math.sqrt(TRADING_DAYS_PER_YEAR));
    }

    /**
     * Annualized volatility of daily returns. Empty with fewer than two returns.
     */
    public static OptionalDouble calculateVolatility(List<Double> values) {
        OptionalDouble stdev = sampleStdev(calculateDailyReturns(values));
        if (stdev.isEmpty()) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(stdev.getAsDouble() * Math.sqrt(TRADING_DAYS_PER_YEAR));
    }

    /**
     * Compound annual growth rate over the {@code n - 1} daily periods spanned by {@code n} values.
     */
    public static double calculateCagr(List<Double> values) {
        if (values.size() < 2 || values.get(0) <= 0) {
            return 0.0;
        }
        double growth = values.get(values.size() - 1) / values.get(0);
        if (growth <= 0) {
            return -1.0;
        }
        return Math.pow(growth, (double) TRADING_DAYS_PER_YEAR / (values.size() - 1)) - 1.0;
    }

    /**
     * Largest decline from a running peak, as a negative fraction (or 0 when the series never falls).
     */
    public static double calculateMaxDrawdown(List<Double> values) {
        double maxDrawdown = 0.0;
        double peak = Double.NEGATIVE_INFINITY;
        for (double value : values) {
            peak = Math.max(peak, value);
            if (peak > 0) {
                maxDrawdown = Math.min(maxDrawdown, (value - peak) / peak);
            }
        }
        return maxDrawdown;
    }

    private static double mean(List<Double> samples) {
        return samples.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
    }

    private static OptionalDouble sampleStdev(List<Double> samples) {
        if (samples.size() < 2) {
            return OptionalDouble.empty();
        }
        double mean = mean(samples);
        double sumSquaredDiff = 0.0;
        for (double sample : samples) {
            sumSquaredDiff += (sample - mean) * (sample - mean);
        }
        return OptionalDouble.of(Math.sqrt(sumSquaredDiff / (samples.size() - 1)));
    }
}
