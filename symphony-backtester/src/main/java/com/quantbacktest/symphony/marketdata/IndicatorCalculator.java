package com.quantbacktest.symphony.marketdata;

import com.quantbacktest.symphony.strategy.IndicatorRef;

import java.time.LocalDate;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Queue;
import java.util.TreeMap;

/**
 * Precomputes indicator series from a close-price series.
 * Output series contain no entry for dates still inside the warm-up window.
 */
public final class IndicatorCalculator {

    private IndicatorCalculator() {
    }

    public static NavigableMap<LocalDate, Double> compute(IndicatorRef indicator, NavigableMap<LocalDate, Double> closes) {
        return switch (indicator.getKind()) {
            case RSI -> relativeStrengthIndex(closes, indicator.getWindow());
            case MOVING_AVERAGE -> simpleMovingAverage(closes, indicator.getWindow());
        };
    }

    /**
     * Arithmetic mean of the last {@code window} closes, defined from the window-th close onward.
     */
    public static NavigableMap<LocalDate, Double> simpleMovingAverage(NavigableMap<LocalDate, Double> closes, int window) {
        NavigableMap<LocalDate, Double> result = new TreeMap<>();
        Queue<Double> recent = new ArrayDeque<>(window);
        double sum = 0.0;
        for (Map.Entry<LocalDate, Double> entry : closes.entrySet()) {
            recent.add(entry.getValue());
            sum += entry.getValue();
            if (recent.size() > window) {
                sum -= recent.remove();
            }
            if (recent.size() == window) {
                result.put(entry.getKey(), sum / window);
            }
        }
        return result;
    }

    /**
     * Relative strength index with Wilder smoothing.
     * The first average gain and loss are plain means over {@code window} price changes, so the
     * first value appears at the close following the first {@code window} changes.
     */
    public static NavigableMap<LocalDate, Double> relativeStrengthIndex(NavigableMap<LocalDate, Double> closes, int window) {
        NavigableMap<LocalDate, Double> result = new TreeMap<>();
        List<LocalDate> dates = new ArrayList<>(closes.keySet());
        List<Double> prices = new ArrayList<>(closes.values());
        if (prices.size() <= window) {
            return result;
        }

        double avgGain = 0.0;
        double avgLoss = 0.0;
        for (int i = 1; i <= window; i++) {
            double change = prices.get(i) - prices.get(i - 1);
            avgGain += Math.max(change, 0.0);
            avgLoss += Math.max(-change, 0.0);
        }
        avgGain /= window;
        avgLoss /= window;
        result.put(dates.get(window), rsi(avgGain, avgLoss));

        for (int i = window + 1; i < prices.size(); i++) {
            double change = prices.get(i) - prices.get(i - 1);
            avgGain = (avgGain * (window - 1) + Math.max(change, 0.0)) / window;
            avgLoss = (avgLoss * (window - 1) + Math.max(-change, 0.0)) / window;
            result.put(dates.get(i), rsi(avgGain, avgLoss));
        }
        return result;
    }

    private static double rsi(double avgGain, double avgLoss) {
        if (avgLoss == 0.0) {
            // flat series has no direction
            return avgGain == 0.0 ? 50.0 : 100.0;
        }
        double relativeStrength = avgGain / avgLoss;
        return 100.0 - 100.0 / (1.0 + relativeStrength);
    }
}
