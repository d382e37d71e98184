package com.quantbacktest.symphony.strategy;

import lombok.Value;

/**
 * An indicator kind paired with its look-back window.
 */
@Value
public class IndicatorRef implements Comparable<IndicatorRef> {

    IndicatorKind kind;
    int window;

    public IndicatorRef(IndicatorKind kind, int window) {
        if (window < 1) {
            throw new IllegalArgumentException("Indicator window must be positive: " + window);
        }
        this.kind = kind;
        this.window = window;
    }

    public static IndicatorRef rsi(int window) {
        return new IndicatorRef(IndicatorKind.RSI, window);
    }

    public static IndicatorRef movingAverage(int window) {
        return new IndicatorRef(IndicatorKind.MOVING_AVERAGE, window);
    }

    @Override
    public int compareTo(IndicatorRef other) {
        int byKind = kind.compareTo(other.kind);
        return byKind != 0 ? byKind : Integer.compare(window, other.window);
    }

    @Override
    public String toString() {
        return kind.name() + "_" + window;
    }
}
