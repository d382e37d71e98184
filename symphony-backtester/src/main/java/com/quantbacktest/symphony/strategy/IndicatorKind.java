package com.quantbacktest.symphony.strategy;

/**
 * Precomputed technical indicators the evaluator can reference.
 */
public enum IndicatorKind {
    RSI(10),
    MOVING_AVERAGE(20);

    private final int defaultWindow;

    IndicatorKind(int defaultWindow) {
        this.defaultWindow = defaultWindow;
    }

    /**
     * Window used when a program omits the {@code :window} parameter.
     */
    public int getDefaultWindow() {
        return defaultWindow;
    }
}
