package com.quantbacktest.symphony.strategy;

import lombok.Value;

/**
 * Precomputed indicator of a symbol on the evaluation date, e.g. RSI(10) of SPY or
 * the 200-day moving average price of SPY. The window is fixed when the program is parsed.
 */
@Value
public class IndicatorValue implements ValueExpression {

    String symbol;
    IndicatorRef indicator;

    public static IndicatorValue rsi(String symbol, int window) {
        return new IndicatorValue(symbol, IndicatorRef.rsi(window));
    }

    public static IndicatorValue movingAveragePrice(String symbol, int window) {
        return new IndicatorValue(symbol, IndicatorRef.movingAverage(window));
    }

    @Override
    public <R> R accept(ValueExpressionVisitor<R> visitor) {
        return visitor.visitIndicator(this);
    }
}
