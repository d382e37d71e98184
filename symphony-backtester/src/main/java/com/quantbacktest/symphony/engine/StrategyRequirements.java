package com.quantbacktest.symphony.engine;

import com.quantbacktest.symphony.strategy.IndicatorRef;
import lombok.Value;

import java.util.Map;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Data a program needs before it can be evaluated: the tickers to load and, per indicator,
 * the symbols it must be computed for.
 */
@Value
public class StrategyRequirements {

    Set<String> tickers;
    Set<IndicatorRef> indicators;
    Map<IndicatorRef, Set<String>> indicatorSymbols;

    public Set<String> symbolsFor(IndicatorRef indicator) {
        return indicatorSymbols.getOrDefault(indicator, Set.of());
    }

    /**
     * Longest indicator window, used to size the warm-up history.
     */
    public OptionalInt maxWindow() {
        return indicators.stream().mapToInt(IndicatorRef::getWindow).max();
    }
}
