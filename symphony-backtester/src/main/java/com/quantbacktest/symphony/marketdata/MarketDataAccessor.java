package com.quantbacktest.symphony.marketdata;

import com.quantbacktest.symphony.strategy.IndicatorRef;

import java.time.LocalDate;
import java.util.OptionalDouble;

/**
 * Read-only, as-of view over prices and precomputed indicators.
 * A lookup for date D returns the most recent value on or before D, never a later one.
 * Implementations must be safe for concurrent reads.
 */
public interface MarketDataAccessor {

    OptionalDouble close(String symbol, LocalDate date);

    OptionalDouble indicator(String symbol, IndicatorRef indicator, LocalDate date);
}
