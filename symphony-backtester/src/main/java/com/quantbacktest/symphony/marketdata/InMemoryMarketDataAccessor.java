package com.quantbacktest.symphony.marketdata;

import com.quantbacktest.symphony.strategy.IndicatorRef;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.NavigableSet;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * {@link MarketDataAccessor} over series held in memory.
 * Series are populated before a run starts and only read afterwards, so concurrent lookups are safe.
 */
@Slf4j
public class InMemoryMarketDataAccessor implements MarketDataAccessor {

    private final Map<String, NavigableMap<LocalDate, Double>> closes = new HashMap<>();
    private final Map<String, Map<IndicatorRef, NavigableMap<LocalDate, Double>>> indicators = new HashMap<>();

    /**
     * Builds an accessor from close series and computes every requested indicator for its symbols.
     */
    public static InMemoryMarketDataAccessor withIndicators(Map<String, NavigableMap<LocalDate, Double>> closeSeries,
                                                            Map<IndicatorRef, Set<String>> indicatorSymbols) {
        InMemoryMarketDataAccessor accessor = new InMemoryMarketDataAccessor();
        closeSeries.forEach(accessor::putCloses);
        indicatorSymbols.forEach((indicator, symbols) -> {
            for (String symbol : symbols) {
                NavigableMap<LocalDate, Double> series = closeSeries.get(symbol);
                if (series == null) {
                    log.warn("Cannot compute {} for {}: no price history", indicator, symbol);
                    continue;
                }
                accessor.putIndicator(symbol, indicator, IndicatorCalculator.compute(indicator, series));
            }
        });
        return accessor;
    }

    public InMemoryMarketDataAccessor putCloses(String symbol, NavigableMap<LocalDate, Double> series) {
        closes.put(symbol, Collections.unmodifiableNavigableMap(new TreeMap<>(series)));
        return this;
    }

    public InMemoryMarketDataAccessor putIndicator(String symbol, IndicatorRef indicator,
                                                   NavigableMap<LocalDate, Double> series) {
        indicators.computeIfAbsent(symbol, key -> new HashMap<>())
                .put(indicator, Collections.unmodifiableNavigableMap(new TreeMap<>(series)));
        return this;
    }

    @Override
    public OptionalDouble close(String symbol, LocalDate date) {
        return asOf(closes.get(symbol), date);
    }

    @Override
    public OptionalDouble indicator(String symbol, IndicatorRef indicator, LocalDate date) {
        Map<IndicatorRef, NavigableMap<LocalDate, Double>> bySymbol = indicators.get(symbol);
        return asOf(bySymbol == null ? null : bySymbol.get(indicator), date);
    }

    public boolean hasPrices(String symbol) {
        return closes.containsKey(symbol);
    }

    /**
     * Dates in {@code [start, end]} on which every listed symbol that has price history has a close.
     * Symbols without any history are left out of the intersection.
     */
    public List<LocalDate> tradingCalendar(Collection<String> symbols, LocalDate start, LocalDate end) {
        NavigableSet<LocalDate> calendar = null;
        for (String symbol : symbols) {
            NavigableMap<LocalDate, Double> series = closes.get(symbol);
            if (series == null) {
                log.warn("Symbol {} has no price history and is excluded from the trading calendar", symbol);
                continue;
            }
            NavigableSet<LocalDate> dates = new TreeSet<>(series.subMap(start, true, end, true).keySet());
            if (calendar == null) {
                calendar = dates;
            } else {
                calendar.retainAll(dates);
            }
        }
        return calendar == null ? List.of() : new ArrayList<>(calendar);
    }

    private static OptionalDouble asOf(NavigableMap<LocalDate, Double> series, LocalDate date) {
        if (series == null) {
            return OptionalDouble.empty();
        }
        Map.Entry<LocalDate, Double> entry = series.floorEntry(date);
        return entry == null ? OptionalDouble.empty() : OptionalDouble.of(entry.getValue());
    }
}
