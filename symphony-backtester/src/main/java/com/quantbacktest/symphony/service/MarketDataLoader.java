package com.quantbacktest.symphony.service;

import com.quantbacktest.symphony.engine.StrategyRequirements;
import com.quantbacktest.symphony.marketdata.InMemoryMarketDataAccessor;
import com.quantbacktest.symphony.marketdata.PriceBar;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Materializes everything a program needs before simulation starts: close series for every
 * required symbol, including indicator warm-up history, and the precomputed indicators.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MarketDataLoader {

    /** Calendar days loaded before the start date on top of the indicator windows. */
    static final int WARMUP_BUFFER_DAYS = 100;

    private final MarketDataService marketDataService;

    public LoadedMarketData load(StrategyRequirements requirements, LocalDate startDate, LocalDate endDate) {
        Set<String> symbols = new TreeSet<>(requirements.getTickers());
        requirements.getIndicatorSymbols().values().forEach(symbols::addAll);

        // windows count trading days; two calendar days per trading day is a safe upper bound
        int maxWindow = requirements.maxWindow().orElse(0);
        LocalDate historyStart = startDate.minusDays(2L * maxWindow + WARMUP_BUFFER_DAYS);

        log.info("Loading {} symbols from {} (warm-up for window {}) to {}",
                symbols.size(), historyStart, maxWindow, endDate);

        Map<String, NavigableMap<LocalDate, Double>> closes = new HashMap<>();
        for (String symbol : symbols) {
            List<PriceBar> bars = marketDataService.loadPriceBars(symbol, historyStart, endDate);
            if (bars.isEmpty()) {
                continue;
            }
            NavigableMap<LocalDate, Double> series = new TreeMap<>();
            for (PriceBar bar : bars) {
                if (bar.getClose() != null) {
                    series.put(bar.getDate(), bar.getClose().doubleValue());
                }
            }
            closes.put(symbol, series);
        }

        InMemoryMarketDataAccessor accessor =
                InMemoryMarketDataAccessor.withIndicators(closes, requirements.getIndicatorSymbols());
        List<LocalDate> tradingDays = accessor.tradingCalendar(symbols, startDate, endDate);
        log.info("Trading calendar has {} days between {} and {}", tradingDays.size(), startDate, endDate);
        return new LoadedMarketData(accessor, tradingDays, closes.keySet());
    }

    @Value
    public static class LoadedMarketData {
        InMemoryMarketDataAccessor accessor;
        List<LocalDate> tradingDays;
        Set<String> symbolsWithData;
    }
}
