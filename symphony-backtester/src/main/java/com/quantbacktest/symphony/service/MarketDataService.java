package com.quantbacktest.symphony.service;

import com.quantbacktest.symphony.config.RedisConfig;
import com.quantbacktest.symphony.domain.HistoricalMarketData;
import com.quantbacktest.symphony.marketdata.PriceBar;
import com.quantbacktest.symphony.repository.HistoricalMarketDataRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.stream.Collectors;

/**
 * Loads stored daily bars per symbol, cached in Redis.
 * When enabled, a symbol with no stored history gets a deterministic synthetic series instead.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MarketDataService {

    private final HistoricalMarketDataRepository historicalMarketDataRepository;

    @Value("${backtest.market-data.synthetic-fallback:false}")
    private boolean syntheticFallback;

    /**
     * Load bars for the given symbol and date range, oldest first.
     * Returns an empty list when nothing is stored and synthetic fallback is off.
     */
    @Cacheable(value = RedisConfig.PRICE_SERIES_CACHE, key = "#symbol + '_' + #startDate + '_' + #endDate",
            unless = "#result.isEmpty()")
    public List<PriceBar> loadPriceBars(String symbol, LocalDate startDate, LocalDate endDate) {
        log.info("Loading price history for {} from {} to {}", symbol, startDate, endDate);

        List<HistoricalMarketData> historicalData = historicalMarketDataRepository
                .findBySymbolAndDateRange(symbol, startDate, endDate);

        if (!historicalData.isEmpty()) {
            log.info("Loaded {} bars for {} from database", historicalData.size(), symbol);
            return historicalData.stream()
                    .map(HistoricalMarketData::toPriceBar)
                    .collect(Collectors.toList());
        }

        if (!syntheticFallback) {
            log.warn("No price history stored for {} between {} and {}", symbol, startDate, endDate);
            return new ArrayList<>();
        }

        log.warn("No price history stored for {}. Generating synthetic bars.", symbol);
        List<PriceBar> syntheticData = generateSyntheticData(symbol, startDate, endDate);
        log.info("Generated {} synthetic bars for {}", syntheticData.size(), symbol);
        return syntheticData;
    }

    /**
     * Random walk on weekdays, seeded by the symbol so each symbol gets its own repeatable path.
     */
    List<PriceBar> generateSyntheticData(String symbol, LocalDate startDate, LocalDate endDate) {
        List<PriceBar> data = new ArrayList<>();
        Random random = new Random(42L ^ symbol.hashCode());

        BigDecimal price = new BigDecimal("100.00");
        LocalDate currentDate = startDate;

        while (!currentDate.isAfter(endDate)) {
            DayOfWeek day = currentDate.getDayOfWeek();
            if (day != DayOfWeek.SATURDAY && day != DayOfWeek.SUNDAY) {
                double changePercent = (random.nextGaussian() * 0.02) + 0.0003;
                price = price.add(price.multiply(BigDecimal.valueOf(changePercent)));
                if (price.compareTo(BigDecimal.ONE) < 0) {
                    price = BigDecimal.ONE;
                }

                BigDecimal high = price.multiply(BigDecimal.valueOf(1 + Math.abs(random.nextGaussian()) * 0.01));
                BigDecimal low = price.multiply(BigDecimal.valueOf(1 - Math.abs(random.nextGaussian()) * 0.01));

                data.add(PriceBar.builder()
                        .date(currentDate)
                        .symbol(symbol)
                        .open(price.setScale(2, RoundingMode.HALF_UP))
                        .high(high.setScale(2, RoundingMode.HALF_UP))
                        .low(low.setScale(2, RoundingMode.HALF_UP))
                        .close(price.setScale(2, RoundingMode.HALF_UP))
                        .volume((long) (1_000_000 + random.nextInt(500_000)))
                        .build());
            }
            currentDate = currentDate.plusDays(1);
        }

        return data;
    }
}
