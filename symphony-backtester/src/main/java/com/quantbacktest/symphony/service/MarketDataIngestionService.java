package com.quantbacktest.symphony.service;

import com.quantbacktest.symphony.config.RedisConfig;
import com.quantbacktest.symphony.domain.HistoricalMarketData;
import com.quantbacktest.symphony.marketdata.PriceBar;
import com.quantbacktest.symphony.repository.HistoricalMarketDataRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Ingests daily bars from CSV (Yahoo Finance layout: Date,Open,High,Low,Close[,Adj Close],Volume).
 * Dates already stored for the symbol are left untouched.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MarketDataIngestionService {

    private static final int BATCH_SIZE = 1000;

    private static final DateTimeFormatter[] DATE_FORMATTERS = {
            DateTimeFormatter.ISO_LOCAL_DATE,
            DateTimeFormatter.ofPattern("MM/dd/yyyy"),
            DateTimeFormatter.ofPattern("M/d/yyyy")
    };

    private final HistoricalMarketDataRepository historicalMarketDataRepository;

    /**
     * Ingest CSV content for a symbol.
     *
     * @return number of new bars stored
     */
    @Transactional
    @CacheEvict(value = RedisConfig.PRICE_SERIES_CACHE, allEntries = true)
    public int ingestCsv(String symbol, String csvContent) {
        String normalizedSymbol = symbol.trim().toUpperCase(Locale.ROOT);
        log.info("Starting CSV ingestion for symbol: {}", normalizedSymbol);

        List<HistoricalMarketData> batch = new ArrayList<>();
        Set<LocalDate> seen = new HashSet<>();
        int inserted = 0;
        int rejected = 0;
        boolean firstLine = true;

        for (String rawLine : csvContent.split("\\r?\\n")) {
            String line = rawLine.trim();
            if (line.isEmpty()) {
                continue;
            }
            if (firstLine) {
                firstLine = false;
                if (line.toLowerCase(Locale.ROOT).startsWith("date")) {
                    continue;
                }
            }

            PriceBar bar = parseLine(normalizedSymbol, line);
            if (bar == null) {
                rejected++;
                continue;
            }
            if (!seen.add(bar.getDate())
                    || historicalMarketDataRepository.existsBySymbolAndDate(normalizedSymbol, bar.getDate())) {
                continue;
            }
            batch.add(HistoricalMarketData.fromPriceBar(bar));

            if (batch.size() >= BATCH_SIZE) {
                historicalMarketDataRepository.saveAll(batch);
                inserted += batch.size();
                log.info("Batch inserted {} records for {}", batch.size(), normalizedSymbol);
                batch.clear();
            }
        }

        if (!batch.isEmpty()) {
            historicalMarketDataRepository.saveAll(batch);
            inserted += batch.size();
        }

        if (rejected > 0) {
            log.warn("Rejected {} unparseable lines for {}", rejected, normalizedSymbol);
        }
        log.info("CSV ingestion completed for {}: {} new bars", normalizedSymbol, inserted);
        return inserted;
    }

    public long countRecords(String symbol) {
        return historicalMarketDataRepository.countBySymbol(symbol.trim().toUpperCase(Locale.ROOT));
    }

    /**
     * Parse one CSV row; null when the row cannot be read.
     */
    PriceBar parseLine(String symbol, String line) {
        String[] parts = line.split(",");
        if (parts.length < 6) {
            log.warn("Invalid CSV line format (expected 6+ columns): {}", line);
            return null;
        }
        // with an Adj Close column the volume moves to the seventh position
        String volumeCell = parts.length >= 7 ? parts[6] : parts[5];
        try {
            BigDecimal close = new BigDecimal(parts[4].trim());
            if (close.signum() <= 0) {
                log.warn("Non-positive close in line: {}", line);
                return null;
            }
            return PriceBar.builder()
                    .symbol(symbol)
                    .date(parseDate(parts[0].trim()))
                    .open(new BigDecimal(parts[1].trim()))
                    .high(new BigDecimal(parts[2].trim()))
                    .low(new BigDecimal(parts[3].trim()))
                    .close(close)
                    .volume(Long.parseLong(volumeCell.trim()))
                    .build();
        } catch (NumberFormatException | DateTimeParseException e) {
            log.warn("Failed to parse values from line: {} - Error: {}", line, e.getMessage());
            return null;
        }
    }

    private static LocalDate parseDate(String value) {
        DateTimeParseException last = null;
        for (DateTimeFormatter formatter : DATE_FORMATTERS) {
            try {
                return LocalDate.parse(value, formatter);
            } catch (DateTimeParseException e) {
                last = e;
            }
        }
        throw last;
    }
}
