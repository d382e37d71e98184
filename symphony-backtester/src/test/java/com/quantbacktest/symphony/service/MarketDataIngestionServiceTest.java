package com.quantbacktest.symphony.service;

import com.quantbacktest.symphony.domain.HistoricalMarketData;
import com.quantbacktest.symphony.marketdata.PriceBar;
import com.quantbacktest.symphony.repository.HistoricalMarketDataRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for MarketDataIngestionService CSV parsing and deduplication.
 */
@ExtendWith(MockitoExtension.class)
class MarketDataIngestionServiceTest {

    @Mock
    private HistoricalMarketDataRepository historicalMarketDataRepository;

    @Captor
    private ArgumentCaptor<List<HistoricalMarketData>> batchCaptor;

    private MarketDataIngestionService ingestionService;

    @BeforeEach
    void setUp() {
        ingestionService = new MarketDataIngestionService(historicalMarketDataRepository);
    }

    @Test
    void testIngestCsv_YahooLayoutWithAdjClose() {
        // Arrange
        String csv = "Date,Open,High,Low,Close,Adj Close,Volume\n"
                + "2024-01-02,470.0,475.5,468.1,472.65,470.1,81964900\n"
                + "2024-01-03,470.4,471.2,466.9,468.79,466.3,103585900\n";

        // Act
        int inserted = ingestionService.ingestCsv("spy", csv);

        // Assert
        assertEquals(2, inserted);
        verify(historicalMarketDataRepository).saveAll(batchCaptor.capture());
        HistoricalMarketData first = batchCaptor.getValue().get(0);
        assertEquals("SPY", first.getSymbol());
        assertEquals(LocalDate.of(2024, 1, 2), first.getDate());
        assertEquals(new BigDecimal("472.65"), first.getClose());
        assertEquals(81964900L, first.getVolume());
    }

    @Test
    void testIngestCsv_ExistingAndDuplicateDatesSkipped() {
        // Arrange
        String csv = "Date,Open,High,Low,Close,Volume\n"
                + "2024-01-02,1,1,1,10,100\n"
                + "2024-01-02,1,1,1,11,100\n"
                + "2024-01-03,1,1,1,12,100\n";
        when(historicalMarketDataRepository.existsBySymbolAndDate("QQQ", LocalDate.of(2024, 1, 2))).thenReturn(false);
        when(historicalMarketDataRepository.existsBySymbolAndDate("QQQ", LocalDate.of(2024, 1, 3))).thenReturn(true);

        // Act
        int inserted = ingestionService.ingestCsv("QQQ", csv);

        // Assert
        assertEquals(1, inserted);
        verify(historicalMarketDataRepository).saveAll(batchCaptor.capture());
        assertEquals(new BigDecimal("10"), batchCaptor.getValue().get(0).getClose());
    }

    @Test
    void testIngestCsv_BadLinesRejected() {
        // Arrange
        String csv = "2024-01-02,1,1,1,10,100\n"
                + "garbage\n"
                + "2024-01-04,1,1,1,-5,100\n"
                + "2024-13-40,1,1,1,10,100\n";

        // Act
        int inserted = ingestionService.ingestCsv("TLT", csv);

        // Assert
        assertEquals(1, inserted, "Only the first line is valid");
    }

    @Test
    void testIngestCsv_LargeFileBatched() {
        // Arrange
        StringBuilder csv = new StringBuilder("Date,Open,High,Low,Close,Volume\n");
        LocalDate date = LocalDate.of(2015, 1, 1);
        for (int i = 0; i < 1500; i++) {
            csv.append(date.plusDays(i)).append(",1,1,1,10,100\n");
        }

        // Act
        int inserted = ingestionService.ingestCsv("BIL", csv.toString());

        // Assert
        assertEquals(1500, inserted);
        verify(historicalMarketDataRepository, times(2)).saveAll(any());
    }

    @Test
    void testIngestCsv_NothingNew_NoSave() {
        // Act
        int inserted = ingestionService.ingestCsv("BIL", "Date,Open,High,Low,Close,Volume\n");

        // Assert
        assertEquals(0, inserted);
        verify(historicalMarketDataRepository, never()).saveAll(any());
    }

    @Test
    void testParseLine_UsDateFormat() {
        // Act
        PriceBar bar = ingestionService.parseLine("SPY", "1/5/2024,1,2,0.5,1.5,42");

        // Assert
        assertNotNull(bar);
        assertEquals(LocalDate.of(2024, 1, 5), bar.getDate());
        assertEquals(42L, bar.getVolume());
    }

    @Test
    void testParseLine_TooFewColumns() {
        assertNull(ingestionService.parseLine("SPY", "2024-01-02,1,2,3"));
    }

    @Test
    void testCountRecords_NormalizesSymbol() {
        // Arrange
        when(historicalMarketDataRepository.countBySymbol("SPY")).thenReturn(252L);

        // Act & Assert
        assertEquals(252L, ingestionService.countRecords(" spy "));
    }
}
