package com.quantbacktest.symphony.domain;

import com.quantbacktest.symphony.marketdata.PriceBar;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Stored daily bar of a symbol. Closes feed both valuation and indicator precomputation.
 */
@Entity
@Table(name = "historical_market_data", uniqueConstraints = {
        @UniqueConstraint(name = "uk_symbol_date", columnNames = { "symbol", "date" })
}, indexes = {
        @Index(name = "idx_symbol_date", columnList = "symbol, date")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class HistoricalMarketData {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "symbol", nullable = false, length = 20)
    private String symbol;

    @Column(name = "date", nullable = false)
    private LocalDate date;

    @Column(name = "open", precision = 14, scale = 6)
    private BigDecimal open;

    @Column(name = "high", precision = 14, scale = 6)
    private BigDecimal high;

    @Column(name = "low", precision = 14, scale = 6)
    private BigDecimal low;

    @Column(name = "close", nullable = false, precision = 14, scale = 6)
    private BigDecimal close;

    @Column(name = "volume")
    private Long volume;

    public PriceBar toPriceBar() {
        return PriceBar.builder()
                .date(date)
                .symbol(symbol)
                .open(open)
                .high(high)
                .low(low)
                .close(close)
                .volume(volume)
                .build();
    }

    public static HistoricalMarketData fromPriceBar(PriceBar bar) {
        return HistoricalMarketData.builder()
                .symbol(bar.getSymbol())
                .date(bar.getDate())
                .open(bar.getOpen())
                .high(bar.getHigh())
                .low(bar.getLow())
                .close(bar.getClose())
                .volume(bar.getVolume())
                .build();
    }
}
