package com.quantbacktest.symphony.marketdata;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * One daily OHLCV bar of a symbol.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PriceBar {

    private LocalDate date;
    private String symbol;
    private BigDecimal open;
    private BigDecimal high;
    private BigDecimal low;
    private BigDecimal close;
    private Long volume;
}
