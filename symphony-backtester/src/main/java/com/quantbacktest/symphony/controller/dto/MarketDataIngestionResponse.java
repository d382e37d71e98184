package com.quantbacktest.symphony.controller.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class MarketDataIngestionResponse {

    private String symbol;
    private int inserted;
    private long totalRecords;
}
