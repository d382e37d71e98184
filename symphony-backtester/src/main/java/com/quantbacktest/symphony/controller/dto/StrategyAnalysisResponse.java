package com.quantbacktest.symphony.controller.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Set;

/**
 * Tickers and indicators a program needs.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class StrategyAnalysisResponse {

    private String name;
    private Set<String> tickers;
    private List<IndicatorRequirement> indicators;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class IndicatorRequirement {
        private String kind;
        private int window;
        private Set<String> symbols;
    }
}
