package com.quantbacktest.symphony.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.quantbacktest.symphony.accuracy.AccuracyValidator;
import com.quantbacktest.symphony.accuracy.GroundTruthCsvLoader;
import com.quantbacktest.symphony.domain.BacktestEngine;
import com.quantbacktest.symphony.engine.StaticAnalyzer;
import com.quantbacktest.symphony.engine.StrategyEvaluator;
import com.quantbacktest.symphony.simulation.SimulationSettings;
import com.quantbacktest.symphony.strategy.parse.LispSymphonyReader;
import com.quantbacktest.symphony.strategy.parse.QuantmageNormalizer;
import com.quantbacktest.symphony.strategy.parse.SymphonyParser;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the framework-free strategy engine into the application context.
 */
@Configuration
public class StrategyEngineConfig {

    @Value("${backtest.simulation.initial-capital:100000}")
    private double initialCapital;

    @Value("${backtest.simulation.transaction-cost-pct:0}")
    private double transactionCostPct;

    @Value("${backtest.simulation.slippage-pct:0}")
    private double slippagePct;

    @Value("${backtest.simulation.min-trade-size:0}")
    private double minTradeSize;

    @Value("${backtest.simulation.rebalance-frequency-days:1}")
    private int rebalanceFrequencyDays;

    /**
     * Settings applied where a submitted job leaves a value unset.
     */
    @Bean
    public SimulationSettings defaultSimulationSettings() {
        SimulationSettings settings = SimulationSettings.builder()
                .initialCapital(initialCapital)
                .transactionCostPct(transactionCostPct)
                .slippagePct(slippagePct)
                .minTradeSize(minTradeSize)
                .rebalanceFrequencyDays(rebalanceFrequencyDays)
                .build();
        settings.validate();
        return settings;
    }

    @Bean
    public SymphonyParser symphonyParser(ObjectMapper objectMapper) {
        return new SymphonyParser(objectMapper);
    }

    @Bean
    public LispSymphonyReader lispSymphonyReader() {
        return new LispSymphonyReader();
    }

    @Bean
    public QuantmageNormalizer quantmageNormalizer() {
        return new QuantmageNormalizer();
    }

    @Bean
    public StaticAnalyzer staticAnalyzer() {
        return new StaticAnalyzer();
    }

    @Bean
    public StrategyEvaluator strategyEvaluator() {
        return new StrategyEvaluator();
    }

    @Bean
    public GroundTruthCsvLoader groundTruthCsvLoader() {
        return new GroundTruthCsvLoader();
    }

    @Bean
    public BacktestEngine backtestEngine(StrategyEvaluator strategyEvaluator) {
        return new BacktestEngine(strategyEvaluator, new AccuracyValidator());
    }
}
