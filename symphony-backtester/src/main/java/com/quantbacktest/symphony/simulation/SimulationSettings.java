package com.quantbacktest.symphony.simulation;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Capital and friction settings of a simulated run.
 * Cost and slippage are fractions: 0.001 means 0.1% of the traded value.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class SimulationSettings {

    @Builder.Default
    private double initialCapital = 100_000.0;

    @Builder.Default
    private double transactionCostPct = 0.0;

    @Builder.Default
    private double slippagePct = 0.0;

    /** Smallest trade value, in currency, executed after the first rebalance. */
    @Builder.Default
    private double minTradeSize = 0.0;

    @Builder.Default
    private int rebalanceFrequencyDays = 1;

    public void validate() {
        if (!(initialCapital > 0)) {
            throw new IllegalArgumentException("Initial capital must be positive: " + initialCapital);
        }
        if (transactionCostPct < 0 || transactionCostPct >= 1) {
            throw new IllegalArgumentException("Transaction cost must be in [0, 1): " + transactionCostPct);
        }
        if (slippagePct < 0 || slippagePct >= 1) {
            throw new IllegalArgumentException("Slippage must be in [0, 1): " + slippagePct);
        }
        if (minTradeSize < 0) {
            throw new IllegalArgumentException("Minimum trade size must not be negative: " + minTradeSize);
        }
        if (rebalanceFrequencyDays < 1) {
            throw new IllegalArgumentException("Rebalance frequency must be at least one day: " + rebalanceFrequencyDays);
        }
    }
}
