package com.quantbacktest.symphony.simulation;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * A fill produced by the simulator.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ExecutedOrder {

    private LocalDate date;
    private String symbol;
    private Side side;
    private double shares;
    /** Close price the order was sized against. */
    private double marketPrice;
    /** Price after slippage. */
    private double executionPrice;
    private double fee;
    private Reason reason;

    public enum Side {
        BUY, SELL
    }

    public enum Reason {
        /** Position closed because the symbol left the target allocation. */
        LIQUIDATION,
        /** Position resized toward its target weight. */
        REBALANCE
    }

    public double getGrossValue() {
        return shares * executionPrice;
    }

    /**
     * Change in cash caused by this order, fee included.
     */
    public double getCashFlow() {
        return side == Side.BUY ? -(getGrossValue() + fee) : getGrossValue() - fee;
    }
}
