package com.quantbacktest.symphony.simulation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Cash and fractional share holdings. Only symbols with a positive position are kept.
 * Mutated exclusively by {@link PortfolioSimulator}.
 */
public class PortfolioState {

    private double cash;
    private final Map<String, Double> holdings = new LinkedHashMap<>();

    public PortfolioState(double cash) {
        this.cash = cash;
    }

    public double getCash() {
        return cash;
    }

    public Map<String, Double> getHoldings() {
        return Collections.unmodifiableMap(holdings);
    }

    public double sharesOf(String symbol) {
        return holdings.getOrDefault(symbol, 0.0);
    }

    public boolean holds(String symbol) {
        return holdings.containsKey(symbol);
    }

    void adjustCash(double delta) {
        cash += delta;
    }

    void setCash(double cash) {
        this.cash = cash;
    }

    void setShares(String symbol, double shares) {
        if (shares <= 0) {
            holdings.remove(symbol);
        } else {
            holdings.put(symbol, shares);
        }
    }

    @Override
    public String toString() {
        return "PortfolioState{cash=" + cash + ", holdings=" + holdings + "}";
    }
}
