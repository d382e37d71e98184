package com.quantbacktest.symphony.engine;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Immutable mapping of symbol to portfolio weight.
 * Weights are strictly positive and sum to 1, or the allocation is empty, meaning hold all cash.
 * Iteration order is the order in which symbols were first produced by the evaluation.
 */
public final class TargetAllocation {

    public static final TargetAllocation CASH = new TargetAllocation(new LinkedHashMap<>());

    private final Map<String, Double> weights;

    private TargetAllocation(LinkedHashMap<String, Double> weights) {
        this.weights = Collections.unmodifiableMap(weights);
    }

    /**
     * Drops non-positive entries and scales the rest to sum to 1.
     */
    public static TargetAllocation normalized(Map<String, Double> raw) {
        LinkedHashMap<String, Double> scaled = normalize(raw);
        return scaled.isEmpty() ? CASH : new TargetAllocation(scaled);
    }

    static LinkedHashMap<String, Double> normalize(Map<String, Double> raw) {
        double total = 0.0;
        for (double weight : raw.values()) {
            if (weight > 0) {
                total += weight;
            }
        }
        LinkedHashMap<String, Double> scaled = new LinkedHashMap<>();
        if (total <= 0) {
            return scaled;
        }
        for (Map.Entry<String, Double> entry : raw.entrySet()) {
            if (entry.getValue() > 0) {
                scaled.put(entry.getKey(), entry.getValue() / total);
            }
        }
        return scaled;
    }

    public Map<String, Double> getWeights() {
        return weights;
    }

    public double weightOf(String symbol) {
        return weights.getOrDefault(symbol, 0.0);
    }

    public boolean contains(String symbol) {
        return weights.containsKey(symbol);
    }

    public boolean isCash() {
        return weights.isEmpty();
    }

    /**
     * Symbols held with a positive weight, in allocation order.
     */
    public Set<String> selectedSymbols() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(weights.keySet()));
    }

    public double totalWeight() {
        return weights.values().stream().mapToDouble(Double::doubleValue).sum();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TargetAllocation)) {
            return false;
        }
        return weights.equals(((TargetAllocation) o).weights);
    }

    @Override
    public int hashCode() {
        return weights.hashCode();
    }

    @Override
    public String toString() {
        return isCash() ? "CASH" : weights.toString();
    }
}
