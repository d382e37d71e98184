package com.quantbacktest.symphony.strategy;

import lombok.Value;

import java.util.List;

/**
 * Explicit per-branch weights. Each branch's symbols receive the literal weight of the pair.
 */
@Value
public class WeightSpecifiedNode implements StrategyNode {

    List<WeightedBranch> branches;

    public WeightSpecifiedNode(List<WeightedBranch> branches) {
        this.branches = List.copyOf(branches);
    }

    @Override
    public <R> R accept(StrategyNodeVisitor<R> visitor) {
        return visitor.visitWeightSpecified(this);
    }

    @Value
    public static class WeightedBranch {
        double weight;
        StrategyNode node;
    }
}
