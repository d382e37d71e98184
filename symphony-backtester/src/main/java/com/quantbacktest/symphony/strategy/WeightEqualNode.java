package com.quantbacktest.symphony.strategy;

import lombok.Value;

import java.util.List;

/**
 * Splits the allocation equally across the outcomes of its branches.
 */
@Value
public class WeightEqualNode implements StrategyNode {

    List<StrategyNode> branches;

    public WeightEqualNode(List<StrategyNode> branches) {
        this.branches = List.copyOf(branches);
    }

    @Override
    public <R> R accept(StrategyNodeVisitor<R> visitor) {
        return visitor.visitWeightEqual(this);
    }
}
