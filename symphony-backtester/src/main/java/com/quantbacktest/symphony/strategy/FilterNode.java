package com.quantbacktest.symphony.strategy;

import lombok.Value;

import java.util.List;

/**
 * Ranks candidate symbols by an indicator and keeps the top or bottom {@code count}.
 */
@Value
public class FilterNode implements StrategyNode {

    IndicatorRef indicator;
    SelectionMode mode;
    int count;
    List<StrategyNode> candidates;

    public FilterNode(IndicatorRef indicator, SelectionMode mode, int count, List<StrategyNode> candidates) {
        this.indicator = indicator;
        this.mode = mode;
        this.count = count;
        this.candidates = List.copyOf(candidates);
    }

    @Override
    public <R> R accept(StrategyNodeVisitor<R> visitor) {
        return visitor.visitFilter(this);
    }
}
