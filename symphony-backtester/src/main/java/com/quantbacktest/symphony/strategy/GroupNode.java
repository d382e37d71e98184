package com.quantbacktest.symphony.strategy;

import lombok.Value;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Named wrapper around one sub-expression.
 * The label is a '+'-joined list of member tickers and is only read by static analysis.
 */
@Value
public class GroupNode implements StrategyNode {

    String label;
    StrategyNode body;

    /**
     * Ticker tokens of the label, blanks removed.
     */
    public List<String> labelTickers() {
        if (label == null) {
            return List.of();
        }
        return Arrays.stream(label.split("\\+"))
                .map(String::trim)
                .filter(token -> !token.isEmpty())
                .collect(Collectors.toList());
    }

    @Override
    public <R> R accept(StrategyNodeVisitor<R> visitor) {
        return visitor.visitGroup(this);
    }
}
