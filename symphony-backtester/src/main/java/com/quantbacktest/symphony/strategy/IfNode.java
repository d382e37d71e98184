package com.quantbacktest.symphony.strategy;

import lombok.Value;

/**
 * Conditional branch; exactly one of the branches is evaluated.
 */
@Value
public class IfNode implements StrategyNode {

    Condition condition;
    StrategyNode thenBranch;
    StrategyNode elseBranch;

    @Override
    public <R> R accept(StrategyNodeVisitor<R> visitor) {
        return visitor.visitIf(this);
    }
}
