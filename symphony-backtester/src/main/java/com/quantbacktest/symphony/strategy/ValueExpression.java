package com.quantbacktest.symphony.strategy;

/**
 * Operand of a {@link Condition}: a literal or a market-data lookup.
 */
public interface ValueExpression {

    <R> R accept(ValueExpressionVisitor<R> visitor);
}
