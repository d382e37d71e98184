package com.quantbacktest.symphony.strategy;

import lombok.Value;

/**
 * As-of closing price of a symbol on the evaluation date.
 */
@Value
public class CurrentPrice implements ValueExpression {

    String symbol;

    @Override
    public <R> R accept(ValueExpressionVisitor<R> visitor) {
        return visitor.visitCurrentPrice(this);
    }
}
