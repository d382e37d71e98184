package com.quantbacktest.symphony.strategy;

import lombok.Value;

@Value
public class LiteralValue implements ValueExpression {

    double value;

    @Override
    public <R> R accept(ValueExpressionVisitor<R> visitor) {
        return visitor.visitLiteral(this);
    }
}
