package com.quantbacktest.symphony.strategy;

public interface ValueExpressionVisitor<R> {

    R visitLiteral(LiteralValue value);

    R visitCurrentPrice(CurrentPrice value);

    R visitIndicator(IndicatorValue value);
}
