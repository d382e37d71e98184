package com.quantbacktest.symphony.strategy;

import lombok.Value;

/**
 * Comparison of two resolved values, used as the test of an {@link IfNode}.
 */
@Value
public class Condition {

    ComparisonOperator operator;
    ValueExpression left;
    ValueExpression right;
}
