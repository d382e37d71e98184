package com.quantbacktest.symphony.strategy.parse;

import com.quantbacktest.symphony.engine.EvaluationErrorKind;
import lombok.Getter;

/**
 * Raised when a program document cannot be turned into a strategy tree.
 * The kind is either {@link EvaluationErrorKind#MALFORMED_EXPRESSION} or
 * {@link EvaluationErrorKind#UNKNOWN_OPERATOR}.
 */
@Getter
public class StrategyParseException extends RuntimeException {

    private final EvaluationErrorKind kind;

    public StrategyParseException(EvaluationErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public StrategyParseException(EvaluationErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    static StrategyParseException malformed(String message) {
        return new StrategyParseException(EvaluationErrorKind.MALFORMED_EXPRESSION, message);
    }

    static StrategyParseException unknownOperator(String operator) {
        return new StrategyParseException(EvaluationErrorKind.UNKNOWN_OPERATOR, "Unknown operator: " + operator);
    }
}
