package com.quantbacktest.symphony.engine;

import lombok.Getter;

/**
 * Raised when a strategy expression cannot be evaluated for a given date.
 */
@Getter
public class EvaluationException extends RuntimeException {

    private final EvaluationErrorKind kind;
    private final String symbol;

    public EvaluationException(EvaluationErrorKind kind, String message) {
        this(kind, null, message);
    }

    public EvaluationException(EvaluationErrorKind kind, String symbol, String message) {
        super(message);
        this.kind = kind;
        this.symbol = symbol;
    }

    public static EvaluationException dataUnavailable(String symbol, String what, Object date) {
        return new EvaluationException(EvaluationErrorKind.DATA_UNAVAILABLE, symbol,
                String.format("No %s available for %s on %s", what, symbol, date));
    }

    public boolean isRecoverable() {
        return kind != EvaluationErrorKind.UNKNOWN_OPERATOR;
    }
}
