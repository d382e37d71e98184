package com.quantbacktest.symphony.engine;

/**
 * Classification of failures raised while parsing or evaluating a strategy program.
 */
public enum EvaluationErrorKind {
    /** Price or indicator value is missing for the evaluation date. Recoverable per day. */
    DATA_UNAVAILABLE,
    /** Structurally invalid expression. */
    MALFORMED_EXPRESSION,
    /** Operator or indicator name the engine does not support. Always fatal. */
    UNKNOWN_OPERATOR
}
