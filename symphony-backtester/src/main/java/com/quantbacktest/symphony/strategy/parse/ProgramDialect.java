package com.quantbacktest.symphony.strategy.parse;

/**
 * Source formats a strategy program can be submitted in.
 */
public enum ProgramDialect {
    /** Composer program as a JSON nested-array document. */
    COMPOSER_JSON,
    /** Composer program as Lisp/EDN text. */
    COMPOSER_LISP,
    /** Quantmage incantation document. */
    QUANTMAGE
}
