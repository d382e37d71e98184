package com.quantbacktest.symphony.strategy;

/**
 * Direction of a filter ranking.
 */
public enum SelectionMode {
    /** Highest indicator values first. */
    TOP,
    /** Lowest indicator values first. */
    BOTTOM
}
