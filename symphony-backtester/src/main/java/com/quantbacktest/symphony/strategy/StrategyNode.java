package com.quantbacktest.symphony.strategy;

/**
 * A node of a parsed strategy program.
 * The set of node types is closed; every consumer dispatches through {@link StrategyNodeVisitor}
 * so that adding a node type forces every traversal to handle it.
 */
public interface StrategyNode {

    <R> R accept(StrategyNodeVisitor<R> visitor);
}
