package com.quantbacktest.symphony.strategy;

/**
 * Exhaustive dispatch over the {@link StrategyNode} variants.
 *
 * @param <R> result type of the traversal
 */
public interface StrategyNodeVisitor<R> {

    R visitAsset(AssetNode node);

    R visitGroup(GroupNode node);

    R visitIf(IfNode node);

    R visitWeightEqual(WeightEqualNode node);

    R visitWeightSpecified(WeightSpecifiedNode node);

    R visitFilter(FilterNode node);
}
