package com.quantbacktest.symphony.strategy;

import lombok.Value;

/**
 * Leaf node naming a tradable instrument.
 */
@Value
public class AssetNode implements StrategyNode {

    String symbol;

    /** Display name carried by the program, may be null. */
    String name;

    public static AssetNode of(String symbol) {
        return new AssetNode(symbol, null);
    }

    @Override
    public <R> R accept(StrategyNodeVisitor<R> visitor) {
        return visitor.visitAsset(this);
    }
}
