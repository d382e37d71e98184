package com.quantbacktest.symphony.strategy;

import lombok.Value;

/**
 * A parsed strategy program: its name, description and the root expression that is evaluated.
 */
@Value
public class Symphony {

    String name;
    String description;
    StrategyNode root;
}
