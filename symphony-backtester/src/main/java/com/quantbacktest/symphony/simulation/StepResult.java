package com.quantbacktest.symphony.simulation;

import lombok.Value;

import java.time.LocalDate;
import java.util.List;

/**
 * Outcome of one simulated day.
 */
@Value
public class StepResult {

    LocalDate date;
    double preTradeValue;
    boolean rebalanced;
    List<ExecutedOrder> orders;
}
