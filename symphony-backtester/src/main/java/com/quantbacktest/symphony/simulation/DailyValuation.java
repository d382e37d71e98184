package com.quantbacktest.symphony.simulation;

import lombok.Value;

import java.time.LocalDate;

/**
 * Portfolio value marked to market at the close of a day, before that day's trades.
 */
@Value
public class DailyValuation {

    LocalDate date;
    double value;
}
