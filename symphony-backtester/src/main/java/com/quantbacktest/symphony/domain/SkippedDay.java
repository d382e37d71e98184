package com.quantbacktest.symphony.domain;

import com.quantbacktest.symphony.engine.EvaluationErrorKind;
import lombok.Value;

import java.time.LocalDate;

/**
 * A day on which no target allocation could be computed, so nothing traded.
 */
@Value
public class SkippedDay {

    LocalDate date;
    EvaluationErrorKind reason;
    String symbol;
    String message;
}
