package com.quantbacktest.symphony.accuracy;

import lombok.Value;

import java.time.LocalDate;
import java.util.SortedSet;

@Value
public class SelectionMismatch {

    LocalDate date;
    SortedSet<String> evaluated;
    SortedSet<String> expected;
}
