package com.quantbacktest.symphony.accuracy;

import java.time.LocalDate;
import java.util.Collections;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Externally recorded daily selections: for each date, the symbols that held a positive allocation.
 */
public final class GroundTruth {

    private static final GroundTruth EMPTY = new GroundTruth(new TreeMap<>());

    private final NavigableMap<LocalDate, Set<String>> selections;

    private GroundTruth(NavigableMap<LocalDate, Set<String>> selections) {
        this.selections = Collections.unmodifiableNavigableMap(selections);
    }

    public static GroundTruth empty() {
        return EMPTY;
    }

    public static GroundTruth of(Map<LocalDate, Set<String>> selections) {
        NavigableMap<LocalDate, Set<String>> copy = new TreeMap<>();
        selections.forEach((date, symbols) -> copy.put(date, Set.copyOf(symbols)));
        return new GroundTruth(copy);
    }

    public Optional<Set<String>> selectionsOn(LocalDate date) {
        return Optional.ofNullable(selections.get(date));
    }

    public NavigableMap<LocalDate, Set<String>> getSelections() {
        return selections;
    }

    public boolean isEmpty() {
        return selections.isEmpty();
    }

    public int size() {
        return selections.size();
    }
}
